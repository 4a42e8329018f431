/*
 * Copyright 2021 The Circuit ASG Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.circuitlang.asg;

import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * {@code target.member}, or {@code Circuit::member} when there is no target. A method accessed
 * this way has a function type.
 */
public final class CircuitAccessExpression extends Expression {
  private final Circuit circuit;
  private final @Nullable Slot<Expression> target;
  private final CircuitMember member;

  CircuitAccessExpression(
      AsgContext context,
      @Nullable Span span,
      Circuit circuit,
      @Nullable Expression target,
      CircuitMember member) {
    super(context, span);
    this.circuit = circuit;
    this.target = target == null ? null : new Slot<>(target);
    this.member = member;
  }

  public Circuit getCircuit() {
    return circuit;
  }

  /** The instance accessed, or null for a static access. */
  public @Nullable Expression getTarget() {
    return target == null ? null : target.get();
  }

  public CircuitMember getMember() {
    return member;
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return target == null ? ImmutableList.of() : ImmutableList.of(target);
  }

  @Override
  public Type getType() {
    if (member instanceof CircuitMember.Field) {
      return ((CircuitMember.Field) member).type();
    }
    return new Type.FunctionRef(((CircuitMember.Method) member).function());
  }

  @Override
  public boolean isMutRef() {
    return target != null && target.get().isMutRef();
  }

  @Override
  public @Nullable ConstValue constValue() {
    return null;
  }

  @Override
  public boolean isConsty() {
    return target == null || target.get().isConsty();
  }
}
