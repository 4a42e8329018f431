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
import com.circuitlang.ast.UnaryOperation;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** {@code !inner} or {@code -inner}. */
public final class UnaryExpression extends Expression {
  private final UnaryOperation operation;
  private final Slot<Expression> inner;

  UnaryExpression(
      AsgContext context, @Nullable Span span, UnaryOperation operation, Expression inner) {
    super(context, span);
    this.operation = operation;
    this.inner = new Slot<>(inner);
  }

  public UnaryOperation getOperation() {
    return operation;
  }

  public Expression getInner() {
    return inner.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(inner);
  }

  @Override
  public Type getType() {
    return inner.get().getType();
  }

  @Override
  public boolean isMutRef() {
    return false;
  }

  @Override
  public @Nullable ConstValue constValue() {
    ConstValue value = inner.get().constValue();
    return value == null ? null : ConstValue.evaluate(operation, value);
  }

  @Override
  public boolean isConsty() {
    return inner.get().isConsty();
  }
}
