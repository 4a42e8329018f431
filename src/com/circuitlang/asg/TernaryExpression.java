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

/** {@code condition ? ifTrue : ifFalse}; both branches have the same type. */
public final class TernaryExpression extends Expression {
  private final Slot<Expression> condition;
  private final Slot<Expression> ifTrue;
  private final Slot<Expression> ifFalse;

  TernaryExpression(
      AsgContext context,
      @Nullable Span span,
      Expression condition,
      Expression ifTrue,
      Expression ifFalse) {
    super(context, span);
    this.condition = new Slot<>(condition);
    this.ifTrue = new Slot<>(ifTrue);
    this.ifFalse = new Slot<>(ifFalse);
  }

  public Expression getCondition() {
    return condition.get();
  }

  public Expression getIfTrue() {
    return ifTrue.get();
  }

  public Expression getIfFalse() {
    return ifFalse.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(condition, ifTrue, ifFalse);
  }

  @Override
  public Type getType() {
    return ifTrue.get().getType();
  }

  @Override
  public boolean isMutRef() {
    return ifTrue.get().isMutRef() && ifFalse.get().isMutRef();
  }

  @Override
  public @Nullable ConstValue constValue() {
    ConstValue c = condition.get().constValue();
    if (!(c instanceof ConstValue.Bool)) {
      return null;
    }
    return ((ConstValue.Bool) c).value() ? ifTrue.get().constValue() : ifFalse.get().constValue();
  }

  @Override
  public boolean isConsty() {
    return condition.get().isConsty() && ifTrue.get().isConsty() && ifFalse.get().isConsty();
  }
}
