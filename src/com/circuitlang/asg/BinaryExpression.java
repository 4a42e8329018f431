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

import com.circuitlang.ast.BinaryOperation;
import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** {@code left op right}. Comparisons and logical operators produce {@code bool}. */
public final class BinaryExpression extends Expression {
  private final BinaryOperation operation;
  private final Slot<Expression> left;
  private final Slot<Expression> right;
  private final Type type;

  BinaryExpression(
      AsgContext context,
      @Nullable Span span,
      BinaryOperation operation,
      Expression left,
      Expression right,
      Type type) {
    super(context, span);
    this.operation = operation;
    this.left = new Slot<>(left);
    this.right = new Slot<>(right);
    this.type = type;
  }

  public BinaryOperation getOperation() {
    return operation;
  }

  public Expression getLeft() {
    return left.get();
  }

  public Expression getRight() {
    return right.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(left, right);
  }

  @Override
  public Type getType() {
    return type;
  }

  @Override
  public boolean isMutRef() {
    return false;
  }

  @Override
  public @Nullable ConstValue constValue() {
    ConstValue l = left.get().constValue();
    if (l == null) {
      return null;
    }
    ConstValue r = right.get().constValue();
    if (r == null) {
      return null;
    }
    return ConstValue.evaluate(operation, l, r);
  }

  @Override
  public boolean isConsty() {
    return left.get().isConsty() && right.get().isConsty();
  }
}
