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

/** An expression evaluated for its effect. */
public final class ExpressionStatement extends Statement {
  private final Slot<Expression> expression;

  ExpressionStatement(AsgContext context, @Nullable Span span, Expression expression) {
    super(context, span);
    this.expression = new Slot<>(expression);
  }

  public Expression getExpression() {
    return expression.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(expression);
  }
}
