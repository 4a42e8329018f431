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
 * {@code if condition { result } else next}. {@code next} is a block or another conditional, or
 * null when there is no else branch.
 */
public final class ConditionalStatement extends Statement {
  private final Slot<Expression> condition;
  private final Slot<BlockStatement> result;
  private final @Nullable Slot<Statement> next;

  ConditionalStatement(
      AsgContext context,
      @Nullable Span span,
      Expression condition,
      BlockStatement result,
      @Nullable Statement next) {
    super(context, span);
    this.condition = new Slot<>(condition);
    this.result = new Slot<>(result);
    this.next = next == null ? null : new Slot<>(next);
  }

  public Expression getCondition() {
    return condition.get();
  }

  public BlockStatement getResult() {
    return result.get();
  }

  public @Nullable Statement getNext() {
    return next == null ? null : next.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return next == null
        ? ImmutableList.of(condition, result)
        : ImmutableList.of(condition, result, next);
  }
}
