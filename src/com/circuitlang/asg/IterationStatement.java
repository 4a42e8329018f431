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

/** {@code for variable in start..stop { body }}; bounds are consty. */
public final class IterationStatement extends Statement {
  private final Variable variable;
  private final Slot<Expression> start;
  private final Slot<Expression> stop;
  private final boolean inclusive;
  private final Slot<BlockStatement> body;

  IterationStatement(
      AsgContext context,
      @Nullable Span span,
      Variable variable,
      Expression start,
      Expression stop,
      boolean inclusive,
      BlockStatement body) {
    super(context, span);
    this.variable = variable;
    this.start = new Slot<>(start);
    this.stop = new Slot<>(stop);
    this.inclusive = inclusive;
    this.body = new Slot<>(body);
  }

  public Variable getVariable() {
    return variable;
  }

  public Expression getStart() {
    return start.get();
  }

  public Expression getStop() {
    return stop.get();
  }

  public boolean isInclusive() {
    return inclusive;
  }

  public BlockStatement getBody() {
    return body.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(start, stop, body);
  }
}
