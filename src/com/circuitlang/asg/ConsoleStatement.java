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
import com.circuitlang.ast.StatementTree.ConsoleFunction;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** {@code console.assert(...)}, {@code console.log(...)} or {@code console.error(...)}. */
public final class ConsoleStatement extends Statement {
  private final ConsoleFunction function;
  private final @Nullable String format;
  private final ImmutableList<Slot<Expression>> arguments;

  ConsoleStatement(
      AsgContext context,
      @Nullable Span span,
      ConsoleFunction function,
      @Nullable String format,
      List<Expression> arguments) {
    super(context, span);
    this.function = function;
    this.format = format;
    ImmutableList.Builder<Slot<Expression>> slots = ImmutableList.builder();
    for (Expression argument : arguments) {
      slots.add(new Slot<>(argument));
    }
    this.arguments = slots.build();
  }

  public ConsoleFunction getFunction() {
    return function;
  }

  /** The format string; null for {@code assert}. */
  public @Nullable String getFormat() {
    return format;
  }

  public ImmutableList<Expression> getArguments() {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    for (Slot<Expression> argument : arguments) {
      result.add(argument.get());
    }
    return result.build();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.copyOf(arguments);
  }
}
