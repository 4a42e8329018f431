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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A validated call: the arity matches the function and every {@code const} parameter received a
 * consty argument.
 */
public final class CallExpression extends Expression {
  private final Function function;
  private final @Nullable Slot<Expression> target;
  private final ImmutableList<Slot<Expression>> arguments;

  CallExpression(
      AsgContext context,
      @Nullable Span span,
      Function function,
      @Nullable Expression target,
      List<Expression> arguments) {
    super(context, span);
    this.function = function;
    this.target = target == null ? null : new Slot<>(target);
    ImmutableList.Builder<Slot<Expression>> slots = ImmutableList.builder();
    for (Expression argument : arguments) {
      slots.add(new Slot<>(argument));
    }
    this.arguments = slots.build();
  }

  public Function getFunction() {
    return function;
  }

  /** The receiver of an instance call, or null. */
  public @Nullable Expression getTarget() {
    return target == null ? null : target.get();
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
    ImmutableList.Builder<Slot<?>> slots = ImmutableList.builder();
    if (target != null) {
      slots.add(target);
    }
    return slots.addAll(arguments).build();
  }

  @Override
  public Type getType() {
    return function.getOutput();
  }

  /** A call result is a fresh value, which a {@code mut self} method may modify. */
  @Override
  public boolean isMutRef() {
    return true;
  }

  /** Calls are not evaluated at this layer. */
  @Override
  public @Nullable ConstValue constValue() {
    return null;
  }

  @Override
  public boolean isConsty() {
    if (target != null && !target.get().isConsty()) {
      return false;
    }
    for (Slot<Expression> argument : arguments) {
      if (!argument.get().isConsty()) {
        return false;
      }
    }
    return true;
  }
}
