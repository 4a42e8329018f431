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
 * {@code let} or {@code const} binding of one variable, or of several destructured from a tuple.
 */
public final class DefinitionStatement extends Statement {
  private final ImmutableList<Variable> variables;
  private final Slot<Expression> value;

  DefinitionStatement(
      AsgContext context, @Nullable Span span, List<Variable> variables, Expression value) {
    super(context, span);
    this.variables = ImmutableList.copyOf(variables);
    this.value = new Slot<>(value);
  }

  public ImmutableList<Variable> getVariables() {
    return variables;
  }

  public Expression getValue() {
    return value.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(value);
  }
}
