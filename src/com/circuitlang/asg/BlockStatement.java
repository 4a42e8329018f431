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

/** {@code { statements }}, with its own scope. */
public final class BlockStatement extends Statement {
  private final ImmutableList<Slot<Statement>> statements;
  private final Scope scope;

  BlockStatement(
      AsgContext context, @Nullable Span span, List<Statement> statements, Scope scope) {
    super(context, span);
    ImmutableList.Builder<Slot<Statement>> slots = ImmutableList.builder();
    for (Statement statement : statements) {
      slots.add(new Slot<>(statement));
    }
    this.statements = slots.build();
    this.scope = scope;
  }

  public ImmutableList<Statement> getStatements() {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    for (Slot<Statement> statement : statements) {
      result.add(statement.get());
    }
    return result.build();
  }

  public Scope getScope() {
    return scope;
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.copyOf(statements);
  }
}
