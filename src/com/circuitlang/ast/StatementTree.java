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
package com.circuitlang.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Statement nodes produced by the parser. */
public interface StatementTree {

  @Nullable Span span();

  /** {@code return expression;}. */
  record Return(ExpressionTree expression, @Nullable Span span) implements StatementTree {}

  /** Whether a definition introduces mutable or constant bindings. */
  enum DeclarationKind {
    LET,
    CONST
  }

  /**
   * {@code let a: T = value;} or {@code let (a, b) = value;}. {@code type} is the written
   * annotation, if any.
   */
  record Definition(
      DeclarationKind kind,
      ImmutableList<Identifier> variables,
      @Nullable TypeTree type,
      ExpressionTree value,
      @Nullable Span span)
      implements StatementTree {
    public Definition(
        DeclarationKind kind,
        List<Identifier> variables,
        @Nullable TypeTree type,
        ExpressionTree value,
        @Nullable Span span) {
      this(kind, ImmutableList.copyOf(variables), type, value, span);
    }
  }

  /** One step from an assigned variable into a part of it. */
  interface AssigneeAccess {}

  /** {@code [index]}. */
  record ArrayIndex(ExpressionTree index) implements AssigneeAccess {}

  /** {@code .0}. */
  record TupleIndex(int index) implements AssigneeAccess {}

  /** {@code .name}. */
  record Member(Identifier name) implements AssigneeAccess {}

  /** The left hand side of an assignment: a variable and a path into it. */
  record Assignee(Identifier identifier, ImmutableList<AssigneeAccess> accesses) {
    public Assignee(Identifier identifier, List<AssigneeAccess> accesses) {
      this(identifier, ImmutableList.copyOf(accesses));
    }
  }

  record Assign(
      AssignOperation operation, Assignee assignee, ExpressionTree value, @Nullable Span span)
      implements StatementTree {}

  /** {@code if condition { block } else next}; {@code next} is a block or another conditional. */
  record Conditional(
      ExpressionTree condition, Block block, @Nullable StatementTree next, @Nullable Span span)
      implements StatementTree {}

  /** {@code for variable in start..stop { block }} ({@code ..=} when inclusive). */
  record Iteration(
      Identifier variable,
      ExpressionTree start,
      ExpressionTree stop,
      boolean inclusive,
      Block block,
      @Nullable Span span)
      implements StatementTree {}

  /** The built-in console functions. */
  enum ConsoleFunction {
    ASSERT,
    LOG,
    ERROR
  }

  /**
   * {@code console.assert(e)}, {@code console.log("{}", e)} or {@code console.error(...)}. The
   * format string is null for {@code assert}.
   */
  record Console(
      ConsoleFunction function,
      @Nullable String format,
      ImmutableList<ExpressionTree> arguments,
      @Nullable Span span)
      implements StatementTree {
    public Console(
        ConsoleFunction function,
        @Nullable String format,
        List<ExpressionTree> arguments,
        @Nullable Span span) {
      this(function, format, ImmutableList.copyOf(arguments), span);
    }
  }

  /** An expression evaluated for its effect. */
  record Expression(ExpressionTree expression, @Nullable Span span) implements StatementTree {}

  /** {@code { statements }}. */
  record Block(ImmutableList<StatementTree> statements, @Nullable Span span)
      implements StatementTree {
    public Block(List<StatementTree> statements, @Nullable Span span) {
      this(ImmutableList.copyOf(statements), span);
    }
  }
}
