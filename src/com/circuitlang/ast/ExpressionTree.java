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

/**
 * Expression nodes produced by the parser. The set of variants is closed; consumers dispatch over
 * it with {@code instanceof}.
 */
public interface ExpressionTree {

  @Nullable Span span();

  /** A bare name. */
  record Ident(Identifier identifier) implements ExpressionTree {
    @Override
    public @Nullable Span span() {
      return identifier.span();
    }
  }

  /** The kind of a literal. */
  enum ValueKind {
    ADDRESS,
    BOOLEAN,
    CHAR,
    FIELD,
    GROUP,
    /** A number without a type suffix; its type comes from the context. */
    IMPLICIT,
    INTEGER
  }

  /**
   * A literal. {@code integerType} is set for {@link ValueKind#INTEGER} only.
   */
  record Value(
      ValueKind kind, String text, @Nullable IntegerType integerType, @Nullable Span span)
      implements ExpressionTree {}

  record Binary(
      BinaryOperation operation,
      ExpressionTree left,
      ExpressionTree right,
      @Nullable Span span)
      implements ExpressionTree {}

  record Unary(UnaryOperation operation, ExpressionTree inner, @Nullable Span span)
      implements ExpressionTree {}

  /** {@code condition ? ifTrue : ifFalse}. */
  record Ternary(
      ExpressionTree condition,
      ExpressionTree ifTrue,
      ExpressionTree ifFalse,
      @Nullable Span span)
      implements ExpressionTree {}

  /** An element of an inline array, possibly spread ({@code ...a}). */
  record ArrayElement(ExpressionTree expression, boolean spread) {}

  /** {@code [a, ...b, c]}. */
  record ArrayInline(ImmutableList<ArrayElement> elements, @Nullable Span span)
      implements ExpressionTree {
    public ArrayInline(List<ArrayElement> elements, @Nullable Span span) {
      this(ImmutableList.copyOf(elements), span);
    }
  }

  /** {@code [element; length]}. */
  record ArrayInit(ExpressionTree element, int length, @Nullable Span span)
      implements ExpressionTree {}

  /** {@code array[index]}. */
  record ArrayAccess(ExpressionTree array, ExpressionTree index, @Nullable Span span)
      implements ExpressionTree {}

  /** {@code (a, b, ...)}. */
  record TupleInit(ImmutableList<ExpressionTree> elements, @Nullable Span span)
      implements ExpressionTree {
    public TupleInit(List<ExpressionTree> elements, @Nullable Span span) {
      this(ImmutableList.copyOf(elements), span);
    }
  }

  /** {@code tuple.index}. */
  record TupleAccess(ExpressionTree tuple, int index, @Nullable Span span)
      implements ExpressionTree {}

  /** One {@code name: value} pair of a circuit initializer; a null value is the shorthand form. */
  record MemberInit(Identifier name, @Nullable ExpressionTree expression) {}

  /** {@code Name { a: 1, b }}. */
  record CircuitInit(Identifier name, ImmutableList<MemberInit> members, @Nullable Span span)
      implements ExpressionTree {
    public CircuitInit(Identifier name, List<MemberInit> members, @Nullable Span span) {
      this(name, ImmutableList.copyOf(members), span);
    }
  }

  /** {@code circuit.name}. */
  record MemberAccess(ExpressionTree circuit, Identifier name, @Nullable Span span)
      implements ExpressionTree {}

  /** {@code Circuit::name}. */
  record StaticAccess(ExpressionTree circuit, Identifier name, @Nullable Span span)
      implements ExpressionTree {}

  /** {@code function(arguments...)}. */
  record Call(ExpressionTree function, ImmutableList<ExpressionTree> arguments, @Nullable Span span)
      implements ExpressionTree {
    public Call(ExpressionTree function, List<ExpressionTree> arguments, @Nullable Span span) {
      this(function, ImmutableList.copyOf(arguments), span);
    }
  }
}
