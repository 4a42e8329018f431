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

/** A type as written in the source, before names are resolved. */
public interface TypeTree {

  /** Keyword types without parameters. */
  enum ScalarKind {
    ADDRESS("address"),
    BOOLEAN("bool"),
    CHAR("char"),
    FIELD("field"),
    GROUP("group");

    private final String keyword;

    ScalarKind(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  /** {@code bool}, {@code field}, ... */
  record Scalar(ScalarKind kind) implements TypeTree {
    @Override
    public String toString() {
      return kind.keyword();
    }
  }

  /** {@code u8}, {@code i64}, ... */
  record Int(IntegerType integerType) implements TypeTree {
    @Override
    public String toString() {
      return integerType.keyword();
    }
  }

  /** {@code [element; length]}. Multi-dimensional arrays nest. */
  record Array(TypeTree element, int length) implements TypeTree {
    @Override
    public String toString() {
      return "[" + element + "; " + length + "]";
    }
  }

  /** {@code (a, b, ...)}; the empty tuple is the unit type. */
  record Tuple(ImmutableList<TypeTree> elements) implements TypeTree {
    public Tuple(List<TypeTree> elements) {
      this(ImmutableList.copyOf(elements));
    }

    @Override
    public String toString() {
      StringBuilder b = new StringBuilder("(");
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(elements.get(i));
      }
      return b.append(')').toString();
    }
  }

  /** A reference to a circuit by name. */
  record Named(Identifier name) implements TypeTree {
    @Override
    public String toString() {
      return name.name();
    }
  }

  /** {@code Self} inside a circuit. */
  record SelfType(@Nullable Span span) implements TypeTree {
    @Override
    public String toString() {
      return "Self";
    }
  }
}
