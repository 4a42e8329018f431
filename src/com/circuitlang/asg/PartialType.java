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

import com.circuitlang.ast.IntegerType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An expected-type hint with unknown positions. Hints flow down into conversion; concrete types
 * flow back up and are checked with {@link #matches}.
 */
public interface PartialType {

  static PartialType exact(Type type) {
    return new Exact(type);
  }

  /** Any integer type. */
  static PartialType anyInteger() {
    return new IntegerHint(null, null);
  }

  /**
   * Whether {@code type} is compatible with this hint. Unknown positions match anything; this is
   * not equality.
   */
  boolean matches(Type type);

  /** Lowers a fully known hint back to a type, or returns null if some position is unknown. */
  @Nullable Type full();

  /** A completely known type. */
  record Exact(Type type) implements PartialType {
    @Override
    public boolean matches(Type other) {
      return type.equals(other);
    }

    @Override
    public Type full() {
      return type;
    }

    @Override
    public String toString() {
      return type.toString();
    }
  }

  /**
   * Some integer type. {@code implicitDefault} is the width an unsuffixed literal takes when
   * {@code exact} is unknown.
   */
  record IntegerHint(@Nullable IntegerType exact, @Nullable IntegerType implicitDefault)
      implements PartialType {
    @Override
    public boolean matches(Type other) {
      return other instanceof Type.Int
          && (exact == null || exact == ((Type.Int) other).integerType());
    }

    @Override
    public @Nullable Type full() {
      return exact == null ? null : Type.integer(exact);
    }

    /** The width for an unsuffixed literal under this hint, or null. */
    public @Nullable IntegerType literalType() {
      return exact != null ? exact : implicitDefault;
    }

    @Override
    public String toString() {
      return exact == null ? "integer" : exact.keyword();
    }
  }

  /** An array with an optionally known element type and length. */
  record ArrayHint(@Nullable PartialType element, @Nullable Integer length)
      implements PartialType {
    @Override
    public boolean matches(Type other) {
      if (!(other instanceof Type.Array)) {
        return false;
      }
      Type.Array array = (Type.Array) other;
      if (length != null && length != array.length()) {
        return false;
      }
      return element == null || element.matches(array.element());
    }

    @Override
    public @Nullable Type full() {
      Type elementType = element == null ? null : element.full();
      if (elementType == null || length == null) {
        return null;
      }
      return new Type.Array(elementType, length);
    }

    @Override
    public String toString() {
      return "[" + (element == null ? "_" : element) + "; " + (length == null ? "_" : length) + "]";
    }
  }

  /** A tuple of a known arity with optionally known elements; null slots are unknown. */
  record TupleHint(List<@Nullable PartialType> elements) implements PartialType {
    public TupleHint {
      elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public boolean matches(Type other) {
      if (!(other instanceof Type.Tuple)) {
        return false;
      }
      Type.Tuple tuple = (Type.Tuple) other;
      if (tuple.elements().size() != elements.size()) {
        return false;
      }
      for (int i = 0; i < elements.size(); i++) {
        PartialType element = elements.get(i);
        if (element != null && !element.matches(tuple.elements().get(i))) {
          return false;
        }
      }
      return true;
    }

    @Override
    public @Nullable Type full() {
      List<Type> types = new ArrayList<>();
      for (PartialType element : elements) {
        Type type = element == null ? null : element.full();
        if (type == null) {
          return null;
        }
        types.add(type);
      }
      return new Type.Tuple(types);
    }

    @Override
    public String toString() {
      StringBuilder b = new StringBuilder("(");
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(elements.get(i) == null ? "_" : elements.get(i));
      }
      return b.append(')').toString();
    }
  }
}
