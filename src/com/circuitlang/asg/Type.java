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
import com.circuitlang.ast.TypeTree.ScalarKind;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * A fully resolved value type. The variants are closed; {@link #toString()} renders the type the
 * way it is written in source.
 */
public interface Type {

  Type ADDRESS = new Scalar(ScalarKind.ADDRESS);
  Type BOOLEAN = new Scalar(ScalarKind.BOOLEAN);
  Type CHAR = new Scalar(ScalarKind.CHAR);
  Type FIELD = new Scalar(ScalarKind.FIELD);
  Type GROUP = new Scalar(ScalarKind.GROUP);

  /** The empty tuple. */
  Type UNIT = new Tuple(ImmutableList.of());

  static Type integer(IntegerType integerType) {
    return new Int(integerType);
  }

  /** Lifts this type into an expected-type hint. */
  default PartialType partial() {
    return PartialType.exact(this);
  }

  default boolean isUnit() {
    return equals(UNIT);
  }

  default boolean isInteger() {
    return this instanceof Int;
  }

  /** Keyword types other than integers. */
  record Scalar(ScalarKind kind) implements Type {
    @Override
    public String toString() {
      return kind.keyword();
    }
  }

  record Int(IntegerType integerType) implements Type {
    @Override
    public PartialType partial() {
      return new PartialType.IntegerHint(integerType, null);
    }

    @Override
    public String toString() {
      return integerType.keyword();
    }
  }

  record Array(Type element, int length) implements Type {
    @Override
    public PartialType partial() {
      return new PartialType.ArrayHint(element.partial(), length);
    }

    @Override
    public String toString() {
      return "[" + element + "; " + length + "]";
    }
  }

  record Tuple(ImmutableList<Type> elements) implements Type {
    public Tuple(List<Type> elements) {
      this(ImmutableList.copyOf(elements));
    }

    @Override
    public PartialType partial() {
      List<PartialType> hints = new ArrayList<>();
      for (Type element : elements) {
        hints.add(element.partial());
      }
      return new PartialType.TupleHint(hints);
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(", ").join(elements) + ")";
    }
  }

  /** The type of values of a circuit. */
  record CircuitRef(Circuit circuit) implements Type {
    @Override
    public String toString() {
      return circuit.getName();
    }
  }

  /** The type of a function used as a value. */
  record FunctionRef(Function function) implements Type {
    @Override
    public String toString() {
      return "function " + function.getName();
    }
  }
}
