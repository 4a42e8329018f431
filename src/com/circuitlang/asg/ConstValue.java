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

import com.circuitlang.ast.BinaryOperation;
import com.circuitlang.ast.IntegerType;
import com.circuitlang.ast.UnaryOperation;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A statically known value. Arithmetic on integers is checked: an operation whose result does not
 * fit the width, or a division by zero, has no static value and evaluates to null.
 */
public interface ConstValue {

  Type getType();

  record Int(IntegerType integerType, BigInteger value) implements ConstValue {
    public Int {
      if (!integerType.contains(value)) {
        throw new IllegalArgumentException(value + " does not fit " + integerType);
      }
    }

    @Override
    public Type getType() {
      return Type.integer(integerType);
    }

    @Override
    public String toString() {
      return value + integerType.keyword();
    }
  }

  record Field(BigInteger value) implements ConstValue {
    @Override
    public Type getType() {
      return Type.FIELD;
    }

    @Override
    public String toString() {
      return value + "field";
    }
  }

  /** A group element in its literal form, e.g. {@code 1group} or {@code (0, 1)group}. */
  record Group(String text) implements ConstValue {
    @Override
    public Type getType() {
      return Type.GROUP;
    }

    @Override
    public String toString() {
      return text + "group";
    }
  }

  record Address(String text) implements ConstValue {
    @Override
    public Type getType() {
      return Type.ADDRESS;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  record Bool(boolean value) implements ConstValue {
    @Override
    public Type getType() {
      return Type.BOOLEAN;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  record Char(int codePoint) implements ConstValue {
    @Override
    public Type getType() {
      return Type.CHAR;
    }

    @Override
    public String toString() {
      return "'" + new String(Character.toChars(codePoint)) + "'";
    }
  }

  record Tuple(ImmutableList<ConstValue> elements) implements ConstValue {
    public Tuple(List<ConstValue> elements) {
      this(ImmutableList.copyOf(elements));
    }

    @Override
    public Type getType() {
      List<Type> types = new ArrayList<>();
      for (ConstValue element : elements) {
        types.add(element.getType());
      }
      return new Type.Tuple(types);
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(", ").join(elements) + ")";
    }
  }

  /** An array; the element type is kept so that empty arrays still have a type. */
  record Array(Type elementType, ImmutableList<ConstValue> elements) implements ConstValue {
    public Array(Type elementType, List<ConstValue> elements) {
      this(elementType, ImmutableList.copyOf(elements));
    }

    @Override
    public Type getType() {
      return new Type.Array(elementType, elements.size());
    }

    @Override
    public String toString() {
      return "[" + Joiner.on(", ").join(elements) + "]";
    }
  }

  /**
   * Evaluates {@code left operation right}, or returns null when the result is not statically
   * known. Operand types are assumed to have been checked already.
   */
  static @Nullable ConstValue evaluate(
      BinaryOperation operation, ConstValue left, ConstValue right) {
    switch (operation.operationClass()) {
      case EQUALITY:
        boolean equal = left.equals(right);
        return new Bool(operation == BinaryOperation.EQ ? equal : !equal);
      case BOOLEAN:
        if (left instanceof Bool && right instanceof Bool) {
          boolean l = ((Bool) left).value();
          boolean r = ((Bool) right).value();
          return new Bool(operation == BinaryOperation.AND ? l && r : l || r);
        }
        return null;
      case ORDERING:
        if (left instanceof Int && right instanceof Int) {
          int c = ((Int) left).value().compareTo(((Int) right).value());
          return new Bool(compare(operation, c));
        }
        return null;
      case NUMERIC:
        if (left instanceof Int && right instanceof Int) {
          return arithmetic(operation, (Int) left, (Int) right);
        }
        // Field and group arithmetic depends on the curve and is left to the backend.
        return null;
    }
    throw new IllegalStateException("unexpected operation " + operation);
  }

  static @Nullable ConstValue evaluate(UnaryOperation operation, ConstValue inner) {
    switch (operation) {
      case NOT:
        return inner instanceof Bool ? new Bool(!((Bool) inner).value()) : null;
      case NEGATE:
        if (inner instanceof Int) {
          Int value = (Int) inner;
          return checked(value.integerType(), value.value().negate());
        }
        if (inner instanceof Field) {
          return new Field(((Field) inner).value().negate());
        }
        return null;
    }
    throw new IllegalStateException("unexpected operation " + operation);
  }

  private static boolean compare(BinaryOperation operation, int c) {
    switch (operation) {
      case GE:
        return c >= 0;
      case GT:
        return c > 0;
      case LE:
        return c <= 0;
      case LT:
        return c < 0;
      default:
        throw new IllegalStateException("not an ordering " + operation);
    }
  }

  private static @Nullable ConstValue arithmetic(BinaryOperation operation, Int left, Int right) {
    IntegerType type = left.integerType();
    BigInteger l = left.value();
    BigInteger r = right.value();
    switch (operation) {
      case ADD:
        return checked(type, l.add(r));
      case SUB:
        return checked(type, l.subtract(r));
      case MUL:
        return checked(type, l.multiply(r));
      case DIV:
        return r.signum() == 0 ? null : checked(type, l.divide(r));
      case POW:
        if (r.signum() < 0) {
          return null;
        }
        if (l.abs().compareTo(BigInteger.ONE) <= 0) {
          if (l.signum() == 0) {
            return checked(type, r.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO);
          }
          return checked(type, l.signum() < 0 && r.testBit(0) ? l : BigInteger.ONE);
        }
        if (r.compareTo(BigInteger.valueOf(type.bits())) >= 0) {
          return null;
        }
        return checked(type, l.pow(r.intValue()));
      default:
        throw new IllegalStateException("not arithmetic " + operation);
    }
  }

  private static @Nullable ConstValue checked(IntegerType type, BigInteger value) {
    return type.contains(value) ? new Int(type, value) : null;
  }
}
