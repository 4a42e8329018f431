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

/** Binary operators, grouped by the operands they accept. */
public enum BinaryOperation {
  ADD("+", OperationClass.NUMERIC),
  SUB("-", OperationClass.NUMERIC),
  MUL("*", OperationClass.NUMERIC),
  DIV("/", OperationClass.NUMERIC),
  POW("**", OperationClass.NUMERIC),
  OR("||", OperationClass.BOOLEAN),
  AND("&&", OperationClass.BOOLEAN),
  EQ("==", OperationClass.EQUALITY),
  NE("!=", OperationClass.EQUALITY),
  GE(">=", OperationClass.ORDERING),
  GT(">", OperationClass.ORDERING),
  LE("<=", OperationClass.ORDERING),
  LT("<", OperationClass.ORDERING);

  /** What an operator consumes and produces. */
  public enum OperationClass {
    /** Numeric operands, result of the operand type. */
    NUMERIC,
    /** Boolean operands and result. */
    BOOLEAN,
    /** Operands of any equal type, boolean result. */
    EQUALITY,
    /** Ordered numeric operands, boolean result. */
    ORDERING
  }

  private final String symbol;
  private final OperationClass operationClass;

  BinaryOperation(String symbol, OperationClass operationClass) {
    this.symbol = symbol;
    this.operationClass = operationClass;
  }

  public String symbol() {
    return symbol;
  }

  public OperationClass operationClass() {
    return operationClass;
  }

  /** Whether the result is a boolean regardless of the operand type. */
  public boolean producesBoolean() {
    return operationClass != OperationClass.NUMERIC;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
