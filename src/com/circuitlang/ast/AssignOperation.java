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

import org.jspecify.annotations.Nullable;

/** Assignment operators; compound forms carry the binary operation they apply. */
public enum AssignOperation {
  ASSIGN("=", null),
  ADD("+=", BinaryOperation.ADD),
  SUB("-=", BinaryOperation.SUB),
  MUL("*=", BinaryOperation.MUL),
  DIV("/=", BinaryOperation.DIV),
  POW("**=", BinaryOperation.POW);

  private final String symbol;
  private final @Nullable BinaryOperation binaryOperation;

  AssignOperation(String symbol, @Nullable BinaryOperation binaryOperation) {
    this.symbol = symbol;
    this.binaryOperation = binaryOperation;
  }

  public String symbol() {
    return symbol;
  }

  /** The operation combined with the old value, or null for plain assignment. */
  public @Nullable BinaryOperation binaryOperation() {
    return binaryOperation;
  }

  public boolean isCompound() {
    return binaryOperation != null;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
