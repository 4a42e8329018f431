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

/** One entry of a function's parameter list. */
public interface FunctionInput {

  @Nullable Span span();

  /** Which receiver form a method declares. */
  enum SelfKind {
    /** {@code self} */
    SELF,
    /** {@code const self} */
    CONST_SELF,
    /** {@code mut self} */
    MUT_SELF
  }

  /** A receiver keyword. */
  record SelfKeyword(SelfKind kind, @Nullable Span span) implements FunctionInput {}

  /** {@code [const] [mut] name: type}. */
  record Variable(
      Identifier identifier, boolean isConst, boolean mutable, TypeTree type, @Nullable Span span)
      implements FunctionInput {}
}
