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
 * A function or method declaration.
 *
 * @param identifier The function name.
 * @param inputs Parameters, including any receiver keyword.
 * @param output The declared return type; null means the unit type.
 * @param block The body.
 * @param annotations Annotation names, e.g. {@code test}.
 * @param span Source of the whole declaration.
 */
public record FunctionDecl(
    Identifier identifier,
    ImmutableList<FunctionInput> inputs,
    @Nullable TypeTree output,
    StatementTree.Block block,
    ImmutableList<String> annotations,
    @Nullable Span span) {

  public FunctionDecl(
      Identifier identifier,
      List<FunctionInput> inputs,
      @Nullable TypeTree output,
      StatementTree.Block block,
      List<String> annotations,
      @Nullable Span span) {
    this(
        identifier,
        ImmutableList.copyOf(inputs),
        output,
        block,
        ImmutableList.copyOf(annotations),
        span);
  }
}
