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

/** {@code circuit Name { fields and methods }}. */
public record CircuitDecl(
    Identifier name, ImmutableList<CircuitDecl.Member> members, @Nullable Span span) {

  public CircuitDecl(Identifier name, List<Member> members, @Nullable Span span) {
    this(name, ImmutableList.copyOf(members), span);
  }

  /** A field or a method. */
  public interface Member {
    Identifier name();
  }

  /** {@code name: type}. */
  public record Field(Identifier name, TypeTree type) implements Member {}

  /** A function declared inside the circuit. */
  public record Method(FunctionDecl function) implements Member {
    @Override
    public Identifier name() {
      return function.identifier();
    }
  }
}
