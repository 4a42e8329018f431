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

/** The root of a parsed compilation unit. */
public record ProgramTree(
    String name,
    ImmutableList<ImportDecl> imports,
    ImmutableList<CircuitDecl> circuits,
    ImmutableList<FunctionDecl> functions) {

  public ProgramTree(
      String name,
      List<ImportDecl> imports,
      List<CircuitDecl> circuits,
      List<FunctionDecl> functions) {
    this(
        name,
        ImmutableList.copyOf(imports),
        ImmutableList.copyOf(circuits),
        ImmutableList.copyOf(functions));
  }
}
