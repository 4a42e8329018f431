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

import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.circuitlang.ast.CircuitDecl;
import com.circuitlang.ast.FunctionDecl;
import com.circuitlang.ast.IR;
import com.circuitlang.ast.IntegerType;
import com.circuitlang.ast.ProgramTree;
import com.circuitlang.ast.StatementTree;
import com.circuitlang.ast.TypeTree;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Before;

/** Builds small programs from {@link IR} trees for the graph tests. */
public abstract class AsgTestSupport {
  protected static final TypeTree U8 = IR.type(IntegerType.U8);
  protected static final TypeTree U32 = IR.type(IntegerType.U32);
  protected static final TypeTree BOOL = IR.boolType();

  protected AsgContext context;
  protected AsgOptions options;

  @Before
  public void setUpContext() {
    context = new AsgContext();
    options = new AsgOptions();
  }

  protected Program build(ProgramTree tree) throws AsgConvertException {
    return new ProgramBuilder(context, options).build(tree);
  }

  protected Program build(FunctionDecl... functions) throws AsgConvertException {
    return build(program(functions));
  }

  /** Asserts that building {@code tree} fails with {@code type} and returns the failure. */
  protected AsgConvertException assertBuildFails(DiagnosticType type, ProgramTree tree) {
    AsgConvertException e = assertThrows(AsgConvertException.class, () -> build(tree));
    assertWithMessage("Unexpected error: %s", e.getError()).that(e.getType()).isEqualTo(type);
    return e;
  }

  protected AsgConvertException assertBuildFails(DiagnosticType type, FunctionDecl... functions) {
    return assertBuildFails(type, program(functions));
  }

  protected static ProgramTree program(FunctionDecl... functions) {
    return IR.program("test", ImmutableList.of(), Arrays.asList(functions));
  }

  protected static ProgramTree program(List<CircuitDecl> circuits, FunctionDecl... functions) {
    return IR.program("test", circuits, Arrays.asList(functions));
  }

  /** {@code function main() -> output { body }}. */
  protected static FunctionDecl main(@Nullable TypeTree output, StatementTree... body) {
    return IR.function("main", ImmutableList.of(), output, IR.block(body));
  }

  /** The built function named {@code name}, free or method. */
  protected static Function builtFunction(Program program, String name) {
    for (Function function : program.getAllFunctions()) {
      if (function.getName().equals(name)) {
        return function;
      }
    }
    throw new AssertionError("No function " + name);
  }

  /** Every node of {@code kind} in the body of {@code function}, in post-order. */
  protected static <T extends Node> ImmutableList<T> findAll(Function function, Class<T> kind) {
    ImmutableList.Builder<T> nodes = ImmutableList.builder();
    NodeTraversal.traverse(
        function.getBody(),
        (n, parent) -> {
          if (kind.isInstance(n)) {
            nodes.add(kind.cast(n));
          }
        });
    return nodes.build();
  }
}
