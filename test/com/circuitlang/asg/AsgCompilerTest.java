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

import static com.circuitlang.ast.IR.add;
import static com.circuitlang.ast.IR.block;
import static com.circuitlang.ast.IR.forNode;
import static com.circuitlang.ast.IR.integer;
import static com.circuitlang.ast.IR.log;
import static com.circuitlang.ast.IR.number;
import static com.circuitlang.ast.IR.returnNode;
import static com.google.common.truth.Truth.assertThat;

import com.circuitlang.ast.FunctionDecl;
import com.circuitlang.ast.IR;
import com.circuitlang.ast.Identifier;
import com.circuitlang.ast.IntegerType;
import com.circuitlang.ast.ProgramTree;
import com.circuitlang.ast.Span;
import com.circuitlang.ast.TypeTree;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AsgCompilerTest {
  private static final TypeTree U8 = IR.type(IntegerType.U8);

  private AsgOptions options;
  private SortingErrorManager errorManager;

  @Before
  public void setUp() {
    options = new AsgOptions();
    errorManager = new SortingErrorManager();
  }

  private static ProgramTree program(FunctionDecl... functions) {
    return IR.program("main", ImmutableList.of(), ImmutableList.copyOf(functions));
  }

  private static FunctionDecl sum() {
    return IR.function(
        "main",
        ImmutableList.of(),
        U8,
        block(returnNode(add(integer(1, IntegerType.U8), integer(2, IntegerType.U8)))));
  }

  /** {@code function main() -> u8 { for i in 0..2 { return 1u8; log("after"); } }}. */
  private static FunctionDecl loopWithDeadCode() {
    return IR.function(
        "main",
        ImmutableList.of(),
        U8,
        block(
            forNode(
                "i",
                number(0),
                number(2),
                block(returnNode(integer(1, IntegerType.U8)), log("after")))));
  }

  private static ReturnStatement onlyReturn(Program program) {
    Statement statement = program.getFunctions().get("main").getBody().getStatements().get(0);
    return (ReturnStatement) statement;
  }

  @Test
  public void testCompileFoldsConstants() {
    AsgCompiler compiler = new AsgCompiler(options, errorManager);
    Program program = compiler.compile(program(sum()));

    assertThat(program).isNotNull();
    assertThat(compiler.hasErrors()).isFalse();
    assertThat(onlyReturn(program).getValue()).isInstanceOf(Constant.class);
  }

  @Test
  public void testFoldingDisabled() {
    options.setFoldConstants(false);
    Program program = new AsgCompiler(options, errorManager).compile(program(sum()));
    assertThat(onlyReturn(program).getValue()).isInstanceOf(BinaryExpression.class);
  }

  @Test
  public void testFailureIsReported() {
    AsgCompiler compiler = new AsgCompiler(options, errorManager);
    assertThat(compiler.compile(program(loopWithDeadCode()))).isNull();

    assertThat(compiler.hasErrors()).isTrue();
    assertThat(compiler.getErrors()).hasSize(1);
    assertThat(compiler.getErrors().get(0).type()).isEqualTo(AsgConvertErrors.MISSING_RETURN);
  }

  @Test
  public void testAllReturnPathErrorsReported() {
    options.setReturnPathErrorMode(AsgOptions.ReturnPathErrorMode.ALL);
    AsgCompiler compiler = new AsgCompiler(options, errorManager);
    assertThat(compiler.compile(program(loopWithDeadCode()))).isNull();

    ImmutableList.Builder<DiagnosticType> types = ImmutableList.builder();
    for (AsgError error : compiler.getErrors()) {
      types.add(error.type());
    }
    assertThat(types.build())
        .containsExactly(AsgConvertErrors.MISSING_RETURN, AsgConvertErrors.UNREACHABLE_CODE);
  }

  @Test
  public void testDemotedUnreachableCodeIsReportedAsWarning() {
    options.setWarningLevel(DiagnosticGroups.UNREACHABLE, CheckLevel.WARNING);
    FunctionDecl main =
        IR.function(
            "main",
            ImmutableList.of(),
            U8,
            block(returnNode(integer(1, IntegerType.U8)), log("after")));
    AsgCompiler compiler = new AsgCompiler(options, errorManager);

    assertThat(compiler.compile(program(main))).isNotNull();
    assertThat(compiler.hasErrors()).isFalse();
    assertThat(compiler.getWarnings()).hasSize(1);
    assertThat(compiler.getWarnings().get(0).type())
        .isEqualTo(AsgConvertErrors.UNREACHABLE_CODE);
    assertThat(errorManager.getWarningCount()).isEqualTo(1);
  }

  @Test
  public void testErrorQuotesSource() {
    AsgCompiler compiler = new AsgCompiler(options, errorManager);
    compiler.addSource("main.circ", "function main() -> u8 {\n}\n");
    FunctionDecl main =
        new FunctionDecl(
            Identifier.of("main"),
            ImmutableList.of(),
            U8,
            block(),
            ImmutableList.of(),
            Span.of("main.circ", 1, 10, 14));

    assertThat(compiler.compile(program(main))).isNull();

    String message =
        LightweightMessageFormatter.withSource(compiler).formatError(compiler.getErrors().get(0));
    assertThat(message)
        .isEqualTo(
            "main.circ:1:10: ERROR - [ASG_MISSING_RETURN] function `main` missing return for all"
                + " paths\n"
                + "function main() -> u8 {\n"
                + "         ^^^^\n");
  }

  @Test
  public void testGetSourceLine() {
    AsgCompiler compiler = new AsgCompiler(options);
    compiler.addSource("a.circ", "one\ntwo");
    assertThat(compiler.getSourceLine("a.circ", 2)).isEqualTo("two");
    assertThat(compiler.getSourceLine("a.circ", 3)).isNull();
    assertThat(compiler.getSourceLine("a.circ", 0)).isNull();
    assertThat(compiler.getSourceLine("b.circ", 1)).isNull();
  }

  @Test
  public void testEachCompilationHasItsOwnContext() {
    AsgCompiler first = new AsgCompiler(options, errorManager);
    AsgCompiler second = new AsgCompiler(options, new SortingErrorManager());
    first.compile(program(sum()));
    assertThat(first.getContext().getFunctions()).hasSize(1);
    assertThat(second.getContext().getFunctions()).isEmpty();
  }
}
