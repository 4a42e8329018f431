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

import static com.circuitlang.ast.IR.block;
import static com.circuitlang.ast.IR.call;
import static com.circuitlang.ast.IR.circuit;
import static com.circuitlang.ast.IR.circuitInit;
import static com.circuitlang.ast.IR.constParam;
import static com.circuitlang.ast.IR.exprResult;
import static com.circuitlang.ast.IR.fieldMember;
import static com.circuitlang.ast.IR.function;
import static com.circuitlang.ast.IR.init;
import static com.circuitlang.ast.IR.integer;
import static com.circuitlang.ast.IR.let;
import static com.circuitlang.ast.IR.member;
import static com.circuitlang.ast.IR.method;
import static com.circuitlang.ast.IR.mutSelf;
import static com.circuitlang.ast.IR.name;
import static com.circuitlang.ast.IR.number;
import static com.circuitlang.ast.IR.namedType;
import static com.circuitlang.ast.IR.param;
import static com.circuitlang.ast.IR.returnNode;
import static com.circuitlang.ast.IR.self;
import static com.circuitlang.ast.IR.staticMember;
import static com.circuitlang.ast.IR.testFunction;
import static com.circuitlang.ast.IR.trueNode;
import static com.google.common.truth.Truth.assertThat;

import com.circuitlang.ast.CircuitDecl;
import com.circuitlang.ast.ExpressionTree;
import com.circuitlang.ast.FunctionDecl;
import com.circuitlang.ast.IntegerType;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CallResolverTest extends AsgTestSupport {

  private static final ExpressionTree ONE_U8 = integer(1, IntegerType.U8);

  private static final FunctionDecl IDENTITY =
      function("f", ImmutableList.of(param("x", U32)), U32, block(returnNode(name("x"))));

  /** {@code circuit C { x: u8, function static_fn() -> u32, function get(self) -> u8, ... } }. */
  private static final CircuitDecl CIRCUIT_C =
      circuit(
          "C",
          fieldMember("x", U8),
          method(
              function(
                  "static_fn",
                  ImmutableList.of(),
                  U32,
                  block(returnNode(integer(0, IntegerType.U32))))),
          method(
              function(
                  "get",
                  ImmutableList.of(self()),
                  U8,
                  block(returnNode(member(name("self"), "x"))))),
          method(function("bump", ImmutableList.of(mutSelf()), null, block())));

  @Test
  public void testFreeCall() throws Exception {
    Program program =
        build(
            IDENTITY,
            main(U32, returnNode(call("f", integer(1, IntegerType.U32)))));
    CallExpression call = findAll(builtFunction(program, "main"), CallExpression.class).get(0);
    assertThat(call.getFunction().getName()).isEqualTo("f");
    assertThat(call.getTarget()).isNull();
    assertThat(call.getType()).isEqualTo(Type.integer(IntegerType.U32));
    assertThat(call.getArguments()).hasSize(1);
  }

  @Test
  public void testArgumentCountMismatch() {
    AsgConvertException e =
        assertBuildFails(
            AsgConvertErrors.ARGUMENT_COUNT_MISMATCH,
            IDENTITY,
            main(
                U32,
                returnNode(
                    call("f", integer(1, IntegerType.U32), integer(2, IntegerType.U32)))));
    assertThat(e.getError().description()).isEqualTo("function call expected 1 arguments, got 2");
  }

  @Test
  public void testArgumentCountMismatchIgnoresArgumentTypes() {
    assertBuildFails(
        AsgConvertErrors.ARGUMENT_COUNT_MISMATCH,
        IDENTITY,
        main(U32, returnNode(call("f"))));
    assertBuildFails(
        AsgConvertErrors.ARGUMENT_COUNT_MISMATCH,
        IDENTITY,
        main(
            U32,
            returnNode(call("f", trueNode(), trueNode()))));
  }

  @Test
  public void testArgumentTypeMismatch() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_TYPE,
        IDENTITY,
        main(U32, returnNode(call("f", integer(1, IntegerType.U8)))));
  }

  @Test
  public void testOutputTypeMismatch() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_TYPE,
        IDENTITY,
        main(U8, returnNode(call("f", integer(1, IntegerType.U32)))));
  }

  @Test
  public void testUnresolvedFunction() {
    assertBuildFails(AsgConvertErrors.UNRESOLVED_FUNCTION, main(null, exprResult(call("g"))));
  }

  @Test
  public void testImplicitArgumentTakesParameterType() throws Exception {
    Program program =
        build(IDENTITY, main(U32, returnNode(call("f", number(7)))));
    CallExpression call = findAll(builtFunction(program, "main"), CallExpression.class).get(0);
    assertThat(call.getArguments().get(0).getType()).isEqualTo(Type.integer(IntegerType.U32));
  }

  @Test
  public void testConstParameterRequiresConstyArgument() throws Exception {
    FunctionDecl constF =
        function("f", ImmutableList.of(constParam("x", U32)), U32, block(returnNode(name("x"))));
    build(constF, main(U32, returnNode(call("f", integer(1, IntegerType.U32)))));

    setUpContext();
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_NONCONST,
        constF,
        function(
            "main",
            ImmutableList.of(param("y", U32)),
            U32,
            block(returnNode(call("f", name("y"))))));
  }

  @Test
  public void testCallTestFunction() {
    assertBuildFails(
        AsgConvertErrors.CALL_TEST_FUNCTION,
        testFunction("t", block()),
        main(null, exprResult(call("t"))));
  }

  @Test
  public void testCallTestFunctionCheckedAfterArity() {
    assertBuildFails(
        AsgConvertErrors.ARGUMENT_COUNT_MISMATCH,
        testFunction("t", block()),
        main(null, exprResult(call("t", integer(1, IntegerType.U8)))));
  }

  @Test
  public void testStaticCallThroughInstanceFails() {
    AsgConvertException e =
        assertBuildFails(
            AsgConvertErrors.STATIC_CALL_INVALID,
            program(
                ImmutableList.of(CIRCUIT_C),
                function(
                    "main",
                    ImmutableList.of(param("c", namedType("C"))),
                    U32,
                    block(returnNode(call(member(name("c"), "static_fn")))))));
    assertThat(e.getError().description()).contains("C::static_fn");
  }

  @Test
  public void testStaticCall() throws Exception {
    Program program =
        build(
            program(
                ImmutableList.of(CIRCUIT_C),
                main(U32, returnNode(call(staticMember("C", "static_fn"))))));
    CallExpression call = findAll(builtFunction(program, "main"), CallExpression.class).get(0);
    assertThat(call.getFunction().isStatic()).isTrue();
    assertThat(call.getTarget()).isNull();
  }

  @Test
  public void testInstanceCall() throws Exception {
    Program program =
        build(
            program(
                ImmutableList.of(CIRCUIT_C),
                function(
                    "main",
                    ImmutableList.of(param("c", namedType("C"))),
                    U8,
                    block(returnNode(call(member(name("c"), "get")))))));
    CallExpression call = findAll(builtFunction(program, "main"), CallExpression.class).get(0);
    assertThat(call.getFunction().getQualifier()).isEqualTo(FunctionQualifier.SELF_REF);
    assertThat(call.getTarget()).isInstanceOf(VariableRef.class);
    assertThat(call.getTarget().getParent()).isSameInstanceAs(call);
  }

  @Test
  public void testInstanceMethodThroughStaticFormFails() {
    assertBuildFails(
        AsgConvertErrors.MEMBER_CALL_INVALID,
        program(ImmutableList.of(CIRCUIT_C), main(U8, returnNode(call(staticMember("C", "get"))))));
  }

  @Test
  public void testMutSelfCallOnMutableTarget() throws Exception {
    build(
        program(
            ImmutableList.of(CIRCUIT_C),
            main(
                null,
                let("c", null, circuitInit("C", init("x", integer(1, IntegerType.U8)))),
                exprResult(call(member(name("c"), "bump"))))));
  }

  @Test
  public void testMutSelfCallOnImmutableTargetFails() {
    assertBuildFails(
        AsgConvertErrors.MUT_CALL_INVALID,
        program(
            ImmutableList.of(CIRCUIT_C),
            function(
                "main",
                ImmutableList.of(param("c", namedType("C"))),
                null,
                block(exprResult(call(member(name("c"), "bump")))))));
  }

  @Test
  public void testMutSelfCallOnTemporaryFails() {
    assertBuildFails(
        AsgConvertErrors.MUT_CALL_INVALID,
        program(
            ImmutableList.of(CIRCUIT_C),
            main(
                null,
                exprResult(call(member(circuitInit("C", init("x", ONE_U8)), "bump"))))));
  }

  @Test
  public void testFieldCallFails() {
    assertBuildFails(
        AsgConvertErrors.CIRCUIT_VARIABLE_CALL,
        program(
            ImmutableList.of(CIRCUIT_C),
            function(
                "main",
                ImmutableList.of(param("c", namedType("C"))),
                null,
                block(exprResult(call(member(name("c"), "x")))))));
    setUpContext();
    assertBuildFails(
        AsgConvertErrors.CIRCUIT_VARIABLE_CALL,
        program(ImmutableList.of(CIRCUIT_C), main(null, exprResult(call(staticMember("C", "x"))))));
  }

  @Test
  public void testUnknownMemberFails() {
    assertBuildFails(
        AsgConvertErrors.UNRESOLVED_CIRCUIT_MEMBER,
        program(
            ImmutableList.of(CIRCUIT_C), main(null, exprResult(call(staticMember("C", "nope"))))));
  }

  @Test
  public void testUnknownCircuitFails() {
    assertBuildFails(
        AsgConvertErrors.UNRESOLVED_CIRCUIT,
        main(null, exprResult(call(staticMember("D", "f")))));
  }

  @Test
  public void testMemberCallOnNonCircuitFails() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_TYPE,
        function(
            "main",
            ImmutableList.of(param("n", U8)),
            null,
            block(exprResult(call(member(name("n"), "get"))))));
  }

  @Test
  public void testNonNameCallTargetFails() {
    assertBuildFails(
        AsgConvertErrors.ILLEGAL_AST_STRUCTURE,
        main(null, exprResult(call(integer(1, IntegerType.U8)))));
  }

  @Test
  public void testCallConstness() throws Exception {
    FunctionDecl add =
        function(
            "add",
            ImmutableList.of(param("a", U32), param("b", U32)),
            U32,
            block(returnNode(name("a"))));
    Program program =
        build(
            add,
            function(
                "main",
                ImmutableList.of(param("y", U32)),
                null,
                block(
                    exprResult(
                        call("add", integer(1, IntegerType.U32), integer(2, IntegerType.U32))),
                    exprResult(call("add", integer(1, IntegerType.U32), name("y"))))));
    ImmutableList<CallExpression> calls =
        findAll(builtFunction(program, "main"), CallExpression.class);
    assertThat(calls.get(0).isConsty()).isTrue();
    assertThat(calls.get(1).isConsty()).isFalse();
  }
}
