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

import static com.circuitlang.ast.IR.assertNode;
import static com.circuitlang.ast.IR.assign;
import static com.circuitlang.ast.IR.block;
import static com.circuitlang.ast.IR.circuit;
import static com.circuitlang.ast.IR.circuitInit;
import static com.circuitlang.ast.IR.constant;
import static com.circuitlang.ast.IR.destructure;
import static com.circuitlang.ast.IR.fieldMember;
import static com.circuitlang.ast.IR.forNode;
import static com.circuitlang.ast.IR.function;
import static com.circuitlang.ast.IR.group;
import static com.circuitlang.ast.IR.groupType;
import static com.circuitlang.ast.IR.init;
import static com.circuitlang.ast.IR.integer;
import static com.circuitlang.ast.IR.let;
import static com.circuitlang.ast.IR.log;
import static com.circuitlang.ast.IR.method;
import static com.circuitlang.ast.IR.name;
import static com.circuitlang.ast.IR.number;
import static com.circuitlang.ast.IR.param;
import static com.circuitlang.ast.IR.returnNode;
import static com.circuitlang.ast.IR.trueNode;
import static com.circuitlang.ast.IR.tuple;
import static com.google.common.truth.Truth.assertThat;

import com.circuitlang.ast.AssignOperation;
import com.circuitlang.ast.CircuitDecl;
import com.circuitlang.ast.FunctionDecl;
import com.circuitlang.ast.IR;
import com.circuitlang.ast.Identifier;
import com.circuitlang.ast.IntegerType;
import com.circuitlang.ast.StatementTree;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StatementConverterTest extends AsgTestSupport {

  private static final CircuitDecl COUNTER =
      circuit(
          "Counter",
          fieldMember("count", U8),
          method(function("reset", ImmutableList.of(), null, block())));

  /** {@code function main(x: u8) { body }}. */
  private static FunctionDecl withParam(StatementTree... body) {
    return function("main", ImmutableList.of(param("x", U8)), null, block(body));
  }

  private static ImmutableList<StatementTree.AssigneeAccess> path(
      StatementTree.AssigneeAccess... accesses) {
    return ImmutableList.copyOf(accesses);
  }

  @Test
  public void testLetIsMutable() throws Exception {
    Program program = build(main(null, let("a", U8, number(1)), assign("a", number(2))));
    DefinitionStatement definition =
        findAll(builtFunction(program, "main"), DefinitionStatement.class).get(0);
    Variable a = definition.getVariables().get(0);
    assertThat(a.isMutable()).isTrue();
    assertThat(a.getDeclaration()).isEqualTo(Variable.Declaration.DEFINITION);
    assertThat(a.getAssignments()).hasSize(2);
    assertThat(a.getAssignments().get(0)).isSameInstanceAs(definition);
  }

  @Test
  public void testConstAssignmentFails() {
    AsgConvertException e =
        assertBuildFails(
            AsgConvertErrors.IMMUTABLE_ASSIGNMENT,
            main(null, constant("a", U8, number(1)), assign("a", number(2))));
    assertThat(e.getError().description()).contains("`a`");
  }

  @Test
  public void testParameterAssignmentFails() {
    assertBuildFails(AsgConvertErrors.IMMUTABLE_ASSIGNMENT, withParam(assign("x", number(2))));
  }

  @Test
  public void testMutParameterAssignment() throws Exception {
    build(
        function(
            "main",
            ImmutableList.of(IR.mutParam("x", U8)),
            null,
            block(assign("x", number(2)))));
  }

  @Test
  public void testAssignUnknownVariable() {
    assertBuildFails(AsgConvertErrors.UNRESOLVED_REFERENCE, main(null, assign("a", number(2))));
  }

  @Test
  public void testAssignmentTypeMismatch() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_TYPE,
        main(null, let("a", U8, number(1)), assign("a", trueNode())));
  }

  @Test
  public void testConstNeedsConstyValue() throws Exception {
    build(main(null, constant("a", U8, number(1)), constant("b", U8, name("a"))));

    setUpContext();
    assertBuildFails(AsgConvertErrors.UNEXPECTED_NONCONST, withParam(constant("a", U8, name("x"))));
  }

  @Test
  public void testDuplicateDefinitionInSameBlock() {
    assertBuildFails(
        AsgConvertErrors.DUPLICATE_DEFINITION,
        main(null, let("a", U8, number(1)), let("a", U8, number(2))));
  }

  @Test
  public void testShadowingInNestedBlock() throws Exception {
    Program program =
        build(
            main(
                null,
                let("a", U8, number(1)),
                block(let("a", BOOL, trueNode()), assertNode(name("a"))),
                let("b", U8, name("a"))));
    ImmutableList<VariableRef> refs = findAll(builtFunction(program, "main"), VariableRef.class);
    assertThat(refs.get(0).getType()).isEqualTo(Type.BOOLEAN);
    assertThat(refs.get(1).getType()).isEqualTo(Type.integer(IntegerType.U8));
  }

  @Test
  public void testDefinitionReadsOuterVariableOfSameName() throws Exception {
    build(main(null, let("a", U8, number(1)), block(let("a", U8, name("a")))));
  }

  @Test
  public void testDestructuring() throws Exception {
    Program program =
        build(
            main(
                null,
                destructure(
                    ImmutableList.of("a", "b"), tuple(integer(1, IntegerType.U8), trueNode())),
                assertNode(name("b"))));
    DefinitionStatement definition =
        findAll(builtFunction(program, "main"), DefinitionStatement.class).get(0);
    assertThat(definition.getVariables()).hasSize(2);
    assertThat(definition.getVariables().get(0).getType())
        .isEqualTo(Type.integer(IntegerType.U8));
    assertThat(definition.getVariables().get(1).getType()).isEqualTo(Type.BOOLEAN);
  }

  @Test
  public void testDestructuringArityMismatch() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_TYPE,
        main(
            null,
            destructure(
                ImmutableList.of("a", "b", "c"), tuple(integer(1, IntegerType.U8), trueNode()))));
  }

  @Test
  public void testCompoundAssignment() throws Exception {
    build(
        main(
            null,
            let("a", U8, number(1)),
            assign(AssignOperation.ADD, "a", path(), number(2))));
  }

  @Test
  public void testCompoundAssignmentOnBooleanFails() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_TYPE,
        main(
            null,
            let("a", BOOL, trueNode()),
            assign(AssignOperation.ADD, "a", path(), trueNode())));
  }

  @Test
  public void testCompoundAddOnGroup() throws Exception {
    build(
        main(
            null,
            let("g", groupType(), group("1")),
            assign(AssignOperation.ADD, "g", path(), group("2"))));
  }

  @Test
  public void testCompoundMultiplyOnGroupFails() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_TYPE,
        main(
            null,
            let("g", groupType(), group("1")),
            assign(AssignOperation.MUL, "g", path(), group("2"))));
  }

  @Test
  public void testAssignThroughAccesses() throws Exception {
    Program program =
        build(
            program(
                ImmutableList.of(COUNTER),
                main(
                    null,
                    let(
                        "t",
                        null,
                        tuple(
                            circuitInit("Counter", init("count", integer(0, IntegerType.U8))),
                            IR.arrayInit(integer(0, IntegerType.U8), 2))),
                    assign(
                        AssignOperation.ASSIGN,
                        "t",
                        path(
                            new StatementTree.TupleIndex(0),
                            new StatementTree.Member(Identifier.of("count"))),
                        number(3)),
                    assign(
                        AssignOperation.ASSIGN,
                        "t",
                        path(
                            new StatementTree.TupleIndex(1),
                            new StatementTree.ArrayIndex(number(1))),
                        number(4)))));
    ImmutableList<AssignStatement> assigns =
        findAll(builtFunction(program, "main"), AssignStatement.class);
    assertThat(assigns.get(0).getAccesses())
        .containsExactly(new AssignStatement.TupleIndex(0), new AssignStatement.Member("count"))
        .inOrder();
    assertThat(assigns.get(0).getValue().getType()).isEqualTo(Type.integer(IntegerType.U8));
    AssignStatement.ArrayIndex index =
        (AssignStatement.ArrayIndex) assigns.get(1).getAccesses().get(1);
    assertThat(index.getIndex().getParent()).isSameInstanceAs(assigns.get(1));
  }

  @Test
  public void testAssignToMethodFails() {
    assertBuildFails(
        AsgConvertErrors.IMMUTABLE_ASSIGNMENT,
        program(
            ImmutableList.of(COUNTER),
            main(
                null,
                let("c", null, circuitInit("Counter", init("count", integer(0, IntegerType.U8)))),
                assign(
                    AssignOperation.ASSIGN,
                    "c",
                    path(new StatementTree.Member(Identifier.of("reset"))),
                    number(1)))));
  }

  @Test
  public void testAssignTupleIndexOutOfBounds() {
    assertBuildFails(
        AsgConvertErrors.INDEX_OUT_OF_BOUNDS,
        main(
            null,
            let("t", IR.tupleType(U8, BOOL), tuple(number(1), trueNode())),
            assign(AssignOperation.ASSIGN, "t", path(new StatementTree.TupleIndex(5)), number(1))));
  }

  @Test
  public void testIteration() throws Exception {
    Program program =
        build(main(null, forNode("i", number(0), number(4), block(log("{}", name("i"))))));
    IterationStatement loop =
        findAll(builtFunction(program, "main"), IterationStatement.class).get(0);
    assertThat(loop.getVariable().getType()).isEqualTo(Type.integer(IntegerType.U32));
    assertThat(loop.getVariable().getDeclaration())
        .isEqualTo(Variable.Declaration.ITERATION_DEFINITION);
    assertThat(loop.getVariable().isMutable()).isFalse();
    assertThat(loop.isInclusive()).isFalse();
  }

  @Test
  public void testLoopVariableIsImmutable() {
    assertBuildFails(
        AsgConvertErrors.IMMUTABLE_ASSIGNMENT,
        main(null, forNode("i", number(0), number(4), block(assign("i", number(1))))));
  }

  @Test
  public void testLoopBoundsMustBeConsty() {
    assertBuildFails(
        AsgConvertErrors.UNEXPECTED_NONCONST,
        function(
            "main",
            ImmutableList.of(param("n", U32)),
            null,
            block(forNode("i", number(0), name("n"), block()))));
  }

  @Test
  public void testLogFormatArgumentMismatch() {
    AsgConvertException e =
        assertBuildFails(
            AsgConvertErrors.FORMAT_ARGUMENT_MISMATCH, withParam(log("{} and {}", name("x"))));
    assertThat(e.getError().description()).contains("2");
  }

  @Test
  public void testAssertNeedsBoolean() {
    assertBuildFails(AsgConvertErrors.UNEXPECTED_TYPE, withParam(assertNode(name("x"))));
  }

  @Test
  public void testReturnTypeMismatch() {
    assertBuildFails(AsgConvertErrors.UNEXPECTED_TYPE, main(U8, returnNode(trueNode())));
  }

  @Test
  public void testCountContainers() {
    assertThat(StatementConverter.countContainers("")).isEqualTo(0);
    assertThat(StatementConverter.countContainers("{} {}")).isEqualTo(2);
    assertThat(StatementConverter.countContainers("{}{}{}")).isEqualTo(3);
    assertThat(StatementConverter.countContainers("{ }")).isEqualTo(0);
  }
}
