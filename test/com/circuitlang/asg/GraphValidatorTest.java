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
import static com.circuitlang.ast.IR.call;
import static com.circuitlang.ast.IR.circuit;
import static com.circuitlang.ast.IR.circuitInit;
import static com.circuitlang.ast.IR.fieldMember;
import static com.circuitlang.ast.IR.forNode;
import static com.circuitlang.ast.IR.function;
import static com.circuitlang.ast.IR.ifNode;
import static com.circuitlang.ast.IR.index;
import static com.circuitlang.ast.IR.init;
import static com.circuitlang.ast.IR.integer;
import static com.circuitlang.ast.IR.let;
import static com.circuitlang.ast.IR.log;
import static com.circuitlang.ast.IR.member;
import static com.circuitlang.ast.IR.method;
import static com.circuitlang.ast.IR.name;
import static com.circuitlang.ast.IR.number;
import static com.circuitlang.ast.IR.param;
import static com.circuitlang.ast.IR.returnNode;
import static com.circuitlang.ast.IR.self;
import static com.circuitlang.ast.IR.tuple;
import static com.circuitlang.ast.IR.tupleAccess;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.circuitlang.ast.ExpressionTree;
import com.circuitlang.ast.IR;
import com.circuitlang.ast.IntegerType;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GraphValidatorTest extends AsgTestSupport {

  private Program buildSample() throws AsgConvertException {
    ExpressionTree sum = add(index(name("arr"), number(1)), tupleAccess(name("t"), 0));
    return build(
        program(
            ImmutableList.of(
                circuit(
                    "C",
                    fieldMember("x", U8),
                    method(
                        function(
                            "get",
                            ImmutableList.of(self()),
                            U8,
                            block(returnNode(member(name("self"), "x"))))))),
            function(
                "twice",
                ImmutableList.of(param("v", U8)),
                U8,
                block(returnNode(add(name("v"), name("v"))))),
            function(
                "main",
                ImmutableList.of(param("cond", BOOL)),
                U8,
                block(
                    let("c", null, circuitInit("C", init("x", integer(1, IntegerType.U8)))),
                    let("arr", IR.arrayType(U8, 2), IR.arrayInit(number(3), 2)),
                    let("t", null, tuple(integer(2, IntegerType.U8), IR.trueNode())),
                    forNode("i", number(0), number(2), block(log("{}", name("i")))),
                    ifNode(
                        name("cond"),
                        block(returnNode(call(member(name("c"), "get")))),
                        block(returnNode(call("twice", sum))))))));
  }

  @Test
  public void testParentsAreWired() throws Exception {
    Program program = buildSample();
    for (Function function : program.getAllFunctions()) {
      BlockStatement body = function.getBody();
      assertThat(body.getParent()).isNull();
      NodeTraversal.traverse(
          body,
          (n, parent) -> {
            for (Node child : n.getChildren()) {
              assertThat(child.getParent()).isSameInstanceAs(n);
            }
          });
    }
  }

  @Test
  public void testValidGraphPasses() throws Exception {
    List<String> violations = new ArrayList<>();
    new GraphValidator((message, n) -> violations.add(message)).process(buildSample());
    assertThat(violations).isEmpty();
  }

  @Test
  public void testBrokenParentIsReported() throws Exception {
    Program program = buildSample();
    Function main = builtFunction(program, "main");
    ReturnStatement ret = findAll(main, ReturnStatement.class).get(0);
    ret.getValue().setParent(null);

    List<String> violations = new ArrayList<>();
    new GraphValidator((message, n) -> violations.add(message)).validateFunction(main);
    assertThat(violations).hasSize(1);
  }

  @Test
  public void testDefaultHandlerThrows() throws Exception {
    Program program = buildSample();
    Function main = builtFunction(program, "main");
    findAll(main, CallExpression.class).get(0).setParent(null);
    assertThrows(IllegalStateException.class, () -> new GraphValidator().process(program));
  }

  @Test
  public void testReplaceWithKeepsParents() throws Exception {
    Program program = buildSample();
    Function twice = builtFunction(program, "twice");
    BinaryExpression sum = findAll(twice, BinaryExpression.class).get(0);
    Expression left = sum.getLeft();
    Constant replacement =
        context.alloc(
            new Constant(context, null, new ConstValue.Int(IntegerType.U8, BigInteger.ONE)));

    left.replaceWith(replacement);

    assertThat(sum.getLeft()).isSameInstanceAs(replacement);
    assertThat(replacement.getParent()).isSameInstanceAs(sum);
    assertThat(left.getParent()).isNull();
    new GraphValidator().validateFunction(twice);
  }

  @Test
  public void testDetachedReferenceIsReported() throws Exception {
    Program program = buildSample();
    BinaryExpression sum = findAll(builtFunction(program, "twice"), BinaryExpression.class).get(0);
    sum.getLeft()
        .replaceWith(
            context.alloc(
                new Constant(context, null, new ConstValue.Int(IntegerType.U8, BigInteger.ONE))));

    List<String> violations = new ArrayList<>();
    new GraphValidator((message, n) -> violations.add(message)).process(program);
    assertThat(violations).containsExactly("Reference to v is detached from the graph");
  }

  @Test
  public void testReplaceWithWrongTypeFails() throws Exception {
    Program program = buildSample();
    BinaryExpression sum = findAll(builtFunction(program, "twice"), BinaryExpression.class).get(0);
    Constant replacement = context.alloc(new Constant(context, null, new ConstValue.Bool(true)));
    assertThrows(IllegalArgumentException.class, () -> sum.getLeft().replaceWith(replacement));
  }

  @Test
  public void testReplaceDetachedFails() {
    Constant detached = context.alloc(new Constant(context, null, new ConstValue.Bool(true)));
    Constant replacement = context.alloc(new Constant(context, null, new ConstValue.Bool(false)));
    assertThrows(IllegalStateException.class, () -> detached.replaceWith(replacement));
  }
}
