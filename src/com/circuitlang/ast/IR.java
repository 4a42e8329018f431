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

import static com.google.common.base.Preconditions.checkArgument;

import com.circuitlang.ast.ExpressionTree.ArrayElement;
import com.circuitlang.ast.ExpressionTree.ValueKind;
import com.circuitlang.ast.StatementTree.Block;
import com.circuitlang.ast.StatementTree.DeclarationKind;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A syntax tree construction helper. Nodes built here carry no source positions.
 */
public class IR {

  private IR() {}

  // Types

  public static TypeTree type(IntegerType integerType) {
    return new TypeTree.Int(integerType);
  }

  public static TypeTree boolType() {
    return new TypeTree.Scalar(TypeTree.ScalarKind.BOOLEAN);
  }

  public static TypeTree fieldType() {
    return new TypeTree.Scalar(TypeTree.ScalarKind.FIELD);
  }

  public static TypeTree groupType() {
    return new TypeTree.Scalar(TypeTree.ScalarKind.GROUP);
  }

  public static TypeTree addressType() {
    return new TypeTree.Scalar(TypeTree.ScalarKind.ADDRESS);
  }

  public static TypeTree charType() {
    return new TypeTree.Scalar(TypeTree.ScalarKind.CHAR);
  }

  public static TypeTree arrayType(TypeTree element, int length) {
    return new TypeTree.Array(element, length);
  }

  public static TypeTree tupleType(TypeTree... elements) {
    return new TypeTree.Tuple(Arrays.asList(elements));
  }

  public static TypeTree namedType(String circuit) {
    return new TypeTree.Named(Identifier.of(circuit));
  }

  public static TypeTree selfType() {
    return new TypeTree.SelfType(null);
  }

  // Expressions

  public static ExpressionTree name(String name) {
    return new ExpressionTree.Ident(Identifier.of(name));
  }

  public static ExpressionTree integer(String value, IntegerType integerType) {
    return new ExpressionTree.Value(ValueKind.INTEGER, value, integerType, null);
  }

  public static ExpressionTree integer(long value, IntegerType integerType) {
    return integer(Long.toString(value), integerType);
  }

  /** A number whose type is inferred from context. */
  public static ExpressionTree number(long value) {
    return new ExpressionTree.Value(ValueKind.IMPLICIT, Long.toString(value), null, null);
  }

  public static ExpressionTree field(String value) {
    return new ExpressionTree.Value(ValueKind.FIELD, value, null, null);
  }

  public static ExpressionTree group(String value) {
    return new ExpressionTree.Value(ValueKind.GROUP, value, null, null);
  }

  public static ExpressionTree address(String value) {
    return new ExpressionTree.Value(ValueKind.ADDRESS, value, null, null);
  }

  public static ExpressionTree character(String value) {
    return new ExpressionTree.Value(ValueKind.CHAR, value, null, null);
  }

  public static ExpressionTree trueNode() {
    return new ExpressionTree.Value(ValueKind.BOOLEAN, "true", null, null);
  }

  public static ExpressionTree falseNode() {
    return new ExpressionTree.Value(ValueKind.BOOLEAN, "false", null, null);
  }

  public static ExpressionTree binary(
      BinaryOperation operation, ExpressionTree left, ExpressionTree right) {
    return new ExpressionTree.Binary(operation, left, right, null);
  }

  public static ExpressionTree add(ExpressionTree left, ExpressionTree right) {
    return binary(BinaryOperation.ADD, left, right);
  }

  public static ExpressionTree eq(ExpressionTree left, ExpressionTree right) {
    return binary(BinaryOperation.EQ, left, right);
  }

  public static ExpressionTree not(ExpressionTree inner) {
    return new ExpressionTree.Unary(UnaryOperation.NOT, inner, null);
  }

  public static ExpressionTree neg(ExpressionTree inner) {
    return new ExpressionTree.Unary(UnaryOperation.NEGATE, inner, null);
  }

  public static ExpressionTree ternary(
      ExpressionTree condition, ExpressionTree ifTrue, ExpressionTree ifFalse) {
    return new ExpressionTree.Ternary(condition, ifTrue, ifFalse, null);
  }

  public static ExpressionTree array(ExpressionTree... elements) {
    ImmutableList.Builder<ArrayElement> builder = ImmutableList.builder();
    for (ExpressionTree element : elements) {
      builder.add(new ArrayElement(element, false));
    }
    return new ExpressionTree.ArrayInline(builder.build(), null);
  }

  public static ArrayElement spread(ExpressionTree array) {
    return new ArrayElement(array, true);
  }

  public static ExpressionTree arrayOf(ArrayElement... elements) {
    return new ExpressionTree.ArrayInline(Arrays.asList(elements), null);
  }

  public static ExpressionTree arrayInit(ExpressionTree element, int length) {
    return new ExpressionTree.ArrayInit(element, length, null);
  }

  public static ExpressionTree index(ExpressionTree array, ExpressionTree index) {
    return new ExpressionTree.ArrayAccess(array, index, null);
  }

  public static ExpressionTree tuple(ExpressionTree... elements) {
    return new ExpressionTree.TupleInit(Arrays.asList(elements), null);
  }

  public static ExpressionTree tupleAccess(ExpressionTree tuple, int index) {
    return new ExpressionTree.TupleAccess(tuple, index, null);
  }

  public static ExpressionTree.MemberInit init(String name, @Nullable ExpressionTree value) {
    return new ExpressionTree.MemberInit(Identifier.of(name), value);
  }

  public static ExpressionTree circuitInit(String name, ExpressionTree.MemberInit... members) {
    return new ExpressionTree.CircuitInit(Identifier.of(name), Arrays.asList(members), null);
  }

  public static ExpressionTree member(ExpressionTree circuit, String name) {
    return new ExpressionTree.MemberAccess(circuit, Identifier.of(name), null);
  }

  public static ExpressionTree staticMember(String circuit, String name) {
    return new ExpressionTree.StaticAccess(name(circuit), Identifier.of(name), null);
  }

  public static ExpressionTree call(ExpressionTree function, ExpressionTree... arguments) {
    return new ExpressionTree.Call(function, Arrays.asList(arguments), null);
  }

  public static ExpressionTree call(String function, ExpressionTree... arguments) {
    return call(name(function), arguments);
  }

  // Statements

  public static StatementTree returnNode(ExpressionTree expression) {
    return new StatementTree.Return(expression, null);
  }

  public static StatementTree let(String name, @Nullable TypeTree type, ExpressionTree value) {
    return new StatementTree.Definition(
        DeclarationKind.LET, ImmutableList.of(Identifier.of(name)), type, value, null);
  }

  public static StatementTree constant(
      String name, @Nullable TypeTree type, ExpressionTree value) {
    return new StatementTree.Definition(
        DeclarationKind.CONST, ImmutableList.of(Identifier.of(name)), type, value, null);
  }

  /** {@code let (names...) = value;}. */
  public static StatementTree destructure(List<String> names, ExpressionTree value) {
    checkArgument(names.size() > 1, "destructuring needs several names");
    ImmutableList.Builder<Identifier> variables = ImmutableList.builder();
    for (String name : names) {
      variables.add(Identifier.of(name));
    }
    return new StatementTree.Definition(DeclarationKind.LET, variables.build(), null, value, null);
  }

  public static StatementTree assign(String name, ExpressionTree value) {
    return assign(AssignOperation.ASSIGN, name, ImmutableList.of(), value);
  }

  public static StatementTree assign(
      AssignOperation operation,
      String name,
      List<StatementTree.AssigneeAccess> accesses,
      ExpressionTree value) {
    return new StatementTree.Assign(
        operation, new StatementTree.Assignee(Identifier.of(name), accesses), value, null);
  }

  public static StatementTree ifNode(ExpressionTree condition, Block block) {
    return new StatementTree.Conditional(condition, block, null, null);
  }

  public static StatementTree ifNode(ExpressionTree condition, Block block, StatementTree next) {
    checkArgument(
        next instanceof Block || next instanceof StatementTree.Conditional,
        "else branch must be a block or a conditional: %s",
        next);
    return new StatementTree.Conditional(condition, block, next, null);
  }

  public static StatementTree forNode(
      String variable, ExpressionTree start, ExpressionTree stop, Block block) {
    return new StatementTree.Iteration(Identifier.of(variable), start, stop, false, block, null);
  }

  public static StatementTree assertNode(ExpressionTree condition) {
    return new StatementTree.Console(
        StatementTree.ConsoleFunction.ASSERT, null, ImmutableList.of(condition), null);
  }

  public static StatementTree log(String format, ExpressionTree... arguments) {
    return new StatementTree.Console(
        StatementTree.ConsoleFunction.LOG, format, Arrays.asList(arguments), null);
  }

  public static StatementTree exprResult(ExpressionTree expression) {
    return new StatementTree.Expression(expression, null);
  }

  public static Block block(StatementTree... statements) {
    return new Block(Arrays.asList(statements), null);
  }

  // Declarations

  public static FunctionInput param(String name, TypeTree type) {
    return new FunctionInput.Variable(Identifier.of(name), false, false, type, null);
  }

  public static FunctionInput constParam(String name, TypeTree type) {
    return new FunctionInput.Variable(Identifier.of(name), true, false, type, null);
  }

  public static FunctionInput mutParam(String name, TypeTree type) {
    return new FunctionInput.Variable(Identifier.of(name), false, true, type, null);
  }

  public static FunctionInput self() {
    return new FunctionInput.SelfKeyword(FunctionInput.SelfKind.SELF, null);
  }

  public static FunctionInput constSelf() {
    return new FunctionInput.SelfKeyword(FunctionInput.SelfKind.CONST_SELF, null);
  }

  public static FunctionInput mutSelf() {
    return new FunctionInput.SelfKeyword(FunctionInput.SelfKind.MUT_SELF, null);
  }

  public static FunctionDecl function(
      String name, List<FunctionInput> inputs, @Nullable TypeTree output, Block body) {
    return new FunctionDecl(
        Identifier.of(name), inputs, output, body, ImmutableList.<String>of(), null);
  }

  public static FunctionDecl testFunction(String name, Block body) {
    return new FunctionDecl(
        Identifier.of(name), ImmutableList.of(), null, body, ImmutableList.of("test"), null);
  }

  public static CircuitDecl.Member fieldMember(String name, TypeTree type) {
    return new CircuitDecl.Field(Identifier.of(name), type);
  }

  public static CircuitDecl.Member method(FunctionDecl function) {
    return new CircuitDecl.Method(function);
  }

  public static CircuitDecl circuit(String name, CircuitDecl.Member... members) {
    return new CircuitDecl(Identifier.of(name), Arrays.asList(members), null);
  }

  public static ImportDecl importStar(String... packagePath) {
    return new ImportDecl(Arrays.asList(packagePath), true, ImmutableList.of(), null);
  }

  public static ImportDecl importSymbols(List<String> packagePath, ImportDecl.Symbol... symbols) {
    return new ImportDecl(packagePath, false, Arrays.asList(symbols), null);
  }

  public static ImportDecl.Symbol symbol(String name, @Nullable String alias) {
    return new ImportDecl.Symbol(Identifier.of(name), alias == null ? null : Identifier.of(alias));
  }

  public static ProgramTree program(
      String name, List<CircuitDecl> circuits, List<FunctionDecl> functions) {
    return new ProgramTree(name, ImmutableList.of(), circuits, functions);
  }
}
