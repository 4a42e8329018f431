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

import static com.circuitlang.asg.AsgConvertErrors.FORMAT_ARGUMENT_MISMATCH;
import static com.circuitlang.asg.AsgConvertErrors.ILLEGAL_AST_STRUCTURE;
import static com.circuitlang.asg.AsgConvertErrors.IMMUTABLE_ASSIGNMENT;
import static com.circuitlang.asg.AsgConvertErrors.INDEX_OUT_OF_BOUNDS;
import static com.circuitlang.asg.AsgConvertErrors.UNEXPECTED_NONCONST;
import static com.circuitlang.asg.AsgConvertErrors.UNEXPECTED_TYPE;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_REFERENCE;

import com.circuitlang.ast.AssignOperation;
import com.circuitlang.ast.BinaryOperation;
import com.circuitlang.ast.Identifier;
import com.circuitlang.ast.IntegerType;
import com.circuitlang.ast.StatementTree;
import com.circuitlang.ast.StatementTree.ConsoleFunction;
import com.circuitlang.ast.StatementTree.DeclarationKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Converts syntax tree statements into graph statements. Every block gets its own scope;
 * definitions declare their variables after the value is converted, so a definition can read
 * an outer variable of the same name.
 */
final class StatementConverter {
  private static final String FORMAT_CONTAINER = "{}";

  private final AsgContext context;
  private final ExpressionConverter expressions;

  StatementConverter(AsgContext context, ExpressionConverter expressions) {
    this.context = context;
    this.expressions = expressions;
  }

  Statement convert(Scope scope, StatementTree tree) throws AsgConvertException {
    if (tree instanceof StatementTree.Return) {
      return convertReturn(scope, (StatementTree.Return) tree);
    } else if (tree instanceof StatementTree.Definition) {
      return convertDefinition(scope, (StatementTree.Definition) tree);
    } else if (tree instanceof StatementTree.Assign) {
      return convertAssign(scope, (StatementTree.Assign) tree);
    } else if (tree instanceof StatementTree.Conditional) {
      return convertConditional(scope, (StatementTree.Conditional) tree);
    } else if (tree instanceof StatementTree.Iteration) {
      return convertIteration(scope, (StatementTree.Iteration) tree);
    } else if (tree instanceof StatementTree.Console) {
      return convertConsole(scope, (StatementTree.Console) tree);
    } else if (tree instanceof StatementTree.Expression) {
      StatementTree.Expression statement = (StatementTree.Expression) tree;
      Expression expression = expressions.convert(scope, statement.expression(), null);
      return finish(new ExpressionStatement(context, statement.span(), expression));
    } else if (tree instanceof StatementTree.Block) {
      return convertBlock(scope, (StatementTree.Block) tree);
    }
    throw AsgConvertException.of(tree.span(), ILLEGAL_AST_STRUCTURE, "unknown statement " + tree);
  }

  private <T extends Statement> T finish(T statement) {
    context.alloc(statement);
    statement.enforceParents();
    return statement;
  }

  BlockStatement convertBlock(Scope scope, StatementTree.Block tree) throws AsgConvertException {
    Scope blockScope = scope.makeSubscope();
    List<Statement> statements = new ArrayList<>();
    for (StatementTree statement : tree.statements()) {
      statements.add(convert(blockScope, statement));
    }
    return finish(new BlockStatement(context, tree.span(), statements, blockScope));
  }

  private Statement convertReturn(Scope scope, StatementTree.Return tree)
      throws AsgConvertException {
    Function function = scope.getFunction();
    if (function == null) {
      throw AsgConvertException.of(tree.span(), ILLEGAL_AST_STRUCTURE, "return outside function");
    }
    Expression value =
        expressions.convert(scope, tree.expression(), function.getOutput().partial());
    return finish(new ReturnStatement(context, tree.span(), value));
  }

  private Statement convertDefinition(Scope scope, StatementTree.Definition tree)
      throws AsgConvertException {
    List<Identifier> names = tree.variables();
    Type declared = tree.type() == null ? null : scope.resolveDeclaredType(tree.type());
    PartialType hint;
    if (declared != null) {
      hint = declared.partial();
    } else if (names.size() > 1) {
      hint = new PartialType.TupleHint(Collections.nCopies(names.size(), null));
    } else {
      hint = null;
    }
    Expression value = expressions.convert(scope, tree.value(), hint);
    Type type = value.getType();
    if (names.size() > 1
        && (!(type instanceof Type.Tuple)
            || ((Type.Tuple) type).elements().size() != names.size())) {
      throw AsgConvertException.of(
          tree.span(), UNEXPECTED_TYPE, "tuple of " + names.size(), type.toString());
    }
    boolean isConst = tree.kind() == DeclarationKind.CONST;
    if (isConst && !value.isConsty()) {
      throw AsgConvertException.of(tree.value().span(), UNEXPECTED_NONCONST);
    }

    List<Variable> variables = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      Identifier name = names.get(i);
      Type variableType = names.size() == 1 ? type : ((Type.Tuple) type).elements().get(i);
      variables.add(
          context.alloc(
              new Variable(
                  context,
                  name.name(),
                  name.span(),
                  variableType,
                  !isConst,
                  isConst,
                  Variable.Declaration.DEFINITION)));
    }
    for (Variable variable : variables) {
      scope.declareVariable(variable);
    }
    DefinitionStatement statement =
        finish(new DefinitionStatement(context, tree.span(), variables, value));
    for (Variable variable : variables) {
      variable.addAssignment(statement);
    }
    return statement;
  }

  private Statement convertAssign(Scope scope, StatementTree.Assign tree)
      throws AsgConvertException {
    Identifier name = tree.assignee().identifier();
    Variable variable = scope.resolveVariable(name.name());
    if (variable == null) {
      throw AsgConvertException.of(name.span(), UNRESOLVED_REFERENCE, name.name());
    }
    if (!variable.isMutable()) {
      throw AsgConvertException.of(tree.span(), IMMUTABLE_ASSIGNMENT, name.name());
    }

    Type type = variable.getType();
    List<AssignStatement.Access> accesses = new ArrayList<>();
    for (StatementTree.AssigneeAccess access : tree.assignee().accesses()) {
      if (access instanceof StatementTree.ArrayIndex) {
        if (!(type instanceof Type.Array)) {
          throw AsgConvertException.of(tree.span(), UNEXPECTED_TYPE, "array", type.toString());
        }
        Expression index =
            expressions.convert(
                scope,
                ((StatementTree.ArrayIndex) access).index(),
                new PartialType.IntegerHint(null, IntegerType.U32));
        accesses.add(new AssignStatement.ArrayIndex(index));
        type = ((Type.Array) type).element();
      } else if (access instanceof StatementTree.TupleIndex) {
        int index = ((StatementTree.TupleIndex) access).index();
        if (!(type instanceof Type.Tuple)) {
          throw AsgConvertException.of(tree.span(), UNEXPECTED_TYPE, "tuple", type.toString());
        }
        List<Type> elements = ((Type.Tuple) type).elements();
        if (index < 0 || index >= elements.size()) {
          throw AsgConvertException.of(
              tree.span(),
              INDEX_OUT_OF_BOUNDS,
              String.valueOf(index),
              type.toString(),
              String.valueOf(elements.size()));
        }
        accesses.add(new AssignStatement.TupleIndex(index));
        type = elements.get(index);
      } else if (access instanceof StatementTree.Member) {
        Identifier member = ((StatementTree.Member) access).name();
        if (!(type instanceof Type.CircuitRef)) {
          throw AsgConvertException.of(tree.span(), UNEXPECTED_TYPE, "circuit", type.toString());
        }
        Circuit circuit = ((Type.CircuitRef) type).circuit();
        CircuitMember field = ExpressionConverter.member(circuit, member.name(), member.span());
        if (!(field instanceof CircuitMember.Field)) {
          throw AsgConvertException.of(
              member.span(), IMMUTABLE_ASSIGNMENT, circuit.getName() + "::" + member.name());
        }
        accesses.add(new AssignStatement.Member(member.name()));
        type = ((CircuitMember.Field) field).type();
      } else {
        throw AsgConvertException.of(
            tree.span(), ILLEGAL_AST_STRUCTURE, "unknown assignee access " + access);
      }
    }

    AssignOperation operation = tree.operation();
    BinaryOperation compound = operation.binaryOperation();
    if (compound != null && !ExpressionConverter.isArithmetic(compound, type)) {
      throw AsgConvertException.of(
          tree.span(),
          UNEXPECTED_TYPE,
          ExpressionConverter.arithmeticTypes(compound),
          type.toString());
    }
    Expression value = expressions.convert(scope, tree.value(), type.partial());
    AssignStatement statement =
        finish(new AssignStatement(context, tree.span(), operation, variable, accesses, value));
    variable.addAssignment(statement);
    return statement;
  }

  private Statement convertConditional(Scope scope, StatementTree.Conditional tree)
      throws AsgConvertException {
    Expression condition = expressions.convert(scope, tree.condition(), Type.BOOLEAN.partial());
    BlockStatement result = convertBlock(scope, tree.block());
    Statement next = null;
    StatementTree nextTree = tree.next();
    if (nextTree instanceof StatementTree.Block) {
      next = convertBlock(scope, (StatementTree.Block) nextTree);
    } else if (nextTree instanceof StatementTree.Conditional) {
      next = convertConditional(scope, (StatementTree.Conditional) nextTree);
    } else if (nextTree != null) {
      throw AsgConvertException.of(
          nextTree.span(), ILLEGAL_AST_STRUCTURE, "else branch is neither a block nor an if");
    }
    return finish(new ConditionalStatement(context, tree.span(), condition, result, next));
  }

  private Statement convertIteration(Scope scope, StatementTree.Iteration tree)
      throws AsgConvertException {
    Expression start =
        expressions.convert(
            scope, tree.start(), new PartialType.IntegerHint(null, IntegerType.U32));
    Expression stop = expressions.convert(scope, tree.stop(), start.getType().partial());
    if (!start.isConsty()) {
      throw AsgConvertException.of(tree.start().span(), UNEXPECTED_NONCONST);
    }
    if (!stop.isConsty()) {
      throw AsgConvertException.of(tree.stop().span(), UNEXPECTED_NONCONST);
    }

    Scope loopScope = scope.makeSubscope();
    Variable variable =
        context.alloc(
            new Variable(
                context,
                tree.variable().name(),
                tree.variable().span(),
                start.getType(),
                false,
                false,
                Variable.Declaration.ITERATION_DEFINITION));
    loopScope.declareVariable(variable);
    BlockStatement body = convertBlock(loopScope, tree.block());
    return finish(
        new IterationStatement(
            context, tree.span(), variable, start, stop, tree.inclusive(), body));
  }

  private Statement convertConsole(Scope scope, StatementTree.Console tree)
      throws AsgConvertException {
    List<Expression> arguments = new ArrayList<>();
    if (tree.function() == ConsoleFunction.ASSERT) {
      if (tree.arguments().size() != 1) {
        throw AsgConvertException.of(
            tree.span(), ILLEGAL_AST_STRUCTURE, "console.assert takes one argument");
      }
      arguments.add(expressions.convert(scope, tree.arguments().get(0), Type.BOOLEAN.partial()));
    } else {
      String format = tree.format();
      if (format == null) {
        throw AsgConvertException.of(
            tree.span(), ILLEGAL_AST_STRUCTURE, "console output without format string");
      }
      int containers = countContainers(format);
      if (containers != tree.arguments().size()) {
        throw AsgConvertException.of(
            tree.span(),
            FORMAT_ARGUMENT_MISMATCH,
            String.valueOf(containers),
            String.valueOf(tree.arguments().size()));
      }
      for (var argument : tree.arguments()) {
        arguments.add(expressions.convert(scope, argument, null));
      }
    }
    return finish(
        new ConsoleStatement(context, tree.span(), tree.function(), tree.format(), arguments));
  }

  static int countContainers(String format) {
    int count = 0;
    for (int i = format.indexOf(FORMAT_CONTAINER);
        i >= 0;
        i = format.indexOf(FORMAT_CONTAINER, i + FORMAT_CONTAINER.length())) {
      count++;
    }
    return count;
  }
}
