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

import static com.circuitlang.asg.AsgConvertErrors.UNREACHABLE_CODE;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a function body returns on every path. A loop body may run zero times and an
 * if without else may be skipped, so neither counts as returning. In a block, the first statement
 * after one that always returns is reported as unreachable.
 */
public final class ReturnPathReducer implements StatementReducer<ReturnPath> {
  private final String functionName;

  public ReturnPathReducer(String functionName) {
    this.functionName = functionName;
  }

  /** Reduces a whole function body. */
  public static ReturnPath analyze(Function function, BlockStatement body) {
    return new ReducerDirector<>(new ReturnPathReducer(function.getName())).reduceStatement(body);
  }

  @Override
  public ReturnPath reduceReturn(ReturnStatement statement) {
    return ReturnPath.RETURNS;
  }

  @Override
  public ReturnPath reduceDefinition(DefinitionStatement statement) {
    return ReturnPath.NONE;
  }

  @Override
  public ReturnPath reduceAssign(AssignStatement statement) {
    return ReturnPath.NONE;
  }

  @Override
  public ReturnPath reduceExpression(ExpressionStatement statement) {
    return ReturnPath.NONE;
  }

  @Override
  public ReturnPath reduceConsole(ConsoleStatement statement) {
    return ReturnPath.NONE;
  }

  @Override
  public ReturnPath reduceIteration(IterationStatement statement, ReturnPath body) {
    return body.notReturning();
  }

  @Override
  public ReturnPath reduceConditional(
      ConditionalStatement statement, ReturnPath result, @Nullable ReturnPath otherwise) {
    if (otherwise == null) {
      return result.notReturning();
    }
    return result.both(otherwise);
  }

  @Override
  public ReturnPath reduceBlock(BlockStatement block, List<ReturnPath> statements) {
    List<Statement> children = block.getStatements();
    ReturnPath path = ReturnPath.NONE;
    boolean reported = false;
    for (int i = 0; i < statements.size(); i++) {
      if (path.returns() && !reported) {
        path = path.andThen(new ReturnPath(true, ImmutableList.of(unreachable(children.get(i)))));
        reported = true;
      }
      path = path.andThen(statements.get(i));
    }
    return path;
  }

  private AsgError unreachable(Statement statement) {
    return AsgError.make(statement.getSpan(), UNREACHABLE_CODE, functionName);
  }
}
