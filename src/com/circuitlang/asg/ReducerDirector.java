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

import java.util.ArrayList;
import java.util.List;

/** Walks a statement tree and feeds a {@link StatementReducer} children first. */
public final class ReducerDirector<T> {
  private final StatementReducer<T> reducer;

  public ReducerDirector(StatementReducer<T> reducer) {
    this.reducer = reducer;
  }

  public StatementReducer<T> getReducer() {
    return reducer;
  }

  public T reduceStatement(Statement statement) {
    if (statement instanceof ReturnStatement) {
      return reducer.reduceReturn((ReturnStatement) statement);
    } else if (statement instanceof DefinitionStatement) {
      return reducer.reduceDefinition((DefinitionStatement) statement);
    } else if (statement instanceof AssignStatement) {
      return reducer.reduceAssign((AssignStatement) statement);
    } else if (statement instanceof ExpressionStatement) {
      return reducer.reduceExpression((ExpressionStatement) statement);
    } else if (statement instanceof ConsoleStatement) {
      return reducer.reduceConsole((ConsoleStatement) statement);
    } else if (statement instanceof IterationStatement) {
      IterationStatement iteration = (IterationStatement) statement;
      return reducer.reduceIteration(iteration, reduceStatement(iteration.getBody()));
    } else if (statement instanceof ConditionalStatement) {
      ConditionalStatement conditional = (ConditionalStatement) statement;
      T result = reduceStatement(conditional.getResult());
      Statement next = conditional.getNext();
      return reducer.reduceConditional(
          conditional, result, next == null ? null : reduceStatement(next));
    } else if (statement instanceof BlockStatement) {
      BlockStatement block = (BlockStatement) statement;
      List<T> statements = new ArrayList<>();
      for (Statement child : block.getStatements()) {
        statements.add(reduceStatement(child));
      }
      return reducer.reduceBlock(block, statements);
    }
    throw new IllegalArgumentException("Unexpected statement: " + statement);
  }
}
