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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Folds a statement tree bottom-up into a single value. Each method receives the statement and
 * the already reduced values of its nested statements; expressions are not visited.
 *
 * @param <T> the reduced value
 * @see ReducerDirector
 */
public interface StatementReducer<T> {
  T reduceReturn(ReturnStatement statement);

  T reduceDefinition(DefinitionStatement statement);

  T reduceAssign(AssignStatement statement);

  T reduceExpression(ExpressionStatement statement);

  T reduceConsole(ConsoleStatement statement);

  T reduceIteration(IterationStatement statement, T body);

  /** {@code otherwise} is null when the conditional has no else branch. */
  T reduceConditional(ConditionalStatement statement, T result, @Nullable T otherwise);

  T reduceBlock(BlockStatement statement, List<T> statements);
}
