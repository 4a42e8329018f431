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

/**
 * Replaces every expression that has a compile time value by a {@link Constant} of that value.
 * Expressions already constant, and values whose type differs from the expression's, are left
 * alone.
 */
public final class FoldConstants extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node subtree) {
    if (!(subtree instanceof Expression) || subtree instanceof Constant) {
      return subtree;
    }
    Expression expression = (Expression) subtree;
    if (expression.getParent() == null) {
      return subtree;
    }
    ConstValue value = expression.constValue();
    if (value == null || !value.getType().equals(expression.getType())) {
      return subtree;
    }
    AsgContext context = getContext();
    Constant constant = context.alloc(new Constant(context, expression.getSpan(), value));
    expression.replaceWith(constant);
    markReferencesDeleted(expression);
    reportChange();
    return constant;
  }
}
