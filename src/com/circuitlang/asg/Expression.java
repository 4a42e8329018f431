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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.circuitlang.ast.Span;
import org.jspecify.annotations.Nullable;

/** A typed expression of the semantic graph. */
public abstract class Expression extends Node {

  Expression(AsgContext context, @Nullable Span span) {
    super(context, span);
  }

  /** The type of the value this expression produces. */
  public abstract Type getType();

  /** Whether this expression denotes a place that a {@code mut self} method may modify. */
  public abstract boolean isMutRef();

  /** The statically known value, or null. */
  public abstract @Nullable ConstValue constValue();

  /** Whether the value is known without any circuit input, i.e. every operand is consty. */
  public abstract boolean isConsty();

  /**
   * Replaces this expression in its parent with {@code replacement}, which must have a compatible
   * type. The replacement's parent is set; this node is detached.
   */
  public final void replaceWith(Expression replacement) {
    Node parent = getParent();
    checkState(parent != null, "cannot replace detached %s", this);
    checkArgument(
        getType().partial().matches(replacement.getType()),
        "replacement type %s does not match %s",
        replacement.getType(),
        getType());
    parent.replaceChild(this, replacement);
  }
}
