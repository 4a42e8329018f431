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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An abstract class whose implementations rewrite one small piece of the graph at a time, such as
 * replacing a computable expression by its value.
 */
public abstract class AbstractPeepholeOptimization {

  private AsgContext context;
  private boolean changed;

  /**
   * Given a node to optimize, optimize the node. An optimization that replaces the node performs
   * the replacement, calls {@link #reportChange} and returns the replacement; otherwise it must
   * return {@code subtree}.
   */
  abstract Node optimizeSubtree(Node subtree);

  /** The context new nodes must be allocated in. */
  protected AsgContext getContext() {
    return checkNotNull(context);
  }

  /** Calls {@link Variable#markReferencesDeleted(Node)} */
  protected final void markReferencesDeleted(Node dropped) {
    Variable.markReferencesDeleted(dropped);
  }

  protected void reportChange() {
    changed = true;
  }

  /** Informs the optimization that a traversal will begin. */
  void beginTraversal(AsgContext context) {
    this.context = checkNotNull(context);
    this.changed = false;
  }

  /** Returns whether anything changed since the traversal began. */
  boolean hasChanged() {
    return changed;
  }
}
