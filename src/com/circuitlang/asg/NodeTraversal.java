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

import org.jspecify.annotations.Nullable;

/** Post-order traversal of the semantic graph. */
public final class NodeTraversal {

  /** Visits each node after its children. */
  public interface Callback {
    void visit(Node n, @Nullable Node parent);
  }

  private NodeTraversal() {}

  /**
   * Traverses {@code root} and everything below it. The children of a node are read before they
   * are visited, so a callback may replace the node it is visiting.
   */
  public static void traverse(Node root, Callback cb) {
    for (Node child : root.getChildren()) {
      traverse(child, cb);
    }
    cb.visit(root, root.getParent());
  }

  /** Traverses the body of every function of {@code program}, methods included. */
  public static void traverseFunctions(Program program, Callback cb) {
    for (Function function : program.getAllFunctions()) {
      BlockStatement body = function.getBody();
      if (body != null) {
        traverse(body, cb);
      }
    }
  }
}
