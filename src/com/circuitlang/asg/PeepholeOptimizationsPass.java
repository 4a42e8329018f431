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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.logging.Logger;

/** Runs peephole optimizations over every function body until none of them changes anything. */
public final class PeepholeOptimizationsPass implements CompilerPass {
  private static final Logger logger = Logger.getLogger(PeepholeOptimizationsPass.class.getName());

  private final ImmutableList<AbstractPeepholeOptimization> peepholeOptimizations;

  public PeepholeOptimizationsPass(AbstractPeepholeOptimization... optimizations) {
    this(ImmutableList.copyOf(optimizations));
  }

  public PeepholeOptimizationsPass(List<AbstractPeepholeOptimization> optimizations) {
    this.peepholeOptimizations = ImmutableList.copyOf(optimizations);
  }

  @Override
  public void process(Program program) {
    int iterations = 0;
    boolean changed;
    // Repeat to an internal fixed point.
    do {
      iterations++;
      beginTraversal(program.getContext());
      NodeTraversal.traverseFunctions(program, this::visit);
      changed = false;
      for (AbstractPeepholeOptimization optimization : peepholeOptimizations) {
        changed |= optimization.hasChanged();
      }
    } while (changed);
    logger.fine("Peephole optimizations reached a fixed point after " + iterations + " pass(es)");
  }

  private void visit(Node n, Node parent) {
    Node currentNode = n;
    for (AbstractPeepholeOptimization optim : peepholeOptimizations) {
      currentNode = optim.optimizeSubtree(currentNode);
    }
  }

  private void beginTraversal(AsgContext context) {
    for (AbstractPeepholeOptimization optimization : peepholeOptimizations) {
      optimization.beginTraversal(context);
    }
  }
}
