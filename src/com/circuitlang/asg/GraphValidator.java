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
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Walks every function body and validates that the graph is well formed: parent links agree with
 * slots, return values match the function's output, calls match the callee's signature, binary
 * operands agree, and variable reference lists name exactly the references in the graph. Run
 * before and after rewrites to catch passes that break the graph.
 */
public final class GraphValidator implements CompilerPass {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;
  private @Nullable Function currentFunction;

  public GraphValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  /** Creates a validator that throws {@link IllegalStateException} on the first violation. */
  public GraphValidator() {
    this(
        (message, n) -> {
          throw new IllegalStateException(
              message + ". Reference node: " + n + ", parent node: " + n.getParent());
        });
  }

  @Override
  public void process(Program program) {
    for (Function function : program.getAllFunctions()) {
      validateFunction(function);
    }
    validateReferences(program.getContext());
  }

  /** Checks that every recorded variable reference is still part of some function body. */
  private void validateReferences(AsgContext context) {
    Set<Node> bodies = new HashSet<>();
    for (Function function : context.getFunctions()) {
      if (function.getBody() != null) {
        bodies.add(function.getBody());
      }
    }
    for (Variable variable : context.getVariables()) {
      for (Expression reference : variable.getReferences()) {
        Node root = reference;
        while (root.getParent() != null) {
          root = root.getParent();
        }
        if (!bodies.contains(root)) {
          violation(
              "Reference to " + variable.getName() + " is detached from the graph", reference);
        }
      }
    }
  }

  public void validateFunction(Function function) {
    BlockStatement body = function.getBody();
    if (body == null) {
      return;
    }
    currentFunction = function;
    if (body.getParent() != null) {
      violation("Function body of " + function.getName() + " has a parent", body);
    }
    NodeTraversal.traverse(body, (n, parent) -> validateNode(n));
    currentFunction = null;
  }

  private void validateNode(Node n) {
    for (Node child : n.getChildren()) {
      if (child.getParent() != n) {
        violation("Child " + child + " has parent " + child.getParent(), child);
      }
    }
    if (n instanceof VariableRef) {
      Variable variable = ((VariableRef) n).getVariable();
      if (!variable.getReferences().contains(n)) {
        violation("Reference to " + variable.getName() + " is not recorded", n);
      }
    } else if (n instanceof ReturnStatement) {
      validateReturn((ReturnStatement) n);
    } else if (n instanceof CallExpression) {
      validateCall((CallExpression) n);
    } else if (n instanceof BinaryExpression) {
      validateBinary((BinaryExpression) n);
    }
  }

  private void validateReturn(ReturnStatement n) {
    Type output = currentFunction.getOutput();
    Type actual = n.getValue().getType();
    if (!output.partial().matches(actual)) {
      violation("Return of " + actual + " from function returning " + output, n);
    }
  }

  private void validateCall(CallExpression n) {
    Function callee = n.getFunction();
    ImmutableList<Variable> parameters = callee.getParameters().values().asList();
    ImmutableList<Expression> arguments = n.getArguments();
    if (parameters.size() != arguments.size()) {
      violation(
          "Call to " + callee.getName() + " with " + arguments.size() + " argument(s)", n);
      return;
    }
    for (int i = 0; i < parameters.size(); i++) {
      Type expected = parameters.get(i).getType();
      if (!expected.partial().matches(arguments.get(i).getType())) {
        violation(
            "Argument " + i + " of " + callee.getName() + " is not a " + expected,
            arguments.get(i));
      }
    }
  }

  private void validateBinary(BinaryExpression n) {
    Type left = n.getLeft().getType();
    Type right = n.getRight().getType();
    if (!left.equals(right)) {
      violation("Operands of " + n.getOperation() + " disagree: " + left + ", " + right, n);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
