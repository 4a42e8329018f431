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

import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A named storage location. Every expression reading the variable and every statement writing it
 * is recorded, in conversion order, for later passes.
 */
public final class Variable {
  /** The name of the receiver variable inside instance methods. */
  public static final String SELF_NAME = "self";

  /** How the variable was introduced. */
  public enum Declaration {
    PARAMETER,
    DEFINITION,
    ITERATION_DEFINITION,
    /** The receiver of an instance method. */
    SELF
  }

  private final int id;
  private final String name;
  private final @Nullable Span span;
  private final Type type;
  private final boolean mutable;
  private final boolean isConst;
  private final Declaration declaration;
  private final List<Expression> references = new ArrayList<>();
  private final List<Statement> assignments = new ArrayList<>();

  Variable(
      AsgContext context,
      String name,
      @Nullable Span span,
      Type type,
      boolean mutable,
      boolean isConst,
      Declaration declaration) {
    this.id = context.nextId();
    this.name = name;
    this.span = span;
    this.type = type;
    this.mutable = mutable;
    this.isConst = isConst;
    this.declaration = declaration;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public @Nullable Span getSpan() {
    return span;
  }

  public Type getType() {
    return type;
  }

  public boolean isMutable() {
    return mutable;
  }

  public boolean isConst() {
    return isConst;
  }

  public Declaration getDeclaration() {
    return declaration;
  }

  public ImmutableList<Expression> getReferences() {
    return ImmutableList.copyOf(references);
  }

  public ImmutableList<Statement> getAssignments() {
    return ImmutableList.copyOf(assignments);
  }

  void addReference(Expression reference) {
    checkArgument(
        type.equals(reference.getType()),
        "reference of type %s to %s: %s",
        reference.getType(),
        name,
        type);
    references.add(reference);
  }

  void removeReference(Expression reference) {
    checkArgument(references.remove(reference), "%s is not a reference to %s", reference, name);
  }

  /** Recurses through a detached tree, dropping every variable reference in it. */
  static void markReferencesDeleted(Node node) {
    if (node instanceof VariableRef) {
      ((VariableRef) node).getVariable().removeReference((VariableRef) node);
    }
    for (Node child : node.getChildren()) {
      markReferencesDeleted(child);
    }
  }

  void addAssignment(Statement statement) {
    if (statement instanceof AssignStatement) {
      checkArgument(((AssignStatement) statement).getTarget() == this, "assigns another variable");
    } else if (statement instanceof DefinitionStatement) {
      checkArgument(
          ((DefinitionStatement) statement).getVariables().contains(this),
          "defines another variable");
    } else {
      checkArgument(false, "not an assignment: %s", statement);
    }
    assignments.add(statement);
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }
}
