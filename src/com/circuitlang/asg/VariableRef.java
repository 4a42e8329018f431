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

import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A read of a variable. */
public final class VariableRef extends Expression {
  private final Variable variable;

  VariableRef(AsgContext context, @Nullable Span span, Variable variable) {
    super(context, span);
    this.variable = variable;
  }

  public Variable getVariable() {
    return variable;
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of();
  }

  @Override
  public Type getType() {
    return variable.getType();
  }

  @Override
  public boolean isMutRef() {
    return variable.isMutable();
  }

  /** The value of an immutable variable defined exactly once from a statically known value. */
  @Override
  public @Nullable ConstValue constValue() {
    DefinitionStatement definition = soleDefinition();
    if (definition == null) {
      return null;
    }
    ConstValue value = definition.getValue().constValue();
    List<Variable> defined = definition.getVariables();
    if (value == null || defined.size() == 1) {
      return value;
    }
    if (!(value instanceof ConstValue.Tuple)) {
      return null;
    }
    return ((ConstValue.Tuple) value).elements().get(defined.indexOf(variable));
  }

  @Override
  public boolean isConsty() {
    if (variable.getDeclaration() == Variable.Declaration.ITERATION_DEFINITION) {
      return true;
    }
    if (variable.isConst() && variable.getDeclaration() == Variable.Declaration.PARAMETER) {
      return true;
    }
    DefinitionStatement definition = soleDefinition();
    return definition != null && definition.getValue().isConsty();
  }

  private @Nullable DefinitionStatement soleDefinition() {
    if (variable.isMutable()) {
      return null;
    }
    List<Statement> assignments = variable.getAssignments();
    if (assignments.size() != 1 || !(assignments.get(0) instanceof DefinitionStatement)) {
      return null;
    }
    return (DefinitionStatement) assignments.get(0);
  }

  @Override
  public String toString() {
    return variable.getName();
  }
}
