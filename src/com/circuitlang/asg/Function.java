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

import static com.google.common.base.Preconditions.checkState;

import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A free function or a circuit method. The signature is known when the function is registered;
 * the body is filled in by a later phase, so that bodies may call functions declared after them.
 *
 * <p>Two functions are equal only if they come from the same declaration.
 */
public final class Function {
  static final String TEST_ANNOTATION = "test";

  private final int id;
  private final String name;
  private final @Nullable Span span;
  private final Type output;
  private final ImmutableMap<String, Variable> parameters;
  private final FunctionQualifier qualifier;
  private final ImmutableList<String> annotations;
  private final Scope scope;
  private @Nullable Circuit circuit;
  private @Nullable BlockStatement body;

  Function(
      AsgContext context,
      String name,
      @Nullable Span span,
      Type output,
      ImmutableMap<String, Variable> parameters,
      FunctionQualifier qualifier,
      ImmutableList<String> annotations,
      Scope parentScope) {
    this.id = context.nextId();
    this.name = name;
    this.span = span;
    this.output = output;
    this.parameters = parameters;
    this.qualifier = qualifier;
    this.annotations = annotations;
    this.scope = parentScope.makeSubscope();
    this.scope.setFunction(this);
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

  /** The declared output type; the unit type when none was written. */
  public Type getOutput() {
    return output;
  }

  /** Parameters in declaration order, excluding any receiver. */
  public ImmutableMap<String, Variable> getParameters() {
    return parameters;
  }

  public FunctionQualifier getQualifier() {
    return qualifier;
  }

  public boolean isStatic() {
    return qualifier == FunctionQualifier.STATIC;
  }

  public ImmutableList<String> getAnnotations() {
    return annotations;
  }

  /** Test functions are run on their own and may not be called. */
  public boolean isTest() {
    return annotations.contains(TEST_ANNOTATION);
  }

  /** The scope holding the parameters. */
  public Scope getScope() {
    return scope;
  }

  /** The circuit declaring this method, or null for a free function. */
  public @Nullable Circuit getCircuit() {
    return circuit;
  }

  void setCircuit(Circuit circuit) {
    checkState(this.circuit == null, "%s already belongs to %s", name, this.circuit);
    this.circuit = circuit;
  }

  /** The body, or null before bodies are converted. */
  public @Nullable BlockStatement getBody() {
    return body;
  }

  void setBody(BlockStatement body) {
    checkState(this.body == null, "body of %s already set", name);
    this.body = body;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof Function)) {
      return false;
    }
    Function that = (Function) o;
    return name.equals(that.name) && id == that.id;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, id);
  }

  @Override
  public String toString() {
    return circuit == null ? name : circuit.getName() + "::" + name;
  }
}
