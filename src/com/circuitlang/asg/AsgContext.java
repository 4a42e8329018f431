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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Owns every entity of one semantic graph: nodes, variables, functions, circuits and scopes.
 * Entities are registered once and never removed; a node that a rewrite pass replaces stays here
 * until the whole context is dropped.
 *
 * <p>A context is confined to a single thread. Separate contexts share nothing and may be used in
 * parallel.
 */
public final class AsgContext {
  private int nextId = 0;
  private final List<Node> nodes = new ArrayList<>();
  private final List<Variable> variables = new ArrayList<>();
  private final List<Function> functions = new ArrayList<>();
  private final List<Circuit> circuits = new ArrayList<>();
  private final List<Scope> scopes = new ArrayList<>();
  private final Map<String, Program> packages = new HashMap<>();
  private final List<AsgError> warnings = new ArrayList<>();

  /** Returns a fresh id. Ids are never reused within a context. */
  public int nextId() {
    return nextId++;
  }

  @CanIgnoreReturnValue
  public <T extends Expression> T alloc(T expression) {
    nodes.add(expression);
    return expression;
  }

  @CanIgnoreReturnValue
  public <T extends Statement> T alloc(T statement) {
    nodes.add(statement);
    return statement;
  }

  @CanIgnoreReturnValue
  public Variable alloc(Variable variable) {
    variables.add(variable);
    return variable;
  }

  @CanIgnoreReturnValue
  public Function alloc(Function function) {
    functions.add(function);
    return function;
  }

  @CanIgnoreReturnValue
  public Circuit alloc(Circuit circuit) {
    circuits.add(circuit);
    return circuit;
  }

  @CanIgnoreReturnValue
  public Scope alloc(Scope scope) {
    scopes.add(scope);
    return scope;
  }

  /** Allocates a scope without a parent. */
  public Scope makeRootScope() {
    return alloc(new Scope(this, null, null, null));
  }

  public ImmutableList<Node> getNodes() {
    return ImmutableList.copyOf(nodes);
  }

  public ImmutableList<Variable> getVariables() {
    return ImmutableList.copyOf(variables);
  }

  public ImmutableList<Function> getFunctions() {
    return ImmutableList.copyOf(functions);
  }

  public ImmutableList<Circuit> getCircuits() {
    return ImmutableList.copyOf(circuits);
  }

  /** The program already built for {@code packageName} in this context, or null. */
  public @Nullable Program getPackage(String packageName) {
    return packages.get(packageName);
  }

  /** Records the program built for an imported package so later imports share it. */
  void addPackage(String packageName, Program program) {
    checkState(
        packages.putIfAbsent(packageName, program) == null,
        "package %s built twice",
        packageName);
  }

  /** Keeps a diagnostic that did not stop conversion until the driver reports it. */
  void addWarning(AsgError warning) {
    warnings.add(warning);
  }

  /** Returns the diagnostics added since the last call and forgets them. */
  public ImmutableList<AsgError> takeWarnings() {
    ImmutableList<AsgError> taken = ImmutableList.copyOf(warnings);
    warnings.clear();
    return taken;
  }

  public int getScopeCount() {
    return scopes.size();
  }
}
