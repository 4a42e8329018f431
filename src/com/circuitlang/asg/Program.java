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
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** A converted compilation unit: its imports, circuits and free functions. */
public final class Program {
  private final AsgContext context;
  private final String name;
  private final Scope scope;
  private final Map<String, Program> imports = new LinkedHashMap<>();
  private final Map<String, Circuit> circuits = new LinkedHashMap<>();
  private final Map<String, Function> functions = new LinkedHashMap<>();

  Program(AsgContext context, String name, Scope scope) {
    this.context = context;
    this.name = name;
    this.scope = scope;
  }

  public AsgContext getContext() {
    return context;
  }

  public String getName() {
    return name;
  }

  /** The root scope; imported and local circuits and functions are declared here. */
  public Scope getScope() {
    return scope;
  }

  /** Imported programs by package name. */
  public ImmutableMap<String, Program> getImports() {
    return ImmutableMap.copyOf(imports);
  }

  public ImmutableMap<String, Circuit> getCircuits() {
    return ImmutableMap.copyOf(circuits);
  }

  /** Free functions declared in this program. */
  public ImmutableMap<String, Function> getFunctions() {
    return ImmutableMap.copyOf(functions);
  }

  /** Free functions followed by the methods of every local circuit. */
  public ImmutableList<Function> getAllFunctions() {
    ImmutableList.Builder<Function> all = ImmutableList.builder();
    all.addAll(functions.values());
    for (Circuit circuit : circuits.values()) {
      for (CircuitMember member : circuit.getMembers().values()) {
        if (member instanceof CircuitMember.Method) {
          all.add(((CircuitMember.Method) member).function());
        }
      }
    }
    return all.build();
  }

  void addImport(String packageName, Program program) {
    imports.putIfAbsent(packageName, program);
  }

  void addCircuit(Circuit circuit) {
    circuits.put(circuit.getName(), circuit);
  }

  void addFunction(Function function) {
    functions.put(function.getName(), function);
  }

  @Override
  public String toString() {
    return "Program<" + name + ">";
  }
}
