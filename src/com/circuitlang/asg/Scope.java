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
import com.circuitlang.ast.TypeTree;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One level of the lexical environment: the program root, a circuit, a function, or a block.
 *
 * <p>Lookups walk the parent chain outward and stop at the first match, so inner declarations
 * shadow outer ones. Declaring a name twice in the same scope is an error; declaring it again in
 * a nested scope is legal.
 */
public final class Scope {
  static final String SELF_TYPE = "Self";

  private final AsgContext context;
  private final int id;
  private final @Nullable Scope parent;
  private @Nullable Function function;
  private @Nullable Circuit circuitSelf;
  private final Map<String, Variable> variables = new LinkedHashMap<>();
  private final Map<String, Function> functions = new LinkedHashMap<>();
  private final Map<String, Circuit> circuits = new LinkedHashMap<>();

  Scope(
      AsgContext context,
      @Nullable Scope parent,
      @Nullable Function function,
      @Nullable Circuit circuitSelf) {
    this.context = context;
    this.id = context.nextId();
    this.parent = parent;
    this.function = function;
    this.circuitSelf = circuitSelf;
  }

  public AsgContext getContext() {
    return context;
  }

  public int getId() {
    return id;
  }

  public @Nullable Scope getParent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  /** The number of scopes between this one and the root. */
  public int getDepth() {
    int depth = 0;
    for (Scope s = parent; s != null; s = s.parent) {
      depth++;
    }
    return depth;
  }

  /** Returns whether this scope is {@code other} or one of its ancestors. */
  public boolean contains(Scope other) {
    for (Scope s = other; s != null; s = s.parent) {
      if (s == this) {
        return true;
      }
    }
    return false;
  }

  /** The function whose body this scope belongs to, or null outside any function. */
  public @Nullable Function getFunction() {
    return function;
  }

  void setFunction(Function function) {
    checkState(this.function == null || this.function == function, "scope already has a function");
    this.function = function;
  }

  /** The circuit that {@code Self} and {@code self} refer to here, or null. */
  public @Nullable Circuit getCircuitSelf() {
    return circuitSelf;
  }

  void setCircuitSelf(Circuit circuit) {
    checkState(circuitSelf == null, "scope already inside circuit %s", circuitSelf);
    this.circuitSelf = circuit;
  }

  /** Allocates a child scope in the same function and circuit. */
  public Scope makeSubscope() {
    return context.alloc(new Scope(context, this, function, circuitSelf));
  }

  public @Nullable Variable resolveVariable(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Variable variable = s.variables.get(name);
      if (variable != null) {
        return variable;
      }
    }
    return null;
  }

  public @Nullable Function resolveFunction(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Function function = s.functions.get(name);
      if (function != null) {
        return function;
      }
    }
    return null;
  }

  /** Resolves a circuit by name; {@code Self} is the enclosing circuit. */
  public @Nullable Circuit resolveCircuit(String name) {
    if (name.equals(SELF_TYPE)) {
      return circuitSelf;
    }
    for (Scope s = this; s != null; s = s.parent) {
      Circuit circuit = s.circuits.get(name);
      if (circuit != null) {
        return circuit;
      }
    }
    return null;
  }

  public void declareVariable(Variable variable) throws AsgConvertException {
    declare(variables, variable.getName(), variable, "variable", variable.getSpan());
  }

  public void declareFunction(String name, Function function) throws AsgConvertException {
    declare(functions, name, function, "function", function.getSpan());
  }

  public void declareCircuit(String name, Circuit circuit) throws AsgConvertException {
    declare(circuits, name, circuit, "circuit", circuit.getSpan());
  }

  private static <T> void declare(
      Map<String, T> table, String name, T value, String kind, @Nullable Span span)
      throws AsgConvertException {
    if (table.containsKey(name)) {
      throw AsgConvertException.of(span, AsgConvertErrors.DUPLICATE_DEFINITION, kind, name);
    }
    table.put(name, value);
  }

  /** Variables declared directly in this scope. */
  public ImmutableMap<String, Variable> getOwnVariables() {
    return ImmutableMap.copyOf(variables);
  }

  /**
   * Resolves a written type against this scope. Circuit names must already be declared.
   *
   * @throws AsgConvertException with {@code UNRESOLVED_CIRCUIT} for an unknown circuit name or
   *     for {@code Self} outside a circuit
   */
  public Type resolveDeclaredType(TypeTree type) throws AsgConvertException {
    if (type instanceof TypeTree.Scalar) {
      switch (((TypeTree.Scalar) type).kind()) {
        case ADDRESS:
          return Type.ADDRESS;
        case BOOLEAN:
          return Type.BOOLEAN;
        case CHAR:
          return Type.CHAR;
        case FIELD:
          return Type.FIELD;
        case GROUP:
          return Type.GROUP;
      }
    } else if (type instanceof TypeTree.Int) {
      return Type.integer(((TypeTree.Int) type).integerType());
    } else if (type instanceof TypeTree.Array) {
      TypeTree.Array array = (TypeTree.Array) type;
      return new Type.Array(resolveDeclaredType(array.element()), array.length());
    } else if (type instanceof TypeTree.Tuple) {
      List<Type> elements = new ArrayList<>();
      for (TypeTree element : ((TypeTree.Tuple) type).elements()) {
        elements.add(resolveDeclaredType(element));
      }
      return new Type.Tuple(elements);
    } else if (type instanceof TypeTree.Named) {
      TypeTree.Named named = (TypeTree.Named) type;
      Circuit circuit = resolveCircuit(named.name().name());
      if (circuit == null) {
        throw AsgConvertException.of(
            named.name().span(), AsgConvertErrors.UNRESOLVED_CIRCUIT, named.name().name());
      }
      return new Type.CircuitRef(circuit);
    } else if (type instanceof TypeTree.SelfType) {
      if (circuitSelf == null) {
        throw AsgConvertException.of(
            ((TypeTree.SelfType) type).span(), AsgConvertErrors.UNRESOLVED_CIRCUIT, SELF_TYPE);
      }
      return new Type.CircuitRef(circuitSelf);
    }
    throw AsgConvertException.of(
        null, AsgConvertErrors.ILLEGAL_AST_STRUCTURE, "unknown type " + type);
  }

  @Override
  public String toString() {
    return "Scope@" + id;
  }
}
