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

import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Group a set of related diagnostic types together, so that callers can map them to one exit
 * code or toggle them as one unit.
 */
public final class DiagnosticGroup implements Serializable {
  private static final long serialVersionUID = 1;

  // The set of types represented by this group, hashed by key.
  private final ImmutableSet<DiagnosticType> types;

  // A human-readable name for the group.
  private final @Nullable String name;

  /** Create a group that matches all errors of the given types. */
  DiagnosticGroup(String name, DiagnosticType... types) {
    this.name = name;
    this.types = ImmutableSet.copyOf(types);
  }

  /** Create a composite group. */
  public DiagnosticGroup(String name, DiagnosticGroup... groups) {
    ImmutableSet.Builder<DiagnosticType> set = ImmutableSet.builder();
    for (DiagnosticGroup group : groups) {
      set.addAll(group.types);
    }
    this.name = name;
    this.types = set.build();
  }

  /** Returns whether the given error's type matches a type in this group. */
  public boolean matches(AsgError error) {
    return matches(error.type());
  }

  /** Returns whether the given type matches a type in this group. */
  public boolean matches(DiagnosticType type) {
    return types.contains(type);
  }

  /** Returns whether all of the types in the given group are in this group. */
  boolean isSubGroup(DiagnosticGroup group) {
    return types.containsAll(group.types);
  }

  public ImmutableSet<DiagnosticType> getTypes() {
    return types;
  }

  public @Nullable String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name == null ? super.toString() : "DiagnosticGroup<" + name + ">";
  }
}
