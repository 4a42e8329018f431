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
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A named aggregate of fields and methods. Members are found by name; there is no inheritance. */
public final class Circuit {
  private final int id;
  private final String name;
  private final @Nullable Span span;
  private final Scope scope;
  private final Map<String, CircuitMember> members = new LinkedHashMap<>();

  Circuit(AsgContext context, String name, @Nullable Span span, Scope parentScope) {
    this.id = context.nextId();
    this.name = name;
    this.span = span;
    this.scope = parentScope.makeSubscope();
    this.scope.setCircuitSelf(this);
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

  /** The scope methods are declared in; {@code Self} resolves to this circuit inside it. */
  public Scope getScope() {
    return scope;
  }

  public @Nullable CircuitMember getMember(String name) {
    return members.get(name);
  }

  public ImmutableMap<String, CircuitMember> getMembers() {
    return ImmutableMap.copyOf(members);
  }

  /** Fields in declaration order. */
  public ImmutableList<CircuitMember.Field> getFields() {
    ImmutableList.Builder<CircuitMember.Field> fields = ImmutableList.builder();
    for (CircuitMember member : members.values()) {
      if (member instanceof CircuitMember.Field) {
        fields.add((CircuitMember.Field) member);
      }
    }
    return fields.build();
  }

  void addMember(CircuitMember member, @Nullable Span span) throws AsgConvertException {
    if (members.containsKey(member.name())) {
      throw AsgConvertException.of(
          span, AsgConvertErrors.DUPLICATE_DEFINITION, "circuit member", member.name());
    }
    members.put(member.name(), member);
  }

  @Override
  public String toString() {
    return name;
  }
}
