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
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** {@code Name { field: value, ... }} with every field of the circuit given exactly once. */
public final class CircuitInitExpression extends Expression {
  private final Circuit circuit;
  private final ImmutableMap<String, Slot<Expression>> values;

  CircuitInitExpression(
      AsgContext context, @Nullable Span span, Circuit circuit, Map<String, Expression> values) {
    super(context, span);
    this.circuit = circuit;
    ImmutableMap.Builder<String, Slot<Expression>> slots = ImmutableMap.builder();
    for (Map.Entry<String, Expression> entry : values.entrySet()) {
      slots.put(entry.getKey(), new Slot<>(entry.getValue()));
    }
    this.values = slots.buildOrThrow();
  }

  public Circuit getCircuit() {
    return circuit;
  }

  /** Field values in the order they were written. */
  public ImmutableMap<String, Expression> getValues() {
    ImmutableMap.Builder<String, Expression> result = ImmutableMap.builder();
    for (Map.Entry<String, Slot<Expression>> entry : values.entrySet()) {
      result.put(entry.getKey(), entry.getValue().get());
    }
    return result.buildOrThrow();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.copyOf(values.values());
  }

  @Override
  public Type getType() {
    return new Type.CircuitRef(circuit);
  }

  @Override
  public boolean isMutRef() {
    return false;
  }

  @Override
  public @Nullable ConstValue constValue() {
    return null;
  }

  @Override
  public boolean isConsty() {
    for (Slot<Expression> value : values.values()) {
      if (!value.get().isConsty()) {
        return false;
      }
    }
    return true;
  }
}
