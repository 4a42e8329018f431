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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** {@code (a, b, ...)}. */
public final class TupleInitExpression extends Expression {
  private final ImmutableList<Slot<Expression>> elements;

  TupleInitExpression(AsgContext context, @Nullable Span span, List<Expression> elements) {
    super(context, span);
    ImmutableList.Builder<Slot<Expression>> slots = ImmutableList.builder();
    for (Expression element : elements) {
      slots.add(new Slot<>(element));
    }
    this.elements = slots.build();
  }

  public ImmutableList<Expression> getElements() {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    for (Slot<Expression> element : elements) {
      result.add(element.get());
    }
    return result.build();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.copyOf(elements);
  }

  @Override
  public Type.Tuple getType() {
    List<Type> types = new ArrayList<>();
    for (Slot<Expression> element : elements) {
      types.add(element.get().getType());
    }
    return new Type.Tuple(types);
  }

  @Override
  public boolean isMutRef() {
    return false;
  }

  @Override
  public @Nullable ConstValue constValue() {
    List<ConstValue> values = new ArrayList<>();
    for (Slot<Expression> element : elements) {
      ConstValue value = element.get().constValue();
      if (value == null) {
        return null;
      }
      values.add(value);
    }
    return new ConstValue.Tuple(values);
  }

  @Override
  public boolean isConsty() {
    for (Slot<Expression> element : elements) {
      if (!element.get().isConsty()) {
        return false;
      }
    }
    return true;
  }
}
