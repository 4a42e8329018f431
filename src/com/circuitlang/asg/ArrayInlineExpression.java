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

/** {@code [a, ...b, c]}. A spread element contributes every element of an array. */
public final class ArrayInlineExpression extends Expression {
  private final ImmutableList<Slot<Expression>> elements;
  private final ImmutableList<Boolean> spread;
  private final Type.Array type;

  ArrayInlineExpression(
      AsgContext context,
      @Nullable Span span,
      List<Expression> elements,
      List<Boolean> spread,
      Type.Array type) {
    super(context, span);
    checkArgument(elements.size() == spread.size());
    ImmutableList.Builder<Slot<Expression>> slots = ImmutableList.builder();
    for (Expression element : elements) {
      slots.add(new Slot<>(element));
    }
    this.elements = slots.build();
    this.spread = ImmutableList.copyOf(spread);
    this.type = type;
  }

  public int getElementCount() {
    return elements.size();
  }

  public Expression getElement(int i) {
    return elements.get(i).get();
  }

  public boolean isSpread(int i) {
    return spread.get(i);
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.copyOf(elements);
  }

  @Override
  public Type.Array getType() {
    return type;
  }

  @Override
  public boolean isMutRef() {
    return false;
  }

  @Override
  public @Nullable ConstValue constValue() {
    List<ConstValue> values = new ArrayList<>();
    for (int i = 0; i < elements.size(); i++) {
      ConstValue value = elements.get(i).get().constValue();
      if (value == null) {
        return null;
      }
      if (spread.get(i)) {
        values.addAll(((ConstValue.Array) value).elements());
      } else {
        values.add(value);
      }
    }
    return new ConstValue.Array(type.element(), values);
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
