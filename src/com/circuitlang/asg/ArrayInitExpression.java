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
import java.util.Collections;
import org.jspecify.annotations.Nullable;

/** {@code [element; length]}. */
public final class ArrayInitExpression extends Expression {
  /** Longest array whose constant value is materialized. Longer ones stay unfolded. */
  static final int MAX_CONST_ELEMENTS = 1 << 16;

  private final Slot<Expression> element;
  private final int length;

  ArrayInitExpression(AsgContext context, @Nullable Span span, Expression element, int length) {
    super(context, span);
    checkArgument(length >= 0, "negative array length %s", length);
    this.element = new Slot<>(element);
    this.length = length;
  }

  public Expression getElement() {
    return element.get();
  }

  public int getLength() {
    return length;
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(element);
  }

  @Override
  public Type.Array getType() {
    return new Type.Array(element.get().getType(), length);
  }

  @Override
  public boolean isMutRef() {
    return false;
  }

  @Override
  public @Nullable ConstValue constValue() {
    if (length > MAX_CONST_ELEMENTS) {
      return null;
    }
    ConstValue value = element.get().constValue();
    if (value == null) {
      return null;
    }
    return new ConstValue.Array(value.getType(), Collections.nCopies(length, value));
  }

  @Override
  public boolean isConsty() {
    return element.get().isConsty();
  }
}
