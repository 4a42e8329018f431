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
import java.math.BigInteger;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** {@code array[index]}. */
public final class ArrayAccessExpression extends Expression {
  private final Slot<Expression> array;
  private final Slot<Expression> index;

  ArrayAccessExpression(
      AsgContext context, @Nullable Span span, Expression array, Expression index) {
    super(context, span);
    this.array = new Slot<>(array);
    this.index = new Slot<>(index);
  }

  public Expression getArray() {
    return array.get();
  }

  public Expression getIndex() {
    return index.get();
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(array, index);
  }

  @Override
  public Type getType() {
    return ((Type.Array) array.get().getType()).element();
  }

  @Override
  public boolean isMutRef() {
    return array.get().isMutRef();
  }

  @Override
  public @Nullable ConstValue constValue() {
    ConstValue a = array.get().constValue();
    ConstValue i = index.get().constValue();
    if (!(a instanceof ConstValue.Array) || !(i instanceof ConstValue.Int)) {
      return null;
    }
    List<ConstValue> elements = ((ConstValue.Array) a).elements();
    BigInteger position = ((ConstValue.Int) i).value();
    if (position.signum() < 0 || position.compareTo(BigInteger.valueOf(elements.size())) >= 0) {
      return null;
    }
    return elements.get(position.intValue());
  }

  @Override
  public boolean isConsty() {
    return array.get().isConsty() && index.get().isConsty();
  }
}
