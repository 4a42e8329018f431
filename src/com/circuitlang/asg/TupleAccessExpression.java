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
import org.jspecify.annotations.Nullable;

/** {@code tuple.index}; the index is checked against the tuple arity during conversion. */
public final class TupleAccessExpression extends Expression {
  private final Slot<Expression> tuple;
  private final int index;

  TupleAccessExpression(AsgContext context, @Nullable Span span, Expression tuple, int index) {
    super(context, span);
    this.tuple = new Slot<>(tuple);
    this.index = index;
  }

  public Expression getTuple() {
    return tuple.get();
  }

  public int getIndex() {
    return index;
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of(tuple);
  }

  @Override
  public Type getType() {
    return ((Type.Tuple) tuple.get().getType()).elements().get(index);
  }

  @Override
  public boolean isMutRef() {
    return tuple.get().isMutRef();
  }

  @Override
  public @Nullable ConstValue constValue() {
    ConstValue value = tuple.get().constValue();
    if (!(value instanceof ConstValue.Tuple)) {
      return null;
    }
    return ((ConstValue.Tuple) value).elements().get(index);
  }

  @Override
  public boolean isConsty() {
    return tuple.get().isConsty();
  }
}
