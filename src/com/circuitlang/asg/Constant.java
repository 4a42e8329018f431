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

/** A literal, or a value computed by constant folding. */
public final class Constant extends Expression {
  private final ConstValue value;

  Constant(AsgContext context, @Nullable Span span, ConstValue value) {
    super(context, span);
    this.value = value;
  }

  public ConstValue getValue() {
    return value;
  }

  @Override
  ImmutableList<Slot<?>> getSlots() {
    return ImmutableList.of();
  }

  @Override
  public Type getType() {
    return value.getType();
  }

  @Override
  public boolean isMutRef() {
    return false;
  }

  @Override
  public ConstValue constValue() {
    return value;
  }

  @Override
  public boolean isConsty() {
    return true;
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
