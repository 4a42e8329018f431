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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A rebindable reference from a node to one of its children. Rewrite passes substitute a child by
 * rebinding its slot; the parent node itself is never reallocated.
 */
public final class Slot<T extends Node> {
  private T value;

  Slot(T value) {
    this.value = checkNotNull(value);
  }

  public T get() {
    return value;
  }

  void set(T value) {
    this.value = checkNotNull(value);
  }

  @Override
  public String toString() {
    return "Slot[" + value + "]";
  }
}
