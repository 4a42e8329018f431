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

import com.google.common.collect.ImmutableList;

/**
 * Whether a statement returns on every path, plus the control flow errors found inside it.
 *
 * <p>Sequencing ({@link #andThen}) is a monoid with identity {@link #NONE}: it returns if either
 * part does. Branching ({@link #both}) returns only if both branches do. Both concatenate errors
 * in order.
 */
public record ReturnPath(boolean returns, ImmutableList<AsgError> errors) {
  public static final ReturnPath NONE = new ReturnPath(false, ImmutableList.of());
  public static final ReturnPath RETURNS = new ReturnPath(true, ImmutableList.of());

  public ReturnPath andThen(ReturnPath next) {
    return new ReturnPath(returns || next.returns, concat(errors, next.errors));
  }

  public ReturnPath both(ReturnPath other) {
    return new ReturnPath(returns && other.returns, concat(errors, other.errors));
  }

  /** The same errors, without the guarantee of returning. */
  public ReturnPath notReturning() {
    return returns ? new ReturnPath(false, errors) : this;
  }

  private static ImmutableList<AsgError> concat(
      ImmutableList<AsgError> first, ImmutableList<AsgError> second) {
    if (first.isEmpty()) {
      return second;
    } else if (second.isEmpty()) {
      return first;
    }
    return ImmutableList.<AsgError>builder().addAll(first).addAll(second).build();
  }
}
