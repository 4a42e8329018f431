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

/** How a function relates to an instance of its circuit. */
public enum FunctionQualifier {
  /** Declared with {@code self}. */
  SELF_REF,
  /** Declared with {@code const self}. */
  CONST_SELF_REF,
  /** Declared with {@code mut self}; the receiver must be a mutable reference. */
  MUT_SELF_REF,
  /** No receiver. Free functions are always static. */
  STATIC
}
