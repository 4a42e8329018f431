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

/** Chooses the passes that run after a program is built. */
public final class PassConfig {
  private final AsgOptions options;

  public PassConfig(AsgOptions options) {
    this.options = options;
  }

  public ImmutableList<CompilerPass> getPasses() {
    ImmutableList.Builder<CompilerPass> passes = ImmutableList.builder();
    if (options.shouldValidateGraph()) {
      passes.add(new GraphValidator());
    }
    if (options.shouldFoldConstants()) {
      passes.add(new PeepholeOptimizationsPass(new FoldConstants()));
      if (options.shouldValidateGraph()) {
        passes.add(new GraphValidator());
      }
    }
    return passes.build();
  }
}
