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
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Supplies the programs named by import declarations. */
public interface ImportResolver {
  /** Resolves nothing; every import fails. */
  ImportResolver NONE = (context, options, packagePath, span) -> null;

  /**
   * Returns the program for {@code packagePath}, built into {@code context}, or null when there is
   * no such package.
   */
  @Nullable Program resolvePackage(
      AsgContext context, AsgOptions options, List<String> packagePath, @Nullable Span span)
      throws AsgConvertException;
}
