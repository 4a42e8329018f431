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
package com.circuitlang.ast;

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/**
 * A region of source text. Lines and columns are one-indexed; {@code colStop} is exclusive.
 *
 * @param sourceName Name of the source the region belongs to, if known.
 * @param lineStart First line of the region.
 * @param lineStop Last line of the region.
 * @param colStart Column of the first character on {@code lineStart}.
 * @param colStop Column just past the last character on {@code lineStop}.
 */
public record Span(
    @Nullable String sourceName, int lineStart, int lineStop, int colStart, int colStop) {

  public Span {
    checkArgument(lineStart <= lineStop, "Recorded bad position information: %s > %s",
        lineStart, lineStop);
    checkArgument(lineStart != lineStop || colStart <= colStop,
        "Recorded bad position information: %s > %s", colStart, colStop);
  }

  /** A single-line region. */
  public static Span of(@Nullable String sourceName, int line, int colStart, int colStop) {
    return new Span(sourceName, line, line, colStart, colStop);
  }

  public boolean isSingleLine() {
    return lineStart == lineStop;
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    if (sourceName != null) {
      b.append(sourceName).append(':');
    }
    b.append(lineStart).append(':').append(colStart);
    return b.toString();
  }
}
