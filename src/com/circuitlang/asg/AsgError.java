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

import static java.util.Objects.requireNonNull;

import com.circuitlang.ast.Span;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param span Where the error occurred, if known.
 * @param defaultLevel The default level, before a caller demotes or promotes it.
 */
public record AsgError(
    DiagnosticType type, String description, @Nullable Span span, CheckLevel defaultLevel)
    implements Serializable {

  public AsgError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates an AsgError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static AsgError make(DiagnosticType type, String... arguments) {
    return new AsgError(type, type.format(arguments), null, type.level);
  }

  /**
   * Creates an AsgError at a given source location
   *
   * @param span The location, or null when unknown
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static AsgError make(@Nullable Span span, DiagnosticType type, String... arguments) {
    return new AsgError(type, type.format(arguments), span, type.level);
  }

  /** The source file name, or null. */
  public @Nullable String sourceName() {
    return span == null ? null : span.sourceName();
  }

  /** One-indexed line number, or -1 when unknown. */
  public int lineNumber() {
    return span == null ? -1 : span.lineStart();
  }

  /** One-indexed column, or -1 when unknown. */
  public int charno() {
    return span == null ? -1 : span.colStart();
  }

  /** Number of highlighted characters on the first line, or 0 when unknown. */
  public int length() {
    if (span == null || !span.isSingleLine()) {
      return 0;
    }
    return span.colStop() - span.colStart();
  }

  /** Format a message at the given level; null when the level is off. */
  public @Nullable String format(CheckLevel level, MessageFormatter formatter) {
    switch (level) {
      case ERROR:
        return formatter.formatError(this);
      case WARNING:
        return formatter.formatWarning(this);
      default:
        return null;
    }
  }

  @Override
  public String toString() {
    return type.key
        + ". "
        + description
        + " at "
        + (span == null ? "(unknown source)" : span.toString());
  }
}
