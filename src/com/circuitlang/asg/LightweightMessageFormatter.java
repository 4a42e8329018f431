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

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight message formatter. The format of messages this formatter produces is very compact
 * and to the point:
 *
 * <pre>
 * main.circ:3:12: ERROR - [ASG_UNEXPECTED_TYPE] unexpected type, expected: `u32`, received: `bool`
 *     return true;
 *            ^^^^
 * </pre>
 */
public final class LightweightMessageFormatter implements MessageFormatter {
  private final @Nullable SourceExcerptProvider source;
  private boolean includeLocation = true;
  private boolean includeLevel = true;

  private LightweightMessageFormatter(@Nullable SourceExcerptProvider source) {
    this.source = source;
  }

  public static LightweightMessageFormatter withSource(SourceExcerptProvider source) {
    return new LightweightMessageFormatter(checkNotNull(source));
  }

  /** A formatter for when the client doesn't care about source information. */
  public static LightweightMessageFormatter withoutSource() {
    return new LightweightMessageFormatter(null);
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLocation(boolean includeLocation) {
    this.includeLocation = includeLocation;
    return this;
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLevel(boolean includeLevel) {
    this.includeLevel = includeLevel;
    return this;
  }

  @Override
  public String formatError(AsgError error) {
    return format(error, CheckLevel.ERROR);
  }

  @Override
  public String formatWarning(AsgError warning) {
    return format(warning, CheckLevel.WARNING);
  }

  private String format(AsgError error, CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (includeLocation) {
      appendPosition(b, error.sourceName(), error.lineNumber(), error.charno());
    }
    if (includeLevel) {
      b.append(level).append(" - [").append(error.type().key).append("] ");
    }
    b.append(error.description()).append('\n');

    String sourceName = error.sourceName();
    if (source != null && sourceName != null && error.lineNumber() > 0) {
      String line = source.getSourceLine(sourceName, error.lineNumber());
      if (line != null) {
        b.append(line).append('\n');
        int charno = error.charno();
        // charno == line.length() + 1 means something is missing at the end of the line
        if (charno > 0 && charno <= line.length() + 1) {
          padLine(b, line, charno, error.length());
        }
      }
    }
    return b.toString();
  }

  private static void appendPosition(
      StringBuilder b, @Nullable String sourceName, int lineNumber, int charno) {
    if (sourceName != null) {
      b.append(sourceName);
      if (lineNumber > 0) {
        b.append(':').append(lineNumber);
        if (charno > 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
  }

  /** Underlines the error region, keeping tabs so the carets line up. */
  private static void padLine(StringBuilder b, String line, int charno, int length) {
    for (int i = 0; i < charno - 1; i++) {
      b.append(line.charAt(i) == '\t' ? '\t' : ' ');
    }
    int available = Math.max(1, line.length() - (charno - 1));
    b.append(Strings.repeat("^", length > 0 ? Math.min(length, available) : 1));
    b.append('\n');
  }
}
