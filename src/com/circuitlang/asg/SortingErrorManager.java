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
import java.util.Comparator;
import java.util.Objects;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * An error manager that sorts all errors and warnings reported to it. Subclasses decide how the
 * sorted diagnostics are printed by overriding {@link #println} and {@link #printSummary}.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, AsgError error) {
    if (!level.isOn()) {
      return;
    }
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        if (error.defaultLevel() == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<AsgError> getErrors() {
    return collect(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<AsgError> getWarnings() {
    return collect(CheckLevel.WARNING);
  }

  private ImmutableList<AsgError> collect(CheckLevel level) {
    ImmutableList.Builder<AsgError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /** Prints one diagnostic. Does nothing by default. */
  protected void println(CheckLevel level, AsgError error) {}

  /** Prints the number of errors and warnings. Does nothing by default. */
  protected void printSummary() {}

  /**
   * Orders diagnostics lexically on (level, source name, line number, column, description).
   * Errors come before warnings; diagnostics without a location come first within a level.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // check level
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }

      // sourceName comparison
      String source1 = p1.error.sourceName();
      String source2 = p2.error.sourceName();
      if (source1 != null && source2 != null) {
        int sourceCompare = source1.compareTo(source2);
        if (sourceCompare != 0) {
          return sourceCompare;
        }
      } else if (source1 == null && source2 != null) {
        return P1_LT_P2;
      } else if (source1 != null && source2 == null) {
        return P1_GT_P2;
      }

      // lineno comparison
      int lineno1 = p1.error.lineNumber();
      int lineno2 = p2.error.lineNumber();
      if (lineno1 != lineno2) {
        return Integer.compare(lineno1, lineno2);
      }

      // charno comparison
      int charno1 = p1.error.charno();
      int charno2 = p2.error.charno();
      if (charno1 != charno2) {
        return Integer.compare(charno1, charno2);
      }

      // description
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final AsgError error;
    final CheckLevel level;

    ErrorWithLevel(AsgError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(
          level, error.description(), error.sourceName(), error.lineNumber(), error.charno());
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return level == e.level
          && error.description().equals(e.error.description())
          && Objects.equals(error.sourceName(), e.error.sourceName())
          && error.lineNumber() == e.error.lineNumber()
          && error.charno() == e.error.charno();
    }
  }
}
