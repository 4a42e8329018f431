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

import java.util.LinkedHashMap;
import java.util.Map;

/** Settings for one {@link AsgCompiler} run. */
public class AsgOptions {

  /** How many control flow errors a failing function reports. */
  public enum ReturnPathErrorMode {
    /** Only the first error is reported. */
    FIRST,
    /** Every error the return path analysis finds is reported, in order. */
    ALL
  }

  private ReturnPathErrorMode returnPathErrorMode = ReturnPathErrorMode.FIRST;
  private boolean foldConstants = true;
  private boolean validateGraph = true;
  private ImportResolver importResolver = ImportResolver.NONE;
  private final Map<DiagnosticGroup, CheckLevel> warningLevels = new LinkedHashMap<>();

  public ReturnPathErrorMode getReturnPathErrorMode() {
    return returnPathErrorMode;
  }

  public void setReturnPathErrorMode(ReturnPathErrorMode returnPathErrorMode) {
    this.returnPathErrorMode = returnPathErrorMode;
  }

  public boolean shouldFoldConstants() {
    return foldConstants;
  }

  /** Whether expressions with a compile time value are replaced by constants after conversion. */
  public void setFoldConstants(boolean foldConstants) {
    this.foldConstants = foldConstants;
  }

  public boolean shouldValidateGraph() {
    return validateGraph;
  }

  /** Whether graph invariants are checked before and after the rewrite passes. */
  public void setValidateGraph(boolean validateGraph) {
    this.validateGraph = validateGraph;
  }

  public ImportResolver getImportResolver() {
    return importResolver;
  }

  public void setImportResolver(ImportResolver importResolver) {
    this.importResolver = importResolver;
  }

  /**
   * Reports the diagnostics of {@code group} at {@code level}. Only the return path analysis
   * consults these levels: a demoted {@code UNREACHABLE_CODE} no longer fails the function. Every
   * other diagnostic stops conversion whatever its level.
   */
  public void setWarningLevel(DiagnosticGroup group, CheckLevel level) {
    warningLevels.remove(group);
    warningLevels.put(group, level);
  }

  /** The level for {@code error}. The group set last wins when several match. */
  CheckLevel getLevel(AsgError error) {
    CheckLevel level = error.defaultLevel();
    for (Map.Entry<DiagnosticGroup, CheckLevel> entry : warningLevels.entrySet()) {
      if (entry.getKey().matches(error)) {
        level = entry.getValue();
      }
    }
    return level;
  }
}
