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

import com.circuitlang.ast.ProgramTree;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Builds a semantic graph from a syntax tree, reports any conversion errors, and runs the
 * configured passes over the result.
 *
 * <p>One compiler owns one {@link AsgContext} and must be used from one thread at a time.
 */
public class AsgCompiler implements SourceExcerptProvider {
  private static final Logger logger = Logger.getLogger(AsgCompiler.class.getName());
  private static final Splitter LINES = Splitter.on('\n');

  private final AsgOptions options;
  private final ErrorManager errorManager;
  private final AsgContext context = new AsgContext();
  private final Map<String, List<String>> sources = new HashMap<>();

  /** Creates a compiler that logs its errors with source excerpts. */
  public AsgCompiler(AsgOptions options) {
    this.options = options;
    this.errorManager =
        new LoggerErrorManager(LightweightMessageFormatter.withSource(this), logger);
  }

  public AsgCompiler(AsgOptions options, ErrorManager errorManager) {
    this.options = options;
    this.errorManager = errorManager;
  }

  /** Registers source text so that error reports can quote it. */
  public void addSource(String sourceName, String text) {
    sources.put(sourceName, LINES.splitToList(text));
  }

  @Override
  public @Nullable String getSourceLine(String sourceName, int lineNumber) {
    if (lineNumber < 1) {
      return null;
    }
    List<String> lines = sources.get(sourceName);
    if (lines == null || lineNumber > lines.size()) {
      return null;
    }
    return lines.get(lineNumber - 1);
  }

  /**
   * Builds {@code tree}, runs the passes and generates the error report.
   *
   * @return the program, or null if conversion failed
   */
  public @Nullable Program compile(ProgramTree tree) {
    Program program;
    try {
      logger.fine("Building " + tree.name());
      program = new ProgramBuilder(context, options).build(tree);
    } catch (AsgConvertException e) {
      for (AsgError error : e.getErrors()) {
        report(error);
      }
      reportWarnings();
      errorManager.generateReport();
      return null;
    }
    reportWarnings();

    for (CompilerPass pass : new PassConfig(options).getPasses()) {
      logger.fine("Running " + pass.getClass().getSimpleName());
      pass.process(program);
    }
    errorManager.generateReport();
    return program;
  }

  public void report(AsgError error) {
    errorManager.report(error.defaultLevel(), error);
  }

  private void reportWarnings() {
    for (AsgError warning : context.takeWarnings()) {
      report(warning);
    }
  }

  public AsgOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  public AsgContext getContext() {
    return context;
  }

  public ImmutableList<AsgError> getErrors() {
    return errorManager.getErrors();
  }

  public ImmutableList<AsgError> getWarnings() {
    return errorManager.getWarnings();
  }

  public boolean hasErrors() {
    return errorManager.hasHaltingErrors();
  }
}
