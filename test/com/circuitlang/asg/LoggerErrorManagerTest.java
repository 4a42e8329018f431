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

import static com.google.common.truth.Truth.assertThat;

import com.circuitlang.ast.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LoggerErrorManagerTest {
  private static final DiagnosticType FOO_TYPE =
      DiagnosticType.error("TEST_FOO", "Foo description");
  private static final DiagnosticType BAR_TYPE =
      DiagnosticType.make("TEST_BAR", CheckLevel.WARNING, "Bar description");

  private final List<LogRecord> records = new ArrayList<>();
  private Logger logger;

  @Before
  public void setUp() {
    logger = Logger.getAnonymousLogger();
    logger.setUseParentHandlers(false);
    logger.setLevel(Level.ALL);
    logger.addHandler(
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        });
  }

  @Test
  public void testErrorsAndWarningsAreLogged() {
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    manager.report(CheckLevel.WARNING, AsgError.make(Span.of("a.circ", 2, 1, 2), BAR_TYPE));
    manager.report(CheckLevel.ERROR, AsgError.make(Span.of("a.circ", 1, 1, 2), FOO_TYPE));

    manager.generateReport();

    assertThat(records).hasSize(3);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage())
        .isEqualTo("a.circ:1:1: ERROR - [TEST_FOO] Foo description\n");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(1).getMessage()).contains("[TEST_BAR]");
    assertThat(records.get(2).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(2).getParameters()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void testCleanSummary() {
    new LoggerErrorManager(logger).generateReport();
    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);
    assertThat(records.get(0).getMessage()).isEqualTo("0 error(s), 0 warning(s)");
  }
}
