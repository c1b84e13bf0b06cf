/*
 * Copyright 2025 The Rustfront Authors.
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

package org.rustfront.compiler;

import static com.google.common.truth.Truth.assertThat;

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

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo {0}");
  private static final DiagnosticType BAR_TYPE = DiagnosticType.warning("TEST_BAR", "Bar");

  private final List<LogRecord> records = new ArrayList<>();
  private Logger logger;

  @Before
  public void setUp() {
    records.clear();
    logger = Logger.getAnonymousLogger();
    logger.setUseParentHandlers(false);
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
    manager.report(CheckLevel.ERROR, RsError.make("a.rs", 3, 4, FOO_TYPE, "x"));
    manager.report(CheckLevel.WARNING, RsError.make("a.rs", 5, 0, BAR_TYPE));
    manager.generateReport();

    assertThat(records).hasSize(3);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage()).isEqualTo("a.rs:3:4: ERROR - [TEST_FOO] Foo x");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(1).getMessage()).isEqualTo("a.rs:5:0: WARNING - [TEST_BAR] Bar");
    assertThat(records.get(2).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(2).getMessage()).isEqualTo("{0} error(s), {1} warning(s)");
    assertThat(records.get(2).getParameters()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void testModuleHeadersAtFine() {
    logger.setLevel(Level.FINE);
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    manager.report(CheckLevel.WARNING, RsError.make("b.rs", 1, 0, BAR_TYPE));
    manager.report(CheckLevel.ERROR, RsError.make("a.rs", 2, 0, FOO_TYPE, "x"));
    manager.report(CheckLevel.ERROR, RsError.make("a.rs", 7, 0, FOO_TYPE, "y"));
    manager.generateReport();

    List<String> messages = new ArrayList<>();
    for (LogRecord record : records) {
      messages.add(record.getMessage());
    }
    assertThat(messages)
        .containsExactly(
            "Diagnostics for a.rs",
            "a.rs:2:0: ERROR - [TEST_FOO] Foo x",
            "a.rs:7:0: ERROR - [TEST_FOO] Foo y",
            "Diagnostics for b.rs",
            "b.rs:1:0: WARNING - [TEST_BAR] Bar",
            "{0} error(s), {1} warning(s)")
        .inOrder();
  }

  @Test
  public void testCleanSummaryIsInfo() {
    new LoggerErrorManager(logger).generateReport();

    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);
  }

  @Test
  public void testCustomFormatter() {
    MessageFormatter formatter =
        new MessageFormatter() {
          @Override
          public String formatError(RsError error) {
            return "E:" + error.type().key;
          }

          @Override
          public String formatWarning(RsError warning) {
            return "W:" + warning.type().key;
          }
        };
    LoggerErrorManager manager = new LoggerErrorManager(formatter, logger);
    manager.report(CheckLevel.ERROR, RsError.make(FOO_TYPE, "x"));
    manager.generateReport();

    assertThat(records.get(0).getMessage()).isEqualTo("E:TEST_FOO");
  }
}
