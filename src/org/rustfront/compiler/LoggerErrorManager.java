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

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Logs the diagnostics of a compilation when the report is generated: errors at SEVERE, warnings
 * at WARNING, and a closing count at INFO, or at WARNING when anything was reported. A header line
 * at FINE names each module before its diagnostics.
 */
public class LoggerErrorManager extends SortingErrorManager {
  private final MessageFormatter formatter;
  private final Logger logger;

  private boolean headerLogged;
  private @Nullable String currentSource;

  public LoggerErrorManager(MessageFormatter formatter, Logger logger) {
    this.formatter = formatter;
    this.logger = logger;
  }

  /** Logs with a {@link LightweightMessageFormatter}. */
  public LoggerErrorManager(Logger logger) {
    this(new LightweightMessageFormatter(), logger);
  }

  @Override
  public void generateReport() {
    headerLogged = false;
    currentSource = null;
    super.generateReport();
  }

  @Override
  protected void printDiagnostic(CheckLevel level, RsError error) {
    String source = error.sourceName();
    if (!headerLogged || !Objects.equals(source, currentSource)) {
      headerLogged = true;
      currentSource = source;
      logger.fine("Diagnostics for " + (source != null ? source : "(unknown source)"));
    }
    logger.log(
        level == CheckLevel.ERROR ? Level.SEVERE : Level.WARNING, error.format(level, formatter));
  }

  @Override
  protected void printSummary() {
    int errors = getErrorCount();
    int warnings = getWarningCount();
    logger.log(
        errors + warnings == 0 ? Level.INFO : Level.WARNING,
        "{0} error(s), {1} warning(s)",
        new Object[] {errors, warnings});
  }
}
