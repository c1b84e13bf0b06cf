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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.TreeSet;

/**
 * Keeps the diagnostics of one compilation in report order: grouped by module, then by position
 * within the module, with errors ahead of warnings at the same position. A diagnostic reported
 * again at the same position is kept once, which happens when a pass runs twice over a module.
 *
 * <p>{@link #generateReport()} hands every diagnostic to {@link #printDiagnostic} and then calls
 * {@link #printSummary}. Both do nothing here; {@link LoggerErrorManager} prints.
 */
public class SortingErrorManager implements ErrorManager {

  private static final Ordering<String> SOURCE_NAME_ORDERING = Ordering.natural().nullsFirst();

  private static final Comparator<Diagnostic> REPORT_ORDER =
      Comparator.comparing((Diagnostic d) -> d.error().sourceName(), SOURCE_NAME_ORDERING)
          .thenComparingInt(d -> d.error().lineno())
          .thenComparingInt(d -> d.error().charno())
          .thenComparing(Diagnostic::level)
          .thenComparing(d -> d.error().type().key)
          .thenComparing(d -> d.error().description());

  /** An error together with the level it was reported at. */
  record Diagnostic(RsError error, CheckLevel level) {}

  private final TreeSet<Diagnostic> diagnostics = new TreeSet<>(REPORT_ORDER);
  private int errorCount;
  private int haltingErrorCount;
  private int warningCount;

  @Override
  public void report(CheckLevel level, RsError error) {
    checkArgument(level.isOn(), "Cannot report %s at level %s", error.type().key, level);
    if (!diagnostics.add(new Diagnostic(error, level))) {
      return;
    }
    if (level == CheckLevel.WARNING) {
      warningCount++;
      return;
    }
    errorCount++;
    // A warning promoted through CompilerOptions#setWarningLevel does not halt.
    if (error.type().level == CheckLevel.ERROR) {
      haltingErrorCount++;
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public boolean hasHaltingErrors() {
    return haltingErrorCount > 0;
  }

  @Override
  public ImmutableList<RsError> getErrors() {
    return atLevel(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<RsError> getWarnings() {
    return atLevel(CheckLevel.WARNING);
  }

  private ImmutableList<RsError> atLevel(CheckLevel level) {
    return diagnostics.stream()
        .filter(d -> d.level() == level)
        .map(Diagnostic::error)
        .collect(toImmutableList());
  }

  @Override
  public void generateReport() {
    // Printing may report more diagnostics; they show up in the summary only.
    for (Diagnostic d : ImmutableList.copyOf(diagnostics)) {
      printDiagnostic(d.level(), d.error());
    }
    printSummary();
  }

  /** Called once per diagnostic, in report order. */
  protected void printDiagnostic(CheckLevel level, RsError error) {}

  /** Called after the last diagnostic. */
  protected void printSummary() {}
}
