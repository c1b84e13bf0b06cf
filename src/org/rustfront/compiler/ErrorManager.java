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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported during a compilation.
 */
public interface ErrorManager {

  /**
   * Reports an error. The error manager is generally expected to store the error and the level
   * until {@link #generateReport()} is called.
   *
   * @param level the reporting level
   * @param error the error to report
   */
  void report(CheckLevel level, RsError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Gets the number of errors. */
  int getErrorCount();

  /** Gets the number of warnings. */
  int getWarningCount();

  /** Gets all errors. */
  ImmutableList<RsError> getErrors();

  /** Gets all warnings. */
  ImmutableList<RsError> getWarnings();

  /** Returns whether any reported error has the ERROR level by default. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
