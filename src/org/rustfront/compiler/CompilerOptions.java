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

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Compiler options */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  /**
   * Whether a {@code ?} outside of any try block may propagate to the return contract of the
   * enclosing function or closure. When false, such an operator is reported as misplaced.
   */
  private boolean propagateToEnclosingFunction = true;

  /** Whether function-level {@code ?} operators are lowered after try blocks. */
  private boolean desugarQuestionMarks = true;

  /** Whether the lowered AST is checked for structural invariants after the passes run. */
  private boolean validateAst = true;

  /** Whether the lowered code is printed to the compiler logger at FINE level. */
  private boolean printLoweredCode = false;

  private final Map<String, CheckLevel> warningLevels = new LinkedHashMap<>();

  public CompilerOptions() {}

  public void setPropagateToEnclosingFunction(boolean propagateToEnclosingFunction) {
    this.propagateToEnclosingFunction = propagateToEnclosingFunction;
  }

  public boolean shouldPropagateToEnclosingFunction() {
    return propagateToEnclosingFunction;
  }

  public void setDesugarQuestionMarks(boolean desugarQuestionMarks) {
    this.desugarQuestionMarks = desugarQuestionMarks;
  }

  public boolean shouldDesugarQuestionMarks() {
    return desugarQuestionMarks;
  }

  public void setValidateAst(boolean validateAst) {
    this.validateAst = validateAst;
  }

  public boolean shouldValidateAst() {
    return validateAst;
  }

  public void setPrintLoweredCode(boolean printLoweredCode) {
    this.printLoweredCode = printLoweredCode;
  }

  public boolean shouldPrintLoweredCode() {
    return printLoweredCode;
  }

  /** Overrides the reporting level of one diagnostic type. {@code OFF} suppresses it. */
  public void setWarningLevel(DiagnosticType type, CheckLevel level) {
    warningLevels.put(type.key, level);
  }

  /** Returns the overridden level for the given diagnostic, or null if there is none. */
  @Nullable CheckLevel getWarningLevel(DiagnosticType type) {
    return warningLevels.get(type.key);
  }
}
