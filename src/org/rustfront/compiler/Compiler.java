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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.rustfront.ast.Node;

/**
 * Compiler (and the other classes in this package) lowers the surface forms that later stages do
 * not understand.
 *
 * <p>A Compiler instance is one compilation: it owns the options, the error manager and the
 * hygiene counter, so generated names are unique across all of its passes and modules.
 */
public class Compiler extends AbstractCompiler {

  /**
   * Logger for the whole org.rustfront.compiler package. Setting the level of this logger affects
   * all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("org.rustfront.compiler");

  private final UniqueIdSupplier uniqueIdSupplier = new UniqueIdSupplier();
  private ErrorManager errorManager;
  private CompilerOptions options = new CompilerOptions();

  /** Creates a Compiler that reports errors and warnings to its logger. */
  public Compiler() {
    this(null);
  }

  /** Creates a Compiler that reports errors and warnings to the given error manager. */
  public Compiler(@Nullable ErrorManager errorManager) {
    this.errorManager = errorManager != null ? errorManager : new LoggerErrorManager(logger);
  }

  /** Initializes the compiler options. It's important to call this before any compile method. */
  public void initOptions(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  @Override
  public CompilerOptions getOptions() {
    return options;
  }

  public void setErrorManager(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager, "the error manager cannot be null");
  }

  @Override
  public ErrorManager getErrorManager() {
    return errorManager;
  }

  @Override
  public UniqueIdSupplier getUniqueIdSupplier() {
    return uniqueIdSupplier;
  }

  @Override
  AstFactory createAstFactory() {
    return new AstFactory();
  }

  /**
   * Lowers the tree in place and generates the error report.
   *
   * @param root a ROOT or MODULE node; the tree is rewritten in place
   */
  public Result compile(Node root) {
    checkArgument(root.isRoot() || root.isModule(), "Unexpected compilation root %s", root);
    for (CompilerPass pass : createPasses()) {
      String passName = pass.getClass().getSimpleName();
      logger.fine("Running pass " + passName);
      pass.process(root);
    }
    if (options.shouldPrintLoweredCode() && logger.isLoggable(Level.FINE)) {
      logger.fine("Lowered code:\n" + new CodePrinter().print(root));
    }
    generateReport();
    return getResult();
  }

  private ImmutableList<CompilerPass> createPasses() {
    ImmutableList.Builder<CompilerPass> passes = ImmutableList.builder();
    passes.add(new DesugarTryBlocks(this));
    if (options.shouldDesugarQuestionMarks()) {
      passes.add(new DesugarQuestionMarks(this));
    }
    if (options.shouldValidateAst()) {
      passes.add(
          new AstValidator()
              .setRequireQuestionMarksLowered(options.shouldDesugarQuestionMarks()));
    }
    return passes.build();
  }

  /** Generate a report of the errors and warnings seen so far. */
  public void generateReport() {
    errorManager.generateReport();
  }

  /** Returns the result of the compilation so far. */
  public Result getResult() {
    return new Result(errorManager.getErrors(), errorManager.getWarnings());
  }

  @Override
  public void report(RsError error) {
    CheckLevel level = error.defaultLevel();
    CheckLevel override = options.getWarningLevel(error.type());
    if (override != null) {
      level = override;
    }
    if (level.isOn()) {
      errorManager.report(level, error);
    }
  }

  /** Gets the number of errors. */
  public int getErrorCount() {
    return errorManager.getErrorCount();
  }

  /** Gets the number of warnings. */
  public int getWarningCount() {
    return errorManager.getWarningCount();
  }

  /** Report an internal error. */
  @Override
  void throwInternalError(String message, Throwable cause) {
    throw new RuntimeException(
        "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + message, cause);
  }
}
