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

/**
 * An abstract compiler, to help remove the circular dependency of passes on Compiler.
 *
 * <p>Passes only see this interface: they report diagnostics, read options, and ask for fresh
 * names and a node factory.
 */
public abstract class AbstractCompiler {

  /** Report an error or warning. */
  public abstract void report(RsError error);

  /** Returns the options of the current compilation. */
  public abstract CompilerOptions getOptions();

  /** Returns the hygiene counter shared by every pass of this compilation. */
  public abstract UniqueIdSupplier getUniqueIdSupplier();

  /** Returns a factory for the nodes that lowering passes synthesize. */
  abstract AstFactory createAstFactory();

  /** Returns the error manager diagnostics are collected in. */
  public abstract ErrorManager getErrorManager();

  /** Report an internal error. */
  abstract void throwInternalError(String message, Throwable cause);
}
