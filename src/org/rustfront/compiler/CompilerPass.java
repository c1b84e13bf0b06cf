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

import org.rustfront.ast.Node;

/**
 * Interface for classes that transform or check the AST.
 *
 * <p>Class has single function "process", which is passed the root node of the tree. Passes
 * mutate the tree in place and report problems through the compiler; they return nothing.
 */
public interface CompilerPass {

  /**
   * Process the tree with root node root. Can modify the contents of each Node tree.
   *
   * @param root Top of the tree, usually a ROOT or MODULE node
   */
  void process(Node root);
}
