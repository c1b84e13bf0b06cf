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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;
import org.rustfront.ast.Node;

/**
 * NodeTraversal allows an iteration through the nodes in the tree, and facilitates the lowering
 * passes on the tree.
 */
public class NodeTraversal {
  private final AbstractCompiler compiler;
  private final Callback callback;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** The current source file name */
  private @Nullable String sourceName;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns true, the node will be visited by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder and its children will be visited by both methods.
     *
     * <p>Siblings are always visited left-to-right.
     *
     * <p>Implementations can have side-effects (e.g. modify the tree). Replacing the current node
     * in {@link #visit} is legal; the replacement is not traversed.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} returned true for its parent and itself.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  private NodeTraversal(AbstractCompiler compiler, Callback callback) {
    this.compiler = checkNotNull(compiler);
    this.callback = checkNotNull(callback);
  }

  /** Traverses a tree recursively, calling back into {@code cb}. */
  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    new NodeTraversal(compiler, cb).traverse(root);
  }

  private void traverse(Node root) {
    try {
      sourceName = NodeUtil.getSourceName(root);
      currentNode = root;
      traverseBranch(root, root.getParent());
    } catch (Error | Exception unexpectedException) {
      throwUnexpectedException(unexpectedException);
    }
  }

  private void throwUnexpectedException(Throwable unexpectedException) {
    // If there's an unexpected exception, try to get the
    // line number of the code that caused it.
    String message = unexpectedException.getMessage();
    if (currentNode != null) {
      message =
          unexpectedException.getMessage()
              + "\n"
              + formatNodeContext("Node", currentNode)
              + formatNodeContext("Parent", currentNode.getParent());
    }
    compiler.throwInternalError(message, unexpectedException);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL\n";
    }
    return "  " + label + "(" + n + "): " + n.getLocation() + "\n";
  }

  /** Traverses a branch. */
  private void traverseBranch(Node n, @Nullable Node parent) {
    String previousSourceName = sourceName;
    if (n.isModule()) {
      sourceName = n.getSourceFileName();
    }

    currentNode = n;
    if (callback.shouldTraverse(this, n, parent)) {
      traverseChildren(n);
      currentNode = n;
      callback.visit(this, n, parent);
    }

    sourceName = previousSourceName;
  }

  private void traverseChildren(Node n) {
    for (Node child = n.getFirstChild(); child != null; ) {
      // child could be replaced, in which case our child node
      // would no longer point to the true next
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }
  }

  public AbstractCompiler getCompiler() {
    return compiler;
  }

  /** Returns the node currently being traversed. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Returns the source file name of the module currently being traversed, if known. */
  public @Nullable String getSourceName() {
    return sourceName;
  }

  /** Reports a diagnostic (error or warning) */
  public void report(Node n, DiagnosticType diagnosticType, String... arguments) {
    compiler.report(RsError.make(n, diagnosticType, arguments));
  }
}
