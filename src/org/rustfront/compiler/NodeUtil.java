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

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.base.Splitter;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.rustfront.ast.IR;
import org.rustfront.ast.Node;
import org.rustfront.ast.Token;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private static final Splitter PATH_SPLITTER = Splitter.on("::").omitEmptyStrings();

  private NodeUtil() {}

  /** A pre-order or post-order visitor of nodes. */
  public interface Visitor {
    void visit(Node node);
  }

  /** A pre-order traversal, calling Visitor.visit for each decendent. */
  public static void visitPreOrder(Node node, Visitor visitor) {
    visitPreOrder(node, visitor, Predicates.alwaysTrue());
  }

  /** A pre-order traversal, calling Visitor.visit for each node in the tree. */
  public static void visitPreOrder(
      Node node, Visitor visitor, Predicate<Node> traverseChildrenPred) {
    visitor.visit(node);
    if (traverseChildrenPred.apply(node)) {
      for (Node c = node.getFirstChild(); c != null; c = c.getNext()) {
        visitPreOrder(c, visitor, traverseChildrenPred);
      }
    }
  }

  /** Returns true if a node has a token that matches {@code pred} within the tree. */
  public static boolean has(Node node, Predicate<Node> pred, Predicate<Node> traverseChildrenPred) {
    if (pred.apply(node)) {
      return true;
    }

    if (!traverseChildrenPred.apply(node)) {
      return false;
    }

    for (Node c = node.getFirstChild(); c != null; c = c.getNext()) {
      if (has(c, pred, traverseChildrenPred)) {
        return true;
      }
    }

    return false;
  }

  /** Finds the number of times a type is referenced within the node tree. */
  static int getNodeTypeReferenceCount(Node node, Token type) {
    int[] count = {0};
    visitPreOrder(
        node,
        n -> {
          if (n.getToken() == type) {
            count[0]++;
          }
        });
    return count[0];
  }

  /**
   * Collects every identifier spelled anywhere in the tree: names, labels, binding patterns, field
   * names and the segments of paths. Generated names are checked against this set.
   */
  static Set<String> collectIdentifiers(Node root) {
    Set<String> identifiers = new LinkedHashSet<>();
    visitPreOrder(
        root,
        n -> {
          switch (n.getToken()) {
            case NAME:
            case LABEL_NAME:
            case IDENT_PATTERN:
            case FIELD:
              identifiers.add(n.getString());
              break;
            case PATH:
              for (String segment : PATH_SPLITTER.split(n.getString())) {
                identifiers.add(segment);
              }
              break;
            default:
              break;
          }
        });
    return identifiers;
  }

  /** Returns the tail expression of a block, or null if the block ends in a statement. */
  static @Nullable Node getBlockTail(Node block) {
    checkArgument(block.isBlock(), block);
    Node last = block.getLastChild();
    return last != null && !IR.isStatement(last) ? last : null;
  }

  /** Whether the node unconditionally transfers control elsewhere. */
  static boolean isDivergingJump(Node n) {
    switch (n.getToken()) {
      case RETURN:
      case BREAK:
      case CONTINUE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Whether a propagation operator inside the node can never reach a target outside it. Functions
   * and closures own their return contract; const items have none.
   */
  static boolean isPropagationBoundary(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case CLOSURE:
      case CONST_ITEM:
        return true;
      default:
        return false;
    }
  }

  /** Returns the source file name of the node, or of the nearest ancestor that has one. */
  public static @Nullable String getSourceName(Node n) {
    for (Node cursor = n; cursor != null; cursor = cursor.getParent()) {
      String sourceName = cursor.getSourceFileName();
      if (sourceName != null) {
        return sourceName;
      }
    }
    return null;
  }

  /** Returns the label named by a break or continue, or null if it is unlabeled. */
  static @Nullable String getJumpLabel(Node jump) {
    checkArgument(jump.isBreak() || jump.isContinue(), jump);
    Node first = jump.getFirstChild();
    return first != null && first.isLabelName() ? first.getString() : null;
  }
}
