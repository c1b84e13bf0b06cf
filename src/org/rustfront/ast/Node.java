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

package org.rustfront.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Every node is exclusively owned by its parent. Children are kept in a sibling list where
 * {@code first.previous} points at the last child, so appending and replacing are O(1).
 */
public class Node {

  private static final class StringNode extends Node {

    private String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    boolean isEquivalentTo(Node node, boolean recurse) {
      return super.isEquivalentTo(node, recurse) && this.str.equals(((StringNode) node).str);
    }

    @Override
    StringNode cloneNode() {
      StringNode clone = new StringNode(getToken(), str);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private static final class IntegerNode extends Node {

    private long value;

    IntegerNode(long value) {
      super(Token.INTEGER);
      this.value = value;
    }

    @Override
    boolean isEquivalentTo(Node node, boolean recurse) {
      return super.isEquivalentTo(node, recurse) && this.value == ((IntegerNode) node).value;
    }

    @Override
    IntegerNode cloneNode() {
      IntegerNode clone = new IntegerNode(value);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private final Token token;
  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable String sourceFileName;
  private int linenoCharno = -1;
  private int length;

  /**
   * CHARNO_BITS represents how many of the lower-order bits of linenoCharno are reserved for
   * storing the column number. Bits above these store the line number.
   */
  private static final int CHARNO_BITS = 12;

  public static final int MAX_COLUMN_NUMBER = (1 << CHARNO_BITS) - 1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public static Node newInteger(long value) {
    return new IntegerNode(value);
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next == getLastChild();
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean isDescendantOf(Node node) {
    for (Node n = this.parent; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      Node last = first.previous;
      child.previous = last;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    child.checkDetached();

    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /** Inserts this detached node directly before {@code existing}. */
  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingPrevious = existing.previous;

    this.parent = existingParent;
    this.next = existing;
    existing.previous = this;
    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
    } else {
      existingPrevious.next = this;
    }
  }

  /** Swaps `replacement` and its subtree into the position of `this`. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    replacement.srcrefIfMissing(this);

    // The sequence below also has to work when `this` is an only child, which can cause many of
    // the variables to point to the same object.
    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }

    return this;
  }

  /** Removes the first child and returns it, or null if there are no children. */
  public final @Nullable Node removeFirstChild() {
    Node child = first;
    if (child != null) {
      child.detach();
    }
    return child;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  public final String getString() {
    checkState(this instanceof StringNode, "Not a string node: %s", token);
    return ((StringNode) this).str;
  }

  public final void setString(String str) {
    checkState(this instanceof StringNode, "Not a string node: %s", token);
    ((StringNode) this).str = checkNotNull(str);
  }

  public final long getInteger() {
    checkState(this instanceof IntegerNode, "Not an integer node: %s", token);
    return ((IntegerNode) this).value;
  }

  // ==========================================================================
  // Source positions

  public final @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  public final Node setSourceFileName(@Nullable String sourceFileName) {
    this.sourceFileName = sourceFileName;
    return this;
  }

  public final int getLength() {
    return this.length;
  }

  public final void setLength(int length) {
    this.length = length;
  }

  /** Returns the 1-based line number, or -1 if unknown. */
  public final int getLineno() {
    return linenoCharno == -1 ? -1 : linenoCharno >>> CHARNO_BITS;
  }

  /** Returns the 0-based column number, or -1 if unknown. */
  public final int getCharno() {
    return linenoCharno == -1 ? -1 : linenoCharno & MAX_COLUMN_NUMBER;
  }

  public final String getLocation() {
    return getSourceFileName() + ":" + getLineno() + ":" + getCharno();
  }

  /**
   * Merges the line number and character number in one integer.
   *
   * <p>The charno takes the first 12 bits and the line number takes the rest. If the charno is
   * greater than (2^12)-1 it is adjusted to (2^12)-1
   */
  public final Node setLinenoCharno(int lineno, int charno) {
    if (lineno < 0 || charno < 0) {
      this.linenoCharno = -1;
      return this;
    }
    if (charno > MAX_COLUMN_NUMBER) {
      charno = MAX_COLUMN_NUMBER;
    }
    this.linenoCharno = (lineno << CHARNO_BITS) | charno;
    return this;
  }

  /** Copy the source info from `other` onto `this`. */
  public final Node srcref(Node other) {
    this.sourceFileName = other.sourceFileName;
    this.linenoCharno = other.linenoCharno;
    this.length = other.length;
    return this;
  }

  /** For all Nodes in the subtree of `this`, copy the source info from `other`. */
  public final Node srcrefTree(Node other) {
    this.srcref(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTree(other);
    }
    return this;
  }

  /** Iff source info is not set on `this`, copy the source info from `other`. */
  public final Node srcrefIfMissing(Node other) {
    if (sourceFileName == null && linenoCharno == -1) {
      srcref(other);
    }
    return this;
  }

  /**
   * For all Nodes in the subtree of `this`, iff source info is not set, copy the source info from
   * `other`.
   */
  public final Node srcrefTreeIfMissing(Node other) {
    this.srcrefIfMissing(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTreeIfMissing(other);
    }
    return this;
  }

  // ==========================================================================
  // Iteration

  /**
   * Return an iterable object that iterates over this node's children. The iterator does not
   * support the optional operation {@link Iterator#remove()}.
   *
   * <p>Do not use this while replacing children; save {@link #getNext()} before mutating instead.
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.next;
      return n;
    }
  }

  // ==========================================================================
  // Equivalence and cloning

  /** Returns true if this node is equivalent semantically to another */
  public final boolean isEquivalentTo(Node node) {
    return isEquivalentTo(node, true);
  }

  /** Checks equivalence without going into child nodes */
  public final boolean isEquivalentToShallow(Node node) {
    return isEquivalentTo(node, false);
  }

  boolean isEquivalentTo(Node node, boolean recurse) {
    if (token != node.token
        || getChildCount() != node.getChildCount()
        || this.getClass() != node.getClass()) {
      return false;
    }
    if (recurse) {
      for (Node n = first, n2 = node.first; n != null; n = n.next, n2 = n2.next) {
        if (!n.isEquivalentTo(n2, true)) {
          return false;
        }
      }
    }
    return true;
  }

  /** Returns a detached clone of the Node, specifically excluding its children. */
  @CheckReturnValue
  Node cloneNode() {
    Node clone = new Node(token);
    copyBaseNodeFields(this, clone);
    return clone;
  }

  private static void copyBaseNodeFields(Node source, Node dest) {
    dest.sourceFileName = source.sourceFileName;
    dest.linenoCharno = source.linenoCharno;
    dest.length = source.length;
  }

  /** Returns a detached clone of the Node and all its children. */
  @CheckReturnValue
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node child = first; child != null; child = child.next) {
      result.addChildToBack(child.cloneTree());
    }
    return result;
  }

  // ==========================================================================
  // Token predicates

  public final boolean isRoot() {
    return token == Token.ROOT;
  }

  public final boolean isModule() {
    return token == Token.MODULE;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isConstItem() {
    return token == Token.CONST_ITEM;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isLet() {
    return token == Token.LET;
  }

  public final boolean isExprStmt() {
    return token == Token.EXPR_STMT;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isTryBlock() {
    return token == Token.TRY_BLOCK;
  }

  public final boolean isLabeledBlock() {
    return token == Token.LABELED_BLOCK;
  }

  public final boolean isLabelName() {
    return token == Token.LABEL_NAME;
  }

  public final boolean isClosure() {
    return token == Token.CLOSURE;
  }

  public final boolean isQuestion() {
    return token == Token.QUESTION;
  }

  public final boolean isBreak() {
    return token == Token.BREAK;
  }

  public final boolean isContinue() {
    return token == Token.CONTINUE;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isMatch() {
    return token == Token.MATCH;
  }

  public final boolean isMatchArm() {
    return token == Token.MATCH_ARM;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isPath() {
    return token == Token.PATH;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isUnit() {
    return token == Token.UNIT;
  }

  // ==========================================================================
  // Debug output

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ');
      sb.append(getString());
    } else if (this instanceof IntegerNode) {
      sb.append(' ');
      sb.append(getInteger());
    }
    int lineno = getLineno();
    if (lineno != -1) {
      sb.append(' ');
      sb.append(lineno);
      sb.append(':');
      sb.append(getCharno());
    }
    if (length != 0) {
      sb.append(" [length: ");
      sb.append(length);
      sb.append(']');
    }
    if (sourceFileName != null && token == Token.MODULE) {
      sb.append(" [source_file: ");
      sb.append(sourceFileName);
      sb.append(']');
    }
    return sb.toString();
  }

  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
