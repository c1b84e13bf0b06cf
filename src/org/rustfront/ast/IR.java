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
import static com.google.common.base.Preconditions.checkState;

/** An AST construction helper class */
public class IR {

  private IR() {}

  public static Node root(Node... modules) {
    Node root = new Node(Token.ROOT);
    for (Node module : modules) {
      checkState(module.isModule(), module);
      root.addChildToBack(module);
    }
    return root;
  }

  public static Node module(String sourceFileName, Node... items) {
    Node module = new Node(Token.MODULE);
    module.setSourceFileName(sourceFileName);
    for (Node item : items) {
      checkState(isItem(item), item);
      module.addChildToBack(item);
    }
    return module;
  }

  public static Node function(String name, Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    return new Node(Token.FUNCTION, name(name), params, body);
  }

  public static Node constItem(String name, Node initializer) {
    checkState(mayBeExpression(initializer), initializer);
    return new Node(Token.CONST_ITEM, name(name), initializer);
  }

  public static Node paramList(String... names) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (String name : names) {
      paramList.addChildToBack(name(name));
    }
    return paramList;
  }

  public static Node closure(Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(mayBeExpression(body), body);
    return new Node(Token.CLOSURE, params, body);
  }

  // Statements

  public static Node let(Node pattern) {
    checkState(isPattern(pattern), pattern);
    return new Node(Token.LET, pattern);
  }

  public static Node let(Node pattern, Node initializer) {
    checkState(isPattern(pattern), pattern);
    checkState(mayBeExpression(initializer), initializer);
    return new Node(Token.LET, pattern, initializer);
  }

  public static Node let(String name, Node initializer) {
    return let(identPattern(name), initializer);
  }

  public static Node exprStmt(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_STMT, expr);
  }

  // Blocks

  /**
   * Creates a block. Every element but the last must be a statement or item; the last may also be
   * an expression, in which case it is the tail of the block.
   */
  public static Node block(Node... children) {
    Node block = new Node(Token.BLOCK);
    for (int i = 0; i < children.length; i++) {
      Node child = children[i];
      boolean isLast = i == children.length - 1;
      checkState(
          isStatement(child) || (isLast && mayBeExpression(child)),
          "Expected statement but was %s",
          child);
      block.addChildToBack(child);
    }
    return block;
  }

  public static Node tryBlock(Node block) {
    checkState(block.isBlock(), block);
    return new Node(Token.TRY_BLOCK, block);
  }

  public static Node labeledBlock(String label, Node block) {
    checkState(block.isBlock(), block);
    return new Node(Token.LABELED_BLOCK, labelName(label), block);
  }

  public static Node labelName(String label) {
    checkArgument(!label.isEmpty());
    return Node.newString(Token.LABEL_NAME, label);
  }

  // Control flow

  public static Node question(Node operand) {
    checkState(mayBeExpression(operand), operand);
    return new Node(Token.QUESTION, operand);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node breakNode(String label, Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.BREAK, labelName(label), value);
  }

  public static Node breakNode(String label) {
    return new Node(Token.BREAK, labelName(label));
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node continueNode(String label) {
    return new Node(Token.CONTINUE, labelName(label));
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.RETURN, value);
  }

  public static Node match(Node scrutinee, Node... arms) {
    checkState(mayBeExpression(scrutinee), scrutinee);
    Node match = new Node(Token.MATCH, scrutinee);
    for (Node arm : arms) {
      checkState(arm.isMatchArm(), arm);
      match.addChildToBack(arm);
    }
    return match;
  }

  public static Node matchArm(Node pattern, Node expr) {
    checkState(isPattern(pattern), pattern);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.MATCH_ARM, pattern, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    checkState(elseNode.isBlock() || elseNode.getToken() == Token.IF, elseNode);
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node loop(Node body) {
    checkState(body.isBlock(), body);
    return new Node(Token.LOOP, body);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(body.isBlock(), body);
    return new Node(Token.WHILE, cond, body);
  }

  // Calls and access

  public static Node call(Node callee, Node... args) {
    checkState(mayBeExpression(callee), callee);
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node methodCall(Node receiver, String method, Node... args) {
    checkState(mayBeExpression(receiver), receiver);
    Node call = new Node(Token.METHOD_CALL, receiver, name(method));
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node field(Node receiver, String field) {
    checkState(mayBeExpression(receiver), receiver);
    Node n = Node.newString(Token.FIELD, field);
    n.addChildToBack(receiver);
    return n;
  }

  public static Node path(String path) {
    checkArgument(!path.isEmpty());
    return Node.newString(Token.PATH, path);
  }

  public static Node name(String name) {
    checkArgument(!name.isEmpty());
    return Node.newString(Token.NAME, name);
  }

  // Literals

  public static Node integer(long value) {
    return Node.newInteger(value);
  }

  public static Node string(String s) {
    return Node.newString(Token.STRINGLIT, s);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node unit() {
    return new Node(Token.UNIT);
  }

  public static Node tuple(Node... elements) {
    Node tuple = new Node(Token.TUPLE);
    for (Node element : elements) {
      checkState(mayBeExpression(element), element);
      tuple.addChildToBack(element);
    }
    return tuple;
  }

  public static Node array(Node... elements) {
    Node array = new Node(Token.ARRAY);
    for (Node element : elements) {
      checkState(mayBeExpression(element), element);
      array.addChildToBack(element);
    }
    return array;
  }

  // Operators

  public static Node binary(Token op, Node left, Node right) {
    checkArgument(op.isBinaryOperator(), op);
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(op, left, right);
  }

  public static Node add(Node left, Node right) {
    return binary(Token.ADD, left, right);
  }

  public static Node assign(Node target, Node value) {
    return binary(Token.ASSIGN, target, value);
  }

  public static Node unary(Token op, Node operand) {
    checkArgument(op.isUnaryOperator(), op);
    checkState(mayBeExpression(operand), operand);
    return new Node(op, operand);
  }

  public static Node not(Node operand) {
    return unary(Token.NOT, operand);
  }

  // Patterns

  public static Node identPattern(String name) {
    checkArgument(!name.isEmpty());
    return Node.newString(Token.IDENT_PATTERN, name);
  }

  public static Node wildcardPattern() {
    return new Node(Token.WILDCARD_PATTERN);
  }

  public static Node tupleStructPattern(String path, Node... patterns) {
    Node pattern = new Node(Token.TUPLE_STRUCT_PATTERN, path(path));
    for (Node sub : patterns) {
      checkState(isPattern(sub), sub);
      pattern.addChildToBack(sub);
    }
    return pattern;
  }

  // Classification

  /** Whether the node is an item that may appear at module level or inside a block. */
  public static boolean isItem(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case CONST_ITEM:
        return true;
      default:
        return false;
    }
  }

  /** Whether the node may appear as a non-tail child of a block. */
  public static boolean isStatement(Node n) {
    switch (n.getToken()) {
      case LET:
      case EXPR_STMT:
        return true;
      default:
        return isItem(n);
    }
  }

  /** Whether the node may appear where a pattern is expected. */
  public static boolean isPattern(Node n) {
    switch (n.getToken()) {
      case IDENT_PATTERN:
      case WILDCARD_PATTERN:
      case TUPLE_STRUCT_PATTERN:
      case INTEGER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case UNIT:
      case PATH:
        return true;
      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is an expression, so just reject
   * known statements, items, patterns and structural nodes.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case ROOT:
      case MODULE:
      case FUNCTION:
      case CONST_ITEM:
      case PARAM_LIST:
      case LET:
      case EXPR_STMT:
      case LABEL_NAME:
      case MATCH_ARM:
      case IDENT_PATTERN:
      case WILDCARD_PATTERN:
      case TUPLE_STRUCT_PATTERN:
        return false;
      default:
        return true;
    }
  }
}
