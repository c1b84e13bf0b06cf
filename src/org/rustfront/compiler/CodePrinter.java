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
import org.rustfront.ast.Token;

/**
 * Prints a tree back as compact Rust source, one line per module. Used for diagnostics excerpts,
 * logging and tests; it is not meant to preserve the original formatting.
 */
public final class CodePrinter {

  private StringBuilder sb = new StringBuilder();

  public CodePrinter() {}

  /** Returns the source for the given tree. */
  public String print(Node n) {
    sb = new StringBuilder();
    add(n);
    return sb.toString();
  }

  private void add(Node n) {
    Token token = n.getToken();
    switch (token) {
      case ROOT:
        addList(n.getFirstChild(), "\n");
        break;
      case MODULE:
        addList(n.getFirstChild(), " ");
        break;
      case FUNCTION:
        sb.append("fn ");
        add(n.getFirstChild());
        add(n.getSecondChild());
        sb.append(' ');
        add(n.getLastChild());
        break;
      case CONST_ITEM:
        sb.append("const ");
        add(n.getFirstChild());
        sb.append(" = ");
        add(n.getLastChild());
        sb.append(';');
        break;
      case PARAM_LIST:
        sb.append('(');
        addList(n.getFirstChild(), ", ");
        sb.append(')');
        break;
      case CLOSURE:
        sb.append('|');
        addList(n.getFirstChild().getFirstChild(), ", ");
        sb.append("| ");
        add(n.getLastChild());
        break;
      case LET:
        sb.append("let ");
        add(n.getFirstChild());
        if (n.hasTwoChildren()) {
          sb.append(" = ");
          add(n.getLastChild());
        }
        sb.append(';');
        break;
      case EXPR_STMT:
        add(n.getFirstChild());
        sb.append(';');
        break;
      case BLOCK:
        addBlock(n);
        break;
      case TRY_BLOCK:
        sb.append("try ");
        add(n.getFirstChild());
        break;
      case LABELED_BLOCK:
        add(n.getFirstChild());
        sb.append(": ");
        add(n.getLastChild());
        break;
      case LABEL_NAME:
        sb.append('\'').append(n.getString());
        break;
      case QUESTION:
        addOperand(n.getFirstChild());
        sb.append('?');
        break;
      case BREAK:
      case CONTINUE:
      case RETURN:
        sb.append(token == Token.BREAK ? "break" : token == Token.CONTINUE ? "continue" : "return");
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          sb.append(' ');
          add(c);
        }
        break;
      case MATCH:
        sb.append("match ");
        add(n.getFirstChild());
        sb.append(" {");
        for (Node arm = n.getSecondChild(); arm != null; arm = arm.getNext()) {
          sb.append(' ');
          add(arm);
          sb.append(',');
        }
        sb.append(" }");
        break;
      case MATCH_ARM:
        add(n.getFirstChild());
        sb.append(" => ");
        add(n.getLastChild());
        break;
      case IF:
        sb.append("if ");
        add(n.getFirstChild());
        sb.append(' ');
        add(n.getSecondChild());
        if (n.getChildCount() == 3) {
          sb.append(" else ");
          add(n.getLastChild());
        }
        break;
      case LOOP:
        sb.append("loop ");
        add(n.getFirstChild());
        break;
      case WHILE:
        sb.append("while ");
        add(n.getFirstChild());
        sb.append(' ');
        add(n.getLastChild());
        break;
      case CALL:
        addOperand(n.getFirstChild());
        sb.append('(');
        addList(n.getSecondChild(), ", ");
        sb.append(')');
        break;
      case METHOD_CALL:
        addOperand(n.getFirstChild());
        sb.append('.');
        add(n.getSecondChild());
        sb.append('(');
        addList(n.getSecondChild().getNext(), ", ");
        sb.append(')');
        break;
      case FIELD:
        addOperand(n.getFirstChild());
        sb.append('.').append(n.getString());
        break;
      case PATH:
      case NAME:
      case IDENT_PATTERN:
        sb.append(n.getString());
        break;
      case INTEGER:
        sb.append(n.getInteger());
        break;
      case STRINGLIT:
        addStringLiteral(n.getString());
        break;
      case TRUE:
        sb.append("true");
        break;
      case FALSE:
        sb.append("false");
        break;
      case UNIT:
        sb.append("()");
        break;
      case TUPLE:
        sb.append('(');
        addList(n.getFirstChild(), ", ");
        if (n.hasOneChild()) {
          sb.append(',');
        }
        sb.append(')');
        break;
      case ARRAY:
        sb.append('[');
        addList(n.getFirstChild(), ", ");
        sb.append(']');
        break;
      case WILDCARD_PATTERN:
        sb.append('_');
        break;
      case TUPLE_STRUCT_PATTERN:
        add(n.getFirstChild());
        sb.append('(');
        addList(n.getSecondChild(), ", ");
        sb.append(')');
        break;
      default:
        if (token.isBinaryOperator()) {
          addOperand(n.getFirstChild());
          sb.append(' ').append(token.operatorText()).append(' ');
          addOperand(n.getLastChild());
        } else if (token.isUnaryOperator()) {
          sb.append(token.operatorText());
          addOperand(n.getFirstChild());
        } else {
          throw new IllegalStateException("Unexpected token " + token);
        }
    }
  }

  private void addBlock(Node block) {
    if (!block.hasChildren()) {
      sb.append("{}");
      return;
    }
    sb.append('{');
    for (Node c = block.getFirstChild(); c != null; c = c.getNext()) {
      sb.append(' ');
      add(c);
    }
    sb.append(" }");
  }

  /** Adds an operand of an operator, call or postfix, in parentheses unless it is atomic. */
  private void addOperand(Node n) {
    if (needsParentheses(n)) {
      sb.append('(');
      add(n);
      sb.append(')');
    } else {
      add(n);
    }
  }

  private static boolean needsParentheses(Node n) {
    Token token = n.getToken();
    if (token.isBinaryOperator() || token.isUnaryOperator()) {
      return true;
    }
    switch (token) {
      case CLOSURE:
      case BREAK:
      case CONTINUE:
      case RETURN:
        return true;
      default:
        return false;
    }
  }

  private void addList(Node first, String separator) {
    for (Node c = first; c != null; c = c.getNext()) {
      if (c != first) {
        sb.append(separator);
      }
      add(c);
    }
  }

  private void addStringLiteral(String s) {
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        default:
          sb.append(c);
      }
    }
    sb.append('"');
  }
}
