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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import org.rustfront.ast.IR;
import org.rustfront.ast.Node;
import org.rustfront.ast.Token;

/**
 * This class walks the AST and validates that the structure is correct after lowering: node shapes
 * are those later stages accept, no try block survives, and every labeled jump has an enclosing
 * label to jump to.
 */
public final class AstValidator implements CompilerPass {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  /** Labels of the enclosing labeled blocks, innermost first. Reset at function boundaries. */
  private Deque<String> labels = new ArrayDeque<>();

  private boolean requireQuestionMarksLowered = true;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public AstValidator() {
    this(
        (message, n) -> {
          throw new IllegalStateException(
              message
                  + ". Reference node:\n"
                  + n.toStringTree()
                  + "\n Parent node:\n"
                  + ((n.getParent() != null) ? n.getParent().toStringTree() : " no parent "));
        });
  }

  /** Whether a remaining {@code ?} is a violation. */
  @CanIgnoreReturnValue
  public AstValidator setRequireQuestionMarksLowered(boolean require) {
    this.requireQuestionMarksLowered = require;
    return this;
  }

  @Override
  public void process(Node root) {
    if (root.isRoot()) {
      validateRoot(root);
    } else {
      validateModule(root);
    }
  }

  public void validateRoot(Node n) {
    validateNodeType(Token.ROOT, n);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateModule(c);
    }
  }

  public void validateModule(Node n) {
    validateNodeType(Token.MODULE, n);
    if (n.getSourceFileName() == null) {
      violation("Missing source file name.", n);
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateItem(c);
    }
  }

  private void validateItem(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
        validateFunction(n);
        return;
      case CONST_ITEM:
        validateConstItem(n);
        return;
      default:
        violation("Expected item but was " + n.getToken(), n);
    }
  }

  private void validateFunction(Node n) {
    validateChildCount(n, 3);
    validateName(n.getFirstChild());
    validateParamList(n.getSecondChild());
    Deque<String> outerLabels = enterLabelScope();
    validateBlock(n.getLastChild());
    labels = outerLabels;
  }

  private void validateConstItem(Node n) {
    validateChildCount(n, 2);
    validateName(n.getFirstChild());
    Deque<String> outerLabels = enterLabelScope();
    validateExpression(n.getLastChild());
    labels = outerLabels;
  }

  private void validateParamList(Node n) {
    validateNodeType(Token.PARAM_LIST, n);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateName(c);
    }
  }

  private Deque<String> enterLabelScope() {
    Deque<String> outer = labels;
    labels = new ArrayDeque<>();
    return outer;
  }

  private void validateBlock(Node n) {
    validateNodeType(Token.BLOCK, n);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (c.getNext() == null && !IR.isStatement(c)) {
        validateExpression(c);
      } else {
        validateStatement(c);
      }
    }
  }

  private void validateStatement(Node n) {
    switch (n.getToken()) {
      case LET:
        validateChildCountIn(n, 1, 2);
        validatePattern(n.getFirstChild());
        if (n.hasTwoChildren()) {
          validateExpression(n.getLastChild());
        }
        return;
      case EXPR_STMT:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case FUNCTION:
      case CONST_ITEM:
        validateItem(n);
        return;
      default:
        violation("Expected statement but was " + n.getToken(), n);
    }
  }

  private void validateExpression(Node n) {
    switch (n.getToken()) {
      case TRY_BLOCK:
        violation("Try blocks must not survive lowering", n);
        return;
      case QUESTION:
        if (requireQuestionMarksLowered) {
          violation("? operators must not survive lowering", n);
        }
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case BLOCK:
        validateBlock(n);
        return;
      case LABELED_BLOCK:
        validateLabeledBlock(n);
        return;
      case BREAK:
        validateBreak(n);
        return;
      case CONTINUE:
        validateContinue(n);
        return;
      case RETURN:
        validateChildCountIn(n, 0, 1);
        validateChildExpressions(n);
        return;
      case MATCH:
        validateMatch(n);
        return;
      case IF:
        validateIf(n);
        return;
      case LOOP:
        validateChildCount(n, 1);
        validateBlock(n.getFirstChild());
        return;
      case WHILE:
        validateChildCount(n, 2);
        validateExpression(n.getFirstChild());
        validateBlock(n.getLastChild());
        return;
      case CLOSURE:
        validateChildCount(n, 2);
        validateParamList(n.getFirstChild());
        Deque<String> outerLabels = enterLabelScope();
        validateExpression(n.getLastChild());
        labels = outerLabels;
        return;
      case CALL:
        validateMinimumChildCount(n, 1);
        validateChildExpressions(n);
        return;
      case METHOD_CALL:
        validateMethodCall(n);
        return;
      case FIELD:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case PATH:
      case NAME:
      case INTEGER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case UNIT:
        validateChildCount(n, 0);
        return;
      case TUPLE:
      case ARRAY:
        validateChildExpressions(n);
        return;
      default:
        if (n.getToken().isBinaryOperator()) {
          validateChildCount(n, 2);
          validateChildExpressions(n);
        } else if (n.getToken().isUnaryOperator()) {
          validateChildCount(n, 1);
          validateChildExpressions(n);
        } else {
          violation("Expected expression but was " + n.getToken(), n);
        }
    }
  }

  private void validateChildExpressions(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateExpression(c);
    }
  }

  private void validateLabeledBlock(Node n) {
    validateChildCount(n, 2);
    Node label = n.getFirstChild();
    validateNodeType(Token.LABEL_NAME, label);
    if (labels.contains(label.getString())) {
      violation("Duplicate label " + label.getString(), label);
    }
    labels.push(label.getString());
    validateBlock(n.getLastChild());
    labels.pop();
  }

  private void validateBreak(Node n) {
    validateChildCountIn(n, 0, 2);
    Node value = n.getFirstChild();
    if (value != null && value.isLabelName()) {
      validateLabelReference(value);
      value = value.getNext();
    } else if (n.hasTwoChildren()) {
      violation("Expected LABEL_NAME but was " + n.getFirstChild().getToken(), n);
      return;
    }
    if (value != null) {
      validateExpression(value);
    }
  }

  private void validateContinue(Node n) {
    validateChildCountIn(n, 0, 1);
    if (n.hasChildren()) {
      validateLabelReference(n.getFirstChild());
    }
  }

  private void validateLabelReference(Node label) {
    validateNodeType(Token.LABEL_NAME, label);
    if (label.isLabelName() && !labels.contains(label.getString())) {
      violation("Jump to undefined label " + label.getString(), label);
    }
  }

  private void validateMatch(Node n) {
    validateMinimumChildCount(n, 1);
    validateExpression(n.getFirstChild());
    for (Node arm = n.getSecondChild(); arm != null; arm = arm.getNext()) {
      validateMatchArm(arm);
    }
  }

  private void validateMatchArm(Node n) {
    if (!n.isMatchArm()) {
      violation("Expected MATCH_ARM but was " + n.getToken(), n);
      return;
    }
    validateChildCount(n, 2);
    validatePattern(n.getFirstChild());
    validateExpression(n.getLastChild());
  }

  private void validateIf(Node n) {
    validateChildCountIn(n, 2, 3);
    validateExpression(n.getFirstChild());
    validateBlock(n.getSecondChild());
    Node elseBranch = n.getChildAtIndex(2);
    if (elseBranch != null) {
      if (elseBranch.getToken() == Token.IF) {
        validateIf(elseBranch);
      } else {
        validateBlock(elseBranch);
      }
    }
  }

  private void validateMethodCall(Node n) {
    validateMinimumChildCount(n, 2);
    validateExpression(n.getFirstChild());
    validateName(n.getSecondChild());
    for (Node arg = n.getSecondChild().getNext(); arg != null; arg = arg.getNext()) {
      validateExpression(arg);
    }
  }

  private void validatePattern(Node n) {
    switch (n.getToken()) {
      case IDENT_PATTERN:
      case WILDCARD_PATTERN:
      case INTEGER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case UNIT:
      case PATH:
        validateChildCount(n, 0);
        return;
      case TUPLE_STRUCT_PATTERN:
        validateMinimumChildCount(n, 1);
        validateNodeType(Token.PATH, n.getFirstChild());
        for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
          validatePattern(c);
        }
        return;
      default:
        violation("Expected pattern but was " + n.getToken(), n);
    }
  }

  private void validateName(Node n) {
    validateNodeType(Token.NAME, n);
    validateChildCount(n, 0);
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }

  private void validateNodeType(Token type, Node n) {
    if (n.getToken() != type) {
      violation("Expected " + type + " but was " + n.getToken(), n);
    }
  }

  private void validateChildCount(Node n, int expected) {
    int count = n.getChildCount();
    if (expected != count) {
      violation("Expected " + expected + " children, but was " + count, n);
    }
  }

  private void validateChildCountIn(Node n, int min, int max) {
    int count = n.getChildCount();
    if (count < min || count > max) {
      violation("Expected child count in [" + min + ", " + max + "], but was " + count, n);
    }
  }

  private void validateMinimumChildCount(Node n, int min) {
    int count = n.getChildCount();
    if (count < min) {
      violation("Expected at least " + min + " children, but was " + count, n);
    }
  }
}
