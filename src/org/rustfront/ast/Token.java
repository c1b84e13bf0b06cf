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

/** The kinds of {@link Node} in the desugaring AST. */
public enum Token {
  ROOT, // holds the modules of one compilation
  MODULE, // one source file

  // Items
  FUNCTION,
  CONST_ITEM,
  PARAM_LIST,

  // Statements
  LET,
  EXPR_STMT,

  // Block-like expressions
  BLOCK,
  TRY_BLOCK, // try { ... }
  LABELED_BLOCK, // 'label: { ... }
  LABEL_NAME,
  CLOSURE,

  // Control flow
  QUESTION, // postfix ? operator
  BREAK,
  CONTINUE,
  RETURN,
  MATCH,
  MATCH_ARM,
  IF,
  LOOP,
  WHILE,

  // Calls and access
  CALL,
  METHOD_CALL,
  FIELD,
  PATH, // a::b::c
  NAME,

  // Literals
  INTEGER,
  STRINGLIT,
  TRUE,
  FALSE,
  UNIT, // ()
  TUPLE,
  ARRAY,

  // Binary operators
  ADD,
  SUB,
  MUL,
  DIV,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  AND, // &&
  OR, // ||
  ASSIGN,

  // Unary operators
  NOT,
  NEG,
  REF, // &
  DEREF, // *

  // Patterns
  IDENT_PATTERN,
  WILDCARD_PATTERN, // _
  TUPLE_STRUCT_PATTERN;

  /** Returns whether this token is a binary operator. */
  public boolean isBinaryOperator() {
    switch (this) {
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case AND:
      case OR:
      case ASSIGN:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this token is a prefix unary operator. */
  public boolean isUnaryOperator() {
    switch (this) {
      case NOT:
      case NEG:
      case REF:
      case DEREF:
        return true;
      default:
        return false;
    }
  }

  /** Returns the source text of an operator token. */
  public String operatorText() {
    switch (this) {
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case EQ:
        return "==";
      case NE:
        return "!=";
      case LT:
        return "<";
      case LE:
        return "<=";
      case GT:
        return ">";
      case GE:
        return ">=";
      case AND:
        return "&&";
      case OR:
        return "||";
      case ASSIGN:
        return "=";
      case NOT:
        return "!";
      case NEG:
        return "-";
      case REF:
        return "&";
      case DEREF:
        return "*";
      default:
        throw new IllegalStateException("Not an operator: " + this);
    }
  }
}
