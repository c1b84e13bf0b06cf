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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rustfront.ast.IR;
import org.rustfront.ast.Node;
import org.rustfront.ast.Token;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static String print(Node n) {
    return new CodePrinter().print(n);
  }

  @Test
  public void testFunction() {
    Node fn =
        IR.function(
            "add",
            IR.paramList("a", "b"),
            IR.block(IR.add(IR.name("a"), IR.name("b"))));
    assertThat(print(fn)).isEqualTo("fn add(a, b) { a + b }");
  }

  @Test
  public void testEmptyBlock() {
    assertThat(print(IR.block())).isEqualTo("{}");
  }

  @Test
  public void testModuleItemsOnOneLine() {
    Node root =
        IR.root(
            IR.module("a.rs", IR.constItem("A", IR.integer(1)), IR.constItem("B", IR.integer(2))),
            IR.module("b.rs", IR.constItem("C", IR.trueNode())));
    assertThat(print(root)).isEqualTo("const A = 1; const B = 2;\nconst C = true;");
  }

  @Test
  public void testTryBlockAndQuestion() {
    Node n = IR.tryBlock(IR.block(IR.let("x", IR.question(IR.name("y"))), IR.name("x")));
    assertThat(print(n)).isEqualTo("try { let x = y?; x }");
  }

  @Test
  public void testLabeledBlockAndJumps() {
    Node n =
        IR.labeledBlock(
            "l",
            IR.block(
                IR.exprStmt(IR.breakNode("l", IR.integer(1))),
                IR.exprStmt(IR.continueNode("l")),
                IR.exprStmt(IR.breakNode()),
                IR.returnNode(IR.unit())));
    assertThat(print(n)).isEqualTo("'l: { break 'l 1; continue 'l; break; return () }");
  }

  @Test
  public void testMatch() {
    Node n =
        IR.match(
            IR.name("x"),
            IR.matchArm(IR.tupleStructPattern("Some", IR.identPattern("v")), IR.name("v")),
            IR.matchArm(IR.wildcardPattern(), IR.integer(0)));
    assertThat(print(n)).isEqualTo("match x { Some(v) => v, _ => 0, }");
  }

  @Test
  public void testControlFlow() {
    Node n =
        IR.block(
            IR.exprStmt(IR.ifNode(IR.trueNode(), IR.block(), IR.block(IR.integer(1)))),
            IR.exprStmt(IR.whileNode(IR.falseNode(), IR.block())),
            IR.loop(IR.block(IR.exprStmt(IR.breakNode()))));
    assertThat(print(n)).isEqualTo("{ if true {} else { 1 }; while false {}; loop { break; } }");
  }

  @Test
  public void testCallsAndAccess() {
    Node n =
        IR.methodCall(
            IR.field(IR.call(IR.path("std::env::args")), "inner"), "get", IR.integer(0));
    assertThat(print(n)).isEqualTo("std::env::args().inner.get(0)");
  }

  @Test
  public void testClosure() {
    Node n = IR.closure(IR.paramList("a", "b"), IR.tuple(IR.name("a"), IR.name("b")));
    assertThat(print(n)).isEqualTo("|a, b| (a, b)");
  }

  @Test
  public void testSingleElementTuple() {
    assertThat(print(IR.tuple(IR.integer(1)))).isEqualTo("(1,)");
  }

  @Test
  public void testArrayAndLiterals() {
    Node n = IR.array(IR.trueNode(), IR.falseNode(), IR.unit(), IR.integer(-3));
    assertThat(print(n)).isEqualTo("[true, false, (), -3]");
  }

  @Test
  public void testStringEscapes() {
    assertThat(print(IR.string("a\"b\\c\nd"))).isEqualTo("\"a\\\"b\\\\c\\nd\"");
  }

  @Test
  public void testNestedOperatorsAreParenthesized() {
    Node n =
        IR.binary(
            Token.MUL,
            IR.add(IR.name("a"), IR.name("b")),
            IR.unary(Token.NEG, IR.name("c")));
    assertThat(print(n)).isEqualTo("(a + b) * (-c)");
  }

  @Test
  public void testQuestionOnOperatorIsParenthesized() {
    Node n = IR.question(IR.unary(Token.REF, IR.name("x")));
    assertThat(print(n)).isEqualTo("(&x)?");
  }

  @Test
  public void testLetWithoutInitializer() {
    assertThat(print(IR.let(IR.identPattern("x")))).isEqualTo("let x;");
  }
}
