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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testBlockTail() {
    Node block = IR.block(IR.let("x", IR.integer(1)), IR.name("x"));
    assertThat(block.getChildCount()).isEqualTo(2);
    assertThat(IR.block().hasChildren()).isFalse();
  }

  @Test
  public void testBlockRejectsExpressionBeforeTail() {
    assertThrows(IllegalStateException.class, () -> IR.block(IR.name("x"), IR.name("y")));
  }

  @Test
  public void testBlockAllowsItems() {
    Node block = IR.block(IR.constItem("C", IR.integer(1)), IR.name("C"));
    assertThat(IR.isItem(block.getFirstChild())).isTrue();
  }

  @Test
  public void testTryBlockRequiresBlock() {
    assertThrows(IllegalStateException.class, () -> IR.tryBlock(IR.name("x")));
    assertThat(IR.tryBlock(IR.block()).isTryBlock()).isTrue();
  }

  @Test
  public void testLabeledBlock() {
    Node n = IR.labeledBlock("'a", IR.block());
    assertThat(n.getFirstChild().isLabelName()).isTrue();
    assertThat(n.getFirstChild().getString()).isEqualTo("'a");
    assertThrows(IllegalArgumentException.class, () -> IR.labelName(""));
  }

  @Test
  public void testExpressionPositionsRejectStatements() {
    assertThrows(IllegalStateException.class, () -> IR.question(IR.exprStmt(IR.unit())));
    assertThrows(IllegalStateException.class, () -> IR.returnNode(IR.let("x", IR.unit())));
    assertThrows(IllegalStateException.class, () -> IR.call(IR.name("f"), IR.identPattern("x")));
  }

  @Test
  public void testMatchRequiresArms() {
    assertThrows(IllegalStateException.class, () -> IR.match(IR.name("x"), IR.name("y")));
    Node match =
        IR.match(
            IR.name("x"),
            IR.matchArm(IR.tupleStructPattern("Some", IR.identPattern("v")), IR.name("v")),
            IR.matchArm(IR.wildcardPattern(), IR.integer(0)));
    assertThat(match.getChildCount()).isEqualTo(3);
  }

  @Test
  public void testMatchArmRequiresPattern() {
    assertThrows(IllegalStateException.class, () -> IR.matchArm(IR.call(IR.name("f")), IR.unit()));
  }

  @Test
  public void testOperators() {
    assertThat(IR.add(IR.integer(1), IR.integer(2)).getToken()).isEqualTo(Token.ADD);
    assertThat(IR.not(IR.trueNode()).getToken()).isEqualTo(Token.NOT);
    assertThrows(IllegalArgumentException.class, () -> IR.binary(Token.NOT, IR.unit(), IR.unit()));
    assertThrows(IllegalArgumentException.class, () -> IR.unary(Token.ADD, IR.unit()));
  }

  @Test
  public void testIfElseChain() {
    Node inner = IR.ifNode(IR.falseNode(), IR.block());
    Node outer = IR.ifNode(IR.trueNode(), IR.block(), inner);
    assertThat(outer.getLastChild()).isSameInstanceAs(inner);
    assertThrows(
        IllegalStateException.class,
        () -> IR.ifNode(IR.trueNode(), IR.block(), IR.name("x")));
  }

  @Test
  public void testFunctionAndClosure() {
    Node fn = IR.function("f", IR.paramList("a", "b"), IR.block());
    assertThat(fn.getFirstChild().getString()).isEqualTo("f");
    assertThat(fn.getSecondChild().getChildCount()).isEqualTo(2);
    assertThrows(IllegalStateException.class, () -> IR.function("f", IR.block(), IR.block()));
    assertThat(IR.closure(IR.paramList(), IR.name("x")).isClosure()).isTrue();
  }

  @Test
  public void testClassification() {
    assertThat(IR.isStatement(IR.let("x", IR.unit()))).isTrue();
    assertThat(IR.isStatement(IR.name("x"))).isFalse();
    assertThat(IR.isPattern(IR.path("None"))).isTrue();
    assertThat(IR.isPattern(IR.name("x"))).isFalse();
    assertThat(IR.mayBeExpression(IR.labeledBlock("l", IR.block()))).isTrue();
    assertThat(IR.mayBeExpression(IR.paramList())).isFalse();
  }
}
