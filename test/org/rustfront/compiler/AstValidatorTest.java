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
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rustfront.ast.IR;
import org.rustfront.ast.Node;
import org.rustfront.ast.Token;

@RunWith(JUnit4.class)
public final class AstValidatorTest {

  private final List<String> violations = new ArrayList<>();
  private AstValidator validator;

  @Before
  public void setUp() {
    violations.clear();
    validator = new AstValidator((message, n) -> violations.add(message));
  }

  private static Node fn(Node... body) {
    return IR.function("f", IR.paramList(), IR.block(body));
  }

  private void expectValid(Node module) {
    validator.process(IR.root(module));
    assertThat(violations).isEmpty();
  }

  private void expectInvalid(Node module, String violation) {
    validator.process(IR.root(module));
    assertThat(violations).containsExactly(violation);
  }

  @Test
  public void testLoweredTryBlockIsValid() {
    expectValid(
        IR.module(
            "a.rs",
            fn(
                IR.let(
                    "r",
                    IR.labeledBlock(
                        "$try$0",
                        IR.block(
                            IR.exprStmt(IR.breakNode("$try$0", IR.integer(1))),
                            IR.call(IR.path("core::ops::Try::from_output"), IR.unit())))))));
  }

  @Test
  public void testRemainingTryBlock() {
    expectInvalid(
        IR.module("a.rs", fn(IR.let("r", IR.tryBlock(IR.block())))),
        "Try blocks must not survive lowering");
  }

  @Test
  public void testRemainingOperator() {
    Node module = IR.module("a.rs", fn(IR.question(IR.name("x"))));
    expectInvalid(module.cloneTree(), "? operators must not survive lowering");

    violations.clear();
    validator.setRequireQuestionMarksLowered(false);
    expectValid(module);
  }

  @Test
  public void testBreakToUndefinedLabel() {
    expectInvalid(
        IR.module("a.rs", fn(IR.exprStmt(IR.breakNode("outer")))),
        "Jump to undefined label outer");
  }

  @Test
  public void testContinueToEnclosingLabel() {
    expectValid(
        IR.module(
            "a.rs",
            fn(IR.labeledBlock("outer", IR.block(IR.exprStmt(IR.continueNode("outer")))))));
  }

  @Test
  public void testLabelsDoNotCrossClosures() {
    Node closure = IR.closure(IR.paramList(), IR.breakNode("outer"));
    expectInvalid(
        IR.module(
            "a.rs",
            fn(IR.labeledBlock("outer", IR.block(IR.let("c", closure))))),
        "Jump to undefined label outer");
  }

  @Test
  public void testLabelsDoNotCrossFunctions() {
    Node inner = IR.function("g", IR.paramList(), IR.block(IR.breakNode("outer")));
    expectInvalid(
        IR.module("a.rs", fn(IR.labeledBlock("outer", IR.block(inner)))),
        "Jump to undefined label outer");
  }

  @Test
  public void testLabelIsOutOfScopeAfterItsBlock() {
    expectInvalid(
        IR.module(
            "a.rs",
            fn(
                IR.exprStmt(IR.labeledBlock("outer", IR.block())),
                IR.breakNode("outer"))),
        "Jump to undefined label outer");
  }

  @Test
  public void testDuplicateNestedLabel() {
    expectInvalid(
        IR.module(
            "a.rs",
            fn(IR.labeledBlock("l", IR.block(IR.labeledBlock("l", IR.block()))))),
        "Duplicate label l");
  }

  @Test
  public void testMissingSourceFileName() {
    Node module = IR.module("a.rs", fn());
    module.setSourceFileName(null);
    expectInvalid(module, "Missing source file name.");
  }

  @Test
  public void testStatementInExpressionPosition() {
    Node call = IR.call(IR.path("g"));
    call.addChildToBack(IR.let("x", IR.integer(1)));
    expectInvalid(IR.module("a.rs", fn(call)), "Expected expression but was LET");
  }

  @Test
  public void testBadChildCount() {
    Node not = new Node(Token.NOT, IR.name("a"), IR.name("b"));
    expectInvalid(IR.module("a.rs", fn(not)), "Expected 1 children, but was 2");
  }

  @Test
  public void testBadMatchArm() {
    Node match = IR.match(IR.name("x"));
    match.addChildToBack(IR.name("y"));
    expectInvalid(IR.module("a.rs", fn(match)), "Expected MATCH_ARM but was NAME");
  }

  @Test
  public void testExpressionsAndPatternsAreValid() {
    expectValid(
        IR.module(
            "a.rs",
            IR.constItem("C", IR.array(IR.integer(1), IR.integer(2))),
            fn(
                IR.let(IR.wildcardPattern()),
                IR.let("t", IR.tuple(IR.string("s"), IR.trueNode(), IR.falseNode())),
                IR.exprStmt(
                    IR.ifNode(
                        IR.not(IR.name("t")),
                        IR.block(IR.exprStmt(IR.returnNode())),
                        IR.ifNode(IR.trueNode(), IR.block(), IR.block()))),
                IR.exprStmt(
                    IR.whileNode(
                        IR.falseNode(), IR.block(IR.exprStmt(IR.loop(IR.block(IR.breakNode())))))),
                IR.match(
                    IR.methodCall(IR.field(IR.name("t"), "0"), "len"),
                    IR.matchArm(
                        IR.tupleStructPattern("Some", IR.identPattern("n")),
                        IR.unary(Token.DEREF, IR.name("n"))),
                    IR.matchArm(IR.wildcardPattern(), IR.integer(0))))));
  }

  @Test
  public void testDefaultHandlerThrows() {
    Node root = IR.root(IR.module("a.rs", fn(IR.let("r", IR.tryBlock(IR.block())))));
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> new AstValidator().process(root));
    assertThat(e).hasMessageThat().startsWith("Try blocks must not survive lowering");
  }

  @Test
  public void testValidatesModuleRoot() {
    validator.process(IR.module("a.rs", fn(IR.tryBlock(IR.block()))));
    assertThat(violations).containsExactly("Try blocks must not survive lowering");
  }
}
