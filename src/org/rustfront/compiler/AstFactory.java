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

import static com.google.common.base.Preconditions.checkState;

import org.rustfront.ast.IR;
import org.rustfront.ast.Node;

/**
 * Creates the nodes that lowering passes synthesize.
 *
 * <p>Every lang item is referenced by its fully qualified path so that lowered code does not depend
 * on what is in scope at the rewrite site.
 */
final class AstFactory {

  static final String TRY_BRANCH = "core::ops::Try::branch";
  static final String TRY_FROM_OUTPUT = "core::ops::Try::from_output";
  static final String FROM_RESIDUAL = "core::ops::FromResidual::from_residual";
  static final String CONTROL_FLOW_CONTINUE = "core::ops::ControlFlow::Continue";
  static final String CONTROL_FLOW_BREAK = "core::ops::ControlFlow::Break";
  static final String PANIC = "core::panicking::panic";

  AstFactory() {}

  /** Creates {@code core::ops::Try::from_output(value)}. */
  Node createFromOutput(Node value) {
    return IR.call(IR.path(TRY_FROM_OUTPUT), value);
  }

  /** Creates {@code core::ops::Try::from_output(())}. */
  Node createFromOutputOfUnit() {
    return createFromOutput(IR.unit());
  }

  /** Creates {@code core::ops::FromResidual::from_residual(residualName)}. */
  Node createFromResidual(String residualName) {
    return IR.call(IR.path(FROM_RESIDUAL), IR.name(residualName));
  }

  /** Creates {@code break 'label value}. */
  Node createBreak(String label, Node value) {
    return IR.breakNode(label, value);
  }

  /** Creates {@code return value}. */
  Node createReturn(Node value) {
    return IR.returnNode(value);
  }

  /** Creates {@code 'label: block}. */
  Node createLabeledBlock(String label, Node block) {
    return IR.labeledBlock(label, block);
  }

  /**
   * Creates the match a propagation operator lowers to:
   *
   * <pre>
   * match core::ops::Try::branch(operand) {
   *   core::ops::ControlFlow::Continue(valueName) =&gt; valueName,
   *   core::ops::ControlFlow::Break(residualName) =&gt; failureExit,
   * }
   * </pre>
   *
   * @param operand a detached expression
   * @param failureExit a detached diverging expression, which should consume {@code residualName}
   */
  Node createBranchMatch(Node operand, String valueName, String residualName, Node failureExit) {
    checkState(!operand.hasParent(), operand);
    checkState(!failureExit.hasParent(), failureExit);
    Node branch = IR.call(IR.path(TRY_BRANCH), operand);
    Node continueArm =
        IR.matchArm(
            IR.tupleStructPattern(CONTROL_FLOW_CONTINUE, IR.identPattern(valueName)),
            IR.name(valueName));
    Node breakArm =
        IR.matchArm(
            IR.tupleStructPattern(CONTROL_FLOW_BREAK, IR.identPattern(residualName)), failureExit);
    return IR.match(branch, continueArm, breakArm);
  }

  /**
   * Creates {@code { operand; core::panicking::panic(message) }}, which keeps the operand evaluated
   * but never produces a value.
   */
  Node createPanicPlaceholder(Node operand, String message) {
    checkState(!operand.hasParent(), operand);
    return IR.block(IR.exprStmt(operand), IR.call(IR.path(PANIC), IR.string(message)));
  }
}
