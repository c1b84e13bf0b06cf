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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.rustfront.ast.IR;
import org.rustfront.ast.Node;

/**
 * Lowers try blocks into labeled blocks that later stages already understand.
 *
 * <p>A try block, {@code try { stmts; tail }}, is rewritten as:
 *
 * <pre>{@code
 * '$try$0: {
 *   stmts;
 *   core::ops::Try::from_output(tail)
 * }
 * }</pre>
 *
 * <p>and each {@code x?} whose nearest target is that try block becomes:
 *
 * <pre>{@code
 * match core::ops::Try::branch(x) {
 *   core::ops::ControlFlow::Continue($val$1) => $val$1,
 *   core::ops::ControlFlow::Break($residual$1) =>
 *       break '$try$0 core::ops::FromResidual::from_residual($residual$1),
 * }
 * }</pre>
 *
 * <p>Only the generated failure arms name the label. An unlabeled {@code break} or {@code continue}
 * written inside the try block is left unlabeled and keeps targeting the enclosing loop; later
 * stages must not let a labeled block capture unlabeled jumps.
 *
 * <p>Functions and closures stop propagation: a {@code ?} inside them belongs to their own return
 * contract and is left for {@link DesugarQuestionMarks}. A tree without try blocks is not changed
 * at all, unless it holds a {@code ?} that has nowhere to go.
 */
public final class DesugarTryBlocks implements NodeTraversal.Callback, CompilerPass {

  private static final Logger logger = Logger.getLogger(DesugarTryBlocks.class.getName());

  static final String TRY_LABEL_PREFIX = "$try$";
  static final String VALUE_PREFIX = "$val$";
  static final String RESIDUAL_PREFIX = "$residual$";

  static final String MISPLACED_OPERATOR_PANIC_MESSAGE = "misplaced ? operator";

  static final DiagnosticType MISPLACED_PROPAGATION_OPERATOR =
      DiagnosticType.error(
          "RSC_MISPLACED_PROPAGATION_OPERATOR",
          "the ? operator can only be used in a try block or in a function body");

  static final DiagnosticType UNSUPPORTED_TRY_BLOCK_TAIL =
      DiagnosticType.warning(
          "RSC_UNSUPPORTED_TRY_BLOCK_TAIL",
          "try block ends in a diverging {0}, which is kept without wrapping it as a success"
              + " value");

  private final AbstractCompiler compiler;
  private final AstFactory astFactory;
  private final Deque<PropagationTarget> targets = new ArrayDeque<>();
  private @Nullable HygienicNameGenerator nameGenerator;

  private int loweredTryBlocks;
  private int loweredOperators;

  public DesugarTryBlocks(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.astFactory = compiler.createAstFactory();
  }

  /** Where a {@code ?} exits to on failure. */
  private static final class PropagationTarget {
    enum Kind {
      /** A try block, which owns {@code label}. */
      TRY_BLOCK,
      /** A function or closure body. */
      FUNCTION,
      /** A const initializer, which has nowhere to propagate to. */
      NONE
    }

    final Node root;
    final Kind kind;
    final @Nullable String label;

    PropagationTarget(Node root, Kind kind, @Nullable String label) {
      this.root = root;
      this.kind = kind;
      this.label = label;
    }
  }

  /**
   * @param root a ROOT or MODULE node. Context outside of it is not considered.
   */
  @Override
  public void process(Node root) {
    checkArgument(root.isRoot() || root.isModule(), "Unexpected root %s", root);
    loweredTryBlocks = 0;
    loweredOperators = 0;
    nameGenerator =
        new HygienicNameGenerator(
            compiler.getUniqueIdSupplier(), NodeUtil.collectIdentifiers(root));
    NodeTraversal.traverse(compiler, root, this);
    checkState(targets.isEmpty(), targets);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Lowered "
              + loweredTryBlocks
              + " try block(s) and "
              + loweredOperators
              + " ? operator(s)");
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case TRY_BLOCK:
        String label = checkNotNull(nameGenerator).generateName(TRY_LABEL_PREFIX);
        targets.push(new PropagationTarget(n, PropagationTarget.Kind.TRY_BLOCK, label));
        break;
      case FUNCTION:
      case CLOSURE:
        targets.push(new PropagationTarget(n, PropagationTarget.Kind.FUNCTION, null));
        break;
      case CONST_ITEM:
        targets.push(new PropagationTarget(n, PropagationTarget.Kind.NONE, null));
        break;
      default:
        break;
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case QUESTION:
        visitQuestion(t, n);
        break;
      case TRY_BLOCK:
        visitTryBlock(t, n, popTarget(n));
        break;
      case FUNCTION:
      case CLOSURE:
      case CONST_ITEM:
        popTarget(n);
        break;
      default:
        break;
    }
  }

  private PropagationTarget popTarget(Node n) {
    PropagationTarget target = targets.pop();
    checkState(target.root == n, "Unbalanced propagation targets at %s", n);
    return target;
  }

  private void visitQuestion(NodeTraversal t, Node question) {
    PropagationTarget target = targets.peek();
    if (target == null || target.kind == PropagationTarget.Kind.NONE) {
      reportMisplacedOperator(t, question);
      return;
    }
    switch (target.kind) {
      case TRY_BLOCK:
        lowerQuestion(question, checkNotNull(target.label));
        break;
      case FUNCTION:
        if (!compiler.getOptions().shouldPropagateToEnclosingFunction()) {
          reportMisplacedOperator(t, question);
        }
        break;
      default:
        throw new IllegalStateException("Unexpected target " + target.kind);
    }
  }

  private void lowerQuestion(Node question, String label) {
    String id = checkNotNull(nameGenerator).generateId(VALUE_PREFIX, RESIDUAL_PREFIX);
    String residualName = RESIDUAL_PREFIX + id;
    Node operand = question.removeFirstChild();
    Node failureExit =
        astFactory.createBreak(label, astFactory.createFromResidual(residualName));
    Node match =
        astFactory.createBranchMatch(operand, VALUE_PREFIX + id, residualName, failureExit);
    question.replaceWith(match.srcrefTreeIfMissing(question));
    loweredOperators++;
  }

  private void reportMisplacedOperator(NodeTraversal t, Node question) {
    t.report(question, MISPLACED_PROPAGATION_OPERATOR);
    replaceWithPlaceholder(astFactory, question);
  }

  /** Replaces a {@code ?} that has no valid target with an expression that cannot complete. */
  static void replaceWithPlaceholder(AstFactory astFactory, Node question) {
    Node operand = question.removeFirstChild();
    Node placeholder = astFactory.createPanicPlaceholder(operand, MISPLACED_OPERATOR_PANIC_MESSAGE);
    question.replaceWith(placeholder.srcrefTreeIfMissing(question));
  }

  private void visitTryBlock(NodeTraversal t, Node tryBlock, PropagationTarget target) {
    checkState(target.kind == PropagationTarget.Kind.TRY_BLOCK, target.kind);
    Node block = tryBlock.getOnlyChild().detach();
    checkState(block.isBlock(), block);

    Node tail = NodeUtil.getBlockTail(block);
    if (tail == null) {
      block.addChildToBack(astFactory.createFromOutputOfUnit().srcrefTree(tryBlock));
    } else if (NodeUtil.isDivergingJump(tail)) {
      String keyword = tail.getToken().name().toLowerCase(Locale.ROOT);
      t.report(tail, UNSUPPORTED_TRY_BLOCK_TAIL, keyword);
      tail.detach();
      block.addChildToBack(IR.exprStmt(tail).srcref(tail));
    } else {
      tail.detach();
      block.addChildToBack(astFactory.createFromOutput(tail).srcrefTreeIfMissing(tail));
    }

    Node labeled = astFactory.createLabeledBlock(checkNotNull(target.label), block);
    tryBlock.replaceWith(labeled.srcrefTreeIfMissing(tryBlock));
    loweredTryBlocks++;
  }
}
