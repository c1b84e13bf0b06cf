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
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.rustfront.ast.Node;

/**
 * Lowers the {@code ?} operators that propagate to the enclosing function or closure. Must run
 * after {@link DesugarTryBlocks}.
 *
 * <p>{@code x?} becomes:
 *
 * <pre>{@code
 * match core::ops::Try::branch(x) {
 *   core::ops::ControlFlow::Continue($val$0) => $val$0,
 *   core::ops::ControlFlow::Break($residual$0) =>
 *       return core::ops::FromResidual::from_residual($residual$0),
 * }
 * }</pre>
 */
public final class DesugarQuestionMarks implements NodeTraversal.Callback, CompilerPass {

  private static final Logger logger = Logger.getLogger(DesugarQuestionMarks.class.getName());

  private final AbstractCompiler compiler;
  private final AstFactory astFactory;

  /** The enclosing functions, closures and const items. */
  private final Deque<Node> boundaries = new ArrayDeque<>();

  private @Nullable HygienicNameGenerator nameGenerator;
  private int loweredOperators;

  public DesugarQuestionMarks(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.astFactory = compiler.createAstFactory();
  }

  @Override
  public void process(Node root) {
    checkArgument(root.isRoot() || root.isModule(), "Unexpected root %s", root);
    loweredOperators = 0;
    nameGenerator =
        new HygienicNameGenerator(
            compiler.getUniqueIdSupplier(), NodeUtil.collectIdentifiers(root));
    NodeTraversal.traverse(compiler, root, this);
    checkState(boundaries.isEmpty(), boundaries);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Lowered " + loweredOperators + " function-level ? operator(s)");
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    checkState(!n.isTryBlock(), "Try blocks must be lowered first: %s", n);
    if (NodeUtil.isPropagationBoundary(n)) {
      boundaries.push(n);
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (NodeUtil.isPropagationBoundary(n)) {
      checkState(boundaries.pop() == n, n);
    } else if (n.isQuestion()) {
      visitQuestion(t, n);
    }
  }

  private void visitQuestion(NodeTraversal t, Node question) {
    Node boundary = boundaries.peek();
    if (boundary == null || boundary.isConstItem()) {
      t.report(question, DesugarTryBlocks.MISPLACED_PROPAGATION_OPERATOR);
      DesugarTryBlocks.replaceWithPlaceholder(astFactory, question);
      return;
    }

    String id =
        checkNotNull(nameGenerator)
            .generateId(DesugarTryBlocks.VALUE_PREFIX, DesugarTryBlocks.RESIDUAL_PREFIX);
    String residualName = DesugarTryBlocks.RESIDUAL_PREFIX + id;
    Node operand = question.removeFirstChild();
    Node failureExit = astFactory.createReturn(astFactory.createFromResidual(residualName));
    Node match =
        astFactory.createBranchMatch(
            operand, DesugarTryBlocks.VALUE_PREFIX + id, residualName, failureExit);
    question.replaceWith(match.srcrefTreeIfMissing(question));
    loweredOperators++;
  }
}
