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
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rustfront.ast.IR;
import org.rustfront.ast.Node;
import org.rustfront.ast.Token;

@RunWith(JUnit4.class)
public final class NodeTraversalTest {

  private final Compiler compiler = new Compiler(new SortingErrorManager());

  private static Node sample() {
    return IR.root(
        IR.module(
            "a.rs",
            IR.function(
                "f",
                IR.paramList(),
                IR.block(
                    IR.exprStmt(IR.call(IR.path("g"))), IR.add(IR.integer(1), IR.integer(2))))));
  }

  @Test
  public void testPreAndPostOrder() {
    List<String> events = new ArrayList<>();
    NodeTraversal.traverse(
        compiler,
        sample().getFirstChild().getFirstChild().getLastChild(),
        new NodeTraversal.Callback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            events.add("enter " + n.getToken());
            return true;
          }

          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            events.add("exit " + n.getToken());
          }
        });
    assertThat(events)
        .containsExactly(
            "enter BLOCK",
            "enter EXPR_STMT",
            "enter CALL",
            "enter PATH",
            "exit PATH",
            "exit CALL",
            "exit EXPR_STMT",
            "enter ADD",
            "enter INTEGER",
            "exit INTEGER",
            "enter INTEGER",
            "exit INTEGER",
            "exit ADD",
            "exit BLOCK")
        .inOrder();
  }

  @Test
  public void testSkippedChildren() {
    List<Token> visited = new ArrayList<>();
    NodeTraversal.traverse(
        compiler,
        sample(),
        new NodeTraversal.Callback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            return !n.isFunction();
          }

          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            visited.add(n.getToken());
          }
        });
    assertThat(visited).containsExactly(Token.MODULE, Token.ROOT).inOrder();
  }

  @Test
  public void testReplacementIsNotRevisited() {
    Node root = sample();
    List<Token> visited = new ArrayList<>();
    NodeTraversal.traverse(
        compiler,
        root,
        new NodeTraversal.AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            visited.add(n.getToken());
            if (n.isCall()) {
              n.replaceWith(IR.call(IR.path("h"), IR.integer(3)));
            }
          }
        });
    assertThat(visited.stream().filter(token -> token == Token.CALL).count()).isEqualTo(1);
    assertThat(visited.stream().filter(token -> token == Token.INTEGER).count()).isEqualTo(2);
    assertThat(new CodePrinter().print(root)).isEqualTo("fn f() { h(3); 1 + 2 }");
  }

  @Test
  public void testSourceNameAndCurrentNode() {
    List<String> seen = new ArrayList<>();
    NodeTraversal.traverse(
        compiler,
        sample(),
        new NodeTraversal.AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            assertThat(t.getCurrentNode()).isSameInstanceAs(n);
            assertThat(t.getCompiler()).isSameInstanceAs(compiler);
            if (n.isPath()) {
              seen.add(t.getSourceName());
            }
          }
        });
    assertThat(seen).containsExactly("a.rs");
  }

  @Test
  public void testReport() {
    Node root = sample();
    DiagnosticType type = DiagnosticType.warning("TEST_PATH", "Found path {0}");
    NodeTraversal.traverse(
        compiler,
        root,
        new NodeTraversal.AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isPath()) {
              t.report(n, type, n.getString());
            }
          }
        });
    RsError warning = compiler.getErrorManager().getWarnings().get(0);
    assertThat(warning.description()).isEqualTo("Found path g");
    assertThat(warning.sourceName()).isEqualTo("a.rs");
  }

  @Test
  public void testUnexpectedExceptionCarriesNodeContext() {
    Node root = sample();
    RuntimeException e =
        assertThrows(
            RuntimeException.class,
            () ->
                NodeTraversal.traverse(
                    compiler,
                    root,
                    new NodeTraversal.AbstractPostOrderCallback() {
                      @Override
                      public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
                        if (n.isCall()) {
                          throw new IllegalStateException("boom");
                        }
                      }
                    }));
    assertThat(e).hasMessageThat().contains("INTERNAL COMPILER ERROR");
    assertThat(e).hasMessageThat().contains("boom");
    assertThat(e).hasMessageThat().contains("Node(CALL)");
    assertThat(e).hasMessageThat().contains("Parent(EXPR_STMT)");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }
}
