/*
 * Copyright 2026 The PCRefine Authors.
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

package com.pcrefine.analysis;

import com.pcrefine.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Greys out statements that can never run because an earlier statement of the same block, or of
 * the program's top level, transfers control away: a return, exit, throw, break, continue or error.
 */
public final class CheckUnreachableCode extends AnalysisPass {

  static final DiagnosticType UNREACHABLE_CODE =
      DiagnosticType.make(
          "PC_UNREACHABLE_CODE",
          CheckLevel.WARNING,
          IndicatorType.TEXTCOLOR,
          0x73737380,
          "Unreachable code (after return/exit/throw statement)");

  @Override
  protected void process(Node root) {
    NodeTraversal.traverse(
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isBlock() || n.getToken() == Token.PROGRAM) {
              checkBlock(n);
            }
          }
        });
  }

  private void checkBlock(Node block) {
    boolean unreachable = false;
    for (Node stmt : block.children()) {
      if (unreachable) {
        report(stmt, UNREACHABLE_CODE);
      } else if (stmt.transfersControl()) {
        unreachable = true;
      }
    }
  }
}
