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
import org.jspecify.annotations.Nullable;

/** Reports user variables that are not declared in any enclosing scope. */
public final class CheckUndefinedVariables extends AnalysisPass {

  static final DiagnosticType UNDEFINED_VARIABLE =
      DiagnosticType.warning("PC_UNDEFINED_VARIABLE", "Undefined variable: {0}");

  @Override
  public boolean runsOnIncompleteParse() {
    return false;
  }

  @Override
  protected void process(Node root) {
    NodeTraversal t =
        NodeTraversal.traverse(
            root,
            new AbstractPostOrderCallback() {
              @Override
              public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
            });
    for (Node reference : t.getSymbolTable().getUndefinedReferences()) {
      report(reference, UNDEFINED_VARIABLE, reference.getStringOrEmpty());
    }
  }
}
