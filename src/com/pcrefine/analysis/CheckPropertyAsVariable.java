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

import com.pcrefine.ast.Node;
import com.pcrefine.ast.Visibility;
import org.jspecify.annotations.Nullable;

/**
 * Highlights public and protected properties that a method reads or writes through their backing
 * variable ({@code &Name}) instead of through the property. Constructors, methods named like
 * their class, are exempt since they commonly initialize the backing storage.
 *
 * <p>A local, parameter or instance variable spelled like the property shadows it, so references
 * to such a variable are never flagged.
 */
public final class CheckPropertyAsVariable extends AnalysisPass implements NodeTraversal.Callback {

  static final DiagnosticType PROPERTY_AS_VARIABLE =
      DiagnosticType.make(
          "PC_PROPERTY_AS_VARIABLE",
          CheckLevel.WARNING,
          IndicatorType.HIGHLIGHTER,
          0x4DB7FF80,
          "Property used as variable outside constructor");

  @Override
  protected void process(Node root) {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isUserVariable() || NodeTraversal.isDeclarationName(n, parent)) {
      return;
    }
    Scope scope = t.getScope();
    if (scope == null) {
      return;
    }
    String name = n.getStringOrEmpty();
    SymbolTable symbols = t.getSymbolTable();
    if (symbols.lookup(name, scope) != null) {
      return;
    }
    Symbol property = symbols.lookup(name.substring(1), scope);
    if (property == null || property.getKind() != SymbolKind.PROPERTY) {
      return;
    }
    Node declaration = property.getDeclarationNode();
    Visibility visibility = declaration == null ? null : declaration.getVisibility();
    if (visibility == null || !visibility.isExternallyVisible()) {
      return;
    }
    Scope methodScope = scope.getClosestScopeOfKind(ScopeKind.METHOD);
    if (methodScope == null) {
      return;
    }
    Node method = methodScope.getRootNode();
    Node type = method.getParent();
    if (type != null && AbstractMemberCollector.isConstructor(method, type)) {
      return;
    }
    report(n, PROPERTY_AS_VARIABLE);
  }
}
