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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Span;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A named declaration: a variable, parameter, property, constant or method.
 *
 * <p>A symbol is created once, at its declaring occurrence, and afterwards only changes by being
 * marked used. A fresh analysis pass creates fresh symbols.
 */
public final class Symbol {
  private final String name;
  private final SymbolKind kind;
  private final Node nameNode;
  private final @Nullable Node declarationNode;
  private final @Nullable String typeName;
  private final boolean implicit;
  private final List<Span> references = new ArrayList<>();
  private @Nullable Scope scope;
  private boolean used;

  private Symbol(
      String name,
      SymbolKind kind,
      Node nameNode,
      @Nullable Node declarationNode,
      @Nullable String typeName,
      boolean implicit) {
    this.name = checkNotNull(name);
    this.kind = checkNotNull(kind);
    this.nameNode = checkNotNull(nameNode);
    this.declarationNode = declarationNode;
    this.typeName = typeName;
    this.implicit = implicit;
  }

  /**
   * Creates a symbol for the NAME node {@code nameNode}, declared by the statement or member
   * {@code declarationNode}.
   */
  public static Symbol create(SymbolKind kind, Node nameNode, @Nullable Node declarationNode) {
    String typeName = declarationNode == null ? null : declarationNode.getTypeName();
    return new Symbol(
        nameNode.getStringOrEmpty(), kind, nameNode, declarationNode, typeName, false);
  }

  /** A symbol the language declares without any source text, such as a setter's new value. */
  public static Symbol implicit(SymbolKind kind, String name, Node scopeRoot) {
    return new Symbol(name, kind, scopeRoot, scopeRoot, null, true);
  }

  public String getName() {
    return name;
  }

  public SymbolKind getKind() {
    return kind;
  }

  /** The NAME node at the declaring occurrence. */
  public Node getNameNode() {
    return nameNode;
  }

  public Span getDeclaringSpan() {
    return implicit ? Span.NONE : nameNode.getSpan();
  }

  /** The declaration statement or member this symbol's name belongs to. */
  public @Nullable Node getDeclarationNode() {
    return declarationNode;
  }

  public @Nullable String getTypeName() {
    return typeName;
  }

  public boolean isImplicit() {
    return implicit;
  }

  public boolean isUsed() {
    return used;
  }

  /** Spans of the references that marked this symbol, in traversal order. */
  public ImmutableList<Span> getReferences() {
    return ImmutableList.copyOf(references);
  }

  /** The scope this symbol was registered in. */
  public Scope getScope() {
    checkState(scope != null, "%s was never registered", this);
    return scope;
  }

  void setScope(Scope scope) {
    checkState(this.scope == null, "%s is already registered in %s", this, this.scope);
    this.scope = scope;
  }

  void markUsed(Span reference) {
    used = true;
    if (reference.isValid() && !references.contains(reference)) {
      references.add(reference);
    }
  }

  @Override
  public String toString() {
    return kind + " " + name + " " + getDeclaringSpan();
  }
}
