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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A lexical scope frame.
 *
 * <p>Scopes live in a {@link ScopeTable} and refer to their parent by index, so the parent of a
 * scope is fixed when the scope is created and the scopes of a pass always form a tree. A scope
 * accepts declarations until traversal leaves it, at which point it is finalized.
 *
 * <p>PeopleCode names are case-insensitive: {@code &Total} and {@code &total} are the same
 * variable.
 */
public final class Scope {
  private final ScopeTable table;
  private final int index;
  private final int parentIndex;
  private final int depth;
  private final ScopeKind kind;
  private final Node rootNode;
  private final Map<String, List<Symbol>> symbols = new LinkedHashMap<>();
  private final List<Symbol> declarationOrder = new ArrayList<>();
  private boolean finalized;

  Scope(ScopeTable table, int index, @Nullable Scope parent, ScopeKind kind, Node rootNode) {
    this.table = table;
    this.index = index;
    this.parentIndex = parent == null ? -1 : parent.index;
    this.depth = parent == null ? 0 : parent.depth + 1;
    this.kind = checkNotNull(kind);
    this.rootNode = checkNotNull(rootNode);
  }

  static String normalize(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  public int getIndex() {
    return index;
  }

  /** Index of the parent scope in the table, or -1 for a root scope. */
  public int getParentIndex() {
    return parentIndex;
  }

  /** Returns the parent scope, or null if this is a root scope. */
  public @Nullable Scope getParent() {
    return parentIndex < 0 ? null : table.get(parentIndex);
  }

  /** The depth of the scope. A root scope has depth 0. */
  public int getDepth() {
    return depth;
  }

  public ScopeKind getKind() {
    return kind;
  }

  public Node getRootNode() {
    return rootNode;
  }

  /** The name of the method, function, accessor or class that owns this scope, if any. */
  public @Nullable String getName() {
    return kind == ScopeKind.BLOCK || kind == ScopeKind.GLOBAL ? null : rootNode.getString();
  }

  public boolean isFinalized() {
    return finalized;
  }

  /** Returns this scope or the closest enclosing scope of the given kind, or null. */
  public @Nullable Scope getClosestScopeOfKind(ScopeKind kind) {
    for (Scope s = this; s != null; s = s.getParent()) {
      if (s.kind == kind) {
        return s;
      }
    }
    return null;
  }

  /**
   * Returns the kind of the closest enclosing scope that is not a {@link ScopeKind#BLOCK}, which
   * is what decides how a local variable is described.
   */
  public ScopeKind getContainerKind() {
    for (Scope s = this; s != null; s = s.getParent()) {
      if (s.kind != ScopeKind.BLOCK) {
        return s.kind;
      }
    }
    return kind;
  }

  public boolean hasOwnSymbol(String name) {
    return symbols.containsKey(normalize(name));
  }

  /** All occurrences declared in this scope under {@code name}, in declaration order. */
  public ImmutableList<Symbol> getOwnSymbols(String name) {
    List<Symbol> found = symbols.get(normalize(name));
    return found == null ? ImmutableList.of() : ImmutableList.copyOf(found);
  }

  public @Nullable Symbol getOwnSymbol(String name) {
    List<Symbol> found = symbols.get(normalize(name));
    return found == null ? null : found.get(0);
  }

  /** Every symbol declared in this scope, in declaration order. */
  public ImmutableList<Symbol> getAllSymbols() {
    return ImmutableList.copyOf(declarationOrder);
  }

  void declare(Symbol symbol) {
    checkState(!finalized, "Cannot declare %s in finalized %s", symbol, this);
    symbols.computeIfAbsent(normalize(symbol.getName()), k -> new ArrayList<>()).add(symbol);
    declarationOrder.add(symbol);
    symbol.setScope(this);
  }

  void finalizeScope() {
    finalized = true;
  }

  @Override
  public String toString() {
    return "Scope#" + index + "@" + kind + "(" + rootNode + ")";
  }
}
