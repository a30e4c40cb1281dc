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

import com.google.common.collect.ImmutableList;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Span;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Records the declarations of one pass and tracks which of them are referenced.
 *
 * <p>Usage is occurrence driven: a symbol is used if any reference to it is seen during the pass,
 * whether that reference comes before or after the declaration in the source text. {@link
 * SyntacticScopeCreator} makes this hold by declaring the whole contents of a scope as soon as the
 * scope is entered.
 */
public final class SymbolTable {
  private final List<Symbol> symbols = new ArrayList<>();
  private final List<Node> undefinedReferences = new ArrayList<>();

  /** Declares {@code symbol} in {@code scope}. */
  public void register(Symbol symbol, Scope scope) {
    checkNotNull(symbol);
    scope.declare(symbol);
    symbols.add(symbol);
  }

  /**
   * Looks {@code name} up from {@code fromScope} outward and marks every occurrence declared in
   * the first scope that has it.
   *
   * @return whether a declaration was found
   */
  public boolean markUsed(String name, Scope fromScope) {
    return markUsed(name, fromScope, Span.NONE);
  }

  /** Like {@link #markUsed(String, Scope)}, recording {@code reference} on the symbols found. */
  public boolean markUsed(String name, Scope fromScope, Span reference) {
    Scope declaring = ScopeStack.resolveFrom(fromScope, name);
    if (declaring == null) {
      return false;
    }
    for (Symbol symbol : declaring.getOwnSymbols(name)) {
      symbol.markUsed(reference);
    }
    return true;
  }

  /** Returns the first declaration of {@code name} visible from {@code fromScope}, or null. */
  public @Nullable Symbol lookup(String name, Scope fromScope) {
    Scope declaring = ScopeStack.resolveFrom(fromScope, name);
    return declaring == null ? null : declaring.getOwnSymbol(name);
  }

  void recordUndefinedReference(Node reference) {
    undefinedReferences.add(reference);
  }

  /** Every symbol registered so far, in registration order. */
  public ImmutableList<Symbol> getSymbols() {
    return ImmutableList.copyOf(symbols);
  }

  /**
   * Returns every symbol that no reference marked, with its declaring scope available through
   * {@link Symbol#getScope()}. Only meaningful once the pass has finished.
   */
  public ImmutableList<Symbol> unusedSymbols() {
    ImmutableList.Builder<Symbol> unused = ImmutableList.builder();
    for (Symbol symbol : symbols) {
      if (!symbol.isUsed()) {
        unused.add(symbol);
      }
    }
    return unused.build();
  }

  /** User variable references that resolved to no declaration, in traversal order. */
  public ImmutableList<Node> getUndefinedReferences() {
    return ImmutableList.copyOf(undefinedReferences);
  }
}
