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

import com.pcrefine.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * The stack of scopes active at the current point of a traversal.
 *
 * <p>Callers bracket every scope-introducing construct with {@link #scoped}, which returns an
 * {@link AutoCloseable} guard:
 *
 * <pre>{@code
 * try (ScopeStack.ScopeGuard guard = scopes.scoped(n, ScopeKind.METHOD)) {
 *   ...
 * }
 * }</pre>
 *
 * so the scope is exited on every path out of the block, including exceptions.
 */
public final class ScopeStack {
  private final ScopeTable table;
  private final Deque<Scope> stack = new ArrayDeque<>();

  public ScopeStack() {
    this(new ScopeTable());
  }

  public ScopeStack(ScopeTable table) {
    this.table = checkNotNull(table);
  }

  public ScopeTable getTable() {
    return table;
  }

  /** Pushes a new scope whose parent is the current scope, or none if the stack is empty. */
  public Scope enterScope(Node node, ScopeKind kind) {
    Scope scope = table.create(stack.peek(), kind, node);
    stack.push(scope);
    return scope;
  }

  /** Pops and finalizes the current scope. */
  public Scope exitScope() {
    checkState(!stack.isEmpty(), "exitScope() without a matching enterScope()");
    Scope scope = stack.pop();
    scope.finalizeScope();
    return scope;
  }

  /** Enters a scope and returns a guard that exits it when closed. */
  public ScopeGuard scoped(Node node, ScopeKind kind) {
    return new ScopeGuard(enterScope(node, kind));
  }

  /** Returns the innermost scope, or null before any scope has been entered. */
  public @Nullable Scope currentScope() {
    return stack.peek();
  }

  public int depth() {
    return stack.size();
  }

  /**
   * Returns the innermost scope, starting at the current one, that declares {@code name}. An
   * inner declaration shadows every outer one whatever the kinds involved.
   */
  public @Nullable Scope resolve(String name) {
    return resolveFrom(currentScope(), name);
  }

  /** Like {@link #resolve} but starting at {@code from} instead of the current scope. */
  public static @Nullable Scope resolveFrom(@Nullable Scope from, String name) {
    for (Scope s = from; s != null; s = s.getParent()) {
      if (s.hasOwnSymbol(name)) {
        return s;
      }
    }
    return null;
  }

  /** Exits its scope on {@link #close()}. */
  public final class ScopeGuard implements AutoCloseable {
    private final Scope scope;
    private boolean closed;

    private ScopeGuard(Scope scope) {
      this.scope = scope;
    }

    public Scope scope() {
      return scope;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      checkState(stack.peek() == scope, "Scope %s closed out of order", scope);
      exitScope();
    }
  }
}
