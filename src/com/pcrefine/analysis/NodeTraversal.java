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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * tracking of scope and of references.
 *
 * <p>Every scope-introducing node (see {@link SyntacticScopeCreator#scopeKindOf}) is bracketed by
 * exactly one scope entry and exit. The contents of a scope are declared in the traversal's {@link
 * SymbolTable} on entry, and every reference met while walking is marked against the scopes in
 * force at that point.
 */
public class NodeTraversal {
  private final Callback callback;
  private final @Nullable ScopedCallback scopeCallback;
  private final ScopeStack scopes;
  private final SymbolTable symbols;
  private final SyntacticScopeCreator scopeCreator;

  /** The current node being visited, for error reporting. */
  private @Nullable Node currentNode;

  /**
   * Callback for tree-based traversals
   */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its
     * children should be traversed.
     *
     * <p>If this method returns false, the node is not visited by {@link #visit} and none of its
     * descendants are visited at all, so references below it are not marked either.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A scope introduced by {@code n} has already
     * been exited when this is called.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Callback that also knows about scope changes. */
  public interface ScopedCallback extends Callback {

    /**
     * Called immediately after entering a new scope, once its declarations are registered. The new
     * scope can be accessed through t.getScope()
     */
    void enterScope(NodeTraversal t);

    /**
     * Called immediately before exiting a scope. The ending scope can be accessed through
     * t.getScope()
     */
    void exitScope(NodeTraversal t);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract scoped callback to visit all nodes in postorder. */
  public abstract static class AbstractScopedCallback implements ScopedCallback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }

    @Override
    public void enterScope(NodeTraversal t) {}

    @Override
    public void exitScope(NodeTraversal t) {}
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builds a traversal; the callback is required. */
  public static final class Builder {
    private @Nullable Callback callback;
    private @Nullable SymbolTable symbols;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCallback(Callback x) {
      this.callback = x;
      return this;
    }

    /** The table to declare symbols in; a fresh one is used if unset. */
    @CanIgnoreReturnValue
    public Builder setSymbolTable(SymbolTable x) {
      this.symbols = x;
      return this;
    }

    public NodeTraversal build() {
      return new NodeTraversal(
          checkNotNull(callback, "A callback is required"),
          symbols == null ? new SymbolTable() : symbols);
    }

    /** Builds a traversal and walks {@code root} with it. */
    @CanIgnoreReturnValue
    public NodeTraversal traverse(Node root) {
      NodeTraversal t = build();
      t.traverse(root);
      return t;
    }
  }

  private NodeTraversal(Callback callback, SymbolTable symbols) {
    this.callback = callback;
    this.scopeCallback = callback instanceof ScopedCallback ? (ScopedCallback) callback : null;
    this.symbols = symbols;
    this.scopes = new ScopeStack();
    this.scopeCreator = new SyntacticScopeCreator(symbols);
  }

  /** Traverses {@code root} with {@code cb} and a fresh symbol table. */
  @CanIgnoreReturnValue
  public static NodeTraversal traverse(Node root, Callback cb) {
    return builder().setCallback(cb).traverse(root);
  }

  /** Traverses a parse tree recursively. */
  private void traverse(Node root) {
    checkState(scopes.depth() == 0, "Traversal already in progress");
    try {
      traverseBranch(root, null);
    } catch (RuntimeException | StackOverflowError unexpectedException) {
      throwUnexpectedException(unexpectedException);
    }
  }

  private void throwUnexpectedException(Throwable unexpectedException) {
    String message = unexpectedException.getMessage();
    if (currentNode != null) {
      message =
          message
              + "\n"
              + formatNodeContext("Node", currentNode)
              + formatNodeContext("Parent", currentNode.getParent());
    }
    throw new IllegalStateException("Unexpected error during traversal: " + message,
        unexpectedException);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL";
    }
    return "  " + label + "(" + n + ")\n";
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    recordReference(n, parent);
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    ScopeKind kind = SyntacticScopeCreator.scopeKindOf(n);
    if (kind == null) {
      traverseChildren(n);
    } else {
      try (ScopeStack.ScopeGuard guard = scopes.scoped(n, kind)) {
        scopeCreator.populate(guard.scope());
        if (scopeCallback != null) {
          scopeCallback.enterScope(this);
        }
        traverseChildren(n);
        if (scopeCallback != null) {
          currentNode = n;
          scopeCallback.exitScope(this);
        }
      }
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }

  private void traverseChildren(Node n) {
    for (Node child : n.children()) {
      traverseBranch(child, n);
    }
  }

  /**
   * Marks the declarations {@code n} refers to.
   *
   * <p>A user variable {@code &X} also marks a member declared as plain {@code X}, and a {@code
   * %This.X} access marks both {@code X} and {@code &X} as declared in the enclosing class: the
   * same member may be declared as an instance variable or as a property, and is reachable under
   * either spelling.
   */
  private void recordReference(Node n, @Nullable Node parent) {
    Scope scope = scopes.currentScope();
    if (scope == null) {
      return;
    }
    switch (n.getToken()) {
      case NAME:
        if (isDeclarationName(n, parent)) {
          return;
        }
        String name = n.getStringOrEmpty();
        switch (n.getIdentifierKind()) {
          case USER_VARIABLE:
            boolean found = symbols.markUsed(name, scope, n.getSpan());
            found |= symbols.markUsed(name.substring(1), scope, n.getSpan());
            if (!found) {
              symbols.recordUndefinedReference(n);
            }
            break;
          case GENERIC:
          case FUNCTION_CALL:
            if (parent != null && parent.getToken() == Token.CALL && parent.getFirstChild() == n) {
              symbols.markUsed(name, scope, n.getSpan());
            }
            break;
          default:
            break;
        }
        break;
      case MEMBER_ACCESS:
        Node target = n.getFirstChild();
        Node member = n.getLastChild();
        if (target != null && target.isThis() && member != null) {
          // Locals of the method never capture a member access.
          Scope classScope = scope.getClosestScopeOfKind(ScopeKind.CLASS);
          if (classScope != null) {
            String memberName = member.getStringOrEmpty();
            for (String spelling : ImmutableList.of(memberName, "&" + memberName)) {
              if (classScope.hasOwnSymbol(spelling)) {
                symbols.markUsed(spelling, classScope, member.getSpan());
              }
            }
          }
        }
        break;
      default:
        break;
    }
  }

  /** Whether {@code name} is the declaring occurrence of a name rather than a reference. */
  static boolean isDeclarationName(Node name, @Nullable Node parent) {
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case LOCAL_VAR:
      case INSTANCE_VAR:
      case GLOBAL_VAR:
      case COMPONENT_VAR:
      case PARAM:
      case PROPERTY:
      case METHOD:
      case FUNCTION:
      case GETTER:
      case SETTER:
      case CLASS:
      case INTERFACE:
        return true;
      case CONSTANT:
      case CATCH:
        return parent.getFirstChild() == name;
      default:
        return false;
    }
  }

  /** Gets the current node being visited. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Returns the innermost scope, or null outside of any scope. */
  public @Nullable Scope getScope() {
    return scopes.currentScope();
  }

  public Node getScopeRoot() {
    Scope scope = scopes.currentScope();
    checkState(scope != null, "Not inside a scope");
    return scope.getRootNode();
  }

  public ScopeStack getScopeStack() {
    return scopes;
  }

  public SymbolTable getSymbolTable() {
    return symbols;
  }

  /** Returns the class or interface enclosing the current scope, or null. */
  public @Nullable Node getEnclosingType() {
    Scope scope = scopes.currentScope();
    Scope classScope = scope == null ? null : scope.getClosestScopeOfKind(ScopeKind.CLASS);
    return classScope == null ? null : classScope.getRootNode();
  }
}
