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
import com.pcrefine.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Declares the contents of a scope as soon as traversal enters it.
 *
 * <p>Declaring eagerly means that every reference in a scope sees every declaration of that scope,
 * whatever their relative order in the text. Parameters belong to the scope of the callable that
 * declares them; a method implementation takes its parameters from the matching header in the
 * class declaration section, so the parameters of a header without an implementation are never
 * declared at all.
 */
public final class SyntacticScopeCreator {

  /** The implicit parameter of every property setter. */
  static final String NEW_VALUE = "&NewValue";

  private final SymbolTable symbols;

  public SyntacticScopeCreator(SymbolTable symbols) {
    this.symbols = checkNotNull(symbols);
  }

  /** Returns the kind of scope {@code n} introduces, or null if it introduces none. */
  public static @Nullable ScopeKind scopeKindOf(Node n) {
    switch (n.getToken()) {
      case PROGRAM:
        return ScopeKind.GLOBAL;
      case CLASS:
      case INTERFACE:
        return ScopeKind.CLASS;
      case METHOD:
        return n.getBody() != null ? ScopeKind.METHOD : null;
      case FUNCTION:
        return ScopeKind.FUNCTION;
      case GETTER:
      case SETTER:
        return ScopeKind.PROPERTY_ACCESSOR;
      case BLOCK:
        return isCallableBody(n) ? null : ScopeKind.BLOCK;
      default:
        return null;
    }
  }

  /** Whether {@code block} is the body of a method, function or accessor, sharing its scope. */
  static boolean isCallableBody(Node block) {
    Node parent = block.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case METHOD:
      case FUNCTION:
      case GETTER:
      case SETTER:
        return true;
      default:
        return false;
    }
  }

  /** Declares everything {@code scope} owns. */
  public void populate(Scope scope) {
    checkState(!scope.isFinalized(), scope);
    Node root = scope.getRootNode();
    switch (scope.getKind()) {
      case GLOBAL:
        declareStatements(scope, root);
        break;
      case CLASS:
        Node members = root.getFirstChildOfType(Token.CLASS_MEMBERS);
        if (members != null) {
          declareMembers(scope, members);
        }
        break;
      case METHOD:
        Node header = findMethodHeader(root);
        if (header != null) {
          declareParameters(scope, header.getFirstChildOfType(Token.PARAM_LIST));
        }
        declareStatements(scope, root.getBody());
        break;
      case FUNCTION:
        declareParameters(scope, root.getFirstChildOfType(Token.PARAM_LIST));
        declareStatements(scope, root.getBody());
        break;
      case PROPERTY_ACCESSOR:
        if (root.getToken() == Token.SETTER) {
          Symbol newValue = Symbol.implicit(SymbolKind.PARAMETER, NEW_VALUE, root);
          symbols.register(newValue, scope);
        }
        declareStatements(scope, root.getBody());
        break;
      case BLOCK:
        Node parent = root.getParent();
        if (parent != null && parent.getToken() == Token.CATCH) {
          Node exceptionVar = parent.getFirstChild();
          symbols.register(Symbol.create(SymbolKind.LOCAL, exceptionVar, parent), scope);
        }
        declareStatements(scope, root);
        break;
    }
  }

  /**
   * Returns the header in the enclosing class declaration section that {@code impl} implements,
   * or null if there is none.
   */
  public static @Nullable Node findMethodHeader(Node impl) {
    Node type = impl.getParent();
    if (type == null) {
      return null;
    }
    Node members = type.getFirstChildOfType(Token.CLASS_MEMBERS);
    if (members == null) {
      return null;
    }
    for (Node member : members.children()) {
      if (member.getToken() == Token.METHOD
          && member.getStringOrEmpty().equalsIgnoreCase(impl.getStringOrEmpty())) {
        return member;
      }
    }
    return null;
  }

  private void declareStatements(Scope scope, @Nullable Node container) {
    if (container == null) {
      return;
    }
    for (Node stmt : container.children()) {
      switch (stmt.getToken()) {
        case LOCAL_VAR:
          declareNames(scope, stmt, SymbolKind.LOCAL);
          break;
        case GLOBAL_VAR:
        case COMPONENT_VAR:
          declareNames(scope, stmt, SymbolKind.GLOBAL);
          break;
        case CONSTANT:
          declare(scope, SymbolKind.CONSTANT, stmt.getFirstChild(), stmt);
          break;
        case FUNCTION:
          declare(scope, SymbolKind.METHOD, stmt.getDeclaredName(), stmt);
          break;
        default:
          break;
      }
    }
  }

  private void declareMembers(Scope scope, Node members) {
    for (Node member : members.children()) {
      switch (member.getToken()) {
        case INSTANCE_VAR:
          declareNames(scope, member, SymbolKind.INSTANCE);
          break;
        case PROPERTY:
          declare(scope, SymbolKind.PROPERTY, member.getDeclaredName(), member);
          break;
        case METHOD:
          declare(scope, SymbolKind.METHOD, member.getDeclaredName(), member);
          break;
        case CONSTANT:
          declare(scope, SymbolKind.CONSTANT, member.getFirstChild(), member);
          break;
        default:
          break;
      }
    }
  }

  private void declareParameters(Scope scope, @Nullable Node params) {
    if (params == null) {
      return;
    }
    for (Node param : params.children()) {
      declare(scope, SymbolKind.PARAMETER, param.getDeclaredName(), param);
    }
  }

  private void declareNames(Scope scope, Node declaration, SymbolKind kind) {
    for (Node name : declaration.children()) {
      declare(scope, kind, name, declaration);
    }
  }

  private void declare(Scope scope, SymbolKind kind, @Nullable Node name, Node declaration) {
    checkState(name != null && name.isName(), "Malformed declaration %s", declaration);
    symbols.register(Symbol.create(kind, name, declaration), scope);
  }
}
