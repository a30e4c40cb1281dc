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

import com.google.common.collect.ImmutableList;
import com.pcrefine.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Decides which declarations are unused variables.
 *
 * <p>{@link CheckUnusedVariables} reports exactly the symbols this class returns and the delete
 * quick fix only deletes one of them, so a fix is offered for precisely what is flagged.
 */
public final class UnusedVariableValidator {

  /** Id of the quick fix attached to unused variable indicators. */
  public static final String QUICK_FIX = "DeleteUnusedVariable";

  private final SymbolTable symbols;

  private UnusedVariableValidator(SymbolTable symbols) {
    this.symbols = symbols;
  }

  /** Walks {@code root} once, resolving every reference in it. */
  public static UnusedVariableValidator analyze(Node root) {
    SymbolTable symbols = new SymbolTable();
    NodeTraversal.builder()
        .setSymbolTable(symbols)
        .setCallback(
            new AbstractPostOrderCallback() {
              @Override
              public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
            })
        .traverse(root);
    return new UnusedVariableValidator(symbols);
  }

  public SymbolTable getSymbolTable() {
    return symbols;
  }

  /** Unused locals, instance variables and parameters, in declaration order. */
  public ImmutableList<Symbol> getUnusedVariables() {
    ImmutableList.Builder<Symbol> result = ImmutableList.builder();
    for (Symbol symbol : symbols.unusedSymbols()) {
      if (isReportable(symbol)) {
        result.add(symbol);
      }
    }
    return result.build();
  }

  /** Returns the unused variable whose declaring name contains {@code offset}, or null. */
  public @Nullable Symbol findUnusedAt(int offset) {
    for (Symbol symbol : getUnusedVariables()) {
      if (symbol.getDeclaringSpan().contains(offset)) {
        return symbol;
      }
    }
    return null;
  }

  /**
   * Whether an unused {@code symbol} is worth reporting. Globals and properties are part of a
   * program's interface to other programs, and constants and methods are not variables. A catch
   * clause must name its exception variable, so it cannot be removed either.
   */
  static boolean isReportable(Symbol symbol) {
    return !symbol.isImplicit() && symbol.getKind().isDeletable() && !isCatchVariable(symbol);
  }

  /** Whether {@code symbol} is the exception variable of a catch clause. */
  public static boolean isCatchVariable(Symbol symbol) {
    Node declaration = symbol.getDeclarationNode();
    return declaration != null && declaration.getToken() == Token.CATCH;
  }

  /** The tooltip of the indicator for an unused {@code symbol}. */
  public static String describe(Symbol symbol) {
    return describePrefix(symbol) + ": " + symbol.getName();
  }

  private static String describePrefix(Symbol symbol) {
    switch (symbol.getKind()) {
      case PARAMETER:
        return "Unused parameter";
      case INSTANCE:
        return "Unused instance variable";
      case PROPERTY:
        return "Unused property";
      case GLOBAL:
        return "Unused global variable";
      case CONSTANT:
        return "Unused constant";
      default:
        break;
    }
    switch (symbol.getScope().getContainerKind()) {
      case METHOD:
        return "Unused method variable";
      case FUNCTION:
        return "Unused function variable";
      case PROPERTY_ACCESSOR:
        return "Unused property variable";
      default:
        return "Unused local variable";
    }
  }
}
