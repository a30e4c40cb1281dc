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

package com.pcrefine.refactoring;

import static com.google.common.base.Preconditions.checkState;

import com.pcrefine.analysis.NodeTraversal;
import com.pcrefine.analysis.NodeTraversal.AbstractPostOrderCallback;
import com.pcrefine.analysis.Symbol;
import com.pcrefine.analysis.SymbolKind;
import com.pcrefine.analysis.SymbolTable;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Renames the local variable, parameter or instance variable under the cursor, at its
 * declaration and at every reference that resolves to it.
 *
 * <p>The new name is asked for after the target is located, through {@link #provideInput}.
 */
public final class RenameLocalVariable extends Refactoring {

  private static final Pattern VARIABLE_NAME = Pattern.compile("&[A-Za-z_][A-Za-z0-9_]*");

  private @Nullable Symbol target;

  public RenameLocalVariable(EditorContext editor) {
    super(editor);
  }

  @Override
  public String getDescription() {
    return "Rename local variable";
  }

  @Override
  public boolean requiresUserInput() {
    return true;
  }

  /** The symbol to be renamed, once validated. */
  public @Nullable Symbol getTarget() {
    return target;
  }

  @Override
  protected RefactorResult validate(Node root) {
    SymbolTable symbols =
        NodeTraversal.traverse(
                root,
                new AbstractPostOrderCallback() {
                  @Override
                  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
                })
            .getSymbolTable();
    int cursor = getCursorPosition();
    for (Symbol symbol : symbols.getSymbols()) {
      if (!symbol.isImplicit() && occursAt(symbol, cursor)) {
        target = symbol;
        break;
      }
    }
    if (target == null) {
      return RefactorResult.failed("No variable, parameter, or method found at cursor position.");
    }
    SymbolKind kind = target.getKind();
    if (kind != SymbolKind.LOCAL && kind != SymbolKind.PARAMETER && kind != SymbolKind.INSTANCE) {
      return RefactorResult.failed(
          "Target '" + target.getName() + "' is not a local variable."
              + " Only local variables can be renamed.");
    }
    return RefactorResult.SUCCESSFUL;
  }

  private static boolean occursAt(Symbol symbol, int cursor) {
    if (symbol.getDeclaringSpan().contains(cursor)) {
      return true;
    }
    for (Span reference : symbol.getReferences()) {
      if (reference.contains(cursor)) {
        return true;
      }
    }
    return false;
  }

  @Override
  protected RefactorResult generateEdits(@Nullable String input, EditCollector collector) {
    checkState(target != null && input != null);
    String newName = input.trim();
    if (!newName.startsWith("&")) {
      newName = "&" + newName;
    }
    if (!VARIABLE_NAME.matcher(newName).matches()) {
      return RefactorResult.failed("'" + newName + "' is not a valid variable name.");
    }
    if (target.getScope().hasOwnSymbol(newName)) {
      return RefactorResult.failed(
          "Variable '" + newName + "' already exists in the current scope."
              + " Please choose a different name.");
    }

    String oldName = target.getName();
    String description = "Rename " + oldName + " to " + newName;
    String text = getEditor().getText();
    List<Span> occurrences = new ArrayList<>();
    occurrences.add(target.getDeclaringSpan());
    occurrences.addAll(target.getReferences());
    for (Span occurrence : occurrences) {
      // Members reached through %This are spelled without the sigil.
      boolean bare = !occurrence.textOf(text).startsWith("&");
      collector.replace(occurrence, bare ? newName.substring(1) : newName, description);
    }
    return RefactorResult.SUCCESSFUL;
  }
}
