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

import com.google.common.collect.ImmutableList;
import com.pcrefine.analysis.Symbol;
import com.pcrefine.analysis.UnusedVariableValidator;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Quick fix that deletes the declaration of the unused variable under the cursor.
 *
 * <p>A name declared together with others is removed from its declaration; a declaration of a
 * single name is removed with its whole line. A parameter is removed together with the separator
 * that joins it to its neighbour.
 */
public final class DeleteUnusedVariable extends Refactoring {

  private @Nullable Symbol target;

  public DeleteUnusedVariable(EditorContext editor) {
    super(editor);
  }

  @Override
  public String getDescription() {
    return "Delete unused variable declaration";
  }

  @Override
  protected RefactorResult validate(Node root) {
    UnusedVariableValidator validator = UnusedVariableValidator.analyze(root);
    int cursor = getCursorPosition();
    for (Symbol symbol : validator.getSymbolTable().unusedSymbols()) {
      if (!symbol.isImplicit() && symbol.getDeclaringSpan().contains(cursor)) {
        target = symbol;
        break;
      }
    }
    if (target == null) {
      return RefactorResult.failed("No unused variable found at cursor position.");
    }
    if (UnusedVariableValidator.isCatchVariable(target)) {
      return RefactorResult.failed("The exception variable of a catch clause cannot be deleted.");
    }
    if (validator.findUnusedAt(cursor) != target) {
      return RefactorResult.failed("Only Local, Instance, or Parameter variables can be deleted.");
    }
    return RefactorResult.SUCCESSFUL;
  }

  @Override
  protected RefactorResult generateEdits(@Nullable String input, EditCollector collector) {
    checkState(target != null);
    Node declaration = target.getDeclarationNode();
    checkState(declaration != null, target);
    switch (target.getKind()) {
      case LOCAL:
        removeFromDeclaration(declaration, "Local", collector);
        break;
      case INSTANCE:
        removeFromDeclaration(declaration, "instance", collector);
        break;
      case PARAMETER:
        removeParameter(declaration, collector);
        break;
      default:
        return RefactorResult.failed(
            "Only Local, Instance, or Parameter variables can be deleted.");
    }
    return RefactorResult.SUCCESSFUL;
  }

  private void removeFromDeclaration(Node declaration, String keyword, EditCollector collector) {
    if (declaration.getChildCount() > 1) {
      List<String> remaining = new ArrayList<>();
      for (Node name : declaration.children()) {
        if (name != target.getNameNode()) {
          remaining.add(name.getStringOrEmpty());
        }
      }
      String terminator = getOriginalText(declaration).endsWith(";") ? ";" : "";
      collector.replaceNode(
          declaration,
          keyword
              + " "
              + declaration.getTypeName()
              + " "
              + String.join(", ", remaining)
              + terminator,
          "Remove variable from declaration.");
      return;
    }
    EditorContext editor = getEditor();
    int start = editor.getLineStartOffset(editor.getLineOfOffset(declaration.getStart()));
    int end = editor.getLineEndOffset(editor.getLineOfOffset(declaration.getEnd()));
    collector.delete(start, end, "Delete unused variable declaration.");
  }

  private static void removeParameter(Node param, EditCollector collector) {
    Node paramList = param.getParent();
    checkState(paramList != null && paramList.getToken() == Token.PARAM_LIST, param);
    ImmutableList<Node> params = paramList.children();
    int index = params.indexOf(param);
    String description = "Remove unused parameter";
    if (params.size() == 1) {
      collector.deleteNode(param, description);
    } else if (index == params.size() - 1) {
      collector.delete(params.get(index - 1).getEnd(), param.getEnd(), description);
    } else {
      collector.delete(param.getStart(), params.get(index + 1).getStart(), description);
    }
  }
}
