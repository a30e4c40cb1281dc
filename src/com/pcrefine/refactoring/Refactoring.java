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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Node.Flag;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Base class of the refactorings and quick fixes.
 *
 * <p>A refactoring runs in two explicit steps. {@link #run} traverses the program, locates the
 * target and checks preconditions without producing any edit. A refactoring that needs input
 * from the user then waits in {@link RefactorState#AWAITING_INPUT} until {@link #provideInput} is
 * called; any other refactoring goes straight on. Either way the edits are generated exactly once,
 * by the step that has everything they depend on. A failed refactoring has no edits.
 */
public abstract class Refactoring {
  private static final Logger logger = Logger.getLogger(Refactoring.class.getName());

  static final String INCOMPLETE_PARSE_MESSAGE =
      "Cannot run refactoring on code with syntax errors";

  private final EditorContext editor;
  private final EditCollector edits = new EditCollector();
  private RefactorState state = RefactorState.NOT_STARTED;
  private RefactorResult result = RefactorResult.SUCCESSFUL;

  protected Refactoring(EditorContext editor) {
    this.editor = checkNotNull(editor);
  }

  /** A short description for undo history. */
  public abstract String getDescription();

  /** Whether the refactoring can run on a tree the parser had to recover. */
  public boolean runsOnIncompleteParse() {
    return true;
  }

  /** Whether the edits depend on a value the user supplies after validation. */
  public boolean requiresUserInput() {
    return false;
  }

  /**
   * Locates the target of the refactoring in {@code root} and checks its preconditions.
   * Implementations record what edit generation will need and must not produce edits.
   */
  protected abstract RefactorResult validate(Node root);

  /**
   * Produces the edits into {@code collector}.
   *
   * @param input the user's input, or null for a refactoring that requires none
   */
  protected abstract RefactorResult generateEdits(@Nullable String input, EditCollector collector);

  /** Traverses {@code root} and, unless user input is required, generates the edits. */
  @CanIgnoreReturnValue
  public final RefactorResult run(Node root) {
    checkState(state == RefactorState.NOT_STARTED, "%s already ran", getDescription());
    if (root.hasFlag(Flag.HAS_PARSE_ERRORS) && !runsOnIncompleteParse()) {
      return fail(INCOMPLETE_PARSE_MESSAGE);
    }
    state = RefactorState.TRAVERSING;
    RefactorResult validation = validate(root);
    if (!validation.success()) {
      return fail(validation.message());
    }
    state = RefactorState.VALIDATED;
    if (requiresUserInput()) {
      state = RefactorState.AWAITING_INPUT;
      return result;
    }
    return generate(null);
  }

  /** Supplies the input a validated refactoring is waiting for and generates the edits. */
  @CanIgnoreReturnValue
  public final RefactorResult provideInput(String input) {
    checkState(
        state == RefactorState.AWAITING_INPUT,
        "%s is not awaiting input but %s",
        getDescription(),
        state);
    return generate(checkNotNull(input));
  }

  private RefactorResult generate(@Nullable String input) {
    RefactorResult generated = generateEdits(input, edits);
    if (!generated.success()) {
      return fail(generated.message());
    }
    if (ApplyTextEdits.containsOverlaps(edits.getEdits())) {
      return fail("Generated edits overlap: " + edits.getEdits());
    }
    state = RefactorState.EDITS_GENERATED;
    return result;
  }

  private RefactorResult fail(String message) {
    logger.fine(getClass().getSimpleName() + " failed: " + message);
    edits.clear();
    state = RefactorState.FAILED;
    result = RefactorResult.failed(message);
    return result;
  }

  public final RefactorState getState() {
    return state;
  }

  public final RefactorResult getResult() {
    return result;
  }

  /** The generated edits; empty unless the refactoring reached EDITS_GENERATED. */
  public final ImmutableList<TextEdit> getEdits() {
    return state == RefactorState.EDITS_GENERATED ? edits.getEdits() : ImmutableList.of();
  }

  /** Applies the generated edits to the editor's text. */
  public final String applyEdits() {
    checkState(state == RefactorState.EDITS_GENERATED, "No edits to apply in state %s", state);
    return ApplyTextEdits.apply(edits.getEdits(), editor.getText());
  }

  /** Where the editor's cursor ends up once the edits are applied. */
  public final int getUpdatedCursorPosition() {
    return ApplyTextEdits.remapCursor(getEdits(), editor.getCursorPosition());
  }

  protected final EditorContext getEditor() {
    return editor;
  }

  protected final int getCursorPosition() {
    return editor.getCursorPosition();
  }

  /** The original text of {@code node}. */
  protected final String getOriginalText(Node node) {
    return node.getText(editor.getText());
  }
}
