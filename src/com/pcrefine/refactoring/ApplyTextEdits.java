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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/** Applies a batch of {@link TextEdit}s to a text. */
public final class ApplyTextEdits {

  private static final Joiner NEWLINE_JOINER = Joiner.on('\n');

  // Same-start insertions sort before the edit they precede, so the sweep sees them first.
  private static final Comparator<TextEdit> START_THEN_END =
      Comparator.comparingInt(TextEdit::getStart).thenComparingInt(TextEdit::getEnd);

  private ApplyTextEdits() {}

  /** Returns {@code edits} in {@link TextEdit#APPLICATION_ORDER}. */
  public static ImmutableList<TextEdit> sortForApplication(Collection<TextEdit> edits) {
    List<TextEdit> sorted = new ArrayList<>(edits);
    sorted.sort(TextEdit.APPLICATION_ORDER);
    return ImmutableList.copyOf(sorted);
  }

  /**
   * Applies {@code edits} to {@code text}, highest start offset first. The edits must not overlap
   * each other; that is a precondition this method does not check.
   */
  public static String apply(Collection<TextEdit> edits, String text) {
    StringBuilder sb = new StringBuilder(text);
    for (TextEdit edit : sortForApplication(edits)) {
      checkArgument(
          edit.getEnd() <= sb.length(),
          "Edit %s reaches past the end of the text (%s)",
          edit,
          sb.length());
      sb.replace(edit.getStart(), edit.getEnd(), edit.getNewText());
    }
    return sb.toString();
  }

  /** Returns where {@code cursor} ends up once all of {@code edits} are applied. */
  public static int remapCursor(Collection<TextEdit> edits, int cursor) {
    int result = cursor;
    for (TextEdit edit : sortForApplication(edits)) {
      result = edit.updateCursorPosition(result);
    }
    return result;
  }

  /**
   * Whether any two of {@code edits} overlap: one starts strictly before the other ends and vice
   * versa. Edits that only touch, and insertions at the start or end of another edit, do not.
   */
  public static boolean containsOverlaps(Collection<TextEdit> edits) {
    List<TextEdit> ascending = new ArrayList<>(edits);
    ascending.sort(START_THEN_END);
    int reached = Integer.MIN_VALUE;
    for (TextEdit edit : ascending) {
      if (edit.getStart() < reached) {
        return true;
      }
      reached = Math.max(reached, edit.getEnd());
    }
    return false;
  }

  /** Fails if {@code edits} overlap, naming all of them. */
  public static void validateNoOverlaps(Collection<TextEdit> edits) {
    checkArgument(
        !containsOverlaps(edits),
        "Found overlap between text edits:\n%s",
        NEWLINE_JOINER.join(edits));
  }
}
