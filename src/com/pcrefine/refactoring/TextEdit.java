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

import com.google.auto.value.AutoValue;
import com.google.auto.value.AutoValue.CopyAnnotations;
import com.google.errorprone.annotations.Immutable;
import com.pcrefine.ast.Span;
import java.util.Comparator;

/** A proposed replacement of the text between two offsets of the original source. */
@AutoValue
@CopyAnnotations
@Immutable
public abstract class TextEdit {

  /**
   * The order in which edits are applied: highest start offset first, so that applying an edit
   * never moves the text any later edit refers to. Among edits with the same start the one that
   * ends last goes first, so an insertion lands in front of a replacement at its offset instead of
   * being replaced by it. Edits with the same range keep their relative order when sorted with a
   * stable sort.
   */
  public static final Comparator<TextEdit> APPLICATION_ORDER =
      Comparator.comparingInt(TextEdit::getStart)
          .thenComparingInt(TextEdit::getEnd)
          .reversed();

  public static TextEdit create(int start, int end, String newText, String description) {
    checkArgument(start >= 0 && end >= start, "Invalid edit range [%s, %s)", start, end);
    return new AutoValue_TextEdit(start, end, newText, description);
  }

  public static TextEdit replace(Span span, String newText, String description) {
    return create(span.start(), span.end(), newText, description);
  }

  /** Offset of the first replaced character. */
  public abstract int getStart();

  /** Offset just past the last replaced character; equal to the start for an insertion. */
  public abstract int getEnd();

  /** The text that replaces the range. */
  public abstract String getNewText();

  /** A human-readable description for undo history and previews. */
  public abstract String getDescription();

  public Span getSpan() {
    return Span.of(getStart(), getEnd());
  }

  /** How much longer the text gets when this edit is applied. */
  public int getLengthDelta() {
    return getNewText().length() - (getEnd() - getStart());
  }

  public boolean isInsertion() {
    return getStart() == getEnd();
  }

  /**
   * Returns where a cursor at {@code cursor} ends up once this edit is applied: unchanged before
   * the edit, at the end of the new text if it was inside the replaced range (both ends
   * included), and shifted by {@link #getLengthDelta()} after it.
   */
  public int updateCursorPosition(int cursor) {
    if (cursor < getStart()) {
      return cursor;
    } else if (cursor <= getEnd()) {
      return getStart() + getNewText().length();
    }
    return cursor + getLengthDelta();
  }
}
