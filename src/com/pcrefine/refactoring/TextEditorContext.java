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
import static com.google.common.base.Preconditions.checkPositionIndex;

import com.pcrefine.ast.LineIndex;

/** An {@link EditorContext} over a string, for batch use and tests. */
public final class TextEditorContext implements EditorContext {
  private final String text;
  private final int cursor;
  private final LineIndex lines;

  public TextEditorContext(String text, int cursor) {
    this.text = checkNotNull(text);
    this.cursor = checkPositionIndex(cursor, text.length());
    this.lines = LineIndex.of(text);
  }

  @Override
  public String getText() {
    return text;
  }

  @Override
  public int getCursorPosition() {
    return cursor;
  }

  @Override
  public int getLineOfOffset(int offset) {
    return lines.getLineOfOffset(offset);
  }

  @Override
  public int getLineStartOffset(int line) {
    return lines.getLineStartOffset(line);
  }

  @Override
  public int getLineEndOffset(int line) {
    return lines.getLineEndOffset(line);
  }
}
