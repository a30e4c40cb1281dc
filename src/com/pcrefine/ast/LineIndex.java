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

package com.pcrefine.ast;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;

import java.util.Arrays;

/** Maps between character offsets and zero-based line numbers of a source text. */
public final class LineIndex {
  private final int length;
  private final int[] lineStarts;

  private LineIndex(int length, int[] lineStarts) {
    this.length = length;
    this.lineStarts = lineStarts;
  }

  public static LineIndex of(String text) {
    int[] starts = new int[16];
    int count = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        if (count == starts.length) {
          starts = Arrays.copyOf(starts, count * 2);
        }
        starts[count++] = i + 1;
      }
    }
    return new LineIndex(text.length(), Arrays.copyOf(starts, count));
  }

  public int getLineCount() {
    return lineStarts.length;
  }

  /** The line containing {@code offset}; the end of the text belongs to the last line. */
  public int getLineOfOffset(int offset) {
    checkPositionIndex(offset, length);
    int i = Arrays.binarySearch(lineStarts, offset);
    return i >= 0 ? i : -i - 2;
  }

  public int getLineStartOffset(int line) {
    checkElementIndex(line, lineStarts.length);
    return lineStarts[line];
  }

  /** Offset just past the end of {@code line}, including its line terminator if it has one. */
  public int getLineEndOffset(int line) {
    checkElementIndex(line, lineStarts.length);
    return line + 1 < lineStarts.length ? lineStarts[line + 1] : length;
  }

  /** Zero-based column of {@code offset} within its line. */
  public int getColumnOfOffset(int offset) {
    return offset - lineStarts[getLineOfOffset(offset)];
  }
}
