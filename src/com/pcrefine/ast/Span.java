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

/**
 * A half-open range {@code [start, end)} of character offsets into the original source text.
 *
 * <p>Construction never fails: a span read from a partially recovered parse may be negative or
 * inverted, and it is up to the consumer to reject it through {@link #isValid()}.
 */
public record Span(int start, int end) {

  public static final Span NONE = new Span(-1, -1);

  public static Span of(int start, int end) {
    return new Span(start, end);
  }

  /** A zero-length span at {@code offset}, as used for insertions. */
  public static Span at(int offset) {
    return new Span(offset, offset);
  }

  public boolean isValid() {
    return start >= 0 && end >= start;
  }

  public int length() {
    return end - start;
  }

  /**
   * Whether {@code offset} falls inside this span. Both ends are inclusive so that a cursor placed
   * right after a name still hits it.
   */
  public boolean contains(int offset) {
    return isValid() && offset >= start && offset <= end;
  }

  public boolean contains(Span other) {
    return isValid() && other.isValid() && other.start >= start && other.end <= end;
  }

  public String textOf(String source) {
    return source.substring(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
