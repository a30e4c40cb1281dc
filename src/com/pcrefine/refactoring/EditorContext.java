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

/**
 * What a refactoring needs from the editor hosting the source. Lines are zero based.
 */
public interface EditorContext {

  /** The full text being edited. */
  String getText();

  int getCursorPosition();

  int getLineOfOffset(int offset);

  int getLineStartOffset(int line);

  /** Offset just past the end of {@code line}, including its line terminator if it has one. */
  int getLineEndOffset(int line);
}
