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

import com.google.common.collect.ImmutableList;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Span;
import java.util.ArrayList;
import java.util.List;

/** Accumulates the edits of one refactoring before any of them is applied. */
public final class EditCollector {
  private final List<TextEdit> edits = new ArrayList<>();

  public void insert(int offset, String text, String description) {
    edits.add(TextEdit.create(offset, offset, text, description));
  }

  public void replace(int start, int end, String text, String description) {
    edits.add(TextEdit.create(start, end, text, description));
  }

  public void replace(Span span, String text, String description) {
    replace(span.start(), span.end(), text, description);
  }

  public void delete(int start, int end, String description) {
    edits.add(TextEdit.create(start, end, "", description));
  }

  public void replaceNode(Node node, String text, String description) {
    replace(node.getSpan(), text, description);
  }

  public void deleteNode(Node node, String description) {
    delete(node.getStart(), node.getEnd(), description);
  }

  public void insertBefore(Node node, String text, String description) {
    insert(node.getStart(), text, description);
  }

  public void insertAfter(Node node, String text, String description) {
    insert(node.getEnd(), text, description);
  }

  /** The edits collected so far, in the order they were added. */
  public ImmutableList<TextEdit> getEdits() {
    return ImmutableList.copyOf(edits);
  }

  public boolean isEmpty() {
    return edits.isEmpty();
  }

  public void clear() {
    edits.clear();
  }
}
