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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.pcrefine.ast.IR;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.SourceFixture;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ApplyTextEditsTest {

  private static final String TEXT = "Hello world";

  @Test
  public void testEditsApplyInAnyCollectionOrder() {
    ImmutableList<TextEdit> edits =
        ImmutableList.of(
            TextEdit.create(0, 5, "Goodbye", "greeting"),
            TextEdit.create(11, 11, "!", "punctuation"),
            TextEdit.create(6, 11, "there", "addressee"));

    assertThat(ApplyTextEdits.apply(edits, TEXT)).isEqualTo("Goodbye there!");
    assertThat(ApplyTextEdits.apply(edits.reverse(), TEXT)).isEqualTo("Goodbye there!");
  }

  @Test
  public void testReplacingNodeWithItsOwnTextIsIdentity() {
    SourceFixture src = SourceFixture.of("Local number &n;", "&n = 1;");
    Node name = src.name("&n", 1);
    Node value = IR.number(src.span("1"), "1");
    Node assign = IR.assign(src.range("&n =", "1"), name, value);
    EditCollector collector = new EditCollector();
    for (Node n : ImmutableList.of(name, value)) {
      collector.replaceNode(n, n.getText(src.text()), "identity");
    }

    assertThat(ApplyTextEdits.apply(collector.getEdits(), src.text())).isEqualTo(src.text());
    assertThat(assign.getText(src.text())).isEqualTo("&n = 1");
  }

  @Test
  public void testSameOffsetInsertionsKeepCollectionOrder() {
    ImmutableList<TextEdit> edits =
        ImmutableList.of(TextEdit.create(5, 5, "B", "b"), TextEdit.create(5, 5, "A", "a"));

    // Applied one after the other at the same offset, so the later one ends up first.
    assertThat(ApplyTextEdits.apply(edits, TEXT)).isEqualTo("HelloAB world");
  }

  @Test
  public void testEditPastEndIsRejected() {
    ImmutableList<TextEdit> edits = ImmutableList.of(TextEdit.create(3, 40, "", "too far"));

    assertThrows(IllegalArgumentException.class, () -> ApplyTextEdits.apply(edits, TEXT));
  }

  @Test
  public void testOverlaps() {
    TextEdit left = TextEdit.create(0, 5, "x", "left");
    TextEdit right = TextEdit.create(3, 7, "y", "right");
    TextEdit adjacent = TextEdit.create(5, 7, "z", "adjacent");

    assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of(left, right))).isTrue();
    assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of(right, left))).isTrue();
    assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of(left, adjacent))).isFalse();
    assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of())).isFalse();
  }

  @Test
  public void testInsertionAtAnotherEditsBoundaryIsNotAnOverlapInEitherOrder() {
    TextEdit replacement = TextEdit.create(6, 11, "planet", "replace");
    TextEdit atStart = TextEdit.create(6, 6, "big ", "insert before");
    TextEdit atEnd = TextEdit.create(11, 11, "!", "insert after");
    TextEdit inside = TextEdit.create(8, 8, "?", "insert inside");

    for (TextEdit insertion : ImmutableList.of(atStart, atEnd)) {
      assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of(insertion, replacement)))
          .isFalse();
      assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of(replacement, insertion)))
          .isFalse();
    }
    assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of(inside, replacement))).isTrue();
    assertThat(ApplyTextEdits.containsOverlaps(ImmutableList.of(replacement, inside))).isTrue();
  }

  @Test
  public void testInsertionLandsBeforeReplacementAtTheSameStart() {
    ImmutableList<TextEdit> edits =
        ImmutableList.of(
            TextEdit.create(6, 6, "big ", "insert"), TextEdit.create(6, 11, "planet", "replace"));

    assertThat(ApplyTextEdits.apply(edits, TEXT)).isEqualTo("Hello big planet");
    assertThat(ApplyTextEdits.apply(edits.reverse(), TEXT)).isEqualTo("Hello big planet");
  }

  @Test
  public void testApplyMatchesSpliceFromTheEnd() {
    ImmutableList<ImmutableList<TextEdit>> editSets =
        ImmutableList.of(
            ImmutableList.of(),
            ImmutableList.of(
                TextEdit.create(0, 0, ">", "open"), TextEdit.create(11, 11, "<", "close")),
            ImmutableList.of(
                TextEdit.create(6, 11, "there", "addressee"),
                TextEdit.create(0, 5, "Goodbye", "greeting"),
                TextEdit.create(5, 6, "_", "separator")),
            ImmutableList.of(
                TextEdit.create(9, 11, "LD", "shout"),
                TextEdit.create(2, 4, "", "drop"),
                TextEdit.create(7, 7, "--", "dash")),
            ImmutableList.of(
                TextEdit.create(6, 11, "planet", "replace"),
                TextEdit.create(6, 6, "big ", "insert"),
                TextEdit.create(0, 1, "J", "initial")));

    for (ImmutableList<TextEdit> edits : editSets) {
      assertThat(ApplyTextEdits.containsOverlaps(edits)).isFalse();
      String expected = spliceFromEnd(edits, TEXT);
      assertThat(ApplyTextEdits.apply(edits, TEXT)).isEqualTo(expected);
      assertThat(ApplyTextEdits.apply(edits.reverse(), TEXT)).isEqualTo(expected);
    }
  }

  /**
   * Rebuilds {@code text} back to front: each edit contributes its new text followed by the
   * untouched text up to the previously placed edit.
   */
  private static String spliceFromEnd(List<TextEdit> edits, String text) {
    List<TextEdit> descending = new ArrayList<>(edits);
    descending.sort(
        (a, b) ->
            a.getStart() != b.getStart()
                ? Integer.compare(b.getStart(), a.getStart())
                : Integer.compare(b.getEnd(), a.getEnd()));
    String tail = "";
    int untouchedEnd = text.length();
    for (TextEdit edit : descending) {
      tail = edit.getNewText() + text.substring(edit.getEnd(), untouchedEnd) + tail;
      untouchedEnd = edit.getStart();
    }
    return text.substring(0, untouchedEnd) + tail;
  }

  @Test
  public void testValidateNoOverlaps() {
    ImmutableList<TextEdit> edits =
        ImmutableList.of(TextEdit.create(0, 5, "x", "left"), TextEdit.create(3, 7, "y", "right"));

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> ApplyTextEdits.validateNoOverlaps(edits));
    assertThat(e).hasMessageThat().contains("Found overlap between text edits");
  }

  @Test
  public void testRemapCursor() {
    ImmutableList<TextEdit> edits =
        ImmutableList.of(
            TextEdit.create(0, 5, "Goodbye", "greeting"),
            TextEdit.create(6, 11, "you", "addressee"));

    assertThat(ApplyTextEdits.remapCursor(edits, 5)).isEqualTo(7);
    assertThat(ApplyTextEdits.remapCursor(edits, 7)).isEqualTo(11);
    assertThat(ApplyTextEdits.remapCursor(ImmutableList.of(), 7)).isEqualTo(7);
  }
}
