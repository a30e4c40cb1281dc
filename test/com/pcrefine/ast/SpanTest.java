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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SpanTest {

  @Test
  public void testValidity() {
    assertThat(Span.of(0, 0).isValid()).isTrue();
    assertThat(Span.of(3, 7).isValid()).isTrue();
    assertThat(Span.of(-1, 4).isValid()).isFalse();
    assertThat(Span.of(5, 4).isValid()).isFalse();
    assertThat(Span.NONE.isValid()).isFalse();
  }

  @Test
  public void testLength() {
    assertThat(Span.of(3, 7).length()).isEqualTo(4);
    assertThat(Span.at(9).length()).isEqualTo(0);
  }

  @Test
  public void testContainsIncludesBothEnds() {
    Span span = Span.of(3, 7);
    assertThat(span.contains(2)).isFalse();
    assertThat(span.contains(3)).isTrue();
    assertThat(span.contains(7)).isTrue();
    assertThat(span.contains(8)).isFalse();
  }

  @Test
  public void testInvalidSpanContainsNothing() {
    assertThat(Span.of(5, 2).contains(3)).isFalse();
    assertThat(Span.of(0, 10).contains(Span.of(5, 2))).isFalse();
  }

  @Test
  public void testContainsSpan() {
    assertThat(Span.of(0, 10).contains(Span.of(2, 10))).isTrue();
    assertThat(Span.of(0, 10).contains(Span.of(2, 11))).isFalse();
  }

  @Test
  public void testTextOf() {
    assertThat(Span.of(6, 11).textOf("Local &name;")).isEqualTo("&name");
  }
}
