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

package com.pcrefine.analysis;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * A position-tagged annotation for the host editor to draw.
 *
 * @param start offset of the first annotated character
 * @param length number of annotated characters
 * @param type how the annotation is drawn
 * @param color color in the host editor's RGBA encoding
 * @param tooltip text shown on hover
 * @param quickFixes ids of the refactorings that fix the finding, possibly empty
 */
public record Indicator(
    int start,
    int length,
    IndicatorType type,
    int color,
    String tooltip,
    ImmutableList<String> quickFixes) {

  public Indicator {
    checkNotNull(type);
    checkNotNull(tooltip);
    checkNotNull(quickFixes);
  }

  public int end() {
    return start + length;
  }

  public boolean hasQuickFix() {
    return !quickFixes.isEmpty();
  }
}
