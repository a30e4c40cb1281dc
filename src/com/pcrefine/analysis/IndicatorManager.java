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

import com.google.common.collect.ImmutableList;
import com.pcrefine.ast.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Accumulates the indicators of one analysis pass.
 *
 * <p>{@link #reset()} must be the first call of every pass. Indicators are kept in the order they
 * were emitted; a consumer that wants them by offset sorts them itself.
 */
public final class IndicatorManager {
  private static final Logger logger = Logger.getLogger(IndicatorManager.class.getName());

  private final List<Indicator> indicators = new ArrayList<>();

  public void reset() {
    indicators.clear();
  }

  /**
   * Records an indicator over {@code span}. A span with a negative start or an end before its
   * start is dropped without failing the pass.
   *
   * @return whether the indicator was recorded
   */
  public boolean emit(Span span, IndicatorType type, int color, String tooltip) {
    return emit(span, type, color, tooltip, ImmutableList.of());
  }

  public boolean emit(
      Span span, IndicatorType type, int color, String tooltip, ImmutableList<String> quickFixes) {
    if (!span.isValid()) {
      logger.fine("Dropping indicator with invalid span " + span + ": " + tooltip);
      return false;
    }
    indicators.add(new Indicator(span.start(), span.length(), type, color, tooltip, quickFixes));
    return true;
  }

  /** The indicators emitted since the last reset, in emission order. */
  public ImmutableList<Indicator> getIndicators() {
    return ImmutableList.copyOf(indicators);
  }

  public int size() {
    return indicators.size();
  }
}
