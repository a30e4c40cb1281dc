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
 * The outcome of running an {@link Analyzer}.
 *
 * @param indicators indicators of every pass that completed, pass by pass in emission order
 * @param skippedPasses passes not run because the program had parse errors
 * @param failedPasses passes that threw, with their error message
 */
public record AnalysisResult(
    ImmutableList<Indicator> indicators,
    ImmutableList<String> skippedPasses,
    ImmutableList<String> failedPasses) {

  public AnalysisResult {
    checkNotNull(indicators);
    checkNotNull(skippedPasses);
    checkNotNull(failedPasses);
  }

  public boolean success() {
    return failedPasses.isEmpty();
  }

  public String message() {
    if (success()) {
      return indicators.size() + " indicator(s)";
    }
    return "Failed passes: " + String.join(", ", failedPasses);
  }
}
