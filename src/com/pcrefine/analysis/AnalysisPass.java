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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Span;

/**
 * Base class of the detection passes.
 *
 * <p>A pass instance owns its indicators and, through the traversals it runs, its scopes and
 * symbols. {@link #run} resets that state before anything else, so the same instance can analyze
 * one program after another but must not be shared between threads.
 */
public abstract class AnalysisPass {
  private final IndicatorManager indicators = new IndicatorManager();
  private AnalysisOptions options = new AnalysisOptions();

  /** A short name for logs and reports. */
  public String getName() {
    return getClass().getSimpleName();
  }

  /** Whether this pass gives sensible results on a tree the parser had to recover. */
  public boolean runsOnIncompleteParse() {
    return true;
  }

  /** Analyzes {@code root} and returns the indicators found, in emission order. */
  @CanIgnoreReturnValue
  public final ImmutableList<Indicator> run(Node root, AnalysisOptions options) {
    indicators.reset();
    this.options = checkNotNull(options);
    process(root);
    return indicators.getIndicators();
  }

  /** Walks {@code root} and reports what it finds. */
  protected abstract void process(Node root);

  protected final AnalysisOptions getOptions() {
    return options;
  }

  /** Reports {@code type} over the span of {@code n}. */
  @CanIgnoreReturnValue
  protected final boolean report(Node n, DiagnosticType type, String... arguments) {
    return report(n.getSpan(), type, ImmutableList.of(), arguments);
  }

  /**
   * Reports {@code type} over {@code span}, unless the type is turned off.
   *
   * @return whether an indicator was recorded
   */
  @CanIgnoreReturnValue
  protected final boolean report(
      Span span, DiagnosticType type, ImmutableList<String> quickFixes, String... arguments) {
    if (!options.getWarningLevel(type).isOn()) {
      return false;
    }
    return indicators.emit(
        span, type.indicatorType, type.color, type.format(arguments), quickFixes);
  }

  public final ImmutableList<Indicator> getIndicators() {
    return indicators.getIndicators();
  }
}
