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
import com.pcrefine.ast.Node;
import com.pcrefine.ast.Node.Flag;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a sequence of independent passes over one program.
 *
 * <p>The passes share the read-only tree and the options but nothing else. A pass that throws is
 * logged and recorded in the result; the remaining passes still run.
 */
public final class Analyzer {
  private static final Logger logger = Logger.getLogger(Analyzer.class.getName());

  private final ImmutableList<AnalysisPass> passes;
  private final AnalysisOptions options;

  public Analyzer(AnalysisOptions options, ImmutableList<AnalysisPass> passes) {
    this.options = checkNotNull(options);
    this.passes = checkNotNull(passes);
  }

  /** An analyzer running every built-in check. */
  public static Analyzer withDefaultPasses(AnalysisOptions options) {
    return new Analyzer(
        options,
        ImmutableList.of(
            new CheckUnusedVariables(),
            new CheckUndefinedVariables(),
            new CheckPropertyAsVariable(),
            new CheckUnreachableCode(),
            new CheckUnimplementedAbstractMembers()));
  }

  public ImmutableList<AnalysisPass> getPasses() {
    return passes;
  }

  public AnalysisResult analyze(Node root) {
    boolean incomplete = root.hasFlag(Flag.HAS_PARSE_ERRORS);
    ImmutableList.Builder<Indicator> indicators = ImmutableList.builder();
    ImmutableList.Builder<String> skipped = ImmutableList.builder();
    ImmutableList.Builder<String> failed = ImmutableList.builder();
    for (AnalysisPass pass : passes) {
      if (incomplete
          && options.shouldSkipPassesOnIncompleteParse()
          && !pass.runsOnIncompleteParse()) {
        logger.fine("Skipping " + pass.getName() + " on incomplete parse");
        skipped.add(pass.getName());
        continue;
      }
      try {
        indicators.addAll(pass.run(root, options));
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, pass.getName() + " failed", e);
        failed.add(pass.getName() + ": " + e.getMessage());
      }
    }
    return new AnalysisResult(indicators.build(), skipped.build(), failed.build());
  }
}
