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
import com.pcrefine.ast.Node;

/**
 * Greys out local variables, instance variables and parameters that are never referenced.
 */
public final class CheckUnusedVariables extends AnalysisPass {

  static final DiagnosticType UNUSED_VARIABLE =
      DiagnosticType.make(
          "PC_UNUSED_VARIABLE", CheckLevel.WARNING, IndicatorType.TEXTCOLOR, 0x73737380, "{0}");

  @Override
  protected void process(Node root) {
    UnusedVariableValidator validator = UnusedVariableValidator.analyze(root);
    for (Symbol symbol : validator.getUnusedVariables()) {
      report(
          symbol.getDeclaringSpan(),
          UNUSED_VARIABLE,
          ImmutableList.of(UnusedVariableValidator.QUICK_FIX),
          UnusedVariableValidator.describe(symbol));
    }
  }
}
