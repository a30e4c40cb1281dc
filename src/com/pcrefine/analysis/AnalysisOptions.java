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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;

/** Configuration shared by the passes of an {@link Analyzer}. */
public class AnalysisOptions {
  private final Map<String, CheckLevel> warningLevels = new HashMap<>();
  private TypeResolver typeResolver = TypeResolver.NONE;
  private boolean skipPassesOnIncompleteParse = true;

  /** Overrides the level of every indicator of {@code type}. */
  @CanIgnoreReturnValue
  public AnalysisOptions setWarningLevel(DiagnosticType type, CheckLevel level) {
    warningLevels.put(type.key, checkNotNull(level));
    return this;
  }

  /** Returns the configured level for {@code type}, falling back to its default. */
  public CheckLevel getWarningLevel(DiagnosticType type) {
    return warningLevels.getOrDefault(type.key, type.level);
  }

  @CanIgnoreReturnValue
  public AnalysisOptions setTypeResolver(TypeResolver typeResolver) {
    this.typeResolver = checkNotNull(typeResolver);
    return this;
  }

  public TypeResolver getTypeResolver() {
    return typeResolver;
  }

  /**
   * Whether passes that cannot handle a partially recovered tree are skipped when the program has
   * parse errors. On by default.
   */
  @CanIgnoreReturnValue
  public AnalysisOptions setSkipPassesOnIncompleteParse(boolean skip) {
    this.skipPassesOnIncompleteParse = skip;
    return this;
  }

  public boolean shouldSkipPassesOnIncompleteParse() {
    return skipPassesOnIncompleteParse;
  }
}
