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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.text.MessageFormat;

/**
 * The type of an analysis finding, together with how it is drawn.
 *
 * <p>Types are compared by key, so a {@link CheckLevel} override configured for a key applies to
 * every indicator of that type.
 */
public final class DiagnosticType implements Comparable<DiagnosticType> {

  /** Default style of a type created without one: a red squiggle. */
  public static final int DEFAULT_COLOR = 0x0000FFA0;

  /** Identifies the type, for configuration and reports. */
  public final String key;

  /** The default way to format messages. The style of format is java.text.MessageFormat. */
  public final String format;

  /** The default reporting level for this diagnostic. */
  public final CheckLevel level;

  public final IndicatorType indicatorType;

  /** Color in the host editor's RGBA encoding. */
  public final int color;

  /**
   * Create a DiagnosticType at level CheckLevel.ERROR
   *
   * @param name An identifier
   * @param descriptionFormat A format string
   * @return A new DiagnosticType
   */
  public static DiagnosticType error(String name, String descriptionFormat) {
    return make(name, CheckLevel.ERROR, IndicatorType.SQUIGGLE, DEFAULT_COLOR, descriptionFormat);
  }

  /**
   * Create a DiagnosticType at level CheckLevel.WARNING
   *
   * @param name An identifier
   * @param descriptionFormat A format string
   * @return A new DiagnosticType
   */
  public static DiagnosticType warning(String name, String descriptionFormat) {
    return make(
        name, CheckLevel.WARNING, IndicatorType.SQUIGGLE, DEFAULT_COLOR, descriptionFormat);
  }

  public static DiagnosticType disabled(String name, String descriptionFormat) {
    return make(name, CheckLevel.OFF, IndicatorType.SQUIGGLE, DEFAULT_COLOR, descriptionFormat);
  }

  public static DiagnosticType make(
      String name,
      CheckLevel level,
      IndicatorType indicatorType,
      int color,
      String descriptionFormat) {
    return new DiagnosticType(name, level, indicatorType, color, descriptionFormat);
  }

  private DiagnosticType(
      String key, CheckLevel level, IndicatorType indicatorType, int color, String format) {
    checkArgument(!key.isEmpty(), "Empty diagnostic key");
    this.key = key;
    this.level = checkNotNull(level);
    this.indicatorType = checkNotNull(indicatorType);
    this.color = color;
    this.format = checkNotNull(format);
  }

  public String format(String... arguments) {
    return MessageFormat.format(format, (Object[]) arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType diagnosticType) {
    return key.compareTo(diagnosticType.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
