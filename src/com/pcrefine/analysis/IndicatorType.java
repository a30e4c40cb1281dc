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

/** How the host editor draws an {@link Indicator}. */
public enum IndicatorType {
  /** A filled background behind the text. */
  HIGHLIGHTER,
  /** A wavy underline. */
  SQUIGGLE,
  /** A change of the text color itself. */
  TEXTCOLOR,
  /** A box around the text. */
  OUTLINE
}
