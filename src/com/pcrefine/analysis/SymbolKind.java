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

/** What a {@link Symbol} declares. */
public enum SymbolKind {
  PARAMETER,
  LOCAL,
  INSTANCE,
  PROPERTY,
  /** A global or component variable. */
  GLOBAL,
  CONSTANT,
  /** A method header or function declaration. */
  METHOD;

  /** Kinds whose declaration can be removed by the delete-unused quick fix. */
  public boolean isDeletable() {
    return this == LOCAL || this == INSTANCE || this == PARAMETER;
  }
}
