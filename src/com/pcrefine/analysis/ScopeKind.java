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

/** The constructs that introduce a lexical scope. */
public enum ScopeKind {
  /** The whole program. */
  GLOBAL,
  /** A class or interface. */
  CLASS,
  METHOD,
  FUNCTION,
  /** A property getter or setter body. */
  PROPERTY_ACCESSOR,
  /** A nested statement block. */
  BLOCK
}
