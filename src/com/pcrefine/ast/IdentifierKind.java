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

package com.pcrefine.ast;

/**
 * How an identifier was classified by the parser.
 *
 * <p>PeopleCode distinguishes names by their sigil: {@code &name} is a user variable, {@code
 * %Name} a system variable and {@code %%name%%} a meta variable.
 */
public enum IdentifierKind {
  /** A plain name such as a method, type or record field. */
  GENERIC,
  USER_VARIABLE,
  SYSTEM_VARIABLE,
  META_VARIABLE,
  /** The name of a user-declared function at a call site. */
  FUNCTION_CALL,
  BUILTIN_FUNCTION;

  /** Classifies {@code name} by its leading sigil. */
  public static IdentifierKind fromName(String name) {
    if (name.startsWith("%%")) {
      return META_VARIABLE;
    } else if (name.startsWith("&")) {
      return USER_VARIABLE;
    } else if (name.startsWith("%")) {
      return SYSTEM_VARIABLE;
    }
    return GENERIC;
  }
}
