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

import com.pcrefine.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Looks up the parsed source of an externally declared class or interface.
 *
 * <p>Implementations are typically backed by a database or a file store and may be slow or fail.
 * Callers treat both a null result and a thrown exception as "type unknown".
 */
@FunctionalInterface
public interface TypeResolver {

  /** A resolver that knows no types. */
  TypeResolver NONE = qualifiedName -> null;

  /**
   * Returns the PROGRAM node of the source declaring {@code qualifiedName}, such as {@code
   * PKG:Sub:Base}, or null if the type is unknown.
   */
  @Nullable Node resolve(String qualifiedName);
}
