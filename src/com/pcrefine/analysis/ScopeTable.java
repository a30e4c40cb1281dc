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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The arena that owns every scope created during one pass, addressed by index. */
public final class ScopeTable {
  private final List<Scope> scopes = new ArrayList<>();

  Scope create(@Nullable Scope parent, ScopeKind kind, Node rootNode) {
    Scope scope = new Scope(this, scopes.size(), parent, kind, rootNode);
    scopes.add(scope);
    return scope;
  }

  public Scope get(int index) {
    return scopes.get(index);
  }

  public int size() {
    return scopes.size();
  }

  /** All scopes in creation order. */
  public ImmutableList<Scope> getScopes() {
    return ImmutableList.copyOf(scopes);
  }
}
