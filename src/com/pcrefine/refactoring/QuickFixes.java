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

package com.pcrefine.refactoring;

import com.pcrefine.analysis.CheckUnimplementedAbstractMembers;
import com.pcrefine.analysis.Indicator;
import com.pcrefine.analysis.TypeResolver;
import com.pcrefine.analysis.UnusedVariableValidator;
import org.jspecify.annotations.Nullable;

/** Creates the refactoring behind a quick fix id attached to an {@link Indicator}. */
public final class QuickFixes {

  private QuickFixes() {}

  /** Returns a new refactoring for {@code id}, or null if the id is unknown. */
  public static @Nullable Refactoring create(
      String id, EditorContext editor, TypeResolver resolver) {
    switch (id) {
      case UnusedVariableValidator.QUICK_FIX:
        return new DeleteUnusedVariable(editor);
      case CheckUnimplementedAbstractMembers.QUICK_FIX:
        return new ImplementAbstractMembers(editor, resolver);
      default:
        return null;
    }
  }
}
