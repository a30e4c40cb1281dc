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

/**
 * The states of a {@link Refactoring}.
 *
 * <pre>
 * NOT_STARTED -> TRAVERSING -> VALIDATED -> [AWAITING_INPUT ->] EDITS_GENERATED
 *                           \-> FAILED          \-> FAILED
 * </pre>
 */
public enum RefactorState {
  NOT_STARTED,
  TRAVERSING,
  /** The target was found and its preconditions hold. */
  VALIDATED,
  /** Waiting for {@link Refactoring#provideInput}. */
  AWAITING_INPUT,
  EDITS_GENERATED,
  FAILED;

  public boolean isTerminal() {
    return this == EDITS_GENERATED || this == FAILED;
  }
}
