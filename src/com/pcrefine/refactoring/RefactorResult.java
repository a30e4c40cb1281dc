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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Whether a refactoring step succeeded, with a message for the user when it did not.
 *
 * @param success whether the step succeeded
 * @param message why it failed; empty on success
 */
public record RefactorResult(boolean success, String message) {

  public static final RefactorResult SUCCESSFUL = new RefactorResult(true, "");

  public RefactorResult {
    checkNotNull(message);
  }

  public static RefactorResult failed(String message) {
    return new RefactorResult(false, message);
  }
}
