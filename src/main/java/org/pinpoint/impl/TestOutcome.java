/*
 * Copyright 2025 The Retrospect Authors
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

package org.pinpoint.impl;

import org.jspecify.annotations.Nullable;

/** The outcome of one assertion (or of an error in a test group outside any assertion). */
public record TestOutcome(Kind kind, @Nullable Diagnostic diagnostic) {

  public enum Kind {
    PASS,
    FAIL,
    ERROR,
    BROKEN,
    SKIP
  }

  static final TestOutcome PASSED = new TestOutcome(Kind.PASS, null);
}
