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

import com.google.common.collect.ImmutableList;

/**
 * A snapshot of an error observed by an assertion or test group: its description and the script
 * stack trace at the time it was caught.
 */
public record ExceptionFrame(String exception, ImmutableList<String> backtrace) {

  static ExceptionFrame of(ScriptError error) {
    return new ExceptionFrame(error.getMessage(), error.stack());
  }
}
