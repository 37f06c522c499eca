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
import java.nio.file.Path;

/**
 * Describes a failed, errored, broken or skipped test outcome.
 *
 * @param expression the source text of the asserted expression, or the group name for an error
 *     outside any assertion
 * @param testType one of {@code test_failure}, {@code test_error}, {@code test_nonbool}, {@code
 *     test_unbroken}, {@code test_broken}, {@code test_skip} or {@code nontest_error}
 * @param exceptions the errors captured since the previous outcome was recorded
 */
public record Diagnostic(
    Path file,
    int line,
    String expression,
    String message,
    String testType,
    ImmutableList<ExceptionFrame> exceptions) {

  /** Returns a multi-line rendering suitable for a console report. */
  public String render() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%s:%s: %s%n", file.getFileName(), line, message));
    sb.append(String.format("  Expression: %s%n", expression));
    for (ExceptionFrame frame : exceptions) {
      sb.append("  ").append(frame.exception()).append(System.lineSeparator());
      for (String entry : frame.backtrace()) {
        sb.append("    in ").append(entry).append(System.lineSeparator());
      }
    }
    return sb.toString();
  }
}
