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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pinpoint.code.Instruction.AssertKind;
import org.pinpoint.code.SourcePos;

/**
 * Collects the outcomes of one run. Test groups are opened and closed as they are executed;
 * outcomes are recorded in the innermost open group, or in the root group if none is open.
 *
 * <p>A TestRecorder also holds the errors caught since the last outcome was recorded; they are
 * attached to the next non-passing outcome and then discarded, so that no error is reported
 * against more than one outcome.
 */
public final class TestRecorder {

  /** A group that is still open. */
  private static class Group {
    final String name;
    final List<TestGroupResult> children = new ArrayList<>();
    final List<TestOutcome> outcomes = new ArrayList<>();

    Group(String name) {
      this.name = name;
    }

    TestGroupResult build() {
      return new TestGroupResult(
          name, ImmutableList.copyOf(children), ImmutableList.copyOf(outcomes));
    }
  }

  private final Deque<Group> open = new ArrayDeque<>();
  private final List<ExceptionFrame> exceptions = new ArrayList<>();

  public TestRecorder(String rootName) {
    open.push(new Group(rootName));
  }

  /** Opens a new group, nested in the innermost currently open group. */
  public void beginGroup(String name) {
    open.push(new Group(name));
  }

  /** Closes the innermost open group. */
  public void endGroup() {
    Preconditions.checkState(open.size() > 1, "No open group");
    Group group = open.pop();
    open.peek().children.add(group.build());
  }

  /** The number of groups currently open, not counting the root. */
  public int depth() {
    return open.size() - 1;
  }

  /** Saves the state of an error that has just been caught, before it is discarded. */
  public void captureException(ScriptError error) {
    exceptions.add(ExceptionFrame.of(error));
  }

  /** The errors captured since the last outcome was recorded. */
  public ImmutableList<ExceptionFrame> pendingExceptions() {
    return ImmutableList.copyOf(exceptions);
  }

  /**
   * Records the outcome of an assertion.
   *
   * @param value the value of the asserted expression, or null if it was not evaluated or threw
   * @param error the error thrown while evaluating the expression, or null
   */
  public void recordAssertion(
      AssertKind kind,
      @Nullable Object value,
      @Nullable ScriptError error,
      SourcePos pos,
      String expression) {
    TestOutcome outcome =
        switch (kind) {
          case ASSERT -> {
            if (error != null) {
              yield outcome(
                  TestOutcome.Kind.ERROR, pos, expression, error.getMessage(), "test_error");
            } else if (Boolean.TRUE.equals(value)) {
              yield TestOutcome.PASSED;
            } else if (Boolean.FALSE.equals(value)) {
              yield outcome(TestOutcome.Kind.FAIL, pos, expression, "Test Failed", "test_failure");
            }
            yield outcome(
                TestOutcome.Kind.ERROR,
                pos,
                expression,
                "Expression evaluated to non-Boolean: " + Values.display(value),
                "test_nonbool");
          }
          case BROKEN -> {
            if (error == null && Boolean.TRUE.equals(value)) {
              yield outcome(
                  TestOutcome.Kind.ERROR,
                  pos,
                  expression,
                  "Unexpected Pass",
                  "test_unbroken");
            }
            yield outcome(TestOutcome.Kind.BROKEN, pos, expression, "Broken", "test_broken");
          }
          case SKIP -> outcome(TestOutcome.Kind.SKIP, pos, expression, "Skipped", "test_skip");
          case THROWS -> {
            if (error != null) {
              yield TestOutcome.PASSED;
            }
            yield outcome(
                TestOutcome.Kind.FAIL,
                pos,
                expression,
                "Expected an exception, but none was thrown",
                "test_failure");
          }
        };
    record(outcome);
  }

  /** Records an error raised in a test group outside of any assertion. */
  public void recordGroupError(String groupName, ScriptError error, SourcePos pos) {
    record(
        outcome(
            TestOutcome.Kind.ERROR,
            pos,
            groupName,
            "Got exception outside of a test: " + error.getMessage(),
            "nontest_error"));
  }

  private TestOutcome outcome(
      TestOutcome.Kind kind, SourcePos pos, String expression, String message, String testType) {
    Diagnostic diagnostic =
        new Diagnostic(
            pos.file(),
            pos.line(),
            expression,
            message,
            testType,
            ImmutableList.copyOf(exceptions));
    return new TestOutcome(kind, diagnostic);
  }

  private void record(TestOutcome outcome) {
    open.peek().outcomes.add(outcome);
    exceptions.clear();
  }

  /** Closes any groups that are still open, and returns the results. */
  public TestGroupResult finish() {
    while (open.size() > 1) {
      endGroup();
    }
    return open.peek().build();
  }
}
