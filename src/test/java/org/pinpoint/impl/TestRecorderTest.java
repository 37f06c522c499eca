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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pinpoint.code.Instruction.AssertKind;
import org.pinpoint.code.SourcePos;

@RunWith(JUnitParamsRunner.class)
public class TestRecorderTest {

  private static final SourcePos POS = new SourcePos(Path.of("dir/t.pp"), 7);

  private static final Object NONE = Nothing.INSTANCE;

  private static final ScriptError ERROR = ScriptError.Kind.DOMAIN_ERROR.error("bad input");

  @SuppressWarnings("unused") // Used via @Parameters
  private static Object[] assertions() {
    return new Object[] {
      new Object[] {AssertKind.ASSERT, true, false, TestOutcome.Kind.PASS, ""},
      new Object[] {AssertKind.ASSERT, false, false, TestOutcome.Kind.FAIL, "test_failure"},
      new Object[] {AssertKind.ASSERT, NONE, true, TestOutcome.Kind.ERROR, "test_error"},
      new Object[] {AssertKind.ASSERT, 3L, false, TestOutcome.Kind.ERROR, "test_nonbool"},
      new Object[] {AssertKind.BROKEN, false, false, TestOutcome.Kind.BROKEN, "test_broken"},
      new Object[] {AssertKind.BROKEN, NONE, true, TestOutcome.Kind.BROKEN, "test_broken"},
      new Object[] {AssertKind.BROKEN, true, false, TestOutcome.Kind.ERROR, "test_unbroken"},
      new Object[] {AssertKind.SKIP, NONE, false, TestOutcome.Kind.SKIP, "test_skip"},
      new Object[] {AssertKind.THROWS, NONE, true, TestOutcome.Kind.PASS, ""},
      new Object[] {AssertKind.THROWS, 1L, false, TestOutcome.Kind.FAIL, "test_failure"},
    };
  }

  @Test
  @Parameters(method = "assertions")
  @TestCaseName("{method}[{index}]")
  public void assertionOutcome(
      AssertKind kind,
      Object value,
      boolean threw,
      TestOutcome.Kind expected,
      String testType) {
    TestRecorder recorder = new TestRecorder("root");
    recorder.recordAssertion(kind, value, threw ? ERROR : null, POS, "f(x)");
    TestGroupResult result = recorder.finish();
    assertThat(result.outcomes).hasSize(1);
    TestOutcome outcome = result.outcomes.get(0);
    assertThat(outcome.kind()).isEqualTo(expected);
    if (testType.isEmpty()) {
      assertThat(outcome.diagnostic()).isNull();
    } else {
      assertThat(outcome.diagnostic().testType()).isEqualTo(testType);
      assertThat(outcome.diagnostic().line()).isEqualTo(7);
      assertThat(outcome.diagnostic().expression()).isEqualTo("f(x)");
    }
  }

  @Test
  public void messages() {
    TestRecorder recorder = new TestRecorder("root");
    recorder.recordAssertion(AssertKind.ASSERT, "s", null, POS, "e1");
    recorder.recordAssertion(AssertKind.ASSERT, null, ERROR, POS, "e2");
    recorder.recordGroupError("g", ERROR, POS);
    TestGroupResult result = recorder.finish();
    assertThat(result.diagnostics().stream().map(Diagnostic::message))
        .containsExactly(
            "Expression evaluated to non-Boolean: s",
            "DomainError: bad input",
            "Got exception outside of a test: DomainError: bad input")
        .inOrder();
    assertThat(result.diagnostics().get(2).testType()).isEqualTo("nontest_error");
  }

  @Test
  public void groupsNest() {
    TestRecorder recorder = new TestRecorder("root");
    recorder.beginGroup("a");
    recorder.recordAssertion(AssertKind.ASSERT, true, null, POS, "x");
    recorder.beginGroup("b");
    assertThat(recorder.depth()).isEqualTo(2);
    recorder.recordAssertion(AssertKind.ASSERT, false, null, POS, "y");
    recorder.endGroup();
    recorder.recordAssertion(AssertKind.SKIP, null, null, POS, "z");
    // "a" is left open; finish() closes it.
    TestGroupResult result = recorder.finish();
    assertThat(result.outcomes).isEmpty();
    TestGroupResult a = result.child("a");
    assertThat(a.passed()).isEqualTo(1);
    assertThat(a.skipped()).isEqualTo(1);
    assertThat(a.failed()).isEqualTo(0);
    assertThat(a.total(TestOutcome.Kind.FAIL)).isEqualTo(1);
    assertThat(a.child("b").failed()).isEqualTo(1);
    assertThat(result.anyNonPass()).isTrue();
    assertThat(result.summary())
        .isEqualTo(
            String.join(
                System.lineSeparator(),
                "root: 1 passed, 1 failed, 1 skipped",
                "  a: 1 passed, 1 failed, 1 skipped",
                "    b: 1 failed",
                ""));
  }

  @Test
  public void cannotCloseRoot() {
    TestRecorder recorder = new TestRecorder("root");
    assertThrows(IllegalStateException.class, recorder::endGroup);
  }

  @Test
  public void capturedExceptionsAttachToNextOutcomeOnly() {
    TestRecorder recorder = new TestRecorder("root");
    recorder.captureException(ERROR);
    assertThat(recorder.pendingExceptions()).hasSize(1);
    recorder.recordAssertion(AssertKind.ASSERT, false, null, POS, "first");
    assertThat(recorder.pendingExceptions()).isEmpty();
    recorder.recordAssertion(AssertKind.ASSERT, false, null, POS, "second");
    TestGroupResult result = recorder.finish();
    assertThat(result.diagnostics().get(0).exceptions())
        .containsExactly(new ExceptionFrame("DomainError: bad input", ERROR.stack()));
    assertThat(result.diagnostics().get(1).exceptions()).isEmpty();
  }

  @Test
  public void skippedAndBrokenAreNotFailures() {
    TestRecorder recorder = new TestRecorder("root");
    recorder.recordAssertion(AssertKind.SKIP, null, null, POS, "a");
    recorder.recordAssertion(AssertKind.BROKEN, false, null, POS, "b");
    TestGroupResult result = recorder.finish();
    assertThat(result.anyNonPass()).isFalse();
    assertThat(result.broken()).isEqualTo(1);
  }

  @Test
  public void render() {
    Diagnostic diagnostic =
        new Diagnostic(
            Path.of("dir/t.pp"),
            7,
            "f(x)",
            "Test Failed",
            "test_failure",
            ImmutableList.of(
                new ExceptionFrame(
                    "DomainError: bad input",
                    ImmutableList.of("f at t.pp:2"))));
    assertThat(diagnostic.render())
        .isEqualTo(
            String.join(
                System.lineSeparator(),
                "t.pp:7: Test Failed",
                "  Expression: f(x)",
                "  DomainError: bad input",
                "    in f at t.pp:2",
                ""));
  }
}
