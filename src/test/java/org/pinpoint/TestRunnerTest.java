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
package org.pinpoint;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pinpoint.compiler.SyntaxError;
import org.pinpoint.impl.Context;
import org.pinpoint.impl.Diagnostic;
import org.pinpoint.impl.ScriptError;
import org.pinpoint.impl.TestGroupResult;
import org.pinpoint.impl.TestOutcome;
import org.pinpoint.impl.TestRecorder;
import org.pinpoint.match.Pattern;

/** Runs the scripts in the testdata directory, with and without patterns. */
@RunWith(JUnit4.class)
public class TestRunnerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/pinpoint/testdata");

  private static Path file(String name) {
    return TESTDATA.resolve(name);
  }

  private static TestGroupResult run(String fileName, String... patterns) {
    ImmutableList<Pattern> parsed =
        Arrays.stream(patterns).map(Pattern::parse).collect(toImmutableList());
    return TestRunner.runTest(file(fileName), parsed, null);
  }

  private static ImmutableList<String> childNames(TestGroupResult result) {
    return result.children.stream().map(c -> c.name).collect(toImmutableList());
  }

  @Test
  public void groupSelectedByName() {
    TestGroupResult result = run("basic.pp", "basic");
    assertThat(result.name).isEqualTo("basic.pp");
    assertThat(childNames(result)).containsExactly("basic");
    TestGroupResult basic = result.child("basic");
    assertThat(basic.passed()).isEqualTo(2);
    assertThat(basic.skipped()).isEqualTo(0);
    assertThat(result.anyNonPass()).isFalse();
  }

  @Test
  public void runAllRunsEveryGroup() {
    TestGroupResult result = TestRunner.runAll(file("basic.pp"), Context.newRoot("Main"));
    assertThat(childNames(result)).containsExactly("basic", "other").inOrder();
    assertThat(result.child("other").failed()).isEqualTo(1);
    assertThat(result.anyNonPass()).isTrue();
    assertThat(result.summary())
        .isEqualTo(
            String.join(
                System.lineSeparator(),
                "basic.pp: 2 passed, 1 failed",
                "  basic: 2 passed",
                "  other: 1 failed",
                ""));
  }

  @Test
  public void noMatchRunsNothing() {
    TestGroupResult result = run("basic.pp", "no such group");
    assertThat(result.children).isEmpty();
    assertThat(result.outcomes).isEmpty();
    assertThat(result.summary()).isEqualTo("basic.pp: no tests" + System.lineSeparator());
  }

  @Test
  public void structuralPatternRunsMatchingAssertionsAndTheirDependencies() {
    TestGroupResult result = run("standalone.pp", ":(f(a_) == b_)");
    // One assertion on line 4, two on line 5; the group is never entered.
    assertThat(result.passed()).isEqualTo(3);
    assertThat(result.children).isEmpty();
    assertThat(result.anyNonPass()).isFalse();
  }

  @Test
  public void structuralPatternSelectsWholeLines() {
    // Only the first assertion on line 5 matches, but both share the line.
    TestGroupResult result = run("standalone.pp", ":(f(4) == b_)");
    assertThat(result.passed()).isEqualTo(2);
    assertThat(result.outcomes).hasSize(2);
    assertThat(result.children).isEmpty();
  }

  @Test
  public void errorInSelectedGroupStatementIsRecordedInItsGroup() {
    TestGroupResult result = run("group_error.pp", ":(div(a_, b_))");
    assertThat(childNames(result)).containsExactly("outer", "after").inOrder();
    TestGroupResult outer = result.child("outer");
    // "assert true" is not selected.
    assertThat(outer.passed()).isEqualTo(0);
    assertThat(outer.errored()).isEqualTo(1);
    Diagnostic diagnostic = outer.diagnostics().get(0);
    assertThat(diagnostic.testType()).isEqualTo("nontest_error");
    assertThat(diagnostic.line()).isEqualTo(2);
    assertThat(diagnostic.message())
        .isEqualTo("Got exception outside of a test: DivideError: integer division error");
    assertThat(result.child("after").passed()).isEqualTo(1);
  }

  @Test
  public void fullRunOfGroupWithError() {
    TestGroupResult result = TestRunner.runAll(file("group_error.pp"), Context.newRoot("Main"));
    assertThat(result.child("outer").errored()).isEqualTo(1);
    assertThat(result.child("outer").passed()).isEqualTo(0);
    assertThat(result.child("after").passed()).isEqualTo(1);
  }

  @Test
  public void structuralPatternWithConsistentBindings() {
    // f(a_) == a_ would require both sides to be the same subtree.
    TestGroupResult result = run("standalone.pp", ":(f(a_) == a_)");
    assertThat(result.outcomes).isEmpty();
  }

  @Test
  public void lineInNestedGroupSelectsThatGroup() {
    TestGroupResult result = run("nested.pp", "L3");
    // "outer" is entered, but its own assertion on line 6 is not run.
    assertThat(childNames(result)).containsExactly("outer");
    TestGroupResult outer = result.child("outer");
    assertThat(outer.outcomes).isEmpty();
    assertThat(childNames(outer)).containsExactly("inner");
    assertThat(outer.child("inner").passed()).isEqualTo(2);
    assertThat(result.anyNonPass()).isFalse();
  }

  @Test
  public void lineRangeCoveringOuterGroupRunsEverything() {
    TestGroupResult result = run("nested.pp", "L1:7");
    assertThat(childNames(result)).containsExactly("outer");
    TestGroupResult outer = result.child("outer");
    assertThat(outer.failed()).isEqualTo(1);
    assertThat(outer.child("inner").passed()).isEqualTo(2);
  }

  @Test
  public void outerGroupNameRunsNestedGroups() {
    TestGroupResult result = run("nested.pp", "outer");
    TestGroupResult outer = result.child("outer");
    assertThat(outer.total(TestOutcome.Kind.PASS)).isEqualTo(2);
    assertThat(outer.total(TestOutcome.Kind.FAIL)).isEqualTo(1);
  }

  @Test
  public void setupErrorPropagates() {
    ScriptError e = assertThrows(ScriptError.class, () -> run("setup_error.pp", "never"));
    assertThat(e.kind).isEqualTo(ScriptError.Kind.DIVIDE_ERROR);
    assertThat(e.getMessage()).isEqualTo("DivideError: integer division error");
    assertThat(e.stack()).containsExactly("top-level scope at setup_error.pp:2");
  }

  @Test
  public void setupErrorLeavesNoGroupResults() {
    TestRecorder recorder = TestRunner.newRecorder(file("setup_error.pp"));
    assertThrows(
        ScriptError.class,
        () ->
            TestRunner.runTest(
                file("setup_error.pp"),
                List.of(new Pattern.Name("never")),
                null,
                Context.newRoot("Main"),
                recorder));
    TestGroupResult partial = recorder.finish();
    assertThat(partial.children).isEmpty();
    assertThat(partial.outcomes).isEmpty();
  }

  @Test
  public void assertionOutcomes() {
    TestGroupResult result = TestRunner.runAll(file("outcomes.pp"), Context.newRoot("Main"));
    TestGroupResult outcomes = result.child("outcomes");
    assertThat(outcomes.passed()).isEqualTo(1);
    assertThat(outcomes.failed()).isEqualTo(1);
    assertThat(outcomes.errored()).isEqualTo(4);
    assertThat(outcomes.broken()).isEqualTo(1);
    assertThat(outcomes.skipped()).isEqualTo(1);
    // The error on line 9 ends the group, but the next group still runs.
    assertThat(result.child("after").passed()).isEqualTo(1);

    ImmutableList<Diagnostic> diagnostics = outcomes.diagnostics();
    assertThat(diagnostics.stream().map(Diagnostic::testType).collect(toImmutableList()))
        .containsExactly(
            "test_error",
            "test_failure",
            "test_broken",
            "test_unbroken",
            "test_skip",
            "test_nonbool",
            "nontest_error")
        .inOrder();
    assertThat(diagnostics.stream().map(Diagnostic::line).collect(toImmutableList()))
        .containsExactly(2, 4, 5, 6, 7, 8, 9)
        .inOrder();

    Diagnostic boom = diagnostics.get(0);
    assertThat(boom.expression()).isEqualTo("error(\"boom\")");
    assertThat(boom.message()).isEqualTo("ErrorException: boom");
    assertThat(boom.exceptions()).hasSize(1);
    assertThat(boom.exceptions().get(0).exception()).isEqualTo("ErrorException: boom");

    assertThat(diagnostics.get(1).message())
        .isEqualTo("Expected an exception, but none was thrown");
    assertThat(diagnostics.get(5).message()).isEqualTo("Expression evaluated to non-Boolean: 42");

    Diagnostic nonTest = diagnostics.get(6);
    assertThat(nonTest.expression()).isEqualTo("outcomes");
    assertThat(nonTest.message()).startsWith("Got exception outside of a test: DomainError: ");
    assertThat(nonTest.exceptions()).hasSize(1);
  }

  @Test
  public void includedFileRunsOnlyItsDependencies() {
    TestGroupResult result = run("include_main.pp", "main");
    assertThat(childNames(result)).containsExactly("main");
    assertThat(result.child("main").passed()).isEqualTo(2);
  }

  @Test
  public void includedFilesRunInFull() {
    TestGroupResult result = TestRunner.runAll(file("include_main.pp"), Context.newRoot("Main"));
    assertThat(childNames(result))
        .containsExactly("leaf group", "included group", "main")
        .inOrder();
    assertThat(result.total(TestOutcome.Kind.PASS)).isEqualTo(4);
  }

  @Test
  public void patternsForIncludedFile() {
    TestGroupResult result =
        TestRunner.runTests(
            file("include_main.pp"),
            ImmutableMap.of(
                file("include_main.pp"), List.<Pattern>of(new Pattern.Name("main")),
                file("included.pp"), List.<Pattern>of(new Pattern.Name("included group"))),
            ImmutableMap.of(),
            Context.newRoot("Main"));
    assertThat(childNames(result)).containsExactly("included group", "main").inOrder();
  }

  @Test
  public void patternsOnlyForIncludedFile() {
    TestGroupResult result =
        TestRunner.runTests(
            file("include_main.pp"),
            ImmutableMap.of(
                file("included.pp"), List.<Pattern>of(new Pattern.Name("included group"))),
            ImmutableMap.of(),
            Context.newRoot("Main"));
    // The entry file has no patterns, so "main" is skipped.
    assertThat(childNames(result)).containsExactly("included group");
    assertThat(result.child("included group").passed()).isEqualTo(1);
    assertThat(result.total(TestOutcome.Kind.PASS)).isEqualTo(1);
  }

  @Test
  public void mappingIncludeIsAnError() {
    ScriptError e = assertThrows(ScriptError.class, () -> run("mapping_include.pp", "anything"));
    assertThat(e.kind).isEqualTo(ScriptError.Kind.ARGUMENT_ERROR);
  }

  @Test
  public void namespacesScopeTheirStatements() {
    Context main = Context.newRoot("Main");
    TestGroupResult result =
        TestRunner.runTest(file("namespaces.pp"), List.of(new Pattern.Name("a")), null, main);
    assertThat(childNames(result)).containsExactly("a");
    assertThat(result.child("a").passed()).isEqualTo(1);
    // Dependencies of the sibling namespace still ran.
    assertThat(main.namespace("B").member("value")).isEqualTo(2L);
    assertThat(main.isBound("value")).isFalse();
  }

  @Test
  public void namespaceMembersAreVisibleOutside() {
    TestGroupResult result = run("namespaces.pp", "top");
    assertThat(childNames(result)).containsExactly("top");
    assertThat(result.child("top").passed()).isEqualTo(2);
  }

  @Test
  public void filterLinesChooseBetweenDuplicateNames() {
    List<Pattern> patterns = List.of(new Pattern.Name("dup"));
    TestGroupResult second = TestRunner.runTest(file("duplicates.pp"), patterns, List.of(4));
    assertThat(second.children).hasSize(1);
    assertThat(second.child("dup").failed()).isEqualTo(1);

    TestGroupResult first = TestRunner.runTest(file("duplicates.pp"), patterns, List.of(2));
    assertThat(first.children).hasSize(1);
    assertThat(first.child("dup").passed()).isEqualTo(1);

    TestGroupResult both = TestRunner.runTest(file("duplicates.pp"), patterns, null);
    assertThat(both.children).hasSize(2);
  }

  @Test
  public void constRedefinitionIsAnError() {
    ScriptError e =
        assertThrows(
            ScriptError.class,
            () -> TestRunner.runAll(file("const_redefinition.pp"), Context.newRoot("Main")));
    assertThat(e.kind).isEqualTo(ScriptError.Kind.ERROR_EXCEPTION);
    assertThat(e.msg).isEqualTo("invalid redefinition of constant LIMIT");
  }

  @Test
  public void syntaxErrorIsFatal() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> run("bad_syntax.pp", "broken"));
    assertThat(e.source).isEqualTo("bad_syntax.pp");
    assertThat(e.lineNum).isEqualTo(3);
  }

  @Test
  public void missingFileIsALoadError() {
    ScriptError e = assertThrows(ScriptError.class, () -> run("no_such_file.pp", "x"));
    assertThat(e.kind).isEqualTo(ScriptError.Kind.LOAD_ERROR);
    assertThat(e).hasCauseThat().isInstanceOf(IOException.class);
    assertThat(e.msg).contains("no_such_file.pp");
    assertThat(e.msg).contains("NoSuchFileException");
  }

  @Test
  public void assertionsInCalledFunctionsAreRecordedInTheCallingGroup() {
    TestGroupResult result = run("functions.pp", "calls");
    TestGroupResult calls = result.child("calls");
    assertThat(calls.passed()).isEqualTo(1);
    assertThat(calls.failed()).isEqualTo(1);
    assertThat(calls.diagnostics().get(0).line()).isEqualTo(2);
  }

  @Test
  public void slicedLoopsTerminate() {
    // Only the first assertion and the loop it depends on are run; the while loop is skipped.
    TestGroupResult result = run("loops.pp", ":(total == b_)");
    TestGroupResult loops = result.child("loops");
    assertThat(loops.passed()).isEqualTo(1);
    assertThat(loops.outcomes).hasSize(1);
  }

  @Test
  public void slicedLoopsWithLoopCarriedState() {
    TestGroupResult result = run("loops.pp", ":(n == b_)");
    assertThat(result.child("loops").passed()).isEqualTo(1);
    assertThat(result.total(TestOutcome.Kind.PASS)).isEqualTo(1);
  }

  @Test
  public void regexPatternSelectsGroups() {
    TestGroupResult result = run("regex.pp", "r\"^point\"");
    assertThat(childNames(result)).containsExactly("point fields", "point equality").inOrder();
    assertThat(result.total(TestOutcome.Kind.PASS)).isEqualTo(2);
  }

  @Test
  public void matchedLines() throws Exception {
    assertThat(TestRunner.matchedLines(file("basic.pp"), List.of(new Pattern.Name("other")), null))
        .containsExactly(6, 7, 8)
        .inOrder();
    assertThat(
            TestRunner.matchedLines(
                file("duplicates.pp"), List.of(new Pattern.Name("dup")), ImmutableSet.of(5)))
        .containsExactly(4, 5, 6)
        .inOrder();
  }

  @Test
  public void eachRunStartsWithNoPendingExceptions() {
    run("outcomes.pp", "outcomes");
    TestGroupResult result = run("basic.pp", "other");
    Diagnostic diagnostic = result.child("other").diagnostics().get(0);
    assertThat(diagnostic.exceptions()).isEmpty();
  }
}
