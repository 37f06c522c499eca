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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.RangeSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.pinpoint.compiler.Compiler;
import org.pinpoint.compiler.SourceFile;
import org.pinpoint.impl.Context;
import org.pinpoint.impl.SelectiveInterpreter;
import org.pinpoint.impl.Session;
import org.pinpoint.impl.TestGroupResult;
import org.pinpoint.impl.TestRecorder;
import org.pinpoint.match.Pattern;
import org.pinpoint.match.SyntaxMatcher;

/**
 * Entry points for running the tests of a script file, or a selected subset of them.
 *
 * <p>Each run records its outcomes with a new {@link TestRecorder}, whose root group is named after
 * the entry file. If a statement that is not a test declaration raises an error, the run is
 * abandoned and the error is thrown to the caller; the overloads that take a recorder allow the
 * outcomes recorded before that point to be retrieved.
 */
public final class TestRunner {

  /** The name of the context used when the caller does not supply one. */
  public static final String DEFAULT_CONTEXT = "Main";

  // Static methods only
  private TestRunner() {}

  /**
   * Runs the tests of {@code file} selected by {@code patterns}, in a new context.
   *
   * @param filterLines if non-null, a syntax pattern match only counts if it spans one of these
   *     lines
   */
  public static TestGroupResult runTest(
      Path file, List<Pattern> patterns, @Nullable Collection<Integer> filterLines) {
    return runTest(file, patterns, filterLines, Context.newRoot(DEFAULT_CONTEXT));
  }

  /** Runs the tests of {@code file} selected by {@code patterns}, in the given context. */
  public static TestGroupResult runTest(
      Path file,
      List<Pattern> patterns,
      @Nullable Collection<Integer> filterLines,
      Context context) {
    return runTest(
        file,
        patterns,
        (filterLines == null) ? null : SyntaxMatcher.rangesOf(filterLines),
        context,
        newRecorder(file));
  }

  /**
   * As {@link #runTest(Path, List, Collection, Context)}, with the filter lines given as ranges and
   * recording outcomes with {@code recorder}.
   */
  public static TestGroupResult runTest(
      Path file,
      List<Pattern> patterns,
      @Nullable RangeSet<Integer> filterLines,
      Context context,
      TestRecorder recorder) {
    Path key = Session.normalize(file);
    Map<Path, RangeSet<Integer>> filters =
        (filterLines == null) ? ImmutableMap.of() : ImmutableMap.of(key, filterLines);
    return runTests(key, ImmutableMap.of(key, patterns), filters, context, recorder);
  }

  /**
   * Runs {@code entry}, selecting tests in each file by that file's patterns. Files that have no
   * entry in {@code patterns} (including included files) run only their dependency statements.
   *
   * @param filterLines for each file that has them, the line ranges that its syntax pattern
   *     matches must overlap
   */
  public static TestGroupResult runTests(
      Path entry,
      Map<Path, ? extends List<Pattern>> patterns,
      Map<Path, ? extends RangeSet<Integer>> filterLines,
      Context context) {
    return runTests(entry, patterns, filterLines, context, newRecorder(entry));
  }

  /** As {@link #runTests(Path, Map, Map, Context)}, recording outcomes with {@code recorder}. */
  public static TestGroupResult runTests(
      Path entry,
      Map<Path, ? extends List<Pattern>> patterns,
      Map<Path, ? extends RangeSet<Integer>> filterLines,
      Context context,
      TestRecorder recorder) {
    ImmutableMap.Builder<Path, ImmutableList<Pattern>> patternMap = ImmutableMap.builder();
    patterns.forEach((k, v) -> patternMap.put(Session.normalize(k), ImmutableList.copyOf(v)));
    ImmutableMap.Builder<Path, ImmutableRangeSet<Integer>> filterMap = ImmutableMap.builder();
    filterLines.forEach(
        (k, v) -> filterMap.put(Session.normalize(k), ImmutableRangeSet.copyOf(v)));
    Session session =
        Session.selective(
            patternMap.buildOrThrow(), filterMap.buildOrThrow(), entry, context, recorder);
    new SelectiveInterpreter().runFile(session);
    return recorder.finish();
  }

  /** Runs every statement of {@code file}, and of every file it includes. */
  public static TestGroupResult runAll(Path file, Context context) {
    return runAll(file, context, newRecorder(file));
  }

  /** As {@link #runAll(Path, Context)}, recording outcomes with {@code recorder}. */
  public static TestGroupResult runAll(Path file, Context context, TestRecorder recorder) {
    new SelectiveInterpreter().runFile(Session.runEverything(file, context, recorder));
    return recorder.finish();
  }

  /** Returns the lines of {@code file} that {@code patterns} select. */
  public static ImmutableSortedSet<Integer> matchedLines(
      Path file, List<Pattern> patterns, @Nullable Set<Integer> filter) throws IOException {
    SourceFile source = SourceFile.read(Session.normalize(file));
    return SyntaxMatcher.matchedLines(
        Compiler.parse(source), patterns, (filter == null) ? null : SyntaxMatcher.rangesOf(filter));
  }

  /** Returns a new recorder whose root group is named after {@code file}. */
  public static TestRecorder newRecorder(Path file) {
    return new TestRecorder(String.valueOf(file.getFileName()));
  }
}
