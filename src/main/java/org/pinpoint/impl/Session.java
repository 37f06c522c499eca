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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableRangeSet;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.pinpoint.match.Pattern;

/**
 * The configuration of a selective run, as seen while processing one file: the patterns and filter
 * lines of every file in the run, the file being processed, the context its statements are run in,
 * and where outcomes are recorded.
 *
 * <p>Sessions are immutable; processing an included file or a namespace uses a derived Session.
 */
public final class Session {

  /** The patterns for each file, keyed by absolute normalized path. */
  public final ImmutableMap<Path, ImmutableList<Pattern>> patterns;

  /** The filter line ranges for each file, keyed by absolute normalized path. */
  public final ImmutableMap<Path, ImmutableRangeSet<Integer>> filterLines;

  public final Path file;
  public final Context context;
  public final TestRecorder recorder;

  /** If true, every statement of every file is run, regardless of patterns. */
  public final boolean runEverything;

  private Session(
      ImmutableMap<Path, ImmutableList<Pattern>> patterns,
      ImmutableMap<Path, ImmutableRangeSet<Integer>> filterLines,
      Path file,
      Context context,
      TestRecorder recorder,
      boolean runEverything) {
    this.patterns = patterns;
    this.filterLines = filterLines;
    this.file = normalize(file);
    this.context = context;
    this.recorder = recorder;
    this.runEverything = runEverything;
  }

  /** Returns a Session for a selective run starting at {@code file}. */
  public static Session selective(
      ImmutableMap<Path, ImmutableList<Pattern>> patterns,
      ImmutableMap<Path, ImmutableRangeSet<Integer>> filterLines,
      Path file,
      Context context,
      TestRecorder recorder) {
    return new Session(patterns, filterLines, file, context, recorder, false);
  }

  /** Returns a Session that runs {@code file} (and anything it includes) in full. */
  public static Session runEverything(Path file, Context context, TestRecorder recorder) {
    return new Session(ImmutableMap.of(), ImmutableMap.of(), file, context, recorder, true);
  }

  /** Returns a Session for processing {@code file} with the same configuration. */
  public Session withFile(Path file) {
    return new Session(patterns, filterLines, file, context, recorder, runEverything);
  }

  /** Returns a Session for running statements in {@code context}. */
  public Session withContext(Context context) {
    return new Session(patterns, filterLines, file, context, recorder, runEverything);
  }

  /** The patterns for the current file, or null if none were given. */
  public @Nullable ImmutableList<Pattern> patternsForFile() {
    return patterns.get(file);
  }

  /** The filter lines for the current file, or null if there are none. */
  public @Nullable ImmutableRangeSet<Integer> filterForFile() {
    return filterLines.get(file);
  }

  /** Returns the absolute, normalized form of {@code path}, as used for map keys. */
  public static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }
}
