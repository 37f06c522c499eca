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

package org.pinpoint.tools;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.pinpoint.TestRunner;
import org.pinpoint.compiler.SyntaxError;
import org.pinpoint.impl.Context;
import org.pinpoint.impl.Diagnostic;
import org.pinpoint.impl.ScriptError;
import org.pinpoint.impl.TestGroupResult;
import org.pinpoint.impl.TestRecorder;
import org.pinpoint.match.Pattern;
import org.pinpoint.match.PatternError;
import org.pinpoint.util.Logging;

/**
 * A command-line tool for running the tests of a single script file, or a selected subset of them.
 * With no patterns, every statement of the file is run.
 */
public class Run {
  private Run() {}

  static final String USAGE =
      "Use: run <fileName> [<pattern> ...] [--filter-lines=<lines>] [--verbose] [--help]\n"
          + "  <pattern>  a testgroup name, r\"regex\", :(expression), L<line> or L<first>:<last>\n"
          + "  --filter-lines=1,5,10:20 (or -f=...)  only count matches spanning these lines\n"
          + "  --verbose (or -v)  log debugging output";

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Runs the tool with the given arguments, and returns its exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    boolean verbose = Boolean.parseBoolean(System.getProperty("pinpoint.verbose", "false"));
    Path file = null;
    List<Pattern> patterns = new ArrayList<>();
    ImmutableRangeSet<Integer> filterLines = null;
    try {
      for (String arg : args) {
        if (arg.equals("--help") || arg.equals("-h")) {
          out.println(USAGE);
          return 0;
        } else if (arg.equals("--verbose") || arg.equals("-v")) {
          verbose = true;
        } else if (arg.startsWith("--filter-lines=") || arg.startsWith("-f=")) {
          filterLines = parseLines(arg.substring(arg.indexOf('=') + 1));
        } else if (arg.startsWith("-")) {
          err.println("Unknown option: " + arg);
          return 1;
        } else if (file == null) {
          file = Path.of(arg);
        } else {
          patterns.add(Pattern.parse(arg));
        }
      }
    } catch (PatternError e) {
      err.println(e.getMessage());
      return 1;
    }
    if (file == null) {
      err.println(USAGE);
      return 1;
    } else if (!Files.isRegularFile(file)) {
      err.println("File not found: " + file);
      return 1;
    }
    Logging.setVerbose(verbose);
    TestRecorder recorder = TestRunner.newRecorder(file);
    Context context = Context.newRoot(TestRunner.DEFAULT_CONTEXT);
    TestGroupResult result;
    try {
      if (patterns.isEmpty()) {
        result = TestRunner.runAll(file, context, recorder);
      } else {
        result = TestRunner.runTest(file, patterns, filterLines, context, recorder);
      }
    } catch (SyntaxError e) {
      err.println(e.getMessage());
      return 1;
    } catch (ScriptError e) {
      report(recorder.finish(), out);
      err.println("Error while running " + file + ": " + e.getMessage());
      e.stack().forEach(entry -> err.println("  in " + entry));
      return 1;
    }
    report(result, out);
    return result.anyNonPass() ? 1 : 0;
  }

  private static void report(TestGroupResult result, PrintStream out) {
    out.print(result.summary());
    ImmutableList<Diagnostic> diagnostics = result.diagnostics();
    if (!diagnostics.isEmpty()) {
      out.println("---");
      diagnostics.forEach(d -> out.print(d.render()));
    }
  }

  /**
   * Parses a comma-separated list of line numbers and ranges, e.g. {@code 1,5,10:20}.
   *
   * @throws PatternError if the list is malformed
   */
  static ImmutableRangeSet<Integer> parseLines(String text) {
    RangeSet<Integer> lines = TreeRangeSet.create();
    for (String item : text.split(",")) {
      Pattern pattern = Pattern.parse("L" + item.trim());
      if (pattern instanceof Pattern.Line line) {
        lines.add(Range.singleton(line.line()));
      } else if (pattern instanceof Pattern.LineRange range) {
        lines.add(Range.closed(range.first(), range.last()));
      } else {
        throw new PatternError("Invalid filter lines: " + text);
      }
    }
    return ImmutableRangeSet.copyOf(lines);
  }
}
