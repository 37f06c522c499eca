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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pinpoint.match.PatternError;

@RunWith(JUnit4.class)
public class RunTest {

  private static final String TESTDATA = "src/test/java/org/pinpoint/testdata/";

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    return Run.run(args, new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
  }

  private String out() {
    return out.toString(UTF_8);
  }

  private String err() {
    return err.toString(UTF_8);
  }

  @Test
  public void help() {
    assertThat(run("--help")).isEqualTo(0);
    assertThat(out()).startsWith("Use: run <fileName>");
  }

  @Test
  public void noArguments() {
    assertThat(run()).isEqualTo(1);
    assertThat(err()).startsWith("Use: run <fileName>");
  }

  @Test
  public void unknownOption() {
    assertThat(run("--frobnicate")).isEqualTo(1);
    assertThat(err()).contains("Unknown option: --frobnicate");
  }

  @Test
  public void missingFile() {
    assertThat(run(TESTDATA + "no_such_file.pp")).isEqualTo(1);
    assertThat(err()).contains("File not found: ");
  }

  @Test
  public void invalidPattern() {
    assertThat(run(TESTDATA + "basic.pp", "L0")).isEqualTo(1);
    assertThat(err()).contains("Line numbers start at 1: 0");
  }

  @Test
  public void passingGroup() {
    assertThat(run(TESTDATA + "basic.pp", "basic")).isEqualTo(0);
    assertThat(out()).contains("basic: 2 passed");
    assertThat(out()).doesNotContain("---");
  }

  @Test
  public void failingGroup() {
    assertThat(run(TESTDATA + "basic.pp", "other")).isEqualTo(1);
    assertThat(out()).contains("other: 1 failed");
    assertThat(out()).contains("---");
  }

  @Test
  public void wholeFile() {
    assertThat(run(TESTDATA + "basic.pp")).isEqualTo(1);
    assertThat(out()).contains("basic: 2 passed");
    assertThat(out()).contains("other: 1 failed");
  }

  @Test
  public void filteredPatternMatchesNothing() {
    assertThat(run(TESTDATA + "basic.pp", "r\"o\"", "--filter-lines=1:4")).isEqualTo(0);
    assertThat(out()).contains("no tests");
    assertThat(out()).doesNotContain("other");
  }

  @Test
  public void syntaxError() {
    assertThat(run(TESTDATA + "bad_syntax.pp")).isEqualTo(1);
    assertThat(err()).contains("bad_syntax.pp");
  }

  @Test
  public void setupError() {
    assertThat(run(TESTDATA + "setup_error.pp", "never")).isEqualTo(1);
    assertThat(err()).contains("Error while running ");
    assertThat(err()).contains("DivideError: integer division error");
    assertThat(err()).contains("  in top-level scope at setup_error.pp:2");
  }

  @Test
  public void filterLines() {
    RangeSet<Integer> lines = Run.parseLines("1,5,10:12");
    assertThat(lines.asRanges()).hasSize(3);
    assertThat(lines.contains(11)).isTrue();
    assertThat(lines.contains(6)).isFalse();
    assertThat(Run.parseLines(" 3 ").asRanges()).containsExactly(Range.singleton(3));
    assertThrows(PatternError.class, () -> Run.parseLines("1,x"));
    assertThrows(PatternError.class, () -> Run.parseLines("4:2"));
  }

  @Test
  public void unboundedLineRanges() {
    RangeSet<Integer> lines = Run.parseLines("2:" + Integer.MAX_VALUE);
    assertThat(lines.contains(Integer.MAX_VALUE)).isTrue();
    assertThat(lines.contains(1)).isFalse();
    assertThat(run(TESTDATA + "basic.pp", "L1:" + Integer.MAX_VALUE)).isEqualTo(1);
    assertThat(out()).contains("basic: 2 passed");
    assertThat(out()).contains("other: 1 failed");
    assertThat(
            run(TESTDATA + "basic.pp", "r\"o\"", "--filter-lines=7:" + Integer.MAX_VALUE))
        .isEqualTo(1);
    assertThat(out()).contains("other: 1 failed");
  }
}
