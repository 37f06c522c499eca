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
package org.pinpoint.match;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class PatternTest {

  @SuppressWarnings("unused") // Used via @Parameters
  private static Object[] validPatterns() {
    return new Object[] {
      new Object[] {"L10", "Line[line=10]"},
      new Object[] {"L10:20", "LineRange[first=10, last=20]"},
      new Object[] {"L7:7", "LineRange[first=7, last=7]"},
      new Object[] {"basic", "Name[name=basic]"},
      new Object[] {"L", "Name[name=L]"},
      new Object[] {"L1x", "Name[name=L1x]"},
      new Object[] {"two words", "Name[name=two words]"},
      new Object[] {"r\"^a.b\"", "r\"^a.b\""},
      new Object[] {
        ":(f(x_) == y_)",
        "Structural[template=(BINARY == (CALL (NAME f) (NAME x_)) (NAME y_))]"
      },
      new Object[] {
        ":(assert g(a__))", "Structural[template=(ASSERT assert (CALL (NAME g) (NAME a__)))]"
      },
    };
  }

  @Test
  @Parameters(method = "validPatterns")
  @TestCaseName("{method}[{index}]")
  public void parse(String text, String expected) {
    assertThat(Pattern.parse(text).toString()).isEqualTo(expected);
  }

  @SuppressWarnings("unused") // Used via @Parameters
  private static Object[] invalidPatterns() {
    return new Object[] {
      new Object[] {"", "Empty pattern"},
      new Object[] {"L0", "Line numbers start at 1: 0"},
      new Object[] {"L5:3", "Empty line range 5:3"},
      new Object[] {"L99999999999", "Line number out of range: L99999999999"},
      new Object[] {":f(x)", "Structural pattern must have the form :(expression): :f(x)"},
      new Object[] {":(", "Structural pattern must have the form :(expression): :("},
      new Object[] {":(f(x)", "Invalid structural pattern: "},
      new Object[] {":(x = )", "Invalid structural pattern: "},
      new Object[] {"r\"[\"", "Invalid regular expression: "},
    };
  }

  @Test
  @Parameters(method = "invalidPatterns")
  @TestCaseName("{method}[{index}]")
  public void parseError(String text, String expectedPrefix) {
    PatternError e = assertThrows(PatternError.class, () -> Pattern.parse(text));
    assertThat(e).hasMessageThat().startsWith(expectedPrefix);
  }

  @Test
  public void linePatterns() {
    assertThat(Pattern.parse("L3").isLinePattern()).isTrue();
    assertThat(Pattern.parse("L3:4").isLinePattern()).isTrue();
    assertThat(Pattern.parse("L3x").isLinePattern()).isFalse();
    assertThat(Pattern.parse(":(x)").isLinePattern()).isFalse();
  }

  @Test
  public void constructorsValidate() {
    assertThrows(PatternError.class, () -> new Pattern.Line(0));
    assertThrows(PatternError.class, () -> new Pattern.LineRange(0, 2));
    assertThrows(PatternError.class, () -> new Pattern.LineRange(3, 2));
    assertThat(new Pattern.LineRange(2, 2).last()).isEqualTo(2);
  }
}
