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
package org.pinpoint.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.nio.file.Path;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class CompilerTest {

  private static Node parse(String text) {
    return Compiler.parse(SourceFile.of(Path.of("test.pp"), text));
  }

  @SuppressWarnings("unused") // Used via @Parameters
  private static Object[] trees() {
    return new Object[] {
      new Object[] {"x = 1", "(UNIT (ASSIGN x (NUMBER 1)))"},
      new Object[] {
        "f(x) = x * 2",
        "(UNIT (FUNCTION f (PARAMS (NAME x)) (BLOCK (RETURN (BINARY * (NAME x) (NUMBER 2))))))"
      },
      new Object[] {
        "testgroup \"g\" { assert a == 1; assert_skip b }",
        "(UNIT (TESTGROUP g (BLOCK (ASSERT assert (BINARY == (NAME a) (NUMBER 1)))"
            + " (ASSERT assert_skip (NAME b)))))"
      },
      new Object[] {"a + b * c", "(UNIT (BINARY + (NAME a) (BINARY * (NAME b) (NAME c))))"},
      new Object[] {"a - b - c", "(UNIT (BINARY - (BINARY - (NAME a) (NAME b)) (NAME c)))"},
      new Object[] {"(a - b) * c", "(UNIT (BINARY * (BINARY - (NAME a) (NAME b)) (NAME c)))"},
      new Object[] {"!a && b || c", "(UNIT (OR (AND (UNARY ! (NAME a)) (NAME b)) (NAME c)))"},
      new Object[] {"xs[1] = \"s\"", "(UNIT (INDEX_ASSIGN xs (NUMBER 1) (STRING \"s\")))"},
      new Object[] {"p.x(1)[2]", "(UNIT (INDEX (CALL (FIELD x (NAME p)) (NUMBER 1)) (NUMBER 2)))"},
      new Object[] {
        "[1, 2.5, true, nothing]", "(UNIT (ARRAY (NUMBER 1) (NUMBER 2.5) (BOOL true) (NOTHING)))"
      },
      new Object[] {
        "if a { b } else if c { d } else { e }",
        "(UNIT (IF (NAME a) (BLOCK (NAME b)) (IF (NAME c) (BLOCK (NAME d)) (BLOCK (NAME e)))))"
      },
      new Object[] {"while a { break }", "(UNIT (WHILE (NAME a) (BLOCK (BREAK))))"},
      new Object[] {"for i in xs { continue }", "(UNIT (FOR i (NAME xs) (BLOCK (CONTINUE))))"},
      new Object[] {
        "namespace N { struct P(a, b) }",
        "(UNIT (NAMESPACE N (BLOCK (STRUCT P (PARAMS (NAME a) (NAME b))))))"
      },
      new Object[] {"f(1,\n  2)", "(UNIT (CALL (NAME f) (NUMBER 1) (NUMBER 2)))"},
      new Object[] {"const K = 1  # a comment", "(UNIT (CONST K (NUMBER 1)))"},
      new Object[] {"function g() { return }", "(UNIT (FUNCTION g (PARAMS) (BLOCK (RETURN))))"},
      new Object[] {"s = \"a\\\"b\\n\"", "(UNIT (ASSIGN s (STRING \"a\"b\n\")))"},
      new Object[] {"\n\n; x\n\n", "(UNIT (NAME x))"},
    };
  }

  @Test
  @Parameters(method = "trees")
  @TestCaseName("{method}[{index}]")
  public void parseTree(String source, String expected) {
    assertThat(parse(source).toString()).isEqualTo(expected);
  }

  @SuppressWarnings("unused") // Used via @Parameters
  private static Object[] errors() {
    return new Object[] {
      new Object[] {"function f(x, x) { }", "Duplicate parameter name 'x'"},
      new Object[] {"x = 99999999999999999999", "Integer literal out of range"},
      new Object[] {"testgroup g { }", ""},
      new Object[] {"x = (1", ""},
      new Object[] {"x = 1 2", ""},
    };
  }

  @Test
  @Parameters(method = "errors")
  @TestCaseName("{method}[{index}]")
  public void syntaxError(String source, String expectedMessage) {
    SyntaxError e = assertThrows(SyntaxError.class, () -> parse(source));
    assertThat(e.source).isEqualTo("test.pp");
    assertThat(e.lineNum).isEqualTo(1);
    assertThat(e.msg).contains(expectedMessage);
  }

  @Test
  public void spans() {
    Node unit = parse("x = 1\ntestgroup \"g\" {\n  assert x ==\n    1\n}\n");
    Node group = unit.child(1);
    assertThat(group.kind).isEqualTo(Node.Kind.TESTGROUP);
    assertThat(group.firstLine).isEqualTo(2);
    assertThat(group.lastLine).isEqualTo(5);
    Node assertion = group.child(0).child(0);
    assertThat(assertion.firstLine).isEqualTo(3);
    assertThat(assertion.lastLine).isEqualTo(4);
    assertThat(assertion.isTestDeclaration()).isTrue();
    assertThat(unit.child(0).isTestDeclaration()).isFalse();
  }

  @Test
  public void textOf() {
    SourceFile source = SourceFile.of(Path.of("test.pp"), "assert f(1,  2) == 3");
    Node assertion = Compiler.parse(source).child(0);
    assertThat(source.textOf(assertion.child(0))).isEqualTo("f(1,  2) == 3");
    assertThat(source.displayName()).isEqualTo("test.pp");
  }

  @Test
  public void parsePattern() {
    assertThat(Compiler.parsePattern("f(a_) == b_").toString())
        .isEqualTo("(BINARY == (CALL (NAME f) (NAME a_)) (NAME b_))");
    assertThat(Compiler.parsePattern("assert x__").toString())
        .isEqualTo("(ASSERT assert (NAME x__))");
    SyntaxError e = assertThrows(SyntaxError.class, () -> Compiler.parsePattern("f("));
    assertThat(e.source).isEqualTo("(pattern)");
  }

  @Test
  public void equivalentIgnoresPosition() {
    Node a = Compiler.parsePattern("f(1) + g");
    Node b = parse("\n\nf( 1 )+g").child(0);
    assertThat(a.equivalent(b)).isTrue();
    assertThat(a.equivalent(Compiler.parsePattern("f(1) + h"))).isFalse();
  }
}
