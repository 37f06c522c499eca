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

import java.util.regex.Matcher;
import java.util.regex.PatternSyntaxException;
import org.pinpoint.compiler.Compiler;
import org.pinpoint.compiler.Node;
import org.pinpoint.compiler.SyntaxError;

/**
 * A query selecting the statements of a file to run: the name of a test group, a regular
 * expression matched against test group names, a syntax template, or source lines.
 */
public sealed interface Pattern {

  /** Selects each test group named exactly {@code name}. */
  record Name(String name) implements Pattern {}

  /** Selects each test group whose name contains a match for {@code regex}. */
  record Regex(java.util.regex.Pattern regex) implements Pattern {
    @Override
    public String toString() {
      return "r\"" + regex.pattern() + '"';
    }
  }

  /**
   * Selects each syntax node that unifies with {@code template}. In the template, a name ending
   * with {@code _} matches any single subtree and a name ending with {@code __} matches any number
   * of consecutive subtrees; each such variable must match equivalent subtrees wherever it occurs.
   */
  record Structural(Node template) implements Pattern {}

  /** Selects the statements on a single (1-based) line. */
  record Line(int line) implements Pattern {
    public Line {
      if (line < 1) {
        throw new PatternError("Line numbers start at 1: " + line);
      }
    }
  }

  /** Selects the statements on lines {@code first} through {@code last}, inclusive. */
  record LineRange(int first, int last) implements Pattern {
    public LineRange {
      if (first < 1) {
        throw new PatternError("Line numbers start at 1: " + first);
      } else if (first > last) {
        throw new PatternError(String.format("Empty line range %s:%s", first, last));
      }
    }
  }

  java.util.regex.Pattern LINE_SYNTAX = java.util.regex.Pattern.compile("L(\\d+)(?::(\\d+))?");

  /**
   * Parses the textual form of a pattern: {@code L10} or {@code L10:20} for lines, {@code :(expr)}
   * for a structural pattern, {@code r"regex"} for a regular expression, and anything else for a
   * test group name.
   *
   * @throws PatternError if {@code text} is not a valid pattern
   */
  static Pattern parse(String text) {
    if (text.isEmpty()) {
      throw new PatternError("Empty pattern");
    }
    Matcher lines = LINE_SYNTAX.matcher(text);
    if (lines.matches()) {
      try {
        int first = Integer.parseInt(lines.group(1));
        return (lines.group(2) == null)
            ? new Line(first)
            : new LineRange(first, Integer.parseInt(lines.group(2)));
      } catch (NumberFormatException e) {
        throw new PatternError("Line number out of range: " + text, e);
      }
    }
    if (text.startsWith(":")) {
      if (text.length() < 3 || !text.startsWith(":(") || !text.endsWith(")")) {
        throw new PatternError("Structural pattern must have the form :(expression): " + text);
      }
      try {
        return new Structural(Compiler.parsePattern(text.substring(2, text.length() - 1)));
      } catch (SyntaxError e) {
        throw new PatternError("Invalid structural pattern: " + e.getMessage(), e);
      }
    }
    if (text.length() >= 3 && text.startsWith("r\"") && text.endsWith("\"")) {
      try {
        return new Regex(java.util.regex.Pattern.compile(text.substring(2, text.length() - 1)));
      } catch (PatternSyntaxException e) {
        throw new PatternError("Invalid regular expression: " + e.getDescription(), e);
      }
    }
    return new Name(text);
  }

  /** True if this pattern selects lines directly rather than by matching syntax. */
  default boolean isLinePattern() {
    return this instanceof Line || this instanceof LineRange;
  }
}
