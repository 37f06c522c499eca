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

import com.google.errorprone.annotations.FormatMethod;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.pinpoint.compiler.PinpointParser.PatternContext;
import org.pinpoint.compiler.PinpointParser.UnitContext;

/** Parses Pinpoint source code into syntax trees. */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  /** The source name used for errors in structural pattern text. */
  static final String PATTERN_SOURCE = "(pattern)";

  /**
   * Parses a source file and returns its syntax tree, a node of kind {@link Node.Kind#UNIT}.
   *
   * @throws SyntaxError if the file is not a valid program
   */
  public static Node parse(SourceFile file) {
    UnitContext unit = newParser(CharStreams.fromString(file.text), file.displayName()).unit();
    return new SyntaxBuilder(file.displayName()).visit(unit);
  }

  /**
   * Parses the body of a structural pattern (a single statement or expression) and returns its
   * syntax tree.
   *
   * @throws SyntaxError if {@code text} is not a valid statement
   */
  public static Node parsePattern(String text) {
    PatternContext pattern = newParser(CharStreams.fromString(text), PATTERN_SOURCE).pattern();
    return new SyntaxBuilder(PATTERN_SOURCE).visit(pattern.statement());
  }

  /** Returns a parser for {@code input} that throws SyntaxErrors in response to parsing errors. */
  private static PinpointParser newParser(CharStream input, String source) {
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new SyntaxError(msg, source, lineNum, charPositionInLine);
          }
        };
    PinpointLexer lexer = new PinpointLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    PinpointParser parser = new PinpointParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser;
  }

  /** Returns a new SyntaxError referring to the given token. */
  static SyntaxError error(String source, Token token, String msg) {
    int lineNum;
    int charPositionInLine;
    if (token != null) {
      lineNum = token.getLine();
      charPositionInLine = token.getCharPositionInLine();
    } else {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      lineNum = 0;
      charPositionInLine = 0;
    }
    return new SyntaxError(msg, source, lineNum, charPositionInLine);
  }

  /** Returns a new SyntaxError referring to the given token. */
  @FormatMethod
  static SyntaxError error(String source, Token token, String fmt, Object... fmtArgs) {
    return error(source, token, String.format(fmt, fmtArgs));
  }

  /** Returns a new SyntaxError located at the start of the given node. */
  @FormatMethod
  static SyntaxError error(String source, Node node, String fmt, Object... fmtArgs) {
    return new SyntaxError(String.format(fmt, fmtArgs), source, node.firstLine, 0);
  }

  /** Returns the value of a string literal token, with the quotes removed and escapes resolved. */
  static String unescape(String literal) {
    StringBuilder sb = new StringBuilder(literal.length());
    for (int i = 1; i < literal.length() - 1; i++) {
      char c = literal.charAt(i);
      if (c == '\\') {
        c = literal.charAt(++i);
        switch (c) {
          case 'n' -> sb.append('\n');
          case 't' -> sb.append('\t');
          case 'r' -> sb.append('\r');
          default -> sb.append(c);
        }
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
