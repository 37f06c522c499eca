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

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;

/**
 * Token types of the keywords that the syntax builder distinguishes by type rather than by rule.
 * ANTLR only exposes token types as generated int constants named after their rules, so the
 * keyword tokens are looked up by their literal names.
 */
class TokenType {

  private TokenType() {}

  static final int KEYWORD_TRUE = literal("true");

  /** Assertion keyword token types, mapped to the keyword text. */
  private static final ImmutableMap<Integer, String> ASSERTIONS =
      ImmutableMap.of(
          literal("assert"), "assert",
          literal("assert_broken"), "assert_broken",
          literal("assert_skip"), "assert_skip",
          literal("assert_throws"), "assert_throws");

  /** Returns the token type whose literal name is {@code 'text'}. */
  private static int literal(String text) {
    Vocabulary vocab = PinpointLexer.VOCABULARY;
    String quoted = "'" + text + "'";
    for (int i = 1; i <= vocab.getMaxTokenType(); i++) {
      if (quoted.equals(vocab.getLiteralName(i))) {
        return i;
      }
    }
    throw new IllegalArgumentException("No token " + quoted);
  }

  /** Returns the keyword that introduced an assertion statement. */
  static String assertKeyword(Token keyword) {
    String result = ASSERTIONS.get(keyword.getType());
    if (result == null) {
      throw new AssertionError(keyword);
    }
    return result;
  }
}
