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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jspecify.annotations.Nullable;
import org.pinpoint.compiler.Node.Kind;
import org.pinpoint.compiler.PinpointParser.ParenPrimaryContext;

/**
 * A base class for the ANTLR visitors that build {@link Node} trees.
 *
 * <p>Every visit method that can be reached must be overridden; the generated "visit the children"
 * default throws an AssertionError instead. The rule being visited is tracked so that {@link
 * #error} can report its position, and the static {@code node} methods compute the line and
 * character span of the nodes they create from the parse tree.
 */
class VisitorBase<T> extends PinpointBaseVisitor<T> {

  /** The name of the source being visited, as it appears in syntax errors. */
  final String source;

  /** The innermost rule currently being visited, or null outside of any visit. */
  private @Nullable ParserRuleContext current;

  VisitorBase(String source) {
    this.source = source;
  }

  @Override
  protected final T defaultResult() {
    throw new AssertionError("No visit method for " + current);
  }

  @Override
  public final T visit(ParseTree tree) {
    ParserRuleContext saved = current;
    if (tree instanceof ParserRuleContext ctx) {
      current = ctx;
    }
    // If visiting throws, the visitor is abandoned, so there is no need to restore current.
    T result = super.visit(tree);
    current = saved;
    return result;
  }

  @Override
  public final T visitParenPrimary(ParenPrimaryContext ctx) {
    return visit(ctx.expression());
  }

  /** Returns a {@link SyntaxError} at the start of the rule being visited. */
  @FormatMethod
  SyntaxError error(String fmt, Object... fmtArgs) {
    if (current == null) {
      throw new IllegalStateException("Not visiting");
    }
    return Compiler.error(source, current.start, fmt, fmtArgs);
  }

  /** Returns a node spanning the tokens of {@code ctx}. */
  static Node node(Kind kind, String text, List<Node> children, ParserRuleContext ctx) {
    Token stop = (ctx.stop == null) ? ctx.start : ctx.stop;
    return new Node(
        kind,
        text,
        ImmutableList.copyOf(children),
        ctx.start.getLine(),
        Math.max(ctx.start.getLine(), stop.getLine()),
        ctx.start.getStartIndex(),
        Math.max(ctx.start.getStartIndex(), stop.getStopIndex()));
  }

  static Node node(Kind kind, String text, ParserRuleContext ctx, Node... children) {
    return node(kind, text, ImmutableList.copyOf(children), ctx);
  }

  /** Returns a childless node spanning a single token. */
  static Node leaf(Kind kind, String text, Token token) {
    return new Node(
        kind,
        text,
        ImmutableList.of(),
        token.getLine(),
        token.getLine(),
        token.getStartIndex(),
        token.getStopIndex());
  }

  /** Returns a synthesized node with the same span as {@code like}. */
  static Node spanningLike(Kind kind, Node like, Node... children) {
    return new Node(
        kind,
        "",
        ImmutableList.copyOf(children),
        like.firstLine,
        like.lastLine,
        like.startIndex,
        like.stopIndex);
  }
}
