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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jspecify.annotations.Nullable;
import org.pinpoint.compiler.Node.Kind;
import org.pinpoint.compiler.PinpointParser.AndExpressionContext;
import org.pinpoint.compiler.PinpointParser.ArgsContext;
import org.pinpoint.compiler.PinpointParser.ArrayPrimaryContext;
import org.pinpoint.compiler.PinpointParser.AssertStatementContext;
import org.pinpoint.compiler.PinpointParser.AssignStatementContext;
import org.pinpoint.compiler.PinpointParser.BinaryExpressionContext;
import org.pinpoint.compiler.PinpointParser.BlockContext;
import org.pinpoint.compiler.PinpointParser.BoolPrimaryContext;
import org.pinpoint.compiler.PinpointParser.BreakStatementContext;
import org.pinpoint.compiler.PinpointParser.CallExpressionContext;
import org.pinpoint.compiler.PinpointParser.ConstStatementContext;
import org.pinpoint.compiler.PinpointParser.ContinueStatementContext;
import org.pinpoint.compiler.PinpointParser.ExpressionStatementContext;
import org.pinpoint.compiler.PinpointParser.FieldExpressionContext;
import org.pinpoint.compiler.PinpointParser.ForStatementContext;
import org.pinpoint.compiler.PinpointParser.FunctionStatementContext;
import org.pinpoint.compiler.PinpointParser.IfChainContext;
import org.pinpoint.compiler.PinpointParser.IfStatementContext;
import org.pinpoint.compiler.PinpointParser.IndexExpressionContext;
import org.pinpoint.compiler.PinpointParser.NamePrimaryContext;
import org.pinpoint.compiler.PinpointParser.NamespaceStatementContext;
import org.pinpoint.compiler.PinpointParser.NothingPrimaryContext;
import org.pinpoint.compiler.PinpointParser.NumberPrimaryContext;
import org.pinpoint.compiler.PinpointParser.OrExpressionContext;
import org.pinpoint.compiler.PinpointParser.ParamsContext;
import org.pinpoint.compiler.PinpointParser.PrimaryExpressionContext;
import org.pinpoint.compiler.PinpointParser.ReturnStatementContext;
import org.pinpoint.compiler.PinpointParser.ShortFunctionStatementContext;
import org.pinpoint.compiler.PinpointParser.StatementContext;
import org.pinpoint.compiler.PinpointParser.StmtsContext;
import org.pinpoint.compiler.PinpointParser.StringPrimaryContext;
import org.pinpoint.compiler.PinpointParser.StructStatementContext;
import org.pinpoint.compiler.PinpointParser.TestgroupStatementContext;
import org.pinpoint.compiler.PinpointParser.UnaryExpressionContext;
import org.pinpoint.compiler.PinpointParser.UnitContext;
import org.pinpoint.compiler.PinpointParser.WhileStatementContext;

/** Converts an ANTLR parse tree into an immutable {@link Node} tree. */
class SyntaxBuilder extends VisitorBase<Node> {

  SyntaxBuilder(String source) {
    super(source);
  }

  private ImmutableList<Node> statements(StmtsContext ctx) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (StatementContext statement : ctx.statement()) {
      result.add(visit(statement));
    }
    return result.build();
  }

  @Override
  public Node visitUnit(UnitContext ctx) {
    return node(Kind.UNIT, "", statements(ctx.stmts()), ctx);
  }

  @Override
  public Node visitBlock(BlockContext ctx) {
    return node(Kind.BLOCK, "", statements(ctx.stmts()), ctx);
  }

  @Override
  public Node visitNamespaceStatement(NamespaceStatementContext ctx) {
    return node(Kind.NAMESPACE, ctx.ID().getText(), ctx, visit(ctx.block()));
  }

  @Override
  public Node visitFunctionStatement(FunctionStatementContext ctx) {
    Node params = params(ctx.params(), ctx);
    return node(Kind.FUNCTION, ctx.ID().getText(), ctx, params, visit(ctx.block()));
  }

  @Override
  public Node visitShortFunctionStatement(ShortFunctionStatementContext ctx) {
    // "f(x) = e" is shorthand for "function f(x) { return e }".
    Node params = params(ctx.params(), ctx);
    Node value = visit(ctx.expression());
    Node body = spanningLike(Kind.BLOCK, value, spanningLike(Kind.RETURN, value, value));
    return node(Kind.FUNCTION, ctx.ID().getText(), ctx, params, body);
  }

  @Override
  public Node visitStructStatement(StructStatementContext ctx) {
    return node(Kind.STRUCT, ctx.ID().getText(), ctx, params(ctx.params(), ctx));
  }

  private Node params(@Nullable ParamsContext ctx, ParserRuleContext owner) {
    if (ctx == null) {
      return node(Kind.PARAMS, "", ImmutableList.of(), owner);
    }
    Set<String> seen = new HashSet<>();
    ImmutableList.Builder<Node> names = ImmutableList.builder();
    for (TerminalNode id : ctx.ID()) {
      String name = id.getText();
      if (!seen.add(name)) {
        throw Compiler.error(source, id.getSymbol(), "Duplicate parameter name '%s'", name);
      }
      names.add(leaf(Kind.NAME, name, id.getSymbol()));
    }
    return node(Kind.PARAMS, "", names.build(), ctx);
  }

  @Override
  public Node visitConstStatement(ConstStatementContext ctx) {
    return node(Kind.CONST, ctx.ID().getText(), ctx, visit(ctx.expression()));
  }

  @Override
  public Node visitTestgroupStatement(TestgroupStatementContext ctx) {
    String name = Compiler.unescape(ctx.STRING().getText());
    return node(Kind.TESTGROUP, name, ctx, visit(ctx.block()));
  }

  @Override
  public Node visitAssertStatement(AssertStatementContext ctx) {
    return node(Kind.ASSERT, TokenType.assertKeyword(ctx.kind), ctx, visit(ctx.expression()));
  }

  @Override
  public Node visitIfStatement(IfStatementContext ctx) {
    return visit(ctx.ifChain());
  }

  @Override
  public Node visitIfChain(IfChainContext ctx) {
    Node condition = visit(ctx.expression());
    Node then = visit(ctx.block(0));
    if (ctx.block().size() > 1) {
      return node(Kind.IF, "", ctx, condition, then, visit(ctx.block(1)));
    } else if (ctx.ifChain() != null) {
      return node(Kind.IF, "", ctx, condition, then, visit(ctx.ifChain()));
    }
    return node(Kind.IF, "", ctx, condition, then);
  }

  @Override
  public Node visitWhileStatement(WhileStatementContext ctx) {
    return node(Kind.WHILE, "", ctx, visit(ctx.expression()), visit(ctx.block()));
  }

  @Override
  public Node visitForStatement(ForStatementContext ctx) {
    return node(Kind.FOR, ctx.ID().getText(), ctx, visit(ctx.expression()), visit(ctx.block()));
  }

  @Override
  public Node visitReturnStatement(ReturnStatementContext ctx) {
    if (ctx.expression() == null) {
      return node(Kind.RETURN, "", ctx);
    }
    return node(Kind.RETURN, "", ctx, visit(ctx.expression()));
  }

  @Override
  public Node visitBreakStatement(BreakStatementContext ctx) {
    return node(Kind.BREAK, "", ctx);
  }

  @Override
  public Node visitContinueStatement(ContinueStatementContext ctx) {
    return node(Kind.CONTINUE, "", ctx);
  }

  @Override
  public Node visitAssignStatement(AssignStatementContext ctx) {
    String name = ctx.ID().getText();
    Node value = visit(ctx.expression());
    if (ctx.args() == null) {
      return node(Kind.ASSIGN, name, ctx, value);
    }
    ImmutableList<Node> children =
        ImmutableList.<Node>builder().addAll(args(ctx.args())).add(value).build();
    return node(Kind.INDEX_ASSIGN, name, children, ctx);
  }

  @Override
  public Node visitExpressionStatement(ExpressionStatementContext ctx) {
    return visit(ctx.expression());
  }

  private ImmutableList<Node> args(@Nullable ArgsContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    return ctx.expression().stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Node visitPrimaryExpression(PrimaryExpressionContext ctx) {
    return visit(ctx.primary());
  }

  @Override
  public Node visitCallExpression(CallExpressionContext ctx) {
    ImmutableList<Node> children =
        ImmutableList.<Node>builder().add(visit(ctx.expression())).addAll(args(ctx.args())).build();
    return node(Kind.CALL, "", children, ctx);
  }

  @Override
  public Node visitIndexExpression(IndexExpressionContext ctx) {
    ImmutableList<Node> children =
        ImmutableList.<Node>builder().add(visit(ctx.expression())).addAll(args(ctx.args())).build();
    return node(Kind.INDEX, "", children, ctx);
  }

  @Override
  public Node visitFieldExpression(FieldExpressionContext ctx) {
    return node(Kind.FIELD, ctx.ID().getText(), ctx, visit(ctx.expression()));
  }

  @Override
  public Node visitUnaryExpression(UnaryExpressionContext ctx) {
    return node(Kind.UNARY, ctx.op.getText(), ctx, visit(ctx.expression()));
  }

  @Override
  public Node visitBinaryExpression(BinaryExpressionContext ctx) {
    return node(
        Kind.BINARY, ctx.op.getText(), ctx, visit(ctx.expression(0)), visit(ctx.expression(1)));
  }

  @Override
  public Node visitAndExpression(AndExpressionContext ctx) {
    return node(Kind.AND, "", ctx, visit(ctx.expression(0)), visit(ctx.expression(1)));
  }

  @Override
  public Node visitOrExpression(OrExpressionContext ctx) {
    return node(Kind.OR, "", ctx, visit(ctx.expression(0)), visit(ctx.expression(1)));
  }

  @Override
  public Node visitNumberPrimary(NumberPrimaryContext ctx) {
    String text = ctx.NUMBER().getText();
    if (isInteger(text)) {
      try {
        Long.parseLong(text);
      } catch (NumberFormatException e) {
        throw error("Integer literal out of range: %s", text);
      }
    }
    return node(Kind.NUMBER, text, ctx);
  }

  /** True if the NUMBER token {@code text} should be read as a long rather than a double. */
  static boolean isInteger(String text) {
    return text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0;
  }

  @Override
  public Node visitStringPrimary(StringPrimaryContext ctx) {
    return node(Kind.STRING, Compiler.unescape(ctx.STRING().getText()), ctx);
  }

  @Override
  public Node visitBoolPrimary(BoolPrimaryContext ctx) {
    return node(Kind.BOOL, ctx.start.getType() == TokenType.KEYWORD_TRUE ? "true" : "false", ctx);
  }

  @Override
  public Node visitNothingPrimary(NothingPrimaryContext ctx) {
    return node(Kind.NOTHING, "", ctx);
  }

  @Override
  public Node visitNamePrimary(NamePrimaryContext ctx) {
    return node(Kind.NAME, ctx.ID().getText(), ctx);
  }

  @Override
  public Node visitArrayPrimary(ArrayPrimaryContext ctx) {
    return node(Kind.ARRAY, "", args(ctx.args()), ctx);
  }
}
