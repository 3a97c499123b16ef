/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.ecmatree.ast;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A tree construction helper for passes and tests that synthesize nodes. Every node built here
 * has an unknown line number. Statement and expression positions are checked against {@link
 * Kind}.
 */
public final class IR {

  private static final int NO_LINE = Node.UNKNOWN_LINENO;

  /** 2^53; integral doubles below this print without loss as a {@code long}. */
  private static final double MAX_EXACT_INTEGER = 9007199254740992.0;

  private IR() {}

  public static Program program(Node... stmts) {
    return new Program(statements(stmts), NO_LINE);
  }

  public static Block block(Node... stmts) {
    return new Block(statements(stmts), NO_LINE);
  }

  public static Identifier name(String name) {
    return new Identifier(name, NO_LINE);
  }

  public static NumberLiteral number(double value) {
    if (value == Math.rint(value)
        && Math.abs(value) < MAX_EXACT_INTEGER
        && !(value == 0 && 1 / value < 0)) {
      return new NumberLiteral(String.valueOf((long) value), NO_LINE);
    }
    return new NumberLiteral(String.valueOf(value), NO_LINE);
  }

  /** Builds a double-quoted string literal. The caller is responsible for escaping. */
  public static StringLiteral string(String value) {
    return new StringLiteral("\"" + value + "\"", NO_LINE);
  }

  public static BooleanLiteral trueNode() {
    return new BooleanLiteral("true", NO_LINE);
  }

  public static BooleanLiteral falseNode() {
    return new BooleanLiteral("false", NO_LINE);
  }

  public static NullLiteral nullNode() {
    return new NullLiteral("null", NO_LINE);
  }

  public static This thisNode() {
    return new This(NO_LINE);
  }

  public static EmptyStatement empty() {
    return new EmptyStatement(NO_LINE);
  }

  public static ExprStatement exprResult(Node expr) {
    checkState(mayBeExpression(expr), "Not an expression: %s", expr);
    return new ExprStatement(expr, NO_LINE);
  }

  public static VarStatement var(Identifier name, @Nullable Node value) {
    return new VarStatement(ImmutableList.of(new VarDecl(name, value, NO_LINE)), NO_LINE);
  }

  public static Assign assign(Node target, Node value) {
    return new Assign("=", target, value, NO_LINE);
  }

  public static BinOp binOp(String op, Node left, Node right) {
    checkState(mayBeExpression(left), "Not an expression: %s", left);
    checkState(mayBeExpression(right), "Not an expression: %s", right);
    return new BinOp(op, left, right, NO_LINE);
  }

  public static Comma comma(Node left, Node right) {
    return new Comma(left, right, NO_LINE);
  }

  public static FunctionCall call(Node target, Node... args) {
    return new FunctionCall(target, ImmutableList.copyOf(args), NO_LINE);
  }

  public static DotAccessor getprop(Node target, String prop) {
    return new DotAccessor(target, name(prop), NO_LINE);
  }

  public static BracketAccessor getelem(Node target, Node elem) {
    return new BracketAccessor(target, elem, NO_LINE);
  }

  public static If ifNode(Node cond, Node then) {
    return ifNode(cond, then, null);
  }

  public static If ifNode(Node cond, Node then, @Nullable Node elseNode) {
    checkState(mayBeExpression(cond), "Not an expression: %s", cond);
    checkState(mayBeStatement(then), "Not a statement: %s", then);
    checkState(elseNode == null || mayBeStatement(elseNode), "Not a statement: %s", elseNode);
    return new If(cond, then, elseNode, NO_LINE);
  }

  public static While whileNode(Node cond, Node body) {
    return new While(cond, body, NO_LINE);
  }

  public static For forNode(
      @Nullable Node init, @Nullable Node cond, @Nullable Node incr, Node body) {
    checkState(mayBeStatement(body), "Not a statement: %s", body);
    return new For(init, cond, incr, body, NO_LINE);
  }

  public static Return returnNode() {
    return new Return(null, NO_LINE);
  }

  public static Return returnNode(Node expr) {
    checkState(mayBeExpression(expr), "Not an expression: %s", expr);
    return new Return(expr, NO_LINE);
  }

  public static Throw throwNode(Node expr) {
    return new Throw(expr, NO_LINE);
  }

  public static FuncDecl function(String name, ImmutableList<String> params, Node... body) {
    return new FuncDecl(name(name), names(params), statements(body), NO_LINE);
  }

  public static FuncExpr functionExpr(ImmutableList<String> params, Node... body) {
    return new FuncExpr(null, names(params), statements(body), NO_LINE);
  }

  public static boolean mayBeStatement(Node n) {
    return n.getKind().isStatement();
  }

  public static boolean mayBeExpression(Node n) {
    return n.getKind().isExpression();
  }

  private static ImmutableList<Node> statements(Node... stmts) {
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Not a statement: %s", stmt);
    }
    return ImmutableList.copyOf(stmts);
  }

  private static ImmutableList<Identifier> names(ImmutableList<String> names) {
    ImmutableList.Builder<Identifier> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(name(name));
    }
    return builder.build();
  }
}
