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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the child and parent contract of {@link Node}. */
@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testForChildrenKeepAbsentPositions() {
    Node cond = IR.binOp("<", IR.name("i"), IR.number(10));
    Node body = IR.block();
    For loop = new For(null, cond, null, body, 3);

    assertThat(loop.children()).containsExactly(null, cond, null, body).inOrder();
    assertThat(loop.presentChildren()).containsExactly(cond, body).inOrder();
  }

  @Test
  public void testForChildrenInSourceOrder() {
    Node init = IR.var(IR.name("i"), IR.number(0));
    Node cond = IR.binOp("<", IR.name("i"), IR.number(10));
    Node count = new UnaryOp("++", IR.name("i"), true, 1);
    Node body = IR.block();
    For loop = new For(init, cond, count, body, 1);

    assertThat(loop.children()).containsExactly(init, cond, count, body).inOrder();
  }

  @Test
  public void testIfWithoutElseKeepsPredicateAtZero() {
    Node predicate = IR.name("a");
    Node consequent = IR.block();
    If withoutElse = IR.ifNode(predicate, consequent);

    assertThat(withoutElse.children()).hasSize(3);
    assertThat(withoutElse.children().get(0)).isSameInstanceAs(predicate);
    assertThat(withoutElse.children().get(2)).isNull();
    assertThat(withoutElse.getAlternative()).isNull();
  }

  @Test
  public void testLeavesHaveNoChildren() {
    assertThat(IR.name("x").children()).isEmpty();
    assertThat(IR.string("s").children()).isEmpty();
    assertThat(IR.thisNode().children()).isEmpty();
    assertThat(new Debugger(1).children()).isEmpty();
    assertThat(new Elision(2, 1).children()).isEmpty();
    assertThat(new RegexLiteral("/a+/g", 1).hasChildren()).isFalse();
  }

  @Test
  public void testEmptyListSlotGivesEmptyChildren() {
    assertThat(IR.block().children()).isEmpty();
    assertThat(new ArrayLiteral(ImmutableList.of(), 1).children()).isEmpty();
  }

  @Test
  public void testDoWhileChildrenBodyFirst() {
    Node body = IR.block();
    Node predicate = IR.name("more");
    DoWhile loop = new DoWhile(body, predicate, 1);

    assertThat(loop.children()).containsExactly(body, predicate).inOrder();
  }

  @Test
  public void testFunctionChildrenNameParametersBody() {
    Identifier name = IR.name("f");
    Identifier a = IR.name("a");
    Identifier b = IR.name("b");
    Node body = IR.returnNode(IR.name("a"));
    FuncDecl f = new FuncDecl(name, ImmutableList.of(a, b), ImmutableList.of(body), 1);

    assertThat(f.children()).containsExactly(name, a, b, body).inOrder();
  }

  @Test
  public void testAnonymousFunctionExpressionHasAbsentName() {
    FuncExpr f = IR.functionExpr(ImmutableList.of("x"));

    assertThat(f.children()).hasSize(2);
    assertThat(f.children().get(0)).isNull();
    assertThat(f.getIdentifier()).isNull();
  }

  @Test
  public void testCallChildrenCalleeThenArguments() {
    Node callee = IR.getprop(IR.name("console"), "log");
    Node arg1 = IR.string("a");
    Node arg2 = IR.number(1);
    FunctionCall call = IR.call(callee, arg1, arg2);

    assertThat(call.children()).containsExactly(callee, arg1, arg2).inOrder();
  }

  @Test
  public void testSwitchKeepsClauseOrder() {
    Node call = IR.exprResult(IR.call(IR.name("f")));
    Case first = new Case(IR.number(1), ImmutableList.of(call), 2);
    Default dflt = new Default(ImmutableList.of(new Break(null, 3)), 3);
    Case last = new Case(IR.number(2), ImmutableList.of(IR.returnNode()), 4);
    Node expr = IR.name("x");
    Switch sw = new Switch(expr, ImmutableList.of(first, dflt, last), 1);

    assertThat(sw.children()).containsExactly(expr, first, dflt, last).inOrder();
    assertThat(sw.getDefault()).isSameInstanceAs(dflt);
    assertThat(dflt.getElements().get(0).getKind()).isEqualTo(Kind.BREAK);
  }

  @Test
  public void testCaseChildrenLabelThenStatements() {
    Node label = IR.number(1);
    Node call = IR.exprResult(IR.call(IR.name("f")));
    Node exit = new Break(null, 3);
    Case clause = new Case(label, ImmutableList.of(call, exit), 2);

    assertThat(clause.children()).containsExactly(label, call, exit).inOrder();
    assertThat(clause.getElements()).containsExactly(call, exit).inOrder();
    assertThat(label.getParent()).isSameInstanceAs(clause);
    assertThat(call.getParent()).isSameInstanceAs(clause);
    assertThat(exit.getParent()).isSameInstanceAs(clause);
  }

  @Test
  public void testDefaultHoldsStatements() {
    Node exit = IR.returnNode();
    Default clause = new Default(ImmutableList.of(exit), 1);

    assertThat(clause.children()).containsExactly(exit);
    assertThat(exit.getParent()).isSameInstanceAs(clause);
  }

  @Test
  public void testSwitchRejectsTwoDefaults() {
    Default one = new Default(ImmutableList.of(), 1);
    Default two = new Default(ImmutableList.of(), 2);

    assertThrows(
        IllegalArgumentException.class,
        () -> new Switch(IR.name("x"), ImmutableList.of(one, two), 1));
  }

  @Test
  public void testTryRequiresCatchOrFinally() {
    assertThrows(IllegalArgumentException.class, () -> new Try(IR.block(), null, null, 1));
  }

  @Test
  public void testTryChildren() {
    Block body = IR.block();
    Catch handler = new Catch(IR.name("e"), IR.block(), 2);
    Try tryNode = new Try(body, handler, null, 1);

    assertThat(tryNode.children()).containsExactly(body, handler, null).inOrder();
  }

  @Test
  public void testConstructionSetsParent() {
    Node left = IR.name("a");
    Node right = IR.number(1);
    BinOp sum = IR.binOp("+", left, right);

    assertThat(left.getParent()).isSameInstanceAs(sum);
    assertThat(right.getParent()).isSameInstanceAs(sum);
    assertThat(sum.getParent()).isNull();
    assertThat(sum.hasParent()).isFalse();
  }

  @Test
  public void testListChildrenGetParent() {
    Node s1 = IR.empty();
    Node s2 = IR.empty();
    Block block = IR.block(s1, s2);

    assertThat(s1.getParent()).isSameInstanceAs(block);
    assertThat(s2.getParent()).isSameInstanceAs(block);
  }

  @Test
  public void testCannotAttachOwnedChild() {
    Node shared = IR.name("a");
    IR.exprResult(shared);

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> IR.exprResult(shared));
    assertThat(e).hasMessageThat().contains("already-owned");
  }

  @Test
  public void testRequiredChildMustBePresent() {
    assertThrows(NullPointerException.class, () -> new Throw(null, 1));
  }

  @Test
  public void testChildrenIsSnapshot() {
    Node s1 = IR.empty();
    Block block = IR.block(s1);
    List<Node> before = block.children();

    s1.replaceWith(IR.returnNode());

    assertThat(before).containsExactly(s1);
  }

  @Test
  public void testChildrenIsUnmodifiable() {
    Block block = IR.block(IR.empty());

    assertThrows(UnsupportedOperationException.class, () -> block.children().clear());
    assertThrows(UnsupportedOperationException.class, () -> block.getStatements().clear());
  }

  @Test
  public void testLineno() {
    assertThat(new Identifier("x", 7).getLineno()).isEqualTo(7);
    assertThat(IR.name("x").getLineno()).isEqualTo(Node.UNKNOWN_LINENO);
  }

  @Test
  public void testToString() {
    assertThat(new Identifier("foo", 3).toString()).isEqualTo("IDENTIFIER foo [line 3]");
    assertThat(new UnaryOp("++", IR.name("i"), true, 2).toString())
        .isEqualTo("UNARY_OP postfix ++ [line 2]");
    assertThat(IR.block().toString()).isEqualTo("BLOCK");
  }

  @Test
  public void testToStringTree() {
    If ifNode = IR.ifNode(IR.trueNode(), IR.block(IR.returnNode()));

    assertThat(ifNode.toStringTree())
        .isEqualTo(
            "IF\n"
                + "    BOOLEAN true\n"
                + "    BLOCK\n"
                + "        RETURN\n"
                + "            <absent>\n"
                + "    <absent>\n");
  }

  @Test
  public void testKindCategories() {
    assertThat(Kind.NUMBER.isLiteral()).isTrue();
    assertThat(Kind.NUMBER.isExpression()).isTrue();
    assertThat(Kind.IDENTIFIER.isLiteral()).isFalse();
    assertThat(Kind.IF.isStatement()).isTrue();
    assertThat(Kind.IF.isExpression()).isFalse();
    assertThat(Kind.CASE.isStatement()).isFalse();
    assertThat(Kind.CASE.isExpression()).isFalse();
  }
}
