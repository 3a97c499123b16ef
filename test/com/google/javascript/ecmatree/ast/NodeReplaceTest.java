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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Node#replaceWith} and {@link Node#replaceChild}. */
@RunWith(JUnit4.class)
public final class NodeReplaceTest {

  @Test
  public void testReplaceSingleSlot() {
    Node a = IR.name("a");
    Node b = IR.block();
    Node c = IR.block();
    If ifNode = IR.ifNode(a, b, c);
    Node a2 = IR.name("a2");

    a.replaceWith(a2);

    assertThat(ifNode.getPredicate()).isSameInstanceAs(a2);
    assertThat(a2.getParent()).isSameInstanceAs(ifNode);
    assertThat(ifNode.getConsequent()).isSameInstanceAs(b);
    assertThat(ifNode.getAlternative()).isSameInstanceAs(c);
    assertThat(b.getParent()).isSameInstanceAs(ifNode);
    assertThat(c.getParent()).isSameInstanceAs(ifNode);
  }

  @Test
  public void testReplaceListSlot() {
    Node s1 = IR.empty();
    Node s2 = IR.empty();
    Node s3 = IR.empty();
    Block block = IR.block(s1, s2, s3);
    Node s2b = IR.returnNode();

    s2.replaceWith(s2b);

    assertThat(block.children()).containsExactly(s1, s2b, s3).inOrder();
    assertThat(block.getStatements()).containsExactly(s1, s2b, s3).inOrder();
    assertThat(s2b.getParent()).isSameInstanceAs(block);
  }

  @Test
  public void testReplaceWithDifferentKind() {
    FunctionCall call = IR.call(IR.name("f"));
    ExprStatement stmt = IR.exprResult(call);
    StringLiteral folded = IR.string("folded");

    call.replaceWith(folded);

    assertThat(stmt.getExpr()).isSameInstanceAs(folded);
    assertThat(stmt.children()).containsExactly(folded);
  }

  @Test
  public void testReplaceEveryOccurrence() {
    Identifier x = IR.name("x");
    BinOp sum = new BinOp("+", x, x, 1);
    Identifier y = IR.name("y");

    x.replaceWith(y);

    assertThat(sum.getLeft()).isSameInstanceAs(y);
    assertThat(sum.getRight()).isSameInstanceAs(y);
    assertThat(y.getParent()).isSameInstanceAs(sum);
  }

  @Test
  public void testReplaceEveryOccurrenceInList() {
    Node arg = IR.name("v");
    FunctionCall call = new FunctionCall(IR.name("f"), ImmutableList.of(arg, arg), 1);
    Node replacement = IR.number(0);

    arg.replaceWith(replacement);

    assertThat(call.getArgs()).containsExactly(replacement, replacement);
  }

  @Test
  public void testReplaceMatchesByIdentity() {
    Identifier first = IR.name("a");
    Identifier second = IR.name("a");
    BinOp sum = IR.binOp("+", first, second);
    Identifier replacement = IR.name("b");

    first.replaceWith(replacement);

    assertThat(sum.getLeft()).isSameInstanceAs(replacement);
    assertThat(sum.getRight()).isSameInstanceAs(second);
  }

  @Test
  public void testReplaceRootFails() {
    Node s1 = IR.empty();
    Block root = IR.block(s1);

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> root.replaceWith(IR.block()));

    assertThat(e).hasMessageThat().contains("Has no parent");
    assertThat(root.children()).containsExactly(s1);
    assertThat(s1.getParent()).isSameInstanceAs(root);
  }

  @Test
  public void testReplacedNodeIsLeftUntouched() {
    Node left = IR.number(1);
    Node right = IR.number(2);
    BinOp sum = IR.binOp("+", left, right);
    ExprStatement stmt = IR.exprResult(sum);
    Node folded = IR.number(3);

    sum.replaceWith(folded);

    assertThat(sum.getParent()).isSameInstanceAs(stmt);
    assertThat(sum.children()).containsExactly(left, right).inOrder();
    assertThat(left.getParent()).isSameInstanceAs(sum);
    assertThat(stmt.getExpr()).isSameInstanceAs(folded);
  }

  @Test
  public void testReplacementDescendantsKeepTheirParent() {
    Node inner = IR.name("inner");
    Node replacement = IR.call(inner);
    Node target = IR.name("target");
    IR.exprResult(target);

    target.replaceWith(replacement);

    assertThat(inner.getParent()).isSameInstanceAs(replacement);
  }

  @Test
  public void testReplaceWithOwnChild() {
    Node cond = IR.name("debug");
    Block then = IR.block(IR.exprResult(IR.call(IR.name("log"))));
    If ifNode = IR.ifNode(cond, then);
    Program program = IR.program(ifNode);

    ifNode.replaceWith(then);

    assertThat(program.getStatements()).containsExactly(then);
    assertThat(then.getParent()).isSameInstanceAs(program);
  }

  @Test
  public void testReplaceWithGrandchild() {
    Identifier x = IR.name("x");
    UnaryOp inner = new UnaryOp("!", x, false, 1);
    UnaryOp outer = new UnaryOp("!", inner, false, 1);
    ExprStatement stmt = IR.exprResult(outer);

    outer.replaceWith(x);

    assertThat(stmt.getExpr()).isSameInstanceAs(x);
    assertThat(x.getParent()).isSameInstanceAs(stmt);
    assertThat(outer.getParent()).isSameInstanceAs(stmt);
  }

  @Test
  public void testReplaceRejectsDescendantOfSibling() {
    Identifier x = IR.name("x");
    UnaryOp sibling = new UnaryOp("!", x, false, 1);
    Node target = IR.name("y");
    BinOp sum = IR.binOp("+", target, sibling);

    assertThrows(IllegalArgumentException.class, () -> target.replaceWith(x));
    assertThat(sum.getLeft()).isSameInstanceAs(target);
    assertThat(x.getParent()).isSameInstanceAs(sibling);
  }

  @Test
  public void testReplaceRejectsSlotTypeMismatch() {
    Identifier binding = IR.name("e");
    Catch handler = new Catch(binding, IR.block(), 1);
    Node number = IR.number(1);

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> binding.replaceWith(number));

    assertThat(e).hasMessageThat().contains("identifier");
    assertThat(handler.getIdentifier()).isSameInstanceAs(binding);
    assertThat(number.getParent()).isNull();
  }

  @Test
  public void testReplaceRejectsNonDeclarationInVarStatement() {
    VarDecl decl = new VarDecl(IR.name("x"), null, 1);
    VarStatement var = new VarStatement(ImmutableList.of(decl), 1);

    assertThrows(IllegalArgumentException.class, () -> decl.replaceWith(IR.name("y")));
    assertThat(var.getDeclarations()).containsExactly(decl);
  }

  @Test
  public void testReplaceRejectsOwnedReplacement() {
    Node target = IR.name("a");
    IR.exprResult(target);
    Node owned = IR.name("b");
    IR.exprResult(owned);

    assertThrows(IllegalArgumentException.class, () -> target.replaceWith(owned));
    assertThat(owned.getParent()).isNotNull();
  }

  @Test
  public void testReplaceRejectsAncestor() {
    Node stmt = IR.empty();
    Block inner = IR.block(stmt);
    Block outer = IR.block(inner);

    assertThrows(IllegalArgumentException.class, () -> stmt.replaceWith(outer));
    assertThat(inner.getStatements()).containsExactly(stmt);
  }

  @Test
  public void testReplaceRejectsSelf() {
    Node stmt = IR.empty();
    IR.block(stmt);

    assertThrows(IllegalArgumentException.class, () -> stmt.replaceWith(stmt));
  }

  @Test
  public void testReplaceOrphanFails() {
    Node stmt = IR.empty();
    Block block = IR.block(stmt);
    Node first = IR.returnNode();
    stmt.replaceWith(first);

    assertThrows(IllegalArgumentException.class, () -> stmt.replaceWith(IR.empty()));
    assertThat(block.getStatements()).containsExactly(first);
  }

  @Test
  public void testReplaceChildFromParentSide() {
    Node body = IR.block();
    While loop = IR.whileNode(IR.trueNode(), body);
    Node replacement = IR.empty();

    loop.replaceChild(body, replacement);

    assertThat(loop.getStatement()).isSameInstanceAs(replacement);
  }

  @Test
  public void testReplaceChildRejectsForeignNode() {
    While loop = IR.whileNode(IR.trueNode(), IR.block());

    assertThrows(IllegalArgumentException.class, () -> loop.replaceChild(IR.block(), IR.empty()));
  }

  @Test
  public void testReplaceFillsAbsentNeighborsUnchanged() {
    Node cond = IR.name("c");
    Node body = IR.block();
    For loop = IR.forNode(null, cond, null, body);
    Node newCond = IR.falseNode();

    cond.replaceWith(newCond);

    assertThat(loop.children()).containsExactly(null, newCond, null, body).inOrder();
  }

  @Test
  public void testReplaceFunctionParameter() {
    FuncDecl f = IR.function("f", ImmutableList.of("a", "b"));
    Identifier a = f.getParameters().get(0);
    Identifier renamed = IR.name("x");

    a.replaceWith(renamed);

    assertThat(f.getParameters()).containsExactly(renamed, f.getParameters().get(1)).inOrder();
    assertThat(renamed.getParent()).isSameInstanceAs(f);
  }

  @Test
  public void testReplaceTryClauses() {
    Catch handler = new Catch(IR.name("e"), IR.block(), 1);
    Try tryNode = new Try(IR.block(), handler, null, 1);
    Catch other = new Catch(IR.name("err"), IR.block(), 1);

    handler.replaceWith(other);

    assertThat(tryNode.getCatchClause()).isSameInstanceAs(other);
    assertThrows(
        IllegalArgumentException.class,
        () -> other.replaceWith(new Finally(IR.block(), 1)));
  }
}
