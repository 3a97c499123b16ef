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

/** Tests for {@link IR}. */
@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testNumberSpelling() {
    assertThat(IR.number(3).getValue()).isEqualTo("3");
    assertThat(IR.number(0.5).getValue()).isEqualTo("0.5");
    assertThat(IR.number(-7).getValue()).isEqualTo("-7");
    assertThat(IR.number(1e300).getValue()).isEqualTo("1.0E300");
    assertThat(IR.number(-0.0).getValue()).isEqualTo("-0.0");
  }

  @Test
  public void testStringIsQuoted() {
    assertThat(IR.string("abc").getValue()).isEqualTo("\"abc\"");
  }

  @Test
  public void testNoLineNumbers() {
    assertThat(IR.program(IR.empty()).getLineno()).isEqualTo(Node.UNKNOWN_LINENO);
  }

  @Test
  public void testIfRejectsExpressionBranch() {
    assertThrows(IllegalStateException.class, () -> IR.ifNode(IR.name("a"), IR.name("b")));
  }

  @Test
  public void testBlockRejectsExpression() {
    assertThrows(IllegalStateException.class, () -> IR.block(IR.number(1)));
  }

  @Test
  public void testVar() {
    VarStatement var = IR.var(IR.name("x"), IR.number(1));

    VarDecl decl = var.getDeclarations().get(0);
    assertThat(decl.getIdentifier().getValue()).isEqualTo("x");
    assertThat(decl.getParent()).isSameInstanceAs(var);
  }

  @Test
  public void testFunction() {
    FuncDecl f = IR.function("f", ImmutableList.of("a"), IR.returnNode(IR.name("a")));

    assertThat(f.getIdentifier().getValue()).isEqualTo("f");
    assertThat(f.getParameters()).hasSize(1);
    assertThat(f.getElements()).hasSize(1);
  }
}
