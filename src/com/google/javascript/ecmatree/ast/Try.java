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

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/** A {@code try} statement. At least one of the catch and finally clauses is present. */
public final class Try extends Node {

  private Block statements;
  private @Nullable Catch catchClause;
  private @Nullable Finally finallyClause;

  public Try(
      Block statements,
      @Nullable Catch catchClause,
      @Nullable Finally finallyClause,
      int lineno) {
    super(lineno);
    checkArgument(
        catchClause != null || finallyClause != null, "try without catch or finally");
    this.statements = adopt(statements);
    this.catchClause = adoptOptional(catchClause);
    this.finallyClause = adoptOptional(finallyClause);
  }

  public Block getStatements() {
    return statements;
  }

  public @Nullable Catch getCatchClause() {
    return catchClause;
  }

  public @Nullable Finally getFinallyClause() {
    return finallyClause;
  }

  @Override
  public Kind getKind() {
    return Kind.TRY;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("statements", Block.class, () -> statements, n -> statements = n)
        .single("catchClause", Catch.class, () -> catchClause, n -> catchClause = n)
        .single("finallyClause", Finally.class, () -> finallyClause, n -> finallyClause = n);
  }
}
