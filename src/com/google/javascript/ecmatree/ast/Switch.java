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

import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A {@code switch} statement. Clauses are kept in source order, so a {@code default} written
 * between two {@code case} clauses stays between them.
 */
public final class Switch extends Node {

  private Node expr;
  private final List<SwitchClause> clauses;

  public Switch(Node expr, List<? extends SwitchClause> clauses, int lineno) {
    super(lineno);
    int defaults = 0;
    for (SwitchClause clause : clauses) {
      if (clause instanceof Default) {
        defaults++;
      }
    }
    checkArgument(defaults <= 1, "switch with %s default clauses", defaults);
    this.expr = adopt(expr);
    this.clauses = adoptAll(clauses);
  }

  public Node getExpr() {
    return expr;
  }

  public List<SwitchClause> getClauses() {
    return Collections.unmodifiableList(clauses);
  }

  /** Returns the {@code default} clause, or null if there is none. */
  public @Nullable Default getDefault() {
    for (SwitchClause clause : clauses) {
      if (clause instanceof Default) {
        return (Default) clause;
      }
    }
    return null;
  }

  @Override
  public Kind getKind() {
    return Kind.SWITCH;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("expr", Node.class, () -> expr, n -> expr = n)
        .list("clauses", SwitchClause.class, clauses);
  }
}
