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

import org.jspecify.annotations.Nullable;

/**
 * A classic {@code for (init; cond; count) statement} loop. Each header part may be absent; the
 * body position is always 3.
 */
public final class For extends Node {

  private @Nullable Node init;
  private @Nullable Node cond;
  private @Nullable Node count;
  private Node statement;

  public For(
      @Nullable Node init,
      @Nullable Node cond,
      @Nullable Node count,
      Node statement,
      int lineno) {
    super(lineno);
    this.init = adoptOptional(init);
    this.cond = adoptOptional(cond);
    this.count = adoptOptional(count);
    this.statement = adopt(statement);
  }

  public @Nullable Node getInit() {
    return init;
  }

  public @Nullable Node getCond() {
    return cond;
  }

  public @Nullable Node getCount() {
    return count;
  }

  public Node getStatement() {
    return statement;
  }

  @Override
  public Kind getKind() {
    return Kind.FOR;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("init", Node.class, () -> init, n -> init = n)
        .single("cond", Node.class, () -> cond, n -> cond = n)
        .single("count", Node.class, () -> count, n -> count = n)
        .single("statement", Node.class, () -> statement, n -> statement = n);
  }
}
