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

public final class Return extends Node {

  private @Nullable Node expr;

  public Return(@Nullable Node expr, int lineno) {
    super(lineno);
    this.expr = adoptOptional(expr);
  }

  public @Nullable Node getExpr() {
    return expr;
  }

  @Override
  public Kind getKind() {
    return Kind.RETURN;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots.single("expr", Node.class, () -> expr, n -> expr = n);
  }
}
