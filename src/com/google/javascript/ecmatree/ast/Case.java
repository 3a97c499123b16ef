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

import java.util.Collections;
import java.util.List;

/** {@code case expr: elements} */
public final class Case extends SwitchClause {

  private Node expr;
  private final List<Node> elements;

  public Case(Node expr, List<? extends Node> elements, int lineno) {
    super(lineno);
    this.expr = adopt(expr);
    this.elements = adoptAll(elements);
  }

  public Node getExpr() {
    return expr;
  }

  @Override
  public List<Node> getElements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public Kind getKind() {
    return Kind.CASE;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("expr", Node.class, () -> expr, n -> expr = n)
        .list("elements", Node.class, elements);
  }
}
