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

/** An {@code if} statement. The alternative is absent when there is no {@code else}. */
public final class If extends Node {

  private Node predicate;
  private Node consequent;
  private @Nullable Node alternative;

  public If(Node predicate, Node consequent, @Nullable Node alternative, int lineno) {
    super(lineno);
    this.predicate = adopt(predicate);
    this.consequent = adopt(consequent);
    this.alternative = adoptOptional(alternative);
  }

  public Node getPredicate() {
    return predicate;
  }

  public Node getConsequent() {
    return consequent;
  }

  public @Nullable Node getAlternative() {
    return alternative;
  }

  @Override
  public Kind getKind() {
    return Kind.IF;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("predicate", Node.class, () -> predicate, n -> predicate = n)
        .single("consequent", Node.class, () -> consequent, n -> consequent = n)
        .single("alternative", Node.class, () -> alternative, n -> alternative = n);
  }
}
