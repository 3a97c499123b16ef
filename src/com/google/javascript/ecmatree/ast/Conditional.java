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

/** {@code predicate ? consequent : alternative} */
public final class Conditional extends Node {

  private Node predicate;
  private Node consequent;
  private Node alternative;

  public Conditional(Node predicate, Node consequent, Node alternative, int lineno) {
    super(lineno);
    this.predicate = adopt(predicate);
    this.consequent = adopt(consequent);
    this.alternative = adopt(alternative);
  }

  public Node getPredicate() {
    return predicate;
  }

  public Node getConsequent() {
    return consequent;
  }

  public Node getAlternative() {
    return alternative;
  }

  @Override
  public Kind getKind() {
    return Kind.CONDITIONAL;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("predicate", Node.class, () -> predicate, n -> predicate = n)
        .single("consequent", Node.class, () -> consequent, n -> consequent = n)
        .single("alternative", Node.class, () -> alternative, n -> alternative = n);
  }
}
