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

/** {@code do statement while (predicate)}. Children follow source order, body first. */
public final class DoWhile extends Node {

  private Node statement;
  private Node predicate;

  public DoWhile(Node statement, Node predicate, int lineno) {
    super(lineno);
    this.statement = adopt(statement);
    this.predicate = adopt(predicate);
  }

  public Node getStatement() {
    return statement;
  }

  public Node getPredicate() {
    return predicate;
  }

  @Override
  public Kind getKind() {
    return Kind.DO_WHILE;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("statement", Node.class, () -> statement, n -> statement = n)
        .single("predicate", Node.class, () -> predicate, n -> predicate = n);
  }
}
