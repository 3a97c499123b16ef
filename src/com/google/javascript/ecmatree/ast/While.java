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

public final class While extends Node {

  private Node predicate;
  private Node statement;

  public While(Node predicate, Node statement, int lineno) {
    super(lineno);
    this.predicate = adopt(predicate);
    this.statement = adopt(statement);
  }

  public Node getPredicate() {
    return predicate;
  }

  public Node getStatement() {
    return statement;
  }

  @Override
  public Kind getKind() {
    return Kind.WHILE;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("predicate", Node.class, () -> predicate, n -> predicate = n)
        .single("statement", Node.class, () -> statement, n -> statement = n);
  }
}
