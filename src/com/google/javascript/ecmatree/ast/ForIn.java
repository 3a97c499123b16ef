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

/**
 * {@code for (item in iterable) statement}. The item is a {@link VarStatement} or a left-hand side
 * expression.
 */
public final class ForIn extends Node {

  private Node item;
  private Node iterable;
  private Node statement;

  public ForIn(Node item, Node iterable, Node statement, int lineno) {
    super(lineno);
    this.item = adopt(item);
    this.iterable = adopt(iterable);
    this.statement = adopt(statement);
  }

  public Node getItem() {
    return item;
  }

  public Node getIterable() {
    return iterable;
  }

  public Node getStatement() {
    return statement;
  }

  @Override
  public Kind getKind() {
    return Kind.FOR_IN;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("item", Node.class, () -> item, n -> item = n)
        .single("iterable", Node.class, () -> iterable, n -> iterable = n)
        .single("statement", Node.class, () -> statement, n -> statement = n);
  }
}
