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

public final class Label extends Node {

  private Identifier identifier;
  private Node statement;

  public Label(Identifier identifier, Node statement, int lineno) {
    super(lineno);
    this.identifier = adopt(identifier);
    this.statement = adopt(statement);
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public Node getStatement() {
    return statement;
  }

  @Override
  public Kind getKind() {
    return Kind.LABEL;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("identifier", Identifier.class, () -> identifier, n -> identifier = n)
        .single("statement", Node.class, () -> statement, n -> statement = n);
  }
}
