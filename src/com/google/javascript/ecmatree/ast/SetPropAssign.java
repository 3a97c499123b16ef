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

/** A setter in an object literal: {@code set name(parameters) { elements }}. */
public final class SetPropAssign extends Node {

  private Node propName;
  private final List<Identifier> parameters;
  private final List<Node> elements;

  public SetPropAssign(
      Node propName,
      List<? extends Identifier> parameters,
      List<? extends Node> elements,
      int lineno) {
    super(lineno);
    this.propName = adopt(propName);
    this.parameters = adoptAll(parameters);
    this.elements = adoptAll(elements);
  }

  public Node getPropName() {
    return propName;
  }

  public List<Identifier> getParameters() {
    return Collections.unmodifiableList(parameters);
  }

  public List<Node> getElements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public Kind getKind() {
    return Kind.SET_PROP_ASSIGN;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("propName", Node.class, () -> propName, n -> propName = n)
        .list("parameters", Identifier.class, parameters)
        .list("elements", Node.class, elements);
  }
}
