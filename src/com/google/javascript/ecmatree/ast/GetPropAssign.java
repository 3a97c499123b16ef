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

/** A getter in an object literal: {@code get name() { elements }}. */
public final class GetPropAssign extends Node {

  private Node propName;
  private final List<Node> elements;

  public GetPropAssign(Node propName, List<? extends Node> elements, int lineno) {
    super(lineno);
    this.propName = adopt(propName);
    this.elements = adoptAll(elements);
  }

  public Node getPropName() {
    return propName;
  }

  public List<Node> getElements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public Kind getKind() {
    return Kind.GET_PROP_ASSIGN;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("propName", Node.class, () -> propName, n -> propName = n)
        .list("elements", Node.class, elements);
  }
}
