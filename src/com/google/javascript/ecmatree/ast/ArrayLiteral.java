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

/** An array literal. Holes appear as {@link Elision} items. */
public final class ArrayLiteral extends Node {

  private final List<Node> items;

  public ArrayLiteral(List<? extends Node> items, int lineno) {
    super(lineno);
    this.items = adoptAll(items);
  }

  public List<Node> getItems() {
    return Collections.unmodifiableList(items);
  }

  @Override
  public Kind getKind() {
    return Kind.ARRAY;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots.list("items", Node.class, items);
  }
}
