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

/**
 * An object literal. Properties are {@link Assign} nodes with the {@code :} operator, {@link
 * GetPropAssign} or {@link SetPropAssign}.
 */
public final class ObjectLiteral extends Node {

  private final List<Node> properties;

  public ObjectLiteral(List<? extends Node> properties, int lineno) {
    super(lineno);
    this.properties = adoptAll(properties);
  }

  public List<Node> getProperties() {
    return Collections.unmodifiableList(properties);
  }

  @Override
  public Kind getKind() {
    return Kind.OBJECT;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots.list("properties", Node.class, properties);
  }
}
