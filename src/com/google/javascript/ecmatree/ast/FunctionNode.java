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
import org.jspecify.annotations.Nullable;

/**
 * Common shape of function declarations and function expressions. The name and every formal
 * parameter are marked rename-eligible when the function is built.
 */
public abstract class FunctionNode extends Node {

  private @Nullable Identifier identifier;
  private final List<Identifier> parameters;
  private final List<Node> elements;

  FunctionNode(
      @Nullable Identifier identifier,
      List<? extends Identifier> parameters,
      List<? extends Node> elements,
      int lineno) {
    super(lineno);
    this.identifier = adoptOptional(identifier);
    this.parameters = adoptAll(parameters);
    this.elements = adoptAll(elements);
    if (this.identifier != null) {
      this.identifier.markRenameEligible();
    }
    for (Identifier parameter : this.parameters) {
      parameter.markRenameEligible();
    }
  }

  public @Nullable Identifier getIdentifier() {
    return identifier;
  }

  public List<Identifier> getParameters() {
    return Collections.unmodifiableList(parameters);
  }

  /** Returns the statements of the function body. */
  public List<Node> getElements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  final void declareSlots(ChildSlots slots) {
    slots
        .single("identifier", Identifier.class, () -> identifier, n -> identifier = n)
        .list("parameters", Identifier.class, parameters)
        .list("elements", Node.class, elements);
  }
}
