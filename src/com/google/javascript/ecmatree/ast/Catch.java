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

/** {@code catch (identifier) elements}. The binding is rename-eligible. */
public final class Catch extends Node {

  private Identifier identifier;
  private Block elements;

  public Catch(Identifier identifier, Block elements, int lineno) {
    super(lineno);
    this.identifier = adopt(identifier);
    this.identifier.markRenameEligible();
    this.elements = adopt(elements);
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public Block getElements() {
    return elements;
  }

  @Override
  public Kind getKind() {
    return Kind.CATCH;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("identifier", Identifier.class, () -> identifier, n -> identifier = n)
        .single("elements", Block.class, () -> elements, n -> elements = n);
  }
}
