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

import org.jspecify.annotations.Nullable;

/** One declarator of a {@link VarStatement}. The target identifier is rename-eligible. */
public final class VarDecl extends Node {

  private Identifier identifier;
  private @Nullable Node initializer;

  public VarDecl(Identifier identifier, @Nullable Node initializer, int lineno) {
    super(lineno);
    this.identifier = adopt(identifier);
    this.identifier.markRenameEligible();
    this.initializer = adoptOptional(initializer);
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public @Nullable Node getInitializer() {
    return initializer;
  }

  @Override
  public Kind getKind() {
    return Kind.VAR_DECL;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("identifier", Identifier.class, () -> identifier, n -> identifier = n)
        .single("initializer", Node.class, () -> initializer, n -> initializer = n);
  }
}
