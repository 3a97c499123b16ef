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

/** {@code break} with an optional label. */
public final class Break extends Node {

  private @Nullable Identifier identifier;

  public Break(@Nullable Identifier identifier, int lineno) {
    super(lineno);
    this.identifier = adoptOptional(identifier);
  }

  public @Nullable Identifier getIdentifier() {
    return identifier;
  }

  @Override
  public Kind getKind() {
    return Kind.BREAK;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots.single("identifier", Identifier.class, () -> identifier, n -> identifier = n);
  }
}
