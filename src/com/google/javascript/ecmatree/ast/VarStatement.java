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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collections;
import java.util.List;

/** {@code var a = 1, b;} */
public final class VarStatement extends Node {

  private final List<VarDecl> declarations;

  public VarStatement(List<? extends VarDecl> declarations, int lineno) {
    super(lineno);
    checkArgument(!declarations.isEmpty(), "var statement without declarations");
    this.declarations = adoptAll(declarations);
  }

  public List<VarDecl> getDeclarations() {
    return Collections.unmodifiableList(declarations);
  }

  @Override
  public Kind getKind() {
    return Kind.VAR_STATEMENT;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots.list("declarations", VarDecl.class, declarations);
  }
}
