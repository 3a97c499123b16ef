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

/**
 * A name. Identifiers that bind a name (function names, formal parameters, variable declaration
 * targets and catch bindings) are marked rename-eligible by the node that declares them. The
 * mark has no meaning inside the tree; renaming passes read it.
 */
public final class Identifier extends ValueNode {

  private boolean renameEligible;

  public Identifier(String value, int lineno) {
    super(value, lineno);
  }

  @Override
  public Kind getKind() {
    return Kind.IDENTIFIER;
  }

  public boolean isRenameEligible() {
    return renameEligible;
  }

  /** Called by binding constructs when they claim this identifier. The mark is never cleared. */
  void markRenameEligible() {
    this.renameEligible = true;
  }
}
