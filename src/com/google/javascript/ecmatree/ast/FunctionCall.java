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

/** A call. The callee is any expression, not only a name. */
public final class FunctionCall extends Node {

  private Node identifier;
  private final List<Node> args;

  public FunctionCall(Node identifier, List<? extends Node> args, int lineno) {
    super(lineno);
    this.identifier = adopt(identifier);
    this.args = adoptAll(args);
  }

  public Node getIdentifier() {
    return identifier;
  }

  public List<Node> getArgs() {
    return Collections.unmodifiableList(args);
  }

  @Override
  public Kind getKind() {
    return Kind.FUNCTION_CALL;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("identifier", Node.class, () -> identifier, n -> identifier = n)
        .list("args", Node.class, args);
  }
}
