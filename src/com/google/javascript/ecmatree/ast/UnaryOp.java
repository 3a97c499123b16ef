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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A unary operator. {@code postfix} distinguishes {@code i++} from {@code ++i}; it is false for
 * every operator other than {@code ++} and {@code --}.
 */
public final class UnaryOp extends Node {

  private final String op;
  private final boolean postfix;
  private Node value;

  public UnaryOp(String op, Node value, boolean postfix, int lineno) {
    super(lineno);
    this.op = checkNotNull(op);
    this.postfix = postfix;
    this.value = adopt(value);
  }

  public String getOp() {
    return op;
  }

  public Node getValue() {
    return value;
  }

  public boolean isPostfix() {
    return postfix;
  }

  @Override
  public Kind getKind() {
    return Kind.UNARY_OP;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots.single("value", Node.class, () -> value, n -> value = n);
  }

  @Override
  String getDetail() {
    return postfix ? "postfix " + op : op;
  }
}
