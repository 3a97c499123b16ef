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
 * An assignment such as {@code a += b}. Object literal properties reuse this node with the
 * {@code :} operator.
 */
public final class Assign extends Node {

  private final String op;
  private Node left;
  private Node right;

  public Assign(String op, Node left, Node right, int lineno) {
    super(lineno);
    this.op = checkNotNull(op);
    this.left = adopt(left);
    this.right = adopt(right);
  }

  public String getOp() {
    return op;
  }

  public Node getLeft() {
    return left;
  }

  public Node getRight() {
    return right;
  }

  @Override
  public Kind getKind() {
    return Kind.ASSIGN;
  }

  @Override
  void declareSlots(ChildSlots slots) {
    slots
        .single("left", Node.class, () -> left, n -> left = n)
        .single("right", Node.class, () -> right, n -> right = n);
  }

  @Override
  String getDetail() {
    return op;
  }
}
