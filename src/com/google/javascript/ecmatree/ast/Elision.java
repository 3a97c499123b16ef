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

/** A run of holes in an array literal, e.g. the two commas in {@code [a,,,b]}. */
public final class Elision extends Node {

  private final int count;

  public Elision(int count, int lineno) {
    super(lineno);
    checkArgument(count > 0, "Elision count must be positive: %s", count);
    this.count = count;
  }

  public int getCount() {
    return count;
  }

  @Override
  public Kind getKind() {
    return Kind.ELISION;
  }

  @Override
  void declareSlots(ChildSlots slots) {}

  @Override
  String getDetail() {
    return String.valueOf(count);
  }
}
