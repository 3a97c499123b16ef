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

/** A leaf carrying the raw source text it was parsed from. */
public abstract class ValueNode extends Node {

  private final String value;

  ValueNode(String value, int lineno) {
    super(lineno);
    this.value = checkNotNull(value);
  }

  /** Returns the literal text exactly as written in the source. */
  public final String getValue() {
    return value;
  }

  @Override
  final void declareSlots(ChildSlots slots) {}

  @Override
  final String getDetail() {
    return value;
  }
}
