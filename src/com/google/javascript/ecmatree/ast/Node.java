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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the syntax tree.
 *
 * <p>Every concrete node declares its child slots through {@link #declareSlots(ChildSlots)}.
 * Children are claimed at construction: each supplied child gets this node as its parent. The
 * parent link is a plain back reference and never implies ownership.
 */
public abstract class Node {

  public static final int UNKNOWN_LINENO = -1;

  private final int lineno;
  private @Nullable Node parent;

  protected Node(int lineno) {
    this.lineno = lineno;
  }

  public abstract Kind getKind();

  /** Declares this node's child slots in source order. Leaves declare nothing. */
  abstract void declareSlots(ChildSlots slots);

  /** Kind-specific text shown by {@link #toString()}, such as a literal value or an operator. */
  @Nullable String getDetail() {
    return null;
  }

  public final int getLineno() {
    return lineno;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /**
   * Returns the children in source order. Absent optional children are null and keep their
   * position, so index 0 of an {@code If} is always its predicate. The returned list is a
   * snapshot and is not affected by later replacements.
   */
  public final List<@Nullable Node> children() {
    return Collections.unmodifiableList(slots().flatten());
  }

  /** Returns the children that are present, in source order. */
  public final Iterable<Node> presentChildren() {
    List<Node> present = new ArrayList<>();
    for (Node child : slots().flatten()) {
      if (child != null) {
        present.add(child);
      }
    }
    return Collections.unmodifiableList(present);
  }

  public final boolean hasChildren() {
    return !Iterables.isEmpty(presentChildren());
  }

  /**
   * Swaps {@code replacement} into every slot of this node's parent that holds this node.
   *
   * <p>This node keeps its own children and its parent link; it simply stops being reachable
   * from the parent. The descendants of {@code replacement} are left as they are.
   *
   * @throws IllegalStateException if this node has no parent
   * @throws IllegalArgumentException if {@code replacement} cannot be placed in one of the slots
   */
  public final void replaceWith(Node replacement) {
    checkState(parent != null, "Has no parent: %s", this);
    parent.replaceChild(this, replacement);
  }

  /**
   * Replaces every occurrence of {@code child} among this node's slots with {@code replacement}.
   * All preconditions are checked before the first slot is written.
   */
  public final void replaceChild(Node child, Node replacement) {
    checkNotNull(child);
    checkNotNull(replacement);
    checkArgument(child.parent == this, "Not a child of %s: %s", this, child);
    checkArgument(replacement != child, "Cannot replace a node with itself: %s", child);
    checkArgument(
        replacement.parent == null || replacement.isDescendantOf(child),
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        replacement,
        replacement.parent,
        this);
    for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
      checkArgument(ancestor != replacement, "Replacement is an ancestor of %s", this);
    }

    List<ChildSlots.Occurrence> occurrences = slots().occurrencesOf(child);
    checkArgument(!occurrences.isEmpty(), "No longer held by %s: %s", this, child);
    for (ChildSlots.Occurrence occurrence : occurrences) {
      checkArgument(
          occurrence.accepts(replacement),
          "Slot %s of %s cannot hold %s",
          occurrence.slotName(),
          getKind(),
          replacement.getKind());
    }

    for (ChildSlots.Occurrence occurrence : occurrences) {
      occurrence.write(replacement);
    }
    replacement.parent = this;
  }

  /** Whether {@code ancestor} is reached by following parent links up from this node. */
  private boolean isDescendantOf(Node ancestor) {
    for (Node n = parent; n != null; n = n.parent) {
      if (n == ancestor) {
        return true;
      }
    }
    return false;
  }

  private ChildSlots slots() {
    ChildSlots slots = new ChildSlots();
    declareSlots(slots);
    return slots;
  }

  /** Claims a required child. */
  @CanIgnoreReturnValue
  final <T extends Node> T adopt(T child) {
    checkNotNull(child, "Missing required child of %s", getKind());
    Node node = child;
    checkArgument(
        node.parent == null || node.parent == this,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        node,
        node.parent,
        getKind());
    node.parent = this;
    return child;
  }

  /** Claims an optional child. */
  final <T extends Node> @Nullable T adoptOptional(@Nullable T child) {
    return child == null ? null : adopt(child);
  }

  /** Claims every element of a list slot and returns the list this node owns. */
  final <T extends Node> List<T> adoptAll(List<? extends T> children) {
    List<T> owned = new ArrayList<>(children.size());
    for (T child : children) {
      owned.add(adopt(child));
    }
    return owned;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getKind().toString());
    String detail = getDetail();
    if (detail != null) {
      sb.append(' ').append(detail);
    }
    if (lineno != UNKNOWN_LINENO) {
      sb.append(" [line ").append(lineno).append(']');
    }
    return sb.toString();
  }

  /** Prints this subtree, one node per line. Absent children print as {@code <absent>}. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    sb.append("    ".repeat(level)).append(this).append('\n');
    for (Node child : slots().flatten()) {
      if (child == null) {
        sb.append("    ".repeat(level + 1)).append("<absent>\n");
      } else {
        child.appendStringTree(sb, level + 1);
      }
    }
  }
}
