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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * The table of child slots a node declares, in source order.
 *
 * <p>A slot is either a single reference, addressed through a getter and a setter, or a list
 * owned by the node. Both {@link Node#children()} and the structural replacement in {@link
 * Node#replaceChild(Node, Node)} read this table, so iteration order and replacement addressing
 * always agree.
 */
final class ChildSlots {

  /** A pending write of one slot position that currently holds a given node. */
  interface Occurrence {
    String slotName();

    boolean accepts(Node replacement);

    void write(Node replacement);
  }

  private interface Slot {
    void appendTo(List<@Nullable Node> out);

    void findOccurrences(Node target, List<Occurrence> out);
  }

  private final List<Slot> slots = new ArrayList<>();

  ChildSlots() {}

  /** Declares a slot holding at most one node of the given type. */
  @CanIgnoreReturnValue
  <T extends Node> ChildSlots single(
      String name, Class<T> type, Supplier<@Nullable T> getter, Consumer<T> setter) {
    slots.add(new SingleSlot<>(name, type, getter, setter));
    return this;
  }

  /** Declares a slot holding an ordered list of nodes of the given type. */
  @CanIgnoreReturnValue
  <T extends Node> ChildSlots list(String name, Class<T> type, List<T> elements) {
    slots.add(new ListSlot<>(name, type, elements));
    return this;
  }

  /** Flattens the table into one positional sequence. Absent single slots contribute null. */
  List<@Nullable Node> flatten() {
    List<@Nullable Node> out = new ArrayList<>();
    for (Slot slot : slots) {
      slot.appendTo(out);
    }
    return out;
  }

  /** Returns every slot position holding {@code target}, compared by identity. */
  List<Occurrence> occurrencesOf(Node target) {
    checkNotNull(target);
    List<Occurrence> out = new ArrayList<>();
    for (Slot slot : slots) {
      slot.findOccurrences(target, out);
    }
    return out;
  }

  private static final class SingleSlot<T extends Node> implements Slot, Occurrence {
    private final String name;
    private final Class<T> type;
    private final Supplier<@Nullable T> getter;
    private final Consumer<T> setter;

    SingleSlot(String name, Class<T> type, Supplier<@Nullable T> getter, Consumer<T> setter) {
      this.name = name;
      this.type = type;
      this.getter = getter;
      this.setter = setter;
    }

    @Override
    public void appendTo(List<@Nullable Node> out) {
      out.add(getter.get());
    }

    @Override
    public void findOccurrences(Node target, List<Occurrence> out) {
      if (getter.get() == target) {
        out.add(this);
      }
    }

    @Override
    public String slotName() {
      return name;
    }

    @Override
    public boolean accepts(Node replacement) {
      return type.isInstance(replacement);
    }

    @Override
    public void write(Node replacement) {
      setter.accept(type.cast(replacement));
    }
  }

  private static final class ListSlot<T extends Node> implements Slot {
    private final String name;
    private final Class<T> type;
    private final List<T> elements;

    ListSlot(String name, Class<T> type, List<T> elements) {
      this.name = name;
      this.type = type;
      this.elements = elements;
    }

    @Override
    public void appendTo(List<@Nullable Node> out) {
      out.addAll(elements);
    }

    @Override
    public void findOccurrences(Node target, List<Occurrence> out) {
      for (int i = 0; i < elements.size(); i++) {
        if (elements.get(i) == target) {
          out.add(new Element(i));
        }
      }
    }

    private final class Element implements Occurrence {
      private final int index;

      Element(int index) {
        this.index = index;
      }

      @Override
      public String slotName() {
        return name + "[" + index + "]";
      }

      @Override
      public boolean accepts(Node replacement) {
        return type.isInstance(replacement);
      }

      @Override
      public void write(Node replacement) {
        elements.set(index, type.cast(replacement));
      }
    }
  }
}
