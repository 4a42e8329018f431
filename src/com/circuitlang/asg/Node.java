/*
 * Copyright 2021 The Circuit ASG Authors.
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
package com.circuitlang.asg;

import static com.google.common.base.Preconditions.checkArgument;

import com.circuitlang.ast.Span;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The common base of expressions and statements.
 *
 * <p>Nodes are built bottom-up: a node's children exist before the node does, so a child cannot
 * learn its parent while it is being converted. Once a node is allocated, {@link #enforceParents}
 * points each direct child back at it.
 */
public abstract class Node {
  private final int id;
  private final @Nullable Span span;
  private @Nullable Node parent;

  Node(AsgContext context, @Nullable Span span) {
    this.id = context.nextId();
    this.span = span;
  }

  public final int getId() {
    return id;
  }

  public final @Nullable Span getSpan() {
    return span;
  }

  /** The enclosing node, or null for a detached node or the body of a function. */
  public final @Nullable Node getParent() {
    return parent;
  }

  final void setParent(@Nullable Node parent) {
    this.parent = parent;
  }

  /** The slots holding this node's direct children, in evaluation order. */
  abstract ImmutableList<Slot<?>> getSlots();

  public final ImmutableList<Node> getChildren() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (Slot<?> slot : getSlots()) {
      children.add(slot.get());
    }
    return children.build();
  }

  /** Sets the parent of every direct child to this node. */
  public final void enforceParents() {
    for (Slot<?> slot : getSlots()) {
      slot.get().setParent(this);
    }
  }

  /** Rebinds the slot holding {@code oldChild}. The caller checks that the types agree. */
  @SuppressWarnings("unchecked")
  final void replaceChild(Node oldChild, Node newChild) {
    for (Slot<?> slot : getSlots()) {
      if (slot.get() == oldChild) {
        ((Slot<Node>) slot).set(newChild);
        newChild.setParent(this);
        oldChild.setParent(null);
        return;
      }
    }
    checkArgument(false, "%s is not a child of %s", oldChild, this);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "#" + id;
  }
}
