/*
 * Copyright 2026 The Pasta Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.pasta.base;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;

import com.google.common.base.Joiner;
import com.google.common.collect.Sets;
import com.google.devtools.pasta.util.Span;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of a Python syntax tree.
 *
 * <p>A node has a kind, an optional scalar value (an identifier, a literal's text, an operator) and
 * an ordered list of children. Each child knows its parent; the parent link is only used for
 * lookups such as dirtiness propagation and indentation queries, never for ownership.
 *
 * <p>Children are changed only through the mutation methods on this class, which keep parent links
 * consistent and mark the node and all its ancestors dirty. A dirty node is reprinted from its
 * structure; a clean node is copied verbatim from the source it was parsed from.
 */
public final class SyntaxNode {
  private final NodeKind kind;
  private @Nullable String value;
  private final List<SyntaxNode> children = new ArrayList<>();
  private @Nullable SyntaxNode parent;
  private final @Nullable Span position;
  private final Formatting formatting = new Formatting();
  private boolean modified;

  private SyntaxNode(
      NodeKind kind, @Nullable String value, @Nullable Span position, List<SyntaxNode> children) {
    this.kind = kind;
    this.value = value;
    this.position = position;
    checkDistinct(children);
    for (SyntaxNode child : children) {
      attach(child);
      this.children.add(child);
    }
  }

  /** Creates a new, unattached node without formatting. It will be printed with defaults. */
  public static SyntaxNode create(
      NodeKind kind, @Nullable String value, List<SyntaxNode> children) {
    return new SyntaxNode(kind, value, null, children);
  }

  /** Creates a new, unattached node without formatting. It will be printed with defaults. */
  public static SyntaxNode create(NodeKind kind, @Nullable String value, SyntaxNode... children) {
    return create(kind, value, Arrays.asList(children));
  }

  /**
   * Creates a node as reported by a parser. {@code position} covers the node's own tokens, from
   * its first to its last, excluding any parentheses wrapped around it.
   */
  public static SyntaxNode parsed(
      NodeKind kind, @Nullable String value, @Nullable Span position, List<SyntaxNode> children) {
    return new SyntaxNode(kind, value, position, children);
  }

  public NodeKind getKind() {
    return kind;
  }

  public @Nullable String getValue() {
    return value;
  }

  /** Returns an unmodifiable view of this node's children. */
  public List<SyntaxNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public SyntaxNode getChild(int index) {
    return children.get(index);
  }

  public int getChildCount() {
    return children.size();
  }

  /** Returns the index of {@code child} among this node's children, or -1. */
  public int indexOf(SyntaxNode child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }

  public @Nullable SyntaxNode getParent() {
    return parent;
  }

  /** Returns the position the parser reported for this node, or null for a created node. */
  public @Nullable Span getPosition() {
    return position;
  }

  public Formatting getFormatting() {
    return formatting;
  }

  /**
   * Whether this node must be reprinted from its structure: it was never annotated, or it or one of
   * its descendants was mutated after annotation.
   */
  public boolean isDirty() {
    return modified || !formatting.isAnnotated();
  }

  /**
   * Replaces the child at {@code index}. The replacement takes over the replaced child's prefix and
   * suffix if it has no formatting of its own. The replaced child is detached and returned.
   */
  public SyntaxNode replaceChild(int index, SyntaxNode node) {
    checkElementIndex(index, children.size());
    SyntaxNode old = children.get(index);
    if (old == node) {
      return old;
    }
    attach(node);
    node.formatting.inheritFraming(old.formatting);
    old.parent = null;
    children.set(index, node);
    markDirty();
    return old;
  }

  /** Inserts {@code node} so that it becomes the child at {@code index}. */
  public void insertChild(int index, SyntaxNode node) {
    checkPositionIndex(index, children.size());
    attach(node);
    children.add(index, node);
    markDirty();
  }

  /** Appends {@code node} as the last child. */
  public void addChild(SyntaxNode node) {
    insertChild(children.size(), node);
  }

  /** Detaches and returns the child at {@code index}. */
  public SyntaxNode removeChild(int index) {
    checkElementIndex(index, children.size());
    SyntaxNode old = children.remove(index);
    old.parent = null;
    markDirty();
    return old;
  }

  /**
   * Replaces all children. The new list may reorder current children; any current child not in it
   * is detached.
   */
  public void setChildren(List<SyntaxNode> newChildren) {
    checkDistinct(newChildren);
    for (SyntaxNode child : newChildren) {
      checkArgument(
          child.parent == null || child.parent == this,
          "%s is already a child of %s",
          child,
          child.parent);
      checkNotAncestor(child);
    }
    for (SyntaxNode child : children) {
      child.parent = null;
    }
    children.clear();
    for (SyntaxNode child : newChildren) {
      child.parent = this;
      children.add(child);
    }
    markDirty();
  }

  /** Changes the scalar value, such as an identifier, of this node. */
  public void setValue(@Nullable String value) {
    this.value = value;
    markDirty();
  }

  private void attach(SyntaxNode child) {
    checkArgument(child.parent == null, "%s is already a child of %s", child, child.parent);
    checkNotAncestor(child);
    child.parent = this;
  }

  private void checkNotAncestor(SyntaxNode child) {
    for (SyntaxNode n = this; n != null; n = n.parent) {
      checkArgument(n != child, "%s cannot become its own descendant", child);
    }
  }

  private static void checkDistinct(List<SyntaxNode> nodes) {
    Set<SyntaxNode> seen = Sets.newIdentityHashSet();
    for (SyntaxNode node : nodes) {
      checkArgument(seen.add(node), "%s appears more than once", node);
    }
  }

  private void markDirty() {
    for (SyntaxNode n = this; n != null; n = n.parent) {
      n.modified = true;
    }
  }

  @Override
  public String toString() {
    return value == null ? kind.toString() : Joiner.on(':').join(kind, value);
  }
}
