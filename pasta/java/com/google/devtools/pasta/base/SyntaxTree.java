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

import com.google.common.graph.Traverser;

/**
 * An annotated module together with the source buffer it was parsed from.
 *
 * <p>A tree is owned by one caller at a time; it is not safe for concurrent mutation. The source
 * buffer is immutable and may be shared.
 */
public final class SyntaxTree {
  private static final Traverser<SyntaxNode> TRAVERSER =
      Traverser.forTree(SyntaxNode::getChildren);

  private final String source;
  private final SyntaxNode root;
  private final String indentUnit;

  SyntaxTree(String source, SyntaxNode root, String indentUnit) {
    this.source = source;
    this.root = root;
    this.indentUnit = indentUnit;
  }

  /** Returns the source text the tree was parsed from. */
  public String getSource() {
    return source;
  }

  public SyntaxNode getRoot() {
    return root;
  }

  /** Returns the indentation step used for new blocks: the one most common in the source. */
  public String getIndentUnit() {
    return indentUnit;
  }

  /**
   * Returns all nodes of the tree in pre-order. The iterable is lazy and may be iterated again; it
   * reflects the tree as it is when iteration happens. Mutating the tree during an iteration is not
   * supported.
   */
  public Iterable<SyntaxNode> walk() {
    return TRAVERSER.depthFirstPreOrder(root);
  }

  /**
   * Returns the indentation of the line {@code node} starts on, as text new statements placed next
   * to it would use.
   */
  public String getIndentation(SyntaxNode node) {
    checkArgument(contains(node), "%s is not part of this tree", node);
    return Indentation.of(node, indentUnit);
  }

  /** Returns the indentation statements added to {@code suite}, a module or block, would use. */
  public String getBodyIndentation(SyntaxNode suite) {
    checkArgument(
        suite.getKind() == NodeKind.MODULE || suite.getKind() == NodeKind.BLOCK,
        "%s is not a module or block",
        suite);
    checkArgument(contains(suite), "%s is not part of this tree", suite);
    return Indentation.ofBody(suite, indentUnit);
  }

  /** Regenerates source text for the tree in its current state. */
  public String dump() throws PrintException {
    return Printer.print(this);
  }

  /** Returns whether {@code node} is the root or one of its descendants. */
  public boolean contains(SyntaxNode node) {
    SyntaxNode n = node;
    while (n.getParent() != null) {
      n = n.getParent();
    }
    return n == root;
  }
}
