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

/** Resolves the indentation new text should use at a given place in a tree. */
final class Indentation {
  private Indentation() {}

  /**
   * Returns the indentation of the line a node starts on. Clauses such as {@code else} line up with
   * the statement owning them; anything inside a statement reports the statement's indentation.
   */
  static String of(SyntaxNode node, String unit) {
    SyntaxNode n = node;
    while (true) {
      if (n.getKind() == NodeKind.MODULE) {
        return "";
      }
      SyntaxNode parent = n.getParent();
      if (parent == null || parent.getKind() == NodeKind.MODULE) {
        return "";
      }
      if (parent.getKind() == NodeKind.BLOCK && n.getKind().isStatement()) {
        return ofBody(parent, unit);
      }
      n = parent;
    }
  }

  /**
   * Returns the indentation of the statements of {@code suite}: as recorded, or one unit deeper
   * than the line introducing it.
   */
  static String ofBody(SyntaxNode suite, String unit) {
    if (suite.getKind() == NodeKind.MODULE) {
      return "";
    }
    String recorded = suite.getFormatting().getIndentation();
    return recorded != null ? recorded : of(suite, unit) + unit;
  }
}
