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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Factories for new nodes, and helpers to read common shapes of nodes. */
public final class SyntaxNodes {
  private static final Splitter DOT = Splitter.on('.');

  private SyntaxNodes() {}

  public static SyntaxNode name(String identifier) {
    return SyntaxNode.create(NodeKind.NAME, identifier);
  }

  public static SyntaxNode number(String text) {
    return SyntaxNode.create(NodeKind.NUM, text);
  }

  /** Creates a string literal from its complete source text, quotes included. */
  public static SyntaxNode string(String literal) {
    return SyntaxNode.create(NodeKind.STR, literal);
  }

  public static SyntaxNode attribute(SyntaxNode value, String attr) {
    return SyntaxNode.create(NodeKind.ATTRIBUTE, attr, value);
  }

  /** Creates the expression {@code a.b.c} from the dotted name {@code "a.b.c"}. */
  public static SyntaxNode dottedName(String dotted) {
    List<String> parts = DOT.splitToList(dotted);
    checkArgument(!parts.contains(""), "invalid dotted name: %s", dotted);
    SyntaxNode node = name(parts.get(0));
    for (String part : parts.subList(1, parts.size())) {
      node = attribute(node, part);
    }
    return node;
  }

  /**
   * Returns the dotted name an expression made only of names and attribute accesses spells, such
   * as {@code "a.b.c"}, or null for any other expression.
   */
  public static @Nullable String dottedNameOf(SyntaxNode node) {
    switch (node.getKind()) {
      case NAME:
        return node.getValue();
      case ATTRIBUTE:
        String base = dottedNameOf(node.getChild(0));
        return base == null ? null : base + "." + node.getValue();
      default:
        return null;
    }
  }

  public static SyntaxNode call(SyntaxNode function, SyntaxNode... args) {
    return SyntaxNode.create(
        NodeKind.CALL,
        null,
        ImmutableList.<SyntaxNode>builder().add(function).add(args).build());
  }

  public static SyntaxNode keyword(String name, SyntaxNode value) {
    return SyntaxNode.create(NodeKind.KEYWORD, name, value);
  }

  public static SyntaxNode expressionStatement(SyntaxNode expression) {
    return SyntaxNode.create(NodeKind.EXPR_STMT, null, expression);
  }

  public static SyntaxNode assign(SyntaxNode target, SyntaxNode value) {
    return SyntaxNode.create(NodeKind.ASSIGN, null, target, value);
  }

  public static SyntaxNode pass() {
    return SyntaxNode.create(NodeKind.PASS, null);
  }

  public static SyntaxNode returnStatement(@Nullable SyntaxNode value) {
    return value == null
        ? SyntaxNode.create(NodeKind.RETURN, null)
        : SyntaxNode.create(NodeKind.RETURN, null, value);
  }

  /** Creates an import alias; {@code asName} is the name it is bound to, if renamed. */
  public static SyntaxNode alias(String name, @Nullable String asName) {
    return asName == null
        ? SyntaxNode.create(NodeKind.ALIAS, name)
        : SyntaxNode.create(NodeKind.ALIAS, name, name(asName));
  }

  /** Creates {@code import a, b.c}. */
  public static SyntaxNode importStatement(String... dottedNames) {
    checkArgument(dottedNames.length > 0, "nothing to import");
    List<SyntaxNode> aliases = new ArrayList<>();
    for (String dotted : dottedNames) {
      aliases.add(alias(dotted, null));
    }
    return SyntaxNode.create(NodeKind.IMPORT, null, aliases);
  }

  /** Creates {@code from module import a, b}. */
  public static SyntaxNode importFrom(String module, String... names) {
    checkArgument(names.length > 0, "nothing to import");
    List<SyntaxNode> aliases = new ArrayList<>();
    for (String name : names) {
      aliases.add(alias(name, null));
    }
    return SyntaxNode.create(NodeKind.IMPORT_FROM, module, aliases);
  }

  /** Returns the alias of an import as it is bound in the importing scope. */
  public static String boundName(SyntaxNode alias) {
    checkArgument(alias.getKind() == NodeKind.ALIAS, "%s is not an import alias", alias);
    if (alias.getChildCount() == 1) {
      return alias.getChild(0).getValue();
    }
    SyntaxNode statement = alias.getParent();
    if (statement != null && statement.getKind() == NodeKind.IMPORT) {
      return DOT.splitToList(alias.getValue()).get(0);
    }
    return alias.getValue();
  }
}
