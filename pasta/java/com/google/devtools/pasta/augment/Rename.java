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

package com.google.devtools.pasta.augment;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.pasta.base.NodeKind;
import com.google.devtools.pasta.base.SyntaxNode;
import com.google.devtools.pasta.base.SyntaxNodes;
import com.google.devtools.pasta.base.SyntaxTree;
import java.util.List;

/** Renames modules and the names they are read through. */
public final class Rename {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter DOT = Splitter.on('.');
  private static final Joiner DOT_JOINER = Joiner.on('.');

  private Rename() {}

  /**
   * Renames the external module or name {@code oldName} to {@code newName} in the imports of
   * {@code tree}, and in the reads of the names those imports bind.
   *
   * <p>{@code import a.b.c} renamed from {@code a.b} to {@code x.y} becomes {@code import x.y.c},
   * and {@code a.b.c.f()} becomes {@code x.y.c.f()}. {@code from a.b import c} renamed from {@code
   * a.b.c} to {@code x.y} becomes {@code from x import y}, and reads of {@code c} become reads of
   * {@code y}. A from-import with other names is split so that they keep their module.
   *
   * @return whether anything was renamed
   */
  public static boolean renameExternal(SyntaxTree tree, String oldName, String newName) {
    if (oldName.equals(newName)) {
      return false;
    }
    boolean changed = false;
    for (SyntaxNode statement : collect(tree, NodeKind.IMPORT, NodeKind.IMPORT_FROM)) {
      if (statement.getKind() == NodeKind.IMPORT) {
        for (SyntaxNode alias : statement.getChildren()) {
          String name = alias.getValue();
          if (name.equals(oldName) || name.startsWith(oldName + ".")) {
            alias.setValue(newName + name.substring(oldName.length()));
            changed = true;
            if (alias.getChildCount() == 0) {
              renameReads(tree, oldName, newName);
            }
          }
        }
      } else {
        changed |= renameInImportFrom(tree, statement, oldName, newName);
      }
    }
    logger.atFine().log("renamed %s to %s: %s", oldName, newName, changed);
    return changed;
  }

  /**
   * Replaces every read of the dotted name {@code oldName}, alone or as the start of a longer
   * attribute chain, with {@code newName}.
   *
   * @return whether anything was replaced
   */
  public static boolean renameReads(SyntaxTree tree, String oldName, String newName) {
    List<SyntaxNode> reads = ImmutableList.copyOf(collectReads(tree, oldName));
    for (SyntaxNode read : reads) {
      SyntaxNode parent = read.getParent();
      parent.replaceChild(parent.indexOf(read), SyntaxNodes.dottedName(newName));
    }
    return !reads.isEmpty();
  }

  private static boolean renameInImportFrom(
      SyntaxTree tree, SyntaxNode statement, String oldName, String newName) {
    String module = statement.getValue();
    if (module.startsWith(".")) {
      return false;
    }
    List<String> moduleParts = DOT.splitToList(module);
    List<String> oldParts = DOT.splitToList(oldName);
    List<String> newParts = DOT.splitToList(newName);

    // Only the module is changing.
    if (moduleParts.size() >= oldParts.size()
        && moduleParts.subList(0, oldParts.size()).equals(oldParts)) {
      statement.setValue(
          DOT_JOINER.join(
              ImmutableList.<String>builder()
                  .addAll(newParts)
                  .addAll(moduleParts.subList(oldParts.size(), moduleParts.size()))
                  .build()));
      return true;
    }

    if (!moduleParts.equals(oldParts.subList(0, oldParts.size() - 1))) {
      return false;
    }
    String oldLast = oldParts.get(oldParts.size() - 1);
    SyntaxNode alias = null;
    for (SyntaxNode candidate : statement.getChildren()) {
      if (candidate.getValue().equals(oldLast)) {
        alias = candidate;
        break;
      }
    }
    if (alias == null) {
      return false;
    }
    checkArgument(newParts.size() > 1, "%s cannot be imported with from-import", newName);
    String newLast = newParts.get(newParts.size() - 1);
    List<String> newModule = newParts.subList(0, newParts.size() - 1);
    alias.setValue(newLast);
    if (alias.getChildCount() == 0) {
      renameReads(tree, oldLast, newLast);
    }
    if (!moduleParts.equals(newModule)) {
      if (statement.getChildCount() > 1) {
        SyntaxNode newImport = ImportUtils.splitImport(tree, statement, alias);
        newImport.setValue(DOT_JOINER.join(newModule));
      } else {
        statement.setValue(DOT_JOINER.join(newModule));
      }
    }
    return true;
  }

  private static List<SyntaxNode> collect(SyntaxTree tree, NodeKind... kinds) {
    ImmutableList.Builder<SyntaxNode> nodes = ImmutableList.builder();
    List<NodeKind> wanted = ImmutableList.copyOf(kinds);
    for (SyntaxNode node : tree.walk()) {
      if (wanted.contains(node.getKind())) {
        nodes.add(node);
      }
    }
    return nodes.build();
  }

  /** The outermost nodes spelling {@code dottedName} that are read, not bound. */
  private static List<SyntaxNode> collectReads(SyntaxTree tree, String dottedName) {
    ImmutableList.Builder<SyntaxNode> reads = ImmutableList.builder();
    for (SyntaxNode node : tree.walk()) {
      if ((node.getKind() == NodeKind.NAME || node.getKind() == NodeKind.ATTRIBUTE)
          && dottedName.equals(SyntaxNodes.dottedNameOf(node))
          && !isBound(node)) {
        reads.add(node);
      }
    }
    return reads.build();
  }

  /** Whether {@code node} is an import alias's name or the target of a binding statement. */
  private static boolean isBound(SyntaxNode node) {
    SyntaxNode parent = node.getParent();
    if (parent == null) {
      return true;
    }
    switch (parent.getKind()) {
      case ALIAS:
      case GLOBAL:
      case NONLOCAL:
      case DELETE:
        return true;
      case ASSIGN:
        return parent.indexOf(node) < parent.getChildCount() - 1;
      case AUG_ASSIGN:
      case ANN_ASSIGN:
      case FOR:
      case COMPREHENSION:
        return parent.indexOf(node) == 0;
      default:
        return false;
    }
  }
}
