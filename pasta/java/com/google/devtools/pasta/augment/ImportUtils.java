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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.pasta.base.NodeKind;
import com.google.devtools.pasta.base.SyntaxNode;
import com.google.devtools.pasta.base.SyntaxNodes;
import com.google.devtools.pasta.base.SyntaxTree;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Operations on {@code import} and {@code from ... import} statements. */
public final class ImportUtils {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter DOT = Splitter.on('.');

  private ImportUtils() {}

  /**
   * Moves {@code alias} out of {@code importNode} into a new import statement of the same kind,
   * placed right after it.
   *
   * @return the new import statement
   * @throws InvalidAstException if the import is not a statement of a module or block of {@code
   *     tree}, or {@code alias} is not one of its aliases
   */
  public static SyntaxNode splitImport(SyntaxTree tree, SyntaxNode importNode, SyntaxNode alias) {
    SyntaxNode suite = suiteOf(tree, importNode);
    int aliasIndex = importNode.indexOf(alias);
    if (aliasIndex < 0) {
      throw new InvalidAstException(alias + " is not an alias of " + importNode);
    }
    importNode.removeChild(aliasIndex);
    SyntaxNode newImport =
        SyntaxNode.create(importNode.getKind(), importNode.getValue(), ImmutableList.of(alias));
    suite.insertChild(suite.indexOf(importNode) + 1, newImport);
    return newImport;
  }

  /**
   * Removes {@code alias} from its import statement, and the whole statement if it was the only
   * alias. A block left without statements gets a {@code pass}.
   */
  public static void removeImportAlias(SyntaxTree tree, SyntaxNode alias) {
    SyntaxNode importNode = alias.getParent();
    if (alias.getKind() != NodeKind.ALIAS || importNode == null) {
      throw new InvalidAstException(alias + " is not an import alias");
    }
    if (importNode.getChildCount() > 1) {
      importNode.removeChild(importNode.indexOf(alias));
      return;
    }
    SyntaxNode suite = suiteOf(tree, importNode);
    suite.removeChild(suite.indexOf(importNode));
    if (suite.getKind() == NodeKind.BLOCK && suite.getChildCount() == 0) {
      suite.addChild(SyntaxNodes.pass());
    }
  }

  /**
   * Returns the aliases whose bound name is never used outside import statements. Star imports and
   * {@code __future__} imports are never reported.
   */
  public static ImmutableList<SyntaxNode> getUnusedImportAliases(SyntaxTree tree) {
    Set<String> used = new HashSet<>();
    List<SyntaxNode> aliases = new ArrayList<>();
    for (SyntaxNode node : tree.walk()) {
      if (node.getKind() == NodeKind.ALIAS) {
        SyntaxNode statement = node.getParent();
        if (!node.getValue().equals("*")
            && !(statement.getKind() == NodeKind.IMPORT_FROM
                && "__future__".equals(statement.getValue()))) {
          aliases.add(node);
        }
      } else if (node.getKind() == NodeKind.NAME && !isImportPart(node)) {
        used.add(node.getValue());
      }
    }
    ImmutableList.Builder<SyntaxNode> unused = ImmutableList.builder();
    for (SyntaxNode alias : aliases) {
      if (!used.contains(SyntaxNodes.boundName(alias))) {
        unused.add(alias);
      }
    }
    return unused.build();
  }

  /**
   * Makes {@code dottedName} available to the module and returns the name it can be referred to by.
   *
   * <p>An existing import that already provides the name is reused. Otherwise a new import is added
   * at the top of the module, after its docstring and {@code __future__} imports. With {@code
   * fromImport}, {@code a.b.c} is imported as {@code from a.b import c}, merged into an existing
   * import from {@code a.b} if there is one, and renamed if {@code c} is already bound in the
   * module.
   */
  public static String addImport(SyntaxTree tree, String dottedName, boolean fromImport) {
    List<String> parts = DOT.splitToList(dottedName);
    String existing = findExistingImport(tree, dottedName, parts);
    if (existing != null) {
      return existing;
    }
    SyntaxNode module = tree.getRoot();
    if (!fromImport || parts.size() == 1) {
      module.insertChild(insertionIndex(module), SyntaxNodes.importStatement(dottedName));
      return dottedName;
    }

    String packageName = Joiner.on('.').join(parts.subList(0, parts.size() - 1));
    String name = parts.get(parts.size() - 1);
    String boundName = freeName(moduleBindings(module), name);
    SyntaxNode alias = SyntaxNodes.alias(name, boundName.equals(name) ? null : boundName);
    for (SyntaxNode statement : module.getChildren()) {
      if (statement.getKind() == NodeKind.IMPORT_FROM
          && packageName.equals(statement.getValue())
          && !statement.getChild(0).getValue().equals("*")) {
        logger.atFine().log("merging %s into %s", dottedName, statement);
        statement.addChild(alias);
        return boundName;
      }
    }
    SyntaxNode statement =
        SyntaxNode.create(NodeKind.IMPORT_FROM, packageName, ImmutableList.of(alias));
    module.insertChild(insertionIndex(module), statement);
    return boundName;
  }

  private static @Nullable String findExistingImport(
      SyntaxTree tree, String dottedName, List<String> parts) {
    for (SyntaxNode node : tree.walk()) {
      if (node.getKind() != NodeKind.ALIAS) {
        continue;
      }
      SyntaxNode statement = node.getParent();
      String name = node.getValue();
      if (statement.getKind() == NodeKind.IMPORT) {
        if (name.equals(dottedName)) {
          return node.getChildCount() == 1 ? node.getChild(0).getValue() : dottedName;
        }
        if (name.startsWith(dottedName + ".") && node.getChildCount() == 0) {
          return dottedName;
        }
      } else if (parts.size() > 1
          && name.equals(parts.get(parts.size() - 1))
          && dottedName.equals(statement.getValue() + "." + name)) {
        return SyntaxNodes.boundName(node);
      }
    }
    return null;
  }

  /** The names bound by top-level definitions, assignments and imports of {@code module}. */
  private static ImmutableSet<String> moduleBindings(SyntaxNode module) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (SyntaxNode statement : module.getChildren()) {
      switch (statement.getKind()) {
        case FUNCTION_DEF:
        case CLASS_DEF:
          names.add(statement.getValue());
          break;
        case ASSIGN:
          List<SyntaxNode> targets = statement.getChildren();
          for (SyntaxNode target : targets.subList(0, targets.size() - 1)) {
            if (target.getKind() == NodeKind.NAME) {
              names.add(target.getValue());
            }
          }
          break;
        case IMPORT:
        case IMPORT_FROM:
          for (SyntaxNode alias : statement.getChildren()) {
            names.add(SyntaxNodes.boundName(alias));
          }
          break;
        default:
          break;
      }
    }
    return names.build();
  }

  private static String freeName(Set<String> taken, String name) {
    String candidate = name;
    for (int i = 1; taken.contains(candidate); i++) {
      candidate = name + "_" + i;
    }
    return candidate;
  }

  /** The index after the module docstring and any {@code __future__} imports. */
  private static int insertionIndex(SyntaxNode module) {
    int index = 0;
    if (module.getChildCount() > 0 && isDocstring(module.getChild(0))) {
      index++;
    }
    while (index < module.getChildCount()
        && module.getChild(index).getKind() == NodeKind.IMPORT_FROM
        && "__future__".equals(module.getChild(index).getValue())) {
      index++;
    }
    return index;
  }

  private static boolean isDocstring(SyntaxNode statement) {
    return statement.getKind() == NodeKind.EXPR_STMT
        && statement.getChild(0).getKind() == NodeKind.STR;
  }

  private static boolean isImportPart(SyntaxNode node) {
    SyntaxNode parent = node.getParent();
    return parent != null && parent.getKind() == NodeKind.ALIAS;
  }

  /** Returns the module or block {@code statement} is directly in. */
  static SyntaxNode suiteOf(SyntaxTree tree, SyntaxNode statement) {
    SyntaxNode suite = statement.getParent();
    if (suite == null
        || !tree.contains(suite)
        || (suite.getKind() != NodeKind.MODULE && suite.getKind() != NodeKind.BLOCK)) {
      throw new InvalidAstException(
          "unable to find the module or block containing " + statement + " in the tree");
    }
    return suite;
  }
}
