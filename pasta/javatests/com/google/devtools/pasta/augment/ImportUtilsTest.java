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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.devtools.pasta.Pasta;
import com.google.devtools.pasta.base.NodeKind;
import com.google.devtools.pasta.base.SyntaxNode;
import com.google.devtools.pasta.base.SyntaxNodes;
import com.google.devtools.pasta.base.SyntaxTree;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ImportUtilsTest {
  private static SyntaxTree parse(String source) throws Exception {
    return Pasta.create().parse(source);
  }

  @Test
  public void testSplitImport() throws Exception {
    SyntaxTree tree = parse("import aaa, bbb, ccc\n");
    SyntaxNode importNode = tree.getRoot().getChild(0);
    SyntaxNode newImport = ImportUtils.splitImport(tree, importNode, importNode.getChild(1));
    assertThat(newImport.getKind()).isEqualTo(NodeKind.IMPORT);
    assertThat(tree.dump()).isEqualTo("import aaa, ccc\nimport bbb\n");
  }

  @Test
  public void testSplitFromImport() throws Exception {
    SyntaxTree tree = parse("def f():\n  from a import (b, c)\n");
    SyntaxNode importNode = tree.getRoot().getChild(0).getChild(1).getChild(0);
    ImportUtils.splitImport(tree, importNode, importNode.getChild(0));
    assertThat(tree.dump()).isEqualTo("def f():\n  from a import ( c)\n  from a import b\n");
  }

  @Test
  public void testSplitImportRejectsForeignNodes() throws Exception {
    SyntaxTree tree = parse("import aaa, bbb\n");
    SyntaxNode importNode = tree.getRoot().getChild(0);
    assertThrows(
        InvalidAstException.class,
        () -> ImportUtils.splitImport(tree, importNode, SyntaxNodes.alias("zzz", null)));
    SyntaxNode detached = SyntaxNodes.importStatement("x", "y");
    assertThrows(
        InvalidAstException.class,
        () -> ImportUtils.splitImport(tree, detached, detached.getChild(0)));
  }

  @Test
  public void testRemoveImportAlias() throws Exception {
    SyntaxTree tree = parse("import a, b\nimport c\n");
    ImportUtils.removeImportAlias(tree, tree.getRoot().getChild(0).getChild(1));
    assertThat(tree.dump()).isEqualTo("import a\nimport c\n");
    ImportUtils.removeImportAlias(tree, tree.getRoot().getChild(1).getChild(0));
    assertThat(tree.dump()).isEqualTo("import a\n");
  }

  @Test
  public void testRemoveLastImportOfBlockLeavesPass() throws Exception {
    SyntaxTree tree = parse("if x:\n  import a\n");
    SyntaxNode alias = tree.getRoot().getChild(0).getChild(1).getChild(0).getChild(0);
    ImportUtils.removeImportAlias(tree, alias);
    assertThat(tree.dump()).isEqualTo("if x:\n  pass\n");
  }

  @Test
  public void testRemoveImportAliasRejectsOtherNodes() throws Exception {
    SyntaxTree tree = parse("x = 1\n");
    assertThrows(
        InvalidAstException.class,
        () -> ImportUtils.removeImportAlias(tree, tree.getRoot().getChild(0).getChild(0)));
  }

  @Test
  public void testGetUnusedImportAliases() throws Exception {
    SyntaxTree tree =
        parse(
            "from __future__ import print_function\n"
                + "import os, sys\n"
                + "import a.b\n"
                + "from c import d as e, f\n"
                + "from g import *\n"
                + "sys.exit(e)\n");
    List<String> unused = new ArrayList<>();
    for (SyntaxNode alias : ImportUtils.getUnusedImportAliases(tree)) {
      unused.add(alias.getValue());
    }
    assertThat(unused).containsExactly("os", "a.b", "f").inOrder();
  }

  @Test
  public void testAddImport() throws Exception {
    SyntaxTree tree = parse("");
    assertThat(ImportUtils.addImport(tree, "a.b.c", false)).isEqualTo("a.b.c");
    assertThat(tree.dump()).isEqualTo("import a.b.c\n");
  }

  @Test
  public void testAddFromImport() throws Exception {
    SyntaxTree tree = parse("");
    assertThat(ImportUtils.addImport(tree, "a.b.c", true)).isEqualTo("c");
    assertThat(tree.dump()).isEqualTo("from a.b import c\n");
  }

  @Test
  public void testAddImportReusesExistingImports() throws Exception {
    assertThat(ImportUtils.addImport(parse("import a.b.c\n"), "a.b.c", false)).isEqualTo("a.b.c");
    assertThat(ImportUtils.addImport(parse("import a.b.c as x\n"), "a.b.c", true)).isEqualTo("x");
    assertThat(ImportUtils.addImport(parse("import a.b.c.d\n"), "a.b.c", false))
        .isEqualTo("a.b.c");
    SyntaxTree tree = parse("from a.b import c as d\n");
    assertThat(ImportUtils.addImport(tree, "a.b.c", true)).isEqualTo("d");
    assertThat(tree.getRoot().isDirty()).isFalse();
  }

  @Test
  public void testAddImportAfterDocstringAndFutureImports() throws Exception {
    SyntaxTree tree = parse("'Docstring.'\nfrom __future__ import division\nimport b\n");
    ImportUtils.addImport(tree, "a", false);
    assertThat(tree.dump())
        .isEqualTo("'Docstring.'\nfrom __future__ import division\nimport a\nimport b\n");
  }

  @Test
  public void testAddFromImportAvoidsNameConflicts() throws Exception {
    SyntaxTree tree = parse("def c(): pass\n");
    assertThat(ImportUtils.addImport(tree, "a.b.c", true)).isEqualTo("c_1");
    assertThat(tree.dump()).isEqualTo("from a.b import c as c_1\ndef c(): pass\n");
  }

  @Test
  public void testAddFromImportMergesIntoExistingImport() throws Exception {
    SyntaxTree tree = parse("from a.b import c\n");
    assertThat(ImportUtils.addImport(tree, "a.b.y", true)).isEqualTo("y");
    assertThat(tree.dump()).isEqualTo("from a.b import c, y\n");
  }
}
