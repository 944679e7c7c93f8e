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

import com.google.devtools.pasta.Pasta;
import com.google.devtools.pasta.base.SyntaxTree;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RenameTest {
  private static SyntaxTree parse(String source) throws Exception {
    return Pasta.create().parse(source);
  }

  @Test
  public void testRenameImportedModule() throws Exception {
    SyntaxTree tree = parse("import aaa.bbb.ccc\naaa.bbb.ccc.foo()\n");
    assertThat(Rename.renameExternal(tree, "aaa.bbb", "xxx.yyy")).isTrue();
    assertThat(tree.dump()).isEqualTo("import xxx.yyy.ccc\nxxx.yyy.ccc.foo()\n");
  }

  @Test
  public void testRenameKeepsAsName() throws Exception {
    SyntaxTree tree = parse("import aaa as a\na.f()\n");
    assertThat(Rename.renameExternal(tree, "aaa", "bbb")).isTrue();
    assertThat(tree.dump()).isEqualTo("import bbb as a\na.f()\n");
  }

  @Test
  public void testRenameFromImportedName() throws Exception {
    SyntaxTree tree = parse("from aaa.bbb import ccc\nccc.foo()\n");
    assertThat(Rename.renameExternal(tree, "aaa.bbb.ccc", "xxx.yyy")).isTrue();
    assertThat(tree.dump()).isEqualTo("from xxx import yyy\nyyy.foo()\n");
  }

  @Test
  public void testRenameFromImportModule() throws Exception {
    SyntaxTree tree = parse("from aaa.bbb import ccc\n");
    assertThat(Rename.renameExternal(tree, "aaa", "zzz")).isTrue();
    assertThat(tree.dump()).isEqualTo("from zzz.bbb import ccc\n");
  }

  @Test
  public void testRenameSplitsSharedFromImport() throws Exception {
    SyntaxTree tree = parse("from aaa import bbb, ccc\nbbb()\nccc()\n");
    assertThat(Rename.renameExternal(tree, "aaa.bbb", "xxx.yyy")).isTrue();
    assertThat(tree.dump())
        .isEqualTo("from aaa import ccc\nfrom xxx import yyy\nyyy()\nccc()\n");
  }

  @Test
  public void testRenameWithoutMatch() throws Exception {
    String source = "import aaa\nfrom .rel import x\n";
    SyntaxTree tree = parse(source);
    assertThat(Rename.renameExternal(tree, "zzz", "yyy")).isFalse();
    assertThat(Rename.renameExternal(tree, "aaa", "aaa")).isFalse();
    assertThat(tree.getRoot().isDirty()).isFalse();
    assertThat(tree.dump()).isEqualTo(source);
  }

  @Test
  public void testRenameReadsOfDottedName() throws Exception {
    SyntaxTree tree = parse("import a.b.c\nc.f()\n");
    assertThat(Rename.renameReads(tree, "c", "a.other")).isTrue();
    assertThat(tree.dump()).isEqualTo("import a.b.c\na.other.f()\n");
  }

  @Test
  public void testRenameReadsSkipsBindings() throws Exception {
    SyntaxTree tree = parse("c = 1\nc += c\nfor c in c: pass\ndel c\nprint(x.c)\n");
    assertThat(Rename.renameReads(tree, "c", "d")).isTrue();
    assertThat(tree.dump()).isEqualTo("c = 1\nc += d\nfor c in d: pass\ndel c\nprint(x.c)\n");
  }

  @Test
  public void testRenameReadsWithoutMatch() throws Exception {
    SyntaxTree tree = parse("a.b = 1\n");
    assertThat(Rename.renameReads(tree, "a.c", "d")).isFalse();
  }
}
