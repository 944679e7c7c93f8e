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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.devtools.pasta.Pasta;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SyntaxTreeTest {
  private static final String SOURCE =
      "class A:\n"
          + "  def f(self):\n"
          + "    if self:\n"
          + "      return 1\n"
          + "    else:\n"
          + "      return 2\n";

  @Test
  public void testWalkIsPreOrder() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = f(y)\n");
    List<String> visited = new ArrayList<>();
    for (SyntaxNode node : tree.walk()) {
      visited.add(node.toString());
    }
    assertThat(visited)
        .containsExactly("MODULE", "ASSIGN", "NAME:x", "CALL", "NAME:f", "NAME:y")
        .inOrder();
  }

  @Test
  public void testIndentation() throws Exception {
    SyntaxTree tree = Pasta.create().parse(SOURCE);
    SyntaxNode classDef = tree.getRoot().getChild(0);
    SyntaxNode function = classDef.getChild(0).getChild(0);
    SyntaxNode ifStatement = function.getChild(1).getChild(0);
    SyntaxNode orElse = ifStatement.getChild(2);
    SyntaxNode secondReturn = orElse.getChild(0);

    assertThat(tree.getIndentation(classDef)).isEmpty();
    assertThat(tree.getIndentation(function)).isEqualTo("  ");
    assertThat(tree.getIndentation(ifStatement)).isEqualTo("    ");
    assertThat(tree.getIndentation(orElse)).isEqualTo("    ");
    assertThat(tree.getIndentation(secondReturn)).isEqualTo("      ");
    assertThat(tree.getIndentation(secondReturn.getChild(0))).isEqualTo("      ");
    assertThat(tree.getBodyIndentation(orElse)).isEqualTo("      ");
    assertThat(tree.getBodyIndentation(tree.getRoot())).isEmpty();
    assertThat(tree.getIndentUnit()).isEqualTo("  ");
  }

  @Test
  public void testBodyIndentationOfNewBlock() throws Exception {
    SyntaxTree tree = Pasta.create().parse(SOURCE);
    SyntaxNode classBody = tree.getRoot().getChild(0).getChild(0);
    SyntaxNode block = SyntaxNode.create(NodeKind.BLOCK, null, SyntaxNodes.pass());
    SyntaxNode loop =
        SyntaxNode.create(
            NodeKind.WHILE, null, ImmutableList.of(SyntaxNodes.name("x"), block));
    classBody.addChild(loop);
    assertThat(tree.getBodyIndentation(block)).isEqualTo("    ");
  }

  @Test
  public void testQueriesRejectForeignNodes() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = 1\n");
    SyntaxNode detached = SyntaxNodes.name("y");
    assertThat(tree.contains(tree.getRoot().getChild(0).getChild(1))).isTrue();
    assertThat(tree.contains(detached)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> tree.getIndentation(detached));
    assertThrows(
        IllegalArgumentException.class,
        () -> tree.getBodyIndentation(tree.getRoot().getChild(0)));
  }

  @Test
  public void testSourceIsKept() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = 1\n");
    tree.getRoot().removeChild(0);
    assertThat(tree.getSource()).isEqualTo("x = 1\n");
    assertThat(tree.dump()).isEmpty();
  }
}
