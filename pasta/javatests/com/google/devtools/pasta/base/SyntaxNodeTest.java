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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests the mutation API of {@link SyntaxNode}. */
@RunWith(JUnit4.class)
public class SyntaxNodeTest {
  @Test
  public void testChildrenKnowTheirParent() {
    SyntaxNode a = SyntaxNodes.name("a");
    SyntaxNode b = SyntaxNodes.name("b");
    SyntaxNode call = SyntaxNodes.call(a, b);
    assertThat(a.getParent()).isSameInstanceAs(call);
    assertThat(call.indexOf(b)).isEqualTo(1);
    assertThat(call.indexOf(SyntaxNodes.name("b"))).isEqualTo(-1);

    SyntaxNode removed = call.removeChild(1);
    assertThat(removed).isSameInstanceAs(b);
    assertThat(b.getParent()).isNull();
    assertThat(call.getChildCount()).isEqualTo(1);
  }

  @Test
  public void testChildrenViewIsUnmodifiable() {
    SyntaxNode call = SyntaxNodes.call(SyntaxNodes.name("f"));
    assertThrows(
        UnsupportedOperationException.class, () -> call.getChildren().add(SyntaxNodes.name("x")));
  }

  @Test
  public void testNodeCannotHaveTwoParents() {
    SyntaxNode a = SyntaxNodes.name("a");
    SyntaxNodes.expressionStatement(a);
    SyntaxNode other = SyntaxNodes.call(SyntaxNodes.name("f"));
    assertThrows(IllegalArgumentException.class, () -> other.addChild(a));
    assertThrows(
        IllegalArgumentException.class,
        () -> SyntaxNode.create(NodeKind.TUPLE, null, ImmutableList.of(a)));
  }

  @Test
  public void testNodeCannotBecomeItsOwnDescendant() {
    SyntaxNode inner = SyntaxNodes.call(SyntaxNodes.name("f"));
    SyntaxNode outer = SyntaxNodes.expressionStatement(inner);
    outer.removeChild(0);
    SyntaxNode tuple = SyntaxNode.create(NodeKind.TUPLE, "()");
    inner.addChild(tuple);
    assertThrows(IllegalArgumentException.class, () -> tuple.addChild(inner));
    assertThrows(IllegalArgumentException.class, () -> tuple.addChild(tuple));
  }

  @Test
  public void testChildrenMustBeDistinct() {
    SyntaxNode a = SyntaxNodes.name("a");
    SyntaxNode tuple = SyntaxNode.create(NodeKind.TUPLE, null);
    assertThrows(IllegalArgumentException.class, () -> tuple.setChildren(ImmutableList.of(a, a)));
  }

  @Test
  public void testIndexChecks() {
    SyntaxNode call = SyntaxNodes.call(SyntaxNodes.name("f"));
    assertThrows(IndexOutOfBoundsException.class, () -> call.removeChild(1));
    assertThrows(
        IndexOutOfBoundsException.class, () -> call.insertChild(2, SyntaxNodes.name("x")));
    assertThrows(
        IndexOutOfBoundsException.class, () -> call.replaceChild(-1, SyntaxNodes.name("x")));
  }

  @Test
  public void testSetChildrenDetachesDroppedChildren() {
    SyntaxNode a = SyntaxNodes.name("a");
    SyntaxNode b = SyntaxNodes.name("b");
    SyntaxNode c = SyntaxNodes.name("c");
    SyntaxNode tuple = SyntaxNode.create(NodeKind.TUPLE, null, a, b);
    tuple.setChildren(ImmutableList.of(c, b));
    assertThat(tuple.getChildren()).containsExactly(c, b).inOrder();
    assertThat(a.getParent()).isNull();
    assertThat(c.getParent()).isSameInstanceAs(tuple);
  }

  @Test
  public void testMutationMarksAncestorsDirty() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = 1\ny = 2\n");
    SyntaxNode root = tree.getRoot();
    SyntaxNode first = root.getChild(0);
    SyntaxNode second = root.getChild(1);
    assertThat(root.isDirty()).isFalse();

    first.getChild(0).setValue("z");
    assertThat(first.getChild(0).isDirty()).isTrue();
    assertThat(first.isDirty()).isTrue();
    assertThat(root.isDirty()).isTrue();
    assertThat(second.isDirty()).isFalse();
    assertThat(first.getChild(1).isDirty()).isFalse();
  }

  @Test
  public void testCreatedNodesAreDirty() {
    SyntaxNode node = SyntaxNodes.name("a");
    assertThat(node.isDirty()).isTrue();
    assertThat(node.getPosition()).isNull();
    assertThat(node.getFormatting().isAnnotated()).isFalse();
  }

  @Test
  public void testReplacementInheritsFraming() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = ( 1 )\n");
    SyntaxNode assign = tree.getRoot().getChild(0);
    SyntaxNode old = assign.getChild(1);
    SyntaxNode replacement = SyntaxNodes.name("y");
    assertThat(assign.replaceChild(1, replacement)).isSameInstanceAs(old);
    assertThat(old.getParent()).isNull();
    assertThat(replacement.getFormatting().getPrefix()).isEqualTo(" ( ");
    assertThat(replacement.getFormatting().getSuffix()).isEqualTo(" )");
    assertThat(replacement.getFormatting().getParenthesisDepth()).isEqualTo(1);
  }

  @Test
  public void testReplacementKeepsItsOwnFraming() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = 1\ny = (2)\n");
    SyntaxNode first = tree.getRoot().getChild(0);
    SyntaxNode moved = tree.getRoot().getChild(1).replaceChild(1, SyntaxNodes.name("z"));
    first.replaceChild(1, moved);
    assertThat(moved.getFormatting().getPrefix()).isEqualTo(" (");
    assertThat(tree.dump()).isEqualTo("x = (2)\ny = (z)\n");
  }

  @Test
  public void testToString() {
    assertThat(SyntaxNodes.name("a").toString()).isEqualTo("NAME:a");
    assertThat(SyntaxNodes.pass().toString()).isEqualTo("PASS");
  }
}
