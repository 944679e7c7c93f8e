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

import com.google.devtools.pasta.Pasta;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TreeDumperTest {
  @Test
  public void testDumpsKindsValuesAndFormatting() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = (1)  # c\n");
    JsonObject module = JsonParser.parseString(TreeDumper.toJson(tree)).getAsJsonObject();
    assertThat(module.get("kind").getAsString()).isEqualTo("MODULE");
    assertThat(module.get("dirty").getAsBoolean()).isFalse();

    JsonObject assign = module.getAsJsonArray("children").get(0).getAsJsonObject();
    assertThat(assign.get("kind").getAsString()).isEqualTo("ASSIGN");
    assertThat(assign.get("suffix").getAsString()).isEqualTo("  # c\n");
    assertThat(assign.has("value")).isFalse();

    JsonObject number = assign.getAsJsonArray("children").get(1).getAsJsonObject();
    assertThat(number.get("value").getAsString()).isEqualTo("1");
    assertThat(number.get("prefix").getAsString()).isEqualTo(" (");
    assertThat(number.get("parenthesisDepth").getAsInt()).isEqualTo(1);
    JsonArray span = number.getAsJsonArray("span");
    assertThat(span.get(0).getAsInt()).isEqualTo(5);
    assertThat(span.get(1).getAsInt()).isEqualTo(6);
  }

  @Test
  public void testDumpsDirtyNodes() throws Exception {
    SyntaxTree tree = Pasta.create().parse("x = 1\n");
    tree.getRoot().addChild(SyntaxNodes.pass());
    JsonObject module = JsonParser.parseString(TreeDumper.toJson(tree)).getAsJsonObject();
    JsonObject pass = module.getAsJsonArray("children").get(1).getAsJsonObject();
    assertThat(module.get("dirty").getAsBoolean()).isTrue();
    assertThat(pass.get("dirty").getAsBoolean()).isTrue();
    assertThat(pass.has("span")).isFalse();
    assertThat(pass.has("prefix")).isFalse();
  }

  @Test
  public void testDumpsStringStyle() throws Exception {
    SyntaxTree tree = Pasta.create().parse("s = u'<a>'\n");
    String json = TreeDumper.toJson(tree);
    assertThat(json).contains("\"quote\": \"'\"");
    assertThat(json).contains("\"stringPrefix\": \"u\"");
    assertThat(json).contains("<a>");
  }
}
