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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/** Renders a tree and its recorded formatting as JSON, for debugging. */
public final class TreeDumper {
  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  private TreeDumper() {}

  public static String toJson(SyntaxTree tree) {
    return GSON.toJson(toJsonObject(tree.getRoot()));
  }

  static JsonObject toJsonObject(SyntaxNode node) {
    Formatting fmt = node.getFormatting();
    JsonObject json = new JsonObject();
    json.addProperty("kind", node.getKind().name());
    if (node.getValue() != null) {
      json.addProperty("value", node.getValue());
    }
    json.addProperty("dirty", node.isDirty());
    if (fmt.getSpan() != null) {
      JsonArray span = new JsonArray();
      span.add(fmt.getSpan().getStart());
      span.add(fmt.getSpan().getEnd());
      json.add("span", span);
    }
    if (fmt.getPrefix() != null) {
      json.addProperty("prefix", fmt.getPrefix());
    }
    if (fmt.getSuffix() != null) {
      json.addProperty("suffix", fmt.getSuffix());
    }
    if (fmt.getParenthesisDepth() > 0) {
      json.addProperty("parenthesisDepth", fmt.getParenthesisDepth());
    }
    if (fmt.getBlankLinesBefore() > 0) {
      json.addProperty("blankLinesBefore", fmt.getBlankLinesBefore());
    }
    if (fmt.hasTrailingComma()) {
      json.addProperty("trailingComma", true);
    }
    if (fmt.getIndentation() != null) {
      json.addProperty("indentation", fmt.getIndentation());
    }
    if (fmt.isInline()) {
      json.addProperty("inline", true);
    }
    if (fmt.getStringStyle() != null) {
      json.addProperty("quote", fmt.getStringStyle().getQuote());
      json.addProperty("stringPrefix", fmt.getStringStyle().getPrefix());
    }
    if (node.getChildCount() > 0) {
      JsonArray children = new JsonArray();
      for (SyntaxNode child : node.getChildren()) {
        children.add(toJsonObject(child));
      }
      json.add("children", children);
    }
    return json;
  }
}
