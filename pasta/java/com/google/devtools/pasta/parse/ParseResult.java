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

package com.google.devtools.pasta.parse;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.devtools.pasta.base.SyntaxNode;
import com.google.devtools.pasta.base.Token;

/** A module tree as reported by a parser, with the gap-free token stream of the same source. */
@AutoValue
public abstract class ParseResult {
  public abstract SyntaxNode getRoot();

  public abstract ImmutableList<Token> getTokens();

  public static ParseResult create(SyntaxNode root, Iterable<Token> tokens) {
    return new AutoValue_ParseResult(root, ImmutableList.copyOf(tokens));
  }
}
