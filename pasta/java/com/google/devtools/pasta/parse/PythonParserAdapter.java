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

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.pasta.base.SyntaxNode;
import com.google.devtools.pasta.base.Token;

/** The built-in adapter: {@link Tokenizer} followed by {@link PythonParser}. */
@AutoService(ParserAdapter.class)
public final class PythonParserAdapter implements ParserAdapter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public PythonParserAdapter() {}

  @Override
  public CompatibilityLevel getCompatibility(GrammarVersion version) {
    return CompatibilityLevel.COMPATIBLE;
  }

  @Override
  public ParseResult parse(String source, GrammarVersion version) throws GrammarException {
    ImmutableList<Token> tokens = new Tokenizer(source).tokenize();
    SyntaxNode root = new PythonParser(source, tokens, version).parseModule();
    logger.atFine().log(
        "parsed %d chars into %d tokens as %s", source.length(), tokens.size(), version);
    return ParseResult.create(root, tokens);
  }
}
