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

package com.google.devtools.pasta;

import com.google.common.flogger.FluentLogger;
import com.google.devtools.pasta.base.AnnotationException;
import com.google.devtools.pasta.base.Annotator;
import com.google.devtools.pasta.base.PrintException;
import com.google.devtools.pasta.base.Printer;
import com.google.devtools.pasta.base.SyntaxTree;
import com.google.devtools.pasta.parse.GrammarException;
import com.google.devtools.pasta.parse.GrammarVersion;
import com.google.devtools.pasta.parse.ParseResult;
import com.google.devtools.pasta.parse.ParserAdapter;
import java.util.logging.Level;

/**
 * Entry point: parses Python source into a {@link SyntaxTree} that remembers its formatting, and
 * dumps a possibly modified tree back to source.
 *
 * <p>{@code dump(parse(source))} returns {@code source} unchanged. After a mutation, only the
 * mutated parts of the tree are reprinted; everything else is copied from the original source.
 */
public final class Pasta {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PastaConfig config;

  private Pasta(PastaConfig config) {
    this.config = config;
  }

  public static Pasta create() {
    return new Pasta(new PastaConfig());
  }

  public static Pasta create(PastaConfig config) {
    return new Pasta(config);
  }

  /** Parses {@code source} with the configured grammar version. */
  public SyntaxTree parse(String source) throws GrammarException, AnnotationException {
    return parse(source, config.getGrammarVersion());
  }

  /**
   * Parses {@code source} and binds every node to the text it came from.
   *
   * @throws GrammarException if {@code source} is not valid under {@code version}
   * @throws AnnotationException if the parsed tree cannot be aligned with the source text
   */
  public SyntaxTree parse(String source, GrammarVersion version)
      throws GrammarException, AnnotationException {
    ParserAdapter adapter =
        ParserAdapter.loadBest(version)
            .orElseThrow(
                () -> new IllegalStateException("no parser registered for " + version));
    ParseResult result = adapter.parse(source, version);
    SyntaxTree tree =
        Annotator.annotate(source, result.getRoot(), result.getTokens(), config.getIndentUnit());
    logger.at(logLevel()).log(
        "parsed %d chars as %s with %s", source.length(), version, adapter.getClass().getName());
    return tree;
  }

  /**
   * Prints {@code tree} back to source.
   *
   * @throws PrintException if a mutation left a node with children its kind cannot have
   */
  public String dump(SyntaxTree tree) throws PrintException {
    String text = Printer.print(tree);
    logger.at(logLevel()).log("dumped %d chars", text.length());
    return text;
  }

  private Level logLevel() {
    return config.getVerboseLogging() ? Level.INFO : Level.FINE;
  }
}
