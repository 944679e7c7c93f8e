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

import com.google.common.collect.Streams;
import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Produces a tree and a token stream for Python source.
 *
 * <p>Implementations are found with {@link ServiceLoader}; each says how well it handles a given
 * grammar version and the best one is used.
 */
public interface ParserAdapter {

  /** How well an adapter handles a grammar version. */
  public enum CompatibilityLevel {
    /** The adapter cannot parse this grammar. */
    INCOMPATIBLE,
    /** The adapter can parse this grammar, but only if nothing better is available. */
    FALLBACK,
    /** The adapter can parse this grammar and should be preferred over a fallback. */
    COMPATIBLE
  }

  CompatibilityLevel getCompatibility(GrammarVersion version);

  /**
   * Parses {@code source}. Every node's reported position covers its own tokens; the token stream
   * concatenates back to {@code source}.
   *
   * @throws GrammarException if {@code source} is not valid under {@code version}
   */
  ParseResult parse(String source, GrammarVersion version) throws GrammarException;

  /** Loads the best registered adapter for {@code version}, if any. */
  public static Optional<ParserAdapter> loadBest(GrammarVersion version) {
    return Streams.stream(ServiceLoader.load(ParserAdapter.class))
        // Filter out incompatible providers.
        .filter(p -> p.getCompatibility(version) != CompatibilityLevel.INCOMPATIBLE)
        // Then find the best.
        .max(Comparator.comparing(p -> p.getCompatibility(version)));
  }
}
