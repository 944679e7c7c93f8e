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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.devtools.pasta.base.PastaException;
import com.google.devtools.pasta.util.PositionMappings;

/** Thrown when a source does not conform to the grammar it is parsed with. */
public final class GrammarException extends PastaException {
  private final int line;
  private final int column;

  public GrammarException(String message, int line, int column) {
    super(String.format("%s (line %d, column %d)", message, line, column));
    this.line = line;
    this.column = column;
  }

  /** Creates an exception for the problem found at char {@code offset} of {@code source}. */
  static GrammarException at(String source, int offset, String message) {
    PositionMappings mappings = new PositionMappings(UTF_8, source);
    int clamped = Math.min(Math.max(offset, 0), source.length());
    return new GrammarException(
        message, mappings.charToLine(clamped), mappings.charToColumn(clamped));
  }

  /** The 1-based line of the problem. */
  public int getLine() {
    return line;
  }

  /** The 0-based column of the problem, in chars. */
  public int getColumn() {
    return column;
  }
}
