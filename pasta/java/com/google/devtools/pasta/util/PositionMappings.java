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

package com.google.devtools.pasta.util;

import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.Charset;

/**
 * Maps char offsets of a source buffer to byte offsets, 1-based line numbers and 0-based columns.
 */
public class PositionMappings {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int[] byteOffsets;
  private final int[] lineNumbers;
  private final int[] columns;

  /**
   * Constructs a new {@link PositionMappings} instance.
   *
   * @param encoding The encoding the source is stored in, used to compute byte offsets.
   * @param text The source text to be mapped.
   * @throws IllegalStateException If an error was encountered while encoding the source text.
   */
  public PositionMappings(Charset encoding, CharSequence text) {
    byteOffsets = new int[text.length() + 1];
    lineNumbers = new int[text.length() + 1];
    columns = new int[text.length() + 1];

    CountingOutputStream counter = new CountingOutputStream();
    OutputStreamWriter writer = new OutputStreamWriter(counter, encoding);
    int lineStart = 0;
    for (int i = 0; i < text.length(); i++) {
      byteOffsets[i] = counter.getCount();
      lineNumbers[i] = counter.getLines() + 1;
      columns[i] = i - lineStart;
      try {
        writer.append(text.charAt(i));
        writer.flush();
      } catch (IOException ioe) {
        throw new IllegalStateException(ioe);
      }
      if (text.charAt(i) == '\n') {
        lineStart = i + 1;
      }
    }
    byteOffsets[text.length()] = counter.getCount();
    lineNumbers[text.length()] = counter.getLines() + 1;
    columns[text.length()] = text.length() - lineStart;
  }

  /**
   * Returns the line number corresponding to the specified char offset.
   *
   * @return The 1-based line number, or -1 if the specified offset was out of bounds.
   */
  public int charToLine(int charOffset) {
    return lookup(lineNumbers, charOffset);
  }

  /**
   * Returns the column corresponding to the specified char offset.
   *
   * @return The 0-based column in chars, or -1 if the specified offset was out of bounds.
   */
  public int charToColumn(int charOffset) {
    return lookup(columns, charOffset);
  }

  /**
   * Returns the byte offset corresponding to the specified char offset.
   *
   * @return The byte offset, or -1 if the specified offset was out of bounds.
   */
  public int charToByteOffset(int charOffset) {
    return lookup(byteOffsets, charOffset);
  }

  /** Returns {@code line:column} for the given offset, as used in error messages. */
  public String describe(int charOffset) {
    return charToLine(charOffset) + ":" + charToColumn(charOffset);
  }

  private static int lookup(int[] table, int charOffset) {
    if (charOffset < 0) {
      return -1;
    } else if (charOffset >= table.length) {
      logger.atWarning().log("offset past end of source: %d >= %d", charOffset, table.length);
      return -1;
    }
    return table[charOffset];
  }

  /** {@link OutputStream} that only counts each {@code byte} that should be written. */
  private static class CountingOutputStream extends OutputStream {
    private int count;
    private int lines;

    /** Returns the count of bytes that have been requested to be written. */
    public int getCount() {
      return count;
    }

    /** Returns the number of full lines that have been requested to be written. */
    public int getLines() {
      return lines;
    }

    @Override
    public void write(int b) {
      count++;
      if (b == '\n') {
        lines++;
      }
    }
  }
}
