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

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;

/** How a string literal was spelled: its prefix letters, its quotes and whether it was split. */
@AutoValue
public abstract class StringStyle {
  /** The prefix letters exactly as written, for example {@code "rb"} or {@code ""}. */
  public abstract String getPrefix();

  /** One of {@code '}, {@code "}, {@code '''} or {@code """}. */
  public abstract String getQuote();

  /** Whether the literal is several adjacent string tokens concatenated implicitly. */
  public abstract boolean isImplicitConcatenation();

  public static StringStyle create(String prefix, String quote, boolean implicitConcatenation) {
    return new AutoValue_StringStyle(prefix, quote, implicitConcatenation);
  }

  /**
   * Derives the style from a literal's source text, which starts with a complete string token.
   *
   * @param text the literal text
   * @param tokenCount the number of string tokens the literal is made of
   */
  public static StringStyle of(String text, int tokenCount) {
    int i = 0;
    while (i < text.length() && text.charAt(i) != '\'' && text.charAt(i) != '"') {
      i++;
    }
    String prefix = text.substring(0, i);
    String quote = text.substring(i, Math.min(text.length(), i + 1));
    if (text.startsWith(quote + quote + quote, i)) {
      quote = quote + quote + quote;
    }
    return create(prefix, quote, tokenCount > 1);
  }

  public final boolean isRaw() {
    return hasPrefix('r');
  }

  public final boolean isBytes() {
    return hasPrefix('b');
  }

  public final boolean isUnicode() {
    return hasPrefix('u');
  }

  public final boolean isFormat() {
    return hasPrefix('f');
  }

  public final boolean isTripleQuoted() {
    return getQuote().length() == 3;
  }

  private boolean hasPrefix(char c) {
    return Ascii.toLowerCase(getPrefix()).indexOf(c) >= 0;
  }
}
