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

import com.google.common.collect.ImmutableSet;

/** The Python grammars a source can be parsed with. */
public enum GrammarVersion {
  PY2_7(
      ImmutableSet.of(
          "and", "as", "assert", "break", "class", "continue", "def", "del", "elif", "else",
          "except", "exec", "finally", "for", "from", "global", "if", "import", "in", "is",
          "lambda", "not", "or", "pass", "print", "raise", "return", "try", "while", "with",
          "yield")),
  PY3_8(
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
          "return", "try", "while", "with", "yield"));

  private final ImmutableSet<String> keywords;

  GrammarVersion(ImmutableSet<String> keywords) {
    this.keywords = keywords;
  }

  /** Returns whether {@code name} is reserved and cannot be used as an identifier. */
  public boolean isKeyword(String name) {
    return keywords.contains(name);
  }

  public boolean isPython3() {
    return this == PY3_8;
  }
}
