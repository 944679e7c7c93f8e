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

/** Lexical categories of the tokens that make up a source buffer. */
public enum TokenKind {
  NAME,
  NUMBER,
  STRING,
  /** Operators and delimiters. */
  OP,
  COMMENT,
  /** A line break that does not end a logical line (blank lines, breaks inside brackets). */
  NL,
  /** The line break ending a logical line. Empty when the source has no final newline. */
  NEWLINE,
  /** Zero-width marker of an indentation increase. */
  INDENT,
  /** Zero-width marker of an indentation decrease. */
  DEDENT,
  /** Spaces, tabs, form feeds and a leading byte order mark. */
  WHITESPACE,
  /** A backslash followed by a line break. */
  CONTINUATION,
  ENDMARKER;

  /** Whether tokens of this kind carry no syntax and may appear between any two tokens. */
  public boolean isTrivia() {
    switch (this) {
      case COMMENT:
      case NL:
      case WHITESPACE:
      case CONTINUATION:
      case INDENT:
      case DEDENT:
        return true;
      default:
        return false;
    }
  }
}
