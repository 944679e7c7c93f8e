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
import com.google.devtools.pasta.util.Span;

/** A lexical token: its kind, its exact source text and the offset where it starts. */
@AutoValue
public abstract class Token {
  public abstract TokenKind getKind();

  public abstract String getText();

  public abstract int getStart();

  public static Token create(TokenKind kind, String text, int start) {
    return new AutoValue_Token(kind, text, start);
  }

  public final int getEnd() {
    return getStart() + getText().length();
  }

  public final Span getSpan() {
    return new Span(getStart(), getEnd());
  }

  /** Returns whether this is an operator or a name spelled {@code s}. */
  public final boolean is(String s) {
    return (getKind() == TokenKind.OP || getKind() == TokenKind.NAME) && getText().equals(s);
  }
}
