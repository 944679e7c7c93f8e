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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A position in a gap-free token stream, with lookahead and backtracking by mark. */
final class TokenCursor {
  private final ImmutableList<Token> tokens;
  private final Token end;
  private int index;

  TokenCursor(List<Token> tokens, int sourceLength) {
    this.tokens = ImmutableList.copyOf(tokens);
    this.end = Token.create(TokenKind.ENDMARKER, "", sourceLength);
  }

  /** Returns the next token without consuming it; an end marker once the stream is exhausted. */
  Token peek() {
    return index < tokens.size() ? tokens.get(index) : end;
  }

  Token next() {
    Token token = peek();
    if (index < tokens.size()) {
      index++;
    }
    return token;
  }

  /** Returns the char offset where the next token starts. */
  int offset() {
    return peek().getStart();
  }

  int mark() {
    return index;
  }

  void reset(int mark) {
    checkArgument(mark >= 0 && mark <= tokens.size(), "invalid mark %s", mark);
    index = mark;
  }

  /** Consumes and returns the text of all trivia tokens ahead. */
  String trivia() {
    StringBuilder text = new StringBuilder();
    while (peek().getKind().isTrivia()) {
      text.append(next().getText());
    }
    return text.toString();
  }

  /** Returns whether everything left is trivia followed by the end of the stream. */
  boolean atEnd() {
    for (int i = index; i < tokens.size(); i++) {
      TokenKind kind = tokens.get(i).getKind();
      if (!kind.isTrivia() && kind != TokenKind.ENDMARKER) {
        return false;
      }
    }
    return true;
  }

  /** Consumes and returns the text of every remaining token. */
  String rest() {
    StringBuilder text = new StringBuilder();
    while (index < tokens.size()) {
      text.append(next().getText());
    }
    return text.toString();
  }
}
