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

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.devtools.pasta.base.Token;
import com.google.devtools.pasta.base.TokenKind;
import java.util.ArrayDeque;
import java.util.Deque;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Splits Python source into a gap-free token stream.
 *
 * <p>Unlike a compiler's tokenizer, every character of the source ends up in exactly one token:
 * whitespace, comments, line continuations and the byte-order mark are tokens too. Concatenating
 * the text of all tokens gives back the source. {@link TokenKind#INDENT} and {@link
 * TokenKind#DEDENT} are zero-width and placed just before the first token of the line that changes
 * the indentation.
 */
public final class Tokenizer {
  /** Operators, longest first so that the first match is the longest one. */
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "**=", "//=", ">>=", "<<=", "...",
          "->", "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "<>",
          "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
          "+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}",
          ",", ":", ";", ".", "=", "@");

  private static final ImmutableList<String> STRING_PREFIXES =
      ImmutableList.of("r", "u", "b", "f", "br", "rb", "fr", "rf", "ur");

  private static final int TAB_SIZE = 8;

  private final String source;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private final Deque<Integer> indents = new ArrayDeque<>();
  private int pos;
  private int depth;
  private boolean lineHasCode;
  private boolean atLineStart = true;
  private @Nullable Token last;

  public Tokenizer(String source) {
    this.source = source;
    indents.push(0);
  }

  /**
   * Tokenizes the whole source.
   *
   * @throws GrammarException on a character or construct that cannot start a token, an unterminated
   *     string, inconsistent dedentation or unbalanced brackets
   */
  public ImmutableList<Token> tokenize() throws GrammarException {
    if (source.startsWith("\uFEFF")) {
      emit(TokenKind.WHITESPACE, 1);
    }
    while (pos < source.length()) {
      if (atLineStart) {
        atLineStart = false;
        if (depth == 0) {
          lineStart();
          continue;
        }
      }
      char c = source.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\f') {
        emit(TokenKind.WHITESPACE, whitespaceEnd(pos) - pos);
      } else if (c == '#') {
        emit(TokenKind.COMMENT, lineEnd(pos) - pos);
      } else if (c == '\n' || c == '\r') {
        newline();
      } else if (c == '\\') {
        continuation();
      } else if (c == '"' || c == '\'') {
        string(pos);
      } else if (isIdentifierStart(c)) {
        nameOrString();
      } else if (isDigit(c) || (c == '.' && pos + 1 < source.length()
          && isDigit(source.charAt(pos + 1)))) {
        number();
      } else {
        operator();
      }
    }
    finish();
    return tokens.build();
  }

  /** Handles indentation at the start of a logical line. */
  private void lineStart() throws GrammarException {
    int start = pos;
    int end = whitespaceEnd(start);
    if (end > start) {
      emit(TokenKind.WHITESPACE, end - start);
    }
    if (end == source.length()) {
      return;
    }
    char c = source.charAt(end);
    if (c == '#' || c == '\n' || c == '\r' || (c == '\\' && isNewline(end + 1))) {
      // Blank and comment-only lines do not change the indentation.
      return;
    }
    int width = width(source.substring(start, end));
    if (width > indents.peek()) {
      indents.push(width);
      emit(TokenKind.INDENT, 0);
      return;
    }
    while (width < indents.peek()) {
      indents.pop();
      emit(TokenKind.DEDENT, 0);
    }
    if (width != indents.peek()) {
      throw GrammarException.at(
          source, end, "unindent does not match any outer indentation level");
    }
  }

  private void newline() {
    int length = source.startsWith("\r\n", pos) ? 2 : 1;
    if (depth > 0 || !lineHasCode) {
      emit(TokenKind.NL, length);
    } else {
      emit(TokenKind.NEWLINE, length);
      lineHasCode = false;
    }
    atLineStart = true;
  }

  private void continuation() throws GrammarException {
    if (!isNewline(pos + 1)) {
      throw GrammarException.at(source, pos, "unexpected character after line continuation");
    }
    int length = source.startsWith("\r\n", pos + 1) ? 3 : 2;
    emit(TokenKind.CONTINUATION, length);
  }

  private void nameOrString() throws GrammarException {
    int end = pos + 1;
    while (end < source.length() && isIdentifierPart(source.charAt(end))) {
      end++;
    }
    String word = source.substring(pos, end);
    if (end < source.length()
        && (source.charAt(end) == '"' || source.charAt(end) == '\'')
        && STRING_PREFIXES.contains(Ascii.toLowerCase(word))) {
      string(end);
      return;
    }
    emitCode(TokenKind.NAME, end - pos);
  }

  /** Lexes a string literal whose prefix runs from {@code pos} to {@code quoteStart}. */
  private void string(int quoteStart) throws GrammarException {
    char quote = source.charAt(quoteStart);
    String triple = Strings.repeat(String.valueOf(quote), 3);
    boolean isTriple = source.startsWith(triple, quoteStart);
    int i = quoteStart + (isTriple ? 3 : 1);
    while (true) {
      if (i >= source.length()) {
        throw GrammarException.at(source, pos, "unterminated string literal");
      }
      char c = source.charAt(i);
      if (c == '\\') {
        i += source.startsWith("\r\n", i + 1) ? 3 : 2;
      } else if (isTriple && source.startsWith(triple, i)) {
        i += 3;
        break;
      } else if (!isTriple && c == quote) {
        i++;
        break;
      } else if (!isTriple && (c == '\n' || c == '\r')) {
        throw GrammarException.at(source, pos, "unterminated string literal");
      } else {
        i++;
      }
    }
    emitCode(TokenKind.STRING, i - pos);
  }

  private void number() {
    int i = pos;
    if (source.charAt(i) == '0' && i + 1 < source.length()
        && "xXoObB".indexOf(source.charAt(i + 1)) >= 0) {
      i += 2;
      while (i < source.length()
          && (Character.digit(source.charAt(i), 16) >= 0 || source.charAt(i) == '_')) {
        i++;
      }
    } else {
      i = digits(i);
      if (i < source.length() && source.charAt(i) == '.') {
        i = digits(i + 1);
      }
      if (i < source.length() && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
        int exponent = i + 1;
        if (exponent < source.length()
            && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
          exponent++;
        }
        if (exponent < source.length() && isDigit(source.charAt(exponent))) {
          i = digits(exponent);
        }
      }
    }
    if (i < source.length() && "jJlL".indexOf(source.charAt(i)) >= 0) {
      i++;
    }
    emitCode(TokenKind.NUMBER, i - pos);
  }

  private int digits(int i) {
    while (i < source.length() && (isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
      i++;
    }
    return i;
  }

  private void operator() throws GrammarException {
    for (String op : OPERATORS) {
      if (source.startsWith(op, pos)) {
        if (op.length() == 1 && "([{".contains(op)) {
          depth++;
        } else if (op.length() == 1 && ")]}".contains(op)) {
          if (depth == 0) {
            throw GrammarException.at(source, pos, "unmatched '" + op + "'");
          }
          depth--;
        }
        emitCode(TokenKind.OP, op.length());
        return;
      }
    }
    throw GrammarException.at(
        source, pos, "unexpected character '" + source.charAt(pos) + "'");
  }

  private void finish() throws GrammarException {
    if (depth > 0) {
      throw GrammarException.at(source, pos, "unexpected end of file inside brackets");
    }
    if (last != null && last.getKind() == TokenKind.CONTINUATION) {
      throw GrammarException.at(source, pos, "unexpected end of file after line continuation");
    }
    if (lineHasCode) {
      emit(TokenKind.NEWLINE, 0);
      lineHasCode = false;
    } else if (last != null
        && (last.getKind() == TokenKind.COMMENT || last.getKind() == TokenKind.WHITESPACE)) {
      emit(TokenKind.NL, 0);
    }
    while (indents.peek() > 0) {
      indents.pop();
      emit(TokenKind.DEDENT, 0);
    }
    emit(TokenKind.ENDMARKER, 0);
  }

  private void emitCode(TokenKind kind, int length) {
    lineHasCode = true;
    emit(kind, length);
  }

  private void emit(TokenKind kind, int length) {
    last = Token.create(kind, source.substring(pos, pos + length), pos);
    tokens.add(last);
    pos += length;
  }

  private int whitespaceEnd(int i) {
    while (i < source.length()
        && (source.charAt(i) == ' ' || source.charAt(i) == '\t' || source.charAt(i) == '\f')) {
      i++;
    }
    return i;
  }

  private int lineEnd(int i) {
    while (i < source.length() && !isNewline(i)) {
      i++;
    }
    return i;
  }

  private boolean isNewline(int i) {
    return i < source.length() && (source.charAt(i) == '\n' || source.charAt(i) == '\r');
  }

  /** The column width of an indentation, with tabs advancing to the next multiple of eight. */
  private static int width(String indentation) {
    int column = 0;
    for (int i = 0; i < indentation.length(); i++) {
      char c = indentation.charAt(i);
      if (c == '\t') {
        column = (column / TAB_SIZE + 1) * TAB_SIZE;
      } else if (c == '\f') {
        column = 0;
      } else {
        column++;
      }
    }
    return column;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isUnicodeIdentifierStart(c);
  }

  private static boolean isIdentifierPart(char c) {
    return c == '_'
        || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
  }
}
