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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.devtools.pasta.util.Span;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Source formatting recorded for one {@link SyntaxNode}.
 *
 * <p>The {@code prefix} is the text before the node's first token that no enclosing node claimed,
 * including any wrapping parentheses. The {@code suffix} is the text after its last token that it
 * owns: wrapping close parentheses and, for simple statements, the rest of the line. The {@code
 * span} delimits everything in between.
 *
 * <p>Text in front of each of the node's own keyword and punctuation tokens is kept in slots, keyed
 * by token and ordered by occurrence. Everything else is a kind-specific extra.
 *
 * <p>Only the annotator and the mutation API write formatting; callers get read access.
 */
public final class Formatting {
  private @Nullable String prefix;
  private @Nullable String suffix;
  private @Nullable Span span;
  private @Nullable String source;
  private final ListMultimap<String, String> slots =
      MultimapBuilder.hashKeys().arrayListValues().build();

  private int parenthesisDepth;
  private int blankLinesBefore;
  private boolean trailingComma;
  private @Nullable String indentation;
  private boolean inline;
  private boolean hasParens;
  private @Nullable StringStyle stringStyle;

  Formatting() {}

  public @Nullable String getPrefix() {
    return prefix;
  }

  public @Nullable String getSuffix() {
    return suffix;
  }

  /** Returns the range of the node's own text in its source, or null if it was never annotated. */
  public @Nullable Span getSpan() {
    return span;
  }

  /** Whether this record was filled in by annotation. */
  public boolean isAnnotated() {
    return span != null;
  }

  /** Returns the original text delimited by {@link #getSpan()}, or null if not annotated. */
  public @Nullable String getSpanText() {
    return span == null || source == null ? null : span.textOf(source);
  }

  /** Returns the recorded text in front of each own token, keyed by token. */
  public ImmutableListMultimap<String, String> getSlots() {
    return ImmutableListMultimap.copyOf(slots);
  }

  /** Number of redundant parentheses wrapped around an expression. */
  public int getParenthesisDepth() {
    return parenthesisDepth;
  }

  /** Number of blank lines in a statement's prefix. */
  public int getBlankLinesBefore() {
    return blankLinesBefore;
  }

  /** Whether a comma-separated form ended with a separator after its last element. */
  public boolean hasTrailingComma() {
    return trailingComma;
  }

  /** The leading whitespace of the statements of a multi-line block; null if unknown. */
  public @Nullable String getIndentation() {
    return indentation;
  }

  /** Whether a block's statements follow its colon on the same line. */
  public boolean isInline() {
    return inline;
  }

  /** Whether a class definition was written with parentheses, or an import list was wrapped. */
  public boolean hasParens() {
    return hasParens;
  }

  /** The literal style of a string node; null for other kinds. */
  public @Nullable StringStyle getStringStyle() {
    return stringStyle;
  }

  /** Whether the module started with a byte order mark. */
  public boolean hasByteOrderMark() {
    return prefix != null && prefix.startsWith("\uFEFF");
  }

  @Nullable String getSource() {
    return source;
  }

  @Nullable String slot(String key, int index) {
    List<String> values = slots.get(key);
    return index < values.size() ? values.get(index) : null;
  }

  void addSlot(String key, String text) {
    slots.put(key, text);
  }

  void setPrefix(@Nullable String prefix) {
    this.prefix = prefix;
  }

  void setSuffix(@Nullable String suffix) {
    this.suffix = suffix;
  }

  void setSpan(Span span, String source) {
    this.span = span;
    this.source = source;
  }

  void setParenthesisDepth(int parenthesisDepth) {
    this.parenthesisDepth = parenthesisDepth;
  }

  void setBlankLinesBefore(int blankLinesBefore) {
    this.blankLinesBefore = blankLinesBefore;
  }

  void setTrailingComma(boolean trailingComma) {
    this.trailingComma = trailingComma;
  }

  void setIndentation(@Nullable String indentation) {
    this.indentation = indentation;
  }

  void setInline(boolean inline) {
    this.inline = inline;
  }

  void setHasParens(boolean hasParens) {
    this.hasParens = hasParens;
  }

  void setStringStyle(@Nullable StringStyle stringStyle) {
    this.stringStyle = stringStyle;
  }

  /** Copies the framing of a replaced node onto this one, if this one has none of its own. */
  void inheritFraming(Formatting replaced) {
    if (prefix == null && suffix == null) {
      prefix = replaced.prefix;
      suffix = replaced.suffix;
      parenthesisDepth = replaced.parenthesisDepth;
      blankLinesBefore = replaced.blankLinesBefore;
    }
  }

  @Override
  public String toString() {
    return String.format(
        "Formatting{prefix=%s, suffix=%s, span=%s}",
        prefix == null ? null : "'" + prefix + "'",
        suffix == null ? null : "'" + suffix + "'",
        span);
  }
}
