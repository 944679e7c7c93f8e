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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.pasta.util.PositionMappings;
import com.google.devtools.pasta.util.Span;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Binds a freshly parsed tree to the text it was parsed from.
 *
 * <p>The tree and its token stream are walked in lock-step. Each node's layout says which of its
 * own tokens come next and where its children are; whitespace and comments found on the way are
 * recorded as slots, prefixes and suffixes so that the node can be printed back exactly.
 *
 * <p>Ownership of the text between nodes:
 *
 * <ul>
 *   <li>text before a token of the node itself is that token's slot;
 *   <li>text before a child, with any parentheses wrapped around the child, is the child's prefix,
 *       and the matching close parentheses are its suffix;
 *   <li>a simple statement's suffix runs to the end of its line, including a trailing comment or a
 *       semicolon;
 *   <li>comment lines after the last statement of a block belong to the block when they are
 *       indented at least as deeply as it, and to the next statement otherwise.
 * </ul>
 */
public final class Annotator extends BaseVisitor<AnnotationException> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String source;
  private final TokenCursor cursor;
  private final Multiset<String> indentSteps = HashMultiset.create();
  private @Nullable PositionMappings mappings;

  private Annotator(String source, List<Token> tokens) {
    this.source = source;
    this.cursor = new TokenCursor(tokens, source.length());
  }

  /**
   * Annotates {@code root}, a module parsed from {@code source}, using the tokens of the same
   * source.
   *
   * @param defaultIndentUnit the indentation step to use for new blocks if the source has none
   * @throws AnnotationException if the tree and the tokens cannot be aligned
   */
  public static SyntaxTree annotate(
      String source, SyntaxNode root, List<Token> tokens, String defaultIndentUnit)
      throws AnnotationException {
    checkArgument(root.getKind() == NodeKind.MODULE, "expected a module but got %s", root);
    Annotator annotator = new Annotator(source, tokens);
    annotator.annotateModule(root);
    annotator.checkCoverage(root);
    String indentUnit = annotator.indentUnit(defaultIndentUnit);
    logger.atFine().log(
        "annotated %d tokens, indentation unit '%s'", tokens.size(), indentUnit);
    return new SyntaxTree(source, root, indentUnit);
  }

  private void annotateModule(SyntaxNode root) throws AnnotationException {
    Formatting fmt = root.getFormatting();
    String bom = "";
    if (cursor.peek().getText().equals("\uFEFF")) {
      bom = cursor.next().getText();
    }
    int start = cursor.offset();
    visit(root);
    int end = cursor.offset();
    if (!cursor.atEnd()) {
      throw error(root, "unexpected '" + cursor.peek().getText() + "' after the last statement");
    }
    fmt.setPrefix(bom);
    fmt.setSpan(new Span(start, end), source);
    fmt.setSuffix(cursor.rest());
  }

  @Override
  protected void token(SyntaxNode node, String key, String text, String defaultGap)
      throws AnnotationException {
    String gap = cursor.trivia();
    Token token = cursor.peek();
    if (token.getKind().isTrivia() || !token.getText().equals(text)) {
      throw error(node, String.format("expected '%s' but found '%s'", text, token.getText()));
    }
    cursor.next();
    node.getFormatting().addSlot(key, gap);
  }

  @Override
  protected void tokens(SyntaxNode node, String key, String text, String defaultGap, boolean exact)
      throws AnnotationException {
    String gap = cursor.trivia();
    String expected = exact ? text : CharMatcher.whitespace().removeFrom(text);
    StringBuilder matched = new StringBuilder();
    int strings = 0;
    while (matched.length() < expected.length()) {
      Token token = cursor.peek();
      String piece = exact || !token.getKind().isTrivia() ? token.getText() : "";
      if (!exact) {
        piece = CharMatcher.whitespace().removeFrom(piece);
      }
      if (token.getKind() == TokenKind.ENDMARKER
          || (piece.isEmpty() && !token.getKind().isTrivia())
          || !expected.startsWith(piece, matched.length())) {
        throw error(
            node, String.format("expected '%s' but found '%s'", text, matched + token.getText()));
      }
      if (token.getKind() == TokenKind.STRING) {
        strings++;
      }
      matched.append(piece);
      cursor.next();
    }
    node.getFormatting().addSlot(key, gap);
    if (node.getKind() == NodeKind.STR) {
      node.getFormatting().setStringStyle(StringStyle.of(text, strings));
    }
  }

  @Override
  protected void clauseToken(SyntaxNode node, String text) throws AnnotationException {
    token(node, text, text, "");
  }

  @Override
  protected void eol(SyntaxNode node) throws AnnotationException {
    String gap = cursor.trivia();
    Token token = cursor.peek();
    if (token.getKind() != TokenKind.NEWLINE) {
      throw error(node, "expected the end of the line but found '" + token.getText() + "'");
    }
    cursor.next();
    node.getFormatting().addSlot(EOL, gap + token.getText());
  }

  @Override
  protected boolean enter(SyntaxNode node, SyntaxNode child, String defaultPrefix)
      throws AnnotationException {
    if (child.getParent() != node) {
      throw error(child, "parent link does not match the tree");
    }
    Formatting fmt = child.getFormatting();
    if (child.getKind() == NodeKind.EMPTY) {
      fmt.setPrefix("");
      fmt.setSuffix("");
      fmt.setSpan(Span.at(cursor.offset()), source);
      return false;
    }
    Span position = child.getPosition();
    if (position == null) {
      throw error(child, "no position was reported");
    }

    StringBuilder prefix = new StringBuilder(cursor.trivia());
    int depth = 0;
    if (child.getKind().isExpression()) {
      while (cursor.peek().is("(") && cursor.peek().getStart() < position.getStart()) {
        prefix.append(cursor.next().getText()).append(cursor.trivia());
        depth++;
      }
    }
    if (cursor.offset() != position.getStart()) {
      throw error(child, "expected to start at " + describe(position.getStart()));
    }
    fmt.setPrefix(prefix.toString());
    fmt.setParenthesisDepth(depth);
    return true;
  }

  @Override
  protected void exit(SyntaxNode node, SyntaxNode child) throws AnnotationException {
    Formatting fmt = child.getFormatting();
    Span position = child.getPosition();
    if (child.getKind().isExpression() && cursor.offset() != position.getEnd()) {
      throw error(child, "expected to end at " + describe(position.getEnd()));
    }
    fmt.setSpan(new Span(position.getStart(), cursor.offset()), source);

    StringBuilder suffix = new StringBuilder();
    for (int i = 0; i < fmt.getParenthesisDepth(); i++) {
      suffix.append(cursor.trivia());
      if (!cursor.peek().is(")")) {
        throw error(child, "unbalanced parentheses, found '" + cursor.peek().getText() + "'");
      }
      suffix.append(cursor.next().getText());
    }
    if (child.getKind().isSimpleStatement()) {
      suffix.append(statementSuffix(child));
    } else if (child.getKind() == NodeKind.BLOCK && !fmt.isInline()) {
      suffix.append(blockSuffix(fmt.getIndentation()));
    }
    fmt.setSuffix(suffix.toString());
  }

  @Override
  protected void statement(SyntaxNode suite, SyntaxNode statement) throws AnnotationException {
    if (suite.getKind() == NodeKind.BLOCK
        && !suite.getFormatting().isInline()
        && suite.getFormatting().getIndentation() == null
        && statement.getPosition() != null) {
      recordIndentation(suite, statement.getPosition().getStart());
    }
    child(suite, statement, "");
    Formatting fmt = statement.getFormatting();
    fmt.setBlankLinesBefore(countBlankLines(fmt.getPrefix()));
  }

  @Override
  protected String clauseGap(SyntaxNode owner) {
    return "";
  }

  @Override
  protected void trailingComma(SyntaxNode node, boolean required) throws AnnotationException {
    int mark = cursor.mark();
    String gap = cursor.trivia();
    if (cursor.peek().is(",")) {
      cursor.next();
      node.getFormatting().addSlot(TRAILING_COMMA, gap);
      node.getFormatting().setTrailingComma(true);
    } else if (required) {
      throw error(node, "expected a trailing comma");
    } else {
      cursor.reset(mark);
    }
  }

  @Override
  protected boolean isInline(SyntaxNode block) {
    int mark = cursor.mark();
    cursor.trivia();
    boolean inline = cursor.peek().getKind() != TokenKind.NEWLINE;
    cursor.reset(mark);
    block.getFormatting().setInline(inline);
    return inline;
  }

  @Override
  protected boolean hasParens(SyntaxNode node) {
    int mark = cursor.mark();
    cursor.trivia();
    boolean parens = cursor.peek().is("(");
    cursor.reset(mark);
    node.getFormatting().setHasParens(parens);
    return parens;
  }

  @Override
  protected AnnotationException error(SyntaxNode node, String message) {
    int offset = cursor.offset();
    return new AnnotationException(
        String.format("%s at %s: %s", node.getKind(), describe(offset), message),
        node.getKind(),
        offset);
  }

  /** The rest of a simple statement's line, or a semicolon and the space up to the next one. */
  private String statementSuffix(SyntaxNode statement) throws AnnotationException {
    StringBuilder suffix = new StringBuilder(cursor.trivia());
    if (cursor.peek().is(";")) {
      suffix.append(cursor.next().getText());
      int mark = cursor.mark();
      String rest = cursor.trivia();
      if (cursor.peek().getKind() == TokenKind.NEWLINE) {
        suffix.append(rest).append(cursor.next().getText());
      } else {
        cursor.reset(mark);
      }
    } else if (cursor.peek().getKind() == TokenKind.NEWLINE) {
      suffix.append(cursor.next().getText());
    } else {
      throw error(statement, "expected the end of the statement but found '"
          + cursor.peek().getText() + "'");
    }
    return suffix.toString();
  }

  /**
   * Consumes the comment lines after a block's last statement, up to the last one indented at
   * least as deeply as the block. Blank lines in between go with them.
   */
  private String blockSuffix(@Nullable String indentation) {
    if (indentation == null) {
      return "";
    }
    int start = cursor.offset();
    int best = cursor.mark();
    while (true) {
      String leading =
          cursor.peek().getKind() == TokenKind.WHITESPACE ? cursor.next().getText() : "";
      if (cursor.peek().getKind() == TokenKind.COMMENT) {
        cursor.next();
        if (cursor.peek().getKind() != TokenKind.NL) {
          break;
        }
        cursor.next();
        if (leading.startsWith(indentation)) {
          best = cursor.mark();
        }
      } else if (cursor.peek().getKind() == TokenKind.NL) {
        cursor.next();
      } else {
        break;
      }
    }
    cursor.reset(best);
    return source.substring(start, cursor.offset());
  }

  private void recordIndentation(SyntaxNode block, int statementStart) {
    String indentation = lineIndentation(statementStart);
    if (indentation == null) {
      return;
    }
    block.getFormatting().setIndentation(indentation);
    SyntaxNode header = block.getValue() != null ? block : block.getParent();
    if (header != null && header.getPosition() != null) {
      String outer = lineIndentation(header.getPosition().getStart());
      if (outer != null
          && indentation.length() > outer.length()
          && indentation.startsWith(outer)) {
        indentSteps.add(indentation.substring(outer.length()));
      }
    }
  }

  /** Returns the whitespace between the start of the line and {@code offset}, if that is all. */
  private @Nullable String lineIndentation(int offset) {
    int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
    String text = CharMatcher.is('\uFEFF').removeFrom(source.substring(lineStart, offset));
    return CharMatcher.anyOf(" \t\f").matchesAllOf(text) ? text : null;
  }

  private String indentUnit(String defaultIndentUnit) {
    if (indentSteps.isEmpty()) {
      return defaultIndentUnit;
    }
    return Multisets.copyHighestCountFirst(indentSteps).iterator().next();
  }

  private static int countBlankLines(String prefix) {
    int count = 0;
    int lineStart = 0;
    for (int i = 0; i < prefix.length(); i++) {
      if (prefix.charAt(i) == '\n') {
        if (CharMatcher.whitespace().matchesAllOf(prefix.substring(lineStart, i))) {
          count++;
        }
        lineStart = i + 1;
      }
    }
    return count;
  }

  /** Checks that every node's prefix, span and suffix tile the source without gaps or overlaps. */
  private void checkCoverage(SyntaxNode root) throws AnnotationException {
    Formatting fmt = root.getFormatting();
    if (fmt.getSpan().getStart() != fmt.getPrefix().length()
        || fmt.getSpan().getEnd() + fmt.getSuffix().length() != source.length()) {
      throw new AnnotationException("module does not cover the source", NodeKind.MODULE, 0);
    }
    Deque<SyntaxNode> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      SyntaxNode node = pending.pop();
      Span span = node.getFormatting().getSpan();
      int last = span.getStart();
      for (SyntaxNode child : node.getChildren()) {
        Formatting childFmt = child.getFormatting();
        Span childSpan = childFmt.getSpan();
        if (childSpan == null) {
          throw coverageError(child, "was not annotated", last);
        }
        int outerStart = childSpan.getStart() - childFmt.getPrefix().length();
        int outerEnd = childSpan.getEnd() + childFmt.getSuffix().length();
        if (outerStart < last
            || outerEnd > span.getEnd()
            || !source.startsWith(childFmt.getPrefix(), outerStart)
            || !source.startsWith(childFmt.getSuffix(), childSpan.getEnd())) {
          throw coverageError(child, "overlaps its neighbours or its parent", outerStart);
        }
        last = outerEnd;
        pending.push(child);
      }
    }
  }

  private AnnotationException coverageError(SyntaxNode node, String message, int offset) {
    return new AnnotationException(
        String.format("%s at %s %s", node.getKind(), describe(offset), message),
        node.getKind(),
        offset);
  }

  private String describe(int offset) {
    if (mappings == null) {
      mappings = new PositionMappings(UTF_8, source);
    }
    return mappings.describe(offset) + " (byte " + mappings.charToByteOffset(offset) + ")";
  }
}
