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

import com.google.common.base.Strings;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Regenerates source text from a tree.
 *
 * <p>A clean node is copied verbatim: its prefix, its original text and its suffix. A dirty node is
 * printed from its layout, reusing the text recorded in front of each of its tokens by occurrence,
 * and falling back to the layout's defaults where nothing was recorded. Its clean children are
 * still copied verbatim.
 *
 * <p>An operand that binds more loosely than its place under an operator allows, such as a new sum
 * under a product, is printed in parentheses.
 */
public final class Printer extends BaseVisitor<PrintException> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String indentUnit;
  private final StringBuilder out = new StringBuilder();
  private final Deque<Multiset<String>> occurrences = new ArrayDeque<>();

  private Printer(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  /**
   * Prints {@code tree}.
   *
   * @throws PrintException if a node was assembled inconsistently, for example with children its
   *     kind cannot have
   */
  public static String print(SyntaxTree tree) throws PrintException {
    Printer printer = new Printer(tree.getIndentUnit());
    printer.print(tree.getRoot(), "");
    return printer.out.toString();
  }

  private void print(SyntaxNode node, String defaultPrefix) throws PrintException {
    if (begin(node, defaultPrefix, false)) {
      visit(node);
      end(node, false);
    }
  }

  /**
   * Prints the text in front of {@code node}, or all of it if it is clean. Returns whether its
   * layout still has to be printed.
   */
  private boolean begin(SyntaxNode node, String defaultPrefix, boolean wrap) {
    if (node.getKind() == NodeKind.EMPTY) {
      return false;
    }
    Formatting fmt = node.getFormatting();
    String open = wrap ? "(" : "";
    String close = wrap ? ")" : "";
    if (!node.isDirty()) {
      append(fmt.getPrefix() + open + fmt.getSpanText() + close + fmt.getSuffix());
      return false;
    }
    append(fmt.getPrefix() != null ? fmt.getPrefix() : defaultPrefix);
    append(open);
    occurrences.push(HashMultiset.create());
    return true;
  }

  private void end(SyntaxNode node, boolean wrap) {
    occurrences.pop();
    if (wrap) {
      append(")");
    }
    Formatting fmt = node.getFormatting();
    if (fmt.getSuffix() != null) {
      append(fmt.getSuffix());
    } else if (node.getKind().isSimpleStatement()) {
      append("\n");
    }
  }

  @Override
  protected void token(SyntaxNode node, String key, String text, String defaultGap) {
    String gap = node.getFormatting().slot(key, occurrences.peek().add(key, 1));
    append(gap != null ? gap : defaultGap);
    append(text);
  }

  @Override
  protected void tokens(
      SyntaxNode node, String key, String text, String defaultGap, boolean exact) {
    token(node, key, text, defaultGap);
  }

  @Override
  protected void clauseToken(SyntaxNode node, String text) {
    token(node, text, text, clauseGap(node));
  }

  @Override
  protected void eol(SyntaxNode node) {
    String recorded = node.getFormatting().slot(EOL, occurrences.peek().add(EOL, 1));
    append(recorded != null ? recorded : "\n");
  }

  @Override
  protected boolean enter(SyntaxNode node, SyntaxNode child, String defaultPrefix)
      throws PrintException {
    checkParent(node, child);
    boolean wrap = Precedence.needsParentheses(node, child);
    if (wrap) {
      logger.atFinest().log("parenthesized %s under %s", child, node);
    }
    return begin(child, defaultPrefix, wrap);
  }

  @Override
  protected void exit(SyntaxNode node, SyntaxNode child) {
    end(child, Precedence.needsParentheses(node, child));
  }

  @Override
  protected void statement(SyntaxNode suite, SyntaxNode statement) throws PrintException {
    checkParent(suite, statement);
    if (!statement.getKind().isStatement()) {
      throw error(suite, statement.getKind() + " is not a statement");
    }
    print(statement, statement.isDirty() ? statementPrefix(suite, statement) : "");
  }

  @Override
  protected String clauseGap(SyntaxNode owner) {
    return (atLineStart() ? "" : "\n") + Indentation.of(owner, indentUnit);
  }

  @Override
  protected void trailingComma(SyntaxNode node, boolean required) {
    if (required || node.getFormatting().hasTrailingComma()) {
      token(node, TRAILING_COMMA, ",", "");
    }
  }

  @Override
  protected boolean isInline(SyntaxNode block) {
    return block.getFormatting().isInline();
  }

  @Override
  protected boolean hasParens(SyntaxNode node) {
    return node.getFormatting().hasParens();
  }

  @Override
  protected PrintException error(SyntaxNode node, String message) {
    return new PrintException(String.format("cannot print %s: %s", node, message));
  }

  private void checkParent(SyntaxNode parent, SyntaxNode child) throws PrintException {
    if (child.getParent() != parent) {
      throw error(child, "it is listed as a child of " + parent + " but is attached to "
          + child.getParent());
    }
  }

  /**
   * A new statement starts on a fresh line, after as many blank lines as the closest earlier
   * statement of the same kind, at the indentation of the block.
   */
  private String statementPrefix(SyntaxNode suite, SyntaxNode statement) {
    StringBuilder prefix = new StringBuilder();
    if (!atLineStart()) {
      prefix.append('\n');
    }
    prefix.append(Strings.repeat("\n", blankLinesBefore(suite, statement)));
    prefix.append(Indentation.ofBody(suite, indentUnit));
    logger.atFinest().log("synthesized prefix '%s' for %s", prefix, statement);
    return prefix.toString();
  }

  private static int blankLinesBefore(SyntaxNode suite, SyntaxNode statement) {
    for (int i = suite.indexOf(statement) - 1; i >= 0; i--) {
      SyntaxNode sibling = suite.getChild(i);
      if (sibling.getKind() == statement.getKind() && sibling.getFormatting().isAnnotated()) {
        return sibling.getFormatting().getBlankLinesBefore();
      }
    }
    return 0;
  }

  private boolean atLineStart() {
    int length = out.length();
    return length == 0
        || out.charAt(length - 1) == '\n'
        || (length == 1 && out.charAt(0) == '\uFEFF');
  }

  /** Appends text, separating it with a space where it would otherwise merge with a word. */
  private void append(String text) {
    if (!text.isEmpty()
        && out.length() > 0
        && isWordChar(out.charAt(out.length() - 1))
        && isWordChar(text.charAt(0))) {
      out.append(' ');
    }
    out.append(text);
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
