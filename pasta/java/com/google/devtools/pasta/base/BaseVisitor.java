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

import com.google.common.base.CharMatcher;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Walks a node's layout: the order of its own tokens and its children.
 *
 * <p>The layout of every kind is written once here and shared by the {@link Annotator}, which
 * consumes the tokens it describes from a token stream, and the {@link Printer}, which emits them.
 * Each token and child is given the text that should precede it when nothing was recorded.
 *
 * @param <E> the failure raised when a node does not fit its layout
 */
abstract class BaseVisitor<E extends PastaException> {
  static final String TRAILING_COMMA = "trailing_comma";
  static final String EOL = "eol";

  private static final CharMatcher INDENTATION = CharMatcher.anyOf(" \t\f");

  /** One of the node's own tokens, with the gap before it recorded under {@code key}. */
  protected abstract void token(SyntaxNode node, String key, String text, String defaultGap)
      throws E;

  /**
   * A value that may span several tokens, such as a dotted module name. When {@code exact} is
   * false, whitespace between the tokens is not part of the value.
   */
  protected abstract void tokens(
      SyntaxNode node, String key, String text, String defaultGap, boolean exact) throws E;

  /** A keyword on a new line aligned with {@code node}, such as {@code def} after decorators. */
  protected abstract void clauseToken(SyntaxNode node, String text) throws E;

  /** The end of a header line: optional trailing comment and the line break. */
  protected abstract void eol(SyntaxNode node) throws E;

  /**
   * Starts a child: the text in front of it. Returns false if the child was handled completely, in
   * which case neither its layout nor {@link #exit} follow.
   */
  protected abstract boolean enter(SyntaxNode node, SyntaxNode child, String defaultPrefix)
      throws E;

  /** Ends a child entered with {@link #enter}: the text after it. */
  protected abstract void exit(SyntaxNode node, SyntaxNode child) throws E;

  /** A statement in a module or block. */
  protected abstract void statement(SyntaxNode suite, SyntaxNode statement) throws E;

  /** The text in front of a new clause aligned with {@code owner}. */
  protected abstract String clauseGap(SyntaxNode owner);

  protected abstract void trailingComma(SyntaxNode node, boolean required) throws E;

  /** Whether a block's statements follow its colon on the same line. */
  protected abstract boolean isInline(SyntaxNode block) throws E;

  /** Whether an optional pair of parentheses is present, for class bases and import lists. */
  protected abstract boolean hasParens(SyntaxNode node) throws E;

  protected abstract E error(SyntaxNode node, String message);

  protected final void token(SyntaxNode node, String text, String defaultGap) throws E {
    token(node, text, text, defaultGap);
  }

  /** A clause aligned with its owning statement: elif, else, except, finally, decorators. */
  protected final void clause(SyntaxNode owner, SyntaxNode clause) throws E {
    child(owner, clause, clauseGap(owner));
  }

  protected final void child(SyntaxNode node, SyntaxNode child, String defaultPrefix) throws E {
    if (enter(node, child, defaultPrefix)) {
      visit(child);
      exit(node, child);
    }
  }

  protected final void visit(SyntaxNode node) throws E {
    switch (node.getKind()) {
      case MODULE:
        for (SyntaxNode statement : node.getChildren()) {
          statement(node, statement);
        }
        break;
      case BLOCK:
        visitBlock(node);
        break;
      case EXPR_STMT:
        expectChildren(node, 1, 1);
        child(node, node.getChild(0), "");
        break;
      case ASSIGN:
        visitAssign(node);
        break;
      case AUG_ASSIGN:
        expectChildren(node, 2, 2);
        child(node, node.getChild(0), "");
        token(node, value(node), " ");
        child(node, node.getChild(1), " ");
        break;
      case ANN_ASSIGN:
        expectChildren(node, 2, 3);
        child(node, node.getChild(0), "");
        token(node, ":", "");
        child(node, node.getChild(1), " ");
        if (node.getChildCount() == 3) {
          token(node, "=", " ");
          child(node, node.getChild(2), " ");
        }
        break;
      case PASS:
        keywordOnly(node, "pass");
        break;
      case BREAK:
        keywordOnly(node, "break");
        break;
      case CONTINUE:
        keywordOnly(node, "continue");
        break;
      case RETURN:
        expectChildren(node, 0, 1);
        token(node, "return", "");
        if (node.getChildCount() == 1) {
          child(node, node.getChild(0), " ");
        }
        break;
      case DELETE:
        keywordAndList(node, "del");
        break;
      case RAISE:
        visitRaise(node);
        break;
      case GLOBAL:
        keywordAndList(node, "global");
        break;
      case NONLOCAL:
        keywordAndList(node, "nonlocal");
        break;
      case ASSERT:
        expectChildren(node, 1, 2);
        token(node, "assert", "");
        child(node, node.getChild(0), " ");
        if (node.getChildCount() == 2) {
          token(node, ",", "");
          child(node, node.getChild(1), " ");
        }
        break;
      case IMPORT:
        expectChildren(node, 1, Integer.MAX_VALUE);
        token(node, "import", "");
        commaSeparated(node, node.getChildren(), " ");
        break;
      case IMPORT_FROM:
        visitImportFrom(node);
        break;
      case PRINT:
        visitPrint(node);
        break;
      case IF:
        visitIf(node);
        break;
      case WHILE:
        expectChildren(node, 2, 3);
        token(node, "while", "");
        child(node, node.getChild(0), " ");
        child(node, node.getChild(1), "");
        optionalClause(node, 2);
        break;
      case FOR:
        expectChildren(node, 3, 4);
        token(node, "for", "");
        child(node, node.getChild(0), " ");
        token(node, "in", " ");
        child(node, node.getChild(1), " ");
        child(node, node.getChild(2), "");
        optionalClause(node, 3);
        break;
      case WITH:
        expectChildren(node, 2, Integer.MAX_VALUE);
        token(node, "with", "");
        List<SyntaxNode> items = node.getChildren();
        commaSeparated(node, items.subList(0, items.size() - 1), " ");
        child(node, last(node), "");
        break;
      case TRY:
        expectChildren(node, 2, Integer.MAX_VALUE);
        token(node, "try", "");
        child(node, node.getChild(0), "");
        for (int i = 1; i < node.getChildCount(); i++) {
          clause(node, node.getChild(i));
        }
        break;
      case FUNCTION_DEF:
        visitFunctionDef(node);
        break;
      case CLASS_DEF:
        visitClassDef(node);
        break;
      case ALIAS:
        expectChildren(node, 0, 1);
        tokens(node, "name", value(node), "", false);
        if (node.getChildCount() == 1) {
          token(node, "as", " ");
          child(node, node.getChild(0), " ");
        }
        break;
      case EXCEPT_HANDLER:
        expectChildren(node, 1, 2);
        token(node, "except", "");
        if (node.getChildCount() == 2) {
          child(node, node.getChild(0), " ");
          if (node.getValue() != null) {
            token(node, "as", " ");
            token(node, "name", node.getValue(), " ");
          }
        }
        child(node, last(node), "");
        break;
      case WITH_ITEM:
        expectChildren(node, 1, 2);
        child(node, node.getChild(0), "");
        if (node.getChildCount() == 2) {
          token(node, "as", " ");
          child(node, node.getChild(1), " ");
        }
        break;
      case DECORATOR:
        expectChildren(node, 1, 1);
        token(node, "@", "");
        child(node, node.getChild(0), "");
        eol(node);
        break;
      case PARAMETERS:
        bracketed(node, "()".equals(node.getValue()) ? "(" : null, node.getChildren(), false);
        break;
      case PARAM:
        visitParam(node);
        break;
      case KEYWORD:
        expectChildren(node, 1, 1);
        token(node, "name", value(node), "");
        token(node, "=", "");
        child(node, node.getChild(0), "");
        break;
      case COMPREHENSION:
        expectChildren(node, 2, Integer.MAX_VALUE);
        token(node, "for", "");
        child(node, node.getChild(0), " ");
        token(node, "in", " ");
        child(node, node.getChild(1), " ");
        for (int i = 2; i < node.getChildCount(); i++) {
          token(node, "if", " ");
          child(node, node.getChild(i), " ");
        }
        break;
      case DICT_ENTRY:
        expectChildren(node, 1, 2);
        child(node, node.getChild(0), "");
        if (node.getChildCount() == 2) {
          token(node, ":", "");
          child(node, node.getChild(1), " ");
        }
        break;
      case OPERATOR:
        expectChildren(node, 0, 0);
        tokens(node, "operator", value(node), "", false);
        break;
      case SLICE:
        visitSlice(node);
        break;
      case NAME:
      case NUM:
        expectChildren(node, 0, 0);
        token(node, "value", value(node), "");
        break;
      case STR:
        expectChildren(node, 0, 0);
        tokens(node, "value", value(node), "", true);
        break;
      case BOOL_OP:
        expectChildren(node, 2, Integer.MAX_VALUE);
        child(node, node.getChild(0), "");
        for (int i = 1; i < node.getChildCount(); i++) {
          token(node, value(node), " ");
          child(node, node.getChild(i), " ");
        }
        break;
      case COMPARE:
        visitCompare(node);
        break;
      case UNARY_OP:
        expectChildren(node, 1, 1);
        token(node, value(node), "");
        child(node, node.getChild(0), value(node).equals("not") ? " " : "");
        break;
      case IF_EXP:
        expectChildren(node, 3, 3);
        child(node, node.getChild(0), "");
        token(node, "if", " ");
        child(node, node.getChild(1), " ");
        token(node, "else", " ");
        child(node, node.getChild(2), " ");
        break;
      case LAMBDA:
        expectChildren(node, 2, 2);
        token(node, "lambda", "");
        child(node, node.getChild(0), node.getChild(0).getChildCount() > 0 ? " " : "");
        token(node, ":", "");
        child(node, node.getChild(1), " ");
        break;
      case TUPLE:
        if (node.getValue() == null && node.getChildCount() == 0) {
          throw error(node, "an empty tuple needs parentheses");
        }
        bracketed(
            node,
            "()".equals(node.getValue()) ? "(" : null,
            node.getChildren(),
            node.getChildCount() == 1);
        break;
      case LIST:
        bracketed(node, "[", node.getChildren(), false);
        break;
      case SET:
        expectChildren(node, 1, Integer.MAX_VALUE);
        bracketed(node, "{", node.getChildren(), false);
        break;
      case DICT:
        bracketed(node, "{", node.getChildren(), false);
        break;
      case LIST_COMP:
        comprehension(node, "[");
        break;
      case SET_COMP:
      case DICT_COMP:
        comprehension(node, "{");
        break;
      case GENERATOR_EXP:
        comprehension(node, "()".equals(node.getValue()) ? "(" : null);
        break;
      case STARRED:
        expectChildren(node, 1, 1);
        token(node, value(node), "");
        child(node, node.getChild(0), "");
        break;
      case YIELD:
        expectChildren(node, 0, 1);
        token(node, "yield", "");
        if ("from".equals(node.getValue())) {
          token(node, "from", " ");
        }
        if (node.getChildCount() == 1) {
          child(node, node.getChild(0), " ");
        }
        break;
      case EMPTY:
        expectChildren(node, 0, 0);
        break;
      case ATTRIBUTE:
      case CALL:
      case SUBSCRIPT:
      case BIN_OP:
        visitLeftNested(node);
        break;
    }
  }

  /** Kinds whose layout starts with their first child, which is often of such a kind again. */
  private static boolean isLeftNested(NodeKind kind) {
    switch (kind) {
      case ATTRIBUTE:
      case CALL:
      case SUBSCRIPT:
      case BIN_OP:
        return true;
      default:
        return false;
    }
  }

  /**
   * Walks a chain such as {@code a + b + c} or {@code a.b().c} whose first children nest to the
   * left, without recursing once per link.
   */
  private void visitLeftNested(SyntaxNode node) throws E {
    Deque<SyntaxNode> entered = new ArrayDeque<>();
    SyntaxNode current = node;
    while (true) {
      expectChildren(current, 1, current.getKind() == NodeKind.BIN_OP ? 2 : Integer.MAX_VALUE);
      SyntaxNode first = current.getChild(0);
      if (!isLeftNested(first.getKind())) {
        child(current, first, "");
        break;
      }
      if (!enter(current, first, "")) {
        break;
      }
      entered.push(current);
      current = first;
    }
    while (true) {
      visitAfterFirstChild(current);
      if (entered.isEmpty()) {
        return;
      }
      SyntaxNode parent = entered.pop();
      exit(parent, current);
      current = parent;
    }
  }

  private void visitAfterFirstChild(SyntaxNode node) throws E {
    switch (node.getKind()) {
      case ATTRIBUTE:
        expectChildren(node, 1, 1);
        token(node, ".", "");
        token(node, "attr", value(node), "");
        break;
      case CALL:
        List<SyntaxNode> args = node.getChildren();
        bracketed(node, "(", args.subList(1, args.size()), false);
        break;
      case SUBSCRIPT:
        expectChildren(node, 2, 2);
        token(node, "[", "");
        child(node, node.getChild(1), "");
        token(node, "]", "");
        break;
      case BIN_OP:
        expectChildren(node, 2, 2);
        token(node, value(node), " ");
        child(node, node.getChild(1), " ");
        break;
      default:
        throw new IllegalArgumentException(node.getKind().toString());
    }
  }

  private void visitBlock(SyntaxNode node) throws E {
    expectChildren(node, 1, Integer.MAX_VALUE);
    if (node.getValue() != null) {
      token(node, node.getValue(), "");
    }
    token(node, ":", "");
    if (!isInline(node)) {
      eol(node);
    }
    for (SyntaxNode statement : node.getChildren()) {
      statement(node, statement);
    }
  }

  /** Walks an if statement and its chain of elif clauses without recursing once per clause. */
  private void visitIf(SyntaxNode node) throws E {
    Deque<SyntaxNode> entered = new ArrayDeque<>();
    SyntaxNode current = node;
    while (true) {
      expectChildren(current, 2, 3);
      token(current, current.getValue() == null ? "if" : current.getValue(), "");
      child(current, current.getChild(0), " ");
      child(current, current.getChild(1), "");
      if (current.getChildCount() < 3) {
        break;
      }
      SyntaxNode orElse = current.getChild(2);
      if (orElse.getKind() != NodeKind.IF) {
        clause(current, orElse);
        break;
      }
      if (!enter(current, orElse, clauseGap(current))) {
        break;
      }
      entered.push(current);
      current = orElse;
    }
    while (!entered.isEmpty()) {
      SyntaxNode owner = entered.pop();
      exit(owner, current);
      current = owner;
    }
  }

  private void visitAssign(SyntaxNode node) throws E {
    expectChildren(node, 2, Integer.MAX_VALUE);
    int last = node.getChildCount() - 1;
    for (int i = 0; i < last; i++) {
      child(node, node.getChild(i), i == 0 ? "" : " ");
      token(node, "=", " ");
    }
    child(node, node.getChild(last), " ");
  }

  private void visitRaise(SyntaxNode node) throws E {
    expectChildren(node, 0, 3);
    token(node, "raise", "");
    if (node.getChildCount() == 0) {
      return;
    }
    child(node, node.getChild(0), " ");
    if (node.getChildCount() > 1 && node.getValue() == null) {
      throw error(node, "a raise with several operands needs a separator");
    }
    for (int i = 1; i < node.getChildCount(); i++) {
      if (node.getValue().equals(",")) {
        token(node, ",", "");
      } else {
        token(node, node.getValue(), " ");
      }
      child(node, node.getChild(i), " ");
    }
  }

  private void visitImportFrom(SyntaxNode node) throws E {
    expectChildren(node, 1, Integer.MAX_VALUE);
    token(node, "from", "");
    tokens(node, "module", value(node), " ", false);
    token(node, "import", " ");
    boolean parens = hasParens(node);
    if (parens) {
      token(node, "(", " ");
    }
    commaSeparated(node, node.getChildren(), parens ? "" : " ");
    if (parens) {
      trailingComma(node, false);
      token(node, ")", "");
    }
  }

  private void visitPrint(SyntaxNode node) throws E {
    token(node, "print", "");
    List<SyntaxNode> values = node.getChildren();
    if (">>".equals(node.getValue())) {
      expectChildren(node, 1, Integer.MAX_VALUE);
      token(node, ">>", " ");
      child(node, values.get(0), "");
      for (SyntaxNode value : values.subList(1, values.size())) {
        token(node, ",", "");
        child(node, value, " ");
      }
    } else {
      commaSeparated(node, values, " ");
    }
    if (!values.isEmpty()) {
      trailingComma(node, false);
    }
  }

  private void visitFunctionDef(SyntaxNode node) throws E {
    int i = decorators(node);
    if (i > 0) {
      clauseToken(node, "def");
    } else {
      token(node, "def", "");
    }
    token(node, "name", value(node), " ");
    if (i >= node.getChildCount() || node.getChild(i).getKind() != NodeKind.PARAMETERS) {
      throw error(node, "a function needs parameters");
    }
    child(node, node.getChild(i++), "");
    if (i == node.getChildCount() - 2) {
      token(node, "->", " ");
      child(node, node.getChild(i++), " ");
    }
    expectBody(node, i);
  }

  private void visitClassDef(SyntaxNode node) throws E {
    int i = decorators(node);
    if (i > 0) {
      clauseToken(node, "class");
    } else {
      token(node, "class", "");
    }
    token(node, "name", value(node), " ");
    List<SyntaxNode> bases = node.getChildren().subList(i, Math.max(i, node.getChildCount() - 1));
    if (hasParens(node) || !bases.isEmpty()) {
      bracketed(node, "(", bases, false);
    }
    expectBody(node, i + bases.size());
  }

  /** Visits the leading decorators of a definition and returns how many there are. */
  private int decorators(SyntaxNode node) throws E {
    int i = 0;
    while (i < node.getChildCount() && node.getChild(i).getKind() == NodeKind.DECORATOR) {
      if (i == 0) {
        child(node, node.getChild(i), "");
      } else {
        clause(node, node.getChild(i));
      }
      i++;
    }
    return i;
  }

  private void expectBody(SyntaxNode node, int index) throws E {
    if (index != node.getChildCount() - 1 || last(node).getKind() != NodeKind.BLOCK) {
      throw error(node, "expected a body as the last child");
    }
    child(node, last(node), "");
  }

  private void visitParam(SyntaxNode node) throws E {
    expectChildren(node, 2, 2);
    tokens(node, "name", value(node), "", false);
    SyntaxNode annotation = node.getChild(0);
    SyntaxNode defaultValue = node.getChild(1);
    boolean annotated = annotation.getKind() != NodeKind.EMPTY;
    if (annotated) {
      token(node, ":", "");
    }
    child(node, annotation, " ");
    if (defaultValue.getKind() != NodeKind.EMPTY) {
      token(node, "=", annotated ? " " : "");
    }
    child(node, defaultValue, annotated ? " " : "");
  }

  private void visitSlice(SyntaxNode node) throws E {
    expectChildren(node, 3, 3);
    boolean extended = "::".equals(node.getValue());
    if (!extended && node.getChild(2).getKind() != NodeKind.EMPTY) {
      throw error(node, "a slice step needs a second colon");
    }
    child(node, node.getChild(0), "");
    token(node, ":", "");
    child(node, node.getChild(1), "");
    if (extended) {
      token(node, ":", "");
    }
    child(node, node.getChild(2), "");
  }

  private void visitCompare(SyntaxNode node) throws E {
    if (node.getChildCount() < 3 || node.getChildCount() % 2 == 0) {
      throw error(node, "a comparison alternates operands and operators");
    }
    child(node, node.getChild(0), "");
    for (int i = 1; i < node.getChildCount(); i += 2) {
      if (node.getChild(i).getKind() != NodeKind.OPERATOR) {
        throw error(node, "expected an operator at child " + i);
      }
      child(node, node.getChild(i), " ");
      child(node, node.getChild(i + 1), " ");
    }
  }

  private void comprehension(SyntaxNode node, @Nullable String open) throws E {
    expectChildren(node, 2, Integer.MAX_VALUE);
    if (open != null) {
      token(node, open, "");
    }
    child(node, node.getChild(0), "");
    for (int i = 1; i < node.getChildCount(); i++) {
      if (node.getChild(i).getKind() != NodeKind.COMPREHENSION) {
        throw error(node, "expected a comprehension at child " + i);
      }
      child(node, node.getChild(i), " ");
    }
    if (open != null) {
      token(node, closing(open), "");
    }
  }

  /** Elements separated by commas, optionally between brackets and with a trailing comma. */
  private void bracketed(
      SyntaxNode node, @Nullable String open, List<SyntaxNode> elements, boolean needsComma)
      throws E {
    if (open != null) {
      token(node, open, "");
    }
    commaSeparated(node, elements, "");
    if (!elements.isEmpty()) {
      trailingComma(node, needsComma);
    }
    if (open != null) {
      token(node, closing(open), "");
    }
  }

  private void commaSeparated(SyntaxNode node, List<SyntaxNode> elements, String firstPrefix)
      throws E {
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        token(node, ",", "");
      }
      child(node, elements.get(i), i == 0 ? firstPrefix : elementGap(elements, i));
    }
  }

  /**
   * The text in front of an element after a comma: a fresh line at the indentation of the closest
   * earlier element that starts its own line, or a single space.
   */
  private static String elementGap(List<SyntaxNode> elements, int index) {
    for (int i = index - 1; i >= 0; i--) {
      String prefix = elements.get(i).getFormatting().getPrefix();
      if (prefix != null) {
        int newline = prefix.lastIndexOf('\n');
        if (newline < 0) {
          return " ";
        }
        String line = prefix.substring(newline + 1);
        return "\n" + line.substring(0, line.length() - INDENTATION.trimLeadingFrom(line).length());
      }
    }
    return " ";
  }

  private void keywordOnly(SyntaxNode node, String keyword) throws E {
    expectChildren(node, 0, 0);
    token(node, keyword, "");
  }

  private void keywordAndList(SyntaxNode node, String keyword) throws E {
    expectChildren(node, 1, Integer.MAX_VALUE);
    token(node, keyword, "");
    commaSeparated(node, node.getChildren(), " ");
    trailingComma(node, false);
  }

  private void optionalClause(SyntaxNode node, int index) throws E {
    if (node.getChildCount() > index) {
      clause(node, node.getChild(index));
    }
  }

  private void expectChildren(SyntaxNode node, int min, int max) throws E {
    int count = node.getChildCount();
    if (count < min || count > max) {
      throw error(
          node,
          String.format(
              "expected %s children but found %d",
              min == max
                  ? String.valueOf(min)
                  : max == Integer.MAX_VALUE ? min + "+" : min + "-" + max,
              count));
    }
  }

  private String value(SyntaxNode node) throws E {
    if (node.getValue() == null) {
      throw error(node, "missing value");
    }
    return node.getValue();
  }

  private static SyntaxNode last(SyntaxNode node) {
    return node.getChild(node.getChildCount() - 1);
  }

  private static String closing(String open) {
    switch (open) {
      case "(":
        return ")";
      case "[":
        return "]";
      case "{":
        return "}";
      default:
        throw new IllegalArgumentException(open);
    }
  }
}
