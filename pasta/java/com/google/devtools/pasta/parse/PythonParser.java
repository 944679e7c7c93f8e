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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.devtools.pasta.base.NodeKind;
import com.google.devtools.pasta.base.SyntaxNode;
import com.google.devtools.pasta.base.Token;
import com.google.devtools.pasta.base.TokenKind;
import com.google.devtools.pasta.util.Span;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A recursive-descent parser for Python 2.7 and 3.8 statements and expressions.
 *
 * <p>The parser works on the significant tokens only and reports, for every node, the span of its
 * own tokens. Parentheses that merely group an expression are not part of its span.
 */
final class PythonParser {
  private static final ImmutableSet<String> AUGMENTED_ASSIGNMENTS =
      ImmutableSet.of(
          "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=", "@=");

  private static final ImmutableSet<String> COMPARISONS =
      ImmutableSet.of("<", ">", "==", ">=", "<=", "!=", "in", "is");

  /** Binary operators by increasing precedence. */
  private static final ImmutableList<ImmutableSet<String>> BINARY_OPERATORS =
      ImmutableList.of(
          ImmutableSet.of("|"),
          ImmutableSet.of("^"),
          ImmutableSet.of("&"),
          ImmutableSet.of("<<", ">>"),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "/", "%", "//", "@"));

  /** Keywords that can start an expression. */
  private static final ImmutableSet<String> EXPRESSION_KEYWORDS =
      ImmutableSet.of("not", "lambda", "None", "True", "False");

  private static final ImmutableSet<String> ATOM_KEYWORDS =
      ImmutableSet.of("None", "True", "False");

  /** Limits on nesting, close to those of CPython's own parser. */
  private static final int MAX_INDENTATION_LEVELS = 100;

  private static final int MAX_EXPRESSION_NESTING = 100;

  private final String source;
  private final ImmutableList<Token> tokens;
  private final GrammarVersion version;
  private boolean printStatement;
  private int index;
  private int indentationLevels;
  private int expressionNesting;

  PythonParser(String source, List<Token> allTokens, GrammarVersion version) {
    this.source = source;
    this.version = version;
    this.printStatement = !version.isPython3();
    ImmutableList.Builder<Token> significant = ImmutableList.builder();
    for (Token token : allTokens) {
      switch (token.getKind()) {
        case COMMENT:
        case NL:
        case WHITESPACE:
        case CONTINUATION:
          break;
        default:
          significant.add(token);
      }
    }
    this.tokens = significant.build();
  }

  SyntaxNode parseModule() throws GrammarException {
    List<SyntaxNode> statements = new ArrayList<>();
    while (peek().getKind() != TokenKind.ENDMARKER) {
      statements.addAll(statement());
    }
    return SyntaxNode.parsed(
        NodeKind.MODULE, null, new Span(0, source.length()), statements);
  }

  // Statements

  private List<SyntaxNode> statement() throws GrammarException {
    Token first = peek();
    if (first.getKind() == TokenKind.INDENT) {
      throw error("unexpected indent");
    }
    if (first.getKind() == TokenKind.NAME) {
      switch (first.getText()) {
        case "if":
          return ImmutableList.of(ifStatement());
        case "while":
          return ImmutableList.of(whileStatement());
        case "for":
          return ImmutableList.of(forStatement());
        case "try":
          return ImmutableList.of(tryStatement());
        case "with":
          return ImmutableList.of(withStatement());
        case "def":
        case "class":
          return ImmutableList.of(definition(ImmutableList.of(), first.getStart()));
        case "async":
          if (version.isKeyword("async")) {
            throw error("async statements are not supported");
          }
          break;
        default:
          break;
      }
    } else if (at("@")) {
      return ImmutableList.of(decorated());
    }
    return simpleLine();
  }

  /** One or more small statements separated by semicolons, up to the end of the line. */
  private List<SyntaxNode> simpleLine() throws GrammarException {
    List<SyntaxNode> statements = new ArrayList<>();
    statements.add(smallStatement());
    while (accept(";")) {
      if (peek().getKind() == TokenKind.NEWLINE) {
        break;
      }
      statements.add(smallStatement());
    }
    expectKind(TokenKind.NEWLINE, "the end of the line");
    return statements;
  }

  private SyntaxNode block(@Nullable String keyword) throws GrammarException {
    int start = peek().getStart();
    if (keyword != null) {
      expect(keyword);
    }
    expect(":");
    List<SyntaxNode> body = new ArrayList<>();
    if (peek().getKind() == TokenKind.NEWLINE) {
      next();
      expectKind(TokenKind.INDENT, "an indented block");
      if (++indentationLevels > MAX_INDENTATION_LEVELS) {
        throw error("too many levels of indentation");
      }
      while (peek().getKind() != TokenKind.DEDENT && peek().getKind() != TokenKind.ENDMARKER) {
        body.addAll(statement());
      }
      expectKind(TokenKind.DEDENT, "a dedent");
      indentationLevels--;
    } else {
      body.addAll(simpleLine());
    }
    return compound(NodeKind.BLOCK, keyword, start, body);
  }

  /** An if statement. Each elif is an if nested as the last child of the one before it. */
  private SyntaxNode ifStatement() throws GrammarException {
    List<Integer> starts = new ArrayList<>();
    List<List<SyntaxNode>> clauses = new ArrayList<>();
    String keyword = "if";
    while (true) {
      starts.add(expect(keyword).getStart());
      List<SyntaxNode> children = new ArrayList<>();
      children.add(test());
      children.add(block(null));
      clauses.add(children);
      if (at("elif")) {
        keyword = "elif";
        continue;
      }
      if (at("else")) {
        children.add(block("else"));
      }
      break;
    }
    SyntaxNode statement = null;
    for (int i = clauses.size() - 1; i >= 0; i--) {
      List<SyntaxNode> children = clauses.get(i);
      if (statement != null) {
        children.add(statement);
      }
      statement = compound(NodeKind.IF, i == 0 ? null : "elif", starts.get(i), children);
    }
    return statement;
  }

  private SyntaxNode whileStatement() throws GrammarException {
    int start = expect("while").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    children.add(test());
    children.add(block(null));
    if (at("else")) {
      children.add(block("else"));
    }
    return compound(NodeKind.WHILE, null, start, children);
  }

  private SyntaxNode forStatement() throws GrammarException {
    int start = expect("for").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    children.add(exprList());
    expect("in");
    children.add(testList(false));
    children.add(block(null));
    if (at("else")) {
      children.add(block("else"));
    }
    return compound(NodeKind.FOR, null, start, children);
  }

  private SyntaxNode tryStatement() throws GrammarException {
    int start = expect("try").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    children.add(block(null));
    boolean handled = false;
    while (at("except")) {
      children.add(exceptHandler());
      handled = true;
    }
    if (handled && at("else")) {
      children.add(block("else"));
    }
    if (at("finally")) {
      children.add(block("finally"));
    } else if (!handled) {
      throw error("expected 'except' or 'finally'");
    }
    return compound(NodeKind.TRY, null, start, children);
  }

  private SyntaxNode exceptHandler() throws GrammarException {
    int start = expect("except").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    String name = null;
    if (!at(":")) {
      children.add(test());
      if (accept("as")) {
        name = expectName().getText();
      } else if (at(",")) {
        throw error("'except type, name' is not supported, use 'except type as name'");
      }
    }
    children.add(block(null));
    return compound(NodeKind.EXCEPT_HANDLER, name, start, children);
  }

  private SyntaxNode withStatement() throws GrammarException {
    int start = expect("with").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    do {
      int itemStart = peek().getStart();
      List<SyntaxNode> item = new ArrayList<>();
      item.add(test());
      if (accept("as")) {
        item.add(expr());
      }
      children.add(node(NodeKind.WITH_ITEM, null, itemStart, item));
    } while (accept(","));
    children.add(block(null));
    return compound(NodeKind.WITH, null, start, children);
  }

  private SyntaxNode decorated() throws GrammarException {
    int start = peek().getStart();
    List<SyntaxNode> decorators = new ArrayList<>();
    while (at("@")) {
      int decoratorStart = next().getStart();
      SyntaxNode expression = test();
      expectKind(TokenKind.NEWLINE, "the end of the line");
      decorators.add(node(NodeKind.DECORATOR, null, decoratorStart, ImmutableList.of(expression)));
    }
    if (!at("def") && !at("class")) {
      throw error("expected 'def' or 'class' after decorators");
    }
    return definition(decorators, start);
  }

  private SyntaxNode definition(List<SyntaxNode> decorators, int start) throws GrammarException {
    List<SyntaxNode> children = new ArrayList<>(decorators);
    if (accept("def")) {
      String name = expectName().getText();
      children.add(parameters());
      if (accept("->")) {
        children.add(test());
      }
      children.add(block(null));
      return compound(NodeKind.FUNCTION_DEF, name, start, children);
    }
    expect("class");
    String name = expectName().getText();
    if (accept("(")) {
      children.addAll(arguments(")"));
      expect(")");
    }
    children.add(block(null));
    return compound(NodeKind.CLASS_DEF, name, start, children);
  }

  private SyntaxNode parameters() throws GrammarException {
    int start = expect("(").getStart();
    List<SyntaxNode> params = parameterList(")", version.isPython3());
    expect(")");
    return node(NodeKind.PARAMETERS, "()", start, params);
  }

  private List<SyntaxNode> parameterList(String closer, boolean annotations)
      throws GrammarException {
    List<SyntaxNode> params = new ArrayList<>();
    while (!at(closer)) {
      int start = peek().getStart();
      String name;
      if (accept("*")) {
        name = at(",") || at(closer) ? "*" : "*" + expectName().getText();
      } else if (accept("**")) {
        name = "**" + expectName().getText();
      } else if (version.isPython3() && accept("/")) {
        name = "/";
      } else if (at("(")) {
        throw error("tuple parameters are not supported");
      } else {
        name = expectName().getText();
      }
      SyntaxNode annotation = empty();
      SyntaxNode defaultValue = empty();
      if (annotations && accept(":")) {
        annotation = test();
      }
      if (accept("=")) {
        defaultValue = test();
      }
      params.add(node(NodeKind.PARAM, name, start, ImmutableList.of(annotation, defaultValue)));
      if (!accept(",")) {
        break;
      }
    }
    return params;
  }

  private SyntaxNode smallStatement() throws GrammarException {
    Token first = peek();
    int start = first.getStart();
    if (first.getKind() == TokenKind.NAME && isReserved(first.getText())) {
      switch (first.getText()) {
        case "pass":
          next();
          return node(NodeKind.PASS, null, start, ImmutableList.of());
        case "break":
          next();
          return node(NodeKind.BREAK, null, start, ImmutableList.of());
        case "continue":
          next();
          return node(NodeKind.CONTINUE, null, start, ImmutableList.of());
        case "return":
          next();
          return node(
              NodeKind.RETURN,
              null,
              start,
              startsExpression() ? ImmutableList.of(testList(true)) : ImmutableList.of());
        case "del":
          next();
          return node(NodeKind.DELETE, null, start, expressions());
        case "raise":
          return raiseStatement();
        case "global":
        case "nonlocal":
          next();
          return node(
              first.getText().equals("global") ? NodeKind.GLOBAL : NodeKind.NONLOCAL,
              null,
              start,
              names());
        case "assert":
          next();
          List<SyntaxNode> operands = new ArrayList<>();
          operands.add(test());
          if (accept(",")) {
            operands.add(test());
          }
          return node(NodeKind.ASSERT, null, start, operands);
        case "import":
          return importStatement();
        case "from":
          return importFrom();
        case "print":
          return printStatement();
        case "exec":
          throw error("exec statements are not supported");
        default:
          break;
      }
    }
    return expressionStatement();
  }

  private SyntaxNode expressionStatement() throws GrammarException {
    int start = peek().getStart();
    SyntaxNode first = at("yield") ? yieldExpression() : testList(true);
    if (peek().getKind() == TokenKind.OP && AUGMENTED_ASSIGNMENTS.contains(peek().getText())) {
      String op = next().getText();
      SyntaxNode value = at("yield") ? yieldExpression() : testList(false);
      return node(NodeKind.AUG_ASSIGN, op, start, ImmutableList.of(first, value));
    }
    if (version.isPython3() && accept(":")) {
      List<SyntaxNode> children = new ArrayList<>();
      children.add(first);
      children.add(test());
      if (accept("=")) {
        children.add(at("yield") ? yieldExpression() : testList(true));
      }
      return node(NodeKind.ANN_ASSIGN, null, start, children);
    }
    if (at("=")) {
      List<SyntaxNode> children = new ArrayList<>();
      children.add(first);
      while (accept("=")) {
        children.add(at("yield") ? yieldExpression() : testList(true));
      }
      return node(NodeKind.ASSIGN, null, start, children);
    }
    return node(NodeKind.EXPR_STMT, null, start, ImmutableList.of(first));
  }

  private SyntaxNode raiseStatement() throws GrammarException {
    int start = expect("raise").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    String separator = null;
    if (startsExpression()) {
      children.add(test());
      if (version.isPython3()) {
        if (accept("from")) {
          separator = "from";
          children.add(test());
        }
      } else if (accept(",")) {
        separator = ",";
        children.add(test());
        if (accept(",")) {
          children.add(test());
        }
      }
    }
    return node(NodeKind.RAISE, separator, start, children);
  }

  private SyntaxNode importStatement() throws GrammarException {
    int start = expect("import").getStart();
    List<SyntaxNode> aliases = new ArrayList<>();
    do {
      int aliasStart = peek().getStart();
      String name = dottedName();
      aliases.add(alias(name, aliasStart));
    } while (accept(","));
    return node(NodeKind.IMPORT, null, start, aliases);
  }

  private SyntaxNode importFrom() throws GrammarException {
    int start = expect("from").getStart();
    StringBuilder module = new StringBuilder();
    while (at(".") || at("...")) {
      module.append(next().getText());
    }
    if (module.length() == 0 || !at("import")) {
      module.append(dottedName());
    }
    expect("import");
    List<SyntaxNode> aliases = new ArrayList<>();
    if (at("*")) {
      int starStart = next().getStart();
      aliases.add(node(NodeKind.ALIAS, "*", starStart, ImmutableList.of()));
    } else {
      boolean parens = accept("(");
      do {
        if (parens && at(")")) {
          break;
        }
        int aliasStart = peek().getStart();
        aliases.add(alias(expectName().getText(), aliasStart));
      } while (accept(","));
      if (parens) {
        expect(")");
      }
    }
    if (aliases.isEmpty()) {
      throw error("expected a name to import");
    }
    if (module.toString().equals("__future__")) {
      for (SyntaxNode alias : aliases) {
        if ("print_function".equals(alias.getValue())) {
          printStatement = false;
        }
      }
    }
    return node(NodeKind.IMPORT_FROM, module.toString(), start, aliases);
  }

  private SyntaxNode alias(String name, int start) throws GrammarException {
    if (accept("as")) {
      Token asName = expectName();
      return node(NodeKind.ALIAS, name, start, ImmutableList.of(name(asName)));
    }
    return node(NodeKind.ALIAS, name, start, ImmutableList.of());
  }

  private String dottedName() throws GrammarException {
    StringBuilder name = new StringBuilder(expectName().getText());
    while (accept(".")) {
      name.append('.').append(expectName().getText());
    }
    return name.toString();
  }

  private SyntaxNode printStatement() throws GrammarException {
    int start = expect("print").getStart();
    List<SyntaxNode> values = new ArrayList<>();
    String value = null;
    if (accept(">>")) {
      value = ">>";
      values.add(test());
      while (accept(",")) {
        if (!startsExpression()) {
          break;
        }
        values.add(test());
      }
    } else if (startsExpression()) {
      values.add(test());
      while (accept(",")) {
        if (!startsExpression()) {
          break;
        }
        values.add(test());
      }
    }
    return node(NodeKind.PRINT, value, start, values);
  }

  /** Comma-separated expressions, allowing a trailing comma, as in {@code del}. */
  private List<SyntaxNode> expressions() throws GrammarException {
    List<SyntaxNode> result = new ArrayList<>();
    do {
      result.add(expr());
    } while (accept(",") && startsExpression());
    return result;
  }

  private List<SyntaxNode> names() throws GrammarException {
    List<SyntaxNode> result = new ArrayList<>();
    do {
      result.add(name(expectName()));
    } while (accept(","));
    return result;
  }

  // Expressions

  /** Expressions separated by commas; a tuple if there is a comma. */
  private SyntaxNode testList(boolean allowStar) throws GrammarException {
    int start = peek().getStart();
    SyntaxNode first = allowStar ? testOrStar() : test();
    if (!at(",")) {
      return first;
    }
    List<SyntaxNode> elements = new ArrayList<>();
    elements.add(first);
    while (accept(",")) {
      if (!startsExpression()) {
        break;
      }
      elements.add(allowStar ? testOrStar() : test());
    }
    return node(NodeKind.TUPLE, null, start, elements);
  }

  /** Assignment targets of {@code for} loops and comprehensions. */
  private SyntaxNode exprList() throws GrammarException {
    int start = peek().getStart();
    SyntaxNode first = exprOrStar();
    if (!at(",")) {
      return first;
    }
    List<SyntaxNode> elements = new ArrayList<>();
    elements.add(first);
    while (accept(",")) {
      if (!startsExpression()) {
        break;
      }
      elements.add(exprOrStar());
    }
    return node(NodeKind.TUPLE, null, start, elements);
  }

  private SyntaxNode testOrStar() throws GrammarException {
    if (at("*")) {
      int start = next().getStart();
      return node(NodeKind.STARRED, "*", start, ImmutableList.of(expr()));
    }
    return test();
  }

  private SyntaxNode exprOrStar() throws GrammarException {
    if (at("*")) {
      int start = next().getStart();
      return node(NodeKind.STARRED, "*", start, ImmutableList.of(expr()));
    }
    return expr();
  }

  private SyntaxNode test() throws GrammarException {
    descend();
    try {
      return conditional();
    } finally {
      expressionNesting--;
    }
  }

  private SyntaxNode conditional() throws GrammarException {
    if (at("lambda")) {
      return lambda();
    }
    int start = peek().getStart();
    SyntaxNode body = orTest();
    if (!at("if")) {
      return body;
    }
    next();
    SyntaxNode condition = orTest();
    expect("else");
    SyntaxNode orElse = test();
    return node(NodeKind.IF_EXP, null, start, ImmutableList.of(body, condition, orElse));
  }

  /** The condition of a comprehension, where a conditional expression needs parentheses. */
  private SyntaxNode testNoCondition() throws GrammarException {
    return at("lambda") ? lambda() : orTest();
  }

  private SyntaxNode lambda() throws GrammarException {
    int start = expect("lambda").getStart();
    int paramsStart = peek().getStart();
    List<SyntaxNode> params = parameterList(":", false);
    SyntaxNode parameters =
        params.isEmpty()
            ? SyntaxNode.parsed(NodeKind.PARAMETERS, null, Span.at(paramsStart), params)
            : node(NodeKind.PARAMETERS, null, paramsStart, params);
    expect(":");
    SyntaxNode body = test();
    return node(NodeKind.LAMBDA, null, start, ImmutableList.of(parameters, body));
  }

  private SyntaxNode orTest() throws GrammarException {
    return booleanOperation("or");
  }

  private SyntaxNode booleanOperation(String op) throws GrammarException {
    int start = peek().getStart();
    SyntaxNode first = op.equals("or") ? booleanOperation("and") : notTest();
    if (!at(op)) {
      return first;
    }
    List<SyntaxNode> operands = new ArrayList<>();
    operands.add(first);
    while (accept(op)) {
      operands.add(op.equals("or") ? booleanOperation("and") : notTest());
    }
    return node(NodeKind.BOOL_OP, op, start, operands);
  }

  private SyntaxNode notTest() throws GrammarException {
    if (at("not")) {
      int start = next().getStart();
      descend();
      try {
        return node(NodeKind.UNARY_OP, "not", start, ImmutableList.of(notTest()));
      } finally {
        expressionNesting--;
      }
    }
    return comparison();
  }

  private SyntaxNode comparison() throws GrammarException {
    int start = peek().getStart();
    SyntaxNode first = expr();
    List<SyntaxNode> children = new ArrayList<>();
    children.add(first);
    while (true) {
      Token token = peek();
      int opStart = token.getStart();
      String op;
      if (at("not") && peek(1).is("in")) {
        next();
        next();
        op = "not in";
      } else if (at("is")) {
        next();
        op = accept("not") ? "is not" : "is";
      } else if ((token.getKind() == TokenKind.OP || token.getKind() == TokenKind.NAME)
          && (COMPARISONS.contains(token.getText())
              || (!version.isPython3() && token.getText().equals("<>")))) {
        op = next().getText();
      } else {
        break;
      }
      children.add(node(NodeKind.OPERATOR, op, opStart, ImmutableList.of()));
      children.add(expr());
    }
    return children.size() == 1 ? first : node(NodeKind.COMPARE, null, start, children);
  }

  private SyntaxNode expr() throws GrammarException {
    return binary(0);
  }

  private SyntaxNode binary(int level) throws GrammarException {
    if (level == BINARY_OPERATORS.size()) {
      return factor();
    }
    int start = peek().getStart();
    SyntaxNode left = binary(level + 1);
    while (peek().getKind() == TokenKind.OP
        && BINARY_OPERATORS.get(level).contains(peek().getText())) {
      String op = next().getText();
      SyntaxNode right = binary(level + 1);
      left = node(NodeKind.BIN_OP, op, start, ImmutableList.of(left, right));
    }
    return left;
  }

  private SyntaxNode factor() throws GrammarException {
    if (at("+") || at("-") || at("~")) {
      Token op = next();
      descend();
      try {
        return node(NodeKind.UNARY_OP, op.getText(), op.getStart(), ImmutableList.of(factor()));
      } finally {
        expressionNesting--;
      }
    }
    return power();
  }

  private SyntaxNode power() throws GrammarException {
    int start = peek().getStart();
    SyntaxNode base = atomWithTrailers();
    if (accept("**")) {
      descend();
      try {
        return node(NodeKind.BIN_OP, "**", start, ImmutableList.of(base, factor()));
      } finally {
        expressionNesting--;
      }
    }
    return base;
  }

  private SyntaxNode atomWithTrailers() throws GrammarException {
    int start = peek().getStart();
    SyntaxNode node = atom();
    while (true) {
      if (accept("(")) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(node);
        children.addAll(arguments(")"));
        expect(")");
        node = node(NodeKind.CALL, null, start, children);
      } else if (accept("[")) {
        SyntaxNode index = subscripts();
        expect("]");
        node = node(NodeKind.SUBSCRIPT, null, start, ImmutableList.of(node, index));
      } else if (accept(".")) {
        Token attr = expectKind(TokenKind.NAME, "an attribute name");
        node = node(NodeKind.ATTRIBUTE, attr.getText(), start, ImmutableList.of(node));
      } else {
        return node;
      }
    }
  }

  private SyntaxNode atom() throws GrammarException {
    Token token = peek();
    switch (token.getKind()) {
      case NAME:
        if (isReserved(token.getText()) && !ATOM_KEYWORDS.contains(token.getText())) {
          throw error("unexpected keyword '" + token.getText() + "'");
        }
        return name(next());
      case NUMBER:
        next();
        return node(NodeKind.NUM, token.getText(), token.getStart(), ImmutableList.of());
      case STRING:
        while (peek().getKind() == TokenKind.STRING) {
          next();
        }
        return SyntaxNode.parsed(
            NodeKind.STR,
            source.substring(token.getStart(), previousEnd()),
            new Span(token.getStart(), previousEnd()),
            ImmutableList.of());
      case OP:
        switch (token.getText()) {
          case "(":
            return parenthesized();
          case "[":
            return list();
          case "{":
            return dictOrSet();
          case "...":
            next();
            return node(NodeKind.NAME, "...", token.getStart(), ImmutableList.of());
          default:
            break;
        }
        break;
      default:
        break;
    }
    throw error("expected an expression");
  }

  private SyntaxNode parenthesized() throws GrammarException {
    int start = expect("(").getStart();
    if (accept(")")) {
      return node(NodeKind.TUPLE, "()", start, ImmutableList.of());
    }
    if (at("yield")) {
      SyntaxNode inner = yieldExpression();
      expect(")");
      return inner;
    }
    SyntaxNode first = testOrStar();
    if (at("for")) {
      List<SyntaxNode> children = new ArrayList<>();
      children.add(first);
      children.addAll(comprehensions());
      expect(")");
      return node(NodeKind.GENERATOR_EXP, "()", start, children);
    }
    if (at(",")) {
      List<SyntaxNode> elements = new ArrayList<>();
      elements.add(first);
      while (accept(",")) {
        if (at(")")) {
          break;
        }
        elements.add(testOrStar());
      }
      expect(")");
      return node(NodeKind.TUPLE, "()", start, elements);
    }
    // Grouping parentheses are not part of the node.
    expect(")");
    return first;
  }

  private SyntaxNode list() throws GrammarException {
    int start = expect("[").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    if (accept("]")) {
      return node(NodeKind.LIST, null, start, children);
    }
    children.add(testOrStar());
    if (at("for")) {
      children.addAll(comprehensions());
      expect("]");
      return node(NodeKind.LIST_COMP, null, start, children);
    }
    while (accept(",")) {
      if (at("]")) {
        break;
      }
      children.add(testOrStar());
    }
    expect("]");
    return node(NodeKind.LIST, null, start, children);
  }

  private SyntaxNode dictOrSet() throws GrammarException {
    int start = expect("{").getStart();
    List<SyntaxNode> children = new ArrayList<>();
    if (accept("}")) {
      return node(NodeKind.DICT, null, start, children);
    }
    int firstStart = peek().getStart();
    if (at("**")) {
      children.add(dictEntry());
    } else {
      SyntaxNode first = testOrStar();
      if (accept(":")) {
        SyntaxNode value = test();
        children.add(node(NodeKind.DICT_ENTRY, null, firstStart, ImmutableList.of(first, value)));
      } else {
        children.add(first);
        if (at("for")) {
          children.addAll(comprehensions());
          expect("}");
          return node(NodeKind.SET_COMP, null, start, children);
        }
        while (accept(",")) {
          if (at("}")) {
            break;
          }
          children.add(testOrStar());
        }
        expect("}");
        return node(NodeKind.SET, null, start, children);
      }
    }
    if (at("for") && children.get(0).getChildCount() == 2) {
      children.addAll(comprehensions());
      expect("}");
      return node(NodeKind.DICT_COMP, null, start, children);
    }
    while (accept(",")) {
      if (at("}")) {
        break;
      }
      children.add(dictEntry());
    }
    expect("}");
    return node(NodeKind.DICT, null, start, children);
  }

  private SyntaxNode dictEntry() throws GrammarException {
    int start = peek().getStart();
    if (accept("**")) {
      SyntaxNode unpacked = node(NodeKind.STARRED, "**", start, ImmutableList.of(expr()));
      return node(NodeKind.DICT_ENTRY, null, start, ImmutableList.of(unpacked));
    }
    SyntaxNode key = test();
    expect(":");
    SyntaxNode value = test();
    return node(NodeKind.DICT_ENTRY, null, start, ImmutableList.of(key, value));
  }

  private List<SyntaxNode> comprehensions() throws GrammarException {
    List<SyntaxNode> result = new ArrayList<>();
    while (at("for")) {
      int start = next().getStart();
      List<SyntaxNode> children = new ArrayList<>();
      children.add(exprList());
      expect("in");
      children.add(orTest());
      while (accept("if")) {
        children.add(testNoCondition());
      }
      result.add(node(NodeKind.COMPREHENSION, null, start, children));
    }
    return result;
  }

  /** Call arguments or class bases, up to but excluding {@code closer}. */
  private List<SyntaxNode> arguments(String closer) throws GrammarException {
    List<SyntaxNode> args = new ArrayList<>();
    while (!at(closer)) {
      int start = peek().getStart();
      if (at("*") || at("**")) {
        String op = next().getText();
        args.add(node(NodeKind.STARRED, op, start, ImmutableList.of(test())));
      } else if (peek().getKind() == TokenKind.NAME && peek(1).is("=")) {
        String name = expectName().getText();
        expect("=");
        args.add(node(NodeKind.KEYWORD, name, start, ImmutableList.of(test())));
      } else {
        SyntaxNode arg = test();
        if (at("for")) {
          List<SyntaxNode> children = new ArrayList<>();
          children.add(arg);
          children.addAll(comprehensions());
          arg = node(NodeKind.GENERATOR_EXP, null, start, children);
        }
        args.add(arg);
      }
      if (!accept(",")) {
        break;
      }
    }
    return args;
  }

  private SyntaxNode subscripts() throws GrammarException {
    int start = peek().getStart();
    SyntaxNode first = subscript();
    if (!at(",")) {
      return first;
    }
    List<SyntaxNode> elements = new ArrayList<>();
    elements.add(first);
    while (accept(",")) {
      if (at("]")) {
        break;
      }
      elements.add(subscript());
    }
    return node(NodeKind.TUPLE, null, start, elements);
  }

  private SyntaxNode subscript() throws GrammarException {
    int start = peek().getStart();
    SyntaxNode lower = empty();
    if (!at(":")) {
      lower = test();
      if (!at(":")) {
        return lower;
      }
    }
    expect(":");
    SyntaxNode upper = at(":") || at("]") || at(",") ? empty() : test();
    String value = ":";
    SyntaxNode step = empty();
    if (accept(":")) {
      value = "::";
      if (!at("]") && !at(",")) {
        step = test();
      }
    }
    return node(NodeKind.SLICE, value, start, ImmutableList.of(lower, upper, step));
  }

  private SyntaxNode yieldExpression() throws GrammarException {
    int start = expect("yield").getStart();
    if (version.isPython3() && accept("from")) {
      return node(NodeKind.YIELD, "from", start, ImmutableList.of(test()));
    }
    if (startsExpression()) {
      return node(NodeKind.YIELD, null, start, ImmutableList.of(testList(true)));
    }
    return node(NodeKind.YIELD, null, start, ImmutableList.of());
  }

  private SyntaxNode name(Token token) {
    return SyntaxNode.parsed(NodeKind.NAME, token.getText(), token.getSpan(), ImmutableList.of());
  }

  private static SyntaxNode empty() {
    return SyntaxNode.parsed(NodeKind.EMPTY, null, null, ImmutableList.of());
  }

  /** A node whose own tokens run from {@code start} to the last token consumed. */
  private SyntaxNode node(
      NodeKind kind, @Nullable String value, int start, List<SyntaxNode> children) {
    return SyntaxNode.parsed(kind, value, new Span(start, previousEnd()), children);
  }

  /** A node that ends where its last child ends, such as a block and its trailing dedent. */
  private static SyntaxNode compound(
      NodeKind kind, @Nullable String value, int start, List<SyntaxNode> children) {
    Span last = children.get(children.size() - 1).getPosition();
    return SyntaxNode.parsed(kind, value, new Span(start, last.getEnd()), children);
  }

  // Token access

  private boolean isReserved(String name) {
    if (name.equals("print")) {
      return printStatement;
    }
    return version.isKeyword(name);
  }

  private boolean startsExpression() {
    Token token = peek();
    switch (token.getKind()) {
      case NAME:
        return !isReserved(token.getText()) || EXPRESSION_KEYWORDS.contains(token.getText());
      case NUMBER:
      case STRING:
        return true;
      case OP:
        switch (token.getText()) {
          case "(":
          case "[":
          case "{":
          case "-":
          case "+":
          case "~":
          case "*":
          case "**":
          case "...":
            return true;
          default:
            return false;
        }
      default:
        return false;
    }
  }

  private Token peek() {
    return peek(0);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(index + ahead, tokens.size() - 1));
  }

  private Token next() {
    Token token = peek();
    if (index < tokens.size() - 1) {
      index++;
    }
    return token;
  }

  private int previousEnd() {
    return tokens.get(index - 1).getEnd();
  }

  private boolean at(String text) {
    return peek().is(text);
  }

  private boolean accept(String text) {
    if (at(text)) {
      next();
      return true;
    }
    return false;
  }

  private Token expect(String text) throws GrammarException {
    if (!at(text)) {
      throw error("expected '" + text + "'");
    }
    return next();
  }

  private Token expectKind(TokenKind kind, String description) throws GrammarException {
    if (peek().getKind() != kind) {
      throw error("expected " + description);
    }
    return next();
  }

  private Token expectName() throws GrammarException {
    Token token = peek();
    if (token.getKind() != TokenKind.NAME || isReserved(token.getText())) {
      throw error("expected a name");
    }
    return next();
  }

  private void descend() throws GrammarException {
    if (++expressionNesting > MAX_EXPRESSION_NESTING) {
      throw error("too many nested expressions");
    }
  }

  private GrammarException error(String message) {
    Token token = peek();
    String found;
    switch (token.getKind()) {
      case ENDMARKER:
        found = "the end of the file";
        break;
      case NEWLINE:
        found = "the end of the line";
        break;
      case INDENT:
        found = "an indent";
        break;
      case DEDENT:
        found = "a dedent";
        break;
      default:
        found = "'" + token.getText() + "'";
    }
    return GrammarException.at(source, token.getStart(), message + " but found " + found);
  }
}
