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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.devtools.pasta.base.NodeKind;
import com.google.devtools.pasta.base.SyntaxNode;
import com.google.devtools.pasta.util.Span;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PythonParserTest {
  private static SyntaxNode parse(String source, GrammarVersion version) throws GrammarException {
    return new PythonParser(source, new Tokenizer(source).tokenize(), version).parseModule();
  }

  private static SyntaxNode parse(String source) throws GrammarException {
    return parse(source, GrammarVersion.PY3_8);
  }

  /** Renders a tree as {@code KIND:value[children]}. */
  private static String render(SyntaxNode node) {
    StringBuilder text = new StringBuilder(node.toString());
    if (node.getChildCount() > 0) {
      List<String> children = new ArrayList<>();
      for (SyntaxNode child : node.getChildren()) {
        children.add(render(child));
      }
      text.append('[').append(String.join(", ", children)).append(']');
    }
    return text.toString();
  }

  private static String renderFirst(String source) throws GrammarException {
    return render(parse(source).getChild(0));
  }

  @Test
  public void assignment() throws Exception {
    SyntaxNode module = parse("x = y = 1\n");
    assertThat(module.getPosition()).isEqualTo(new Span(0, 10));
    assertThat(render(module)).isEqualTo("MODULE[ASSIGN[NAME:x, NAME:y, NUM:1]]");
    assertThat(module.getChild(0).getPosition()).isEqualTo(new Span(0, 9));
  }

  @Test
  public void groupingParenthesesAreNotPartOfTheNode() throws Exception {
    SyntaxNode assign = parse("y = (a + b) * c\n").getChild(0);
    SyntaxNode product = assign.getChild(1);
    assertThat(render(product)).isEqualTo("BIN_OP:*[BIN_OP:+[NAME:a, NAME:b], NAME:c]");
    assertThat(product.getPosition()).isEqualTo(new Span(4, 15));
    assertThat(product.getChild(0).getPosition()).isEqualTo(new Span(5, 10));
  }

  @Test
  public void tuplesAndGenerators() throws Exception {
    assertThat(renderFirst("()\n")).isEqualTo("EXPR_STMT[TUPLE:()]");
    assertThat(renderFirst("(1,)\n")).isEqualTo("EXPR_STMT[TUPLE:()[NUM:1]]");
    assertThat(renderFirst("x = 1, 2,\n")).isEqualTo("ASSIGN[NAME:x, TUPLE[NUM:1, NUM:2]]");
    assertThat(renderFirst("f(x for x in y)\n"))
        .isEqualTo("EXPR_STMT[CALL[NAME:f, GENERATOR_EXP[NAME:x, COMPREHENSION[NAME:x, NAME:y]]]]");
    assertThat(renderFirst("(x for x in y if x)\n"))
        .isEqualTo(
            "EXPR_STMT[GENERATOR_EXP:()[NAME:x, COMPREHENSION[NAME:x, NAME:y, NAME:x]]]");
  }

  @Test
  public void trailingCommaIsPartOfTheTuple() throws Exception {
    SyntaxNode tuple = parse("x = 1, 2,\n").getChild(0).getChild(1);
    assertThat(tuple.getPosition()).isEqualTo(new Span(4, 9));
  }

  @Test
  public void ifElifElse() throws Exception {
    assertThat(renderFirst("if a:\n  pass\nelif b:\n  pass\nelse:\n  pass\n"))
        .isEqualTo(
            "IF[NAME:a, BLOCK[PASS], IF:elif[NAME:b, BLOCK[PASS], BLOCK:else[PASS]]]");
  }

  @Test
  public void blockPositions() throws Exception {
    String source = "while x:\n    y\nelse: z\n";
    SyntaxNode loop = parse(source).getChild(0);
    assertThat(loop.getChild(1).getPosition()).isEqualTo(new Span(7, 14));
    assertThat(loop.getChild(2).getPosition()).isEqualTo(new Span(15, 22));
  }

  @Test
  public void tryStatement() throws Exception {
    assertThat(
            renderFirst(
                "try:\n  a\nexcept E as e:\n  b\nexcept:\n  c\nelse:\n  d\nfinally:\n  f\n"))
        .isEqualTo(
            "TRY[BLOCK[EXPR_STMT[NAME:a]], EXCEPT_HANDLER:e[NAME:E, BLOCK[EXPR_STMT[NAME:b]]],"
                + " EXCEPT_HANDLER[BLOCK[EXPR_STMT[NAME:c]]], BLOCK:else[EXPR_STMT[NAME:d]],"
                + " BLOCK:finally[EXPR_STMT[NAME:f]]]");
  }

  @Test
  public void functionDefinition() throws Exception {
    String source = "@d\ndef f(a, *args, b=1, **kw) -> int:\n  return a\n";
    SyntaxNode def = parse(source).getChild(0);
    assertThat(render(def))
        .isEqualTo(
            "FUNCTION_DEF:f[DECORATOR[NAME:d], PARAMETERS:()[PARAM:a[EMPTY, EMPTY],"
                + " PARAM:*args[EMPTY, EMPTY], PARAM:b[EMPTY, NUM:1], PARAM:**kw[EMPTY, EMPTY]],"
                + " NAME:int, BLOCK[RETURN[NAME:a]]]");
    assertThat(def.getPosition().getStart()).isEqualTo(0);
    assertThat(def.getChild(0).getPosition()).isEqualTo(new Span(0, 3));
  }

  @Test
  public void classDefinition() throws Exception {
    assertThat(renderFirst("class A(B, metaclass=M): pass\n"))
        .isEqualTo("CLASS_DEF:A[NAME:B, KEYWORD:metaclass[NAME:M], BLOCK[PASS]]");
    assertThat(renderFirst("class A: pass\n")).isEqualTo("CLASS_DEF:A[BLOCK[PASS]]");
  }

  @Test
  public void lambdaWithoutParameters() throws Exception {
    SyntaxNode lambda = parse("f = lambda: 0\n").getChild(0).getChild(1);
    assertThat(render(lambda)).isEqualTo("LAMBDA[PARAMETERS, NUM:0]");
    assertThat(lambda.getChild(0).getPosition()).isEqualTo(Span.at(10));
  }

  @Test
  public void imports() throws Exception {
    assertThat(renderFirst("import a.b as c, d\n"))
        .isEqualTo("IMPORT[ALIAS:a.b[NAME:c], ALIAS:d]");
    assertThat(renderFirst("from ..pkg import (a as b, c,)\n"))
        .isEqualTo("IMPORT_FROM:..pkg[ALIAS:a[NAME:b], ALIAS:c]");
    assertThat(renderFirst("from . import *\n")).isEqualTo("IMPORT_FROM:.[ALIAS:*]");
  }

  @Test
  public void comparisons() throws Exception {
    assertThat(renderFirst("a not in b is not c < d\n"))
        .isEqualTo(
            "EXPR_STMT[COMPARE[NAME:a, OPERATOR:not in, NAME:b, OPERATOR:is not, NAME:c,"
                + " OPERATOR:<, NAME:d]]");
  }

  @Test
  public void operatorPrecedence() throws Exception {
    assertThat(renderFirst("a or b and not c | d ** -e\n"))
        .isEqualTo(
            "EXPR_STMT[BOOL_OP:or[NAME:a, BOOL_OP:and[NAME:b, UNARY_OP:not[BIN_OP:|[NAME:c,"
                + " BIN_OP:**[NAME:d, UNARY_OP:-[NAME:e]]]]]]]");
  }

  @Test
  public void subscriptsAndSlices() throws Exception {
    assertThat(renderFirst("x[1:2, ::3]\n"))
        .isEqualTo(
            "EXPR_STMT[SUBSCRIPT[NAME:x, TUPLE[SLICE::[NUM:1, NUM:2, EMPTY],"
                + " SLICE:::[EMPTY, EMPTY, NUM:3]]]]");
    assertThat(renderFirst("x[...]\n")).isEqualTo("EXPR_STMT[SUBSCRIPT[NAME:x, NAME:...]]");
  }

  @Test
  public void displays() throws Exception {
    assertThat(renderFirst("{1: 2, **d}\n"))
        .isEqualTo("EXPR_STMT[DICT[DICT_ENTRY[NUM:1, NUM:2], DICT_ENTRY[STARRED:**[NAME:d]]]]");
    assertThat(renderFirst("{1, *s}\n")).isEqualTo("EXPR_STMT[SET[NUM:1, STARRED:*[NAME:s]]]");
    assertThat(renderFirst("{k: v for k in x}\n"))
        .isEqualTo(
            "EXPR_STMT[DICT_COMP[DICT_ENTRY[NAME:k, NAME:v], COMPREHENSION[NAME:k, NAME:x]]]");
    assertThat(renderFirst("[a for a, b in x]\n"))
        .isEqualTo(
            "EXPR_STMT[LIST_COMP[NAME:a, COMPREHENSION[TUPLE[NAME:a, NAME:b], NAME:x]]]");
  }

  @Test
  public void implicitStringConcatenation() throws Exception {
    SyntaxNode string = parse("s = ('a'\n     'b')\n").getChild(0).getChild(1);
    assertThat(string.getKind()).isEqualTo(NodeKind.STR);
    assertThat(string.getValue()).isEqualTo("'a'\n     'b'");
  }

  @Test
  public void statementsOnOneLine() throws Exception {
    assertThat(render(parse("a = 1; del a, b,; global g\n")))
        .isEqualTo("MODULE[ASSIGN[NAME:a, NUM:1], DELETE[NAME:a, NAME:b], GLOBAL[NAME:g]]");
  }

  @Test
  public void python3Statements() throws Exception {
    assertThat(renderFirst("x: int = 1\n")).isEqualTo("ANN_ASSIGN[NAME:x, NAME:int, NUM:1]");
    assertThat(renderFirst("raise E from c\n")).isEqualTo("RAISE:from[NAME:E, NAME:c]");
    assertThat(renderFirst("x += yield\n")).isEqualTo("AUG_ASSIGN:+=[NAME:x, YIELD]");
    assertThat(renderFirst("nonlocal a, b\n")).isEqualTo("NONLOCAL[NAME:a, NAME:b]");
    assertThat(renderFirst("print(x)\n")).isEqualTo("EXPR_STMT[CALL[NAME:print, NAME:x]]");
  }

  @Test
  public void python2Statements() throws Exception {
    assertThat(render(parse("print >>f, x,\n", GrammarVersion.PY2_7).getChild(0)))
        .isEqualTo("PRINT:>>[NAME:f, NAME:x]");
    assertThat(render(parse("print\n", GrammarVersion.PY2_7).getChild(0))).isEqualTo("PRINT");
    assertThat(render(parse("raise E, v, tb\n", GrammarVersion.PY2_7).getChild(0)))
        .isEqualTo("RAISE:,[NAME:E, NAME:v, NAME:tb]");
    assertThat(render(parse("x <> y\n", GrammarVersion.PY2_7).getChild(0)))
        .isEqualTo("EXPR_STMT[COMPARE[NAME:x, OPERATOR:<>, NAME:y]]");
  }

  @Test
  public void printFunctionFutureImport() throws Exception {
    SyntaxNode module =
        parse("from __future__ import print_function\nprint(x)\n", GrammarVersion.PY2_7);
    assertThat(module.getChild(1).getKind()).isEqualTo(NodeKind.EXPR_STMT);
  }

  @Test
  public void grammarErrors() {
    assertThrows(GrammarException.class, () -> parse("x = \n"));
    assertThrows(GrammarException.class, () -> parse("  x\n"));
    assertThrows(GrammarException.class, () -> parse("if x:\npass\n"));
    assertThrows(GrammarException.class, () -> parse("print x\n"));
    assertThrows(GrammarException.class, () -> parse("x: int\n", GrammarVersion.PY2_7));
    assertThrows(GrammarException.class, () -> parse("async def f(): pass\n"));
    assertThrows(GrammarException.class, () -> parse("try:\n  pass\n"));
    GrammarException e =
        assertThrows(
            GrammarException.class,
            () -> parse("try:\n  pass\nexcept E, e:\n  pass\n", GrammarVersion.PY2_7));
    assertThat(e).hasMessageThat().contains("except type as name");
    assertThat(e.getLine()).isEqualTo(3);
  }
}
