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

/** The closed set of syntactic kinds a {@link SyntaxNode} can have. */
public enum NodeKind {
  MODULE(Category.SUITE),
  /** An indented or single-line suite, including its introducing colon and clause keyword. */
  BLOCK(Category.SUITE),

  EXPR_STMT(Category.SIMPLE_STATEMENT),
  ASSIGN(Category.SIMPLE_STATEMENT),
  AUG_ASSIGN(Category.SIMPLE_STATEMENT),
  ANN_ASSIGN(Category.SIMPLE_STATEMENT),
  PASS(Category.SIMPLE_STATEMENT),
  BREAK(Category.SIMPLE_STATEMENT),
  CONTINUE(Category.SIMPLE_STATEMENT),
  RETURN(Category.SIMPLE_STATEMENT),
  DELETE(Category.SIMPLE_STATEMENT),
  RAISE(Category.SIMPLE_STATEMENT),
  GLOBAL(Category.SIMPLE_STATEMENT),
  NONLOCAL(Category.SIMPLE_STATEMENT),
  ASSERT(Category.SIMPLE_STATEMENT),
  IMPORT(Category.SIMPLE_STATEMENT),
  IMPORT_FROM(Category.SIMPLE_STATEMENT),
  /** The statement form of {@code print} in the 2.7 grammar. */
  PRINT(Category.SIMPLE_STATEMENT),

  IF(Category.COMPOUND_STATEMENT),
  WHILE(Category.COMPOUND_STATEMENT),
  FOR(Category.COMPOUND_STATEMENT),
  WITH(Category.COMPOUND_STATEMENT),
  TRY(Category.COMPOUND_STATEMENT),
  FUNCTION_DEF(Category.COMPOUND_STATEMENT),
  CLASS_DEF(Category.COMPOUND_STATEMENT),

  ALIAS(Category.PART),
  EXCEPT_HANDLER(Category.PART),
  WITH_ITEM(Category.PART),
  DECORATOR(Category.PART),
  PARAMETERS(Category.PART),
  PARAM(Category.PART),
  KEYWORD(Category.PART),
  COMPREHENSION(Category.PART),
  DICT_ENTRY(Category.PART),
  OPERATOR(Category.PART),
  SLICE(Category.PART),

  NAME(Category.EXPRESSION),
  NUM(Category.EXPRESSION),
  STR(Category.EXPRESSION),
  ATTRIBUTE(Category.EXPRESSION),
  CALL(Category.EXPRESSION),
  SUBSCRIPT(Category.EXPRESSION),
  BIN_OP(Category.EXPRESSION),
  BOOL_OP(Category.EXPRESSION),
  COMPARE(Category.EXPRESSION),
  UNARY_OP(Category.EXPRESSION),
  IF_EXP(Category.EXPRESSION),
  LAMBDA(Category.EXPRESSION),
  TUPLE(Category.EXPRESSION),
  LIST(Category.EXPRESSION),
  SET(Category.EXPRESSION),
  DICT(Category.EXPRESSION),
  LIST_COMP(Category.EXPRESSION),
  SET_COMP(Category.EXPRESSION),
  DICT_COMP(Category.EXPRESSION),
  GENERATOR_EXP(Category.EXPRESSION),
  STARRED(Category.EXPRESSION),
  YIELD(Category.EXPRESSION),
  /** Placeholder for an absent optional part, such as a missing slice bound. Has no text. */
  EMPTY(Category.PART);

  /** Coarse grouping of kinds, used for prefix and suffix ownership rules. */
  public enum Category {
    SUITE,
    SIMPLE_STATEMENT,
    COMPOUND_STATEMENT,
    PART,
    EXPRESSION
  }

  private final Category category;

  NodeKind(Category category) {
    this.category = category;
  }

  public Category getCategory() {
    return category;
  }

  public boolean isStatement() {
    return category == Category.SIMPLE_STATEMENT || category == Category.COMPOUND_STATEMENT;
  }

  public boolean isSimpleStatement() {
    return category == Category.SIMPLE_STATEMENT;
  }

  public boolean isExpression() {
    return category == Category.EXPRESSION;
  }
}
