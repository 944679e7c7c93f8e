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

/**
 * Binding strength of expressions, from a bare tuple up to an atom.
 *
 * <p>An operand that binds more loosely than its position allows has to be printed in parentheses,
 * or the printed text would parse into a different tree.
 */
final class Precedence {
  /** Bare tuples, {@code yield} and unparenthesized generator expressions. */
  static final int TUPLE = 0;
  static final int LAMBDA = 1;
  static final int CONDITIONAL = 2;
  static final int OR = 3;
  static final int AND = 4;
  static final int NOT = 5;
  static final int COMPARISON = 6;
  static final int BIT_OR = 7;
  static final int XOR = 8;
  static final int BIT_AND = 9;
  static final int SHIFT = 10;
  static final int ARITHMETIC = 11;
  static final int TERM = 12;
  static final int UNARY = 13;
  static final int POWER = 14;
  static final int ATOM = 15;

  private Precedence() {}

  /** Returns how tightly {@code node} binds its operands. */
  static int of(SyntaxNode node) {
    String value = node.getValue();
    switch (node.getKind()) {
      case TUPLE:
      case GENERATOR_EXP:
        return value == null ? TUPLE : ATOM;
      case YIELD:
        return TUPLE;
      case LAMBDA:
        return LAMBDA;
      case IF_EXP:
        return CONDITIONAL;
      case BOOL_OP:
        return "or".equals(value) ? OR : AND;
      case UNARY_OP:
        return "not".equals(value) ? NOT : UNARY;
      case COMPARE:
        return COMPARISON;
      case BIN_OP:
        return value == null ? ATOM : ofBinaryOperator(value);
      default:
        return ATOM;
    }
  }

  /** Returns the weakest binding the child at {@code index} of {@code parent} may have. */
  static int required(SyntaxNode parent, int index) {
    String value = parent.getValue();
    switch (parent.getKind()) {
      case BIN_OP:
        if ("**".equals(value)) {
          return index == 0 ? ATOM : UNARY;
        }
        return index == 0 ? of(parent) : of(parent) + 1;
      case BOOL_OP:
        return of(parent) + 1;
      case COMPARE:
        return COMPARISON + 1;
      case UNARY_OP:
        return "not".equals(value) ? NOT : UNARY;
      case IF_EXP:
        return index == 2 ? LAMBDA : CONDITIONAL + 1;
      case ATTRIBUTE:
      case CALL:
      case SUBSCRIPT:
        return index == 0 ? ATOM : TUPLE;
      default:
        return TUPLE;
    }
  }

  /**
   * Returns whether {@code child} has to be wrapped in parentheses to keep its place under {@code
   * parent}. Parentheses already recorded around it count.
   */
  static boolean needsParentheses(SyntaxNode parent, SyntaxNode child) {
    if (!child.getKind().isExpression() || child.getFormatting().getParenthesisDepth() > 0) {
      return false;
    }
    return of(child) < required(parent, parent.indexOf(child));
  }

  private static int ofBinaryOperator(String op) {
    switch (op) {
      case "|":
        return BIT_OR;
      case "^":
        return XOR;
      case "&":
        return BIT_AND;
      case "<<":
      case ">>":
        return SHIFT;
      case "+":
      case "-":
        return ARITHMETIC;
      case "**":
        return POWER;
      default:
        return TERM;
    }
  }
}
