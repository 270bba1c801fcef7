// Copyright 2024 The Gleam Java Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.gleam.java.syntax;

import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/**
 * The binary operators, with their printed form and binding strength. A larger precedence binds
 * tighter; all operators are left-associative.
 */
public enum BinaryOperator {
  OR("||", 1),
  AND("&&", 2),
  EQUALS("==", 3),
  NOT_EQUALS("!=", 3),
  LESS_INT("<", 4),
  LESS_EQUALS_INT("<=", 4),
  LESS_FLOAT("<.", 4),
  LESS_EQUALS_FLOAT("<=.", 4),
  GREATER_INT(">", 4),
  GREATER_EQUALS_INT(">=", 4),
  GREATER_FLOAT(">.", 4),
  GREATER_EQUALS_FLOAT(">=.", 4),
  CONCATENATE("<>", 5),
  ADD_INT("+", 7),
  ADD_FLOAT("+.", 7),
  SUBTRACT_INT("-", 7),
  SUBTRACT_FLOAT("-.", 7),
  MULTIPLY_INT("*", 8),
  MULTIPLY_FLOAT("*.", 8),
  DIVIDE_INT("/", 8),
  DIVIDE_FLOAT("/.", 8),
  REMAINDER_INT("%", 8);

  /** The precedence of the pipe operator {@code |>}, which builds a pipeline, not a binop. */
  public static final int PIPE_PRECEDENCE = 6;

  /** The precedence of anything that is not an operator application. */
  public static final int MAX_PRECEDENCE = 255;

  private static final ImmutableMap<TokenKind, BinaryOperator> BY_TOKEN =
      ImmutableMap.<TokenKind, BinaryOperator>builder()
          .put(TokenKind.VBAR_VBAR, OR)
          .put(TokenKind.AMPERSAND_AMPERSAND, AND)
          .put(TokenKind.EQUALS_EQUALS, EQUALS)
          .put(TokenKind.NOT_EQUALS, NOT_EQUALS)
          .put(TokenKind.LESS, LESS_INT)
          .put(TokenKind.LESS_EQUALS, LESS_EQUALS_INT)
          .put(TokenKind.LESS_DOT, LESS_FLOAT)
          .put(TokenKind.LESS_EQUALS_DOT, LESS_EQUALS_FLOAT)
          .put(TokenKind.GREATER, GREATER_INT)
          .put(TokenKind.GREATER_EQUALS, GREATER_EQUALS_INT)
          .put(TokenKind.GREATER_DOT, GREATER_FLOAT)
          .put(TokenKind.GREATER_EQUALS_DOT, GREATER_EQUALS_FLOAT)
          .put(TokenKind.LESS_GREATER, CONCATENATE)
          .put(TokenKind.PLUS, ADD_INT)
          .put(TokenKind.PLUS_DOT, ADD_FLOAT)
          .put(TokenKind.MINUS, SUBTRACT_INT)
          .put(TokenKind.MINUS_DOT, SUBTRACT_FLOAT)
          .put(TokenKind.STAR, MULTIPLY_INT)
          .put(TokenKind.STAR_DOT, MULTIPLY_FLOAT)
          .put(TokenKind.SLASH, DIVIDE_INT)
          .put(TokenKind.SLASH_DOT, DIVIDE_FLOAT)
          .put(TokenKind.PERCENT, REMAINDER_INT)
          .buildOrThrow();

  private final String symbol;
  private final int precedence;

  BinaryOperator(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  /** Returns the operator as written in source, e.g. {@code "<>"}. */
  public String symbol() {
    return symbol;
  }

  public int precedence() {
    return precedence;
  }

  /** Reports whether the operator may appear in a clause guard. */
  public boolean isGuardOperator() {
    return precedence <= 4;
  }

  /** Returns the operator denoted by a token, or null if the token is not a binary operator. */
  @Nullable
  static BinaryOperator fromToken(TokenKind kind) {
    return BY_TOKEN.get(kind);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
