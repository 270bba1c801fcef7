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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  AMPERSAND_AMPERSAND("&&"),
  AS("as"),
  ASSERT("assert"),
  AT("@"),
  BANG("!"),
  CASE("case"),
  COLON(":"),
  COMMA(","),
  CONST("const"),
  DISCARD_NAME("discard name"),
  DOT("."),
  DOT_DOT(".."),
  EOF("EOF"),
  EQUALS("="),
  EQUALS_EQUALS("=="),
  FLOAT("float literal"),
  FN("fn"),
  GREATER(">"),
  GREATER_DOT(">."),
  GREATER_EQUALS(">="),
  GREATER_EQUALS_DOT(">=."),
  GREATER_GREATER(">>"),
  HASH("#"),
  IF("if"),
  ILLEGAL("illegal character"),
  IMPORT("import"),
  INT("integer literal"),
  LBRACE("{"),
  LBRACKET("["),
  LEFT_ARROW("<-"),
  LESS("<"),
  LESS_DOT("<."),
  LESS_EQUALS("<="),
  LESS_EQUALS_DOT("<=."),
  LESS_GREATER("<>"),
  LESS_LESS("<<"),
  LET("let"),
  LPAREN("("),
  MINUS("-"),
  MINUS_DOT("-."),
  NAME("name"),
  NOT_EQUALS("!="),
  OPAQUE("opaque"),
  PANIC("panic"),
  PERCENT("%"),
  PIPE("|>"),
  PLUS("+"),
  PLUS_DOT("+."),
  PUB("pub"),
  RBRACE("}"),
  RBRACKET("]"),
  RIGHT_ARROW("->"),
  RPAREN(")"),
  SLASH("/"),
  SLASH_DOT("/."),
  STAR("*"),
  STAR_DOT("*."),
  STRING("string literal"),
  TODO("todo"),
  TYPE("type"),
  UP_NAME("upper-case name"),
  USE("use"),
  VBAR("|"),
  VBAR_VBAR("||");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
