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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, "test.gleam"), errors);
  }

  // Returns the names of the tokens, with the raw text of value-carrying tokens in parentheses.
  private String values(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buf = new StringBuilder();
    do {
      lexer.nextToken();
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.kind.name());
      if (lexer.raw != null) {
        buf.append('(').append(lexer.raw).append(')');
      }
    } while (lexer.kind != TokenKind.EOF);
    return buf.toString();
  }

  // Returns the trivia collected while scanning the whole input.
  private ModuleExtra trivia(String input) {
    Lexer lexer = createLexer(input);
    do {
      lexer.nextToken();
    } while (lexer.kind != TokenKind.EOF);
    return lexer.getExtra();
  }

  @Test
  public void testKeywordsAndNames() {
    assertThat(values("pub fn main() { let x = y }"))
        .isEqualTo("PUB FN NAME(main) LPAREN RPAREN LBRACE LET NAME(x) EQUALS NAME(y) RBRACE EOF");
    assertThat(values("Ok _ _unused opaque type"))
        .isEqualTo("UP_NAME(Ok) DISCARD_NAME(_) DISCARD_NAME(_unused) OPAQUE TYPE EOF");
    assertThat(values("use x <- f")).isEqualTo("USE NAME(x) LEFT_ARROW NAME(f) EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testOperators() {
    assertThat(values("+ +. - -. * *. / /. %"))
        .isEqualTo("PLUS PLUS_DOT MINUS MINUS_DOT STAR STAR_DOT SLASH SLASH_DOT PERCENT EOF");
    assertThat(values("< <. <= <=. > >. >= >=. == !="))
        .isEqualTo(
            "LESS LESS_DOT LESS_EQUALS LESS_EQUALS_DOT GREATER GREATER_DOT GREATER_EQUALS"
                + " GREATER_EQUALS_DOT EQUALS_EQUALS NOT_EQUALS EOF");
    assertThat(values("&& || |> | <> << >> -> <- .. ."))
        .isEqualTo(
            "AMPERSAND_AMPERSAND VBAR_VBAR PIPE VBAR LESS_GREATER LESS_LESS GREATER_GREATER"
                + " RIGHT_ARROW LEFT_ARROW DOT_DOT DOT EOF");
  }

  @Test
  public void testNumbers() {
    assertThat(values("1 1_000 0xFF 0b1010 0o17"))
        .isEqualTo("INT(1) INT(1_000) INT(0xFF) INT(0b1010) INT(0o17) EOF");
    assertThat(values("1.5 1. 1.0e10 2.5e-3"))
        .isEqualTo("FLOAT(1.5) FLOAT(1.) FLOAT(1.0e10) FLOAT(2.5e-3) EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testOnlyIntAfterDot() {
    assertThat(values("t.0.1")).isEqualTo("NAME(t) DOT INT(0) DOT INT(1) EOF");
    assertThat(values("[1, ..xs]"))
        .isEqualTo("LBRACKET INT(1) COMMA DOT_DOT NAME(xs) RBRACKET EOF");
  }

  @Test
  public void testStrings() {
    assertThat(values("\"hello\"")).isEqualTo("STRING(hello) EOF");
    // Escapes are kept as written.
    assertThat(values("\"a\\nb\\\"c\"")).isEqualTo("STRING(a\\nb\\\"c) EOF");
    assertThat(values("\"two\nlines\"")).isEqualTo("STRING(two\nlines) EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testStringErrors() {
    values("\"unterminated");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("unterminated string literal");

    values("\"bad \\q\"");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("invalid escape sequence: \\q");
  }

  @Test
  public void testIllegalCharacter() {
    assertThat(values("a $ b")).isEqualTo("NAME(a) ILLEGAL($) NAME(b) EOF");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).toString()).isEqualTo("test.gleam:1:3: invalid character: '$'");
  }

  @Test
  public void testCommentsAreSortedByKind() {
    ModuleExtra extra = trivia("//// module\n/// doc\n// regular\nx // trailing\n");
    assertThat(extra.moduleComments()).hasSize(1);
    assertThat(extra.moduleComments().get(0).getText()).isEqualTo(" module");
    assertThat(extra.docComments()).hasSize(1);
    assertThat(extra.docComments().get(0).getText()).isEqualTo(" doc");
    assertThat(extra.comments()).hasSize(2);
    assertThat(extra.comments().get(0).getText()).isEqualTo(" regular");
    assertThat(extra.comments().get(1).getText()).isEqualTo(" trailing");
  }

  @Test
  public void testCommentOffsetIsAfterTheSlashes() {
    ModuleExtra extra = trivia("x\n// c\r\n");
    Comment comment = extra.comments().get(0);
    assertThat(comment.getStartOffset()).isEqualTo(4);
    assertThat(comment.getText()).isEqualTo(" c");
    assertThat(comment.getStartLocation().line()).isEqualTo(2);
  }

  @Test
  public void testEmptyLinesRecordWhereTheWhitespaceRunStarts() {
    ModuleExtra extra = trivia("a b\n\n\nc\nd\n\ne");
    assertThat(extra.emptyLines().asList()).containsExactly(3, 9).inOrder();
  }

  @Test
  public void testEmptyLineAfterComment() {
    // The run after the comment starts at the newline that ends it.
    ModuleExtra extra = trivia("// c\n\nx");
    assertThat(extra.emptyLines().asList()).containsExactly(4);
  }

  @Test
  public void testSingleNewlinesAreNotEmptyLines() {
    assertThat(trivia("a\nb\n  c\n").emptyLines().isEmpty()).isTrue();
  }
}
