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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableIntArray;
import java.util.List;

/**
 * A scanner for Gleam. Newlines are not significant to the grammar, so they never become tokens;
 * instead the lexer records comments and blank lines as trivia in a {@link ModuleExtra}.
 */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  // raw is defined only for NAME, UP_NAME, DISCARD_NAME, INT, FLOAT, STRING and ILLEGAL.
  // For STRING it is the text between the quotes, escapes left as written.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw;

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  private final ImmutableList.Builder<Comment> comments = ImmutableList.builder();
  private final ImmutableList.Builder<Comment> docComments = ImmutableList.builder();
  private final ImmutableList.Builder<Comment> moduleComments = ImmutableList.builder();
  private final ImmutableIntArray.Builder emptyLines = ImmutableIntArray.builder();

  // End offset of the last token or comment, where the current whitespace run began.
  private int whitespaceStart;

  // Number of newlines in the current whitespace run. The second one makes a blank line.
  private int newlines;

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("as", TokenKind.AS)
          .put("assert", TokenKind.ASSERT)
          .put("case", TokenKind.CASE)
          .put("const", TokenKind.CONST)
          .put("fn", TokenKind.FN)
          .put("if", TokenKind.IF)
          .put("import", TokenKind.IMPORT)
          .put("let", TokenKind.LET)
          .put("opaque", TokenKind.OPAQUE)
          .put("panic", TokenKind.PANIC)
          .put("pub", TokenKind.PUB)
          .put("todo", TokenKind.TODO)
          .put("type", TokenKind.TYPE)
          .put("use", TokenKind.USE)
          .buildOrThrow();

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.errors = errors;
  }

  /** Returns the trivia collected so far. Complete once the EOF token has been scanned. */
  ModuleExtra getExtra() {
    return new ModuleExtra(
        comments.build(), docComments.build(), moduleComments.build(), emptyLines.build());
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    boolean afterDot = kind == TokenKind.DOT;
    tokenize(afterDot);
    Preconditions.checkState(kind != null);
  }

  private void error(String message, int pos) {
    errors.add(new SyntaxError(locs.getLocation(pos), message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.raw = null;
  }

  // Sets a token spanning from start to the current position.
  private void setToken(TokenKind kind, int start) {
    setToken(kind, start, pos);
  }

  // setValue records the raw text associated with a literal or name token.
  private void setValue(String raw) {
    this.raw = raw;
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  // Consumes the next char if it is c.
  private boolean accept(char c) {
    if (peek(0) == c) {
      pos++;
      return true;
    }
    return false;
  }

  private void newline() {
    newlines++;
    if (newlines == 2) {
      emptyLines.add(whitespaceStart);
    }
  }

  private void endOfTrivia(int offset) {
    whitespaceStart = offset;
    newlines = 0;
  }

  /**
   * Scans a comment.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first slash. ON EXIT: 'pos' is the index of the
   * terminating newline, or the end of the buffer.
   */
  private void comment() {
    pos++; // second slash
    Comment.Kind commentKind = Comment.Kind.REGULAR;
    if (accept('/')) {
      commentKind = accept('/') ? Comment.Kind.MODULE : Comment.Kind.DOC;
    }
    int contentStart = pos;
    while (pos < buffer.length && buffer[pos] != '\n') {
      pos++;
    }
    int contentEnd = pos;
    if (contentEnd > contentStart && buffer[contentEnd - 1] == '\r') {
      contentEnd--;
    }
    Comment comment =
        new Comment(locs, commentKind, contentStart, bufferSlice(contentStart, contentEnd));
    switch (commentKind) {
      case REGULAR:
        comments.add(comment);
        break;
      case DOC:
        docComments.add(comment);
        break;
      case MODULE:
        moduleComments.add(comment);
        break;
    }
    endOfTrivia(pos);
  }

  /**
   * Scans a string literal. Escape sequences are validated but left as written, since a printer
   * must reproduce them verbatim.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the opening quote. ON EXIT: 'pos' is 1 + the index of
   * the closing quote.
   */
  private void stringLiteral() {
    int literalStart = pos - 1;
    int contentStart = pos;
    while (pos < buffer.length) {
      char c = buffer[pos++];
      switch (c) {
        case '\\':
          if (pos == buffer.length) {
            break;
          }
          char escaped = buffer[pos++];
          switch (escaped) {
            case 'n': case 'r': case 't': case 'f': case '"': case '\\': case 'u':
              break;
            default:
              error("invalid escape sequence: \\" + escaped, pos - 2);
              break;
          }
          break;
        case '"':
          setToken(TokenKind.STRING, literalStart);
          setValue(bufferSlice(contentStart, pos - 1));
          return;
        default:
          break;
      }
    }
    error("unterminated string literal", literalStart);
    setToken(TokenKind.STRING, literalStart);
    setValue(bufferSlice(contentStart, pos));
  }

  private static boolean isNameChar(int c) {
    return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
  }

  private static boolean isUpNameChar(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  /**
   * Scans an identifier or keyword.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier. ON EXIT: 'pos' is 1 +
   * the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    while (isNameChar(peek(0))) {
      pos++;
    }
    String id = bufferSlice(oldPos, pos);
    TokenKind keyword = KEYWORDS.get(id);
    if (keyword == null) {
      setToken(TokenKind.NAME, oldPos);
      setValue(id);
    } else {
      setToken(keyword, oldPos);
    }
  }

  private void upName() {
    int oldPos = pos - 1;
    while (isUpNameChar(peek(0))) {
      pos++;
    }
    setToken(TokenKind.UP_NAME, oldPos);
    setValue(bufferSlice(oldPos, pos));
  }

  private void discardName() {
    int oldPos = pos - 1;
    while (isNameChar(peek(0))) {
      pos++;
    }
    setToken(TokenKind.DISCARD_NAME, oldPos);
    setValue(bufferSlice(oldPos, pos));
  }

  private void skipDigits() {
    while (isDigit(peek(0)) || peek(0) == '_') {
      pos++;
    }
  }

  /**
   * Scans an int or float literal. Directly after a '.', only an int is scanned, so that {@code
   * t.0.1} is two tuple indexes rather than an index by a float.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first digit.
   */
  private void numberLiteral(char first, boolean afterDot) {
    int oldPos = pos - 1;
    if (first == '0' && (peek(0) == 'x' || peek(0) == 'b' || peek(0) == 'o')) {
      pos++;
      int digitsStart = pos;
      while (isUpNameChar(peek(0)) || peek(0) == '_') {
        pos++;
      }
      if (pos == digitsStart) {
        error("invalid integer literal", oldPos);
      }
      setToken(TokenKind.INT, oldPos);
      setValue(bufferSlice(oldPos, pos));
      return;
    }
    skipDigits();
    if (!afterDot && peek(0) == '.' && peek(1) != '.') {
      pos++;
      skipDigits();
      if (peek(0) == 'e' && (isDigit(peek(1)) || (peek(1) == '-' && isDigit(peek(2))))) {
        pos += 2;
        skipDigits();
      }
      setToken(TokenKind.FLOAT, oldPos);
    } else {
      setToken(TokenKind.INT, oldPos);
    }
    setValue(bufferSlice(oldPos, pos));
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor,
   * skipping whitespace and comments until a token is found.
   */
  private void tokenize(boolean afterDot) {
    kind = null;
    while (pos < buffer.length) {
      char c = buffer[pos];
      pos++;
      int tokenStart = pos - 1;
      switch (c) {
        case ' ':
        case '\t':
        case '\r':
          /* ignore */
          continue;
        case '\n':
          newline();
          continue;
        case '/':
          if (peek(0) == '/') {
            comment();
            continue;
          }
          setToken(accept('.') ? TokenKind.SLASH_DOT : TokenKind.SLASH, tokenStart);
          break;
        case '(':
          setToken(TokenKind.LPAREN, tokenStart);
          break;
        case ')':
          setToken(TokenKind.RPAREN, tokenStart);
          break;
        case '[':
          setToken(TokenKind.LBRACKET, tokenStart);
          break;
        case ']':
          setToken(TokenKind.RBRACKET, tokenStart);
          break;
        case '{':
          setToken(TokenKind.LBRACE, tokenStart);
          break;
        case '}':
          setToken(TokenKind.RBRACE, tokenStart);
          break;
        case ',':
          setToken(TokenKind.COMMA, tokenStart);
          break;
        case ':':
          setToken(TokenKind.COLON, tokenStart);
          break;
        case '#':
          setToken(TokenKind.HASH, tokenStart);
          break;
        case '@':
          setToken(TokenKind.AT, tokenStart);
          break;
        case '%':
          setToken(TokenKind.PERCENT, tokenStart);
          break;
        case '.':
          setToken(accept('.') ? TokenKind.DOT_DOT : TokenKind.DOT, tokenStart);
          break;
        case '=':
          setToken(accept('=') ? TokenKind.EQUALS_EQUALS : TokenKind.EQUALS, tokenStart);
          break;
        case '!':
          setToken(accept('=') ? TokenKind.NOT_EQUALS : TokenKind.BANG, tokenStart);
          break;
        case '+':
          setToken(accept('.') ? TokenKind.PLUS_DOT : TokenKind.PLUS, tokenStart);
          break;
        case '*':
          setToken(accept('.') ? TokenKind.STAR_DOT : TokenKind.STAR, tokenStart);
          break;
        case '-':
          if (accept('>')) {
            setToken(TokenKind.RIGHT_ARROW, tokenStart);
          } else {
            setToken(accept('.') ? TokenKind.MINUS_DOT : TokenKind.MINUS, tokenStart);
          }
          break;
        case '<':
          if (accept('<')) {
            setToken(TokenKind.LESS_LESS, tokenStart);
          } else if (accept('>')) {
            setToken(TokenKind.LESS_GREATER, tokenStart);
          } else if (accept('-')) {
            setToken(TokenKind.LEFT_ARROW, tokenStart);
          } else if (accept('=')) {
            setToken(accept('.') ? TokenKind.LESS_EQUALS_DOT : TokenKind.LESS_EQUALS, tokenStart);
          } else {
            setToken(accept('.') ? TokenKind.LESS_DOT : TokenKind.LESS, tokenStart);
          }
          break;
        case '>':
          if (accept('>')) {
            setToken(TokenKind.GREATER_GREATER, tokenStart);
          } else if (accept('=')) {
            setToken(
                accept('.') ? TokenKind.GREATER_EQUALS_DOT : TokenKind.GREATER_EQUALS, tokenStart);
          } else {
            setToken(accept('.') ? TokenKind.GREATER_DOT : TokenKind.GREATER, tokenStart);
          }
          break;
        case '|':
          if (accept('|')) {
            setToken(TokenKind.VBAR_VBAR, tokenStart);
          } else {
            setToken(accept('>') ? TokenKind.PIPE : TokenKind.VBAR, tokenStart);
          }
          break;
        case '&':
          if (accept('&')) {
            setToken(TokenKind.AMPERSAND_AMPERSAND, tokenStart);
            break;
          }
          illegal(c, tokenStart);
          break;
        case '"':
          stringLiteral();
          break;
        case '_':
          discardName();
          break;
        default:
          if (c >= 'a' && c <= 'z') {
            identifierOrKeyword();
          } else if (c >= 'A' && c <= 'Z') {
            upName();
          } else if (isDigit(c)) {
            numberLiteral(c, afterDot);
          } else {
            illegal(c, tokenStart);
          }
          break;
      }
      endOfTrivia(end);
      return;
    }
    setToken(TokenKind.EOF, pos, pos);
  }

  private void illegal(char c, int offset) {
    error(String.format("invalid character: '%s'", c), offset);
    setToken(TokenKind.ILLEGAL, offset);
    setValue(Character.toString(c));
  }

  /**
   * Returns parts of the source buffer based on offsets.
   *
   * @param start the beginning offset for the slice
   * @param end the offset immediately following the slice
   * @return the text at offset start with length end - start
   */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }
}
