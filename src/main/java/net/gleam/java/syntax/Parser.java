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
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/** Parser is a recursive-descent parser for Gleam modules. */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    /** The top-level definitions of the parsed module. */
    final ImmutableList<TargetedDefinition> definitions;

    /** The comments and blank lines of the parsed module. */
    final ModuleExtra extra;

    // Errors encountered during scanning or parsing.
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs,
        ImmutableList<TargetedDefinition> definitions,
        ModuleExtra extra,
        List<SyntaxError> errors) {
      this.locs = locs;
      this.definitions = Preconditions.checkNotNull(definitions);
      this.extra = Preconditions.checkNotNull(extra);
      this.errors = errors;
    }
  }

  // Tokens that may begin a top-level definition; error recovery skips to one of these.
  private static final EnumSet<TokenKind> DEFINITION_START_SET =
      EnumSet.of(
          TokenKind.AT,
          TokenKind.CONST,
          TokenKind.EOF,
          TokenKind.FN,
          TokenKind.IMPORT,
          TokenKind.PUB,
          TokenKind.TYPE);

  // Creates the node for a short-form bit array size, such as the 8 of x:8.
  @FunctionalInterface
  private interface LiteralFactory<T> {
    T create(int start, int end, String raw);
  }

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  // End offset of the last consumed token.
  private int lastEnd;

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next definition

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    nextToken();
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, @Nullable String raw) {
    if (kind == TokenKind.STRING) {
      return "\"" + raw + "\"";
    }
    return raw == null ? kind.toString() : raw;
  }

  // Main entry point for parsing a module.
  static ParseResult parseModule(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors);
    ImmutableList<TargetedDefinition> definitions;
    try {
      definitions = parser.parseDefinitions();
    } catch (StackOverflowError ex) {
      // Nesting deep enough to exhaust the stack is reported rather than propagated.
      parser.reportError(lexer.start, "nesting too deep, cannot parse module");
      definitions = ImmutableList.of();
    }
    return new ParseResult(lexer.locs, definitions, lexer.getExtra(), errors);
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      Location location = locs.getLocation(offset);
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    syntaxError(token.start, token.kind, token.raw, message);
  }

  private void syntaxError(int offset, TokenKind tokenKind, String raw, String message) {
    if (!recoveryMode) {
      reportError(offset, "syntax error at '%s': %s", tokenString(tokenKind, raw), message);
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Consumes a token that carries a value and returns the value.
  private String expectValue(TokenKind kind) {
    String raw = token.kind == kind ? token.raw : "";
    expect(kind);
    return raw;
  }

  // Consumes the token and returns its start offset.
  private int nextToken() {
    int prev = token.start;
    if (token.kind != TokenKind.EOF) {
      lastEnd = token.end;
      lexer.nextToken();
    }
    return prev;
  }

  // Returns an identifier whose content is the input from start to end, standing in for a
  // malformed expression.
  private Identifier makeErrorExpression(int start, int end) {
    return new Identifier(locs, start, end, lexer.bufferSlice(start, end));
  }

  // Parses an int token as a small non-negative number, such as a tuple index.
  private int parseSmallInt() {
    int start = token.start;
    String raw = expectValue(TokenKind.INT);
    try {
      return Integer.parseInt(raw.replace("_", ""));
    } catch (NumberFormatException ex) {
      reportError(start, "invalid index or unit: '%s'", raw);
      return 0;
    }
  }

  // --- Definitions ---

  // module = definition*
  private ImmutableList<TargetedDefinition> parseDefinitions() {
    ImmutableList.Builder<TargetedDefinition> list = ImmutableList.builder();
    while (token.kind != TokenKind.EOF) {
      if (recoveryMode) {
        // Skip the rest of the broken definition.
        nextToken();
        while (!DEFINITION_START_SET.contains(token.kind)) {
          nextToken();
        }
        recoveryMode = false;
        continue;
      }
      TargetedDefinition definition = parseTargetedDefinition();
      if (definition != null) {
        list.add(definition);
      }
    }
    return list.build();
  }

  // targeted_definition = attribute* definition
  // attribute = '@' NAME '(' ... ')'
  @Nullable
  private TargetedDefinition parseTargetedDefinition() {
    Target target = null;
    String deprecation = null;
    // At most one binding per target, kept in target order.
    EnumMap<Target, ExternalBinding> externals = new EnumMap<>(Target.class);
    while (token.kind == TokenKind.AT) {
      nextToken();
      int nameStart = token.start;
      String name = expectValue(TokenKind.NAME);
      expect(TokenKind.LPAREN);
      switch (name) {
        case "target":
          target = parseTarget();
          break;
        case "deprecated":
          deprecation = expectValue(TokenKind.STRING);
          break;
        case "external":
          Target externalTarget = parseTarget();
          expect(TokenKind.COMMA);
          String module = expectValue(TokenKind.STRING);
          expect(TokenKind.COMMA);
          String function = expectValue(TokenKind.STRING);
          if (externals.put(
                  externalTarget, ExternalBinding.create(externalTarget, module, function))
              != null) {
            reportError(nameStart, "duplicate @external for target %s", externalTarget.getName());
          }
          break;
        default:
          reportError(nameStart, "unknown attribute '@%s'", name);
          recoveryMode = true;
          return null;
      }
      expect(TokenKind.RPAREN);
    }

    Definition definition;
    int start = token.start;
    boolean isPublic = false;
    if (token.kind == TokenKind.PUB) {
      isPublic = true;
      nextToken();
    }
    switch (token.kind) {
      case FN:
        definition =
            parseFunctionDefinition(
                start, isPublic, deprecation, ImmutableList.copyOf(externals.values()));
        break;
      case TYPE:
      case OPAQUE:
        definition = parseTypeDefinition(start, isPublic, deprecation);
        break;
      case CONST:
        definition = parseConstantDefinition(start, isPublic);
        break;
      case IMPORT:
        if (isPublic) {
          reportError(start, "imports cannot be public");
        }
        definition = parseImport();
        break;
      default:
        syntaxError("expected a definition");
        nextToken();
        return null;
    }
    if (!externals.isEmpty() && definition.kind() != Definition.Kind.FUNCTION) {
      reportError(start, "only functions can have an @external attribute");
    }
    return new TargetedDefinition(locs, target, definition);
  }

  private Target parseTarget() {
    int start = token.start;
    String name = expectValue(TokenKind.NAME);
    Target target = Target.fromName(name);
    if (target == null) {
      reportError(start, "unknown target '%s'", name);
      return Target.ERLANG;
    }
    return target;
  }

  // function = 'fn' NAME '(' parameters ')' ['->' type] ['{' statements '}']
  private FunctionDefinition parseFunctionDefinition(
      int start,
      boolean isPublic,
      @Nullable String deprecation,
      ImmutableList<ExternalBinding> externals) {
    expect(TokenKind.FN);
    String name = expectValue(TokenKind.NAME);
    ImmutableList<Parameter> parameters = parseParameters(/* labelsAllowed= */ true);
    TypeExpression returnAnnotation = null;
    if (token.kind == TokenKind.RIGHT_ARROW) {
      nextToken();
      returnAnnotation = parseType();
    }
    int end = lastEnd;
    ImmutableList<Statement> body;
    int bodyEnd;
    if (token.kind == TokenKind.LBRACE) {
      int lbrace = nextToken();
      body = parseStatementsBody(lbrace);
      bodyEnd = token.start;
      expect(TokenKind.RBRACE);
    } else {
      if (externals.isEmpty()) {
        syntaxError("expected '{': only functions with an @external attribute may omit the body");
      }
      body =
          ImmutableList.of(
              new ExpressionStatement(locs, new PlaceholderExpression(locs, end, end)));
      bodyEnd = end;
    }
    return new FunctionDefinition(
        locs,
        start,
        end,
        isPublic,
        name,
        parameters,
        returnAnnotation,
        body,
        bodyEnd,
        deprecation,
        externals);
  }

  // parameters = '(' [parameter {',' parameter} [',']] ')'
  // parameter = [NAME] (NAME | DISCARD_NAME) [':' type]
  private ImmutableList<Parameter> parseParameters(boolean labelsAllowed) {
    expect(TokenKind.LPAREN);
    ImmutableList.Builder<Parameter> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      list.add(parseParameter(labelsAllowed));
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    expect(TokenKind.RPAREN);
    return list.build();
  }

  private Parameter parseParameter(boolean labelsAllowed) {
    int start = token.start;
    String label = null;
    String name = parseParameterName();
    if (token.kind == TokenKind.NAME || token.kind == TokenKind.DISCARD_NAME) {
      if (!labelsAllowed) {
        reportError(start, "anonymous function parameters cannot be labelled");
      } else if (name.startsWith("_")) {
        reportError(start, "a label cannot be a discard name");
      }
      label = name;
      name = parseParameterName();
    }
    TypeExpression annotation = null;
    if (token.kind == TokenKind.COLON) {
      nextToken();
      annotation = parseType();
    }
    return new Parameter(locs, start, lastEnd, label, name, annotation);
  }

  private String parseParameterName() {
    if (token.kind == TokenKind.DISCARD_NAME) {
      String name = token.raw;
      nextToken();
      return name;
    }
    return expectValue(TokenKind.NAME);
  }

  // type_definition = ['opaque'] 'type' UP_NAME ['(' names ')'] ('=' type | ['{' constructors '}'])
  private Definition parseTypeDefinition(
      int start, boolean isPublic, @Nullable String deprecation) {
    boolean isOpaque = false;
    if (token.kind == TokenKind.OPAQUE) {
      isOpaque = true;
      nextToken();
    }
    expect(TokenKind.TYPE);
    String name = expectValue(TokenKind.UP_NAME);
    ImmutableList.Builder<String> parameters = ImmutableList.builder();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
        parameters.add(expectValue(TokenKind.NAME));
        if (token.kind != TokenKind.COMMA) {
          break;
        }
        nextToken();
      }
      expect(TokenKind.RPAREN);
    }
    int end = lastEnd;

    if (token.kind == TokenKind.EQUALS) {
      if (isOpaque) {
        reportError(start, "a type alias cannot be opaque");
      }
      nextToken();
      TypeExpression type = parseType();
      return new TypeAliasDefinition(
          locs, start, isPublic, name, parameters.build(), type, deprecation);
    }

    ImmutableList.Builder<RecordConstructor> constructors = ImmutableList.builder();
    int bodyEnd = end;
    if (token.kind == TokenKind.LBRACE) {
      nextToken();
      while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
        constructors.add(parseRecordConstructor());
      }
      bodyEnd = token.start;
      expect(TokenKind.RBRACE);
    }
    return new CustomTypeDefinition(
        locs,
        start,
        end,
        isPublic,
        isOpaque,
        name,
        parameters.build(),
        constructors.build(),
        bodyEnd,
        deprecation);
  }

  // constructor = UP_NAME ['(' [NAME ':'] type {',' [NAME ':'] type} [','] ')']
  private RecordConstructor parseRecordConstructor() {
    int start = token.start;
    String name = expectValue(TokenKind.UP_NAME);
    ImmutableList.Builder<RecordConstructorArgument> arguments = ImmutableList.builder();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
        int argStart = token.start;
        String label = null;
        TypeExpression type = parseType();
        if (token.kind == TokenKind.COLON && type instanceof TypeVariable) {
          label = ((TypeVariable) type).getName();
          nextToken();
          type = parseType();
        }
        arguments.add(new RecordConstructorArgument(locs, argStart, label, type));
        if (token.kind != TokenKind.COMMA) {
          break;
        }
        nextToken();
      }
      expect(TokenKind.RPAREN);
    }
    return new RecordConstructor(locs, start, lastEnd, name, arguments.build());
  }

  // constant_definition = 'const' NAME [':' type] '=' constant
  private ConstantDefinition parseConstantDefinition(int start, boolean isPublic) {
    expect(TokenKind.CONST);
    String name = expectValue(TokenKind.NAME);
    TypeExpression annotation = null;
    if (token.kind == TokenKind.COLON) {
      nextToken();
      annotation = parseType();
    }
    expect(TokenKind.EQUALS);
    Constant value = parseConstant();
    return new ConstantDefinition(locs, start, isPublic, name, annotation, value);
  }

  // import = 'import' NAME {'/' NAME} ['.' '{' unqualified {',' unqualified} [','] '}']
  //          ['as' (NAME | DISCARD_NAME)]
  private ImportDefinition parseImport() {
    int start = expect(TokenKind.IMPORT);
    StringBuilder module = new StringBuilder(expectValue(TokenKind.NAME));
    while (token.kind == TokenKind.SLASH) {
      nextToken();
      module.append('/').append(expectValue(TokenKind.NAME));
    }
    ImmutableList.Builder<UnqualifiedImport> types = ImmutableList.builder();
    ImmutableList.Builder<UnqualifiedImport> values = ImmutableList.builder();
    if (token.kind == TokenKind.DOT) {
      nextToken();
      expect(TokenKind.LBRACE);
      while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
        int itemStart = token.start;
        if (token.kind == TokenKind.TYPE) {
          nextToken();
          String name = expectValue(TokenKind.UP_NAME);
          String alias = null;
          if (token.kind == TokenKind.AS) {
            nextToken();
            alias = expectValue(TokenKind.UP_NAME);
          }
          types.add(new UnqualifiedImport(locs, itemStart, lastEnd, name, alias));
        } else {
          TokenKind nameKind = token.kind == TokenKind.UP_NAME ? TokenKind.UP_NAME : TokenKind.NAME;
          String name = expectValue(nameKind);
          String alias = null;
          if (token.kind == TokenKind.AS) {
            nextToken();
            alias = expectValue(nameKind);
          }
          values.add(new UnqualifiedImport(locs, itemStart, lastEnd, name, alias));
        }
        if (token.kind != TokenKind.COMMA) {
          break;
        }
        nextToken();
      }
      expect(TokenKind.RBRACE);
    }
    String alias = null;
    if (token.kind == TokenKind.AS) {
      nextToken();
      alias = parseParameterName();
    }
    return new ImportDefinition(
        locs, start, lastEnd, module.toString(), types.build(), values.build(), alias);
  }

  // --- Statements ---

  // Parses the statements of a function body or block, after the '{'. An empty function body is
  // an implicit 'todo'.
  private ImmutableList<Statement> parseStatementsBody(int lbrace) {
    if (token.kind == TokenKind.RBRACE) {
      return ImmutableList.of(
          new ExpressionStatement(locs, new TodoExpression(locs, lbrace, token.end, null)));
    }
    return parseStatements();
  }

  // statements = statement {statement}
  private ImmutableList<Statement> parseStatements() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      list.add(parseStatement());
    }
    return list.build();
  }

  // statement = 'let' ['assert'] pattern [':' type] '=' expr
  //           | 'use' [use_assignment {',' use_assignment}] '<-' expr
  //           | expr
  private Statement parseStatement() {
    int start = token.start;
    switch (token.kind) {
      case LET:
        {
          nextToken();
          boolean isAssert = false;
          if (token.kind == TokenKind.ASSERT) {
            isAssert = true;
            nextToken();
          }
          Pattern pattern = parsePattern();
          TypeExpression annotation = null;
          if (token.kind == TokenKind.COLON) {
            nextToken();
            annotation = parseType();
          }
          expect(TokenKind.EQUALS);
          Expression value = parseExpression();
          return new AssignmentStatement(locs, start, isAssert, pattern, annotation, value);
        }
      case USE:
        {
          nextToken();
          ImmutableList.Builder<UseAssignment> assignments = ImmutableList.builder();
          while (token.kind != TokenKind.LEFT_ARROW && token.kind != TokenKind.EOF) {
            Pattern pattern = parsePattern();
            TypeExpression annotation = null;
            if (token.kind == TokenKind.COLON) {
              nextToken();
              annotation = parseType();
            }
            assignments.add(new UseAssignment(locs, lastEnd, pattern, annotation));
            if (token.kind != TokenKind.COMMA) {
              break;
            }
            nextToken();
          }
          expect(TokenKind.LEFT_ARROW);
          Expression call = parseExpression();
          return new UseStatement(locs, start, assignments.build(), call);
        }
      default:
        return new ExpressionStatement(locs, parseExpression());
    }
  }

  // --- Expressions ---

  // expr = binop_expression of the lowest precedence
  private Expression parseExpression() {
    return parseBinaryExpression(1);
  }

  // binop_expression = binop_expression OP binop_expression
  //                  | unit
  // Handles precedence by recursing one level per precedence, and left-to-right associativity.
  // The pipe operator collects its operands into a single pipeline node.
  private Expression parseBinaryExpression(int prec) {
    if (prec > BinaryOperator.MULTIPLY_INT.precedence()) {
      return parseUnit();
    }
    Expression x = parseBinaryExpression(prec + 1);
    if (prec == BinaryOperator.PIPE_PRECEDENCE) {
      if (token.kind != TokenKind.PIPE) {
        return x;
      }
      ImmutableList.Builder<Expression> stages = ImmutableList.builder();
      stages.add(x);
      while (token.kind == TokenKind.PIPE) {
        nextToken();
        stages.add(parseBinaryExpression(prec + 1));
      }
      return new PipelineExpression(locs, stages.build());
    }
    for (; ; ) {
      BinaryOperator op = BinaryOperator.fromToken(token.kind);
      if (op == null || op.precedence() != prec) {
        return x;
      }
      nextToken();
      Expression y = parseBinaryExpression(prec + 1);
      x = new BinaryOperatorExpression(locs, x, op, y);
    }
  }

  // unit = primary {call_suffix | '.' NAME | '.' UP_NAME | '.' INT}
  private Expression parseUnit() {
    Expression e = parsePrimary();
    for (; ; ) {
      if (token.kind == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else if (token.kind == TokenKind.DOT) {
        nextToken();
        if (token.kind == TokenKind.NAME || token.kind == TokenKind.UP_NAME) {
          String label = token.raw;
          nextToken();
          e = new FieldAccessExpression(locs, e, label, lastEnd);
        } else if (token.kind == TokenKind.INT) {
          int index = parseSmallInt();
          e = new TupleIndexExpression(locs, e, index, lastEnd);
        } else {
          syntaxError("expected a field name or tuple index");
          return e;
        }
      } else {
        return e;
      }
    }
  }

  private Expression parsePrimary() {
    int start = token.start;
    switch (token.kind) {
      case INT:
        {
          String raw = token.raw;
          nextToken();
          return new IntLiteral(locs, start, lastEnd, raw);
        }
      case FLOAT:
        {
          String raw = token.raw;
          nextToken();
          return new FloatLiteral(locs, start, lastEnd, raw);
        }
      case STRING:
        {
          String raw = token.raw;
          nextToken();
          return new StringLiteral(locs, start, lastEnd, raw);
        }
      case NAME:
      case UP_NAME:
        {
          String name = token.raw;
          nextToken();
          return new Identifier(locs, start, lastEnd, name);
        }
      case HASH:
        {
          nextToken();
          expect(TokenKind.LPAREN);
          ImmutableList<Expression> elements = parseExpressions(TokenKind.RPAREN);
          expect(TokenKind.RPAREN);
          return new TupleExpression(locs, start, lastEnd, elements);
        }
      case LBRACKET:
        return parseList();
      case LESS_LESS:
        {
          nextToken();
          ImmutableList<BitArraySegment<Expression>> segments =
              parseBitArraySegments(
                  this::parseUnit,
                  this::parseUnit,
                  (s, e, raw) -> new IntLiteral(locs, s, e, raw));
          expect(TokenKind.GREATER_GREATER);
          return new BitArrayExpression(locs, start, lastEnd, segments);
        }
      case FN:
        {
          nextToken();
          ImmutableList<Parameter> parameters = parseParameters(/* labelsAllowed= */ false);
          TypeExpression returnAnnotation = null;
          if (token.kind == TokenKind.RIGHT_ARROW) {
            nextToken();
            returnAnnotation = parseType();
          }
          int lbrace = token.start;
          expect(TokenKind.LBRACE);
          ImmutableList<Statement> body = parseStatementsBody(lbrace);
          expect(TokenKind.RBRACE);
          return new FnExpression(
              locs, start, lastEnd, /* isCapture= */ false, parameters, returnAnnotation, body);
        }
      case CASE:
        return parseCase();
      case LBRACE:
        {
          nextToken();
          if (token.kind == TokenKind.RBRACE) {
            syntaxError("a block must contain at least one expression");
          }
          ImmutableList<Statement> statements = parseStatements();
          expect(TokenKind.RBRACE);
          return new BlockExpression(locs, start, lastEnd, statements);
        }
      case TODO:
        {
          nextToken();
          String message = parseOptionalMessage();
          return new TodoExpression(locs, start, lastEnd, message);
        }
      case PANIC:
        {
          nextToken();
          String message = parseOptionalMessage();
          return new PanicExpression(locs, start, lastEnd, message);
        }
      case BANG:
        {
          nextToken();
          return new NegateBoolExpression(locs, start, parseUnit());
        }
      case MINUS:
        {
          nextToken();
          if (token.kind == TokenKind.INT || token.kind == TokenKind.FLOAT) {
            return parsePrimaryWithSign(start);
          }
          return new NegateIntExpression(locs, start, parseUnit());
        }
      case DISCARD_NAME:
        {
          reportError(start, "'%s' can only be used as a call argument", token.raw);
          nextToken();
          return makeErrorExpression(start, lastEnd);
        }
      default:
        {
          syntaxError("expected expression");
          nextToken();
          return makeErrorExpression(start, lastEnd);
        }
    }
  }

  // A numeric literal preceded by a minus sign is a negative literal, whatever the spacing.
  private Expression parsePrimaryWithSign(int start) {
    String raw = "-" + token.raw;
    boolean isFloat = token.kind == TokenKind.FLOAT;
    nextToken();
    return isFloat
        ? new FloatLiteral(locs, start, lastEnd, raw)
        : new IntLiteral(locs, start, lastEnd, raw);
  }

  @Nullable
  private String parseOptionalMessage() {
    if (token.kind != TokenKind.AS) {
      return null;
    }
    nextToken();
    return expectValue(TokenKind.STRING);
  }

  // Parses a comma-separated list of expressions with an optional trailing comma, stopping before
  // the closing token.
  private ImmutableList<Expression> parseExpressions(TokenKind close) {
    ImmutableList.Builder<Expression> list = ImmutableList.builder();
    while (token.kind != close && token.kind != TokenKind.EOF) {
      list.add(parseExpression());
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    return list.build();
  }

  // list = '[' [expr {',' expr}] [',' '..' expr] [','] ']'
  private Expression parseList() {
    int start = expect(TokenKind.LBRACKET);
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    Expression tail = null;
    boolean empty = true;
    while (token.kind != TokenKind.RBRACKET && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.DOT_DOT) {
        int spread = nextToken();
        if (empty) {
          reportError(spread, "a list spread must follow at least one element");
        }
        tail = parseExpression();
        if (token.kind == TokenKind.COMMA) {
          nextToken();
        }
        break;
      }
      elements.add(parseExpression());
      empty = false;
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    expect(TokenKind.RBRACKET);
    return new ListExpression(locs, start, lastEnd, elements.build(), tail);
  }

  // call_suffix = '(' [arg {',' arg} [',']] ')'
  //             | '(' '..' expr {',' NAME ':' expr} [','] ')'
  // A call with a '_' argument is a function capture.
  private Expression parseCallSuffix(Expression function) {
    expect(TokenKind.LPAREN);
    if (token.kind == TokenKind.DOT_DOT) {
      return parseRecordUpdate(function);
    }
    ImmutableList.Builder<Argument<Expression>> builder = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      builder.add(parseCallArgument());
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    expect(TokenKind.RPAREN);
    ImmutableList<Argument<Expression>> arguments = builder.build();
    CallExpression call = new CallExpression(locs, function, arguments, lastEnd);

    Argument<Expression> hole = null;
    for (Argument<Expression> arg : arguments) {
      if (arg.getValue() instanceof Identifier
          && ((Identifier) arg.getValue()).isCaptureHole()) {
        if (hole != null) {
          reportError(arg.getStartOffset(), "a function capture may only have one '_'");
        }
        hole = arg;
      }
    }
    if (hole == null) {
      return call;
    }
    Parameter parameter =
        new Parameter(
            locs,
            hole.getValue().getStartOffset(),
            hole.getValue().getEndOffset(),
            null,
            Identifier.CAPTURE_NAME,
            null);
    return new FnExpression(
        locs,
        call.getStartOffset(),
        call.getEndOffset(),
        /* isCapture= */ true,
        ImmutableList.of(parameter),
        null,
        ImmutableList.of(new ExpressionStatement(locs, call)));
  }

  // arg = [NAME ':'] (expr | '_')
  private Argument<Expression> parseCallArgument() {
    int start = token.start;
    String label = null;
    if (token.kind != TokenKind.DISCARD_NAME) {
      Expression e = parseExpression();
      if (token.kind != TokenKind.COLON) {
        return new Argument<>(locs, start, null, e);
      }
      if (e.kind() == Expression.Kind.IDENTIFIER) {
        label = ((Identifier) e).getName();
      } else {
        syntaxError("expected a label before ':'");
      }
      nextToken();
      if (token.kind != TokenKind.DISCARD_NAME) {
        return new Argument<>(locs, start, label, parseExpression());
      }
    }
    // The hole of a function capture.
    int holeStart = token.start;
    if (!token.raw.equals("_")) {
      reportError(holeStart, "'%s' can only be used as a pattern", token.raw);
    }
    nextToken();
    if (token.kind != TokenKind.COMMA && token.kind != TokenKind.RPAREN) {
      syntaxError("'_' must be a whole call argument");
    }
    return new Argument<>(
        locs, start, label, new Identifier(locs, holeStart, lastEnd, Identifier.CAPTURE_NAME));
  }

  private Expression parseRecordUpdate(Expression constructor) {
    expect(TokenKind.DOT_DOT);
    Expression spread = parseExpression();
    ImmutableList.Builder<Argument<Expression>> arguments = ImmutableList.builder();
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.RPAREN) {
        break;
      }
      int start = token.start;
      String label = expectValue(TokenKind.NAME);
      expect(TokenKind.COLON);
      arguments.add(new Argument<>(locs, start, label, parseExpression()));
    }
    expect(TokenKind.RPAREN);
    return new RecordUpdateExpression(locs, constructor, spread, arguments.build(), lastEnd);
  }

  // case = 'case' expr {',' expr} '{' clause {clause} '}'
  private Expression parseCase() {
    int start = expect(TokenKind.CASE);
    ImmutableList.Builder<Expression> subjects = ImmutableList.builder();
    subjects.add(parseExpression());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      subjects.add(parseExpression());
    }
    expect(TokenKind.LBRACE);
    ImmutableList.Builder<Clause> clauses = ImmutableList.builder();
    if (token.kind == TokenKind.RBRACE) {
      syntaxError("a case expression must have at least one clause");
    }
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      clauses.add(parseClause());
    }
    expect(TokenKind.RBRACE);
    return new CaseExpression(locs, start, lastEnd, subjects.build(), clauses.build());
  }

  // clause = patterns {'|' patterns} ['if' guard] '->' expr
  private Clause parseClause() {
    ImmutableList<Pattern> patterns = parseClausePatterns();
    ImmutableList.Builder<ImmutableList<Pattern>> alternatives = ImmutableList.builder();
    while (token.kind == TokenKind.VBAR) {
      nextToken();
      alternatives.add(parseClausePatterns());
    }
    ClauseGuard guard = null;
    if (token.kind == TokenKind.IF) {
      nextToken();
      guard = parseGuard();
    }
    expect(TokenKind.RIGHT_ARROW);
    Expression then = parseExpression();
    return new Clause(locs, patterns, alternatives.build(), guard, then);
  }

  private ImmutableList<Pattern> parseClausePatterns() {
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    patterns.add(parsePattern());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      patterns.add(parsePattern());
    }
    return patterns.build();
  }

  // --- Bit arrays ---

  // Parses the segments of a bit array, after the '<<' and before the '>>'.
  // segment = value [':' option {'-' option}]
  private <T extends Node> ImmutableList<BitArraySegment<T>> parseBitArraySegments(
      Supplier<T> value, Supplier<T> size, LiteralFactory<T> shortSize) {
    ImmutableList.Builder<BitArraySegment<T>> segments = ImmutableList.builder();
    while (token.kind != TokenKind.GREATER_GREATER && token.kind != TokenKind.EOF) {
      T segmentValue = value.get();
      ImmutableList.Builder<BitArrayOption<T>> options = ImmutableList.builder();
      if (token.kind == TokenKind.COLON) {
        nextToken();
        options.add(parseBitArrayOption(size, shortSize));
        while (token.kind == TokenKind.MINUS) {
          nextToken();
          options.add(parseBitArrayOption(size, shortSize));
        }
      }
      segments.add(new BitArraySegment<>(locs, segmentValue, options.build(), lastEnd));
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    return segments.build();
  }

  // option = NAME | 'size' '(' value ')' | 'unit' '(' INT ')' | INT
  private <T extends Node> BitArrayOption<T> parseBitArrayOption(
      Supplier<T> size, LiteralFactory<T> shortSize) {
    int start = token.start;
    if (token.kind == TokenKind.INT) {
      String raw = token.raw;
      nextToken();
      return BitArrayOption.size(
          locs, start, lastEnd, shortSize.create(start, lastEnd, raw), /* shortForm= */ true);
    }
    String name = expectValue(TokenKind.NAME);
    switch (name) {
      case "size":
        {
          expect(TokenKind.LPAREN);
          T value = size.get();
          expect(TokenKind.RPAREN);
          return BitArrayOption.size(locs, start, lastEnd, value, /* shortForm= */ false);
        }
      case "unit":
        {
          expect(TokenKind.LPAREN);
          int unit = parseSmallInt();
          expect(TokenKind.RPAREN);
          return BitArrayOption.unit(locs, start, lastEnd, unit);
        }
      default:
        {
          BitArrayOption.Kind kind = BitArrayOption.namedKind(name);
          if (kind == null) {
            reportError(start, "unknown bit array option '%s'", name);
            kind = BitArrayOption.Kind.BITS;
          }
          return BitArrayOption.named(locs, start, lastEnd, kind);
        }
    }
  }

  // --- Patterns ---

  // pattern = pattern_unit ['as' NAME]
  private Pattern parsePattern() {
    Pattern pattern = parsePatternUnit();
    if (token.kind == TokenKind.AS) {
      nextToken();
      String name = expectValue(TokenKind.NAME);
      pattern = new AssignPattern(locs, pattern, name, lastEnd);
    }
    return pattern;
  }

  private Pattern parsePatternUnit() {
    int start = token.start;
    switch (token.kind) {
      case INT:
        {
          String raw = token.raw;
          nextToken();
          return new IntPattern(locs, start, lastEnd, raw);
        }
      case FLOAT:
        {
          String raw = token.raw;
          nextToken();
          return new FloatPattern(locs, start, lastEnd, raw);
        }
      case MINUS:
        {
          nextToken();
          boolean isFloat = token.kind == TokenKind.FLOAT;
          String raw = "-" + (isFloat ? expectValue(TokenKind.FLOAT) : expectValue(TokenKind.INT));
          return isFloat
              ? new FloatPattern(locs, start, lastEnd, raw)
              : new IntPattern(locs, start, lastEnd, raw);
        }
      case STRING:
        return parseStringPattern();
      case NAME:
        {
          String name = token.raw;
          nextToken();
          if (token.kind == TokenKind.DOT) {
            nextToken();
            return parseConstructorPattern(start, name);
          }
          return new VariablePattern(locs, start, lastEnd, name);
        }
      case DISCARD_NAME:
        {
          String name = token.raw;
          nextToken();
          return new DiscardPattern(locs, start, lastEnd, name);
        }
      case UP_NAME:
        return parseConstructorPattern(start, null);
      case HASH:
        {
          nextToken();
          expect(TokenKind.LPAREN);
          ImmutableList.Builder<Pattern> elements = ImmutableList.builder();
          while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
            elements.add(parsePattern());
            if (token.kind != TokenKind.COMMA) {
              break;
            }
            nextToken();
          }
          expect(TokenKind.RPAREN);
          return new TuplePattern(locs, start, lastEnd, elements.build());
        }
      case LBRACKET:
        return parseListPattern();
      case LESS_LESS:
        {
          nextToken();
          ImmutableList<BitArraySegment<Pattern>> segments =
              parseBitArraySegments(
                  this::parsePattern,
                  this::parseSizePattern,
                  (s, e, raw) -> new IntPattern(locs, s, e, raw));
          expect(TokenKind.GREATER_GREATER);
          return new BitArrayPattern(locs, start, lastEnd, segments);
        }
      default:
        {
          syntaxError("expected pattern");
          nextToken();
          return new DiscardPattern(locs, start, lastEnd, "_");
        }
    }
  }

  // string_pattern = STRING ['as' NAME] ['<>' (NAME | DISCARD_NAME)]
  private Pattern parseStringPattern() {
    int start = token.start;
    String value = expectValue(TokenKind.STRING);
    int stringEnd = lastEnd;
    String prefixName = null;
    if (token.kind == TokenKind.AS) {
      nextToken();
      prefixName = expectValue(TokenKind.NAME);
      if (token.kind != TokenKind.LESS_GREATER) {
        return new AssignPattern(
            locs, new StringPattern(locs, start, stringEnd, value), prefixName, lastEnd);
      }
    }
    if (token.kind != TokenKind.LESS_GREATER) {
      return new StringPattern(locs, start, stringEnd, value);
    }
    nextToken();
    String restName = parseParameterName();
    return new StringPrefixPattern(locs, start, lastEnd, value, prefixName, restName);
  }

  // constructor_pattern = UP_NAME ['(' [arg {',' arg}] [','] ['..'] ')']
  // The module qualifier, if any, has already been consumed.
  private Pattern parseConstructorPattern(int start, @Nullable String module) {
    String name = expectValue(TokenKind.UP_NAME);
    ImmutableList.Builder<Argument<Pattern>> arguments = ImmutableList.builder();
    boolean withSpread = false;
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.DOT_DOT) {
          nextToken();
          withSpread = true;
          if (token.kind == TokenKind.COMMA) {
            nextToken();
          }
          break;
        }
        arguments.add(parsePatternArgument());
        if (token.kind != TokenKind.COMMA) {
          break;
        }
        nextToken();
      }
      expect(TokenKind.RPAREN);
    }
    return new ConstructorPattern(
        locs, start, lastEnd, module, name, arguments.build(), withSpread);
  }

  // pattern_arg = [NAME ':'] pattern
  private Argument<Pattern> parsePatternArgument() {
    int start = token.start;
    Pattern value = parsePattern();
    if (token.kind == TokenKind.COLON && value.kind() == Pattern.Kind.VARIABLE) {
      nextToken();
      return new Argument<>(locs, start, ((VariablePattern) value).getName(), parsePattern());
    }
    return new Argument<>(locs, start, null, value);
  }

  // list_pattern = '[' [pattern {',' pattern}] [',' '..' [pattern]] [','] ']'
  private Pattern parseListPattern() {
    int start = expect(TokenKind.LBRACKET);
    ImmutableList.Builder<Pattern> elements = ImmutableList.builder();
    Pattern tail = null;
    boolean empty = true;
    while (token.kind != TokenKind.RBRACKET && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.DOT_DOT) {
        int spread = nextToken();
        if (empty) {
          reportError(spread, "a list spread must follow at least one element");
        }
        if (token.kind == TokenKind.COMMA || token.kind == TokenKind.RBRACKET) {
          tail = new DiscardPattern(locs, spread, lastEnd, "_");
        } else {
          tail = parsePattern();
        }
        if (token.kind == TokenKind.COMMA) {
          nextToken();
        }
        break;
      }
      elements.add(parsePattern());
      empty = false;
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    expect(TokenKind.RBRACKET);
    return new ListPattern(locs, start, lastEnd, elements.build(), tail);
  }

  // The size of a bit array pattern segment: an int or a variable bound earlier.
  private Pattern parseSizePattern() {
    int start = token.start;
    if (token.kind == TokenKind.INT) {
      String raw = token.raw;
      nextToken();
      return new IntPattern(locs, start, lastEnd, raw);
    }
    String name = expectValue(TokenKind.NAME);
    return new VarUsagePattern(locs, start, lastEnd, name);
  }

  // --- Clause guards ---

  // guard = binop_guard of the lowest precedence
  private ClauseGuard parseGuard() {
    return parseBinaryGuard(1);
  }

  private ClauseGuard parseBinaryGuard(int prec) {
    if (prec > BinaryOperator.LESS_INT.precedence()) {
      return parseGuardUnit();
    }
    ClauseGuard x = parseBinaryGuard(prec + 1);
    for (; ; ) {
      BinaryOperator op = BinaryOperator.fromToken(token.kind);
      if (op == null || !op.isGuardOperator() || op.precedence() != prec) {
        return x;
      }
      nextToken();
      ClauseGuard y = parseBinaryGuard(prec + 1);
      x = new BinaryGuard(locs, x, op, y);
    }
  }

  // guard_unit = '!' guard_unit | '{' guard '}' | NAME {'.' (NAME | INT)} | constant
  private ClauseGuard parseGuardUnit() {
    int start = token.start;
    switch (token.kind) {
      case BANG:
        nextToken();
        return new NotGuard(locs, start, parseGuardUnit());
      case LBRACE:
        {
          nextToken();
          ClauseGuard guard = parseGuard();
          expect(TokenKind.RBRACE);
          return guard;
        }
      case NAME:
        {
          String name = token.raw;
          nextToken();
          ClauseGuard variable = new VariableGuard(locs, start, lastEnd, name);
          if (token.kind != TokenKind.DOT) {
            return variable;
          }
          nextToken();
          if (token.kind == TokenKind.UP_NAME) {
            // A module-qualified constant record, such as option.None.
            return new ConstantGuard(locs, parseRecordConstant(start, name));
          }
          return parseGuardSuffix(parseGuardAccess(variable));
        }
      default:
        return new ConstantGuard(locs, parseConstant());
    }
  }

  // Parses one '.NAME' or '.INT' access, after the '.'.
  private ClauseGuard parseGuardAccess(ClauseGuard container) {
    if (token.kind == TokenKind.INT) {
      int index = parseSmallInt();
      return new TupleIndexGuard(locs, container, index, lastEnd);
    }
    String label = expectValue(TokenKind.NAME);
    return new FieldAccessGuard(locs, container, label, lastEnd);
  }

  private ClauseGuard parseGuardSuffix(ClauseGuard guard) {
    while (token.kind == TokenKind.DOT) {
      nextToken();
      guard = parseGuardAccess(guard);
    }
    return guard;
  }

  // --- Constants ---

  // constant = INT | FLOAT | STRING | '-' (INT | FLOAT)
  //          | '[' constants ']' | '#(' constants ')' | '<<' segments '>>'
  //          | [NAME '.'] UP_NAME ['(' const_args ')'] | [NAME '.'] NAME
  private Constant parseConstant() {
    int start = token.start;
    switch (token.kind) {
      case INT:
        return new IntConstant(locs, start, token.end, expectValue(TokenKind.INT));
      case FLOAT:
        return new FloatConstant(locs, start, token.end, expectValue(TokenKind.FLOAT));
      case STRING:
        return new StringConstant(locs, start, token.end, expectValue(TokenKind.STRING));
      case MINUS:
        {
          nextToken();
          if (token.kind == TokenKind.FLOAT) {
            String raw = "-" + expectValue(TokenKind.FLOAT);
            return new FloatConstant(locs, start, lastEnd, raw);
          }
          String raw = "-" + expectValue(TokenKind.INT);
          return new IntConstant(locs, start, lastEnd, raw);
        }
      case LBRACKET:
        {
          nextToken();
          ImmutableList<Constant> elements = parseConstants(TokenKind.RBRACKET);
          expect(TokenKind.RBRACKET);
          return new ListConstant(locs, start, lastEnd, elements);
        }
      case HASH:
        {
          nextToken();
          expect(TokenKind.LPAREN);
          ImmutableList<Constant> elements = parseConstants(TokenKind.RPAREN);
          expect(TokenKind.RPAREN);
          return new TupleConstant(locs, start, lastEnd, elements);
        }
      case LESS_LESS:
        {
          nextToken();
          ImmutableList<BitArraySegment<Constant>> segments =
              parseBitArraySegments(
                  this::parseConstant,
                  this::parseConstant,
                  (s, e, raw) -> new IntConstant(locs, s, e, raw));
          expect(TokenKind.GREATER_GREATER);
          return new BitArrayConstant(locs, start, lastEnd, segments);
        }
      case UP_NAME:
        return parseRecordConstant(start, null);
      case NAME:
        {
          String name = token.raw;
          nextToken();
          if (token.kind != TokenKind.DOT) {
            return new VariableConstant(locs, start, lastEnd, null, name);
          }
          nextToken();
          if (token.kind == TokenKind.UP_NAME) {
            return parseRecordConstant(start, name);
          }
          String member = expectValue(TokenKind.NAME);
          return new VariableConstant(locs, start, lastEnd, name, member);
        }
      default:
        {
          syntaxError("expected a constant value");
          nextToken();
          return new VariableConstant(
              locs, start, lastEnd, null, lexer.bufferSlice(start, lastEnd));
        }
    }
  }

  private ImmutableList<Constant> parseConstants(TokenKind close) {
    ImmutableList.Builder<Constant> list = ImmutableList.builder();
    while (token.kind != close && token.kind != TokenKind.EOF) {
      list.add(parseConstant());
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    return list.build();
  }

  // record_constant = UP_NAME ['(' [const_arg {',' const_arg}] [','] ')']
  // const_arg = [NAME ':'] constant
  private Constant parseRecordConstant(int start, @Nullable String module) {
    String name = expectValue(TokenKind.UP_NAME);
    ImmutableList.Builder<Argument<Constant>> arguments = ImmutableList.builder();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
        int argStart = token.start;
        Constant value = parseConstant();
        String label = null;
        if (token.kind == TokenKind.COLON
            && value instanceof VariableConstant
            && ((VariableConstant) value).getModule() == null) {
          label = ((VariableConstant) value).getName();
          nextToken();
          value = parseConstant();
        }
        arguments.add(new Argument<>(locs, argStart, label, value));
        if (token.kind != TokenKind.COMMA) {
          break;
        }
        nextToken();
      }
      expect(TokenKind.RPAREN);
    }
    return new RecordConstant(locs, start, lastEnd, module, name, arguments.build());
  }

  // --- Types ---

  // type = 'fn' '(' [type {',' type}] ')' '->' type
  //      | '#' '(' [type {',' type}] ')'
  //      | [NAME '.'] UP_NAME ['(' type {',' type} ')']
  //      | NAME
  //      | DISCARD_NAME
  private TypeExpression parseType() {
    int start = token.start;
    switch (token.kind) {
      case FN:
        {
          nextToken();
          expect(TokenKind.LPAREN);
          ImmutableList<TypeExpression> arguments = parseTypes();
          expect(TokenKind.RPAREN);
          expect(TokenKind.RIGHT_ARROW);
          return new FunctionType(locs, start, arguments, parseType());
        }
      case HASH:
        {
          nextToken();
          expect(TokenKind.LPAREN);
          ImmutableList<TypeExpression> elements = parseTypes();
          expect(TokenKind.RPAREN);
          return new TupleType(locs, start, lastEnd, elements);
        }
      case UP_NAME:
        return parseNamedType(start, null);
      case NAME:
        {
          String name = token.raw;
          nextToken();
          if (token.kind == TokenKind.DOT) {
            nextToken();
            return parseNamedType(start, name);
          }
          return new TypeVariable(locs, start, lastEnd, name);
        }
      case DISCARD_NAME:
        {
          String name = token.raw;
          nextToken();
          return new TypeHole(locs, start, lastEnd, name);
        }
      default:
        {
          syntaxError("expected a type");
          nextToken();
          return new TypeHole(locs, start, lastEnd, "_");
        }
    }
  }

  private TypeExpression parseNamedType(int start, @Nullable String module) {
    String name = expectValue(TokenKind.UP_NAME);
    ImmutableList<TypeExpression> arguments = ImmutableList.of();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      arguments = parseTypes();
      expect(TokenKind.RPAREN);
    }
    return new NamedType(locs, start, lastEnd, module, name, arguments);
  }

  private ImmutableList<TypeExpression> parseTypes() {
    ImmutableList.Builder<TypeExpression> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      list.add(parseType());
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    return list.build();
  }
}
