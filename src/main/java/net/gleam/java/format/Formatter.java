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
package net.gleam.java.format;

import static net.gleam.java.format.Document.concat;
import static net.gleam.java.format.Document.flexBreak;
import static net.gleam.java.format.Document.join;
import static net.gleam.java.format.Document.line;
import static net.gleam.java.format.Document.lines;
import static net.gleam.java.format.Document.nil;
import static net.gleam.java.format.Document.strictBreak;
import static net.gleam.java.format.Document.text;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;
import net.gleam.java.syntax.Argument;
import net.gleam.java.syntax.AssignPattern;
import net.gleam.java.syntax.AssignmentStatement;
import net.gleam.java.syntax.BinaryGuard;
import net.gleam.java.syntax.BinaryOperator;
import net.gleam.java.syntax.BinaryOperatorExpression;
import net.gleam.java.syntax.BitArrayConstant;
import net.gleam.java.syntax.BitArrayExpression;
import net.gleam.java.syntax.BitArrayOption;
import net.gleam.java.syntax.BitArrayPattern;
import net.gleam.java.syntax.BitArraySegment;
import net.gleam.java.syntax.BlockExpression;
import net.gleam.java.syntax.CallExpression;
import net.gleam.java.syntax.CaseExpression;
import net.gleam.java.syntax.Clause;
import net.gleam.java.syntax.ClauseGuard;
import net.gleam.java.syntax.Comment;
import net.gleam.java.syntax.Constant;
import net.gleam.java.syntax.ConstantDefinition;
import net.gleam.java.syntax.ConstantGuard;
import net.gleam.java.syntax.ConstructorPattern;
import net.gleam.java.syntax.CustomTypeDefinition;
import net.gleam.java.syntax.Definition;
import net.gleam.java.syntax.DiscardPattern;
import net.gleam.java.syntax.Expression;
import net.gleam.java.syntax.ExpressionStatement;
import net.gleam.java.syntax.ExternalBinding;
import net.gleam.java.syntax.FieldAccessExpression;
import net.gleam.java.syntax.FieldAccessGuard;
import net.gleam.java.syntax.FloatConstant;
import net.gleam.java.syntax.FloatLiteral;
import net.gleam.java.syntax.FloatPattern;
import net.gleam.java.syntax.FnExpression;
import net.gleam.java.syntax.FunctionDefinition;
import net.gleam.java.syntax.FunctionType;
import net.gleam.java.syntax.Identifier;
import net.gleam.java.syntax.ImportDefinition;
import net.gleam.java.syntax.IntConstant;
import net.gleam.java.syntax.IntLiteral;
import net.gleam.java.syntax.IntPattern;
import net.gleam.java.syntax.ListConstant;
import net.gleam.java.syntax.ListExpression;
import net.gleam.java.syntax.ListPattern;
import net.gleam.java.syntax.Module;
import net.gleam.java.syntax.NamedType;
import net.gleam.java.syntax.NegateBoolExpression;
import net.gleam.java.syntax.NegateIntExpression;
import net.gleam.java.syntax.Node;
import net.gleam.java.syntax.NotGuard;
import net.gleam.java.syntax.PanicExpression;
import net.gleam.java.syntax.Parameter;
import net.gleam.java.syntax.Pattern;
import net.gleam.java.syntax.PipelineExpression;
import net.gleam.java.syntax.RecordConstant;
import net.gleam.java.syntax.RecordConstructor;
import net.gleam.java.syntax.RecordConstructorArgument;
import net.gleam.java.syntax.RecordUpdateExpression;
import net.gleam.java.syntax.Statement;
import net.gleam.java.syntax.StringConstant;
import net.gleam.java.syntax.StringLiteral;
import net.gleam.java.syntax.StringPattern;
import net.gleam.java.syntax.StringPrefixPattern;
import net.gleam.java.syntax.TargetedDefinition;
import net.gleam.java.syntax.TodoExpression;
import net.gleam.java.syntax.TupleConstant;
import net.gleam.java.syntax.TupleExpression;
import net.gleam.java.syntax.TupleIndexExpression;
import net.gleam.java.syntax.TupleIndexGuard;
import net.gleam.java.syntax.TuplePattern;
import net.gleam.java.syntax.TupleType;
import net.gleam.java.syntax.TypeAliasDefinition;
import net.gleam.java.syntax.TypeExpression;
import net.gleam.java.syntax.TypeHole;
import net.gleam.java.syntax.TypeVariable;
import net.gleam.java.syntax.UnqualifiedImport;
import net.gleam.java.syntax.UseAssignment;
import net.gleam.java.syntax.UseStatement;
import net.gleam.java.syntax.VarUsagePattern;
import net.gleam.java.syntax.VariableConstant;
import net.gleam.java.syntax.VariableGuard;
import net.gleam.java.syntax.VariablePattern;

/**
 * Lowers a syntax tree to a {@link Document}, one method per syntactic category.
 *
 * <p>The tree is walked in source order. Before printing a node, the formatter pops from the
 * {@link TriviaCursor} the comments and blank lines that precede it, and prints them in front of
 * it.
 *
 * <p>A Formatter is used for a single module.
 */
final class Formatter {

  /** The width the output is laid out for. */
  static final int LINE_WIDTH = 80;

  /** The indentation of each nesting level. */
  static final int INDENT = 2;

  private static final Ordering<UnqualifiedImport> BY_NAME =
      Ordering.<String>natural().onResultOf(UnqualifiedImport::getName);

  private final TriviaCursor trivia;

  Formatter(TriviaCursor trivia) {
    this.trivia = trivia;
  }

  // --- Module ---

  /** Returns the document of a whole module, ending with a newline. */
  Document module(Module module) {
    List<Document> definitions = new ArrayList<>();
    boolean previousIsImport = false;
    for (TargetedDefinition def : module.getDefinitions()) {
      boolean isImport = def.getDefinition().kind() == Definition.Kind.IMPORT;
      if (!definitions.isEmpty()) {
        definitions.add(previousIsImport && isImport ? line() : lines(2));
      }
      definitions.add(targetedDefinition(def));
      previousIsImport = isImport;
    }

    Document moduleComments = nil();
    ImmutableList<String> banner = trivia.moduleComments();
    if (!banner.isEmpty()) {
      List<Document> docs = new ArrayList<>();
      for (String comment : banner) {
        docs.add(text(Comment.Kind.MODULE.prefix() + comment));
      }
      moduleComments = join(docs, line()).append(line());
    }

    // Regular comments first: popping doc comments also consumes the blank lines between them.
    Document leftoverComments = printedComments(trivia.popComments(Integer.MAX_VALUE), false);
    List<Document> leftoverDocs = new ArrayList<>();
    for (String comment : trivia.popDocComments(Integer.MAX_VALUE)) {
      leftoverDocs.add(text(Comment.Kind.DOC.prefix() + comment));
    }

    return join(
            ImmutableList.of(
                moduleComments,
                concat(definitions).group(),
                join(leftoverDocs, line()),
                leftoverComments),
            line())
        .append(line());
  }

  private Document targetedDefinition(TargetedDefinition targeted) {
    Definition def = targeted.getDefinition();
    ImmutableList<Optional<String>> comments = trivia.popComments(def.getStartOffset());
    Document doc = docComments(def.getStartOffset()).append(definition(def).group()).group();
    if (targeted.getTarget() != null) {
      doc = concat(text("@target(" + targeted.getTarget().getName() + ")"), line(), doc);
    }
    return commented(doc, comments);
  }

  private Document definition(Definition def) {
    switch (def.kind()) {
      case CONSTANT:
        return constantDefinition((ConstantDefinition) def);
      case CUSTOM_TYPE:
        return customType((CustomTypeDefinition) def);
      case FUNCTION:
        return function((FunctionDefinition) def);
      case IMPORT:
        return importDefinition((ImportDefinition) def);
      case TYPE_ALIAS:
        return typeAlias((TypeAliasDefinition) def);
    }
    throw new AssertionError(def.kind());
  }

  // --- Definitions ---

  private Document importDefinition(ImportDefinition imp) {
    Document doc = text("import " + imp.getModule());
    if (!imp.getTypes().isEmpty() || !imp.getValues().isEmpty()) {
      List<Document> items = new ArrayList<>();
      for (UnqualifiedImport type : BY_NAME.sortedCopy(imp.getTypes())) {
        items.add(text("type ").append(unqualifiedImport(type)));
      }
      for (UnqualifiedImport value : BY_NAME.sortedCopy(imp.getValues())) {
        items.add(unqualifiedImport(value));
      }
      Document list =
          concat(strictBreak("", ""), join(items, flexBreak(",", ", ")))
              .nest(INDENT)
              .append(strictBreak(",", ""))
              .group();
      doc = doc.append(text(".{"), list, text("}"));
    }
    if (imp.getAlias() != null) {
      doc = doc.append(" as " + imp.getAlias());
    }
    return doc;
  }

  private static Document unqualifiedImport(UnqualifiedImport item) {
    return item.getAlias() == null
        ? text(item.getName())
        : text(item.getName() + " as " + item.getAlias());
  }

  private Document constantDefinition(ConstantDefinition constant) {
    Document head = text(pub(constant.isPublic()) + "const " + constant.getName());
    if (constant.getAnnotation() != null) {
      head = head.append(text(": "), typeAst(constant.getAnnotation()));
    }
    return head.append(text(" = "), constExpr(constant.getValue()));
  }

  private Document typeAlias(TypeAliasDefinition alias) {
    Document head =
        deprecation(alias.getDeprecation())
            .append(text(pub(alias.isPublic()) + "type " + alias.getName()));
    if (!alias.getParameters().isEmpty()) {
      head = head.append(wrapArgs(texts(alias.getParameters())).group());
    }
    return head.append(
        text(" ="), concat(line(), typeAst(alias.getType())).group().nest(INDENT));
  }

  private Document customType(CustomTypeDefinition type) {
    trivia.popEmptyLines(type.getEndOffset());
    Document head =
        deprecation(type.getDeprecation())
            .append(
                text(
                    pub(type.isPublic())
                        + (type.isOpaque() ? "opaque type " : "type ")
                        + type.getName()));
    if (!type.getParameters().isEmpty()) {
      head = head.append(wrapArgs(texts(type.getParameters())).group());
    }
    if (type.getConstructors().isEmpty()) {
      return head;
    }

    List<Document> body = new ArrayList<>();
    boolean first = true;
    for (RecordConstructor constructor : type.getConstructors()) {
      boolean precededByBlank = trivia.popEmptyLines(constructor.getStartOffset());
      body.add(!first && precededByBlank ? lines(2) : line());
      body.add(recordConstructor(constructor));
      first = false;
    }
    Document trailing = printedComments(trivia.popComments(type.getBodyEndOffset()), false);
    if (!trailing.isEmpty()) {
      body.add(line());
      body.add(trailing);
    }
    return head.append(text(" {"), concat(body).nest(INDENT).group(), line(), text("}"));
  }

  private Document recordConstructor(RecordConstructor constructor) {
    ImmutableList<Optional<String>> comments = trivia.popComments(constructor.getStartOffset());
    Document docs = docComments(constructor.getStartOffset());
    Document doc = text(constructor.getName());
    if (!constructor.getArguments().isEmpty()) {
      doc =
          doc.append(
              wrapArgs(map(constructor.getArguments(), this::recordConstructorArgument)).group());
    }
    return commented(docs.append(doc).group(), comments);
  }

  private Document recordConstructorArgument(RecordConstructorArgument arg) {
    ImmutableList<Optional<String>> comments = trivia.popComments(arg.getStartOffset());
    Document docs = docComments(arg.getStartOffset());
    Document doc = typeAst(arg.getType());
    if (arg.getLabel() != null) {
      doc = text(arg.getLabel() + ": ").append(doc);
    }
    return commented(docs.append(doc.group()), comments);
  }

  private Document function(FunctionDefinition fn) {
    Document head = deprecation(fn.getDeprecation());
    for (ExternalBinding external : fn.getExternals()) {
      head =
          head.append(
              text(
                  "@external("
                      + external.target().getName()
                      + ", \""
                      + external.module()
                      + "\", \""
                      + external.function()
                      + "\")"),
              line());
    }
    Document signature =
        text(pub(fn.isPublic()) + "fn " + fn.getName())
            .append(wrapArgs(map(fn.getParameters(), this::fnArg)));
    if (fn.getReturnAnnotation() != null) {
      signature = signature.append(text(" -> "), typeAst(fn.getReturnAnnotation()));
    }
    head = head.append(signature.group());

    ImmutableList<Statement> body = fn.getBody();
    if (body.size() == 1 && isPlaceholder(body.get(0))) {
      return head;
    }
    Document statements = statements(body);
    Document trailing = printedComments(trivia.popComments(fn.getBodyEndOffset()), false);
    if (!trailing.isEmpty()) {
      statements = statements.append(line(), trailing);
    }
    return head.append(
        text(" {"), concat(line(), statements).nest(INDENT).group(), line(), text("}"));
  }

  private static boolean isPlaceholder(Statement statement) {
    return statement.kind() == Statement.Kind.EXPRESSION
        && ((ExpressionStatement) statement).getExpression().kind()
            == Expression.Kind.PLACEHOLDER;
  }

  private Document fnArg(Parameter param) {
    ImmutableList<Optional<String>> comments = trivia.popComments(param.getStartOffset());
    String names =
        param.getLabel() == null ? param.getName() : param.getLabel() + " " + param.getName();
    Document doc = text(names);
    if (param.getAnnotation() != null) {
      doc = doc.append(text(": "), typeAst(param.getAnnotation()));
    }
    return commented(doc.group(), comments);
  }

  // --- Statements ---

  /**
   * Returns the statements of a body one per line, keeping a single blank line where the source
   * had any. Anything but a lone expression is force-broken.
   */
  private Document statements(List<Statement> statements) {
    List<Document> docs = new ArrayList<>();
    int previousEnd = 0;
    for (int i = 0; i < statements.size(); i++) {
      Statement statement = statements.get(i);
      boolean precededByBlank = trivia.popEmptyLines(previousEnd + 1);
      if (i > 0) {
        docs.add(precededByBlank ? lines(2) : line());
      }
      previousEnd = statement.getEndOffset();
      docs.add(statement(statement).group());
    }
    Document doc = concat(docs);
    if (statements.size() == 1 && statements.get(0).kind() == Statement.Kind.EXPRESSION) {
      return doc;
    }
    return doc.forceBreak();
  }

  private Document statement(Statement statement) {
    switch (statement.kind()) {
      case ASSIGNMENT:
        return assignment((AssignmentStatement) statement);
      case EXPRESSION:
        return expr(((ExpressionStatement) statement).getExpression());
      case USE:
        return use((UseStatement) statement);
    }
    throw new AssertionError(statement.kind());
  }

  private Document assignment(AssignmentStatement assignment) {
    ImmutableList<Optional<String>> comments = trivia.popComments(assignment.getStartOffset());
    trivia.popEmptyLines(assignment.getPattern().getEndOffset());
    Document pattern = pattern(assignment.getPattern());
    if (assignment.getAnnotation() != null) {
      pattern = pattern.append(text(": "), typeAst(assignment.getAnnotation()));
    }
    Document doc =
        text(assignment.isAssert() ? "let assert " : "let ")
            .append(pattern.group(), text(" ="), assignedValue(assignment.getValue()));
    return commented(doc, comments);
  }

  private Document use(UseStatement use) {
    ImmutableList<Optional<String>> comments = trivia.popComments(use.getStartOffset());
    Expression call = use.getCall();
    Document callDoc =
        call.kind() == Expression.Kind.CALL
            ? text(" ").append(expr(call)).group()
            : concat(strictBreak("", " "), expr(call)).nest(INDENT).group();
    Document doc;
    if (use.getAssignments().isEmpty()) {
      doc = text("use <-").append(callDoc);
    } else {
      List<Document> assignments = new ArrayList<>();
      for (UseAssignment assignment : use.getAssignments()) {
        Document pattern = pattern(assignment.getPattern());
        if (assignment.getAnnotation() != null) {
          pattern = pattern.append(text(": "), typeAst(assignment.getAnnotation()));
        }
        assignments.add(pattern.group());
      }
      Document left =
          concat(text("use"), strictBreak("", " "), join(assignments, strictBreak(",", ", ")))
              .nest(INDENT)
              .append(strictBreak("", " "))
              .group();
      doc = concat(left, text("<-"), callDoc).group();
    }
    return commented(doc, comments);
  }

  // --- Expressions ---

  private Document expr(Expression expr) {
    ImmutableList<Optional<String>> comments = trivia.popComments(expr.getStartOffset());
    return commented(exprWithoutComments(expr), comments);
  }

  private Document exprWithoutComments(Expression expr) {
    switch (expr.kind()) {
      case PLACEHOLDER:
        throw new AssertionError("placeholder expression reached the formatter");
      case PANIC:
        return withMessage("panic", ((PanicExpression) expr).getMessage());
      case TODO:
        return withMessage("todo", ((TodoExpression) expr).getMessage());
      case PIPELINE:
        return pipeline(((PipelineExpression) expr).getStages());
      case INT_LITERAL:
        return integer(((IntLiteral) expr).getValue());
      case FLOAT_LITERAL:
        return floating(((FloatLiteral) expr).getValue());
      case STRING_LITERAL:
        return string(((StringLiteral) expr).getValue());
      case BLOCK:
        return block((BlockExpression) expr);
      case IDENTIFIER:
        {
          Identifier id = (Identifier) expr;
          return text(id.isCaptureHole() ? "_" : id.getName());
        }
      case TUPLE_INDEX:
        {
          TupleIndexExpression index = (TupleIndexExpression) expr;
          return expr(index.getTuple()).append("." + index.getIndex());
        }
      case NEGATE_INT:
        return negateInt(((NegateIntExpression) expr).getValue());
      case NEGATE_BOOL:
        return negateBool(((NegateBoolExpression) expr).getValue());
      case FN:
        {
          FnExpression fn = (FnExpression) expr;
          return fn.isCapture() ? fnCapture(fn) : anonymousFn(fn);
        }
      case LIST:
        {
          ListExpression list = (ListExpression) expr;
          return list(list.getElements(), list.getTail());
        }
      case CALL:
        {
          CallExpression call = (CallExpression) expr;
          return call(call.getFunction(), call.getArguments());
        }
      case BINARY_OPERATOR:
        return binaryOperator((BinaryOperatorExpression) expr);
      case CASE:
        return caseExpr((CaseExpression) expr);
      case FIELD_ACCESS:
        {
          FieldAccessExpression access = (FieldAccessExpression) expr;
          return expr(access.getContainer()).append("." + access.getLabel());
        }
      case TUPLE:
        return text("#")
            .append(wrapArgs(map(((TupleExpression) expr).getElements(), this::expr)))
            .group();
      case BIT_ARRAY:
        {
          ImmutableList<BitArraySegment<Expression>> segments =
              ((BitArrayExpression) expr).getSegments();
          boolean simple = true;
          List<Document> docs = new ArrayList<>();
          for (BitArraySegment<Expression> segment : segments) {
            simple &= isSimpleSegment(segment, isSimple(segment.getValue()));
            docs.add(bitArraySegment(segment, this::bitArraySegmentExpr));
          }
          return bitArray(docs, simple);
        }
      case RECORD_UPDATE:
        return recordUpdate((RecordUpdateExpression) expr);
    }
    throw new AssertionError(expr.kind());
  }

  private static Document withMessage(String keyword, @Nullable String message) {
    return message == null ? text(keyword) : text(keyword + " as \"" + message + "\"");
  }

  private Document bitArraySegmentExpr(Expression value) {
    Document doc = expr(value);
    return value.kind() == Expression.Kind.BINARY_OPERATOR ? wrapBlock(doc).group() : doc;
  }

  private Document negateInt(Expression value) {
    Expression.Kind kind = value.kind();
    if (kind == Expression.Kind.BINARY_OPERATOR || kind == Expression.Kind.NEGATE_INT) {
      return text("- ").append(expr(value));
    }
    return text("-").append(expr(value));
  }

  private Document negateBool(Expression value) {
    if (value.kind() == Expression.Kind.BINARY_OPERATOR) {
      return text("!").append(wrapBlock(expr(value)).group());
    }
    return text("!").append(expr(value));
  }

  private Document block(BlockExpression block) {
    Document statements = withTrailingComments(statements(block.getStatements()), block);
    return concat(
            text("{"),
            concat(strictBreak("", " "), statements).nest(INDENT),
            strictBreak("", " "),
            text("}"))
        .group();
  }

  // Appends the comments left before the closing brace of a node.
  private Document withTrailingComments(Document doc, Node node) {
    Document trailing = printedComments(trivia.popComments(node.getEndOffset()), false);
    if (trailing.isEmpty()) {
      return doc;
    }
    return doc.append(line(), trailing).forceBreak();
  }

  private Document anonymousFn(FnExpression fn) {
    Document doc = text("fn").append(wrapArgs(map(fn.getParameters(), this::fnArg)).group());
    if (fn.getReturnAnnotation() != null) {
      doc = doc.append(text(" -> "), typeAst(fn.getReturnAnnotation()));
    }
    Document body = withTrailingComments(statements(fn.getBody()), fn);
    return doc.append(text(" "), wrapBlock(body).group()).group();
  }

  // Returns the call of a capture, which is the only statement of its body.
  private static CallExpression captureCall(FnExpression fn) {
    ImmutableList<Statement> body = fn.getBody();
    if (body.size() == 1 && body.get(0).kind() == Statement.Kind.EXPRESSION) {
      Expression call = ((ExpressionStatement) body.get(0)).getExpression();
      if (call.kind() == Expression.Kind.CALL) {
        return (CallExpression) call;
      }
    }
    throw new AssertionError("function capture body is not a call");
  }

  private Document fnCapture(FnExpression fn) {
    CallExpression call = captureCall(fn);
    List<Argument<Expression>> args = call.getArguments();
    Document function = expr(call.getFunction());
    if (args.size() == 2
        && args.get(0).isCaptureHole()
        && isBreakable(args.get(1).getValue())) {
      return function.append(text("(_, "), callArg(args.get(1)), text(")")).group();
    }
    return function.append(wrapArgs(map(args, this::callArg)).group());
  }

  private Document call(Expression function, List<Argument<Expression>> args) {
    Document fun;
    switch (function.kind()) {
      case PLACEHOLDER:
        throw new AssertionError("placeholder expression in call position");
      case PIPELINE:
        fun = breakBlock(expr(function));
        break;
      default:
        fun = expr(function);
        break;
    }
    if (args.size() == 1) {
      Argument<Expression> arg = args.get(0);
      if (isBreakable(arg.getValue()) && !trivia.anyCommentsBefore(arg.getStartOffset())) {
        return fun.append(text("("), callArg(arg), text(")")).group();
      }
    }
    return fun.append(wrapArgs(map(args, this::callArg)).group()).group();
  }

  private Document callArg(Argument<Expression> arg) {
    if (arg.getLabel() == null) {
      return expr(arg.getValue());
    }
    Document label =
        commented(text(arg.getLabel() + ": "), trivia.popComments(arg.getStartOffset()));
    return label.append(expr(arg.getValue()));
  }

  private Document recordUpdate(RecordUpdateExpression update) {
    Document constructor = expr(update.getConstructor());
    List<Document> args = new ArrayList<>();
    ImmutableList<Optional<String>> spreadComments =
        trivia.popComments(update.getSpread().getStartOffset());
    args.add(commented(text("..").append(expr(update.getSpread())), spreadComments));
    for (Argument<Expression> arg : update.getArguments()) {
      ImmutableList<Optional<String>> comments = trivia.popComments(arg.getStartOffset());
      args.add(commented(text(arg.getLabel() + ": ").append(expr(arg.getValue())), comments));
    }
    return constructor.append(wrapArgs(args)).group();
  }

  private Document binaryOperator(BinaryOperatorExpression binop) {
    BinaryOperator op = binop.getOperator();
    Expression x = binop.getX();
    Expression y = binop.getY();
    Document left = operatorSide(expr(x), op.precedence(), x.precedence());
    Document right = operatorSide(expr(y), op.precedence(), y.precedence() - 1);
    return concat(left, text(" " + op.symbol() + " "), right);
  }

  // An operand that binds looser than its position requires is wrapped in a block.
  private static Document operatorSide(Document doc, int required, int actual) {
    return required > actual ? wrapBlock(doc).group() : doc;
  }

  private Document pipeline(List<Expression> stages) {
    List<Document> docs = new ArrayList<>();
    Expression first = stages.get(0);
    docs.add(operatorSide(expr(first), BinaryOperator.PIPE_PRECEDENCE, first.precedence()));
    for (Expression stage : stages.subList(1, stages.size())) {
      ImmutableList<Optional<String>> comments = trivia.popComments(stage.getStartOffset());
      Document doc =
          stage.kind() == Expression.Kind.FN && ((FnExpression) stage).isCapture()
              ? pipeCaptureStage((FnExpression) stage)
              : expr(stage);
      docs.add(line());
      docs.add(commented(text("|> "), comments));
      docs.add(operatorSide(doc, BinaryOperator.PIPE_PRECEDENCE + 1, stage.precedence()));
    }
    return concat(docs).forceBreak();
  }

  // The piped value fills the hole when it is the first argument, so the hole is left out.
  private Document pipeCaptureStage(FnExpression fn) {
    CallExpression call = captureCall(fn);
    List<Argument<Expression>> args = call.getArguments();
    Document function = expr(call.getFunction());
    if (!args.get(0).isCaptureHole()) {
      return function.append(wrapArgs(map(args, this::callArg)).group());
    }
    if (args.size() == 1) {
      return function;
    }
    return function.append(wrapArgs(map(args.subList(1, args.size()), this::callArg)).group());
  }

  private Document caseExpr(CaseExpression caseExpr) {
    Document subjects = join(map(caseExpr.getSubjects(), this::expr), strictBreak(",", ", "));
    Document head =
        concat(strictBreak("case", "case "), subjects)
            .nest(INDENT)
            .append(strictBreak("", " "), text("{"))
            .group();
    List<Document> clauses = new ArrayList<>();
    ImmutableList<Clause> list = caseExpr.getClauses();
    for (int i = 0; i < list.size(); i++) {
      clauses.add(clause(list.get(i), i));
    }
    Document body = withTrailingComments(concat(clauses), caseExpr);
    return head.append(concat(line(), body).nest(INDENT), line(), text("}")).forceBreak();
  }

  private Document clause(Clause clause, int index) {
    boolean precededByBlank = trivia.popEmptyLines(clause.getStartOffset());
    ImmutableList<Optional<String>> comments = trivia.popComments(clause.getStartOffset());
    List<Document> alternatives = new ArrayList<>();
    alternatives.add(join(map(clause.getPatterns(), this::pattern), text(", ")));
    for (List<Pattern> alternative : clause.getAlternativePatterns()) {
      alternatives.add(join(map(alternative, this::pattern), text(", ")));
    }
    Document patterns = join(alternatives, concat(strictBreak("", " "), text("| "))).group();
    if (clause.getGuard() != null) {
      patterns = patterns.append(text(" if "), clauseGuard(clause.getGuard()));
    }
    Document separator = index == 0 ? nil() : precededByBlank ? lines(2) : line();
    return concat(
        separator,
        commented(patterns, comments),
        text(" ->"),
        caseClauseValue(clause.getThen()));
  }

  private Document caseClauseValue(Expression value) {
    switch (value.kind()) {
      case FN:
      case LIST:
      case TUPLE:
      case BIT_ARRAY:
        return text(" ").append(expr(value)).group();
      case CASE:
        return concat(line(), expr(value)).nest(INDENT).group();
      case BLOCK:
        {
          BlockExpression block = (BlockExpression) value;
          Document statements = withTrailingComments(statements(block.getStatements()), block);
          return concat(
                  text(" {"), concat(line(), statements).nest(INDENT).group(), line(), text("}"))
              .group();
        }
      default:
        return concat(strictBreak("", " "), expr(value)).nest(INDENT).group();
    }
  }

  private Document assignedValue(Expression value) {
    if (value.kind() == Expression.Kind.CASE) {
      return text(" ").append(expr(value)).group();
    }
    return caseClauseValue(value);
  }

  private Document list(List<Expression> elements, @Nullable Expression tail) {
    if (elements.isEmpty()) {
      return tail == null ? text("[]") : expr(tail);
    }
    boolean simple = tail == null;
    for (Expression element : elements) {
      simple &= isSimple(element);
    }
    Document comma = simple ? flexBreak(",", ", ") : strictBreak(",", ", ");
    Document doc = concat(strictBreak("[", "["), join(map(elements, this::expr), comma));
    if (tail == null) {
      doc = doc.nest(INDENT).append(strictBreak(",", ""));
    } else {
      ImmutableList<Optional<String>> comments = trivia.popComments(tail.getStartOffset());
      Document spread = commented(text("..").append(expr(tail)), comments);
      doc = doc.append(strictBreak(",", ", "), spread).nest(INDENT).append(strictBreak("", ""));
    }
    return doc.append(text("]")).group();
  }

  // --- Patterns ---

  private Document pattern(Pattern pattern) {
    ImmutableList<Optional<String>> comments = trivia.popComments(pattern.getStartOffset());
    return commented(patternWithoutComments(pattern), comments);
  }

  private Document patternWithoutComments(Pattern pattern) {
    switch (pattern.kind()) {
      case INT:
        return integer(((IntPattern) pattern).getValue());
      case FLOAT:
        return floating(((FloatPattern) pattern).getValue());
      case STRING:
        return string(((StringPattern) pattern).getValue());
      case VARIABLE:
        return text(((VariablePattern) pattern).getName());
      case VAR_USAGE:
        return text(((VarUsagePattern) pattern).getName());
      case DISCARD:
        return text(((DiscardPattern) pattern).getName());
      case ASSIGN:
        {
          AssignPattern assign = (AssignPattern) pattern;
          return pattern(assign.getPattern()).append(" as " + assign.getName());
        }
      case LIST:
        {
          ListPattern list = (ListPattern) pattern;
          return listPattern(list.getElements(), list.getTail());
        }
      case CONSTRUCTOR:
        return constructorPattern((ConstructorPattern) pattern);
      case TUPLE:
        return text("#")
            .append(wrapArgs(map(((TuplePattern) pattern).getElements(), this::pattern)))
            .group();
      case BIT_ARRAY:
        return bitArray(
            map(
                ((BitArrayPattern) pattern).getSegments(),
                segment -> bitArraySegment(segment, this::pattern)),
            false);
      case STRING_PREFIX:
        {
          StringPrefixPattern prefix = (StringPrefixPattern) pattern;
          StringBuilder buf = new StringBuilder();
          buf.append('"').append(prefix.getPrefix()).append('"');
          if (prefix.getPrefixName() != null) {
            buf.append(" as ").append(prefix.getPrefixName());
          }
          buf.append(" <> ").append(prefix.getRestName());
          return text(buf.toString());
        }
    }
    throw new AssertionError(pattern.kind());
  }

  private Document listPattern(List<Pattern> elements, @Nullable Pattern tail) {
    if (elements.isEmpty()) {
      return tail == null ? text("[]") : pattern(tail);
    }
    Document doc =
        concat(strictBreak("[", "["), join(map(elements, this::pattern), strictBreak(",", ", ")));
    if (tail == null) {
      doc = doc.nest(INDENT).append(strictBreak(",", ""));
    } else {
      Document spread =
          tail.kind() == Pattern.Kind.DISCARD && ((DiscardPattern) tail).getName().equals("_")
              ? text("..")
              : text("..").append(pattern(tail));
      doc = doc.append(strictBreak(",", ", "), spread).nest(INDENT).append(strictBreak("", ""));
    }
    return doc.append(text("]")).group();
  }

  private Document constructorPattern(ConstructorPattern constructor) {
    String name =
        constructor.getModule() == null
            ? constructor.getName()
            : constructor.getModule() + "." + constructor.getName();
    List<Argument<Pattern>> args = constructor.getArguments();
    if (args.isEmpty()) {
      return text(constructor.hasSpread() ? name + "(..)" : name);
    }
    if (constructor.hasSpread()) {
      return text(name).append(wrapArgsWithSpread(map(args, this::patternCallArg)));
    }
    if (args.size() == 1 && isBreakable(args.get(0).getValue())) {
      return text(name + "(").append(patternCallArg(args.get(0)), text(")")).group();
    }
    return text(name).append(wrapArgs(map(args, this::patternCallArg))).group();
  }

  private Document patternCallArg(Argument<Pattern> arg) {
    Document value = pattern(arg.getValue());
    return arg.getLabel() == null ? value : text(arg.getLabel() + ": ").append(value);
  }

  private static boolean isBreakable(Pattern pattern) {
    switch (pattern.kind()) {
      case TUPLE:
      case LIST:
      case BIT_ARRAY:
        return true;
      case CONSTRUCTOR:
        return !((ConstructorPattern) pattern).getArguments().isEmpty();
      default:
        return false;
    }
  }

  // --- Clause guards ---

  private Document clauseGuard(ClauseGuard guard) {
    switch (guard.kind()) {
      case BINARY_OPERATOR:
        {
          BinaryGuard binop = (BinaryGuard) guard;
          int prec = binop.getOperator().precedence();
          Document left = operatorSide(clauseGuard(binop.getX()), prec, binop.getX().precedence());
          Document right =
              operatorSide(clauseGuard(binop.getY()), prec, binop.getY().precedence() - 1);
          return concat(left, text(" " + binop.getOperator().symbol() + " "), right);
        }
      case NOT:
        {
          ClauseGuard inner = ((NotGuard) guard).getGuard();
          Document doc = clauseGuard(inner);
          if (inner.kind() == ClauseGuard.Kind.BINARY_OPERATOR) {
            doc = wrapBlock(doc).group();
          }
          return text("!").append(doc);
        }
      case VARIABLE:
        return text(((VariableGuard) guard).getName());
      case TUPLE_INDEX:
        {
          TupleIndexGuard index = (TupleIndexGuard) guard;
          return clauseGuard(index.getTuple()).append("." + index.getIndex());
        }
      case FIELD_ACCESS:
        {
          FieldAccessGuard access = (FieldAccessGuard) guard;
          return clauseGuard(access.getContainer()).append("." + access.getLabel());
        }
      case CONSTANT:
        return constExpr(((ConstantGuard) guard).getConstant());
    }
    throw new AssertionError(guard.kind());
  }

  // --- Constants ---

  private Document constExpr(Constant constant) {
    switch (constant.kind()) {
      case INT:
        return integer(((IntConstant) constant).getValue());
      case FLOAT:
        return floating(((FloatConstant) constant).getValue());
      case STRING:
        return string(((StringConstant) constant).getValue());
      case LIST:
        {
          ImmutableList<Constant> elements = ((ListConstant) constant).getElements();
          if (elements.isEmpty()) {
            return text("[]");
          }
          boolean simple = true;
          for (Constant element : elements) {
            simple &= isSimple(element);
          }
          Document comma = simple ? flexBreak(",", ", ") : strictBreak(",", ", ");
          return concat(strictBreak("[", "["), join(map(elements, this::constExpr), comma))
              .nest(INDENT)
              .append(strictBreak(",", ""), text("]"))
              .group();
        }
      case TUPLE:
        return text("#")
            .append(wrapArgs(map(((TupleConstant) constant).getElements(), this::constExpr)))
            .group();
      case BIT_ARRAY:
        {
          boolean simple = true;
          List<Document> docs = new ArrayList<>();
          for (BitArraySegment<Constant> segment : ((BitArrayConstant) constant).getSegments()) {
            simple &= isSimpleSegment(segment, isSimple(segment.getValue()));
            docs.add(bitArraySegment(segment, this::constExpr));
          }
          return bitArray(docs, simple);
        }
      case RECORD:
        {
          RecordConstant record = (RecordConstant) constant;
          Document name = text(qualified(record.getModule(), record.getName()));
          if (record.getArguments().isEmpty()) {
            return name;
          }
          return name.append(wrapArgs(map(record.getArguments(), this::constantCallArg))).group();
        }
      case VARIABLE:
        {
          VariableConstant variable = (VariableConstant) constant;
          return text(qualified(variable.getModule(), variable.getName()));
        }
    }
    throw new AssertionError(constant.kind());
  }

  private Document constantCallArg(Argument<Constant> arg) {
    Document value = constExpr(arg.getValue());
    return arg.getLabel() == null ? value : text(arg.getLabel() + ": ").append(value);
  }

  // --- Types ---

  private Document typeAst(TypeExpression type) {
    return typeAstWithoutGroup(type).group();
  }

  private Document typeAstWithoutGroup(TypeExpression type) {
    switch (type.kind()) {
      case HOLE:
        return text(((TypeHole) type).getName());
      case VARIABLE:
        return text(((TypeVariable) type).getName());
      case NAMED:
        {
          NamedType named = (NamedType) type;
          Document name = text(qualified(named.getModule(), named.getName()));
          if (named.getArguments().isEmpty()) {
            return name;
          }
          return name.append(wrapArgs(map(named.getArguments(), this::typeAst)));
        }
      case FUNCTION:
        {
          FunctionType fn = (FunctionType) type;
          return text("fn")
              .append(
                  wrapArgs(map(fn.getArguments(), this::typeAst)).group(),
                  text(" ->"),
                  concat(strictBreak("", " "), typeAst(fn.getReturnType())).nest(INDENT));
        }
      case TUPLE:
        return text("#").append(wrapArgs(map(((TupleType) type).getElements(), this::typeAst)));
    }
    throw new AssertionError(type.kind());
  }

  // --- Bit arrays ---

  private static Document bitArray(List<Document> segments, boolean simple) {
    Document comma = simple ? flexBreak(",", ", ") : strictBreak(",", ", ");
    return concat(strictBreak("<<", "<<"), join(segments, comma))
        .nest(INDENT)
        .append(strictBreak(",", ""), text(">>"))
        .group();
  }

  private <T extends Node> Document bitArraySegment(
      BitArraySegment<T> segment, Function<T, Document> printer) {
    Document value = printer.apply(segment.getValue());
    if (segment.getOptions().isEmpty()) {
      return value;
    }
    List<Document> options = new ArrayList<>();
    for (BitArrayOption<T> option : segment.getOptions()) {
      switch (option.kind()) {
        case SIZE:
          Document size = printer.apply(option.getValue());
          options.add(option.isShortForm() ? size : size.surround("size(", ")"));
          break;
        case UNIT:
          options.add(text("unit(" + option.getUnit() + ")"));
          break;
        default:
          options.add(text(option.kind().canonicalName()));
          break;
      }
    }
    return value.append(text(":"), join(options, text("-")));
  }

  private static boolean isSimpleSegment(BitArraySegment<?> segment, boolean valueIsSimple) {
    if (!valueIsSimple) {
      return false;
    }
    for (BitArrayOption<?> option : segment.getOptions()) {
      if (!option.isNamed()) {
        return false;
      }
    }
    return true;
  }

  // --- Classification ---

  /**
   * Reports whether an element packs with flex breaks: a literal, a bare variable, or a tuple or
   * tail-less list of such elements.
   */
  private static boolean isSimple(Expression expr) {
    switch (expr.kind()) {
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case STRING_LITERAL:
        return true;
      case IDENTIFIER:
        return !((Identifier) expr).isCaptureHole();
      case TUPLE:
        return allSimple(((TupleExpression) expr).getElements());
      case LIST:
        {
          ListExpression list = (ListExpression) expr;
          return list.getTail() == null && allSimple(list.getElements());
        }
      default:
        return false;
    }
  }

  private static boolean allSimple(List<Expression> elements) {
    for (Expression element : elements) {
      if (!isSimple(element)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isSimple(Constant constant) {
    switch (constant.kind()) {
      case INT:
      case FLOAT:
      case STRING:
        return true;
      case VARIABLE:
        return ((VariableConstant) constant).getModule() == null;
      case TUPLE:
        return allSimpleConstants(((TupleConstant) constant).getElements());
      case LIST:
        return allSimpleConstants(((ListConstant) constant).getElements());
      default:
        return false;
    }
  }

  private static boolean allSimpleConstants(List<Constant> elements) {
    for (Constant element : elements) {
      if (!isSimple(element)) {
        return false;
      }
    }
    return true;
  }

  /** Reports whether a sole call argument may hug the parentheses. */
  private static boolean isBreakable(Expression expr) {
    switch (expr.kind()) {
      case FN:
      case BLOCK:
      case CALL:
      case CASE:
      case LIST:
      case TUPLE:
      case BIT_ARRAY:
        return true;
      default:
        return false;
    }
  }

  // --- Literals ---

  private static Document integer(String value) {
    String digits = value.startsWith("-") ? value.substring(1) : value;
    if (digits.startsWith("0x") || digits.startsWith("0b") || digits.startsWith("0o")) {
      return text(value);
    }
    return text(underscoreIntegerString(value));
  }

  /**
   * Strips the underscores of a decimal integer and, for numbers of 5 or more characters (6 if
   * negative), puts them back every 3 digits.
   */
  static String underscoreIntegerString(String value) {
    boolean negative = value.startsWith("-");
    String digits = value.replace("_", "");
    boolean insert = digits.length() >= (negative ? 6 : 5);
    StringBuilder reversed = new StringBuilder();
    int count = 0;
    for (int i = digits.length() - 1; i >= 0; i--) {
      char ch = digits.charAt(i);
      if (insert && count > 0 && ch != '-' && count % 3 == 0) {
        reversed.append('_');
      }
      reversed.append(ch);
      count++;
    }
    return reversed.reverse().toString();
  }

  private static Document floating(String value) {
    int dot = value.indexOf('.');
    String fraction = value.substring(dot + 1);
    String exponent = "";
    int e = fraction.indexOf('e');
    if (e >= 0) {
      exponent = fraction.substring(e);
      fraction = fraction.substring(0, e);
    }
    int end = fraction.length();
    while (end > 0 && fraction.charAt(end - 1) == '0') {
      end--;
    }
    fraction = end == 0 ? "0" : fraction.substring(0, end);
    return text(underscoreIntegerString(value.substring(0, dot)) + "." + fraction + exponent);
  }

  private static Document string(String value) {
    Document doc = text("\"" + value + "\"");
    return value.indexOf('\n') >= 0 ? doc.forceBreak() : doc;
  }

  // --- Comments ---

  /** Returns the doc comments up to {@code limit} as a block of {@code ///} lines. */
  private Document docComments(int limit) {
    List<Document> docs = new ArrayList<>();
    for (String comment : trivia.popDocComments(limit)) {
      docs.add(text(Comment.Kind.DOC.prefix() + comment));
    }
    if (docs.isEmpty()) {
      return nil();
    }
    return join(docs, line()).append(line()).forceBreak();
  }

  /**
   * Prints a run of comments, one per line, with a blank line where the run has a marker. With
   * {@code trailingNewline}, the run ends with a newline, two after a final marker, and is
   * force-broken; otherwise a final marker is dropped.
   */
  static Document printedComments(List<Optional<String>> run, boolean trailingNewline) {
    if (run.isEmpty()) {
      return nil();
    }
    List<Document> docs = new ArrayList<>();
    int i = 0;
    while (i < run.size()) {
      Optional<String> item = run.get(i++);
      if (!item.isPresent()) {
        continue;
      }
      docs.add(text(Comment.Kind.REGULAR.prefix() + item.get()));
      if (i < run.size() && run.get(i).isPresent()) {
        docs.add(line());
      } else if (i < run.size()) {
        i++; // the blank-line marker
        if (i < run.size() || trailingNewline) {
          docs.add(lines(2));
        }
      } else if (trailingNewline) {
        docs.add(line());
      }
    }
    Document doc = concat(docs);
    return trailingNewline ? doc.forceBreak() : doc;
  }

  /** Prefixes a document with the comments that precede it. */
  private static Document commented(Document doc, List<Optional<String>> comments) {
    Document printed = printedComments(comments, true);
    return printed.isEmpty() ? doc : printed.append(doc.group());
  }

  // --- Helpers ---

  private static String pub(boolean isPublic) {
    return isPublic ? "pub " : "";
  }

  private static String qualified(@Nullable String module, String name) {
    return module == null ? name : module + "." + name;
  }

  private static Document deprecation(@Nullable String message) {
    return message == null ? nil() : text("@deprecated(\"" + message + "\")").append(line());
  }

  private static List<Document> texts(List<String> names) {
    List<Document> docs = new ArrayList<>();
    for (String name : names) {
      docs.add(text(name));
    }
    return docs;
  }

  private static <T> List<Document> map(List<T> nodes, Function<? super T, Document> printer) {
    List<Document> docs = new ArrayList<>();
    for (T node : nodes) {
      docs.add(printer.apply(node));
    }
    return docs;
  }

  /** Returns {@code doc} between braces, on its own indented lines when broken. */
  private static Document breakBlock(Document doc) {
    return concat(text("{"), concat(line(), doc).nest(INDENT), line(), text("}")).forceBreak();
  }

  private static Document wrapBlock(Document doc) {
    return concat(strictBreak("{", "{ "), doc)
        .nest(INDENT)
        .append(strictBreak("", " "), text("}"));
  }

  /** Returns the arguments in parentheses, one per line with a trailing comma when broken. */
  private static Document wrapArgs(List<Document> args) {
    if (args.isEmpty()) {
      return text("()");
    }
    return concat(strictBreak("(", "("), join(args, strictBreak(",", ", ")))
        .nest(INDENT)
        .append(strictBreak(",", ""), text(")"));
  }

  private static Document wrapArgsWithSpread(List<Document> args) {
    if (args.isEmpty()) {
      return text("(..)");
    }
    return concat(
            strictBreak("(", "("),
            join(args, strictBreak(",", ", ")),
            strictBreak(",", ", "),
            text(".."))
        .nest(INDENT)
        .append(strictBreak(",", ""), text(")"))
        .group();
  }
}
