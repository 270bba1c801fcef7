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

import com.google.common.collect.Ordering;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A printer of syntax trees as compact parenthesized dumps. The dump records the structure of a
 * tree and the spelling of its leaves, but no offsets, layout or comments, so two parses of
 * differently formatted text print the same iff they have the same meaning.
 */
final class NodePrinter {

  private static final Ordering<UnqualifiedImport> BY_NAME =
      Ordering.<String>natural().onResultOf(UnqualifiedImport::getName);

  private final StringBuilder buf = new StringBuilder();

  private NodePrinter() {}

  /** Returns the dump of a node. */
  static String print(Node node) {
    NodePrinter printer = new NodePrinter();
    printer.printNode(node);
    return printer.buf.toString();
  }

  private void open(String tag) {
    buf.append('(').append(tag);
  }

  private void close() {
    buf.append(')');
  }

  // Appends a leaf value: a name, a literal spelling, or "-" for an absent optional.
  private void leaf(@Nullable Object value) {
    buf.append(' ');
    if (value == null) {
      buf.append('-');
    } else if (value instanceof String) {
      buf.append('"').append(value).append('"');
    } else {
      buf.append(value);
    }
  }

  private void child(@Nullable Node node) {
    buf.append(' ');
    if (node == null) {
      buf.append('-');
    } else {
      printNode(node);
    }
  }

  private void children(List<? extends Node> nodes) {
    buf.append(" [");
    String sep = "";
    for (Node node : nodes) {
      buf.append(sep);
      printNode(node);
      sep = " ";
    }
    buf.append(']');
  }

  private void printNode(Node node) {
    if (node instanceof Expression) {
      printExpression((Expression) node);
    } else if (node instanceof Pattern) {
      printPattern((Pattern) node);
    } else if (node instanceof Constant) {
      printConstant((Constant) node);
    } else if (node instanceof TypeExpression) {
      printType((TypeExpression) node);
    } else if (node instanceof ClauseGuard) {
      printGuard((ClauseGuard) node);
    } else if (node instanceof Statement) {
      printStatement((Statement) node);
    } else if (node instanceof Definition) {
      printDefinition((Definition) node);
    } else {
      printOther(node);
    }
  }

  private void printOther(Node node) {
    if (node instanceof Module) {
      open("module");
      children(((Module) node).getDefinitions());
    } else if (node instanceof TargetedDefinition) {
      TargetedDefinition def = (TargetedDefinition) node;
      if (def.getTarget() == null) {
        printNode(def.getDefinition());
        return;
      }
      open("target");
      leaf(def.getTarget().getName());
      child(def.getDefinition());
    } else if (node instanceof Argument) {
      Argument<?> arg = (Argument<?>) node;
      open("arg");
      leaf(arg.getLabel());
      child(arg.getValue());
    } else if (node instanceof Parameter) {
      Parameter param = (Parameter) node;
      open("param");
      leaf(param.getLabel());
      leaf(param.getName());
      child(param.getAnnotation());
    } else if (node instanceof Clause) {
      Clause clause = (Clause) node;
      open("clause");
      children(clause.getPatterns());
      for (List<Pattern> alternative : clause.getAlternativePatterns()) {
        buf.append(" |");
        children(alternative);
      }
      child(clause.getGuard());
      child(clause.getThen());
    } else if (node instanceof BitArraySegment) {
      BitArraySegment<?> segment = (BitArraySegment<?>) node;
      open("segment");
      child(segment.getValue());
      children(segment.getOptions());
    } else if (node instanceof BitArrayOption) {
      BitArrayOption<?> option = (BitArrayOption<?>) node;
      switch (option.kind()) {
        case SIZE:
          open(option.isShortForm() ? "size-short" : "size");
          child(option.getValue());
          break;
        case UNIT:
          open("unit");
          leaf(option.getUnit());
          break;
        default:
          open(option.kind().canonicalName());
          break;
      }
    } else if (node instanceof UseAssignment) {
      UseAssignment assignment = (UseAssignment) node;
      open("use-assign");
      child(assignment.getPattern());
      child(assignment.getAnnotation());
    } else if (node instanceof RecordConstructor) {
      RecordConstructor constructor = (RecordConstructor) node;
      open("constructor");
      leaf(constructor.getName());
      children(constructor.getArguments());
    } else if (node instanceof RecordConstructorArgument) {
      RecordConstructorArgument arg = (RecordConstructorArgument) node;
      open("field");
      leaf(arg.getLabel());
      child(arg.getType());
    } else if (node instanceof UnqualifiedImport) {
      UnqualifiedImport item = (UnqualifiedImport) node;
      open("unqualified");
      leaf(item.getName());
      leaf(item.getAlias());
    } else if (node instanceof Comment) {
      Comment comment = (Comment) node;
      open("comment");
      leaf(comment.kind());
      leaf(comment.getText());
    } else {
      throw new IllegalArgumentException("unexpected node: " + node.getClass().getName());
    }
    close();
  }

  private void printDefinition(Definition def) {
    switch (def.kind()) {
      case CONSTANT:
        {
          ConstantDefinition constant = (ConstantDefinition) def;
          open(constant.isPublic() ? "pub-const" : "const");
          leaf(constant.getName());
          child(constant.getAnnotation());
          child(constant.getValue());
          break;
        }
      case CUSTOM_TYPE:
        {
          CustomTypeDefinition type = (CustomTypeDefinition) def;
          open(type.isPublic() ? "pub-type" : "type");
          if (type.isOpaque()) {
            buf.append(" opaque");
          }
          leaf(type.getName());
          leaf(type.getParameters());
          leaf(type.getDeprecation());
          children(type.getConstructors());
          break;
        }
      case FUNCTION:
        {
          FunctionDefinition fn = (FunctionDefinition) def;
          open(fn.isPublic() ? "pub-fn" : "fn");
          leaf(fn.getName());
          children(fn.getParameters());
          child(fn.getReturnAnnotation());
          leaf(fn.getDeprecation());
          for (ExternalBinding external : fn.getExternals()) {
            buf.append(" (external");
            leaf(external.target().getName());
            leaf(external.module());
            leaf(external.function());
            close();
          }
          children(fn.getBody());
          break;
        }
      case IMPORT:
        {
          ImportDefinition imp = (ImportDefinition) def;
          open("import");
          leaf(imp.getModule());
          // The order of unqualified imports is insignificant.
          children(BY_NAME.sortedCopy(imp.getTypes()));
          children(BY_NAME.sortedCopy(imp.getValues()));
          leaf(imp.getAlias());
          break;
        }
      case TYPE_ALIAS:
        {
          TypeAliasDefinition alias = (TypeAliasDefinition) def;
          open(alias.isPublic() ? "pub-alias" : "alias");
          leaf(alias.getName());
          leaf(alias.getParameters());
          leaf(alias.getDeprecation());
          child(alias.getType());
          break;
        }
    }
    close();
  }

  private void printStatement(Statement stmt) {
    switch (stmt.kind()) {
      case ASSIGNMENT:
        {
          AssignmentStatement assignment = (AssignmentStatement) stmt;
          open(assignment.isAssert() ? "let-assert" : "let");
          child(assignment.getPattern());
          child(assignment.getAnnotation());
          child(assignment.getValue());
          break;
        }
      case EXPRESSION:
        // Expression statements print as their expression.
        printExpression(((ExpressionStatement) stmt).getExpression());
        return;
      case USE:
        {
          UseStatement use = (UseStatement) stmt;
          open("use");
          children(use.getAssignments());
          child(use.getCall());
          break;
        }
    }
    close();
  }

  private void printExpression(Expression expr) {
    switch (expr.kind()) {
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          open(binop.getOperator().symbol());
          child(binop.getX());
          child(binop.getY());
          break;
        }
      case BIT_ARRAY:
        open("bits");
        children(((BitArrayExpression) expr).getSegments());
        break;
      case BLOCK:
        open("block");
        children(((BlockExpression) expr).getStatements());
        break;
      case CALL:
        {
          CallExpression call = (CallExpression) expr;
          open("call");
          child(call.getFunction());
          children(call.getArguments());
          break;
        }
      case CASE:
        {
          CaseExpression caseExpr = (CaseExpression) expr;
          open("case");
          children(caseExpr.getSubjects());
          children(caseExpr.getClauses());
          break;
        }
      case FIELD_ACCESS:
        {
          FieldAccessExpression access = (FieldAccessExpression) expr;
          open("field");
          child(access.getContainer());
          leaf(access.getLabel());
          break;
        }
      case FLOAT_LITERAL:
        open("float");
        leaf(number(((FloatLiteral) expr).getValue()));
        break;
      case FN:
        {
          FnExpression fn = (FnExpression) expr;
          if (fn.isCapture()) {
            open("capture");
            children(fn.getBody());
            break;
          }
          open("lambda");
          children(fn.getParameters());
          child(fn.getReturnAnnotation());
          children(fn.getBody());
          break;
        }
      case IDENTIFIER:
        open("var");
        leaf(((Identifier) expr).getName());
        break;
      case INT_LITERAL:
        open("int");
        leaf(number(((IntLiteral) expr).getValue()));
        break;
      case LIST:
        {
          ListExpression list = (ListExpression) expr;
          open("list");
          children(list.getElements());
          child(list.getTail());
          break;
        }
      case NEGATE_BOOL:
        open("not");
        child(((NegateBoolExpression) expr).getValue());
        break;
      case NEGATE_INT:
        open("neg");
        child(((NegateIntExpression) expr).getValue());
        break;
      case PANIC:
        open("panic");
        leaf(((PanicExpression) expr).getMessage());
        break;
      case PIPELINE:
        {
          open("pipe");
          buf.append(" [");
          String sep = "";
          for (Expression stage : ((PipelineExpression) expr).getStages()) {
            buf.append(sep);
            printStage(stage);
            sep = " ";
          }
          buf.append(']');
          break;
        }
      case PLACEHOLDER:
        open("placeholder");
        break;
      case RECORD_UPDATE:
        {
          RecordUpdateExpression update = (RecordUpdateExpression) expr;
          open("update");
          child(update.getConstructor());
          child(update.getSpread());
          children(update.getArguments());
          break;
        }
      case STRING_LITERAL:
        open("string");
        leaf(((StringLiteral) expr).getValue());
        break;
      case TODO:
        open("todo");
        leaf(((TodoExpression) expr).getMessage());
        break;
      case TUPLE:
        open("tuple");
        children(((TupleExpression) expr).getElements());
        break;
      case TUPLE_INDEX:
        {
          TupleIndexExpression index = (TupleIndexExpression) expr;
          open("index");
          child(index.getTuple());
          leaf(index.getIndex());
          break;
        }
    }
    close();
  }

  // A capture whose hole is the first argument is the same stage as the call without it:
  // x |> f(_, 2) is x |> f(2), and x |> f(_) is x |> f.
  private void printStage(Expression stage) {
    if (stage.kind() == Expression.Kind.FN && ((FnExpression) stage).isCapture()) {
      Statement body = ((FnExpression) stage).getBody().get(0);
      Expression call = ((ExpressionStatement) body).getExpression();
      if (call.kind() == Expression.Kind.CALL) {
        CallExpression c = (CallExpression) call;
        List<Argument<Expression>> args = c.getArguments();
        if (args.get(0).isCaptureHole()) {
          if (args.size() == 1) {
            printNode(c.getFunction());
          } else {
            open("call");
            child(c.getFunction());
            children(args.subList(1, args.size()));
            close();
          }
          return;
        }
      }
    }
    printNode(stage);
  }

  /**
   * Returns the value of a numeric literal without its layout: no underscores, and no trailing
   * zeros in a fraction beyond the first digit.
   */
  static String number(String raw) {
    String value = raw.replace("_", "");
    int dot = value.indexOf('.');
    if (dot < 0) {
      return value;
    }
    String fraction = value.substring(dot + 1);
    String exponent = "";
    int e = fraction.indexOf('e');
    if (e >= 0) {
      exponent = fraction.substring(e);
      fraction = fraction.substring(0, e);
    }
    int end = fraction.length();
    while (end > 1 && fraction.charAt(end - 1) == '0') {
      end--;
    }
    fraction = end == 0 ? "0" : fraction.substring(0, end);
    return value.substring(0, dot + 1) + fraction + exponent;
  }

  private void printPattern(Pattern pattern) {
    switch (pattern.kind()) {
      case ASSIGN:
        {
          AssignPattern assign = (AssignPattern) pattern;
          open("as");
          child(assign.getPattern());
          leaf(assign.getName());
          break;
        }
      case BIT_ARRAY:
        open("bits");
        children(((BitArrayPattern) pattern).getSegments());
        break;
      case CONSTRUCTOR:
        {
          ConstructorPattern constructor = (ConstructorPattern) pattern;
          open(constructor.hasSpread() ? "record.." : "record");
          leaf(constructor.getModule());
          leaf(constructor.getName());
          children(constructor.getArguments());
          break;
        }
      case DISCARD:
        open("discard");
        leaf(((DiscardPattern) pattern).getName());
        break;
      case FLOAT:
        open("float");
        leaf(number(((FloatPattern) pattern).getValue()));
        break;
      case INT:
        open("int");
        leaf(number(((IntPattern) pattern).getValue()));
        break;
      case LIST:
        {
          ListPattern list = (ListPattern) pattern;
          open("list");
          children(list.getElements());
          child(list.getTail());
          break;
        }
      case STRING:
        open("string");
        leaf(((StringPattern) pattern).getValue());
        break;
      case STRING_PREFIX:
        {
          StringPrefixPattern prefix = (StringPrefixPattern) pattern;
          open("prefix");
          leaf(prefix.getPrefix());
          leaf(prefix.getPrefixName());
          leaf(prefix.getRestName());
          break;
        }
      case TUPLE:
        open("tuple");
        children(((TuplePattern) pattern).getElements());
        break;
      case VARIABLE:
        open("var");
        leaf(((VariablePattern) pattern).getName());
        break;
      case VAR_USAGE:
        open("use-var");
        leaf(((VarUsagePattern) pattern).getName());
        break;
    }
    close();
  }

  private void printConstant(Constant constant) {
    switch (constant.kind()) {
      case BIT_ARRAY:
        open("bits");
        children(((BitArrayConstant) constant).getSegments());
        break;
      case FLOAT:
        open("float");
        leaf(number(((FloatConstant) constant).getValue()));
        break;
      case INT:
        open("int");
        leaf(number(((IntConstant) constant).getValue()));
        break;
      case LIST:
        open("list");
        children(((ListConstant) constant).getElements());
        break;
      case RECORD:
        {
          RecordConstant record = (RecordConstant) constant;
          open("record");
          leaf(record.getModule());
          leaf(record.getName());
          children(record.getArguments());
          break;
        }
      case STRING:
        open("string");
        leaf(((StringConstant) constant).getValue());
        break;
      case TUPLE:
        open("tuple");
        children(((TupleConstant) constant).getElements());
        break;
      case VARIABLE:
        {
          VariableConstant variable = (VariableConstant) constant;
          open("var");
          leaf(variable.getModule());
          leaf(variable.getName());
          break;
        }
    }
    close();
  }

  private void printType(TypeExpression type) {
    switch (type.kind()) {
      case FUNCTION:
        {
          FunctionType fn = (FunctionType) type;
          open("fn-type");
          children(fn.getArguments());
          child(fn.getReturnType());
          break;
        }
      case HOLE:
        open("hole");
        leaf(((TypeHole) type).getName());
        break;
      case NAMED:
        {
          NamedType named = (NamedType) type;
          open("type");
          leaf(named.getModule());
          leaf(named.getName());
          children(named.getArguments());
          break;
        }
      case TUPLE:
        open("tuple-type");
        children(((TupleType) type).getElements());
        break;
      case VARIABLE:
        open("type-var");
        leaf(((TypeVariable) type).getName());
        break;
    }
    close();
  }

  private void printGuard(ClauseGuard guard) {
    switch (guard.kind()) {
      case BINARY_OPERATOR:
        {
          BinaryGuard binop = (BinaryGuard) guard;
          open(binop.getOperator().symbol());
          child(binop.getX());
          child(binop.getY());
          break;
        }
      case CONSTANT:
        printConstant(((ConstantGuard) guard).getConstant());
        return;
      case FIELD_ACCESS:
        {
          FieldAccessGuard access = (FieldAccessGuard) guard;
          open("field");
          child(access.getContainer());
          leaf(access.getLabel());
          break;
        }
      case NOT:
        open("not");
        child(((NotGuard) guard).getGuard());
        break;
      case TUPLE_INDEX:
        {
          TupleIndexGuard index = (TupleIndexGuard) guard;
          open("index");
          child(index.getTuple());
          leaf(index.getIndex());
          break;
        }
      case VARIABLE:
        open("var");
        leaf(((VariableGuard) guard).getName());
        break;
    }
    close();
  }
}
