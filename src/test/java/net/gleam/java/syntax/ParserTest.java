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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of parsing, checked through the structural dump of the resulting trees. */
@RunWith(JUnit4.class)
public final class ParserTest {

  private static Module parseFile(String... lines) {
    Module module = Module.parse(ParserInput.fromLines(lines));
    if (!module.ok()) {
      throw new AssertionError(SyntaxError.toMultilineString(module.errors()));
    }
    return module;
  }

  private static ImmutableList<SyntaxError> parseErrors(String... lines) {
    Module module = Module.parse(ParserInput.fromLines(lines));
    assertThat(module.ok()).isFalse();
    return module.errors();
  }

  private static String firstError(String... lines) {
    return parseErrors(lines).get(0).message();
  }

  private static FunctionDefinition parseFunction(String... lines) {
    return (FunctionDefinition) parseFile(lines).getDefinitions().get(0).getDefinition();
  }

  // Returns the dump of a statement parsed as the body of a function.
  private static String parseStatement(String src) {
    FunctionDefinition fn = parseFunction("fn f() {", src, "}");
    assertThat(fn.getBody()).hasSize(1);
    return fn.getBody().get(0).toString();
  }

  // Returns the dump of the first pattern of the first clause of a case.
  private static String parsePattern(String pattern) {
    CaseExpression caseExpr = parseCase("case x { " + pattern + " -> 1 }");
    return caseExpr.getClauses().get(0).getPatterns().get(0).toString();
  }

  private static CaseExpression parseCase(String src) {
    FunctionDefinition fn = parseFunction("fn f() {", src, "}");
    return (CaseExpression) ((ExpressionStatement) fn.getBody().get(0)).getExpression();
  }

  @Test
  public void testPrecedence() {
    assertThat(parseStatement("1 + 2 * 3"))
        .isEqualTo("(+ (int \"1\") (* (int \"2\") (int \"3\")))");
    assertThat(parseStatement("a - b - c"))
        .isEqualTo("(- (- (var \"a\") (var \"b\")) (var \"c\"))");
    assertThat(parseStatement("a < b && c || d"))
        .isEqualTo("(|| (&& (< (var \"a\") (var \"b\")) (var \"c\")) (var \"d\"))");
    assertThat(parseStatement("a <> b == c"))
        .isEqualTo("(== (<> (var \"a\") (var \"b\")) (var \"c\"))");
  }

  @Test
  public void testBinaryOperatorPrecedenceValues() {
    Statement statement = parseFunction("fn f() { 1 + 2 }").getBody().get(0);
    Expression e = ((ExpressionStatement) statement).getExpression();
    assertThat(e.precedence()).isEqualTo(7);
    Expression x = ((BinaryOperatorExpression) e).getX();
    assertThat(x.precedence()).isEqualTo(BinaryOperator.MAX_PRECEDENCE);
  }

  @Test
  public void testPipelineIsFlattened() {
    assertThat(parseStatement("a |> b |> c"))
        .isEqualTo("(pipe [(var \"a\") (var \"b\") (var \"c\")])");
  }

  @Test
  public void testPipelineBindsBetweenConcatenationAndAddition() {
    assertThat(parseStatement("a + 1 |> f"))
        .isEqualTo("(pipe [(+ (var \"a\") (int \"1\")) (var \"f\")])");
    assertThat(parseStatement("a <> b |> f"))
        .isEqualTo("(<> (var \"a\") (pipe [(var \"b\") (var \"f\")]))");
  }

  @Test
  public void testNegativeLiterals() {
    assertThat(parseStatement("-1")).isEqualTo("(int \"-1\")");
    assertThat(parseStatement("- 1.5")).isEqualTo("(float \"-1.5\")");
    assertThat(parseStatement("-x")).isEqualTo("(neg (var \"x\"))");
    assertThat(parseStatement("!x")).isEqualTo("(not (var \"x\"))");
  }

  @Test
  public void testCallArguments() {
    assertThat(parseStatement("f(x: 1, 2)"))
        .isEqualTo("(call (var \"f\") [(arg \"x\" (int \"1\")) (arg - (int \"2\"))])");
  }

  @Test
  public void testFunctionCapture() {
    assertThat(parseStatement("f(1, _)"))
        .isEqualTo(
            "(capture [(call (var \"f\") [(arg - (int \"1\")) (arg - (var \"_capture\"))])])");
    FnExpression fn =
        (FnExpression)
            ((ExpressionStatement) parseFunction("fn f() { g(_) }").getBody().get(0))
                .getExpression();
    assertThat(fn.isCapture()).isTrue();
    assertThat(fn.getParameters()).hasSize(1);
    assertThat(fn.getParameters().get(0).getName()).isEqualTo(Identifier.CAPTURE_NAME);
  }

  @Test
  public void testCaptureErrors() {
    assertThat(firstError("fn f() { g(_, _) }"))
        .isEqualTo("a function capture may only have one '_'");
    assertThat(firstError("fn f() { _ }")).isEqualTo("'_' can only be used as a call argument");
  }

  @Test
  public void testTupleIndexAndFieldAccess() {
    assertThat(parseStatement("t.0.1")).isEqualTo("(index (index (var \"t\") 0) 1)");
    assertThat(parseStatement("a.b.c"))
        .isEqualTo("(field (field (var \"a\") \"b\") \"c\")");
    assertThat(parseStatement("option.Some(1)"))
        .isEqualTo("(call (field (var \"option\") \"Some\") [(arg - (int \"1\"))])");
  }

  @Test
  public void testRecordUpdate() {
    assertThat(parseStatement("Person(..p, name: n)"))
        .isEqualTo("(update (var \"Person\") (var \"p\") [(arg \"name\" (var \"n\"))])");
  }

  @Test
  public void testLists() {
    assertThat(parseStatement("[1, 2, ..xs]"))
        .isEqualTo("(list [(int \"1\") (int \"2\")] (var \"xs\"))");
    assertThat(parseStatement("[]")).isEqualTo("(list [] -)");
    assertThat(firstError("fn f() { [..xs] }"))
        .isEqualTo("a list spread must follow at least one element");
  }

  @Test
  public void testBitArray() {
    assertThat(parseStatement("<<x:size(8)-little, 1:4, y:unit(8)>>"))
        .isEqualTo(
            "(bits [(segment (var \"x\") [(size (int \"8\")) (little)])"
                + " (segment (int \"1\") [(size-short (int \"4\"))])"
                + " (segment (var \"y\") [(unit 8)])])");
  }

  @Test
  public void testLegacyBitArrayOptionNames() {
    assertThat(parseStatement("<<x:binary, y:bit_string>>"))
        .isEqualTo("(bits [(segment (var \"x\") [(bytes)]) (segment (var \"y\") [(bits)])])");
  }

  @Test
  public void testAssignments() {
    assertThat(parseStatement("let x: Int = 1"))
        .isEqualTo("(let (var \"x\") (type - \"Int\" []) (int \"1\"))");
    assertThat(parseStatement("let assert Ok(x) = y"))
        .isEqualTo("(let-assert (record - \"Ok\" [(arg - (var \"x\"))]) - (var \"y\"))");
  }

  @Test
  public void testUse() {
    assertThat(parseStatement("use a, b <- f(x)"))
        .isEqualTo(
            "(use [(use-assign (var \"a\") -) (use-assign (var \"b\") -)]"
                + " (call (var \"f\") [(arg - (var \"x\"))]))");
    assertThat(parseStatement("use <- f")).isEqualTo("(use [] (var \"f\"))");
  }

  @Test
  public void testAnonymousFunction() {
    assertThat(parseStatement("fn(x: Int) -> Int { x }"))
        .isEqualTo(
            "(lambda [(param - \"x\" (type - \"Int\" []))] (type - \"Int\" []) [(var \"x\")])");
    assertThat(firstError("fn f() { fn(a b) { b } }"))
        .isEqualTo("anonymous function parameters cannot be labelled");
  }

  @Test
  public void testPatterns() {
    assertThat(parsePattern("[a, ..]")).isEqualTo("(list [(var \"a\")] (discard \"_\"))");
    assertThat(parsePattern("[a, ..rest]")).isEqualTo("(list [(var \"a\")] (var \"rest\"))");
    assertThat(parsePattern("\"a\" as p <> rest")).isEqualTo("(prefix \"a\" \"p\" \"rest\")");
    assertThat(parsePattern("\"a\" as p")).isEqualTo("(as (string \"a\") \"p\")");
    assertThat(parsePattern("#(1, _)")).isEqualTo("(tuple [(int \"1\") (discard \"_\")])");
    assertThat(parsePattern("option.Some(x: 1, ..)"))
        .isEqualTo("(record.. \"option\" \"Some\" [(arg \"x\" (int \"1\"))])");
    assertThat(parsePattern("-3")).isEqualTo("(int \"-3\")");
    assertThat(parsePattern("<<n:8, rest:bytes-size(n)>>"))
        .isEqualTo(
            "(bits [(segment (var \"n\") [(size-short (int \"8\"))])"
                + " (segment (var \"rest\") [(bytes) (size (use-var \"n\"))])])");
  }

  @Test
  public void testClauses() {
    CaseExpression caseExpr = parseCase("case x, y { 1, 2 | 3, 4 -> a\n _, _ -> b }");
    assertThat(caseExpr.getSubjects()).hasSize(2);
    assertThat(caseExpr.getClauses().get(0).toString())
        .isEqualTo(
            "(clause [(int \"1\") (int \"2\")] | [(int \"3\") (int \"4\")] - (var \"a\"))");
  }

  @Test
  public void testGuards() {
    Clause clause = parseCase("case x { y if { a || b } && c.0 -> 1 }").getClauses().get(0);
    // The braces only group.
    assertThat(clause.getGuard().toString())
        .isEqualTo("(&& (|| (var \"a\") (var \"b\")) (index (var \"c\") 0))");
    clause = parseCase("case x { y if y == option.None -> 1 }").getClauses().get(0);
    assertThat(clause.getGuard().toString())
        .isEqualTo("(== (var \"y\") (record \"option\" \"None\" []))");
    clause = parseCase("case x { y if !y.ok -> 1 }").getClauses().get(0);
    assertThat(clause.getGuard().toString()).isEqualTo("(not (field (var \"y\") \"ok\"))");
  }

  @Test
  public void testEmptyFunctionBodyIsTodo() {
    assertThat(parseFunction("fn f() {}").getBody().get(0).toString()).isEqualTo("(todo -)");
    assertThat(parseStatement("todo as \"later\"")).isEqualTo("(todo \"later\")");
  }

  @Test
  public void testExternalFunction() {
    FunctionDefinition fn =
        parseFunction(
            "@external(javascript, \"./m.mjs\", \"g\")",
            "@external(erlang, \"m\", \"f\")",
            "pub fn f(x: Int) -> Int");
    // Bindings are kept in target order.
    assertThat(fn.toString())
        .isEqualTo(
            "(pub-fn \"f\" [(param - \"x\" (type - \"Int\" []))] (type - \"Int\" []) -"
                + " (external \"erlang\" \"m\" \"f\")"
                + " (external \"javascript\" \"./m.mjs\" \"g\") [(placeholder)])");
  }

  @Test
  public void testFunctionWithoutBody() {
    assertThat(firstError("fn f()"))
        .contains("only functions with an @external attribute may omit the body");
    assertThat(
            firstError(
                "@external(erlang, \"m\", \"f\")",
                "@external(erlang, \"m\", \"g\")",
                "fn f() -> Int"))
        .isEqualTo("duplicate @external for target erlang");
  }

  @Test
  public void testAttributes() {
    TargetedDefinition def =
        parseFile("@target(javascript)", "@deprecated(\"use g\")", "pub fn f() { 1 }")
            .getDefinitions()
            .get(0);
    assertThat(def.getTarget()).isEqualTo(Target.JAVASCRIPT);
    assertThat(((FunctionDefinition) def.getDefinition()).getDeprecation()).isEqualTo("use g");
    assertThat(firstError("@inline()", "fn f() { 1 }")).isEqualTo("unknown attribute '@inline'");
  }

  @Test
  public void testLabelledParameters() {
    FunctionDefinition fn = parseFunction("pub fn f(from start: Int, _ignored) { start }");
    assertThat(fn.getParameters().get(0).toString())
        .isEqualTo("(param \"from\" \"start\" (type - \"Int\" []))");
    assertThat(fn.getParameters().get(1).toString()).isEqualTo("(param - \"_ignored\" -)");
  }

  @Test
  public void testImportItemsAreNormalized() {
    Module module = parseFile("import a/b.{z, type T, y as w} as c");
    assertThat(module.getDefinitions().get(0).toString())
        .isEqualTo(
            "(import \"a/b\" [(unqualified \"T\" -)]"
                + " [(unqualified \"y\" \"w\") (unqualified \"z\" -)] \"c\")");
  }

  @Test
  public void testTypes() {
    Module module =
        parseFile(
            "pub type Pair(a, b) {",
            "  Pair(first: a, b)",
            "}",
            "pub opaque type Id {",
            "  Id(Int)",
            "}",
            "type Callback = fn(Int, #(String, _)) -> Nil");
    assertThat(module.getDefinitions().get(0).toString())
        .isEqualTo(
            "(pub-type \"Pair\" [a, b] -"
                + " [(constructor \"Pair\" [(field \"first\" (type-var \"a\"))"
                + " (field - (type-var \"b\"))])])");
    assertThat(module.getDefinitions().get(1).toString())
        .isEqualTo(
            "(pub-type opaque \"Id\" [] -"
                + " [(constructor \"Id\" [(field - (type - \"Int\" []))])])");
    assertThat(module.getDefinitions().get(2).toString())
        .isEqualTo(
            "(alias \"Callback\" [] -"
                + " (fn-type [(type - \"Int\" [])"
                + " (tuple-type [(type - \"String\" []) (hole \"_\")])]"
                + " (type - \"Nil\" [])))");
  }

  @Test
  public void testConstants() {
    Module module =
        parseFile(
            "pub const xs: List(Int) = [1, -2]",
            "const p = #(Point(x: 1.0, y: 2.0), option.None, other.value)");
    assertThat(module.getDefinitions().get(0).toString())
        .isEqualTo(
            "(pub-const \"xs\" (type - \"List\" [(type - \"Int\" [])])"
                + " (list [(int \"1\") (int \"-2\")]))");
    assertThat(module.getDefinitions().get(1).toString())
        .isEqualTo(
            "(const \"p\" - (tuple [(record - \"Point\" [(arg \"x\" (float \"1.0\"))"
                + " (arg \"y\" (float \"2.0\"))]) (record \"option\" \"None\" [])"
                + " (var \"other\" \"value\")]))");
  }

  @Test
  public void testNumbersDumpWithoutLayout() {
    assertThat(parseStatement("1_000")).isEqualTo("(int \"1000\")");
    assertThat(parseStatement("1.500")).isEqualTo("(float \"1.5\")");
    assertThat(parseStatement("1.000e3")).isEqualTo("(float \"1.0e3\")");
  }

  @Test
  public void testRecoveryResumesAtNextDefinition() {
    Module module = Module.parse(ParserInput.fromLines("fn f() { 1 }", ") junk", "fn g() { 2 }"));
    assertThat(module.ok()).isFalse();
    assertThat(module.errors()).hasSize(1);
    assertThat(module.errors().get(0).message())
        .isEqualTo("syntax error at ')': expected a definition");
    assertThat(module.errors().get(0).location().line()).isEqualTo(2);
    assertThat(module.getDefinitions()).hasSize(2);
  }

  @Test
  public void testErrorsAreCapped() {
    String[] lines = new String[10];
    for (int i = 0; i < lines.length; i++) {
      lines[i] = "fn f" + i + "() { _ }";
    }
    assertThat(parseErrors(lines)).hasSize(5);
  }

  @Test
  public void testModeratelyNestedCallsParse() {
    int depth = 50;
    String src = "fn f() { " + "g(".repeat(depth) + "x" + ")".repeat(depth) + " }";
    Module module = Module.parse(ParserInput.fromLines(src));
    assertThat(module.errors()).isEmpty();
  }

  @Test
  public void testDeepNestingIsReported() {
    int depth = 100_000;
    String src = "fn f() { " + "[".repeat(depth) + "]".repeat(depth) + " }";
    assertThat(firstError(src)).isEqualTo("nesting too deep, cannot parse module");
  }

  @Test
  public void testNodeLocations() {
    Module module = parseFile("fn f() {", "  foo(1)", "}");
    FunctionDefinition fn = (FunctionDefinition) module.getDefinitions().get(0).getDefinition();
    Statement statement = fn.getBody().get(0);
    assertThat(statement.getStartLocation().toString()).isEqualTo(":2:3");
    assertThat(statement.getEndOffset()).isEqualTo(17);
    assertThat(Joiner.on(',').join(module.getDefinitions())).startsWith("(fn \"f\" []");
  }
}
