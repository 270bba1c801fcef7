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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import net.gleam.java.syntax.Module;
import net.gleam.java.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Formatter}. */
@RunWith(JUnit4.class)
public final class FormatterTest {

  private static String format(String... lines) {
    Module module = Module.parse(ParserInput.fromLines(lines));
    assertThat(module.errors()).isEmpty();
    return new Formatter(new TriviaCursor(module.getExtra()))
        .module(module)
        .render(Formatter.LINE_WIDTH);
  }

  private static String joinLines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  // Asserts that the lines are already formatted.
  private static void assertCanonical(String... lines) {
    assertThat(format(lines)).isEqualTo(joinLines(lines));
  }

  @Test
  public void testImportsAreGroupedAndItemsSorted() {
    assertThat(
            format(
                "import gleam/list.{map, type List, filter}",
                "import gleam/io",
                "pub fn main() {",
                "  io.println(\"hi\")",
                "}"))
        .isEqualTo(
            joinLines(
                "import gleam/list.{type List, filter, map}",
                "import gleam/io",
                "",
                "pub fn main() {",
                "  io.println(\"hi\")",
                "}"));
  }

  @Test
  public void testNumbersAreNormalized() {
    assertThat(format("const a = 100000", "const b = 1.50", "const c = 1.0", "const d = 0xFF"))
        .isEqualTo(
            joinLines(
                "const a = 100_000",
                "",
                "const b = 1.5",
                "",
                "const c = 1.0",
                "",
                "const d = 0xFF"));
  }

  @Test
  public void testUnderscoreIntegerString() {
    assertThat(Formatter.underscoreIntegerString("1000")).isEqualTo("1000");
    assertThat(Formatter.underscoreIntegerString("10000")).isEqualTo("10_000");
    assertThat(Formatter.underscoreIntegerString("1_0000000")).isEqualTo("10_000_000");
    assertThat(Formatter.underscoreIntegerString("-1000")).isEqualTo("-1000");
    assertThat(Formatter.underscoreIntegerString("-10000")).isEqualTo("-10_000");
    assertThat(Formatter.underscoreIntegerString("-100000")).isEqualTo("-100_000");
  }

  @Test
  public void testPrintedComments() {
    ImmutableList<Optional<String>> run =
        ImmutableList.of(Optional.of(" a"), Optional.empty(), Optional.of(" b"));
    assertThat(Formatter.printedComments(run, false).render(80)).isEqualTo("// a\n\n// b");

    ImmutableList<Optional<String>> endsBlank =
        ImmutableList.of(Optional.of(" a"), Optional.empty());
    assertThat(Formatter.printedComments(endsBlank, false).render(80)).isEqualTo("// a");
    assertThat(Formatter.printedComments(endsBlank, true).render(80)).isEqualTo("// a\n\n");
    assertThat(Formatter.printedComments(ImmutableList.of(), true).isEmpty()).isTrue();
  }

  @Test
  public void testFloatFractionKeepsUnderscores() {
    assertThat(format("const a = 1.000_5", "const b = 10000.250"))
        .isEqualTo(joinLines("const a = 1.000_5", "", "const b = 10_000.25"));
  }

  @Test
  public void testOperatorPrecedenceIsKept() {
    assertCanonical(
        "pub fn main() {",
        "  let a = 1 + 2 * 3",
        "  let b = a - { b - c }",
        "  let c = a - b - c",
        "  { a <> b }",
        "  |> f",
        "}");
  }

  @Test
  public void testPipelineOfBlockIsKept() {
    assertThat(format("pub fn main() {", "  { a <> b } |> f", "}"))
        .isEqualTo(joinLines("pub fn main() {", "  { a <> b }", "  |> f", "}"));
  }

  @Test
  public void testPipelineDropsLeadingCaptureHoles() {
    assertThat(format("pub fn main() {", "  x |> f(_, 2) |> g(_) |> h(1, _)", "}"))
        .isEqualTo(
            joinLines(
                "pub fn main() {", "  x", "  |> f(2)", "  |> g", "  |> h(1, _)", "}"));
  }

  @Test
  public void testLineOfExactlyFullWidthIsKept() {
    String value = "\"" + Strings.repeat("a", 68) + "\"";
    assertCanonical("pub fn main() {", "  let x = " + value, "}");
  }

  @Test
  public void testAssignedValueMovesToNextLineWhenTooLong() {
    String value = "\"" + Strings.repeat("a", 69) + "\"";
    assertThat(format("pub fn main() {", "  let x = " + value, "}"))
        .isEqualTo(joinLines("pub fn main() {", "  let x =", "    " + value, "}"));
  }

  @Test
  public void testListOfLiteralsIsPacked() {
    String row = Strings.repeat("100, ", 14) + "100,";
    String input = Strings.repeat("100, ", 29) + "100";
    assertThat(format("pub fn main() {", "  let x = [" + input + "]", "}"))
        .isEqualTo(
            joinLines(
                "pub fn main() {", "  let x = [", "    " + row, "    " + row, "  ]", "}"));
  }

  @Test
  public void testListOfSimpleTuplesIsPacked() {
    String input = Strings.repeat("#(1, 2), ", 11) + "#(1, 2)";
    assertThat(format("pub fn main() {", "  let x = [" + input + "]", "}"))
        .isEqualTo(
            joinLines(
                "pub fn main() {",
                "  let x = [",
                "    " + Strings.repeat("#(1, 2), ", 7) + "#(1, 2),",
                "    " + Strings.repeat("#(1, 2), ", 3) + "#(1, 2),",
                "  ]",
                "}"));
  }

  @Test
  public void testListOfSimpleListsIsPacked() {
    String input = Strings.repeat("[1, 2], ", 11) + "[1, 2]";
    assertThat(format("pub fn main() {", "  let x = [" + input + "]", "}"))
        .isEqualTo(
            joinLines(
                "pub fn main() {",
                "  let x = [",
                "    " + Strings.repeat("[1, 2], ", 8) + "[1, 2],",
                "    " + Strings.repeat("[1, 2], ", 2) + "[1, 2],",
                "  ]",
                "}"));
  }

  @Test
  public void testOneCallMakesListStrict() {
    String input = Strings.repeat("1000, ", 16) + "f(1)";
    String elements = Strings.repeat("    1000,\n", 16);
    assertThat(format("pub fn main() {", "  let x = [" + input + "]", "}"))
        .isEqualTo("pub fn main() {\n  let x = [\n" + elements + "    f(1),\n  ]\n}\n");
  }

  @Test
  public void testListWithTailIsStrict() {
    String input = Strings.repeat("1000, ", 18) + "..rest";
    String elements = Strings.repeat("    1000,\n", 18);
    assertThat(format("pub fn main() {", "  let x = [" + input + "]", "}"))
        .isEqualTo("pub fn main() {\n  let x = [\n" + elements + "    ..rest\n  ]\n}\n");
  }

  @Test
  public void testListOfCallsIsOnePerLine() {
    String input = Strings.repeat("foo(1), ", 9) + "foo(1)";
    String expected =
        joinLines(
            "pub fn main() {",
            "  let x = [",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "    foo(1),",
            "  ]",
            "}");
    assertThat(format("pub fn main() {", "  let x = [" + input + "]", "}")).isEqualTo(expected);
  }

  @Test
  public void testLongCallBreaksWithTrailingComma() {
    assertThat(
            format(
                "pub fn main() {",
                "  some_function(first_argument_value, second_argument_value, "
                    + "third_argument_value)",
                "}"))
        .isEqualTo(
            joinLines(
                "pub fn main() {",
                "  some_function(",
                "    first_argument_value,",
                "    second_argument_value,",
                "    third_argument_value,",
                "  )",
                "}"));
  }

  @Test
  public void testCommentsArePreserved() {
    assertCanonical(
        "pub fn main() {",
        "  // leading",
        "  let x = 1",
        "  // inner",
        "",
        "  // after blank",
        "  x",
        "  // trailing",
        "}");
  }

  @Test
  public void testBlankLinesBetweenEndOfModuleCommentsAreKept() {
    assertThat(format("fn main() {", "  1", "}", "", "// end a", "", "// end b"))
        .isEqualTo(joinLines("fn main() {", "  1", "}", "// end a", "", "// end b"));
  }

  @Test
  public void testEndOfModuleDocAndRegularComments() {
    assertThat(format("const x = 1", "", "/// stray", "", "// a", "", "// b"))
        .isEqualTo(joinLines("const x = 1", "/// stray", "// a", "", "// b"));
  }

  @Test
  public void testBlankLinesCollapseToOne() {
    assertThat(format("pub fn main() {", "  let x = 1", "", "", "", "  x", "}"))
        .isEqualTo(joinLines("pub fn main() {", "  let x = 1", "", "  x", "}"));
  }

  @Test
  public void testModuleAndDocComments() {
    assertCanonical(
        "//// Module doc",
        "",
        "/// Adds.",
        "pub fn add(a: Int, b: Int) -> Int {",
        "  a + b",
        "}");
  }

  @Test
  public void testCaseExpression() {
    assertCanonical(
        "pub fn main() {",
        "  case x {",
        "    1 -> \"one\"",
        "    _ if { a || b } && c -> \"guarded\"",
        "    _ -> \"other\"",
        "  }",
        "}");
  }

  @Test
  public void testListPatternWithTail() {
    assertCanonical(
        "pub fn main() {",
        "  case xs {",
        "    [] -> 0",
        "    [first, ..rest] -> first",
        "  }",
        "}");
  }

  @Test
  public void testCustomTypeConstructorsOnePerLine() {
    assertCanonical(
        "pub type Shape {", "  Circle(radius: Float)", "  Square(side: Float)", "}");
  }

  @Test
  public void testExternalFunctionPrintsHeadOnly() {
    assertCanonical(
        "@external(erlang, \"lists\", \"reverse\")",
        "pub fn reverse(list: List(a)) -> List(a)");
  }

  @Test
  public void testTargetedDefinition() {
    assertThat(format("@target(erlang)", "fn f() { 1 }"))
        .isEqualTo(joinLines("@target(erlang)", "fn f() {", "  1", "}"));
  }

  @Test
  public void testEmptyFunctionBodyBecomesTodo() {
    assertThat(format("pub fn main() {}")).isEqualTo(joinLines("pub fn main() {", "  todo", "}"));
  }

  @Test
  public void testUseStatement() {
    assertCanonical("pub fn main() {", "  use x <- result.try(get())", "  x", "}");
  }

  @Test
  public void testExpressionsThatFit() {
    assertCanonical(
        "pub fn main() {",
        "  let a = list.map(xs, fn(x) { x + 1 })",
        "  let b = #(1, 2)",
        "  let c = Person(..p, name: \"x\")",
        "  let d = { 1 + 2 } * 3",
        "  !{ a && b }",
        "}");
  }
}
