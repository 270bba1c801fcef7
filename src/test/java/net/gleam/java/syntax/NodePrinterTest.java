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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link NodePrinter}. */
@RunWith(JUnit4.class)
public final class NodePrinterTest {

  private static String dump(String... lines) {
    Module module = Module.parse(ParserInput.fromLines(lines));
    assertThat(module.errors()).isEmpty();
    return module.toString();
  }

  @Test
  public void testNumberNormalization() {
    assertThat(NodePrinter.number("1_000")).isEqualTo("1000");
    assertThat(NodePrinter.number("1_000.500")).isEqualTo("1000.5");
    assertThat(NodePrinter.number("1.0")).isEqualTo("1.0");
    assertThat(NodePrinter.number("1.")).isEqualTo("1.0");
    assertThat(NodePrinter.number("2.50e-3")).isEqualTo("2.5e-3");
    assertThat(NodePrinter.number("0xFF_FF")).isEqualTo("0xFFFF");
    assertThat(NodePrinter.number("-10_000")).isEqualTo("-10000");
  }

  @Test
  public void testLayoutIsIgnored() {
    assertThat(dump("pub fn main() {", "  let x = [1, 2]", "  x", "}"))
        .isEqualTo(dump("pub fn main(){let x=[1,2,] x}"));
  }

  @Test
  public void testCommentsAreIgnored() {
    assertThat(dump("// a comment", "fn f() { 1 // one", "}")).isEqualTo(dump("fn f() { 1 }"));
  }

  @Test
  public void testModuleDump() {
    assertThat(dump("import gleam/io", "pub fn main() { io.println(\"hi\") }"))
        .isEqualTo(
            "(module [(import \"gleam/io\" [] [] -) (pub-fn \"main\" [] - -"
                + " [(call (field (var \"io\") \"println\") [(arg - (string \"hi\"))])])])");
  }

  @Test
  public void testTargetedDefinition() {
    assertThat(dump("@target(erlang)", "const x = 1"))
        .isEqualTo("(module [(target \"erlang\" (const \"x\" - (int \"1\")))])");
  }

  @Test
  public void testPipelineCaptureInFirstPositionDumpsAsPlainStage() {
    assertThat(dump("fn f() { x |> f(_, 2) |> g(_) }"))
        .isEqualTo(dump("fn f() { x |> f(2) |> g }"));
    assertThat(dump("fn f() { x |> f(_, 2) }"))
        .isEqualTo(
            "(module [(fn \"f\" [] - - [(pipe [(var \"x\")"
                + " (call (var \"f\") [(arg - (int \"2\"))])])])])");
  }

  @Test
  public void testPipelineCaptureElsewhereIsKept() {
    assertThat(dump("fn f() { x |> h(1, _) }"))
        .isEqualTo(
            "(module [(fn \"f\" [] - - [(pipe [(var \"x\") (capture [(call (var \"h\")"
                + " [(arg - (int \"1\")) (arg - (var \"_capture\"))])])])])])");
  }

  @Test
  public void testImportOrderIsIgnored() {
    assertThat(dump("import m.{b, a, type Y, type X}"))
        .isEqualTo(dump("import m.{type X, type Y, a, b}"));
  }

  @Test
  public void testCommentNode() {
    Comment comment = Module.parse(ParserInput.fromLines("// hi")).getExtra().comments().get(0);
    assertThat(comment.toString()).isEqualTo("(comment REGULAR \" hi\")");
  }
}
