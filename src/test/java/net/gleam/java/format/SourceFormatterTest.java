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
import static org.junit.Assert.assertThrows;

import net.gleam.java.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link SourceFormatter}. */
@RunWith(JUnit4.class)
public final class SourceFormatterTest {

  private static final String MESSY =
      "import gleam/io\npub fn main(){io.println( \"hi\" )\n\n\n}";

  private static final String FORMATTED =
      "import gleam/io\n\npub fn main() {\n  io.println(\"hi\")\n}\n";

  @Test
  public void testFormat() throws Exception {
    assertThat(SourceFormatter.format(ParserInput.fromString(MESSY, "main.gleam")))
        .isEqualTo(FORMATTED);
  }

  @Test
  public void testFormatIsIdempotent() throws Exception {
    String once = SourceFormatter.format(ParserInput.fromString(MESSY, "main.gleam"));
    assertThat(SourceFormatter.format(ParserInput.fromString(once, "main.gleam")))
        .isEqualTo(once);
  }

  @Test
  public void testEmptyModule() throws Exception {
    assertThat(SourceFormatter.format(ParserInput.fromString("", "empty.gleam"))).isEqualTo("\n");
  }

  @Test
  public void testFormatToAppendable() throws Exception {
    StringBuilder sink = new StringBuilder("// existing\n");
    SourceFormatter.format(ParserInput.fromString(MESSY, "main.gleam"), sink);
    assertThat(sink.toString()).isEqualTo("// existing\n" + FORMATTED);
  }

  @Test
  public void testParseFailure() {
    ParserInput input = ParserInput.fromString("const a = $", "bad.gleam");
    StringBuilder sink = new StringBuilder();
    ParseFailureException e =
        assertThrows(ParseFailureException.class, () -> SourceFormatter.format(input, sink));
    assertThat(e.getFile()).isEqualTo("bad.gleam");
    assertThat(e.getSource()).isEqualTo("const a = $");
    assertThat(e.errors()).isNotEmpty();
    assertThat(e.getMessage()).startsWith("bad.gleam:1:11: invalid character: '$'");
    assertThat(e.describeErrors()).startsWith("bad.gleam:1:11: invalid character: '$'");
    assertThat(sink.toString()).isEmpty();
  }

  @Test
  public void testParseFailureReportsEveryError() {
    ParserInput input = ParserInput.fromString("fn a() { _ }\nfn b() { _ }\n", "two.gleam");
    ParseFailureException e =
        assertThrows(ParseFailureException.class, () -> SourceFormatter.format(input));
    assertThat(e.errors()).hasSize(2);
    assertThat(e.getMessage()).endsWith("(+ 1 more)");
    assertThat(e.describeErrors().split("\n")).hasLength(2);
  }
}
