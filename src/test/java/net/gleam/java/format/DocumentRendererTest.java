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
import static net.gleam.java.format.Document.concat;
import static net.gleam.java.format.Document.flexBreak;
import static net.gleam.java.format.Document.join;
import static net.gleam.java.format.Document.line;
import static net.gleam.java.format.Document.lines;
import static net.gleam.java.format.Document.nil;
import static net.gleam.java.format.Document.strictBreak;
import static net.gleam.java.format.Document.text;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link DocumentRenderer}. */
@RunWith(JUnit4.class)
public final class DocumentRendererTest {

  // f(a, b) with the arguments one per line when broken.
  private static Document call(String... args) {
    List<Document> docs = new ArrayList<>();
    for (String arg : args) {
      docs.add(text(arg));
    }
    return concat(text("f("), concat(strictBreak("", ""), join(docs, strictBreak(",", ", "))))
        .nest(2)
        .append(strictBreak(",", ""), text(")"))
        .group();
  }

  @Test
  public void testText() {
    assertThat(text("hello").append(" world").render(80)).isEqualTo("hello world");
    assertThat(nil().render(80)).isEmpty();
  }

  @Test
  public void testGroupThatFitsIsFlat() {
    assertThat(call("a", "b").render(80)).isEqualTo("f(a, b)");
  }

  @Test
  public void testGroupThatOverflowsBreaksEveryBreak() {
    assertThat(call("aaa", "bbb").render(8)).isEqualTo("f(\n  aaa,\n  bbb,\n)");
  }

  @Test
  public void testWidthIsInclusive() {
    Document doc = concat(text("aaaa"), strictBreak("", " "), text("bbbb")).group();
    assertThat(doc.render(9)).isEqualTo("aaaa bbbb");
    assertThat(doc.render(8)).isEqualTo("aaaa\nbbbb");
  }

  @Test
  public void testWidthCountsCodePoints() {
    Document doc = concat(text("😀😀"), strictBreak("", " "), text("x")).group();
    assertThat(doc.render(4)).isEqualTo("😀😀 x");
  }

  @Test
  public void testNestedGroupsBreakOutsideIn() {
    Document doc = call("x", call("y", "z").render(80), "w");
    assertThat(doc.render(80)).isEqualTo("f(x, f(y, z), w)");
    Document nested =
        concat(text("g("), concat(strictBreak("", ""), call("aaaa", "bbbb")))
            .nest(2)
            .append(strictBreak(",", ""), text(")"))
            .group();
    assertThat(nested.render(15)).isEqualTo("g(\n  f(aaaa, bbbb),\n)");
    assertThat(nested.render(10)).isEqualTo("g(\n  f(\n    aaaa,\n    bbbb,\n  ),\n)");
  }

  @Test
  public void testForceBreakBreaksEnclosingGroups() {
    Document args =
        join(ImmutableList.of(text("a"), text("b").forceBreak()), strictBreak(",", ", "));
    Document doc =
        concat(text("f("), concat(strictBreak("", ""), args))
            .nest(2)
            .append(strictBreak(",", ""), text(")"))
            .group();
    assertThat(doc.render(80)).isEqualTo("f(\n  a,\n  b,\n)");
    Document outer = concat(text("x"), strictBreak("", " "), text("y").forceBreak()).group();
    assertThat(outer.render(80)).isEqualTo("x\ny");
  }

  @Test
  public void testForceBreakDoesNotReachIntoInnerGroups() {
    // The inner group is measured on its own and still fits.
    assertThat(call("a", "b").forceBreak().render(80)).isEqualTo("f(a, b)");
  }

  @Test
  public void testLinesAreAlwaysNewlines() {
    Document doc = concat(text("a"), line(), text("b"), lines(2), text("c")).nest(2).group();
    assertThat(doc.render(80)).isEqualTo("a\n  b\n\n  c");
  }

  @Test
  public void testNoTrailingWhitespaceOnBlankLines() {
    Document doc = concat(text("{"), concat(line(), text("a"), lines(3), text("b")).nest(4));
    assertThat(doc.render(80)).isEqualTo("{\n    a\n\n\n    b");
  }

  @Test
  public void testFlexBreaksFillLines() {
    List<Document> items = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      items.add(text("aa"));
    }
    Document doc =
        concat(text("["), concat(strictBreak("", ""), join(items, flexBreak(",", ", "))))
            .nest(2)
            .append(strictBreak(",", ""), text("]"))
            .group();
    assertThat(doc.render(80)).isEqualTo("[aa, aa, aa, aa, aa, aa, aa]");
    assertThat(doc.render(12)).isEqualTo("[\n  aa, aa, aa,\n  aa, aa, aa,\n  aa,\n]");
  }

  @Test
  public void testFlexBreakMeasuresNextGroupFlat() {
    List<Document> items = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      items.add(concat(text("<"), strictBreak("", ""), text("xx>")).group());
    }
    Document doc =
        concat(text("["), concat(strictBreak("", ""), join(items, flexBreak(",", ", "))))
            .nest(2)
            .append(strictBreak(",", ""), text("]"))
            .group();
    // "  <xx>, <xx>" needs 12 columns, so each element starts its own line.
    assertThat(doc.render(11)).isEqualTo("[\n  <xx>,\n  <xx>,\n  <xx>,\n]");
    assertThat(doc.render(12)).isEqualTo("[\n  <xx>, <xx>,\n  <xx>,\n]");
  }

  @Test
  public void testStrictBreaksInBrokenGroupAllBreak() {
    List<Document> items = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      items.add(text("aa"));
    }
    Document doc =
        concat(text("["), concat(strictBreak("", ""), join(items, strictBreak(",", ", "))))
            .nest(2)
            .append(strictBreak(",", ""), text("]"))
            .group();
    assertThat(doc.render(10)).isEqualTo("[\n  aa,\n  aa,\n  aa,\n]");
  }

  @Test
  public void testMultilineTextResetsColumn() {
    Document doc =
        concat(text("x = \"a\nbc\""), concat(strictBreak("", " "), text("tail")).group());
    assertThat(doc.render(10)).isEqualTo("x = \"a\nbc\" tail");
  }

  @Test
  public void testJoinSkipsEmptyDocuments() {
    Document doc = join(ImmutableList.of(text("a"), nil(), text("b")), text(", "));
    assertThat(doc.render(80)).isEqualTo("a, b");
  }

  @Test
  public void testDeepNestingDoesNotOverflow() {
    Document doc = text("x");
    for (int i = 0; i < 50_000; i++) {
      doc = concat(text("("), doc, text(")"));
    }
    assertThat(doc.render(80)).hasLength(100_001);
  }
}
