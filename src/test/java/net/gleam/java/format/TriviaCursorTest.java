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

import java.util.Optional;
import net.gleam.java.syntax.Module;
import net.gleam.java.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link TriviaCursor}. */
@RunWith(JUnit4.class)
public final class TriviaCursorTest {

  private static TriviaCursor cursor(String... lines) {
    Module module = Module.parse(ParserInput.fromLines(lines));
    assertThat(module.errors()).isEmpty();
    return new TriviaCursor(module.getExtra());
  }

  @Test
  public void testBlankLinesBetweenCommentsCoalesce() {
    TriviaCursor cursor = cursor("// a", "", "", "// b", "const x = 1");
    assertThat(cursor.popComments(100))
        .containsExactly(Optional.of(" a"), Optional.empty(), Optional.of(" b"))
        .inOrder();
  }

  @Test
  public void testBlankLinesBeforeFirstCommentAreDropped() {
    TriviaCursor cursor = cursor("", "", "// a", "const x = 1");
    assertThat(cursor.popComments(100)).containsExactly(Optional.of(" a"));
  }

  @Test
  public void testBlankLineAfterLastCommentIsKept() {
    TriviaCursor cursor = cursor("// a", "", "const x = 1");
    assertThat(cursor.popComments(6))
        .containsExactly(Optional.of(" a"), Optional.empty())
        .inOrder();
  }

  @Test
  public void testPopIsInclusiveAndOnlyMovesForward() {
    // The comment text starts at offset 14.
    TriviaCursor cursor = cursor("const x = 1 // t");
    assertThat(cursor.anyCommentsBefore(14)).isFalse();
    assertThat(cursor.anyCommentsBefore(15)).isTrue();
    assertThat(cursor.popComments(13)).isEmpty();
    assertThat(cursor.popComments(14)).containsExactly(Optional.of(" t"));
    assertThat(cursor.popComments(100)).isEmpty();
    assertThat(cursor.anyCommentsBefore(100)).isFalse();
  }

  @Test
  public void testDocCommentsConsumeBlankLines() {
    TriviaCursor cursor = cursor("/// doc", "/// more", "", "const x = 1");
    assertThat(cursor.popDocComments(20)).containsExactly(" doc", " more").inOrder();
    assertThat(cursor.popEmptyLines(100)).isFalse();
    assertThat(cursor.popComments(100)).isEmpty();
  }

  @Test
  public void testPopEmptyLines() {
    TriviaCursor cursor = cursor("const x = 1", "", "const y = 2");
    assertThat(cursor.popEmptyLines(5)).isFalse();
    assertThat(cursor.popEmptyLines(12)).isTrue();
    assertThat(cursor.popEmptyLines(100)).isFalse();
  }

  @Test
  public void testModuleComments() {
    TriviaCursor cursor = cursor("//// one", "//// two", "", "// regular", "const x = 1");
    assertThat(cursor.moduleComments()).containsExactly(" one", " two").inOrder();
    assertThat(cursor.popComments(100)).containsExactly(Optional.of(" regular"));
  }
}
