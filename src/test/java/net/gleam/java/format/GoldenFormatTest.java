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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Resources;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.io.IOException;
import java.util.Locale;
import net.gleam.java.syntax.Module;
import net.gleam.java.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Formats each {@code golden/NAME.input.gleam} resource and compares the result with {@code
 * golden/NAME.output.gleam}.
 */
@RunWith(TestParameterInjector.class)
public final class GoldenFormatTest {

  enum GoldenFile {
    BASICS,
    PIPELINES,
    CUSTOM_TYPES;

    String read(String suffix) throws IOException {
      String name = "golden/" + name().toLowerCase(Locale.ROOT) + suffix;
      return Resources.toString(Resources.getResource(GoldenFormatTest.class, name), UTF_8);
    }
  }

  private static String format(String source) throws ParseFailureException {
    return SourceFormatter.format(ParserInput.fromString(source, "golden.gleam"));
  }

  @Test
  public void testInputFormatsToOutput(@TestParameter GoldenFile file) throws Exception {
    assertThat(format(file.read(".input.gleam"))).isEqualTo(file.read(".output.gleam"));
  }

  @Test
  public void testOutputIsAlreadyFormatted(@TestParameter GoldenFile file) throws Exception {
    String output = file.read(".output.gleam");
    assertThat(format(output)).isEqualTo(output);
  }

  @Test
  public void testFormattingKeepsTheTree(@TestParameter GoldenFile file) throws Exception {
    String before = Module.parse(ParserInput.fromString(file.read(".input.gleam"), "")).toString();
    String after = Module.parse(ParserInput.fromString(file.read(".output.gleam"), "")).toString();
    assertThat(after).isEqualTo(before);
  }
}
