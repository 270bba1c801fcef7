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

import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import net.gleam.java.syntax.Module;
import net.gleam.java.syntax.ParserInput;

/**
 * Formats Gleam source files in the canonical style.
 *
 * <p>Formatting is a pure function of the input: the module is parsed, lowered to a {@link
 * Document} with its comments and blank lines put back, and laid out at a width of {@value
 * Formatter#LINE_WIDTH} columns. Formatting the output again yields the same text.
 *
 * <p>The class is stateless and may be used from any thread.
 */
public final class SourceFormatter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private SourceFormatter() {} // uninstantiable

  /**
   * Returns the formatted text of a source file.
   *
   * @throws ParseFailureException if the input has syntax errors
   */
  public static String format(ParserInput input) throws ParseFailureException {
    Module module = Module.parse(input);
    if (!module.ok()) {
      logger.atFine().log(
          "%s: not formatted, %d syntax error(s)", input.getFile(), module.errors().size());
      throw new ParseFailureException(
          input.getFile(), input.getContentString(), module.errors());
    }
    Document document = new Formatter(new TriviaCursor(module.getExtra())).module(module);
    String output = document.render(Formatter.LINE_WIDTH);
    logger.atFine().log(
        "%s: formatted %d definition(s), %d chars",
        input.getFile(), module.getDefinitions().size(), output.length());
    return output;
  }

  /**
   * Formats a source file and writes the result to {@code sink}. Nothing is written if the input
   * does not parse.
   *
   * @throws ParseFailureException if the input has syntax errors
   * @throws IOException if writing to the sink fails
   */
  public static void format(ParserInput input, Appendable sink)
      throws ParseFailureException, IOException {
    sink.append(format(input));
  }
}
