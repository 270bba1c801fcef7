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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * The apparent name and contents of a source file, for consumption by the parser. The file name
 * appears in the location information in the syntax tree, and in error messages, but the Parser
 * does not attempt to actually open the file.
 */
public final class ParserInput {

  private final String file;
  private final char[] content;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = Preconditions.checkNotNull(file);
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the content of the input source as a string. */
  public String getContentString() {
    return new String(content);
  }

  /** Returns the (non-null) file name of the input source. */
  public String getFile() {
    return file;
  }

  /** Returns an input source that reads from a string. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }

  /**
   * Returns an input source that reads from a list of lines, joined by newlines. Intended for
   * testing.
   */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on('\n').join(lines), "");
  }
}
