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

/** Syntax node for a string literal. */
public final class StringLiteral extends Expression {

  private final String value;

  StringLiteral(FileLocations locs, int startOffset, int endOffset, String value) {
    super(locs, Kind.STRING_LITERAL, startOffset, endOffset);
    this.value = value;
  }

  /**
   * Returns the text between the quotes, escape sequences unexpanded. It may contain newlines.
   */
  public String getValue() {
    return value;
  }
}
