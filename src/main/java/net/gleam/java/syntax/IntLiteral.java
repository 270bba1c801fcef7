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

/**
 * Syntax node for an integer literal. The value is kept as written (with any underscores, radix
 * prefix or leading minus sign) so that a printer decides how to present it.
 */
public final class IntLiteral extends Expression {

  private final String value;

  IntLiteral(FileLocations locs, int startOffset, int endOffset, String value) {
    super(locs, Kind.INT_LITERAL, startOffset, endOffset);
    this.value = value;
  }

  /** Returns the literal as written in source. */
  public String getValue() {
    return value;
  }
}
