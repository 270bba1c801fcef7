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

import javax.annotation.Nullable;

/**
 * Syntax node for a string prefix pattern, {@code "Hello, " <> name}, optionally binding the
 * prefix too, {@code "Hello, " as greeting <> name}.
 */
public final class StringPrefixPattern extends Pattern {

  private final String prefix;
  @Nullable private final String prefixName;
  private final String restName;

  StringPrefixPattern(
      FileLocations locs,
      int startOffset,
      int endOffset,
      String prefix,
      @Nullable String prefixName,
      String restName) {
    super(locs, Kind.STRING_PREFIX, startOffset, endOffset);
    this.prefix = prefix;
    this.prefixName = prefixName;
    this.restName = restName;
  }

  /** Returns the text between the quotes of the prefix literal. */
  public String getPrefix() {
    return prefix;
  }

  /** Returns the variable the prefix is bound to, or null. */
  @Nullable
  public String getPrefixName() {
    return prefixName;
  }

  /** Returns the variable or discard name the rest of the string is bound to. */
  public String getRestName() {
    return restName;
  }
}
