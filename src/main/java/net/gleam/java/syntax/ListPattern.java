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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Syntax node for a list pattern, {@code [a, b, ..rest]}. */
public final class ListPattern extends Pattern {

  private final ImmutableList<Pattern> elements;
  @Nullable private final Pattern tail;

  ListPattern(
      FileLocations locs,
      int startOffset,
      int endOffset,
      ImmutableList<Pattern> elements,
      @Nullable Pattern tail) {
    super(locs, Kind.LIST, startOffset, endOffset);
    this.elements = elements;
    this.tail = tail;
  }

  public ImmutableList<Pattern> getElements() {
    return elements;
  }

  /** Returns the pattern for the rest of the list; a bare {@code ..} is a discard. */
  @Nullable
  public Pattern getTail() {
    return tail;
  }
}
