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

/** Syntax node for a bit array pattern, {@code <<header:8, rest:bytes>>}. */
public final class BitArrayPattern extends Pattern {

  private final ImmutableList<BitArraySegment<Pattern>> segments;

  BitArrayPattern(
      FileLocations locs,
      int startOffset,
      int endOffset,
      ImmutableList<BitArraySegment<Pattern>> segments) {
    super(locs, Kind.BIT_ARRAY, startOffset, endOffset);
    this.segments = segments;
  }

  public ImmutableList<BitArraySegment<Pattern>> getSegments() {
    return segments;
  }
}
