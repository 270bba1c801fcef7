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

/**
 * Syntax node for one segment of a bit array: a value and its options, {@code x:size(8)-little}.
 *
 * @param <T> the kind of the value: {@link Expression}, {@link Pattern} or {@link Constant}
 */
public final class BitArraySegment<T extends Node> extends Node {

  private final T value;
  private final ImmutableList<BitArrayOption<T>> options;

  BitArraySegment(
      FileLocations locs, T value, ImmutableList<BitArrayOption<T>> options, int endOffset) {
    super(locs, value.getStartOffset(), endOffset);
    this.value = value;
    this.options = options;
  }

  public T getValue() {
    return value;
  }

  public ImmutableList<BitArrayOption<T>> getOptions() {
    return options;
  }
}
