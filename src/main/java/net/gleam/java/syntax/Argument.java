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
 * Syntax node for an argument of a call, record update, constructor pattern or constant record:
 * a value with an optional label, {@code label: value}.
 *
 * @param <T> the kind of the value: {@link Expression}, {@link Pattern} or {@link Constant}
 */
public final class Argument<T extends Node> extends Node {

  @Nullable private final String label;
  private final T value;

  Argument(FileLocations locs, int startOffset, @Nullable String label, T value) {
    super(locs, startOffset, value.getEndOffset());
    this.label = label;
    this.value = value;
  }

  @Nullable
  public String getLabel() {
    return label;
  }

  public T getValue() {
    return value;
  }

  /** Reports whether this is the {@code _} of a function capture. */
  public boolean isCaptureHole() {
    return label == null && value instanceof Identifier && ((Identifier) value).isCaptureHole();
  }
}
