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
 * Syntax node for a function parameter: an optional label, a name (possibly a discard name such as
 * {@code _x}) and an optional type annotation, {@code label name: Type}.
 */
public final class Parameter extends Node {

  @Nullable private final String label;
  private final String name;
  @Nullable private final TypeExpression annotation;

  Parameter(
      FileLocations locs,
      int startOffset,
      int endOffset,
      @Nullable String label,
      String name,
      @Nullable TypeExpression annotation) {
    super(locs, startOffset, endOffset);
    this.label = label;
    this.name = name;
    this.annotation = annotation;
  }

  /** Returns the label callers use for this parameter, or null if it is positional only. */
  @Nullable
  public String getLabel() {
    return label;
  }

  public String getName() {
    return name;
  }

  @Nullable
  public TypeExpression getAnnotation() {
    return annotation;
  }
}
