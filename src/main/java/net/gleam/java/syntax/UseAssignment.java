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

/** Syntax node for one binding on the left of a use arrow: a pattern and an optional type. */
public final class UseAssignment extends Node {

  private final Pattern pattern;
  @Nullable private final TypeExpression annotation;

  UseAssignment(
      FileLocations locs, int endOffset, Pattern pattern, @Nullable TypeExpression annotation) {
    super(locs, pattern.getStartOffset(), endOffset);
    this.pattern = pattern;
    this.annotation = annotation;
  }

  public Pattern getPattern() {
    return pattern;
  }

  @Nullable
  public TypeExpression getAnnotation() {
    return annotation;
  }
}
