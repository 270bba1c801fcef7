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
 * Syntax node for a binding, {@code let pattern: Type = value}, or an asserting binding, {@code
 * let assert pattern = value}.
 */
public final class AssignmentStatement extends Statement {

  private final boolean isAssert;
  private final Pattern pattern;
  @Nullable private final TypeExpression annotation;
  private final Expression value;

  AssignmentStatement(
      FileLocations locs,
      int startOffset,
      boolean isAssert,
      Pattern pattern,
      @Nullable TypeExpression annotation,
      Expression value) {
    super(locs, Kind.ASSIGNMENT, startOffset, value.getEndOffset());
    this.isAssert = isAssert;
    this.pattern = pattern;
    this.annotation = annotation;
    this.value = value;
  }

  /** Reports whether this is a {@code let assert}. */
  public boolean isAssert() {
    return isAssert;
  }

  public Pattern getPattern() {
    return pattern;
  }

  @Nullable
  public TypeExpression getAnnotation() {
    return annotation;
  }

  public Expression getValue() {
    return value;
  }
}
