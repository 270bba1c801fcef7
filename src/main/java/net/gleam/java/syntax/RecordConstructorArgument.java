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

/** Syntax node for a field of a record constructor, {@code radius: Float} or just {@code Float}. */
public final class RecordConstructorArgument extends Node {

  @Nullable private final String label;
  private final TypeExpression type;

  RecordConstructorArgument(
      FileLocations locs, int startOffset, @Nullable String label, TypeExpression type) {
    super(locs, startOffset, type.getEndOffset());
    this.label = label;
    this.type = type;
  }

  @Nullable
  public String getLabel() {
    return label;
  }

  public TypeExpression getType() {
    return type;
  }
}
