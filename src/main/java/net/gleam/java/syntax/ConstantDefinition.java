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

/** Syntax node for a module constant, {@code pub const limit: Int = 100}. */
public final class ConstantDefinition extends Definition {

  private final boolean isPublic;
  private final String name;
  @Nullable private final TypeExpression annotation;
  private final Constant value;

  ConstantDefinition(
      FileLocations locs,
      int startOffset,
      boolean isPublic,
      String name,
      @Nullable TypeExpression annotation,
      Constant value) {
    super(locs, Kind.CONSTANT, startOffset, value.getEndOffset());
    this.isPublic = isPublic;
    this.name = name;
    this.annotation = annotation;
    this.value = value;
  }

  public boolean isPublic() {
    return isPublic;
  }

  public String getName() {
    return name;
  }

  @Nullable
  public TypeExpression getAnnotation() {
    return annotation;
  }

  public Constant getValue() {
    return value;
  }
}
