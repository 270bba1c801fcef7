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

/** Syntax node for a type alias, {@code pub type Pair(a) = #(a, a)}. */
public final class TypeAliasDefinition extends Definition {

  private final boolean isPublic;
  private final String name;
  private final ImmutableList<String> parameters;
  private final TypeExpression type;
  @Nullable private final String deprecation;

  TypeAliasDefinition(
      FileLocations locs,
      int startOffset,
      boolean isPublic,
      String name,
      ImmutableList<String> parameters,
      TypeExpression type,
      @Nullable String deprecation) {
    super(locs, Kind.TYPE_ALIAS, startOffset, type.getEndOffset());
    this.isPublic = isPublic;
    this.name = name;
    this.parameters = parameters;
    this.type = type;
    this.deprecation = deprecation;
  }

  public boolean isPublic() {
    return isPublic;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<String> getParameters() {
    return parameters;
  }

  public TypeExpression getType() {
    return type;
  }

  @Nullable
  public String getDeprecation() {
    return deprecation;
  }
}
