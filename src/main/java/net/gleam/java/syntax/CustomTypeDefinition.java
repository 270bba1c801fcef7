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

/**
 * Syntax node for a custom type, {@code pub opaque type Shape { Circle(r: Float) }}. The node
 * spans the head, up to the opening brace; the constructors extend to {@link #getBodyEndOffset}.
 */
public final class CustomTypeDefinition extends Definition {

  private final boolean isPublic;
  private final boolean isOpaque;
  private final String name;
  private final ImmutableList<String> parameters;
  private final ImmutableList<RecordConstructor> constructors;
  private final int bodyEndOffset;
  @Nullable private final String deprecation;

  CustomTypeDefinition(
      FileLocations locs,
      int startOffset,
      int endOffset,
      boolean isPublic,
      boolean isOpaque,
      String name,
      ImmutableList<String> parameters,
      ImmutableList<RecordConstructor> constructors,
      int bodyEndOffset,
      @Nullable String deprecation) {
    super(locs, Kind.CUSTOM_TYPE, startOffset, endOffset);
    this.isPublic = isPublic;
    this.isOpaque = isOpaque;
    this.name = name;
    this.parameters = parameters;
    this.constructors = constructors;
    this.bodyEndOffset = bodyEndOffset;
    this.deprecation = deprecation;
  }

  public boolean isPublic() {
    return isPublic;
  }

  public boolean isOpaque() {
    return isOpaque;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<String> getParameters() {
    return parameters;
  }

  public ImmutableList<RecordConstructor> getConstructors() {
    return constructors;
  }

  /** Returns the offset of the closing brace, or the head end if there is no body. */
  public int getBodyEndOffset() {
    return bodyEndOffset;
  }

  @Nullable
  public String getDeprecation() {
    return deprecation;
  }
}
