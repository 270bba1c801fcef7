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
 * Syntax node for a function definition. The node spans the signature, {@code pub fn name(args)
 * -> Type}; the body extends to {@link #getBodyEndOffset}.
 */
public final class FunctionDefinition extends Definition {

  private final boolean isPublic;
  private final String name;
  private final ImmutableList<Parameter> parameters;
  @Nullable private final TypeExpression returnAnnotation;
  private final ImmutableList<Statement> body;
  private final int bodyEndOffset;
  @Nullable private final String deprecation;
  private final ImmutableList<ExternalBinding> externals;

  FunctionDefinition(
      FileLocations locs,
      int startOffset,
      int endOffset,
      boolean isPublic,
      String name,
      ImmutableList<Parameter> parameters,
      @Nullable TypeExpression returnAnnotation,
      ImmutableList<Statement> body,
      int bodyEndOffset,
      @Nullable String deprecation,
      ImmutableList<ExternalBinding> externals) {
    super(locs, Kind.FUNCTION, startOffset, endOffset);
    this.isPublic = isPublic;
    this.name = name;
    this.parameters = parameters;
    this.returnAnnotation = returnAnnotation;
    this.body = body;
    this.bodyEndOffset = bodyEndOffset;
    this.deprecation = deprecation;
    this.externals = externals;
  }

  public boolean isPublic() {
    return isPublic;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  @Nullable
  public TypeExpression getReturnAnnotation() {
    return returnAnnotation;
  }

  /**
   * Returns the statements of the body; never empty. A function with only external
   * implementations has a body consisting of a single {@link PlaceholderExpression}.
   */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** Returns the offset of the closing brace of the body, or the signature end if there is none. */
  public int getBodyEndOffset() {
    return bodyEndOffset;
  }

  /** Returns the message of the {@code @deprecated} attribute, or null if there is none. */
  @Nullable
  public String getDeprecation() {
    return deprecation;
  }

  /** Returns the {@code @external} attributes, in source order. */
  public ImmutableList<ExternalBinding> getExternals() {
    return externals;
  }
}
