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
 * Syntax node for an anonymous function, {@code fn(x) { x + 1 }}, or a function capture, {@code
 * f(_, 1)}. A capture has a single parameter named {@link Identifier#CAPTURE_NAME} and a body that
 * is exactly one call expression.
 */
public final class FnExpression extends Expression {

  private final boolean isCapture;
  private final ImmutableList<Parameter> parameters;
  @Nullable private final TypeExpression returnAnnotation;
  private final ImmutableList<Statement> body;

  FnExpression(
      FileLocations locs,
      int startOffset,
      int endOffset,
      boolean isCapture,
      ImmutableList<Parameter> parameters,
      @Nullable TypeExpression returnAnnotation,
      ImmutableList<Statement> body) {
    super(locs, Kind.FN, startOffset, endOffset);
    this.isCapture = isCapture;
    this.parameters = parameters;
    this.returnAnnotation = returnAnnotation;
    this.body = body;
  }

  public boolean isCapture() {
    return isCapture;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  @Nullable
  public TypeExpression getReturnAnnotation() {
    return returnAnnotation;
  }

  /** Returns the statements of the body; never empty. */
  public ImmutableList<Statement> getBody() {
    return body;
  }
}
