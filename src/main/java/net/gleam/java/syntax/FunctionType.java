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

/** Syntax node for a function type, {@code fn(Int, String) -> Bool}. */
public final class FunctionType extends TypeExpression {

  private final ImmutableList<TypeExpression> arguments;
  private final TypeExpression returnType;

  FunctionType(
      FileLocations locs,
      int startOffset,
      ImmutableList<TypeExpression> arguments,
      TypeExpression returnType) {
    super(locs, Kind.FUNCTION, startOffset, returnType.getEndOffset());
    this.arguments = arguments;
    this.returnType = returnType;
  }

  public ImmutableList<TypeExpression> getArguments() {
    return arguments;
  }

  public TypeExpression getReturnType() {
    return returnType;
  }
}
