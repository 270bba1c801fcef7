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

/** Syntax node for a function call expression, {@code f(a, label: b)}. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final ImmutableList<Argument<Expression>> arguments;

  CallExpression(
      FileLocations locs,
      Expression function,
      ImmutableList<Argument<Expression>> arguments,
      int endOffset) {
    super(locs, Kind.CALL, function.getStartOffset(), endOffset);
    this.function = function;
    this.arguments = arguments;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  public ImmutableList<Argument<Expression>> getArguments() {
    return arguments;
  }
}
