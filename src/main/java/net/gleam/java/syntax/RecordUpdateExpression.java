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

/**
 * Syntax node for a record update, {@code Person(..person, name: "Nubi")}. Every argument is
 * labelled.
 */
public final class RecordUpdateExpression extends Expression {

  private final Expression constructor;
  private final Expression spread;
  private final ImmutableList<Argument<Expression>> arguments;

  RecordUpdateExpression(
      FileLocations locs,
      Expression constructor,
      Expression spread,
      ImmutableList<Argument<Expression>> arguments,
      int endOffset) {
    super(locs, Kind.RECORD_UPDATE, constructor.getStartOffset(), endOffset);
    this.constructor = constructor;
    this.spread = spread;
    this.arguments = arguments;
  }

  public Expression getConstructor() {
    return constructor;
  }

  /** Returns the record whose fields are copied, the expression after {@code ..}. */
  public Expression getSpread() {
    return spread;
  }

  public ImmutableList<Argument<Expression>> getArguments() {
    return arguments;
  }
}
