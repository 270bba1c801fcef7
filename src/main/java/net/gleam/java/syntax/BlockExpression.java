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

/** Syntax node for a braced sequence of statements, {@code { a b }}. */
public final class BlockExpression extends Expression {

  private final ImmutableList<Statement> statements;

  BlockExpression(
      FileLocations locs, int startOffset, int endOffset, ImmutableList<Statement> statements) {
    super(locs, Kind.BLOCK, startOffset, endOffset);
    this.statements = statements;
  }

  /** Returns the statements of the block; never empty. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }
}
