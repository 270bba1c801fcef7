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

/** Syntax node for a case expression, {@code case a, b { p, q -> x }}. */
public final class CaseExpression extends Expression {

  private final ImmutableList<Expression> subjects;
  private final ImmutableList<Clause> clauses;

  CaseExpression(
      FileLocations locs,
      int startOffset,
      int endOffset,
      ImmutableList<Expression> subjects,
      ImmutableList<Clause> clauses) {
    super(locs, Kind.CASE, startOffset, endOffset);
    this.subjects = subjects;
    this.clauses = clauses;
  }

  public ImmutableList<Expression> getSubjects() {
    return subjects;
  }

  public ImmutableList<Clause> getClauses() {
    return clauses;
  }
}
