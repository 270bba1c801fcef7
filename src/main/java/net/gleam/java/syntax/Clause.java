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
 * Syntax node for a clause of a case expression: one or more alternative rows of patterns, an
 * optional guard and the resulting expression, {@code 1, x | 2, x if x > 0 -> x}.
 */
public final class Clause extends Node {

  private final ImmutableList<Pattern> patterns;
  private final ImmutableList<ImmutableList<Pattern>> alternativePatterns;
  @Nullable private final ClauseGuard guard;
  private final Expression then;

  Clause(
      FileLocations locs,
      ImmutableList<Pattern> patterns,
      ImmutableList<ImmutableList<Pattern>> alternativePatterns,
      @Nullable ClauseGuard guard,
      Expression then) {
    super(locs, patterns.get(0).getStartOffset(), then.getEndOffset());
    this.patterns = patterns;
    this.alternativePatterns = alternativePatterns;
    this.guard = guard;
    this.then = then;
  }

  /** Returns the first row of patterns, one per case subject. */
  public ImmutableList<Pattern> getPatterns() {
    return patterns;
  }

  /** Returns the rows after the first, each introduced by {@code |}. */
  public ImmutableList<ImmutableList<Pattern>> getAlternativePatterns() {
    return alternativePatterns;
  }

  @Nullable
  public ClauseGuard getGuard() {
    return guard;
  }

  public Expression getThen() {
    return then;
  }
}
