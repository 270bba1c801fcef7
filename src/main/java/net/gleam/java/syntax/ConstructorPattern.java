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
 * Syntax node for a record constructor pattern, {@code Ok(x)}, {@code option.Some(..)} or {@code
 * Person(name: n, ..)}.
 */
public final class ConstructorPattern extends Pattern {

  @Nullable private final String module;
  private final String name;
  private final ImmutableList<Argument<Pattern>> arguments;
  private final boolean withSpread;

  ConstructorPattern(
      FileLocations locs,
      int startOffset,
      int endOffset,
      @Nullable String module,
      String name,
      ImmutableList<Argument<Pattern>> arguments,
      boolean withSpread) {
    super(locs, Kind.CONSTRUCTOR, startOffset, endOffset);
    this.module = module;
    this.name = name;
    this.arguments = arguments;
    this.withSpread = withSpread;
  }

  /** Returns the module qualifier, or null for an unqualified constructor. */
  @Nullable
  public String getModule() {
    return module;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Argument<Pattern>> getArguments() {
    return arguments;
  }

  /** Reports whether the arguments end with {@code ..}, ignoring the remaining fields. */
  public boolean hasSpread() {
    return withSpread;
  }
}
