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

/** Syntax node for a list literal, {@code [a, b, ..tail]}. */
public final class ListExpression extends Expression {

  private final ImmutableList<Expression> elements;
  @Nullable private final Expression tail;

  ListExpression(
      FileLocations locs,
      int startOffset,
      int endOffset,
      ImmutableList<Expression> elements,
      @Nullable Expression tail) {
    super(locs, Kind.LIST, startOffset, endOffset);
    this.elements = elements;
    this.tail = tail;
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  /** Returns the list that the elements are prepended to, or null if there is none. */
  @Nullable
  public Expression getTail() {
    return tail;
  }
}
