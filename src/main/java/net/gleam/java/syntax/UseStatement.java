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
 * Syntax node for a use statement, {@code use a, b <- call(x)}. The statements that follow it in
 * the enclosing block become the body of a callback passed as the last argument of the call.
 */
public final class UseStatement extends Statement {

  private final ImmutableList<UseAssignment> assignments;
  private final Expression call;

  UseStatement(
      FileLocations locs,
      int startOffset,
      ImmutableList<UseAssignment> assignments,
      Expression call) {
    super(locs, Kind.USE, startOffset, call.getEndOffset());
    this.assignments = assignments;
    this.call = call;
  }

  /** Returns the callback parameters bound left of the arrow; possibly empty. */
  public ImmutableList<UseAssignment> getAssignments() {
    return assignments;
  }

  public Expression getCall() {
    return call;
  }
}
