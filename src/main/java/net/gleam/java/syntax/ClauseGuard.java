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

/** Base class for the guard of a case clause, the condition after {@code if}. */
public abstract class ClauseGuard extends Node {

  /**
   * Kind of the guard. This is similar to using instanceof, except that it's more efficient and
   * can be used in a switch/case.
   */
  public enum Kind {
    BINARY_OPERATOR,
    CONSTANT,
    FIELD_ACCESS,
    NOT,
    TUPLE_INDEX,
    VARIABLE,
  }

  private final Kind kind;

  ClauseGuard(FileLocations locs, Kind kind, int startOffset, int endOffset) {
    super(locs, startOffset, endOffset);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** Returns how tightly this guard binds as an operand; see {@link Expression#precedence}. */
  public int precedence() {
    return BinaryOperator.MAX_PRECEDENCE;
  }
}
