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

/**
 * Syntax node for a guard combining two guards with a boolean or comparison operator, {@code a &&
 * b}, {@code x >= 0}.
 */
public final class BinaryGuard extends ClauseGuard {

  private final ClauseGuard x;
  private final BinaryOperator op;
  private final ClauseGuard y;

  BinaryGuard(FileLocations locs, ClauseGuard x, BinaryOperator op, ClauseGuard y) {
    super(locs, Kind.BINARY_OPERATOR, x.getStartOffset(), y.getEndOffset());
    this.x = x;
    this.op = op;
    this.y = y;
  }

  public ClauseGuard getX() {
    return x;
  }

  public BinaryOperator getOperator() {
    return op;
  }

  public ClauseGuard getY() {
    return y;
  }

  @Override
  public int precedence() {
    return op.precedence();
  }
}
