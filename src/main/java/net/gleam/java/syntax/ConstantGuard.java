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

/** Syntax node for a constant used as a guard or guard operand, {@code True}, {@code 10}. */
public final class ConstantGuard extends ClauseGuard {

  private final Constant constant;

  ConstantGuard(FileLocations locs, Constant constant) {
    super(locs, Kind.CONSTANT, constant.getStartOffset(), constant.getEndOffset());
    this.constant = constant;
  }

  public Constant getConstant() {
    return constant;
  }
}
