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

/** Syntax node for a negated guard, {@code !x}. */
public final class NotGuard extends ClauseGuard {

  private final ClauseGuard guard;

  NotGuard(FileLocations locs, int startOffset, ClauseGuard guard) {
    super(locs, Kind.NOT, startOffset, guard.getEndOffset());
    this.guard = guard;
  }

  public ClauseGuard getGuard() {
    return guard;
  }
}
