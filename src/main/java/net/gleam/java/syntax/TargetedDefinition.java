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

import javax.annotation.Nullable;

/** A top-level definition, optionally restricted to a single target by {@code @target(...)}. */
public final class TargetedDefinition extends Node {

  @Nullable private final Target target;
  private final Definition definition;

  TargetedDefinition(FileLocations locs, @Nullable Target target, Definition definition) {
    super(locs, definition.getStartOffset(), definition.getEndOffset());
    this.target = target;
    this.definition = definition;
  }

  /** Returns the target the definition is compiled for, or null if it is compiled for all. */
  @Nullable
  public Target getTarget() {
    return target;
  }

  public Definition getDefinition() {
    return definition;
  }
}
