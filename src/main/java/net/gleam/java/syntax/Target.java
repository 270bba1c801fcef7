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

/** A compilation target, as named by {@code @target(...)} and {@code @external(...)}. */
public enum Target {
  ERLANG("erlang"),
  JAVASCRIPT("javascript");

  private final String name;

  Target(String name) {
    this.name = name;
  }

  /** Returns the target as written in attributes. */
  public String getName() {
    return name;
  }

  /** Returns the target with the given name, or null if there is none. */
  @Nullable
  static Target fromName(String name) {
    for (Target target : values()) {
      if (target.name.equals(name)) {
        return target;
      }
    }
    return null;
  }
}
