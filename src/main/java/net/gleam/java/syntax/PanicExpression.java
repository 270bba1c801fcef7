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

/** Syntax node for {@code panic} or {@code panic as "message"}. */
public final class PanicExpression extends Expression {

  @Nullable private final String message;

  PanicExpression(FileLocations locs, int startOffset, int endOffset, @Nullable String message) {
    super(locs, Kind.PANIC, startOffset, endOffset);
    this.message = message;
  }

  /** Returns the raw text of the message string, or null if there is none. */
  @Nullable
  public String getMessage() {
    return message;
  }
}
