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
 * Syntax node for a reference to a variable, function or constructor by name, such as {@code x},
 * {@code print} or {@code Ok}.
 */
public final class Identifier extends Expression {

  /**
   * The name of the variable bound by a function capture. The {@code _} in {@code f(_, 1)} reads
   * this variable in the body of the capture.
   */
  public static final String CAPTURE_NAME = "_capture";

  private final String name;

  Identifier(FileLocations locs, int startOffset, int endOffset, String name) {
    super(locs, Kind.IDENTIFIER, startOffset, endOffset);
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /** Reports whether this identifier is the hole of a function capture. */
  public boolean isCaptureHole() {
    return name.equals(CAPTURE_NAME);
  }
}
