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

/** Syntax node for {@code pattern as name}. */
public final class AssignPattern extends Pattern {

  private final Pattern pattern;
  private final String name;

  AssignPattern(FileLocations locs, Pattern pattern, String name, int endOffset) {
    super(locs, Kind.ASSIGN, pattern.getStartOffset(), endOffset);
    this.pattern = pattern;
    this.name = name;
  }

  public Pattern getPattern() {
    return pattern;
  }

  public String getName() {
    return name;
  }
}
