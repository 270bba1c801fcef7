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

/** Syntax node for a constructor of a custom type, {@code Circle(radius: Float)}. */
public final class RecordConstructor extends Node {

  private final String name;
  private final ImmutableList<RecordConstructorArgument> arguments;

  RecordConstructor(
      FileLocations locs,
      int startOffset,
      int endOffset,
      String name,
      ImmutableList<RecordConstructorArgument> arguments) {
    super(locs, startOffset, endOffset);
    this.name = name;
    this.arguments = arguments;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<RecordConstructorArgument> getArguments() {
    return arguments;
  }
}
