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
import javax.annotation.Nullable;

/** Syntax node for a constant record, {@code True}, {@code Point(x: 1, y: 2)}, {@code m.Red}. */
public final class RecordConstant extends Constant {

  @Nullable private final String module;
  private final String name;
  private final ImmutableList<Argument<Constant>> arguments;

  RecordConstant(
      FileLocations locs,
      int startOffset,
      int endOffset,
      @Nullable String module,
      String name,
      ImmutableList<Argument<Constant>> arguments) {
    super(locs, Kind.RECORD, startOffset, endOffset);
    this.module = module;
    this.name = name;
    this.arguments = arguments;
  }

  @Nullable
  public String getModule() {
    return module;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Argument<Constant>> getArguments() {
    return arguments;
  }
}
