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

/** Syntax node for an import, {@code import gleam/list.{type Order, map as list_map} as l}. */
public final class ImportDefinition extends Definition {

  private final String module;
  private final ImmutableList<UnqualifiedImport> types;
  private final ImmutableList<UnqualifiedImport> values;
  @Nullable private final String alias;

  ImportDefinition(
      FileLocations locs,
      int startOffset,
      int endOffset,
      String module,
      ImmutableList<UnqualifiedImport> types,
      ImmutableList<UnqualifiedImport> values,
      @Nullable String alias) {
    super(locs, Kind.IMPORT, startOffset, endOffset);
    this.module = module;
    this.types = types;
    this.values = values;
    this.alias = alias;
  }

  /** Returns the slash-separated module path, {@code gleam/list}. */
  public String getModule() {
    return module;
  }

  /** Returns the unqualified types, those written {@code type T}, in source order. */
  public ImmutableList<UnqualifiedImport> getTypes() {
    return types;
  }

  /** Returns the unqualified values and constructors, in source order. */
  public ImmutableList<UnqualifiedImport> getValues() {
    return values;
  }

  /** Returns the name after {@code as}, or null. It may be a discard name. */
  @Nullable
  public String getAlias() {
    return alias;
  }
}
