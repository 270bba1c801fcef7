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
import com.google.common.primitives.ImmutableIntArray;

/**
 * The trivia of a module: everything the lexer discards that a printer must put back. Comments of
 * each kind are listed in source order, and {@link #emptyLines} holds, for each run of whitespace
 * that contains at least one blank line, the offset where that run starts. All four sequences are
 * strictly increasing.
 */
public final class ModuleExtra {

  private final ImmutableList<Comment> comments;
  private final ImmutableList<Comment> docComments;
  private final ImmutableList<Comment> moduleComments;
  private final ImmutableIntArray emptyLines;

  ModuleExtra(
      ImmutableList<Comment> comments,
      ImmutableList<Comment> docComments,
      ImmutableList<Comment> moduleComments,
      ImmutableIntArray emptyLines) {
    this.comments = comments;
    this.docComments = docComments;
    this.moduleComments = moduleComments;
    this.emptyLines = emptyLines;
  }

  /** Returns the {@code //} comments. */
  public ImmutableList<Comment> comments() {
    return comments;
  }

  /** Returns the {@code ///} comments. */
  public ImmutableList<Comment> docComments() {
    return docComments;
  }

  /** Returns the {@code ////} comments. */
  public ImmutableList<Comment> moduleComments() {
    return moduleComments;
  }

  /** Returns the offsets of the blank-line runs. */
  public ImmutableIntArray emptyLines() {
    return emptyLines;
  }
}
