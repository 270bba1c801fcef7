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
 * Syntax node for a comment. The text excludes the leading slashes and the trailing newline, so
 * that a comment {@code // hello} has text {@code " hello"}.
 */
public final class Comment extends Node {

  /** The three flavours of comment, distinguished by the number of leading slashes. */
  public enum Kind {
    /** A free-standing {@code //} comment. */
    REGULAR("//"),
    /** A {@code ///} comment documenting the next definition, constructor or field. */
    DOC("///"),
    /** A {@code ////} comment documenting the whole module. */
    MODULE("////");

    private final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }

    /** Returns the slashes that introduce a comment of this kind. */
    public String prefix() {
      return prefix;
    }
  }

  private final Kind kind;
  private final String text;

  Comment(FileLocations locs, Kind kind, int offset, String text) {
    super(locs, offset, offset + text.length());
    this.kind = kind;
    this.text = text;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the text of the comment following its slashes, without the trailing newline. */
  public String getText() {
    return text;
  }
}
