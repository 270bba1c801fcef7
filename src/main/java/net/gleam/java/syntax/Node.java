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
 * A Node is a node in a syntax tree. Every node records the half-open range of char offsets it
 * spans in the source, and the offset table that maps those offsets back to locations.
 */
public abstract class Node {

  final FileLocations locs;
  private final int startOffset;
  private final int endOffset;

  Node(FileLocations locs, int startOffset, int endOffset) {
    this.locs = locs;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  /** Returns the char offset of the first character of this node. */
  public final int getStartOffset() {
    return startOffset;
  }

  /** Returns the char offset just past the last character of this node. */
  public final int getEndOffset() {
    return endOffset;
  }

  /** Returns the location of the first character of this node. */
  public final Location getStartLocation() {
    return locs.getLocation(startOffset);
  }

  /** Returns the location just past the last character of this node. */
  public final Location getEndLocation() {
    return locs.getLocation(endOffset);
  }

  /**
   * Prints the node as a compact, span-free structural dump. Two nodes print the same iff they
   * represent the same tree, regardless of layout, comments and offsets.
   */
  @Override
  public final String toString() {
    return NodePrinter.print(this);
  }
}
