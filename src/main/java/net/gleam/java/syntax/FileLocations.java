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

import java.util.Arrays;

/**
 * FileLocations maps each char offset of a source file to its {@link Location}. Instances are
 * created by the lexer and shared by all the nodes of a parsed module.
 */
final class FileLocations {

  private final int[] lineStarts; // 0-based offset of each line start, ascending
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] lineStarts, String file, int size) {
    this.lineStarts = lineStarts;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] content, String file) {
    int lines = 1;
    for (char c : content) {
      if (c == '\n') {
        lines++;
      }
    }
    int[] lineStarts = new int[lines];
    int line = 1;
    for (int i = 0; i < content.length; i++) {
      if (content[i] == '\n') {
        lineStarts[line++] = i + 1;
      }
    }
    return new FileLocations(lineStarts, file, content.length);
  }

  String file() {
    return file;
  }

  private int getLineAt(int offset) {
    if (offset < 0 || offset > size) {
      throw new IllegalStateException("Illegal position: " + offset);
    }
    int index = Arrays.binarySearch(lineStarts, offset);
    // binarySearch returns (-(insertion point) - 1) when the offset is not a line start
    return index >= 0 ? index : -index - 2;
  }

  /** Returns the location of the specified char offset. */
  Location getLocation(int offset) {
    int line = getLineAt(offset);
    return Location.create(file, line + 1, offset - lineStarts[line] + 1);
  }
}
