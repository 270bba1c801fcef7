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

import com.google.auto.value.AutoValue;

/**
 * A Location denotes a position within a source file: a file name plus a 1-based line and column.
 * The column counts chars (UTF-16 code units) from the start of the line.
 */
@AutoValue
public abstract class Location {

  /** The name of the file containing the position. */
  public abstract String file();

  /** The 1-based line number, or 0 if unknown. */
  public abstract int line();

  /** The 1-based column number, or 0 if unknown. */
  public abstract int column();

  /** Returns a new Location for the specified file, line and column. */
  public static Location create(String file, int line, int column) {
    return new AutoValue_Location(file, line, column);
  }

  /** Formats the location as "file:line:col", omitting the unknown parts. */
  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(file());
    if (line() != 0) {
      buf.append(':').append(line());
      if (column() != 0) {
        buf.append(':').append(column());
      }
    }
    return buf.toString();
  }
}
