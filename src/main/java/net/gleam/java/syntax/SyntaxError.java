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

import com.google.common.base.Joiner;
import java.util.List;

/**
 * A SyntaxError represents a static error associated with a source module: a scanner or parser
 * error. It carries the location of the offending token and a message.
 */
public final class SyntaxError {

  private final Location location;
  private final String message;

  public SyntaxError(Location location, String message) {
    this.location = location;
    this.message = message;
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form "file.gleam:1:2: message". */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * Returns a string summarizing the specified list of errors: the first error, followed by a count
   * of the remaining ones.
   */
  public static String toString(List<SyntaxError> errors) {
    if (errors.isEmpty()) {
      return "no errors";
    }
    StringBuilder buf = new StringBuilder(errors.get(0).toString());
    if (errors.size() > 1) {
      buf.append(String.format(" (+ %d more)", errors.size() - 1));
    }
    return buf.toString();
  }

  /** Joins all the errors, one per line. */
  public static String toMultilineString(List<SyntaxError> errors) {
    return Joiner.on('\n').join(errors);
  }
}
