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
package net.gleam.java.format;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.gleam.java.syntax.SyntaxError;

/**
 * Thrown when a source file cannot be formatted because it does not parse. The exception carries
 * the file, its source and the syntax errors found in it.
 */
public final class ParseFailureException extends Exception {

  private final String file;
  private final String source;
  private final ImmutableList<SyntaxError> errors;

  /** Constructs the exception from a non-empty list of errors. */
  ParseFailureException(String file, String source, List<SyntaxError> errors) {
    super(SyntaxError.toString(errors));
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("no errors");
    }
    this.file = file;
    this.source = source;
    this.errors = ImmutableList.copyOf(errors);
  }

  /** Returns the name of the file that failed to parse. */
  public String getFile() {
    return file;
  }

  /** Returns the content of the file that failed to parse. */
  public String getSource() {
    return source;
  }

  /** Returns an immutable non-empty list of errors. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Returns all the errors, one per line. */
  public String describeErrors() {
    return SyntaxError.toMultilineString(errors);
  }
}
