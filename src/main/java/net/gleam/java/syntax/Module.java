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
import java.util.List;

/**
 * Syntax tree for a Gleam module: its top-level definitions, in source order, and the trivia the
 * lexer set aside.
 */
public final class Module extends Node {

  private final ParserInput input;
  private final ImmutableList<TargetedDefinition> definitions;
  private final ModuleExtra extra;
  private final ImmutableList<SyntaxError> errors;

  private Module(
      FileLocations locs,
      ParserInput input,
      ImmutableList<TargetedDefinition> definitions,
      ModuleExtra extra,
      List<SyntaxError> errors) {
    super(locs, 0, input.getContent().length);
    this.input = input;
    this.definitions = definitions;
    this.extra = extra;
    this.errors = ImmutableList.copyOf(errors);
  }

  /**
   * Parses the input as a Gleam module. Syntax errors are recorded in the result rather than
   * thrown; call {@link #ok} to check for them.
   */
  public static Module parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseModule(input);
    return new Module(result.locs, input, result.definitions, result.extra, result.errors);
  }

  /** Reports whether the module was parsed without errors. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the scanner and parser errors, in the order they were found. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  public ImmutableList<TargetedDefinition> getDefinitions() {
    return definitions;
  }

  /** Returns the comments and blank-line positions of the module. */
  public ModuleExtra getExtra() {
    return extra;
  }

  public ParserInput getInput() {
    return input;
  }

  /** Returns the name of the file from which the module was parsed. */
  public String getFile() {
    return input.getFile();
  }
}
