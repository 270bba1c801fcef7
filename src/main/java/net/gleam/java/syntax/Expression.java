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

/** Base class for all expression nodes in the AST. */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    BINARY_OPERATOR,
    BIT_ARRAY,
    BLOCK,
    CALL,
    CASE,
    FIELD_ACCESS,
    FLOAT_LITERAL,
    FN,
    IDENTIFIER,
    INT_LITERAL,
    LIST,
    NEGATE_BOOL,
    NEGATE_INT,
    PANIC,
    PIPELINE,
    PLACEHOLDER,
    RECORD_UPDATE,
    STRING_LITERAL,
    TODO,
    TUPLE,
    TUPLE_INDEX,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  Expression(FileLocations locs, Kind kind, int startOffset, int endOffset) {
    super(locs, startOffset, endOffset);
    this.kind = kind;
  }

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public final Kind kind() {
    return kind;
  }

  /**
   * Returns how tightly this expression binds as an operand: the operator precedence for binary
   * operators and pipelines, {@link BinaryOperator#MAX_PRECEDENCE} for everything else.
   */
  public int precedence() {
    return BinaryOperator.MAX_PRECEDENCE;
  }
}
