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
 * Syntax node for a field or module member access, {@code record.field} or {@code module.name}.
 * The two are indistinguishable before name resolution.
 */
public final class FieldAccessExpression extends Expression {

  private final Expression container;
  private final String label;

  FieldAccessExpression(FileLocations locs, Expression container, String label, int endOffset) {
    super(locs, Kind.FIELD_ACCESS, container.getStartOffset(), endOffset);
    this.container = container;
    this.label = label;
  }

  public Expression getContainer() {
    return container;
  }

  public String getLabel() {
    return label;
  }
}
