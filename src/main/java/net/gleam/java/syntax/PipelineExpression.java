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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Syntax node for a chain of {@code |>} applications, {@code a |> f |> g}. The first stage is the
 * value being piped; each later stage is applied to the result of the stages before it.
 */
public final class PipelineExpression extends Expression {

  private final ImmutableList<Expression> stages;

  PipelineExpression(FileLocations locs, ImmutableList<Expression> stages) {
    super(
        locs,
        Kind.PIPELINE,
        stages.get(0).getStartOffset(),
        stages.get(stages.size() - 1).getEndOffset());
    Preconditions.checkArgument(stages.size() >= 2, "a pipeline has at least two stages");
    this.stages = stages;
  }

  public ImmutableList<Expression> getStages() {
    return stages;
  }

  @Override
  public int precedence() {
    return BinaryOperator.PIPE_PRECEDENCE;
  }
}
