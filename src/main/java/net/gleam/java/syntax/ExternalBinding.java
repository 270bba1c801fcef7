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
 * An {@code @external(target, "module", "function")} attribute: the foreign function that
 * implements a function on one target.
 */
@AutoValue
public abstract class ExternalBinding {

  public abstract Target target();

  /** Returns the foreign module, the raw text between the quotes. */
  public abstract String module();

  /** Returns the foreign function, the raw text between the quotes. */
  public abstract String function();

  static ExternalBinding create(Target target, String module, String function) {
    return new AutoValue_ExternalBinding(target, module, function);
  }
}
