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

import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/**
 * Syntax node for an option of a bit array segment: a named option such as {@code little}, a size
 * ({@code size(n)}, or just {@code n} in short form), or a unit ({@code unit(8)}).
 *
 * @param <T> the kind of the size value
 */
public final class BitArrayOption<T extends Node> extends Node {

  /** The kinds of option. Every kind but SIZE and UNIT is a bare name. */
  public enum Kind {
    BYTES("bytes"),
    BITS("bits"),
    INT("int"),
    FLOAT("float"),
    UTF8("utf8"),
    UTF16("utf16"),
    UTF32("utf32"),
    UTF8_CODEPOINT("utf8_codepoint"),
    UTF16_CODEPOINT("utf16_codepoint"),
    UTF32_CODEPOINT("utf32_codepoint"),
    SIGNED("signed"),
    UNSIGNED("unsigned"),
    BIG("big"),
    LITTLE("little"),
    NATIVE("native"),
    SIZE("size"),
    UNIT("unit");

    private final String canonicalName;

    Kind(String canonicalName) {
      this.canonicalName = canonicalName;
    }

    /** Returns the name the option is printed with. */
    public String canonicalName() {
      return canonicalName;
    }
  }

  private static final ImmutableMap<String, Kind> NAMED;

  static {
    ImmutableMap.Builder<String, Kind> named = ImmutableMap.builder();
    for (Kind kind : Kind.values()) {
      if (kind != Kind.SIZE && kind != Kind.UNIT) {
        named.put(kind.canonicalName(), kind);
      }
    }
    // Older spellings, printed with their current names.
    named.put("binary", Kind.BYTES);
    named.put("bit_string", Kind.BITS);
    NAMED = named.buildOrThrow();
  }

  private final Kind kind;
  @Nullable private final T value;
  private final int unit;
  private final boolean shortForm;

  private BitArrayOption(
      FileLocations locs,
      int startOffset,
      int endOffset,
      Kind kind,
      @Nullable T value,
      int unit,
      boolean shortForm) {
    super(locs, startOffset, endOffset);
    this.kind = kind;
    this.value = value;
    this.unit = unit;
    this.shortForm = shortForm;
  }

  static <T extends Node> BitArrayOption<T> named(
      FileLocations locs, int startOffset, int endOffset, Kind kind) {
    return new BitArrayOption<>(locs, startOffset, endOffset, kind, null, 0, false);
  }

  static <T extends Node> BitArrayOption<T> size(
      FileLocations locs, int startOffset, int endOffset, T value, boolean shortForm) {
    return new BitArrayOption<>(locs, startOffset, endOffset, Kind.SIZE, value, 0, shortForm);
  }

  static <T extends Node> BitArrayOption<T> unit(
      FileLocations locs, int startOffset, int endOffset, int unit) {
    return new BitArrayOption<>(locs, startOffset, endOffset, Kind.UNIT, null, unit, false);
  }

  /** Returns the kind of a named option, or null if the name is not one. */
  @Nullable
  static Kind namedKind(String name) {
    return NAMED.get(name);
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the size value of a SIZE option; null for all other kinds. */
  @Nullable
  public T getValue() {
    return value;
  }

  /** Returns the unit of a UNIT option. */
  public int getUnit() {
    return unit;
  }

  /** Reports whether a SIZE option was written as a bare value, {@code x:8}. */
  public boolean isShortForm() {
    return shortForm;
  }

  /** Reports whether the option is a bare name, with no value. */
  public boolean isNamed() {
    return kind != Kind.SIZE && kind != Kind.UNIT;
  }
}
