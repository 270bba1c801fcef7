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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * An immutable tree describing what to print, independent of the final line width. A {@link
 * DocumentRenderer} decides, group by group, which conditional breaks become newlines.
 *
 * <p>Empty documents are dropped by {@link #concat} and {@link #join}, so they never introduce
 * separators.
 */
public abstract class Document {

  /**
   * Kind of the document. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    BREAK,
    CONCAT,
    FORCE_BROKEN,
    GROUP,
    LINE,
    NEST,
    TEXT,
  }

  /** How a conditional break decides to break when its enclosing group is broken. */
  public enum BreakKind {
    /** Breaks whenever the enclosing group breaks. */
    STRICT,
    /** Stays on the line while the following content up to the next break still fits. */
    FLEX,
  }

  private static final Concat NIL = new Concat(ImmutableList.of());
  private static final Line LINE = new Line(1);

  private final Kind kind;

  private Document(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  // --- Constructors ---

  /** Returns the empty document. */
  public static Document nil() {
    return NIL;
  }

  /** Returns literal text, or the empty document for the empty string. */
  public static Document text(String text) {
    return text.isEmpty() ? NIL : new Text(text);
  }

  /** Returns a mandatory newline followed by the current indentation. */
  public static Document line() {
    return LINE;
  }

  /** Returns {@code n} mandatory newlines followed by the current indentation. */
  public static Document lines(int n) {
    Preconditions.checkArgument(n >= 1, "lines(%s)", n);
    return n == 1 ? LINE : new Line(n);
  }

  /**
   * Returns a break that renders as {@code unbroken} when its group fits on the line, and as
   * {@code broken} followed by a newline otherwise.
   */
  public static Document strictBreak(String broken, String unbroken) {
    return new Break(BreakKind.STRICT, broken, unbroken);
  }

  /** Returns a break that packs as many elements per line as fit. */
  public static Document flexBreak(String broken, String unbroken) {
    return new Break(BreakKind.FLEX, broken, unbroken);
  }

  public static Document concat(Document... docs) {
    return concat(Arrays.asList(docs));
  }

  public static Document concat(Iterable<Document> docs) {
    ImmutableList.Builder<Document> parts = ImmutableList.builder();
    for (Document doc : docs) {
      if (!doc.isEmpty()) {
        parts.add(doc);
      }
    }
    ImmutableList<Document> list = parts.build();
    if (list.isEmpty()) {
      return NIL;
    }
    return list.size() == 1 ? list.get(0) : new Concat(list);
  }

  /** Concatenates the non-empty documents with {@code separator} between each adjacent pair. */
  public static Document join(Iterable<Document> docs, Document separator) {
    ImmutableList.Builder<Document> parts = ImmutableList.builder();
    boolean first = true;
    for (Document doc : docs) {
      if (doc.isEmpty()) {
        continue;
      }
      if (!first) {
        parts.add(separator);
      }
      parts.add(doc);
      first = false;
    }
    return concat(parts.build());
  }

  // --- Combinators ---

  /** Returns this document followed by the given ones. */
  public final Document append(Document... docs) {
    ImmutableList.Builder<Document> parts = ImmutableList.builder();
    parts.add(this);
    parts.add(docs);
    return concat(parts.build());
  }

  public final Document append(String text) {
    return append(text(text));
  }

  /** Returns this document with the indentation of its lines and breaks increased by n. */
  public final Document nest(int indent) {
    return isEmpty() ? NIL : new Nest(indent, this);
  }

  /** Returns this document as a group whose breaks are resolved together. */
  public final Document group() {
    return isEmpty() || kind == Kind.GROUP ? this : new Group(this);
  }

  /** Returns this document rendered broken, failing every enclosing group's fit check. */
  public final Document forceBreak() {
    return isEmpty() || kind == Kind.FORCE_BROKEN ? this : new ForceBroken(this);
  }

  /** Returns this document between {@code open} and {@code close}. */
  public final Document surround(String open, String close) {
    return concat(text(open), this, text(close));
  }

  /** Reports whether this document renders as nothing. */
  public boolean isEmpty() {
    return false;
  }

  /** Renders the document at the given line width. */
  public final String render(int width) {
    return DocumentRenderer.render(this, width);
  }

  // --- Variants ---

  /** Literal text. */
  public static final class Text extends Document {
    private final String text;

    private Text(String text) {
      super(Kind.TEXT);
      this.text = text;
    }

    public String getText() {
      return text;
    }
  }

  /** One or more mandatory newlines. */
  public static final class Line extends Document {
    private final int count;

    private Line(int count) {
      super(Kind.LINE);
      this.count = count;
    }

    public int getCount() {
      return count;
    }
  }

  /** A conditional break. */
  public static final class Break extends Document {
    private final BreakKind breakKind;
    private final String broken;
    private final String unbroken;

    private Break(BreakKind breakKind, String broken, String unbroken) {
      super(Kind.BREAK);
      this.breakKind = breakKind;
      this.broken = broken;
      this.unbroken = unbroken;
    }

    public BreakKind getBreakKind() {
      return breakKind;
    }

    /** Returns the text printed before the newline when the break is taken. */
    public String getBroken() {
      return broken;
    }

    /** Returns the text printed when the break is not taken. */
    public String getUnbroken() {
      return unbroken;
    }
  }

  /** A subtree with increased indentation. */
  public static final class Nest extends Document {
    private final int indent;
    private final Document document;

    private Nest(int indent, Document document) {
      super(Kind.NEST);
      this.indent = indent;
      this.document = document;
    }

    public int getIndent() {
      return indent;
    }

    public Document getDocument() {
      return document;
    }
  }

  /** A subtree whose breaks are all taken or all not taken. */
  public static final class Group extends Document {
    private final Document document;

    private Group(Document document) {
      super(Kind.GROUP);
      this.document = document;
    }

    public Document getDocument() {
      return document;
    }
  }

  /** A subtree that is always rendered broken. */
  public static final class ForceBroken extends Document {
    private final Document document;

    private ForceBroken(Document document) {
      super(Kind.FORCE_BROKEN);
      this.document = document;
    }

    public Document getDocument() {
      return document;
    }
  }

  /** A sequence of documents. */
  public static final class Concat extends Document {
    private final ImmutableList<Document> documents;

    private Concat(ImmutableList<Document> documents) {
      super(Kind.CONCAT);
      this.documents = documents;
    }

    public ImmutableList<Document> getDocuments() {
      return documents;
    }

    @Override
    public boolean isEmpty() {
      return documents.isEmpty();
    }
  }
}
