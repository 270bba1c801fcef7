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

import com.google.common.base.Strings;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Lays out a {@link Document} at a fixed line width.
 *
 * <p>The renderer keeps a stack of pending frames, each a document with the indentation and mode
 * it is rendered in. A group is rendered flat if its whole content fits on the rest of the line,
 * and broken otherwise. A flex break in a broken group stays on the line if the content up to the
 * next break still fits. No recursion is involved, so deeply nested documents are fine.
 */
public final class DocumentRenderer {

  private enum Mode {
    FLAT,
    BROKEN,
  }

  private static final class Frame {
    final int indent;
    final Mode mode;
    final Document document;

    Frame(int indent, Mode mode, Document document) {
      this.indent = indent;
      this.mode = mode;
      this.document = document;
    }
  }

  private final int width;
  private final StringBuilder out = new StringBuilder();
  private final Deque<Frame> stack = new ArrayDeque<>();

  // Current column, and indentation owed before the next text on the line.
  private int column;
  private int pendingIndent;

  private DocumentRenderer(int width) {
    this.width = width;
  }

  /** Renders the document at the given line width. */
  public static String render(Document document, int width) {
    DocumentRenderer renderer = new DocumentRenderer(width);
    renderer.stack.push(new Frame(0, Mode.FLAT, document));
    renderer.run();
    return renderer.out.toString();
  }

  private void run() {
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      Document doc = frame.document;
      switch (doc.kind()) {
        case TEXT:
          emit(((Document.Text) doc).getText());
          break;
        case LINE:
          newlines(((Document.Line) doc).getCount(), frame.indent);
          break;
        case BREAK:
          {
            Document.Break br = (Document.Break) doc;
            if (frame.mode == Mode.FLAT) {
              emit(br.getUnbroken());
            } else if (br.getBreakKind() == Document.BreakKind.FLEX
                && fits(
                    new Frame(frame.indent, Mode.FLAT, Document.text(br.getUnbroken())),
                    stack.iterator())) {
              emit(br.getUnbroken());
            } else {
              emit(br.getBroken());
              newlines(1, frame.indent);
            }
            break;
          }
        case NEST:
          {
            Document.Nest nest = (Document.Nest) doc;
            stack.push(new Frame(frame.indent + nest.getIndent(), frame.mode, nest.getDocument()));
            break;
          }
        case GROUP:
          {
            Document inner = ((Document.Group) doc).getDocument();
            Mode mode =
                fits(new Frame(frame.indent, Mode.FLAT, inner), null) ? Mode.FLAT : Mode.BROKEN;
            stack.push(new Frame(frame.indent, mode, inner));
            break;
          }
        case FORCE_BROKEN:
          stack.push(
              new Frame(frame.indent, Mode.BROKEN, ((Document.ForceBroken) doc).getDocument()));
          break;
        case CONCAT:
          {
            List<Document> parts = ((Document.Concat) doc).getDocuments();
            for (int i = parts.size() - 1; i >= 0; i--) {
              stack.push(new Frame(frame.indent, frame.mode, parts.get(i)));
            }
            break;
          }
      }
    }
  }

  private void emit(String text) {
    if (text.isEmpty()) {
      return;
    }
    if (pendingIndent > 0) {
      out.append(Strings.repeat(" ", pendingIndent));
      pendingIndent = 0;
    }
    out.append(text);
    column = advance(column, text);
  }

  // Blank lines carry no indentation; it is written before the next text.
  private void newlines(int count, int indent) {
    for (int i = 0; i < count; i++) {
      out.append('\n');
    }
    pendingIndent = indent;
    column = indent;
  }

  /** Returns the column after writing text starting at the given column. */
  private static int advance(int column, String text) {
    int nl = text.lastIndexOf('\n');
    if (nl < 0) {
      return column + text.codePointCount(0, text.length());
    }
    return text.codePointCount(nl + 1, text.length());
  }

  /**
   * Reports whether the given frame, followed by the frames of {@code rest} if non-null, fits on
   * the current line. Measuring stops successfully at the first mandatory newline or broken-mode
   * break, and fails at a force-broken document or when the line overflows.
   */
  private boolean fits(Frame head, @Nullable Iterator<Frame> rest) {
    Deque<Frame> pending = new ArrayDeque<>();
    pending.push(head);
    int col = column;
    for (; ; ) {
      if (col > width) {
        return false;
      }
      Frame frame;
      if (!pending.isEmpty()) {
        frame = pending.pop();
      } else if (rest != null && rest.hasNext()) {
        frame = rest.next();
      } else {
        return true;
      }
      Document doc = frame.document;
      switch (doc.kind()) {
        case TEXT:
          col = advance(col, ((Document.Text) doc).getText());
          break;
        case LINE:
          return true;
        case BREAK:
          if (frame.mode == Mode.BROKEN) {
            return true;
          }
          col = advance(col, ((Document.Break) doc).getUnbroken());
          break;
        case NEST:
          {
            Document.Nest nest = (Document.Nest) doc;
            pending.push(
                new Frame(frame.indent + nest.getIndent(), frame.mode, nest.getDocument()));
            break;
          }
        case GROUP:
          // A group further along the line is laid out flat if it fits, so measure it flat.
          pending.push(new Frame(frame.indent, Mode.FLAT, ((Document.Group) doc).getDocument()));
          break;
        case FORCE_BROKEN:
          return false;
        case CONCAT:
          {
            List<Document> parts = ((Document.Concat) doc).getDocuments();
            for (int i = parts.size() - 1; i >= 0; i--) {
              pending.push(new Frame(frame.indent, frame.mode, parts.get(i)));
            }
            break;
          }
      }
    }
  }
}
