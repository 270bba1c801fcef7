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
import com.google.common.primitives.ImmutableIntArray;
import java.util.Optional;
import net.gleam.java.syntax.Comment;
import net.gleam.java.syntax.ModuleExtra;

/**
 * The trivia of a module not yet reattached to the output. The formatter walks the tree in source
 * order and pops trivia up to each node it prints, so each position only moves forward.
 *
 * <p>A popped run of comments is a list of items, each either a comment text or {@link
 * Optional#empty} for a blank line between comments.
 */
final class TriviaCursor {

  private final ImmutableList<Comment> comments;
  private final ImmutableList<Comment> docComments;
  private final ImmutableList<Comment> moduleComments;
  private final ImmutableIntArray emptyLines;

  // Index of the first unconsumed item of each sequence.
  private int commentIndex;
  private int docCommentIndex;
  private int emptyLineIndex;

  TriviaCursor(ModuleExtra extra) {
    this.comments = extra.comments();
    this.docComments = extra.docComments();
    this.moduleComments = extra.moduleComments();
    this.emptyLines = extra.emptyLines();
  }

  /**
   * Pops the comments and blank lines at offsets up to and including {@code limit}, in source
   * order. Blank lines with no comment between them become a single marker, and blank lines
   * before the first comment are dropped.
   */
  ImmutableList<Optional<String>> popComments(int limit) {
    int end = endOf(comments, commentIndex, limit);
    int emptyEnd = endOfEmptyLines(limit);
    ImmutableList.Builder<Optional<String>> run = ImmutableList.builder();
    boolean lastWasComment = false;
    int i = commentIndex;
    int j = emptyLineIndex;
    while (i < end) {
      Comment comment = comments.get(i);
      if (j < emptyEnd && emptyLines.get(j) < comment.getStartOffset()) {
        if (lastWasComment) {
          run.add(Optional.empty());
          lastWasComment = false;
        }
        j++;
      } else {
        run.add(Optional.of(comment.getText()));
        lastWasComment = true;
        i++;
      }
    }
    if (j < emptyEnd && lastWasComment) {
      run.add(Optional.empty());
    }
    commentIndex = end;
    emptyLineIndex = emptyEnd;
    return run.build();
  }

  /**
   * Pops the doc comments at offsets up to {@code limit}. Blank lines up to the limit are consumed
   * too but not reported: doc comments always print as one contiguous block.
   */
  ImmutableList<String> popDocComments(int limit) {
    int end = endOf(docComments, docCommentIndex, limit);
    ImmutableList.Builder<String> run = ImmutableList.builder();
    for (int i = docCommentIndex; i < end; i++) {
      run.add(docComments.get(i).getText());
    }
    docCommentIndex = end;
    emptyLineIndex = endOfEmptyLines(limit);
    return run.build();
  }

  /** Pops the blank lines at offsets up to {@code limit}, reporting whether there were any. */
  boolean popEmptyLines(int limit) {
    int end = endOfEmptyLines(limit);
    boolean any = end > emptyLineIndex;
    emptyLineIndex = end;
    return any;
  }

  /** Reports whether the next unconsumed comment starts before {@code limit}. */
  boolean anyCommentsBefore(int limit) {
    return commentIndex < comments.size()
        && comments.get(commentIndex).getStartOffset() < limit;
  }

  /** Returns the texts of the {@code ////} comments, which always print at the top. */
  ImmutableList<String> moduleComments() {
    ImmutableList.Builder<String> texts = ImmutableList.builder();
    for (Comment comment : moduleComments) {
      texts.add(comment.getText());
    }
    return texts.build();
  }

  private static int endOf(ImmutableList<Comment> list, int from, int limit) {
    int end = from;
    while (end < list.size() && list.get(end).getStartOffset() <= limit) {
      end++;
    }
    return end;
  }

  private int endOfEmptyLines(int limit) {
    int end = emptyLineIndex;
    while (end < emptyLines.length() && emptyLines.get(end) <= limit) {
      end++;
    }
    return end;
  }
}
