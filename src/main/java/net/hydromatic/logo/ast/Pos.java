/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.logo.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Position of a parse-tree node, or of an error, in the source text.
 *
 * <p>Offsets count {@code char}s from the start of the source; lines and
 * columns are 1-based. {@link #byteStart} and {@link #byteLength} give the
 * same span measured in bytes of the UTF-8 encoding of the source.
 */
public class Pos {
  public final String file;
  public final int startOffset;
  public final int endOffset;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;
  public final int byteStart;
  public final int byteLength;

  /** Creates a Pos. */
  private Pos(
      String file,
      int startOffset,
      int endOffset,
      int startLine,
      int startColumn,
      int endLine,
      int endColumn,
      int byteStart,
      int byteLength) {
    this.file = file;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.byteStart = byteStart;
    this.byteLength = byteLength;
  }

  /** Returns the number of characters in the span. */
  public int length() {
    return endOffset - startOffset;
  }

  @Override public int hashCode() {
    return Objects.hash(file, startOffset, endOffset);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.file.equals(((Pos) o).file)
        && this.startOffset == ((Pos) o).startOffset
        && this.endOffset == ((Pos) o).endOffset;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /**
   * Line and byte offsets of a source string, computed once, so that each
   * {@link Pos} costs a binary search rather than a scan of the source.
   */
  public static class Index {
    private final String file;
    private final int length;
    /** Offset of the first character of each line. */
    private final int[] lineStarts;
    /** UTF-8 byte offset of each character offset, and of the end. */
    private final int[] byteOffsets;

    /** Creates an Index. */
    public Index(String source, String file) {
      this.file = requireNonNull(file);
      this.length = source.length();
      final List<Integer> starts = new ArrayList<>();
      starts.add(0);
      byteOffsets = new int[length + 1];
      int b = 0;
      for (int i = 0; i < length; i++) {
        byteOffsets[i] = b;
        final char c = source.charAt(i);
        if (c == '\n') {
          starts.add(i + 1);
        }
        b += utf8Width(source, i);
      }
      byteOffsets[length] = b;
      lineStarts = Ints.toArray(starts);
    }

    /** Returns the number of bytes that the UTF-8 encoding uses for the
     * character at {@code i}; 0 for the low half of a surrogate pair,
     * which is counted with its high half. */
    private static int utf8Width(String s, int i) {
      final char c = s.charAt(i);
      if (c < 0x80) {
        return 1;
      }
      if (c < 0x800) {
        return 2;
      }
      if (Character.isHighSurrogate(c)) {
        return i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))
            ? 4
            : 1; // unpaired; the encoder writes '?'
      }
      if (Character.isLowSurrogate(c)) {
        return i > 0 && Character.isHighSurrogate(s.charAt(i - 1)) ? 0 : 1;
      }
      return 3;
    }

    /** Returns the position of a span. */
    public Pos pos(int startOffset, int endOffset) {
      checkArgument(0 <= startOffset && startOffset <= endOffset
              && endOffset <= length,
          "invalid span [%s, %s) for source of length %s", startOffset,
          endOffset, length);
      final int startLine = line(startOffset);
      final int endLine = line(endOffset);
      return new Pos(file, startOffset, endOffset, startLine,
          startOffset - lineStarts[startLine - 1] + 1, endLine,
          endOffset - lineStarts[endLine - 1] + 1,
          byteOffsets[startOffset],
          byteOffsets[endOffset] - byteOffsets[startOffset]);
    }

    /** Returns the 1-based line that contains an offset. */
    private int line(int offset) {
      final int k = Arrays.binarySearch(lineStarts, offset);
      return k >= 0 ? k + 1 : -(k + 1);
    }
  }
}

// End Pos.java
