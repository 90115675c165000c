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
package net.hydromatic.logo.parse;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.logo.ast.Pos;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Returns whether a character may occur in an identifier: the name of a
   * variable, procedure or parameter.
   */
  public static boolean isIdentifierChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /**
   * Returns whether a character may occur in a quoted word such as {@code
   * "abc-def}. Words allow hyphens, identifiers do not.
   */
  public static boolean isWordChar(char c) {
    return isIdentifierChar(c) || c == '-';
  }

  /** Returns whether a character is an ASCII decimal digit. Other Unicode
   * digits, such as {@code '\u0661'}, are not digits in Logo. */
  public static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /** Returns the 1-based line number of an offset in a string. */
  public static int lineOf(String s, int offset) {
    int line = 1;
    for (int i = 0; i < offset && i < s.length(); i++) {
      if (s.charAt(i) == '\n') {
        ++line;
      }
    }
    return line;
  }

  /**
   * Appends the lines of source text around a position, with a line of carets
   * under the span on the line where it starts.
   *
   * <p>For example,
   *
   * <pre>{@code
   *    1 | PENDOWN
   *    2 | END
   *      | ^^^
   * }</pre>
   *
   * @param buf Buffer
   * @param source Source text
   * @param pos Position of the error
   * @param contextLines Number of lines to show before and after
   */
  public static StringBuilder appendSourceContext(StringBuilder buf,
      String source, Pos pos, int contextLines) {
    final List<String> lines =
        source.lines().collect(ImmutableList.toImmutableList());
    if (lines.isEmpty()) {
      return buf;
    }
    final int errorLine = Math.min(pos.startLine, lines.size());
    final int first = Math.max(1, errorLine - contextLines);
    final int last = Math.min(lines.size(), errorLine + contextLines);
    for (int line = first; line <= last; line++) {
      final String text = lines.get(line - 1);
      buf.append(Strings.padStart(Integer.toString(line), 4, ' '))
          .append(" | ")
          .append(text)
          .append('\n');
      if (line == errorLine) {
        final int column = Math.min(pos.startColumn - 1, text.length());
        final int width = pos.startLine == pos.endLine
            ? Math.max(1, pos.endColumn - pos.startColumn)
            : Math.max(1, text.length() - column);
        buf.append("     | ")
            .append(Strings.repeat(" ", column))
            .append(Strings.repeat("^", width))
            .append('\n');
      }
    }
    return buf;
  }
}

// End Parsers.java
