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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Pos} and {@link Pos.Index}. */
public class PosTest {
  /** Source with a two-byte character, and a four-byte character that
   * occupies two chars. */
  private static final String SOURCE = "a\n\u00e9 b\n\uD83D\uDE00x";

  @Test void testLineAndColumn() {
    final Pos.Index index = new Pos.Index(SOURCE, "f.logo");
    final Pos pos = index.pos(2, 5);
    assertThat(pos.file, is("f.logo"));
    assertThat(pos.startLine, is(2));
    assertThat(pos.startColumn, is(1));
    assertThat(pos.endLine, is(2));
    assertThat(pos.endColumn, is(4));
    assertThat(pos.length(), is(3));

    // A span that ends at the start of a line ends on that line
    final Pos newline = index.pos(1, 2);
    assertThat(newline.startLine, is(1));
    assertThat(newline.startColumn, is(2));
    assertThat(newline.endLine, is(2));
    assertThat(newline.endColumn, is(1));

    final Pos end = index.pos(9, 9);
    assertThat(end.startLine, is(3));
    assertThat(end.startColumn, is(4));
  }

  @Test void testBytes() {
    final Pos.Index index = new Pos.Index(SOURCE, "");
    final Pos accented = index.pos(2, 5);
    assertThat(accented.byteStart, is(2));
    assertThat(accented.byteLength, is(4));

    final Pos emoji = index.pos(6, 9);
    assertThat(emoji.byteStart, is(7));
    assertThat(emoji.byteLength, is(5));

    final Pos whole = index.pos(0, SOURCE.length());
    assertThat(whole.byteLength, is(12));
  }

  @Test void testInvalidSpan() {
    final Pos.Index index = new Pos.Index(SOURCE, "");
    assertThrows(IllegalArgumentException.class, () -> index.pos(3, 2));
    assertThrows(IllegalArgumentException.class, () -> index.pos(0, 10));
  }
}

// End PosTest.java
