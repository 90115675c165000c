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

import static java.util.Objects.requireNonNull;

import net.hydromatic.logo.ast.Pos;
import net.hydromatic.logo.util.LogoException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Exception caused by a parse error. */
public class LogoParseException extends RuntimeException
    implements LogoException {
  private final String source;
  private final Pos pos;
  private final @Nullable String hint;

  LogoParseException(String message, String source, Pos pos,
      @Nullable String hint) {
    super(message);
    this.source = requireNonNull(source);
    this.pos = requireNonNull(pos);
    this.hint = hint;
  }

  /** Returns the source text in which the error occurred. */
  public String source() {
    return source;
  }

  /** Returns the span of the error. */
  public Pos pos() {
    return pos;
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(getMessage()).append('\n');
    if (!source.isEmpty()) {
      buf.append("\nRelevant code:\n");
      Parsers.appendSourceContext(buf, source, pos, 2);
    }
    if (hint != null) {
      buf.append("Hint: ").append(hint);
    }
    return buf;
  }
}

// End LogoParseException.java
