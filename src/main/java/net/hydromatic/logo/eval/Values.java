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
package net.hydromatic.logo.eval;

import com.google.common.base.CharMatcher;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Coercion rules between the kinds of {@link Value}.
 *
 * <p>All functions are pure. None of them can resolve a {@link
 * Value.VariableRef}; that requires an environment, so a reference that
 * reaches one of these functions is a {@link
 * LogoRuntimeException.Kind#TYPE_MISMATCH}.
 */
public abstract class Values {
  private static final CharMatcher ASCII_DIGIT = CharMatcher.inRange('0', '9');

  private Values() {}

  /**
   * Parses a base-10 signed 32-bit integer, or returns null.
   *
   * <p>A leading sign is allowed; surrounding whitespace is not.
   */
  public static @Nullable Integer parseInt(String s) {
    final int signLength = s.startsWith("-") || s.startsWith("+") ? 1 : 0;
    if (s.length() == signLength
        || !ASCII_DIGIT.matchesAllOf(s.substring(signLength))) {
      return null;
    }
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Returns the boolean that a word denotes, or null.
   *
   * <p>{@code TRUE} and {@code FALSE} are recognized regardless of case.
   */
  public static Value.@Nullable BooleanValue booleanWord(String s) {
    switch (s.toUpperCase(Locale.ROOT)) {
      case "TRUE":
        return Value.TRUE;
      case "FALSE":
        return Value.FALSE;
      default:
        return null;
    }
  }

  /** Converts a value to an integer. */
  public static int toInt(Value value) {
    switch (value.kind) {
      case NUMBER:
        return ((Value.NumberValue) value).value;
      case STRING:
        final String s = ((Value.StringValue) value).value;
        final Integer i = parseInt(s);
        if (i == null) {
          throw LogoRuntimeException.unexpectedValue("a number", s);
        }
        return i;
      case BOOLEAN:
        return ((Value.BooleanValue) value).value ? 1 : 0;
      case VARIABLE:
      default:
        throw LogoRuntimeException.typeMismatch();
    }
  }

  /**
   * Converts a value to a boolean.
   *
   * <p>A string is true only if it is the word {@code TRUE}; every other
   * string, {@code FALSE} included, is false.
   */
  public static boolean toBool(Value value) {
    switch (value.kind) {
      case BOOLEAN:
        return ((Value.BooleanValue) value).value;
      case STRING:
        return ((Value.StringValue) value)
            .value
            .toUpperCase(Locale.ROOT)
            .equals("TRUE");
      case NUMBER:
        return ((Value.NumberValue) value).value != 0;
      case VARIABLE:
      default:
        throw LogoRuntimeException.typeMismatch();
    }
  }

  /** Converts a value to a string. Booleans become "true" and "false". */
  public static String toStr(Value value) {
    switch (value.kind) {
      case STRING:
        return ((Value.StringValue) value).value;
      case NUMBER:
        return Integer.toString(((Value.NumberValue) value).value);
      case BOOLEAN:
        return Boolean.toString(((Value.BooleanValue) value).value);
      case VARIABLE:
      default:
        throw LogoRuntimeException.typeMismatch();
    }
  }

  /**
   * Normalizes a value before it is stored in a variable.
   *
   * <p>A string that is the word {@code TRUE} or {@code FALSE} (in any case)
   * becomes a boolean; a string that is an integer becomes a number; any other
   * value is returned unchanged.
   */
  public static Value normalize(Value value) {
    if (value.kind != Value.Kind.STRING) {
      return value;
    }
    final String s = ((Value.StringValue) value).value;
    final Value.BooleanValue b = booleanWord(s);
    if (b != null) {
      return b;
    }
    final Integer i = parseInt(s);
    return i != null ? Value.number(i) : value;
  }
}

// End Values.java
