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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.List;
import net.hydromatic.logo.util.LogoException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error raised while executing (and, for arity errors, while parsing) a Logo
 * program.
 *
 * <p>Kinds that carry data have a sub-class: {@link InvalidArgument}, {@link
 * UndefinedVariable}, {@link UnexpectedValue}.
 */
public class LogoRuntimeException extends RuntimeException
    implements LogoException {
  public final Kind kind;

  /** Creates a LogoRuntimeException. */
  protected LogoRuntimeException(
      Kind kind, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.kind = requireNonNull(kind);
  }

  /** Creates a LogoRuntimeException of a kind that carries no data. */
  public static LogoRuntimeException of(Kind kind) {
    return new LogoRuntimeException(kind, kind.message, null);
  }

  public static LogoRuntimeException stackUnderflow() {
    return of(Kind.STACK_UNDERFLOW);
  }

  public static LogoRuntimeException divisionByZero() {
    return of(Kind.DIVISION_BY_ZERO);
  }

  public static LogoRuntimeException typeMismatch() {
    return of(Kind.TYPE_MISMATCH);
  }

  public static LogoRuntimeException overflow() {
    return of(Kind.OVERFLOW);
  }

  public static LogoRuntimeException drawError(String message) {
    return new LogoRuntimeException(
        Kind.DRAW_ERROR, Kind.DRAW_ERROR.message + ": " + message, null);
  }

  public static LogoRuntimeException imageSaveError(
      String message, @Nullable Throwable cause) {
    return new LogoRuntimeException(
        Kind.IMAGE_SAVE_ERROR,
        Kind.IMAGE_SAVE_ERROR.message + ": " + message,
        cause);
  }

  public static LogoRuntimeException ioError(IOException e) {
    return new LogoRuntimeException(
        Kind.IO_ERROR, Kind.IO_ERROR.message + ": " + e.getMessage(), e);
  }

  public static InvalidArgument invalidArgument(
      String command, String argument, String expected) {
    return new InvalidArgument(command, argument, expected);
  }

  public static UndefinedVariable undefinedVariable(
      String name, List<String> definedNames) {
    return new UndefinedVariable(name, definedNames);
  }

  public static UnexpectedValue unexpectedValue(String expected, String got) {
    return new UnexpectedValue(expected, got);
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }

  /** Kinds of runtime error. */
  public enum Kind {
    INVALID_ARGUMENT("Invalid argument"),
    UNDEFINED_VARIABLE("Undefined variable"),
    STACK_UNDERFLOW("Stack underflow: attempted to pop from an empty stack"),
    DIVISION_BY_ZERO("Division by zero"),
    TYPE_MISMATCH("Type mismatch: operation not supported for given types"),
    OVERFLOW("Arithmetic overflow occurred"),
    UNEXPECTED_VALUE("Unexpected value"),
    DRAW_ERROR("Draw error"),
    IMAGE_SAVE_ERROR("Image save error"),
    IO_ERROR("IO error");

    public final String message;

    Kind(String message) {
      this.message = message;
    }
  }

  /**
   * Wrong number of arguments, an argument out of range, or a call to a
   * procedure that does not exist.
   */
  public static class InvalidArgument extends LogoRuntimeException {
    public final String command;
    public final String argument;
    public final String expected;

    InvalidArgument(String command, String argument, String expected) {
      super(
          Kind.INVALID_ARGUMENT,
          "Invalid argument for command '"
              + command
              + "': got '"
              + argument
              + "', expected "
              + expected,
          null);
      this.command = requireNonNull(command);
      this.argument = requireNonNull(argument);
      this.expected = requireNonNull(expected);
    }
  }

  /** Reference to a variable that has not been assigned. */
  public static class UndefinedVariable extends LogoRuntimeException {
    public final String name;
    public final List<String> definedNames;

    UndefinedVariable(String name, List<String> definedNames) {
      super(
          Kind.UNDEFINED_VARIABLE,
          "Undefined variable '" + name + "'. Defined variables are: "
              + definedNames,
          null);
      this.name = requireNonNull(name);
      this.definedNames = ImmutableList.copyOf(definedNames);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append("Error: Undefined variable '").append(name).append("'\n");
      if (definedNames.isEmpty()) {
        buf.append("No variables have been defined yet.\n");
      } else {
        buf.append("Currently defined variables are:\n");
        definedNames.forEach(n -> buf.append("  - ").append(n).append('\n'));
      }
      return buf.append(
          "Make sure to define variables using the MAKE command "
              + "before using them.");
    }
  }

  /** A value of the wrong shape, such as a non-numeric string. */
  public static class UnexpectedValue extends LogoRuntimeException {
    public final String expected;
    public final String got;

    UnexpectedValue(String expected, String got) {
      super(
          Kind.UNEXPECTED_VALUE,
          "Unexpected value: expected " + expected + ", but got " + got,
          null);
      this.expected = requireNonNull(expected);
      this.got = requireNonNull(got);
    }
  }
}

// End LogoRuntimeException.java
