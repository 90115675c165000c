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

/**
 * Runtime value.
 *
 * <p>There are exactly four kinds of value, each with its own sub-class:
 * {@link NumberValue} (a 32-bit signed integer), {@link StringValue}, {@link
 * VariableRef} (a reference to a variable, written {@code :name}) and {@link
 * BooleanValue}.
 *
 * <p>A {@code VariableRef} occurs only in the syntax tree; the evaluator
 * resolves it through the environment before any operator or command sees it.
 *
 * @see Values
 */
public abstract class Value {
  public static final BooleanValue TRUE = new BooleanValue(true);
  public static final BooleanValue FALSE = new BooleanValue(false);

  public final Kind kind;

  private Value(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  public static NumberValue number(int n) {
    return new NumberValue(n);
  }

  public static StringValue string(String s) {
    return new StringValue(s);
  }

  public static VariableRef variable(String name) {
    return new VariableRef(name);
  }

  public static BooleanValue bool(boolean b) {
    return b ? TRUE : FALSE;
  }

  /**
   * Returns a description of this value for use in error messages, for
   * example {@code Number(5)} or {@code String("abc")}.
   */
  public abstract String describe();

  /** Returns this value as it would be written in a program. */
  @Override public abstract String toString();

  /** Kind of value. */
  public enum Kind {
    NUMBER,
    STRING,
    VARIABLE,
    BOOLEAN
  }

  /** Integer value. */
  public static final class NumberValue extends Value {
    public final int value;

    NumberValue(int value) {
      super(Kind.NUMBER);
      this.value = value;
    }

    @Override public int hashCode() {
      return Integer.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NumberValue && value == ((NumberValue) o).value;
    }

    @Override public String describe() {
      return "Number(" + value + ")";
    }

    @Override public String toString() {
      return Integer.toString(value);
    }
  }

  /** String value; a word, in Logo parlance. */
  public static final class StringValue extends Value {
    public final String value;

    StringValue(String value) {
      super(Kind.STRING);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof StringValue && value.equals(((StringValue) o).value);
    }

    @Override public String describe() {
      return "String(\"" + value + "\")";
    }

    @Override public String toString() {
      return value;
    }
  }

  /** Reference to a variable, such as {@code :x}. */
  public static final class VariableRef extends Value {
    public final String name;

    VariableRef(String name) {
      super(Kind.VARIABLE);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode() * 31 + 1;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VariableRef && name.equals(((VariableRef) o).name);
    }

    @Override public String describe() {
      return "Variable(\"" + name + "\")";
    }

    @Override public String toString() {
      return ":" + name;
    }
  }

  /** Boolean value. Use {@link #TRUE} and {@link #FALSE}. */
  public static final class BooleanValue extends Value {
    public final boolean value;

    private BooleanValue(boolean value) {
      super(Kind.BOOLEAN);
      this.value = value;
    }

    @Override public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof BooleanValue && value == ((BooleanValue) o).value;
    }

    @Override public String describe() {
      return "Boolean(" + value + ")";
    }

    @Override public String toString() {
      return value ? "TRUE" : "FALSE";
    }
  }
}

// End Value.java
