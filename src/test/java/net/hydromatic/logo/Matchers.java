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
package net.hydromatic.logo;

import net.hydromatic.logo.ast.AstNode;
import net.hydromatic.logo.eval.LogoRuntimeException;
import net.hydromatic.logo.eval.Value;
import net.hydromatic.logo.parse.LogoParseException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Logo tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its string representation. */
  public static <T extends AstNode> Matcher<T> isAst(Class<? extends T> clazz,
      String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override protected boolean matchesSafely(T t) {
        return clazz.isInstance(t) && t.toString().equals(expected);
      }
    };
  }

  /** Matches a number value. */
  public static Matcher<Value> isNumber(int n) {
    return isValue(Value.number(n));
  }

  /** Matches a string value. */
  public static Matcher<Value> isString(String s) {
    return isValue(Value.string(s));
  }

  /** Matches a boolean value. */
  public static Matcher<Value> isBool(boolean b) {
    return isValue(Value.bool(b));
  }

  private static Matcher<Value> isValue(Value expected) {
    return new CustomTypeSafeMatcher<Value>(expected.describe()) {
      @Override protected boolean matchesSafely(Value value) {
        return value.equals(expected);
      }
    };
  }

  static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /** Matches a runtime error of a given kind. */
  public static Matcher<Throwable> throwsKind(LogoRuntimeException.Kind kind) {
    return new CustomTypeSafeMatcher<Throwable>("runtime error " + kind) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item instanceof LogoRuntimeException
            && ((LogoRuntimeException) item).kind == kind;
      }
    };
  }

  /** Matches an {@link LogoRuntimeException.InvalidArgument} error. */
  public static Matcher<Throwable> throwsInvalidArgument(String command,
      String argument, String expected) {
    return new CustomTypeSafeMatcher<Throwable>("invalid argument for "
        + command + ": got '" + argument + "', expected " + expected) {
      @Override protected boolean matchesSafely(Throwable item) {
        if (!(item instanceof LogoRuntimeException.InvalidArgument)) {
          return false;
        }
        final LogoRuntimeException.InvalidArgument e =
            (LogoRuntimeException.InvalidArgument) item;
        return e.command.equals(command)
            && e.argument.equals(argument)
            && e.expected.equals(expected);
      }
    };
  }

  /** Matches an {@link LogoRuntimeException.UndefinedVariable} error. */
  public static Matcher<Throwable> throwsUndefinedVariable(String name) {
    return new CustomTypeSafeMatcher<Throwable>("undefined variable "
        + name) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item instanceof LogoRuntimeException.UndefinedVariable
            && ((LogoRuntimeException.UndefinedVariable) item).name
                .equals(name);
      }
    };
  }

  /** Matches a parse error whose message contains a given string. */
  public static Matcher<Throwable> throwsParseException(String message) {
    return new CustomTypeSafeMatcher<Throwable>("parse error containing "
        + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item instanceof LogoParseException
            && item.getMessage().contains(message);
      }
    };
  }
}

// End Matchers.java
