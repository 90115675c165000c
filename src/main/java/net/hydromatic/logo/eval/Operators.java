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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Locale;
import net.hydromatic.logo.ast.Op;

/** Implementations of the binary operators. */
public abstract class Operators {
  private Operators() {}

  /**
   * Pops two operands from the stack, applies an operator, and pushes and
   * returns the result.
   *
   * <p>The right operand is on top of the stack, so it is popped first.
   */
  public static Value apply(Op op, OperandStack stack) {
    checkArgument(op.category == Op.Category.OPERATOR, "not operator: %s",
        op);
    final Value right = stack.pop();
    final Value left = stack.pop();
    final Value result = apply(op, left, right);
    stack.push(result);
    return result;
  }

  /** Applies an operator to two values. */
  public static Value apply(Op op, Value left, Value right) {
    switch (op) {
      case PLUS:
        try {
          return Value.number(
              Math.addExact(Values.toInt(left), Values.toInt(right)));
        } catch (ArithmeticException e) {
          throw LogoRuntimeException.overflow();
        }
      case MINUS:
        try {
          return Value.number(
              Math.subtractExact(Values.toInt(left), Values.toInt(right)));
        } catch (ArithmeticException e) {
          throw LogoRuntimeException.overflow();
        }
      case TIMES:
        try {
          return Value.number(
              Math.multiplyExact(Values.toInt(left), Values.toInt(right)));
        } catch (ArithmeticException e) {
          throw LogoRuntimeException.overflow();
        }
      case DIVIDE:
        return divide(Values.toInt(left), Values.toInt(right));
      case EQ:
        return Value.bool(equal(left, right));
      case NE:
        return Value.bool(Values.toInt(left) != Values.toInt(right));
      case GT:
        return Value.bool(Values.toInt(left) > Values.toInt(right));
      case LT:
        return Value.bool(Values.toInt(left) < Values.toInt(right));
      case AND:
        return Value.bool(Values.toBool(left) & Values.toBool(right));
      case OR:
        return Value.bool(Values.toBool(left) | Values.toBool(right));
      default:
        throw new AssertionError("unknown operator " + op);
    }
  }

  /** Truncating integer division. */
  private static Value divide(int left, int right) {
    if (right == 0) {
      throw LogoRuntimeException.divisionByZero();
    }
    if (left == Integer.MIN_VALUE && right == -1) {
      throw LogoRuntimeException.overflow();
    }
    return Value.number(left / right);
  }

  /**
   * Compares two values for equality.
   *
   * <p>Strings compare case-insensitively. A number and a string are equal if
   * the string parses to the same number; if it does not parse, the
   * comparison is a type mismatch, as is any other combination of kinds.
   */
  static boolean equal(Value left, Value right) {
    if (left.kind == Value.Kind.NUMBER && right.kind == Value.Kind.NUMBER) {
      return ((Value.NumberValue) left).value
          == ((Value.NumberValue) right).value;
    }
    if (left.kind == Value.Kind.STRING && right.kind == Value.Kind.STRING) {
      return upper(left).equals(upper(right));
    }
    if (left.kind == Value.Kind.BOOLEAN && right.kind == Value.Kind.BOOLEAN) {
      return ((Value.BooleanValue) left).value
          == ((Value.BooleanValue) right).value;
    }
    if (left.kind == Value.Kind.NUMBER && right.kind == Value.Kind.STRING) {
      return numberEqualsString(left, right);
    }
    if (left.kind == Value.Kind.STRING && right.kind == Value.Kind.NUMBER) {
      return numberEqualsString(right, left);
    }
    throw LogoRuntimeException.typeMismatch();
  }

  private static boolean numberEqualsString(Value number, Value string) {
    final Integer n = Values.parseInt(((Value.StringValue) string).value);
    if (n == null) {
      throw LogoRuntimeException.typeMismatch();
    }
    return ((Value.NumberValue) number).value == n;
  }

  private static String upper(Value value) {
    return ((Value.StringValue) value).value.toUpperCase(Locale.ROOT);
  }
}

// End Operators.java
