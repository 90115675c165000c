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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // literals
  NUMBER_LITERAL(Category.LITERAL),
  STRING_LITERAL(Category.LITERAL),
  BOOL_LITERAL(Category.LITERAL),
  VARIABLE(Category.LITERAL),

  // binary operators, written prefix ("+ 1 2")
  PLUS(Category.OPERATOR, "+"),
  MINUS(Category.OPERATOR, "-"),
  TIMES(Category.OPERATOR, "*"),
  DIVIDE(Category.OPERATOR, "/"),
  EQ(Category.OPERATOR, "EQ"),
  NE(Category.OPERATOR, "NE"),
  GT(Category.OPERATOR, "GT"),
  LT(Category.OPERATOR, "LT"),
  AND(Category.OPERATOR, "AND"),
  OR(Category.OPERATOR, "OR"),

  // queries of turtle state
  XCOR(Category.QUERY, "XCOR"),
  YCOR(Category.QUERY, "YCOR"),
  HEADING(Category.QUERY, "HEADING"),
  COLOR(Category.QUERY, "COLOR"),

  // commands with a fixed number of arguments
  PENUP(Category.COMMAND, "PENUP", 0),
  PENDOWN(Category.COMMAND, "PENDOWN", 0),
  FORWARD(Category.COMMAND, "FORWARD", 1),
  BACK(Category.COMMAND, "BACK", 1),
  LEFT(Category.COMMAND, "LEFT", 1),
  RIGHT(Category.COMMAND, "RIGHT", 1),
  SETPENCOLOR(Category.COMMAND, "SETPENCOLOR", 1),
  TURN(Category.COMMAND, "TURN", 1),
  SETHEADING(Category.COMMAND, "SETHEADING", 1),
  SETX(Category.COMMAND, "SETX", 1),
  SETY(Category.COMMAND, "SETY", 1),

  // other commands
  MAKE(Category.COMMAND, "MAKE"),
  ADD_ASSIGN(Category.COMMAND, "ADDASSIGN"),
  IF(Category.COMMAND, "IF"),
  WHILE(Category.COMMAND, "WHILE"),
  EXP_COMMAND(Category.COMMAND),
  TO(Category.COMMAND, "TO"),
  CALL(Category.COMMAND),

  // miscellaneous
  VARIABLE_PARAM(Category.OTHER),
  LITERAL_PARAM(Category.OTHER),
  PROGRAM(Category.OTHER);

  /** Keyword that introduces this construct, e.g. "FORWARD"; or null. */
  public final @Nullable String keyword;
  public final Category category;
  /** Number of arguments of a fixed-arity command, otherwise -1. */
  public final int arity;

  /** Operators, keyed by keyword. */
  public static final ImmutableMap<String, Op> OPERATORS;

  /** Queries, keyed by keyword. */
  public static final ImmutableMap<String, Op> QUERIES;

  /**
   * Fixed-arity commands, in the order that the parser tries them.
   *
   * <p>{@code PENUP} and {@code PENDOWN} take no arguments, the others take
   * one.
   */
  public static final ImmutableList<Op> FIXED_ARITY_COMMANDS;

  static {
    final ImmutableMap.Builder<String, Op> operators = ImmutableMap.builder();
    final ImmutableMap.Builder<String, Op> queries = ImmutableMap.builder();
    final ImmutableList.Builder<Op> commands = ImmutableList.builder();
    for (Op op : values()) {
      switch (op.category) {
        case OPERATOR:
          operators.put(op.keyword, op);
          break;
        case QUERY:
          queries.put(op.keyword, op);
          break;
        case COMMAND:
          if (op.arity >= 0) {
            commands.add(op);
          }
          break;
        default:
          break;
      }
    }
    OPERATORS = operators.build();
    QUERIES = queries.build();
    FIXED_ARITY_COMMANDS = commands.build();
  }

  Op(Category category) {
    this(category, null, -1);
  }

  Op(Category category, String keyword) {
    this(category, keyword, -1);
  }

  Op(Category category, @Nullable String keyword, int arity) {
    this.category = category;
    this.keyword = keyword;
    this.arity = arity;
  }

  /** Category of an {@link Op}. */
  public enum Category {
    LITERAL,
    OPERATOR,
    QUERY,
    COMMAND,
    OTHER
  }
}

// End Op.java
