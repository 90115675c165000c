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
import static net.hydromatic.logo.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.logo.ast.Ast;
import net.hydromatic.logo.ast.Op;
import net.hydromatic.logo.ast.Pos;
import net.hydromatic.logo.eval.LogoRuntimeException;
import net.hydromatic.logo.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for Logo programs.
 *
 * <p>Each production method either consumes input and returns a node, or
 * returns null and leaves the cursor where it was. Once a production has
 * matched its leading keyword it is committed, and a failure after that
 * point throws {@link LogoParseException}.
 *
 * <p>Commands are tried in a fixed order: {@code TO}, the fixed-arity
 * commands, {@code MAKE}, {@code ADDASSIGN}, {@code IF}, {@code WHILE}, a
 * bare expression, and finally a procedure call. Procedure-call syntax
 * accepts almost any word, so it must come last.
 */
public class LogoParser {
  private static final String END = "END";

  private static final String END_HINT =
      "'END' commands must be paired with a 'TO' procedure definition:\n"
          + "     | TO procedure_name\n"
          + "     |    commands...\n"
          + "     | END\n";

  private final String source;
  private final Pos.Index index;
  /** Offset of the next character to be read. */
  private int i;

  /** Creates a parser. */
  public LogoParser(String source, String file) {
    this.source = requireNonNull(source);
    this.index = new Pos.Index(source, file);
  }

  /** Parses a program. */
  public static Ast.Program parse(String source) {
    return new LogoParser(source, "").program();
  }

  /** Parses the whole source as a program. */
  public Ast.Program program() {
    i = 0;
    final List<Ast.Command> commands = new ArrayList<>();
    for (;;) {
      skipWhitespace();
      if (atEnd()) {
        break;
      }
      final int start = i;
      final Ast.Command command = command();
      if (command == null) {
        throw error(start, "Parse error: expected a command");
      }
      commands.add(command);
    }
    return ast.program(pos(0, source.length()), commands);
  }

  /** Parses a command that may appear at the top level or in a block. */
  private Ast.@Nullable Command command() {
    if (lookingAtKeyword(END)) {
      final int line = Parsers.lineOf(source, i);
      throw new LogoParseException("Found 'END' command on line " + line
          + " without matching 'TO' procedure definition. Each 'END' must be"
          + " paired with a 'TO' procedure definition.",
          source, pos(i, i + END.length()), END_HINT);
    }
    final Ast.To to = to();
    if (to != null) {
      return to;
    }
    return regularCommand();
  }

  /** Parses any command except a procedure definition. */
  private Ast.@Nullable Command regularCommand() {
    for (Op op : Op.FIXED_ARITY_COMMANDS) {
      final Ast.Command command = fixedArityCommand(op);
      if (command != null) {
        return command;
      }
    }
    Ast.Command command = make();
    if (command == null) {
      command = addAssign();
    }
    if (command == null) {
      command = ifOrWhile(Op.IF);
    }
    if (command == null) {
      command = ifOrWhile(Op.WHILE);
    }
    if (command == null) {
      final int start = i;
      final Ast.Exp exp = expression();
      if (exp != null) {
        command = ast.expCommand(pos(start, i), exp);
      }
    }
    if (command == null) {
      command = call();
    }
    return command;
  }

  private Ast.@Nullable Command fixedArityCommand(Op op) {
    final int start = i;
    final String keyword = requireNonNull(op.keyword);
    if (!keyword(keyword)) {
      return null;
    }
    if (op.arity == 0) {
      checkNoExtraArgument(keyword, "no arguments");
      return ast.penCommand(pos(start, i), op);
    }
    requireWhitespace(keyword);
    final Ast.Exp arg = requireExpression(keyword);
    checkNoExtraArgument(keyword, "only one argument");
    return ast.unaryCommand(pos(start, arg.pos.endOffset), op, arg);
  }

  private Ast.@Nullable Command make() {
    final int start = i;
    if (!keyword("MAKE")) {
      return null;
    }
    requireWhitespace("MAKE");
    final Ast.Exp name = requireExpression("MAKE");
    requireWhitespace("MAKE");
    final Ast.Exp value = requireExpression("MAKE");
    return ast.make(pos(start, i), name, value);
  }

  private Ast.@Nullable Command addAssign() {
    final int start = i;
    final String keyword = requireNonNull(Op.ADD_ASSIGN.keyword);
    if (!keyword(keyword)) {
      return null;
    }
    requireWhitespace(keyword);
    final char prefix = atEnd() ? ' ' : source.charAt(i);
    if (prefix != '"' && prefix != ':') {
      throw error(i, "Expected '\"' or ':' followed by a variable name after "
          + keyword);
    }
    ++i;
    final String target = identifier();
    if (target == null) {
      throw error(i, "Expected a variable name after " + keyword);
    }
    requireWhitespace(keyword);
    final Ast.Exp amount = requireExpression(keyword);
    checkNoExtraArgument(keyword, "only two arguments");
    return ast.addAssign(pos(start, i), target, prefix == ':', amount);
  }

  private Ast.@Nullable Command ifOrWhile(Op op) {
    final int start = i;
    final String keyword = requireNonNull(op.keyword);
    if (!keyword(keyword)) {
      return null;
    }
    requireWhitespace(keyword);
    final Ast.Exp condition = requireExpression(keyword);
    skipWhitespace();
    final List<Ast.Command> body = block(keyword);
    return op == Op.IF
        ? ast.ifCommand(pos(start, i), condition, body)
        : ast.whileCommand(pos(start, i), condition, body);
  }

  /** Parses "[ command... ]". */
  private List<Ast.Command> block(String keyword) {
    if (atEnd() || source.charAt(i) != '[') {
      throw error(i, "Expected '[' after " + keyword + " condition");
    }
    ++i;
    final List<Ast.Command> commands = new ArrayList<>();
    for (;;) {
      skipWhitespace();
      if (atEnd()) {
        throw error(i, "Expected ']' to close " + keyword + " block");
      }
      if (source.charAt(i) == ']') {
        ++i;
        return commands;
      }
      final Ast.Command command = command();
      if (command == null) {
        throw error(i, "Expected command or ']'");
      }
      commands.add(command);
    }
  }

  /**
   * Parses "TO name params... commands... END".
   *
   * <p>The body may not contain another definition. Commands in brackets,
   * as in "TO f :n [ FORWARD :n ] END", become part of the body.
   *
   * <p>If a body command cannot be parsed, or the input ends before "END",
   * the error names the procedure and counts the commands parsed so far.
   */
  private Ast.@Nullable To to() {
    final int start = i;
    final String keyword = requireNonNull(Op.TO.keyword);
    if (!keyword(keyword)) {
      return null;
    }
    requireWhitespace(keyword);
    final String name = identifier();
    if (name == null) {
      throw error(i, "Expected procedure name after " + keyword);
    }
    final List<Ast.Param> params = new ArrayList<>();
    for (;;) {
      final Ast.Param param = param();
      if (param == null) {
        break;
      }
      params.add(param);
    }
    skipWhitespace();
    final int bodyStart = i;
    final List<Ast.Command> body = new ArrayList<>();
    for (;;) {
      skipWhitespace();
      if (keyword(END)) {
        return ast.to(pos(start, i), name, params, body);
      }
      final Ast.Command command;
      try {
        if (!atEnd() && source.charAt(i) == '[') {
          // A bracketed group; its commands become part of the body.
          body.addAll(block(keyword));
          continue;
        }
        command = atEnd() ? null : regularCommand();
      } catch (LogoParseException e) {
        throw unterminated(name, body.size(), bodyStart, e);
      }
      if (command == null) {
        throw unterminated(name, body.size(), bodyStart, null);
      }
      body.add(command);
    }
  }

  /** Creates the error for a definition whose body is not followed by
   * "END", either because the input ran out or because a body command
   * could not be parsed. */
  private LogoParseException unterminated(String name, int commandCount,
      int bodyStart, @Nullable LogoParseException cause) {
    final LogoParseException e =
        new LogoParseException("Unterminated procedure definition '" + name
            + "': Expected 'END' keyword after " + commandCount + " commands",
            source, pos(bodyStart, source.length()), null);
    if (cause != null) {
      e.initCause(cause);
    }
    return e;
  }

  /** Parses a formal parameter, {@code :x} or {@code "x}, after optional
   * whitespace. */
  private Ast.@Nullable Param param() {
    final int mark = i;
    skipWhitespace();
    final int start = i;
    if (!atEnd()) {
      final char c = source.charAt(i);
      if (c == ':' || c == '"') {
        ++i;
        final String name = identifier();
        if (name != null) {
          return c == ':'
              ? ast.variableParam(pos(start, i), name)
              : ast.literalParam(pos(start, i), name);
        }
      }
    }
    i = mark;
    return null;
  }

  /** Parses a procedure call, "name arg...". */
  private Ast.@Nullable Command call() {
    final int start = i;
    final String name = identifier();
    if (name == null) {
      return null;
    }
    if (name.equals(Op.TO.keyword) || name.equals(END)) {
      i = start;
      return null;
    }
    final List<Ast.Exp> args = new ArrayList<>();
    for (;;) {
      final int mark = i;
      if (!skipWhitespace()) {
        break;
      }
      final Ast.Exp arg = expression();
      if (arg == null) {
        i = mark;
        break;
      }
      args.add(arg);
    }
    return ast.call(pos(start, i), name, args);
  }

  // expressions

  /** Parses an expression: a value, an operator call, or a query. */
  private Ast.@Nullable Exp expression() {
    final Ast.Exp value = value();
    if (value != null) {
      return value;
    }
    final Ast.Exp call = binaryCall();
    if (call != null) {
      return call;
    }
    return query();
  }

  private Ast.@Nullable Exp value() {
    if (atEnd()) {
      return null;
    }
    final int start = i;
    final char c = source.charAt(i);
    if (c == '"') {
      int j = i + 1;
      while (j < source.length() && Parsers.isWordChar(source.charAt(j))) {
        ++j;
      }
      if (j > i + 1) {
        i = j;
        return ast.stringLiteral(pos(start, i),
            source.substring(start + 1, i));
      }
      return null;
    }
    if (c == '-' || Parsers.isDigit(c)) {
      int j = c == '-' ? i + 1 : i;
      final int digitStart = j;
      while (j < source.length() && Parsers.isDigit(source.charAt(j))) {
        ++j;
      }
      if (j == digitStart) {
        return null;
      }
      final String text = source.substring(start, j);
      final Integer n = Values.parseInt(text);
      if (n == null) {
        throw error(start, j,
            "Integer literal out of range: " + text);
      }
      i = j;
      return ast.numberLiteral(pos(start, i), n);
    }
    if (c == ':') {
      ++i;
      final String name = identifier();
      if (name == null) {
        i = start;
        return null;
      }
      return ast.variable(pos(start, i), name);
    }
    if (keyword("TRUE")) {
      return ast.boolLiteral(pos(start, i), true);
    }
    if (keyword("FALSE")) {
      return ast.boolLiteral(pos(start, i), false);
    }
    return null;
  }

  /** Parses a prefix operator followed by two operands, such as "+ 1 2". */
  private Ast.@Nullable Exp binaryCall() {
    final int start = i;
    for (Op op : Op.OPERATORS.values()) {
      final String keyword = requireNonNull(op.keyword);
      if (!source.startsWith(keyword, i)) {
        continue;
      }
      i += keyword.length();
      if (skipWhitespace()) {
        final Ast.Exp a0 = expression();
        if (a0 != null && skipWhitespace()) {
          final Ast.Exp a1 = expression();
          if (a1 != null) {
            return ast.binaryCall(pos(start, i), op, a0, a1);
          }
        }
      }
      i = start;
    }
    return null;
  }

  private Ast.@Nullable Exp query() {
    final int start = i;
    for (Op op : Op.QUERIES.values()) {
      if (keyword(requireNonNull(op.keyword))) {
        return ast.query(pos(start, i), op);
      }
    }
    return null;
  }

  // helpers

  private Ast.Exp requireExpression(String keyword) {
    final Ast.Exp exp = expression();
    if (exp == null) {
      throw error(i, "Expected expression after " + keyword);
    }
    return exp;
  }

  private void requireWhitespace(String keyword) {
    if (!skipWhitespace()) {
      throw error(i, "Expected whitespace after " + keyword);
    }
  }

  /** Throws if whitespace followed by an expression comes next; otherwise
   * leaves the cursor where it was. */
  private void checkNoExtraArgument(String command, String expected) {
    final int mark = i;
    if (skipWhitespace() && expression() != null) {
      throw LogoRuntimeException.invalidArgument(command, "", expected);
    }
    i = mark;
  }

  /** Consumes a keyword if it occurs at the cursor and is not immediately
   * followed by an identifier character. */
  private boolean keyword(String keyword) {
    if (lookingAtKeyword(keyword)) {
      i += keyword.length();
      return true;
    }
    return false;
  }

  private boolean lookingAtKeyword(String keyword) {
    if (!source.startsWith(keyword, i)) {
      return false;
    }
    final int end = i + keyword.length();
    return end == source.length()
        || !Parsers.isIdentifierChar(source.charAt(end));
  }

  /** Consumes an identifier, or returns null. */
  private @Nullable String identifier() {
    final int start = i;
    while (i < source.length() && Parsers.isIdentifierChar(source.charAt(i))) {
      ++i;
    }
    return i > start ? source.substring(start, i) : null;
  }

  /** Skips whitespace and comments; returns whether anything was skipped. */
  private boolean skipWhitespace() {
    final int start = i;
    while (i < source.length()) {
      final char c = source.charAt(i);
      if (Character.isWhitespace(c)) {
        ++i;
      } else if (source.startsWith("//", i)) {
        while (i < source.length() && source.charAt(i) != '\n') {
          ++i;
        }
      } else {
        break;
      }
    }
    return i > start;
  }

  private boolean atEnd() {
    return i >= source.length();
  }

  private Pos pos(int start, int end) {
    return index.pos(start, end);
  }

  private LogoParseException error(int start, String message) {
    return error(start, Math.min(start + 1, source.length()), message);
  }

  private LogoParseException error(int start, int end, String message) {
    return new LogoParseException(message, source, pos(start, end), null);
  }
}

// End LogoParser.java
