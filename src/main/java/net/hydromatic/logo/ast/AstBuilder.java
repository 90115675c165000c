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
import java.util.List;
import net.hydromatic.logo.eval.Value;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // literals

  public Ast.Literal literal(Pos pos, Value value) {
    return new Ast.Literal(pos, value);
  }

  public Ast.Literal numberLiteral(Pos pos, int n) {
    return literal(pos, Value.number(n));
  }

  public Ast.Literal stringLiteral(Pos pos, String s) {
    return literal(pos, Value.string(s));
  }

  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return literal(pos, Value.bool(b));
  }

  public Ast.Literal variable(Pos pos, String name) {
    return literal(pos, Value.variable(name));
  }

  // expressions

  public Ast.BinaryCall binaryCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.BinaryCall(pos, op, a0, a1);
  }

  public Ast.Query query(Pos pos, Op op) {
    return new Ast.Query(pos, op);
  }

  // commands

  public Ast.PenCommand penCommand(Pos pos, Op op) {
    return new Ast.PenCommand(pos, op);
  }

  /** Creates a command with one argument, such as "FORWARD 10". */
  public Ast.UnaryCommand unaryCommand(Pos pos, Op op, Ast.Exp arg) {
    return new Ast.UnaryCommand(pos, op, arg);
  }

  public Ast.Make make(Pos pos, Ast.Exp name, Ast.Exp value) {
    return new Ast.Make(pos, name, value);
  }

  public Ast.AddAssign addAssign(Pos pos, String target, boolean indirect,
      Ast.Exp amount) {
    return new Ast.AddAssign(pos, target, indirect, amount);
  }

  public Ast.If ifCommand(Pos pos, Ast.Exp condition,
      List<? extends Ast.Command> body) {
    return new Ast.If(pos, condition, ImmutableList.copyOf(body));
  }

  public Ast.While whileCommand(Pos pos, Ast.Exp condition,
      List<? extends Ast.Command> body) {
    return new Ast.While(pos, condition, ImmutableList.copyOf(body));
  }

  public Ast.ExpCommand expCommand(Pos pos, Ast.Exp exp) {
    return new Ast.ExpCommand(pos, exp);
  }

  public Ast.Param variableParam(Pos pos, String name) {
    return new Ast.Param(pos, Op.VARIABLE_PARAM, name);
  }

  public Ast.Param literalParam(Pos pos, String name) {
    return new Ast.Param(pos, Op.LITERAL_PARAM, name);
  }

  public Ast.To to(Pos pos, String name, List<Ast.Param> params,
      List<? extends Ast.Command> body) {
    return new Ast.To(pos, name, ImmutableList.copyOf(params),
        ImmutableList.copyOf(body));
  }

  public Ast.Call call(Pos pos, String name, List<? extends Ast.Exp> args) {
    return new Ast.Call(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.Program program(Pos pos, List<? extends Ast.Command> commands) {
    return new Ast.Program(pos, ImmutableList.copyOf(commands));
  }
}

// End AstBuilder.java
