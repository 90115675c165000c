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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.logo.eval.Value;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Parse tree node of a literal: a number, word, boolean or variable. */
  public static class Literal extends Exp {
    public final Value value;

    /** Creates a Literal. */
    Literal(Pos pos, Value value) {
      super(pos, opFor(value));
      this.value = requireNonNull(value);
    }

    private static Op opFor(Value value) {
      switch (value.kind) {
        case NUMBER:
          return Op.NUMBER_LITERAL;
        case STRING:
          return Op.STRING_LITERAL;
        case BOOLEAN:
          return Op.BOOL_LITERAL;
        case VARIABLE:
          return Op.VARIABLE;
        default:
          throw new AssertionError("unknown kind " + value.kind);
      }
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.value.equals(((Literal) o).value);
    }

    @Override AstWriter unparse(AstWriter w) {
      return op == Op.STRING_LITERAL
          ? w.append("\"").append(value.toString())
          : w.append(value.toString());
    }
  }

  /** Call to a binary operator, written prefix; for example "+ :x 1". */
  public static class BinaryCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    BinaryCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      checkArgument(op.category == Op.Category.OPERATOR, "not operator: %s",
          op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.prefix(op.keyword, a0, a1);
    }
  }

  /** Query of the turtle's state, such as "XCOR". */
  public static class Query extends Exp {
    Query(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op.category == Op.Category.QUERY, "not query: %s", op);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword);
    }
  }

  /** Base class for commands. */
  public abstract static class Command extends AstNode {
    Command(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** "PENUP" or "PENDOWN". */
  public static class PenCommand extends Command {
    PenCommand(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op == Op.PENUP || op == Op.PENDOWN);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword);
    }
  }

  /** Command that has exactly one argument, such as "FORWARD 10". */
  public static class UnaryCommand extends Command {
    public final Exp arg;

    UnaryCommand(Pos pos, Op op, Exp arg) {
      super(pos, op);
      checkArgument(op.arity == 1, "not unary: %s", op);
      this.arg = requireNonNull(arg);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.prefix(op.keyword, arg);
    }
  }

  /** "MAKE" command, which assigns a variable. */
  public static class Make extends Command {
    public final Exp name;
    public final Exp value;

    Make(Pos pos, Exp name, Exp value) {
      super(pos, Op.MAKE);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.prefix(op.keyword, name, value);
    }
  }

  /**
   * "ADDASSIGN" command, which adds to a variable.
   *
   * <p>The target is written either {@code "name} or {@code :name}; in the
   * latter case, {@link #indirect} is true and the variable {@code name}
   * holds the name of the variable to add to.
   */
  public static class AddAssign extends Command {
    public final String target;
    public final boolean indirect;
    public final Exp amount;

    AddAssign(Pos pos, String target, boolean indirect, Exp amount) {
      super(pos, Op.ADD_ASSIGN);
      this.target = requireNonNull(target);
      this.indirect = indirect;
      this.amount = requireNonNull(amount);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword)
          .append(indirect ? " :" : " \"")
          .append(target)
          .append(" ")
          .append(amount);
    }
  }

  /** "IF" command. */
  public static class If extends Command {
    public final Exp condition;
    public final List<Command> body;

    If(Pos pos, Exp condition, ImmutableList<Command> body) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.prefix(op.keyword, condition).append(" ").block(body);
    }
  }

  /** "WHILE" command. */
  public static class While extends Command {
    public final Exp condition;
    public final List<Command> body;

    While(Pos pos, Exp condition, ImmutableList<Command> body) {
      super(pos, Op.WHILE);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.prefix(op.keyword, condition).append(" ").block(body);
    }
  }

  /** Expression used as a command; its value is discarded. */
  public static class ExpCommand extends Command {
    public final Exp exp;

    ExpCommand(Pos pos, Exp exp) {
      super(pos, Op.EXP_COMMAND);
      this.exp = requireNonNull(exp);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(exp);
    }
  }

  /** Formal parameter of a procedure, written {@code :x} or {@code "x}. */
  public static class Param extends AstNode {
    public final String name;

    Param(Pos pos, Op op, String name) {
      super(pos, op);
      checkArgument(op == Op.VARIABLE_PARAM || op == Op.LITERAL_PARAM);
      this.name = requireNonNull(name);
    }

    /** Whether this parameter was written {@code :x}. */
    public boolean isVariable() {
      return op == Op.VARIABLE_PARAM;
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(isVariable() ? ":" : "\"").append(name);
    }
  }

  /** Procedure definition, "TO name params... commands... END". */
  public static class To extends Command {
    public final String name;
    public final List<Param> params;
    public final List<Command> body;

    To(Pos pos, String name, ImmutableList<Param> params,
        ImmutableList<Command> body) {
      super(pos, Op.TO);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword)
          .append(" ")
          .append(name)
          .appendAll(params)
          .appendAll(body)
          .append(" END");
    }
  }

  /** Call to a user-defined procedure. */
  public static class Call extends Command {
    public final String name;
    public final List<Exp> args;

    Call(Pos pos, String name, ImmutableList<Exp> args) {
      super(pos, Op.CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(name).appendAll(args);
    }
  }

  /** A whole program; the unit produced by the parser. */
  public static class Program extends AstNode {
    public final List<Command> commands;

    Program(Pos pos, ImmutableList<Command> commands) {
      super(pos, Op.PROGRAM);
      this.commands = requireNonNull(commands);
    }

    @Override AstWriter unparse(AstWriter w) {
      for (int i = 0; i < commands.size(); i++) {
        if (i > 0) {
          w.append("\n");
        }
        w.append(commands.get(i));
      }
      return w;
    }
  }
}

// End Ast.java
