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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.logo.ast.Ast;
import net.hydromatic.logo.turtle.PenColor;

/**
 * Executes programs.
 *
 * <p>Every expression that is evaluated pushes its value onto the session's
 * {@link OperandStack}. A command pops the values of the expressions it
 * owns, so the stack is empty between commands.
 *
 * <p>The first error aborts the run. Errors propagate to the caller
 * unchanged, after being reported to the session's {@link Tracer}.
 */
public abstract class Interpreter {
  private Interpreter() {}

  /** Executes each command of a program, in order. */
  public static void execute(Session session, Ast.Program program) {
    session.tracer.onStart(program);
    try {
      exec(session, program.commands);
    } catch (RuntimeException e) {
      session.tracer.onException(e);
      throw e;
    }
  }

  /** Executes a list of commands, such as the body of a loop. */
  public static void exec(Session session, List<Ast.Command> commands) {
    for (Ast.Command command : commands) {
      exec(session, command);
    }
  }

  /** Executes a command. */
  public static void exec(Session session, Ast.Command command) {
    session.tracer.onCommand(command, session.procedures.depth());
    switch (command.op) {
      case PENUP:
        session.turtle.penUp();
        return;
      case PENDOWN:
        session.turtle.penDown();
        return;
      case FORWARD:
        session.turtle.forward(intArg(session, command));
        return;
      case BACK:
        session.turtle.back(intArg(session, command));
        return;
      case LEFT:
        session.turtle.left(intArg(session, command));
        return;
      case RIGHT:
        session.turtle.right(intArg(session, command));
        return;
      case SETPENCOLOR:
        final int code = intArg(session, command);
        if (PenColor.of(code) == null) {
          throw LogoRuntimeException.invalidArgument("SETPENCOLOR",
              Integer.toString(code), PenColor.RANGE_DESCRIPTION);
        }
        session.turtle.setPenColor(code);
        return;
      case TURN:
        session.turtle.turn(intArg(session, command));
        return;
      case SETHEADING:
        session.turtle.setHeading(intArg(session, command));
        return;
      case SETX:
        session.turtle.setX(intArg(session, command));
        return;
      case SETY:
        session.turtle.setY(intArg(session, command));
        return;
      case MAKE:
        make(session, (Ast.Make) command);
        return;
      case ADD_ASSIGN:
        addAssign(session, (Ast.AddAssign) command);
        return;
      case IF:
        final Ast.If if_ = (Ast.If) command;
        if (Values.toBool(evaluate(session, if_.condition))) {
          exec(session, if_.body);
        }
        return;
      case WHILE:
        final Ast.While while_ = (Ast.While) command;
        while (Values.toBool(evaluate(session, while_.condition))) {
          exec(session, while_.body);
        }
        return;
      case EXP_COMMAND:
        evaluate(session, ((Ast.ExpCommand) command).exp);
        return;
      case TO:
        final Procedure procedure =
            session.procedures.define((Ast.To) command, session.env);
        session.tracer.onDefine(procedure);
        return;
      case CALL:
        call(session, (Ast.Call) command);
        return;
      default:
        throw new AssertionError("unknown command " + command.op);
    }
  }

  /** Evaluates an expression, pushes its value onto the operand stack, and
   * returns the value. */
  public static Value eval(Session session, Ast.Exp exp) {
    final Value value;
    switch (exp.op) {
      case NUMBER_LITERAL:
      case STRING_LITERAL:
      case BOOL_LITERAL:
      case VARIABLE:
        value = resolve(session, ((Ast.Literal) exp).value);
        break;
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case EQ:
      case NE:
      case GT:
      case LT:
      case AND:
      case OR:
        final Ast.BinaryCall call = (Ast.BinaryCall) exp;
        eval(session, call.a0);
        eval(session, call.a1);
        // Operators.apply pops both operands and pushes the result.
        return Operators.apply(call.op, session.stack);
      case XCOR:
        value = Value.number(session.turtle.getX());
        break;
      case YCOR:
        value = Value.number(session.turtle.getY());
        break;
      case HEADING:
        value = Value.number(session.turtle.getHeading());
        break;
      case COLOR:
        value = Value.number(session.turtle.getPenColor());
        break;
      default:
        throw new AssertionError("unknown expression " + exp.op);
    }
    session.stack.push(value);
    return value;
  }

  /** Evaluates an expression and pops its value from the operand stack. */
  private static Value evaluate(Session session, Ast.Exp exp) {
    eval(session, exp);
    return session.stack.pop();
  }

  private static int intArg(Session session, Ast.Command command) {
    return Values.toInt(evaluate(session, ((Ast.UnaryCommand) command).arg));
  }

  /**
   * Resolves a literal value.
   *
   * <p>A variable reference is looked up in the frames of the calls in
   * progress, innermost first, then among the global variables. If a global
   * variable holds a word that starts with ':', that word names another
   * global variable, whose value is the result; this indirection is not
   * repeated.
   *
   * <p>The words {@code TRUE} and {@code FALSE}, in any case, become
   * booleans.
   */
  static Value resolve(Session session, Value value) {
    switch (value.kind) {
      case VARIABLE:
        final String name = ((Value.VariableRef) value).name;
        final Value parameter = session.procedures.lookupParameter(name);
        if (parameter != null) {
          return parameter;
        }
        final Value global = session.env.get(name);
        if (global.kind == Value.Kind.STRING
            && ((Value.StringValue) global).value.startsWith(":")) {
          return session.env.get(
              ((Value.StringValue) global).value.substring(1));
        }
        return global;
      case STRING:
        final Value.BooleanValue b =
            Values.booleanWord(((Value.StringValue) value).value);
        return b != null ? b : value;
      default:
        return value;
    }
  }

  private static void make(Session session, Ast.Make make) {
    eval(session, make.name);
    eval(session, make.value);
    final Value value = session.stack.pop();
    final String name = Values.toStr(session.stack.pop());
    final Value stored = session.env.set(name, value);
    session.tracer.onAssign(name, stored);
  }

  /**
   * Executes "ADDASSIGN".
   *
   * <p>The target is found as follows. If it was written {@code :x}, the
   * variable {@code x} holds the name of the target. Otherwise, if it was
   * written {@code "x} and the global variable {@code x} holds a word, that
   * word is the name of the target; failing that, the target is {@code x}
   * itself.
   */
  private static void addAssign(Session session, Ast.AddAssign addAssign) {
    final int amount = Values.toInt(evaluate(session, addAssign.amount));
    final String name;
    if (addAssign.indirect) {
      name = nameHeldBy(session, addAssign.target);
    } else {
      final Value value = session.env.getOpt(addAssign.target);
      name = value != null && value.kind == Value.Kind.STRING
          ? ((Value.StringValue) value).value
          : addAssign.target;
    }
    final int current = Values.toInt(session.env.get(name));
    final int sum;
    try {
      sum = Math.addExact(current, amount);
    } catch (ArithmeticException e) {
      throw LogoRuntimeException.overflow();
    }
    final Value stored = session.env.set(name, Value.number(sum));
    session.tracer.onAssign(name, stored);
  }

  /** Returns the name held by a variable: the text of the word or number
   * in the global variable, or failing that, in a parameter. */
  private static String nameHeldBy(Session session, String variable) {
    final Value global = session.env.getOpt(variable);
    if (global != null) {
      switch (global.kind) {
        case STRING:
        case NUMBER:
          return Values.toStr(global);
        default:
          throw LogoRuntimeException.unexpectedValue("a string or number",
              global.describe());
      }
    }
    final Value parameter = session.procedures.lookupParameter(variable);
    if (parameter != null
        && (parameter.kind == Value.Kind.STRING
            || parameter.kind == Value.Kind.NUMBER)) {
      return Values.toStr(parameter);
    }
    throw session.env.undefined(variable);
  }

  /**
   * Calls a procedure.
   *
   * <p>Arguments are evaluated in the caller's scope, before the new frame
   * is pushed. The frame is popped when the body completes, whether or not
   * it completes normally.
   */
  private static void call(Session session, Ast.Call call) {
    final Procedure procedure = session.procedures.lookup(call.name);
    final ImmutableList.Builder<Value> args = ImmutableList.builder();
    for (Ast.Exp arg : call.args) {
      args.add(evaluate(session, arg));
    }
    final List<Value> argList = args.build();
    session.procedures.pushFrame(procedure.params, argList);
    session.tracer.onCall(procedure, argList);
    try {
      exec(session, procedure.body);
    } finally {
      session.procedures.popFrame();
    }
  }
}

// End Interpreter.java
