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

import com.google.common.base.Strings;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.logo.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line describing each event to a
   * consumer. */
  public static Tracer printing(Consumer<String> out) {
    return new PrintingTracer(out);
  }

  /** Returns a tracer that performs the given action on each command,
   * then calls the underlying tracer. */
  public static Tracer withOnCommand(Tracer tracer,
      Consumer<Ast.Command> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCommand(Ast.Command command, int depth) {
        consumer.accept(command);
        super.onCommand(command, depth);
      }
    };
  }

  /** Returns a tracer that performs the given action on each assignment,
   * then calls the underlying tracer. */
  public static Tracer withOnAssign(Tracer tracer,
      BiConsumer<String, Value> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onAssign(String name, Value value) {
        consumer.accept(name, value);
        super.onAssign(name, value);
      }
    };
  }

  public static Tracer withOnCall(Tracer tracer,
      BiConsumer<Procedure, List<Value>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCall(Procedure procedure, List<Value> args) {
        consumer.accept(procedure, args);
        super.onCall(procedure, args);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<RuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean onException(RuntimeException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onStart(Ast.Program program) {
    }

    @Override public void onCommand(Ast.Command command, int depth) {
    }

    @Override public void onAssign(String name, Value value) {
    }

    @Override public void onDefine(Procedure procedure) {
    }

    @Override public void onCall(Procedure procedure, List<Value> args) {
    }

    @Override public boolean onException(RuntimeException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onStart(Ast.Program program) {
      tracer.onStart(program);
    }

    @Override public void onCommand(Ast.Command command, int depth) {
      tracer.onCommand(command, depth);
    }

    @Override public void onAssign(String name, Value value) {
      tracer.onAssign(name, value);
    }

    @Override public void onDefine(Procedure procedure) {
      tracer.onDefine(procedure);
    }

    @Override public void onCall(Procedure procedure, List<Value> args) {
      tracer.onCall(procedure, args);
    }

    @Override public boolean onException(RuntimeException e) {
      return tracer.onException(e);
    }
  }

  /** Tracer that describes each event in a line of text. Commands inside
   * procedure calls are indented by two spaces per call. */
  private static class PrintingTracer implements Tracer {
    private final Consumer<String> out;
    private int commandCount;

    PrintingTracer(Consumer<String> out) {
      this.out = requireNonNull(out);
    }

    @Override public void onStart(Ast.Program program) {
      commandCount = 0;
      out.accept("Executing program with " + program.commands.size()
          + " commands");
    }

    @Override public void onCommand(Ast.Command command, int depth) {
      out.accept(Strings.repeat("  ", depth) + "Executing command "
          + ++commandCount + ": " + command);
    }

    @Override public void onAssign(String name, Value value) {
      out.accept("Setting variable: " + name + " = " + value.describe());
    }

    @Override public void onDefine(Procedure procedure) {
      out.accept("Defining procedure: " + procedure);
    }

    @Override public void onCall(Procedure procedure, List<Value> args) {
      out.accept("Calling procedure: " + procedure.name + " " + args);
    }

    @Override public boolean onException(RuntimeException e) {
      out.accept("Execution aborted: " + e.getMessage());
      return false;
    }
  }
}

// End Tracers.java
