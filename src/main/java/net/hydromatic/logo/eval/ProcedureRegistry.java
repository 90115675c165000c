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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.logo.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Procedure definitions, and the stack of parameter frames of the calls
 * that are in progress.
 *
 * <p>The innermost frame is last. Parameter lookup searches from the
 * innermost frame outward; the global {@link Environment} is consulted only
 * after every frame has been searched.
 */
public class ProcedureRegistry {
  private final Map<String, Procedure> procedures = new HashMap<>();
  private final List<Map<String, Value>> frames = new ArrayList<>();

  /**
   * Defines a procedure, replacing any existing procedure of the same name.
   *
   * <p>Parameter names are computed now, against the current variables. A
   * parameter written {@code :x} is named by the value of the global variable
   * {@code x} if that variable holds a word; otherwise, and for a parameter
   * written {@code "x}, its name is {@code x}.
   */
  public Procedure define(Ast.To to, Environment env) {
    final List<String> params = new ArrayList<>();
    for (Ast.Param param : to.params) {
      String name = param.name;
      if (param.isVariable()) {
        final Value value = env.getOpt(param.name);
        if (value != null && value.kind == Value.Kind.STRING) {
          name = ((Value.StringValue) value).value;
        }
      }
      params.add(name);
    }
    final Procedure procedure = new Procedure(to.name, params, to.body);
    procedures.put(to.name, procedure);
    return procedure;
  }

  /** Returns the procedure with a given name, or null. */
  public @Nullable Procedure lookupOpt(String name) {
    return procedures.get(name);
  }

  /**
   * Returns the procedure with a given name.
   *
   * @throws LogoRuntimeException.InvalidArgument if there is none
   */
  public Procedure lookup(String name) {
    final Procedure procedure = procedures.get(name);
    if (procedure == null) {
      throw LogoRuntimeException.invalidArgument("procedure call", name,
          "a defined procedure name");
    }
    return procedure;
  }

  /**
   * Pushes a frame that binds each formal parameter to an argument.
   *
   * @throws LogoRuntimeException.InvalidArgument if the number of arguments
   *   is not the number of formal parameters
   */
  public void pushFrame(List<String> formals, List<Value> args) {
    if (formals.size() != args.size()) {
      throw LogoRuntimeException.invalidArgument("procedure call",
          args.size() + " arguments", formals.size() + " arguments");
    }
    final Map<String, Value> frame = new HashMap<>();
    for (int i = 0; i < formals.size(); i++) {
      frame.put(formals.get(i), args.get(i));
    }
    frames.add(frame);
  }

  /** Pops the innermost frame. */
  public void popFrame() {
    checkState(!frames.isEmpty(), "no frame to pop");
    frames.remove(frames.size() - 1);
  }

  /** Returns the value of a parameter, searching from the innermost frame
   * outward, or null if no frame binds it. */
  public @Nullable Value lookupParameter(String name) {
    for (int i = frames.size() - 1; i >= 0; i--) {
      final Value value = frames.get(i).get(name);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Returns the number of frames; 0 when no procedure call is in
   * progress. */
  public int depth() {
    return frames.size();
  }
}

// End ProcedureRegistry.java
