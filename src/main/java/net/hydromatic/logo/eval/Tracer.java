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

import java.util.List;
import net.hydromatic.logo.ast.Ast;

/** Called on various events during execution. */
public interface Tracer {
  /** Called before the first command of a program is executed. */
  void onStart(Ast.Program program);

  /**
   * Called before a command is executed.
   *
   * @param command Command
   * @param depth Number of procedure calls in progress; 0 at top level
   */
  void onCommand(Ast.Command command, int depth);

  /** Called after a variable has been assigned, with its stored value. */
  void onAssign(String name, Value value);

  /** Called after a procedure has been defined. */
  void onDefine(Procedure procedure);

  /** Called when a procedure is called, after its arguments have been
   * evaluated and before its body is executed. */
  void onCall(Procedure procedure, List<Value> args);

  /**
   * Called with the exception that aborted execution. Returns whether a
   * handler was found.
   */
  boolean onException(RuntimeException e);
}

// End Tracer.java
