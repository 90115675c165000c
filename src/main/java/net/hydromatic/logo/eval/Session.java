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

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.logo.turtle.Turtle;

/**
 * State of one run of a program: variables, procedures, the operand stack,
 * the turtle, and properties.
 *
 * <p>A Session is passed explicitly to each method of {@link Interpreter}.
 * Sessions share nothing, so programs can run in isolation; a session is not
 * thread-safe.
 */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;
  public final Environment env = new Environment();
  public final ProcedureRegistry procedures = new ProcedureRegistry();
  public final OperandStack stack = new OperandStack();
  public final Turtle turtle;
  public final Tracer tracer;

  /**
   * Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * <p>The turtle's pen color is set from the {@link Prop#PEN_COLOR}
   * property.
   *
   * @param map Map that contains property values
   * @param turtle Turtle that movement commands and queries act upon
   * @param tracer Tracer
   */
  public Session(Map<Prop, Object> map, Turtle turtle, Tracer tracer) {
    this.map = requireNonNull(map);
    this.turtle = requireNonNull(turtle);
    this.tracer = requireNonNull(tracer);
    turtle.setPenColor(Prop.PEN_COLOR.intValue(map));
  }

  /** Creates a Session with default properties and no tracing. */
  public Session(Turtle turtle) {
    this(new LinkedHashMap<>(), turtle, Tracers.empty());
  }

  /** Resolves a path against the {@link Prop#DIRECTORY} property. An
   * absolute path is returned unchanged. */
  public File resolve(String path) {
    final File file = new File(path);
    if (file.isAbsolute()) {
      return file;
    }
    final File directory = Prop.DIRECTORY.fileValue(map);
    return directory.getPath().isEmpty() ? file : new File(directory, path);
  }
}

// End Session.java
