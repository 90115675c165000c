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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Global variables.
 *
 * <p>There is a single, flat scope. Parameters of procedure calls are held
 * separately, in the frames of a {@link ProcedureRegistry}.
 */
public class Environment {
  private final Map<String, Value> valueMap = new LinkedHashMap<>();

  /**
   * Assigns a variable, and returns the value that was stored.
   *
   * <p>The value is normalized first: the word {@code TRUE} or {@code FALSE}
   * (in any case) is stored as a boolean, and a word that is an integer is
   * stored as a number. See {@link Values#normalize(Value)}.
   */
  public Value set(String name, Value value) {
    requireNonNull(name, "name");
    final Value stored = Values.normalize(value);
    if (stored.kind == Value.Kind.VARIABLE) {
      throw LogoRuntimeException.typeMismatch();
    }
    valueMap.put(name, stored);
    return stored;
  }

  /** Returns the value of a variable, or null if it is not defined. */
  public @Nullable Value getOpt(String name) {
    return valueMap.get(name);
  }

  /**
   * Returns the value of a variable.
   *
   * @throws LogoRuntimeException.UndefinedVariable if it is not defined
   */
  public Value get(String name) {
    final Value value = valueMap.get(name);
    if (value == null) {
      throw undefined(name);
    }
    return value;
  }

  /** Returns whether a variable is defined. */
  public boolean contains(String name) {
    return valueMap.containsKey(name);
  }

  /** Returns the names of the defined variables, in the order that they were
   * first assigned. */
  public List<String> names() {
    return ImmutableList.copyOf(valueMap.keySet());
  }

  /** Creates an error for a reference to a variable that is not defined. */
  public LogoRuntimeException.UndefinedVariable undefined(String name) {
    return LogoRuntimeException.undefinedVariable(name, names());
  }

  @Override public String toString() {
    return valueMap.toString();
  }
}

// End Environment.java
