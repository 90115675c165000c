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
import java.util.List;
import net.hydromatic.logo.ast.Ast;

/** A user-defined procedure. Immutable. */
public class Procedure {
  public final String name;
  /** Names of the formal parameters, after definition-time substitution. */
  public final List<String> params;
  public final List<Ast.Command> body;

  Procedure(String name, List<String> params, List<Ast.Command> body) {
    this.name = requireNonNull(name);
    this.params = ImmutableList.copyOf(params);
    this.body = ImmutableList.copyOf(body);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder(name);
    params.forEach(p -> b.append(" :").append(p));
    return b.append(" (").append(body.size()).append(" commands)")
        .toString();
  }
}

// End Procedure.java
