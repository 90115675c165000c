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

import java.util.List;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends a list of nodes, each preceded by a space. */
  public AstWriter appendAll(List<? extends AstNode> nodes) {
    for (AstNode node : nodes) {
      append(" ").append(node);
    }
    return this;
  }

  /** Appends a block of commands, enclosed in brackets. */
  public AstWriter block(List<? extends AstNode> commands) {
    append("[");
    for (int i = 0; i < commands.size(); i++) {
      if (i > 0) {
        append(" ");
      }
      append(commands.get(i));
    }
    return append("]");
  }

  /** Appends a call to a prefix operator or command, e.g. "+ 1 2". */
  public AstWriter prefix(String keyword, AstNode... args) {
    append(keyword);
    for (AstNode arg : args) {
      append(" ").append(arg);
    }
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
