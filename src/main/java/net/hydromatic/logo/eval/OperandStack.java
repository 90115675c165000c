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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Stack of values that sequences the evaluation of expressions.
 *
 * <p>Every expression pushes its value after it is evaluated. A binary
 * operator pops its right operand, then its left operand, and pushes its
 * result.
 */
public class OperandStack {
  private final Deque<Value> deque = new ArrayDeque<>();

  /** Pushes a value onto the top of the stack. */
  public void push(Value value) {
    deque.push(requireNonNull(value));
  }

  /**
   * Removes and returns the value on top of the stack.
   *
   * @throws LogoRuntimeException if the stack is empty
   */
  public Value pop() {
    final Value value = deque.poll();
    if (value == null) {
      throw LogoRuntimeException.stackUnderflow();
    }
    return value;
  }

  public int size() {
    return deque.size();
  }

  public boolean isEmpty() {
    return deque.isEmpty();
  }

  /** Returns the contents of the stack, bottom first. */
  public List<Value> toList() {
    return ImmutableList.copyOf(deque).reverse();
  }

  @Override public String toString() {
    return toList().toString();
  }
}

// End OperandStack.java
