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

import static net.hydromatic.logo.Logo.assertError;
import static net.hydromatic.logo.Matchers.isBool;
import static net.hydromatic.logo.Matchers.isNumber;
import static net.hydromatic.logo.Matchers.isString;
import static net.hydromatic.logo.Matchers.throwsInvalidArgument;
import static net.hydromatic.logo.Matchers.throwsKind;
import static net.hydromatic.logo.Matchers.throwsUndefinedVariable;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import net.hydromatic.logo.ast.Ast;
import net.hydromatic.logo.parse.LogoParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Environment} and {@link ProcedureRegistry}. */
public class EnvironmentTest {
  @Test void testSetNormalizes() {
    final Environment env = new Environment();
    assertThat(env.set("a", Value.string("5")), isNumber(5));
    assertThat(env.set("b", Value.string("false")), isBool(false));
    assertThat(env.set("c", Value.string("abc")), isString("abc"));
    assertThat(env.get("a"), isNumber(5));
    assertThat(env.contains("b"), is(true));
    assertThat(env.contains("d"), is(false));
    assertThat(env.getOpt("d"), nullValue());
    assertError(() -> env.set("d", Value.variable("a")),
        throwsKind(LogoRuntimeException.Kind.TYPE_MISMATCH));
  }

  @Test void testNamesInInsertionOrder() {
    final Environment env = new Environment();
    env.set("zebra", Value.number(1));
    env.set("apple", Value.number(2));
    env.set("zebra", Value.number(3));
    assertThat(env.names(), is(Arrays.asList("zebra", "apple")));
    assertThat(env.get("zebra"), isNumber(3));
  }

  @Test void testUndefined() {
    final Environment env = new Environment();
    assertError(() -> env.get("x"), throwsUndefinedVariable("x"));
    final LogoRuntimeException.UndefinedVariable e0 = env.undefined("x");
    assertThat(e0.describeTo(new StringBuilder()).toString(),
        is("Error: Undefined variable 'x'\n"
            + "No variables have been defined yet.\n"
            + "Make sure to define variables using the MAKE command "
            + "before using them."));

    env.set("size", Value.number(10));
    env.set("angle", Value.number(90));
    final LogoRuntimeException.UndefinedVariable e1 = env.undefined("x");
    assertThat(e1.definedNames, is(Arrays.asList("size", "angle")));
    assertThat(e1.describeTo(new StringBuilder()).toString(),
        is("Error: Undefined variable 'x'\n"
            + "Currently defined variables are:\n"
            + "  - size\n"
            + "  - angle\n"
            + "Make sure to define variables using the MAKE command "
            + "before using them."));
  }

  private static Ast.To to(String source) {
    return (Ast.To) LogoParser.parse(source).commands.get(0);
  }

  @Test void testDefine() {
    final Environment env = new Environment();
    final ProcedureRegistry registry = new ProcedureRegistry();
    final Procedure p = registry.define(to("TO f :a \"b PENUP END"), env);
    assertThat(p.name, is("f"));
    assertThat(p.params, is(Arrays.asList("a", "b")));
    assertThat(p.body.size(), is(1));
    assertThat(registry.lookupOpt("f"), is(p));
    assertThat(registry.lookupOpt("g"), nullValue());
    assertError(() -> registry.lookup("g"),
        throwsInvalidArgument("procedure call", "g",
            "a defined procedure name"));

    // Redefinition replaces.
    final Procedure p2 = registry.define(to("TO f END"), env);
    assertThat(registry.lookup("f"), is(p2));
    assertThat(p2.params.isEmpty(), is(true));
  }

  /** A parameter written ":a" takes its name from the word in global
   * variable "a", if there is one, at the time the procedure is defined. */
  @Test void testDefineParameterName() {
    final Environment env = new Environment();
    final ProcedureRegistry registry = new ProcedureRegistry();
    env.set("a", Value.string("size"));
    env.set("b", Value.string("angle"));
    env.set("c", Value.number(3));
    final Procedure p = registry.define(to("TO f :a \"b :c END"), env);
    assertThat(p.params, is(Arrays.asList("size", "b", "c")));

    // Later assignments do not affect the procedure.
    env.set("a", Value.string("other"));
    assertThat(registry.lookup("f").params.get(0), is("size"));
  }

  @Test void testFrames() {
    final ProcedureRegistry registry = new ProcedureRegistry();
    assertThat(registry.depth(), is(0));
    assertThat(registry.lookupParameter("n"), nullValue());

    registry.pushFrame(ImmutableList.of("n", "m"),
        ImmutableList.of(Value.number(1), Value.number(2)));
    registry.pushFrame(ImmutableList.of("n"),
        ImmutableList.of(Value.number(10)));
    assertThat(registry.depth(), is(2));
    assertThat(registry.lookupParameter("n"), isNumber(10));
    assertThat(registry.lookupParameter("m"), isNumber(2));

    registry.popFrame();
    assertThat(registry.lookupParameter("n"), isNumber(1));
    registry.popFrame();
    assertThat(registry.depth(), is(0));
    assertError(registry::popFrame,
        instanceOf(IllegalStateException.class));
  }

  @Test void testArity() {
    final ProcedureRegistry registry = new ProcedureRegistry();
    assertError(
        () -> registry.pushFrame(ImmutableList.of("a", "b"),
            ImmutableList.of(Value.number(1))),
        throwsInvalidArgument("procedure call", "1 arguments",
            "2 arguments"));
    assertThat(registry.depth(), is(0));
  }
}

// End EnvironmentTest.java
