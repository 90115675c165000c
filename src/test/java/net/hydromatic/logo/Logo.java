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
package net.hydromatic.logo;

import static java.util.Objects.requireNonNull;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.logo.ast.Ast;
import net.hydromatic.logo.eval.Interpreter;
import net.hydromatic.logo.eval.Prop;
import net.hydromatic.logo.eval.Session;
import net.hydromatic.logo.eval.Tracer;
import net.hydromatic.logo.eval.Tracers;
import net.hydromatic.logo.eval.Value;
import net.hydromatic.logo.parse.LogoParser;
import net.hydromatic.logo.turtle.ImageTurtle;
import org.hamcrest.Matcher;

/** Fluent test helper. */
public class Logo {
  /** Width and height of the canvas; the turtle starts at (100, 100). */
  public static final int SIZE = 200;

  private final String source;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  Logo(String source, Map<Prop, Object> propMap, Tracer tracer) {
    this.source = requireNonNull(source);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a {@code Logo}. */
  public static Logo logo(String source) {
    return new Logo(source, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  public static void assertError(Runnable runnable,
      Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  public Logo withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Logo(source, map, tracer);
  }

  public Logo withTracer(Tracer tracer) {
    return new Logo(source, propMap, tracer);
  }

  public Ast.Program parse() {
    return LogoParser.parse(source);
  }

  /**
   * Checks that the program can be parsed and returns the given string when
   * unparsed.
   */
  @CanIgnoreReturnValue
  public Logo assertParse(String expected) {
    return assertParse(Matchers.isAst(Ast.Program.class, expected));
  }

  @CanIgnoreReturnValue
  public Logo assertParse(Matcher<Ast.Program> matcher) {
    assertThat(parse(), matcher);
    return this;
  }

  /** Checks that parsing the program throws. */
  @CanIgnoreReturnValue
  public Logo assertParseThrows(Matcher<Throwable> matcher) {
    assertError(() -> fail("expected error, got " + parse()), matcher);
    return this;
  }

  /** Parses and executes the program in a new session, and returns the
   * session. */
  public Session run() {
    final Ast.Program program = parse();
    final Session session =
        new Session(new LinkedHashMap<>(propMap), new ImageTurtle(SIZE, SIZE),
            tracer);
    Interpreter.execute(session, program);
    return session;
  }

  /** Runs the program, then passes the final state to a consumer. */
  @CanIgnoreReturnValue
  public Logo assertEval(Consumer<Session> consumer) {
    consumer.accept(run());
    return this;
  }

  /** Runs the program, and checks the value of a global variable. */
  @CanIgnoreReturnValue
  public Logo assertVariable(String name, Matcher<Value> matcher) {
    return assertEval(session -> assertThat(session.env.get(name), matcher));
  }

  /** Runs the program, and checks where the turtle ends up. */
  @CanIgnoreReturnValue
  public Logo assertTurtle(int x, int y, int heading) {
    return assertEval(session -> {
      assertThat("x", session.turtle.getX(), is(x));
      assertThat("y", session.turtle.getY(), is(y));
      assertThat("heading", session.turtle.getHeading(), is(heading));
    });
  }

  /** Checks that parsing or running the program throws. */
  @CanIgnoreReturnValue
  public Logo assertEvalError(Matcher<Throwable> matcher) {
    assertError(this::run, matcher);
    return this;
  }
}

// End Logo.java
