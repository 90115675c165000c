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
import static net.hydromatic.logo.Matchers.throwsInvalidArgument;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.logo.turtle.ImageTurtle;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  /** Every property's camel name matches its enum name. */
  @Test void testNames() {
    for (Prop prop : Prop.values()) {
      assertThat(Prop.lookup(prop.name()), is(prop));
      assertThat(Prop.lookup(prop.camelName), is(prop));
    }
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.DIRECTORY));
    assertError(() -> Prop.lookup("color"),
        instanceOf(IllegalArgumentException.class));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.TRACE.booleanValue(map), is(false));
    assertThat(Prop.PEN_COLOR.intValue(map), is(7));
    assertThat(Prop.DIRECTORY.fileValue(map).getPath(), is(""));
    assertError(() -> Prop.TRACE.intValue(map),
        instanceOf(IllegalArgumentException.class));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.TRACE.setLenient(map, "TRUE");
    assertThat(Prop.TRACE.booleanValue(map), is(true));
    Prop.PEN_COLOR.setLenient(map, "12");
    assertThat(Prop.PEN_COLOR.intValue(map), is(12));
    Prop.DIRECTORY.setLenient(map, "/tmp");
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("/tmp")));

    assertError(() -> Prop.TRACE.setLenient(map, "yes"),
        instanceOf(IllegalArgumentException.class));
    assertError(() -> Prop.PEN_COLOR.setLenient(map, "twelve"),
        instanceOf(IllegalArgumentException.class));
    assertError(() -> Prop.PEN_COLOR.setLenient(map, "16"),
        throwsInvalidArgument("penColor", "16",
            "an integer between 0 and 15"));
    assertError(() -> Prop.TRACE.set(map, 1),
        instanceOf(IllegalArgumentException.class));

    assertThat(Prop.PEN_COLOR.remove(map), is((Object) 12));
    assertThat(Prop.PEN_COLOR.intValue(map), is(7));
  }

  @Test void testSessionPenColor() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.PEN_COLOR.set(map, 2);
    final Session session =
        new Session(map, new ImageTurtle(10, 10), Tracers.empty());
    assertThat(session.turtle.getPenColor(), is(2));
  }

  @Test void testResolve() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    final Session session =
        new Session(map, new ImageTurtle(10, 10), Tracers.empty());
    assertThat(session.resolve("a.logo"), is(new File("a.logo")));
    Prop.DIRECTORY.set(map, new File("/work"));
    assertThat(session.resolve("a.logo"), is(new File("/work", "a.logo")));
    assertThat(session.resolve("/abs/a.logo"), is(new File("/abs/a.logo")));
  }
}

// End PropTest.java
