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

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.logo.ast.Ast;
import net.hydromatic.logo.eval.Interpreter;
import net.hydromatic.logo.eval.LogoRuntimeException;
import net.hydromatic.logo.eval.Prop;
import net.hydromatic.logo.eval.Session;
import net.hydromatic.logo.eval.Tracer;
import net.hydromatic.logo.eval.Tracers;
import net.hydromatic.logo.eval.Values;
import net.hydromatic.logo.parse.LogoParser;
import net.hydromatic.logo.turtle.ImageTurtle;
import net.hydromatic.logo.util.LogoException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line entry point.
 *
 * <p>Usage: {@code logo [--name=value]... INPUT OUTPUT HEIGHT WIDTH}. Reads a
 * Logo program from INPUT, runs it, and writes the drawing to OUTPUT, an SVG
 * or PNG file of the given size. Each option sets a {@link Prop property};
 * {@code --trace} is short for {@code --trace=true}.
 */
public class Main {
  static final String USAGE =
      "Usage: logo [--name=value]... INPUT OUTPUT HEIGHT WIDTH";

  /** Status when the program ran and the image was written. */
  public static final int SUCCESS = 0;
  /** Status when parsing or execution failed. */
  public static final int ERROR = 1;
  /** Status when the command-line arguments are invalid. */
  public static final int USAGE_ERROR = 2;

  private final List<String> argList;
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args), System.out, new LinkedHashMap<>());
    final int status = main.run();
    if (status != SUCCESS) {
      System.exit(status);
    }
  }

  /** Creates a Main. */
  public Main(List<String> argList, PrintStream out,
      Map<Prop, Object> propMap) {
    this(argList, new OutputStreamWriter(out, StandardCharsets.UTF_8),
        propMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out, Map<Prop, Object> propMap) {
    this.argList = ImmutableList.copyOf(argList);
    this.out = out instanceof PrintWriter
        ? (PrintWriter) out
        : new PrintWriter(out);
    this.propMap = propMap;
  }

  /** Runs the program named on the command line, and returns the exit
   * status. */
  public int run() {
    try {
      return run2();
    } finally {
      out.flush();
    }
  }

  private int run2() {
    final List<String> positional = new ArrayList<>();
    for (String arg : argList) {
      if (!arg.startsWith("--")) {
        positional.add(arg);
        continue;
      }
      final String option = arg.substring(2);
      final int eq = option.indexOf('=');
      final String name = eq < 0 ? option : option.substring(0, eq);
      final String value = eq < 0 ? "true" : option.substring(eq + 1);
      try {
        Prop.lookup(name).setLenient(propMap, value);
      } catch (IllegalArgumentException | LogoRuntimeException e) {
        return usage("Invalid option '" + arg + "': " + e.getMessage());
      }
    }
    if (positional.size() != 4) {
      return usage(null);
    }
    final Integer height = Values.parseInt(positional.get(2));
    final Integer width = Values.parseInt(positional.get(3));
    if (height == null || height <= 0 || width == null || width <= 0) {
      return usage("HEIGHT and WIDTH must be positive integers");
    }

    final Tracer tracer = Prop.TRACE.booleanValue(propMap)
        ? Tracers.printing(out::println)
        : Tracers.empty();
    final ImageTurtle turtle = new ImageTurtle(width, height);
    try {
      final Session session = new Session(propMap, turtle, tracer);
      final String source = read(session.resolve(positional.get(0)));
      final Ast.Program program = LogoParser.parse(source);
      Interpreter.execute(session, program);
      turtle.saveImage(session.resolve(positional.get(1)));
      out.println("Program executed successfully.");
      return SUCCESS;
    } catch (RuntimeException e) {
      if (e instanceof LogoException) {
        out.println(((LogoException) e).describeTo(new StringBuilder()));
        return ERROR;
      }
      throw e;
    }
  }

  private int usage(@Nullable String message) {
    if (message != null) {
      out.println(message);
    }
    out.println(USAGE);
    return USAGE_ERROR;
  }

  private static String read(File file) {
    try {
      return Files.asCharSource(file, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      throw LogoRuntimeException.ioError(e);
    }
  }
}

// End Main.java
