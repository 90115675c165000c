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
package net.hydromatic.logo.turtle;

import static net.hydromatic.logo.Logo.assertError;
import static net.hydromatic.logo.Matchers.throwsInvalidArgument;
import static net.hydromatic.logo.Matchers.throwsKind;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.io.Files;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.imageio.ImageIO;
import net.hydromatic.logo.eval.LogoRuntimeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link ImageTurtle} and {@link Canvas}. */
public class ImageTurtleTest {
  private static void assertPosition(Turtle turtle, int x, int y) {
    assertThat("x", turtle.getX(), is(x));
    assertThat("y", turtle.getY(), is(y));
  }

  @Test void testInitialState() {
    final ImageTurtle turtle = new ImageTurtle(200, 100);
    assertPosition(turtle, 100, 50);
    assertThat(turtle.getHeading(), is(0));
    assertThat(turtle.isPenDown(), is(false));
    assertThat(turtle.getPenColor(), is(PenColor.WHITE.ordinal()));
  }

  /** Heading 0 is up the screen; y grows downwards. */
  @Test void testMove() {
    final ImageTurtle turtle = new ImageTurtle(200, 200);
    turtle.forward(10);
    assertPosition(turtle, 100, 90);
    turtle.back(20);
    assertPosition(turtle, 100, 110);
    turtle.left(5);
    assertPosition(turtle, 95, 110);
    turtle.right(15);
    assertPosition(turtle, 110, 110);

    turtle.setHeading(90);
    turtle.forward(10);
    assertPosition(turtle, 120, 110);
    turtle.left(10);
    assertPosition(turtle, 120, 100);

    turtle.setHeading(45);
    turtle.setX(0);
    turtle.setY(0);
    turtle.forward(10);
    assertPosition(turtle, 7, -7);
  }

  @Test void testNegativeDistance() {
    final ImageTurtle turtle = new ImageTurtle(200, 200);
    turtle.forward(-10);
    assertPosition(turtle, 100, 110);
    turtle.back(-10);
    assertPosition(turtle, 100, 100);
    turtle.left(-10);
    assertPosition(turtle, 110, 100);
    // RIGHT with a negative distance moves right, as RIGHT does with a
    // positive one.
    turtle.right(-10);
    assertPosition(turtle, 120, 100);
  }

  @Test void testTurn() {
    final ImageTurtle turtle = new ImageTurtle(200, 200);
    turtle.turn(90);
    turtle.turn(-180);
    assertThat(turtle.getHeading(), is(-90));
    turtle.turn(450);
    assertThat(turtle.getHeading(), is(360));
    turtle.setHeading(Integer.MAX_VALUE);
    assertError(() -> turtle.turn(1),
        throwsKind(LogoRuntimeException.Kind.OVERFLOW));
  }

  @Test void testErrors() {
    final ImageTurtle turtle = new ImageTurtle(200, 200);
    assertError(() -> turtle.forward(Integer.MIN_VALUE),
        throwsKind(LogoRuntimeException.Kind.OVERFLOW));
    assertError(() -> turtle.left(Integer.MIN_VALUE),
        throwsKind(LogoRuntimeException.Kind.OVERFLOW));
    turtle.setX(Integer.MAX_VALUE);
    assertError(() -> turtle.right(10),
        throwsKind(LogoRuntimeException.Kind.DRAW_ERROR));
    assertPosition(turtle, Integer.MAX_VALUE, 100);
    assertError(() -> turtle.setPenColor(16),
        throwsInvalidArgument("SETPENCOLOR", "16",
            "an integer between 0 and 15"));
  }

  @Test void testDraw() {
    final ImageTurtle turtle = new ImageTurtle(200, 200);
    turtle.forward(10);
    assertThat(turtle.canvas().lines().isEmpty(), is(true));
    turtle.penDown();
    turtle.setPenColor(PenColor.GREEN.ordinal());
    turtle.right(20);
    turtle.penUp();
    turtle.back(5);
    assertThat(turtle.canvas().lines().toString(),
        is("[(100, 90) -> (120, 90) GREEN]"));
  }

  @Test void testSvg() {
    final ImageTurtle turtle = new ImageTurtle(30, 20);
    turtle.penDown();
    turtle.setPenColor(PenColor.ORANGE.ordinal());
    turtle.forward(5);
    assertThat(turtle.canvas().toSvg(),
        is("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"30\" "
            + "height=\"20\" viewBox=\"0 0 30 20\">\n"
            + "<rect width=\"100%\" height=\"100%\" fill=\"black\"/>\n"
            + "<line x1=\"15\" y1=\"10\" x2=\"15\" y2=\"5\" "
            + "stroke=\"rgb(255, 163, 0)\" stroke-width=\"1\"/>\n"
            + "</svg>\n"));
  }

  @Test void testSaveSvg(@TempDir File dir) throws IOException {
    final ImageTurtle turtle = new ImageTurtle(30, 20);
    turtle.penDown();
    turtle.forward(5);
    final File file = new File(dir, "out.svg");
    turtle.saveImage(file);
    final String svg = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    assertThat(svg, startsWith("<svg "));
    assertThat(svg, containsString("stroke=\"rgb(255, 255, 255)\""));
  }

  @Test void testSavePng(@TempDir File dir) throws IOException {
    final ImageTurtle turtle = new ImageTurtle(30, 20);
    turtle.penDown();
    turtle.forward(5);
    final File file = new File(dir, "out.png");
    turtle.saveImage(file);
    final BufferedImage image = ImageIO.read(file);
    assertThat(image.getWidth(), is(30));
    assertThat(image.getHeight(), is(20));
    assertThat(image.getRGB(0, 0) & 0xFFFFFF, is(0));
    assertThat(image.getRGB(15, 7) & 0xFFFFFF, is(0xFFFFFF));
  }

  @Test void testSaveErrors(@TempDir File dir) {
    final ImageTurtle turtle = new ImageTurtle(30, 20);
    assertError(() -> turtle.saveImage(new File(dir, "out.jpg")),
        throwsKind(LogoRuntimeException.Kind.IMAGE_SAVE_ERROR));
    assertError(() -> turtle.saveImage(new File(dir, "out")),
        throwsKind(LogoRuntimeException.Kind.IMAGE_SAVE_ERROR));
    assertError(
        () -> turtle.saveImage(new File(dir, "no/such/dir/out.svg")),
        throwsKind(LogoRuntimeException.Kind.IMAGE_SAVE_ERROR));
  }

  @Test void testPenColor() {
    assertThat(PenColor.of(0), is(PenColor.BLACK));
    assertThat(PenColor.of(15), is(PenColor.GREY));
    assertThat(PenColor.of(16) == null, is(true));
    assertThat(PenColor.of(-1) == null, is(true));
    assertThat(PenColor.BROWN.toSvg(), is("rgb(155, 96, 59)"));
    assertThat(PenColor.RANGE_DESCRIPTION, is("an integer between 0 and 15"));
  }
}

// End ImageTurtleTest.java
