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

import java.io.File;

/**
 * Cursor that moves over a drawing surface, drawing lines when its pen is
 * down.
 *
 * <p>The heading is in degrees, clockwise from north; 0 is up the page, and
 * 90 is to the right. Coordinates are in pixels, with y increasing down the
 * page.
 *
 * <p>Methods that move the turtle accept negative magnitudes. {@code
 * forward(-n)} is {@code back(n)}, {@code back(-n)} is {@code forward(n)},
 * and {@code left(-n)} is {@code right(n)}; {@code right(-n)} is {@code
 * left(-n)}, and therefore also moves to the right.
 */
public interface Turtle {
  void penUp();

  void penDown();

  boolean isPenDown();

  /** Moves in the direction of the heading. */
  void forward(int distance);

  /** Moves opposite to the heading. */
  void back(int distance);

  /** Moves at right angles to the heading, to the turtle's left. The
   * heading does not change. */
  void left(int distance);

  /** Moves at right angles to the heading, to the turtle's right. The
   * heading does not change. */
  void right(int distance);

  /**
   * Sets the pen color.
   *
   * @param code Color code, between 0 and 15; see {@link PenColor}
   */
  void setPenColor(int code);

  /** Adds to the heading. */
  void turn(int degrees);

  void setHeading(int degrees);

  void setX(int x);

  void setY(int y);

  int getX();

  int getY();

  int getHeading();

  /** Returns the code of the pen color, between 0 and 15. */
  int getPenColor();

  /** Writes what has been drawn to a file. The extension of the file,
   * "svg" or "png", determines its format. */
  void saveImage(File file);
}

// End Turtle.java
