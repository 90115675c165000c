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

import static java.util.Objects.requireNonNull;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import net.hydromatic.logo.eval.LogoRuntimeException;

/** Turtle that draws on a {@link Canvas}. */
public class ImageTurtle implements Turtle {
  private final Canvas canvas;
  private int x;
  private int y;
  private int heading;
  private boolean penDown;
  private PenColor color = PenColor.WHITE;

  /** Creates an ImageTurtle on a new canvas of a given size. */
  public ImageTurtle(int width, int height) {
    this(new Canvas(width, height));
  }

  /** Creates an ImageTurtle at the center of a canvas, facing up, with its
   * pen up. */
  public ImageTurtle(Canvas canvas) {
    this.canvas = requireNonNull(canvas);
    this.x = canvas.width / 2;
    this.y = canvas.height / 2;
  }

  public Canvas canvas() {
    return canvas;
  }

  @Override public void penUp() {
    penDown = false;
  }

  @Override public void penDown() {
    penDown = true;
  }

  @Override public boolean isPenDown() {
    return penDown;
  }

  @Override public void forward(int distance) {
    if (distance < 0) {
      back(negate(distance));
      return;
    }
    move(distance, heading);
  }

  @Override public void back(int distance) {
    if (distance < 0) {
      forward(negate(distance));
      return;
    }
    move(distance, (long) heading + 180);
  }

  @Override public void left(int distance) {
    if (distance < 0) {
      right(negate(distance));
      return;
    }
    move(distance, (long) heading - 90);
  }

  @Override public void right(int distance) {
    if (distance < 0) {
      // The magnitude is not negated; left negates it in turn.
      left(distance);
      return;
    }
    move(distance, (long) heading + 90);
  }

  @Override public void setPenColor(int code) {
    final PenColor penColor = PenColor.of(code);
    if (penColor == null) {
      throw LogoRuntimeException.invalidArgument("SETPENCOLOR",
          Integer.toString(code), PenColor.RANGE_DESCRIPTION);
    }
    this.color = penColor;
  }

  @Override public void turn(int degrees) {
    try {
      heading = Math.addExact(heading, degrees);
    } catch (ArithmeticException e) {
      throw LogoRuntimeException.overflow();
    }
  }

  @Override public void setHeading(int degrees) {
    heading = degrees;
  }

  @Override public void setX(int x) {
    this.x = x;
  }

  @Override public void setY(int y) {
    this.y = y;
  }

  @Override public int getX() {
    return x;
  }

  @Override public int getY() {
    return y;
  }

  @Override public int getHeading() {
    return heading;
  }

  @Override public int getPenColor() {
    return color.ordinal();
  }

  @Override public void saveImage(File file) {
    final String extension = Files.getFileExtension(file.getName());
    try {
      switch (extension) {
        case "svg":
          canvas.writeSvg(file);
          break;
        case "png":
          canvas.writePng(file);
          break;
        default:
          throw LogoRuntimeException.imageSaveError(
              "File extension not supported", null);
      }
    } catch (IOException e) {
      throw LogoRuntimeException.imageSaveError(e.toString(), e);
    }
  }

  /** Moves {@code distance} pixels in {@code direction} degrees clockwise
   * from north, drawing a line if the pen is down. */
  private void move(int distance, long direction) {
    final double radians = Math.toRadians(direction - 90);
    final long x1 = x + Math.round(distance * Math.cos(radians));
    final long y1 = y + Math.round(distance * Math.sin(radians));
    if (x1 != (int) x1 || y1 != (int) y1) {
      throw LogoRuntimeException.drawError("end point (" + x1 + ", " + y1
          + ") is out of range");
    }
    if (penDown) {
      canvas.drawLine(x, y, (int) x1, (int) y1, color);
    }
    x = (int) x1;
    y = (int) y1;
  }

  private static int negate(int distance) {
    try {
      return Math.negateExact(distance);
    } catch (ArithmeticException e) {
      throw LogoRuntimeException.overflow();
    }
  }
}

// End ImageTurtle.java
