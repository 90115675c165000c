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

import java.awt.Color;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Colors of the pen.
 *
 * <p>The code of a color is its ordinal; the palette is the standard
 * 16-color palette of UCB Logo.
 */
public enum PenColor {
  BLACK(0, 0, 0),
  BLUE(0, 0, 255),
  GREEN(0, 255, 0),
  CYAN(0, 255, 255),
  RED(255, 0, 0),
  MAGENTA(255, 0, 255),
  YELLOW(255, 255, 0),
  WHITE(255, 255, 255),
  BROWN(155, 96, 59),
  TAN(197, 136, 18),
  FOREST(100, 162, 64),
  AQUA(120, 187, 187),
  SALMON(255, 149, 119),
  PURPLE(144, 113, 208),
  ORANGE(255, 163, 0),
  GREY(183, 183, 183);

  /** Describes the valid codes, for use in error messages. */
  public static final String RANGE_DESCRIPTION =
      "an integer between 0 and " + (values().length - 1);

  public final int red;
  public final int green;
  public final int blue;

  PenColor(int red, int green, int blue) {
    this.red = red;
    this.green = green;
    this.blue = blue;
  }

  /** Returns the color with a given code, or null if the code is out of
   * range. */
  public static @Nullable PenColor of(int code) {
    final PenColor[] values = values();
    return code >= 0 && code < values.length ? values[code] : null;
  }

  public Color toAwt() {
    return new Color(red, green, blue);
  }

  /** Returns the color in the form used by SVG, for example
   * "rgb(255, 0, 0)". */
  public String toSvg() {
    return "rgb(" + red + ", " + green + ", " + blue + ")";
  }
}

// End PenColor.java
