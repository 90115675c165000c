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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.awt.BasicStroke;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Drawing surface that records the lines drawn on it, and renders them as
 * SVG or PNG.
 *
 * <p>The background is black. Lines may extend beyond the edges of the
 * surface; they are clipped when rendered.
 */
public class Canvas {
  public final int width;
  public final int height;
  private final List<Line> lines = new ArrayList<>();

  /** Creates a Canvas. */
  public Canvas(int width, int height) {
    checkArgument(width > 0 && height > 0, "invalid size %sx%s", width,
        height);
    this.width = width;
    this.height = height;
  }

  /** Draws a line. */
  public void drawLine(int x0, int y0, int x1, int y1, PenColor color) {
    lines.add(new Line(x0, y0, x1, y1, color));
  }

  /** Returns the lines drawn so far, oldest first. */
  public List<Line> lines() {
    return ImmutableList.copyOf(lines);
  }

  /** Renders as an SVG document. */
  public String toSvg() {
    final StringBuilder b = new StringBuilder();
    b.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"")
        .append(width).append("\" height=\"").append(height)
        .append("\" viewBox=\"0 0 ").append(width).append(' ').append(height)
        .append("\">\n");
    b.append("<rect width=\"100%\" height=\"100%\" fill=\"black\"/>\n");
    for (Line line : lines) {
      b.append("<line x1=\"").append(line.x0)
          .append("\" y1=\"").append(line.y0)
          .append("\" x2=\"").append(line.x1)
          .append("\" y2=\"").append(line.y1)
          .append("\" stroke=\"").append(line.color.toSvg())
          .append("\" stroke-width=\"1\"/>\n");
    }
    return b.append("</svg>\n").toString();
  }

  /** Renders as an image. */
  public BufferedImage toImage() {
    final BufferedImage image =
        new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    final Graphics2D g = image.createGraphics();
    try {
      g.setColor(PenColor.BLACK.toAwt());
      g.fillRect(0, 0, width, height);
      g.setStroke(new BasicStroke(1));
      for (Line line : lines) {
        g.setColor(line.color.toAwt());
        g.drawLine(line.x0, line.y0, line.x1, line.y1);
      }
    } finally {
      g.dispose();
    }
    return image;
  }

  /** Writes an SVG file. */
  public void writeSvg(File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(toSvg());
  }

  /** Writes a PNG file. */
  public void writePng(File file) throws IOException {
    if (!ImageIO.write(toImage(), "png", file)) {
      throw new IOException("no writer for PNG format");
    }
  }

  /** A line segment. */
  public static class Line {
    public final int x0;
    public final int y0;
    public final int x1;
    public final int y1;
    public final PenColor color;

    Line(int x0, int y0, int x1, int y1, PenColor color) {
      this.x0 = x0;
      this.y0 = y0;
      this.x1 = x1;
      this.y1 = y1;
      this.color = requireNonNull(color);
    }

    @Override public String toString() {
      return "(" + x0 + ", " + y0 + ") -> (" + x1 + ", " + y1 + ") "
          + color;
    }
  }
}

// End Canvas.java
