/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.forestloss.helper;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * The placement of a pixel grid in map coordinates: the upper-left corner, the pixel sizes (pixelY
 * is normally negative) and the grid dimensions.
 */
public final class GridGeometry {
  public final double ulx;
  public final double uly;
  public final double pixelX;
  public final double pixelY;
  public final int width;
  public final int height;

  public GridGeometry(double ulx, double uly, double pixelX, double pixelY, int width, int height) {
    Preconditions.checkArgument(pixelX != 0 && pixelY != 0, "pixel size must be non-zero");
    Preconditions.checkArgument(width > 0 && height > 0, "grid must not be empty");
    this.ulx = ulx;
    this.uly = uly;
    this.pixelX = pixelX;
    this.pixelY = pixelY;
    this.width = width;
    this.height = height;
  }

  /** A unit grid anchored at the origin, for callers that only care about pixel indices. */
  public static GridGeometry ofSize(int width, int height) {
    return new GridGeometry(0, 0, 1, -1, width, height);
  }

  public int size() {
    return width * height;
  }

  /** Map x of the centre of column x. */
  public double centerX(int x) {
    return ulx + (x + 0.5) * pixelX;
  }

  /** Map y of the centre of row y. */
  public double centerY(int y) {
    return uly + (y + 0.5) * pixelY;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof GridGeometry)) {
      return false;
    }
    GridGeometry g = (GridGeometry) o;
    return ulx == g.ulx && uly == g.uly && pixelX == g.pixelX && pixelY == g.pixelY
        && width == g.width && height == g.height;
  }

  @Override
  public int hashCode() {
    return Objects.hash(ulx, uly, pixelX, pixelY, width, height);
  }

  @Override
  public String toString() {
    return String.format("GridGeometry[%dx%d @ (%s, %s), pixel %s x %s]",
        width, height, ulx, uly, pixelX, pixelY);
  }
}
