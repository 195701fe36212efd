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

package net.larse.forestloss.landsat;

import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;

/**
 * Resamples rasters onto another grid. Sample positions are pixel centres; positions outside the
 * source grid are clamped to its edge.
 */
public class Resampler {
  // Offsets closer than this to a pixel centre are snapped onto it, so that aligned grids
  // reproduce the source samples exactly.
  private static final double SNAP = 1e-9;

  public enum Interpolation {
    NEAREST,
    BILINEAR
  }

  private Resampler() {}

  /** Resample one band. Identical grids give a plain copy. */
  public static double[] resample(Raster source, int band, GridGeometry target,
      Interpolation interpolation) {
    GridGeometry src = source.getGeometry();
    double[] values = source.getBand(band);
    if (src.equals(target)) {
      return values.clone();
    }

    double[] result = new double[target.size()];
    for (int y = 0; y < target.height; y++) {
      double fy = snap((target.centerY(y) - src.uly) / src.pixelY - 0.5);
      for (int x = 0; x < target.width; x++) {
        double fx = snap((target.centerX(x) - src.ulx) / src.pixelX - 0.5);
        result[y * target.width + x] = interpolation == Interpolation.NEAREST
            ? nearest(values, src, fx, fy)
            : bilinear(values, src, fx, fy);
      }
    }
    return result;
  }

  /** Resample every band of a raster with the same interpolation. */
  public static Raster resample(Raster source, GridGeometry target, Interpolation interpolation) {
    double[][] bands = new double[source.getBandCount()][];
    for (int b = 0; b < bands.length; b++) {
      bands[b] = resample(source, b, target, interpolation);
    }
    return new Raster(target, source.getBandNames(), bands);
  }

  private static double nearest(double[] values, GridGeometry src, double fx, double fy) {
    int x = clamp((int) Math.round(fx), src.width);
    int y = clamp((int) Math.round(fy), src.height);
    return values[y * src.width + x];
  }

  /** No-data in any neighbour with a non-zero weight makes the result no-data. */
  private static double bilinear(double[] values, GridGeometry src, double fx, double fy) {
    int x0 = (int) Math.floor(fx);
    int y0 = (int) Math.floor(fy);
    double wx = fx - x0;
    double wy = fy - y0;

    double sum = 0.0;
    for (int dy = 0; dy <= 1; dy++) {
      double weightY = dy == 0 ? 1.0 - wy : wy;
      if (weightY == 0.0) {
        continue;
      }
      int y = clamp(y0 + dy, src.height);
      for (int dx = 0; dx <= 1; dx++) {
        double weightX = dx == 0 ? 1.0 - wx : wx;
        if (weightX == 0.0) {
          continue;
        }
        int x = clamp(x0 + dx, src.width);
        double value = values[y * src.width + x];
        if (Raster.isNoData(value)) {
          return Raster.NO_DATA;
        }
        sum += weightX * weightY * value;
      }
    }
    return sum;
  }

  private static double snap(double f) {
    double rounded = Math.rint(f);
    return Math.abs(f - rounded) < SNAP ? rounded : f;
  }

  private static int clamp(int i, int length) {
    return Math.max(0, Math.min(length - 1, i));
  }
}
