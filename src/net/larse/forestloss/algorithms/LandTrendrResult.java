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

package net.larse.forestloss.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.EEArray;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.PixelType;

import java.util.List;

/**
 * Output of an externally run LandTrendr fit over a grid. Each pixel holds the fitter's native
 * 4 x nYears array: the first two rows are the original X and Y values, the third row contains
 * the Y values fitted to the estimated segments, and the 4th row contains a 1 if a corresponding
 * point was used as a segment vertex or 0 if not. Alongside it, the fit's rmse per pixel.
 *
 * <p>Pixels the fitter skipped hold a null array and a NaN rmse.
 */
public class LandTrendrResult {
  public static final int YEAR_ROW = 0;
  public static final int SOURCE_ROW = 1;
  public static final int FITTED_ROW = 2;
  public static final int VERTEX_ROW = 3;

  private final GridGeometry geometry;
  private final EEArray[] fits;
  private final double[] rmse;

  public LandTrendrResult(GridGeometry geometry, EEArray[] fits, double[] rmse) {
    Preconditions.checkArgument(fits.length == geometry.size() && rmse.length == geometry.size(),
        "%s fits and %s rmse values for %s", fits.length, rmse.length, geometry);
    for (EEArray fit : fits) {
      Preconditions.checkArgument(fit == null || fit.rows() == 4,
          "a LandTrendr fit has 4 rows, got %s", fit == null ? 0 : fit.rows());
    }
    this.geometry = geometry;
    this.fits = fits;
    this.rmse = rmse;
  }

  /**
   * Pack one pixel's fit into the 4-row layout.
   *
   * @param vertices indices into {@code x} of the points used as segment vertices.
   */
  public static EEArray toArray(double[] x, double[] y, double[] yFitted, List<Integer> vertices) {
    Preconditions.checkArgument(x.length == y.length && x.length == yFitted.length,
        "x, y and yFitted differ in length");
    EEArray.Builder result = EEArray.builder(PixelType.DOUBLE, 4, x.length);
    for (int i = 0; i < x.length; i++) {
      result.setDouble(x[i], YEAR_ROW, i);
      result.setDouble(y[i], SOURCE_ROW, i);
      result.setDouble(yFitted[i], FITTED_ROW, i);
    }
    for (int vertex : vertices) {
      result.setDouble(1.0, VERTEX_ROW, vertex);
    }
    return result.build();
  }

  public GridGeometry getGeometry() {
    return geometry;
  }

  /** The fit of one pixel, or null if the fitter produced none. */
  public EEArray getFit(int index) {
    return fits[index];
  }

  public double getRmse(int index) {
    return rmse[index];
  }

  /**
   * The vertices of one pixel as a 2 x k array: row 0 the vertex years, row 1 the fitted values.
   * A pixel without a fit has no vertices.
   */
  public EEArray getVertices(int index) {
    EEArray fit = fits[index];
    if (fit == null) {
      return new EEArray(new double[0], 2, 0);
    }
    EEArray flagged = fit.mask(fit.slice(0, VERTEX_ROW, VERTEX_ROW + 1));
    return EEArray.cat(ImmutableList.of(
        flagged.slice(0, YEAR_ROW, YEAR_ROW + 1),
        flagged.slice(0, FITTED_ROW, FITTED_ROW + 1)));
  }
}
