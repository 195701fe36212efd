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

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.helper.EEArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Turns the vertices of a fitted trend into per-segment features.
 *
 * <p>For consecutive vertices (v_i, v_i+1) the segment starts in the first full year after v_i and
 * ends in the year of v_i+1. With {@code dir} the disturbance direction of the index (or +1 when
 * orientation correction is off), start and end values are multiplied by {@code dir} so that
 * they read in the index's natural orientation. The magnitude is multiplied again and so keeps the
 * orientation of the fitted trend, in which vegetation loss is an increase: disturbances have a
 * positive magnitude and dsnr.
 */
public class SegmentFeatureExtractor {
  private static final Logger logger = LoggerFactory.getLogger(SegmentFeatureExtractor.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "The index the trend was fitted on; its disturbance direction orients the values.")
    @Required
    public String index = "NBR";

    @Doc(help = "Flip values by the index's disturbance direction. If false, the direction is "
        + "taken as +1.")
    @Optional
    public boolean orientationCorrection = true;
  }

  private final double direction;

  public SegmentFeatureExtractor() {
    this(new Args());
  }

  public SegmentFeatureExtractor(Args args) {
    args.checkRequired();
    SpectralIndex index = SpectralIndex.forName(args.index);
    this.direction = args.orientationCorrection ? index.getDisturbanceDirection() : 1;
  }

  public double getDirection() {
    return direction;
  }

  /** Segment arrays for every pixel of a fit; pixels with fewer than two vertices have none. */
  public EEArray[] extract(LandTrendrResult fit) {
    int size = fit.getGeometry().size();
    logger.info("Extracting segments for {} pixels, direction {}", size, direction);
    EEArray[] segments = new EEArray[size];
    IntStream.range(0, size).parallel().forEach(
        i -> segments[i] = getSegmentData(fit.getVertices(i), fit.getRmse(i), direction));
    return segments;
  }

  /** The segments of one pixel. */
  public List<Segment> segments(EEArray vertices, double rmse) {
    return Segment.fromArray(getSegmentData(vertices, rmse, direction));
  }

  /**
   * Compute the 8 x (N-1) segment array of one pixel. Rows follow {@link Segment#FIELDS}.
   *
   * @param vertices 2 x N array, row 0 vertex years (non-decreasing), row 1 fitted values.
   * @param rmse the fit's residual error; dsnr is NaN when it is 0 or NaN.
   * @param dir the disturbance direction, -1 or +1.
   */
  public static EEArray getSegmentData(EEArray vertices, double rmse, double dir) {
    Preconditions.checkArgument(vertices.rows() == 2,
        "vertices must be a 2 x N array, got %s rows", vertices.rows());
    double[] years = vertices.row(0);
    for (int i = 1; i < years.length; i++) {
      Preconditions.checkArgument(years[i] >= years[i - 1],
          "vertex years decrease: %s after %s", years[i], years[i - 1]);
    }
    if (vertices.cols() < 2) {
      return new EEArray(new double[0], Segment.FIELDS.size(), 0);
    }

    EEArray left = vertices.slice(1, 0, -1);
    EEArray right = vertices.slice(1, 1);

    EEArray startYear = left.slice(0, 0, 1).add(1);
    EEArray endYear = right.slice(0, 0, 1);
    EEArray startVal = left.slice(0, 1, 2).multiply(dir);
    EEArray endVal = right.slice(0, 1, 2).multiply(dir);
    // Equal vertex years would give -1; there is no negative length.
    EEArray duration = endYear.subtract(startYear).max(0);
    EEArray magnitude = endVal.subtract(startVal).multiply(dir);
    EEArray rate = magnitude.divide(duration);
    EEArray dsnr = magnitude.divide(rmse);

    return EEArray.cat(ImmutableList.of(
        startYear, endYear, startVal, endVal, magnitude, duration, rate, dsnr));
  }
}
