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

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.helper.EEArray;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the most recent qualifying disturbance segment of each pixel and flattens it into one
 * output channel per segment field.
 */
public class DisturbanceEventSelector {
  private static final Logger logger = LoggerFactory.getLogger(DisturbanceEventSelector.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Earliest accepted segment start year (inclusive).")
    @Optional
    public int startYear = 1985;

    @Doc(help = "Latest accepted segment end year (inclusive).")
    @Optional
    public int endYear = 2020;

    @Doc(help = "Minimum magnitude to rmse ratio of an accepted segment.")
    @Optional
    public double dsnrThreshold = 0.0;
  }

  private final Args args;

  public DisturbanceEventSelector() {
    this(new Args());
  }

  public DisturbanceEventSelector(Args args) {
    Preconditions.checkArgument(args.startYear <= args.endYear,
        "startYear %s is after endYear %s", args.startYear, args.endYear);
    this.args = args;
  }

  /** Select the events of every pixel into an 8-band raster named after {@link Segment#FIELDS}. */
  public Raster select(EEArray[] segments, GridGeometry geometry) {
    Preconditions.checkArgument(segments.length == geometry.size(),
        "%s segment arrays for %s", segments.length, geometry);
    Raster result = new Raster(geometry, Segment.FIELDS);
    int found = 0;
    for (int i = 0; i < segments.length; i++) {
      if (segments[i] == null) {
        continue;
      }
      EEArray event = getResult(segments[i], args.startYear, args.endYear, args.dsnrThreshold);
      if (event.cols() == 0) {
        continue;
      }
      found++;
      for (int b = 0; b < Segment.FIELDS.size(); b++) {
        result.getBand(b)[i] = event.get(b, 0);
      }
    }
    logger.info("Found disturbances in {} of {} pixels between {} and {} with dsnr >= {}",
        found, segments.length, args.startYear, args.endYear, args.dsnrThreshold);
    return result;
  }

  /**
   * Filter one pixel's 8 x n segment array and keep the segment with the latest start year.
   * Segments sharing a start year keep their order, so the earlier one wins.
   *
   * @return an 8 x 1 array, or 8 x 0 when no segment qualifies.
   */
  public static EEArray getResult(EEArray segments, double lo, double hi, double dsnrThreshold) {
    Preconditions.checkArgument(segments.rows() == Segment.FIELDS.size(),
        "segments must have %s rows, got %s", Segment.FIELDS.size(), segments.rows());
    double[] start = segments.row(Segment.START_YEAR);
    double[] end = segments.row(Segment.END_YEAR);
    double[] dsnr = segments.row(Segment.DSNR);

    // NaN fails every comparison, so a segment without a dsnr never qualifies.
    double[] keep = new double[segments.cols()];
    for (int j = 0; j < keep.length; j++) {
      keep[j] = start[j] >= lo && end[j] <= hi && dsnr[j] >= dsnrThreshold ? 1 : 0;
    }
    EEArray filtered = segments.mask(new EEArray(keep, 1, keep.length));

    double[] sortKeys = filtered.slice(0, Segment.START_YEAR, Segment.START_YEAR + 1)
        .multiply(-1)
        .row(0);
    return filtered.sort(sortKeys).slice(1, 0, 1);
  }
}
