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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.helper.ArrayHelper;
import net.larse.forestloss.helper.ConfigException;
import net.larse.forestloss.helper.DataException;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.landsat.CanonicalBand;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.Observation;
import net.larse.forestloss.timeseries.TimeSeries;
import net.larse.forestloss.timeseries.TimeSeriesUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.IntStream;

/**
 * Reduces a harmonized multi-sensor series to one composite per calendar year by medoid
 * selection, as in the LandTrendr surface reflectance collection builder:
 * Kennedy, R.E., Yang, Z., Gorelick, N., Braaten, J., Cavalcante, L., Cohen, W.B., Healey, S.
 * (2018). Implementation of the LandTrendr Algorithm on Google Earth Engine. Remote Sensing, 10,
 * 691.
 *
 * <p>For every year present in the series, the images inside the seasonal window are reduced to a
 * per-band median, and each pixel takes the complete band vector of the observation closest to
 * that median. Unlike a per-band median composite, the result is always an observed spectrum.
 */
public class YearlyMedoidCompositor {
  private static final Logger logger = LoggerFactory.getLogger(YearlyMedoidCompositor.class);

  private static final ImmutableList<String> BANDS = CanonicalBand.names();

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "The first day (inclusive) of the seasonal window, as MM-dd.")
    @Optional
    public MonthDay startDay = MonthDay.of(6, 20);

    @Doc(help = "The last day (inclusive) of the seasonal window, as MM-dd. Must not precede "
        + "startDay; windows crossing the year end are not supported.")
    @Optional
    public MonthDay endDay = MonthDay.of(9, 10);

    @Doc(help = "Process image rows in parallel.")
    @Optional
    public boolean parallel = true;
  }

  private final Args args;

  public YearlyMedoidCompositor() {
    this(new Args());
  }

  public YearlyMedoidCompositor(Args args) {
    TimeSeriesUtils.checkWindow(args.startDay, args.endDay);
    this.args = args;
  }

  /**
   * Composite every year of the series. Years are processed in order; an interrupt between two
   * years stops the run with a {@link CancellationException}.
   */
  public CompositeCollection composite(TimeSeries series) {
    List<Image> composites = Lists.newArrayList();
    List<DataException> problems = Lists.newArrayList();
    if (series.isEmpty()) {
      return new CompositeCollection(composites, problems);
    }

    // The set of years is global to the area, not per pixel.
    int[] years = TimeSeriesUtils.distinctYears(series);
    for (int year : years) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("Compositing cancelled before " + year);
      }
      LocalDate start = TimeSeriesUtils.windowStart(year, args.startDay);
      LocalDate end = TimeSeriesUtils.windowEnd(year, args.endDay);
      TimeSeries selected = series.filterDate(start, end);

      if (selected.isEmpty()) {
        EmptyYearException problem = new EmptyYearException(year, start, end.minusDays(1));
        logger.warn(problem.getMessage());
        problems.add(problem);
        composites.add(Image.noData(series.getGeometry(), BANDS, LocalDate.of(year, 1, 1)));
        continue;
      }

      logger.info("Compositing {} from {} images", year, selected.size());
      composites.add(compositeYear(selected, year));
    }
    return new CompositeCollection(composites, problems);
  }

  /** Medoid composite of images that all belong to one year's window. */
  @VisibleForTesting
  Image compositeYear(TimeSeries selected, int year) {
    GridGeometry geometry = selected.getGeometry();
    int nObs = selected.size();

    // [observation][band] -> samples
    double[][][] samples = new double[nObs][BANDS.size()][];
    for (int o = 0; o < nObs; o++) {
      Raster raster = selected.get(o).getRaster();
      for (int b = 0; b < BANDS.size(); b++) {
        if (!raster.hasBand(BANDS.get(b))) {
          throw new ConfigException(String.format(
              "%s lacks canonical band %s; harmonize before compositing", selected.get(o),
              BANDS.get(b)));
        }
        samples[o][b] = raster.getBand(BANDS.get(b));
      }
    }

    Raster result = new Raster(geometry, BANDS);
    IntStream rows = IntStream.range(0, geometry.height);
    if (args.parallel) {
      rows = rows.parallel();
    }
    rows.forEach(y -> {
      double[] values = new double[BANDS.size()];
      List<Observation> observations = Lists.newArrayListWithCapacity(nObs);
      for (int x = 0; x < geometry.width; x++) {
        int index = y * geometry.width + x;
        observations.clear();
        for (int o = 0; o < nObs; o++) {
          for (int b = 0; b < BANDS.size(); b++) {
            values[b] = samples[o][b][index];
          }
          Image image = selected.get(o);
          observations.add(new Observation(values, image.getDate(), image.getSensor()));
        }
        int medoid = MedoidSolver.getResult(observations);
        if (medoid < 0) {
          continue;
        }
        Observation chosen = observations.get(medoid);
        for (int b = 0; b < BANDS.size(); b++) {
          result.getBand(b)[index] = chosen.getBand(b);
        }
      }
    });
    return new Image(result, LocalDate.of(year, 1, 1), null);
  }

  /** The per-pixel medoid selection. */
  @VisibleForTesting
  public static final class MedoidSolver {
    private MedoidSolver() {}

    /**
     * Select the medoid of one pixel's observations.
     *
     * @param observations ordered by acquisition, so that the first of several equally close
     *     observations is the earliest one.
     * @return the index of the selected observation, or -1 when no observation is valid.
     */
    public static int getResult(List<Observation> observations) {
      double[] median = median(observations);

      int best = -1;
      double bestDistance = Double.POSITIVE_INFINITY;
      for (int o = 0; o < observations.size(); o++) {
        Observation observation = observations.get(o);
        if (!observation.isValid()) {
          continue;
        }
        double distance = ArrayHelper.squaredDistance(observation.getBands(), median);
        if (distance < bestDistance) {
          bestDistance = distance;
          best = o;
        }
      }
      return best;
    }

    /** Per-band median over the observations that are valid in that band. */
    public static double[] median(List<Observation> observations) {
      int nBands = observations.isEmpty() ? 0 : observations.get(0).getBandCount();
      double[] median = new double[nBands];
      double[] column = new double[observations.size()];
      for (int b = 0; b < nBands; b++) {
        for (int o = 0; o < observations.size(); o++) {
          column[o] = observations.get(o).getBand(b);
        }
        median[b] = ArrayHelper.median(column);
      }
      return median;
    }
  }
}
