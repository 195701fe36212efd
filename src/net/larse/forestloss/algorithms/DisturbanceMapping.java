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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.helper.EEArray;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.landsat.ArchiveProvider;
import net.larse.forestloss.landsat.LandsatCollectionBuilder;
import net.larse.forestloss.landsat.SensorHarmonizer;
import net.larse.forestloss.timeseries.TimeSeries;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.MonthDay;
import java.util.List;

/**
 * Forest disturbance mapping with LandTrendr, end to end except for the trend fit itself:
 * yearly medoid composites from the combined Landsat archive, the index series the fitter runs
 * on, and the most recent qualifying disturbance per pixel from the fitter's output.
 */
public class DisturbanceMapping {
  private static final Logger logger = LoggerFactory.getLogger(DisturbanceMapping.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "The first year (inclusive) to get data.")
    @Optional
    public int startYear = 1985;

    @Doc(help = "The first day (inclusive) of every year's window, as MM-dd.")
    @Optional
    public MonthDay startDay = MonthDay.of(6, 20);

    @Doc(help = "The last year (inclusive) to get data.")
    @Optional
    public int endYear = 2020;

    @Doc(help = "The last day (inclusive) of every year's window, as MM-dd.")
    @Optional
    public MonthDay endDay = MonthDay.of(9, 10);

    @Doc(help = "The spectral index LandTrendr runs on. Supported values are NDVI and NBR.")
    @Required
    public String index = "NBR";

    @Doc(help = "Additional bands to include in the LandTrendr input.")
    @Optional
    public List<String> ftvBands = ImmutableList.of();

    @Doc(help = "The earliest start year (inclusive) of an accepted disturbance. If unspecified, "
        + "startYear.")
    @Optional
    public Integer eventStartYear = null;

    @Doc(help = "The latest end year (inclusive) of an accepted disturbance. If unspecified, "
        + "endYear.")
    @Optional
    public Integer eventEndYear = null;

    @Doc(help = "The threshold on the disturbance signal-to-noise ratio of a segment.")
    @Optional
    public double dsnrThreshold = 0.0;
  }

  private final LandsatCollectionBuilder collectionBuilder;
  private final YearlyMedoidCompositor compositor;
  private final IndexBandBuilder indexBuilder;
  private final SegmentFeatureExtractor extractor;
  private final DisturbanceEventSelector selector;

  public DisturbanceMapping(Args args) {
    this(args, new SensorHarmonizer());
  }

  public DisturbanceMapping(Args args, SensorHarmonizer harmonizer) {
    args.checkRequired();

    LandsatCollectionBuilder.Args collectionArgs = new LandsatCollectionBuilder.Args();
    collectionArgs.startYear = args.startYear;
    collectionArgs.startDay = args.startDay;
    collectionArgs.endYear = args.endYear;
    collectionArgs.endDay = args.endDay;
    this.collectionBuilder = new LandsatCollectionBuilder(collectionArgs, harmonizer);

    YearlyMedoidCompositor.Args compositeArgs = new YearlyMedoidCompositor.Args();
    compositeArgs.startDay = args.startDay;
    compositeArgs.endDay = args.endDay;
    this.compositor = new YearlyMedoidCompositor(compositeArgs);

    IndexBandBuilder.Args indexArgs = new IndexBandBuilder.Args();
    indexArgs.index = args.index;
    indexArgs.ftvBands = args.ftvBands;
    this.indexBuilder = new IndexBandBuilder(indexArgs);

    SegmentFeatureExtractor.Args segmentArgs = new SegmentFeatureExtractor.Args();
    segmentArgs.index = args.index;
    segmentArgs.orientationCorrection = true;
    this.extractor = new SegmentFeatureExtractor(segmentArgs);

    DisturbanceEventSelector.Args selectorArgs = new DisturbanceEventSelector.Args();
    selectorArgs.startYear = MoreObjects.firstNonNull(args.eventStartYear, args.startYear);
    selectorArgs.endYear = MoreObjects.firstNonNull(args.eventEndYear, args.endYear);
    selectorArgs.dsnrThreshold = args.dsnrThreshold;
    this.selector = new DisturbanceEventSelector(selectorArgs);
  }

  /**
   * Yearly medoid composites of Landsat 5, 7 and 8 over an area.
   *
   * @throws IOException if the archive fails.
   */
  public CompositeCollection buildSurfaceReflectanceCollection(ArchiveProvider provider,
      GridGeometry aoi) throws IOException {
    TimeSeries combined = collectionBuilder.build(provider, aoi);
    logger.info("Combined collection holds {} images", combined.size());
    return compositor.composite(combined);
  }

  /** The LandTrendr input: index band first, then the fitting bands. */
  public TimeSeries buildTrendInput(TimeSeries composites) {
    return indexBuilder.build(composites);
  }

  /** The most recent qualifying disturbance of each pixel, one band per segment field. */
  public Raster extractDisturbances(LandTrendrResult fit) {
    EEArray[] segments = extractor.extract(fit);
    return selector.select(segments, fit.getGeometry());
  }
}
