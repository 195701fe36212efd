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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.helper.ConfigException;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.timeseries.ArchiveMerger;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.TimeSeries;
import net.larse.forestloss.timeseries.TimeSeriesUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;

/**
 * Builds the combined TM-equivalent collection: every configured Landsat sensor is fetched over
 * the same area and date range, harmonized and merged into one chronological series.
 */
public class LandsatCollectionBuilder {
  private static final Logger logger = LoggerFactory.getLogger(LandsatCollectionBuilder.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "The first year (inclusive) to get data.")
    @Optional
    public int startYear = 1985;

    @Doc(help = "The first day (inclusive) to get data, as MM-dd.")
    @Optional
    public MonthDay startDay = MonthDay.of(6, 20);

    @Doc(help = "The last year (inclusive) to get data.")
    @Optional
    public int endYear = 2020;

    @Doc(help = "The last day (inclusive) to get data, as MM-dd.")
    @Optional
    public MonthDay endDay = MonthDay.of(9, 10);

    @Doc(help = "Sensors to combine, by archive name.")
    @Optional
    public List<String> sensors = ImmutableList.of("LT05", "LE07", "LC08");
  }

  private final Args args;
  private final SensorHarmonizer harmonizer;

  public LandsatCollectionBuilder(Args args, SensorHarmonizer harmonizer) {
    Preconditions.checkArgument(args.startYear <= args.endYear,
        "startYear %s is after endYear %s", args.startYear, args.endYear);
    this.args = args;
    this.harmonizer = harmonizer;
  }

  /** The request issued for one sensor; the end day is included by advancing one day. */
  public ArchiveRequest request(Sensor sensor, GridGeometry aoi) {
    LocalDate start = TimeSeriesUtils.windowStart(args.startYear, args.startDay);
    LocalDate end = TimeSeriesUtils.windowEnd(args.endYear, args.endDay);
    return new ArchiveRequest(sensor, aoi, start, end);
  }

  /**
   * Fetch, harmonize and merge all configured sensors. Every image is aligned to the grid of the
   * area, whatever grid the harmonizer was configured with.
   *
   * @throws IOException if the archive fails; nothing is retried here.
   */
  public TimeSeries build(ArchiveProvider provider, GridGeometry aoi) throws IOException {
    SensorHarmonizer aligned = harmonizer.onGrid(aoi);
    List<TimeSeries> harmonized = Lists.newArrayList();
    for (Sensor sensor : sensors()) {
      ArchiveRequest request = request(sensor, aoi);
      List<Image> raw = provider.fetch(request);
      logger.info("Fetched {} images for {}", raw.size(), request);
      harmonized.add(aligned.harmonize(raw));
    }
    return ArchiveMerger.merge(harmonized);
  }

  private List<Sensor> sensors() {
    List<Sensor> sensors = Lists.newArrayList();
    for (String name : args.sensors) {
      try {
        sensors.add(Sensor.valueOf(name));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Unknown sensor " + name);
      }
    }
    return sensors;
  }
}
