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

import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.helper.ConfigException;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.TimeSeries;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Prepares yearly composites for LandTrendr. Each output image starts with the spectral index
 * band, oriented so that an increase means vegetation loss and scaled by 1000, followed by the
 * requested fitting bands copied unchanged under an {@code ftv_} prefix.
 */
public class IndexBandBuilder {
  private static final Logger logger = LoggerFactory.getLogger(IndexBandBuilder.class);

  public static final String FTV_PREFIX = "ftv_";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "The spectral index to segment. Supported values are NDVI and NBR.")
    @Required
    public String index = "NBR";

    @Doc(help = "Additional canonical bands to carry along as fitted-to-vertex bands.")
    @Optional
    public List<String> ftvBands = ImmutableList.of();
  }

  private final SpectralIndex index;
  private final ImmutableList<String> ftvBands;

  /**
   * @throws UnrecognizedIndexException if args.index is not a standard index.
   * @throws UnimplementedIndexException if args.index is known but not supported.
   */
  public IndexBandBuilder(Args args) {
    args.checkRequired();
    this.index = SpectralIndex.forName(args.index);
    this.ftvBands = ImmutableList.copyOf(args.ftvBands);
  }

  public SpectralIndex getIndex() {
    return index;
  }

  /** Band names of every output image, index band first. */
  public ImmutableList<String> outputBands() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    names.add(index.name());
    for (String band : ftvBands) {
      names.add(FTV_PREFIX + band);
    }
    return names.build();
  }

  public TimeSeries build(TimeSeries composites) {
    logger.info("Building {} series with {} fitting bands from {} composites", index,
        ftvBands.size(), composites.size());
    return composites.map(this::build);
  }

  public Image build(Image composite) {
    Raster raster = composite.getRaster();
    for (String band : ftvBands) {
      if (!raster.hasBand(band)) {
        throw new ConfigException(String.format("Fitting band %s is not in %s", band,
            raster.getBandNames()));
      }
    }

    double[] first = raster.getBand(index.getFirst().name());
    double[] second = raster.getBand(index.getSecond().name());
    double scale = index.getDisturbanceDirection() * 1000;

    double[][] bands = new double[1 + ftvBands.size()][];
    bands[0] = new double[first.length];
    for (int i = 0; i < first.length; i++) {
      bands[0][i] = normalizedDifference(first[i], second[i]) * scale;
    }
    for (int f = 0; f < ftvBands.size(); f++) {
      bands[f + 1] = raster.getBand(ftvBands.get(f)).clone();
    }
    return composite.withRaster(new Raster(raster.getGeometry(), outputBands(), bands));
  }

  /**
   * (a - b) / (a + b); no-data when an input is no-data or negative, or the sum is zero. Inputs
   * are reflectances, so the result stays within [-1, 1].
   */
  static double normalizedDifference(double a, double b) {
    double sum = a + b;
    if (Raster.isNoData(sum) || a < 0 || b < 0 || sum == 0.0) {
      return Raster.NO_DATA;
    }
    return (a - b) / sum;
  }
}
