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

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.helper.ConfigException;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.PixelType;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.TimeSeries;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Normalizes raw Landsat surface reflectance images into the canonical six-band representation.
 *
 * <p>Each image is resampled onto the target grid, cleared of water, cloud shadow, snow and cloud
 * pixels using its pixel_qa band, reduced to the mapped bands renamed to canonical names and, for
 * OLI, transformed to ETM+ equivalent values stored as 16-bit integers.
 */
public class SensorHarmonizer {
  private static final Logger logger = LoggerFactory.getLogger(SensorHarmonizer.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Interpolation used when aligning the reflective bands to the target grid.")
    @Optional
    public Resampler.Interpolation interpolation = Resampler.Interpolation.BILINEAR;

    @Doc(help = "Grid all images are aligned to. If unspecified, each image keeps its own grid.")
    @Optional
    public GridGeometry targetGeometry = null;
  }

  private final Args args;

  public SensorHarmonizer() {
    this(new Args());
  }

  public SensorHarmonizer(Args args) {
    this.args = args;
  }

  /** A harmonizer with the same settings that aligns every image to the given grid. */
  public SensorHarmonizer onGrid(GridGeometry target) {
    Args aligned = new Args();
    aligned.interpolation = args.interpolation;
    aligned.targetGeometry = Preconditions.checkNotNull(target, "target");
    return new SensorHarmonizer(aligned);
  }

  /** Harmonize an image as its sensor's family. */
  public Image harmonize(Image raw) {
    if (raw.getSensor() == null) {
      throw new ConfigException("Cannot harmonize an image without a sensor: " + raw);
    }
    return harmonize(raw, raw.getSensor().getFamily());
  }

  /**
   * Harmonize an image as the given sensor family. The family decides both the band mapping and
   * whether the OLI transformation applies.
   *
   * @throws ConfigException if the image lacks the QA band or a mapped band, or was acquired by a
   *     sensor of another family.
   */
  public Image harmonize(Image raw, SensorFamily family) {
    if (raw.getSensor() != null && raw.getSensor().getFamily() != family) {
      throw new ConfigException(String.format("%s was acquired by %s, not a %s sensor", raw,
          raw.getSensor(), family));
    }
    BandMapping mapping = family.getBandMapping();
    Raster source = raw.getRaster();
    checkBands(raw, mapping);

    GridGeometry target = args.targetGeometry == null
        ? source.getGeometry()
        : args.targetGeometry;

    // Reflective bands follow the configured interpolation; the QA flags are never blended.
    ImmutableList.Builder<String> names = ImmutableList.builder();
    double[][] bands = new double[CanonicalBand.COUNT + 1][];
    ImmutableList<String> inputs = mapping.inputBands();
    for (int b = 0; b < inputs.size(); b++) {
      bands[b] = Resampler.resample(source, source.bandIndex(inputs.get(b)), target,
          args.interpolation);
      names.add(inputs.get(b));
    }
    bands[CanonicalBand.COUNT] = Resampler.resample(source, source.bandIndex(QaMask.QA_BAND),
        target, Resampler.Interpolation.NEAREST);
    names.add(QaMask.QA_BAND);
    Raster aligned = new Raster(target, names.build(), bands);

    int masked = QaMask.apply(aligned);

    Raster canonical = aligned.select(inputs, CanonicalBand.names());
    if (family.isRecalibrated()) {
      recalibrate(canonical);
    }

    logger.debug("Harmonized {} {}: {} of {} pixels masked", raw.getSensor(), raw.getDate(),
        masked, target.size());
    return new Image(canonical, raw.getDate(), raw.getSensor());
  }

  /** Harmonize raw images into a date-ordered series on the target grid. */
  public TimeSeries harmonize(List<Image> raw) {
    ImmutableList.Builder<Image> harmonized = ImmutableList.builder();
    for (Image image : raw) {
      harmonized.add(harmonize(image));
    }
    return TimeSeries.of(harmonized.build());
  }

  /**
   * Apply the OLI to ETM+ transformation in place. The result is truncated toward zero into the
   * 16-bit signed range.
   */
  static void recalibrate(Raster canonical) {
    for (CanonicalBand band : CanonicalBand.values()) {
      double[] values = canonical.getBand(band.name());
      double offset = band.getOliIntercept() * 10000;
      for (int i = 0; i < values.length; i++) {
        if (Raster.isNoData(values[i])) {
          continue;
        }
        values[i] = PixelType.INT16.cast((values[i] - offset) / band.getOliSlope());
      }
    }
  }

  private static void checkBands(Image raw, BandMapping mapping) {
    Raster source = raw.getRaster();
    if (!source.hasBand(QaMask.QA_BAND)) {
      throw new ConfigException(String.format("%s has no %s band", raw, QaMask.QA_BAND));
    }
    for (String band : mapping.inputBands()) {
      if (!source.hasBand(band)) {
        throw new ConfigException(String.format("%s has no band %s required by %s",
            raw, band, mapping));
      }
    }
  }
}
