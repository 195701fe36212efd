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
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

/**
 * An in-memory multi-band raster. Samples are stored band-sequential as doubles, one array per
 * band indexed by {@code y * width + x}. Missing samples hold the no-data sentinel NaN.
 */
public class Raster {
  public static final double NO_DATA = Double.NaN;

  private final GridGeometry geometry;
  private final ImmutableList<String> bandNames;
  private final double[][] data;

  /** Create a raster with every sample set to no-data. */
  public Raster(GridGeometry geometry, List<String> bandNames) {
    this.geometry = geometry;
    this.bandNames = ImmutableList.copyOf(bandNames);
    this.data = new double[bandNames.size()][geometry.size()];
    for (double[] band : data) {
      Arrays.fill(band, NO_DATA);
    }
  }

  /** Wrap existing band arrays; the arrays are not copied. */
  public Raster(GridGeometry geometry, List<String> bandNames, double[][] data) {
    Preconditions.checkArgument(bandNames.size() == data.length,
        "%s band names for %s bands", bandNames.size(), data.length);
    for (double[] band : data) {
      Preconditions.checkArgument(band.length == geometry.size(),
          "band of length %s does not fit %s", band.length, geometry);
    }
    Preconditions.checkArgument(bandNames.stream().distinct().count() == bandNames.size(),
        "duplicate band names in %s", bandNames);
    this.geometry = geometry;
    this.bandNames = ImmutableList.copyOf(bandNames);
    this.data = data;
  }

  public static boolean isNoData(double value) {
    return Double.isNaN(value);
  }

  public GridGeometry getGeometry() {
    return geometry;
  }

  public int getWidth() {
    return geometry.width;
  }

  public int getHeight() {
    return geometry.height;
  }

  public ImmutableList<String> getBandNames() {
    return bandNames;
  }

  public int getBandCount() {
    return bandNames.size();
  }

  /** Index of the named band, or -1 when the raster has no such band. */
  public int bandIndex(String name) {
    return bandNames.indexOf(name);
  }

  public boolean hasBand(String name) {
    return bandIndex(name) >= 0;
  }

  /** The live sample array of a band. */
  public double[] getBand(int band) {
    return data[band];
  }

  public double[] getBand(String name) {
    int band = bandIndex(name);
    Preconditions.checkArgument(band >= 0, "no band %s in %s", name, bandNames);
    return data[band];
  }

  public double get(int band, int x, int y) {
    return data[band][y * geometry.width + x];
  }

  public void set(int band, int x, int y, double value) {
    data[band][y * geometry.width + x] = value;
  }

  /** All band values of one pixel, in band order. */
  public double[] pixel(int index) {
    double[] values = new double[data.length];
    for (int b = 0; b < data.length; b++) {
      values[b] = data[b][index];
    }
    return values;
  }

  /** Copy the named bands into a new raster under new names. */
  public Raster select(List<String> names, List<String> newNames) {
    Preconditions.checkArgument(names.size() == newNames.size(),
        "cannot rename %s bands to %s names", names.size(), newNames.size());
    double[][] selected = new double[names.size()][];
    for (int i = 0; i < names.size(); i++) {
      selected[i] = getBand(names.get(i)).clone();
    }
    return new Raster(geometry, newNames, selected);
  }

  public Raster copy() {
    double[][] copied = new double[data.length][];
    for (int b = 0; b < data.length; b++) {
      copied[b] = data[b].clone();
    }
    return new Raster(geometry, bandNames, copied);
  }
}
