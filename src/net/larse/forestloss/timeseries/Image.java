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

package net.larse.forestloss.timeseries;

import com.google.common.base.Preconditions;

import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.landsat.Sensor;

import java.time.LocalDate;
import java.util.List;

/**
 * A raster acquired (or synthesized) at one date. The sensor is null for derived images such as
 * yearly composites, which mix observations of several sensors.
 */
public final class Image {
  private final Raster raster;
  private final LocalDate date;
  private final Sensor sensor;

  public Image(Raster raster, LocalDate date, Sensor sensor) {
    this.raster = Preconditions.checkNotNull(raster, "raster");
    this.date = Preconditions.checkNotNull(date, "date");
    this.sensor = sensor;
  }

  /** An image whose every sample is no-data. */
  public static Image noData(GridGeometry geometry, List<String> bandNames, LocalDate date) {
    return new Image(new Raster(geometry, bandNames), date, null);
  }

  public Raster getRaster() {
    return raster;
  }

  public LocalDate getDate() {
    return date;
  }

  public int getYear() {
    return date.getYear();
  }

  public Sensor getSensor() {
    return sensor;
  }

  public GridGeometry getGeometry() {
    return raster.getGeometry();
  }

  /** A new image with the same date and sensor around another raster. */
  public Image withRaster(Raster other) {
    return new Image(other, date, sensor);
  }

  @Override
  public String toString() {
    return String.format("Image[%s %s %s]", date, sensor, raster.getBandNames());
  }
}
