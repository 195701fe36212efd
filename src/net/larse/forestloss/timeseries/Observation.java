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

import net.larse.forestloss.helper.ArrayHelper;
import net.larse.forestloss.landsat.Sensor;

import java.time.LocalDate;
import java.util.Arrays;

/** One pixel of one image: its band vector, acquisition date and sensor. */
public final class Observation {
  private final double[] bands;
  private final LocalDate date;
  private final Sensor sensor;

  public Observation(double[] bands, LocalDate date, Sensor sensor) {
    this.bands = bands.clone();
    this.date = date;
    this.sensor = sensor;
  }

  public double[] getBands() {
    return bands.clone();
  }

  public int getBandCount() {
    return bands.length;
  }

  public double getBand(int band) {
    return bands[band];
  }

  public LocalDate getDate() {
    return date;
  }

  public Sensor getSensor() {
    return sensor;
  }

  /** An observation is only usable as a whole vector: a single no-data band invalidates it. */
  public boolean isValid() {
    return !ArrayHelper.anyNoData(bands);
  }

  @Override
  public String toString() {
    return String.format("Observation[%s %s %s]", date, sensor, Arrays.toString(bands));
  }
}
