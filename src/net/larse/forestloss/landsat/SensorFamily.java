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

/** Instrument families that share a band layout. */
public enum SensorFamily {
  /** Thematic Mapper and Enhanced Thematic Mapper Plus; already TM-equivalent. */
  TM(BandMapping.TM, false),
  /** Operational Land Imager; shifted band numbers and a cross-sensor recalibration. */
  OLI(BandMapping.OLI, true);

  private final BandMapping bandMapping;
  private final boolean recalibrated;

  SensorFamily(BandMapping bandMapping, boolean recalibrated) {
    this.bandMapping = bandMapping;
    this.recalibrated = recalibrated;
  }

  public BandMapping getBandMapping() {
    return bandMapping;
  }

  /** Whether values need the OLI to ETM+ linear transformation after renaming. */
  public boolean isRecalibrated() {
    return recalibrated;
  }
}
