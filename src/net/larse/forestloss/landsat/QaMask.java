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

import net.larse.forestloss.helper.Raster;

/**
 * Surface reflectance pixel_qa decoding. Bits 2, 3, 4 and 5 flag water, cloud shadow, snow and
 * cloud; a pixel is clear only when none of them is set.
 */
public final class QaMask {
  public static final String QA_BAND = "pixel_qa";

  public static final int WATER_BIT = 1 << 2;
  public static final int CLOUD_SHADOW_BIT = 1 << 3;
  public static final int SNOW_BIT = 1 << 4;
  public static final int CLOUD_BIT = 1 << 5;

  private static final int UNUSABLE = WATER_BIT | CLOUD_SHADOW_BIT | SNOW_BIT | CLOUD_BIT;

  private QaMask() {}

  /** A no-data QA sample is never clear. */
  public static boolean isClear(double qa) {
    return !Raster.isNoData(qa) && ((int) qa & UNUSABLE) == 0;
  }

  /**
   * Set every band of the raster to no-data wherever its QA band is not clear. The QA band itself
   * is left untouched. Returns the number of pixels masked.
   */
  public static int apply(Raster raster) {
    double[] qa = raster.getBand(QA_BAND);
    int qaIndex = raster.bandIndex(QA_BAND);
    int masked = 0;
    for (int i = 0; i < qa.length; i++) {
      if (isClear(qa[i])) {
        continue;
      }
      masked++;
      for (int b = 0; b < raster.getBandCount(); b++) {
        if (b != qaIndex) {
          raster.getBand(b)[i] = Raster.NO_DATA;
        }
      }
    }
    return masked;
  }
}
