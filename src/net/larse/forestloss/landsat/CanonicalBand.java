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

import com.google.common.collect.ImmutableList;

/**
 * The six reflective TM-equivalent bands every sensor is normalized into, in canonical order.
 *
 * <p>Each band carries the OLI to ETM+ transformation of Roy et al. (2016), Remote Sensing of
 * Environment 185, 57-70: {@code etm = (oli - intercept * 10000) / slope} on surface reflectance
 * scaled by 10000.
 */
public enum CanonicalBand {
  B1(0.9785, -0.0095),
  B2(0.9542, -0.0016),
  B3(0.9825, -0.0022),
  B4(1.0073, -0.0021),
  B5(1.0171, -0.0030),
  B7(0.9949, 0.0029);

  public static final int COUNT = 6;

  private final double oliSlope;
  private final double oliIntercept;

  CanonicalBand(double oliSlope, double oliIntercept) {
    this.oliSlope = oliSlope;
    this.oliIntercept = oliIntercept;
  }

  public double getOliSlope() {
    return oliSlope;
  }

  public double getOliIntercept() {
    return oliIntercept;
  }

  /** Band names in canonical order. */
  public static ImmutableList<String> names() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (CanonicalBand band : values()) {
      names.add(band.name());
    }
    return names.build();
  }
}
