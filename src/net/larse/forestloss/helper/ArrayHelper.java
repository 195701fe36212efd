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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import org.apache.commons.math.stat.descriptive.rank.Median;

/** Static array manipulation functions. No-data entries are NaN. */
public class ArrayHelper {
  private ArrayHelper() {}

  /** True if any entry of array is no-data. */
  public static boolean anyNoData(double[] array) {
    for (double value : array) {
      if (Raster.isNoData(value)) {
        return true;
      }
    }
    return false;
  }

  /** The entries of array that are not no-data, in their original order. */
  public static double[] valid(double[] array) {
    DoubleArrayList values = new DoubleArrayList(array.length);
    for (double value : array) {
      if (!Raster.isNoData(value)) {
        values.add(value);
      }
    }
    return values.toDoubleArray();
  }

  /**
   * Median of the entries that are not no-data. With an even count this is the mean of the two
   * middle values. Returns no-data when every entry is no-data.
   */
  public static double median(double[] array) {
    double[] values = valid(array);
    if (values.length == 0) {
      return Raster.NO_DATA;
    }
    return new Median().evaluate(values);
  }

  /** Squared euclidean distance between two vectors of the same length. */
  public static double squaredDistance(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double d = a[i] - b[i];
      sum += d * d;
    }
    return sum;
  }
}
