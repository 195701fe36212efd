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

import com.google.common.primitives.Ints;
import com.google.common.primitives.Shorts;

/**
 * Storage type of array and raster samples. Values are always carried as doubles, the type only
 * decides how a value is coerced when it is written.
 */
public enum PixelType {
  DOUBLE,
  FLOAT,
  INT32,
  INT16;

  /**
   * Coerce a value into this type. Integer types truncate toward zero and saturate at the ends of
   * their range. No-data (NaN) is passed through unchanged for every type.
   */
  public double cast(double value) {
    if (Double.isNaN(value)) {
      return value;
    }
    switch (this) {
      case FLOAT:
        return (float) value;
      case INT32:
        return Ints.saturatedCast((long) value);
      case INT16:
        return Shorts.saturatedCast((long) value);
      default:
        return value;
    }
  }
}
