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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.EEArray;

import java.util.List;

/**
 * The interval between two consecutive trend vertices and its derived features. Values that have
 * no defined result (rate for a zero duration, dsnr for a zero rmse) are NaN.
 */
public final class Segment {
  /** Field names, in the row order of segment arrays and the channel order of event rasters. */
  public static final ImmutableList<String> FIELDS =
      ImmutableList.of("yod", "endYr", "startVal", "endVal", "mag", "dur", "rate", "dsnr");

  public static final int START_YEAR = 0;
  public static final int END_YEAR = 1;
  public static final int START_VALUE = 2;
  public static final int END_VALUE = 3;
  public static final int MAGNITUDE = 4;
  public static final int DURATION = 5;
  public static final int RATE = 6;
  public static final int DSNR = 7;

  private final double[] values;

  private Segment(double[] values) {
    Preconditions.checkArgument(values.length == FIELDS.size(),
        "a segment has %s fields, got %s", FIELDS.size(), values.length);
    this.values = values;
  }

  /** Read one column of an 8 x n segment array. */
  public static Segment fromColumn(EEArray segments, int col) {
    return new Segment(segments.column(col));
  }

  /** All columns of an 8 x n segment array, in column order. */
  public static List<Segment> fromArray(EEArray segments) {
    ImmutableList.Builder<Segment> result = ImmutableList.builder();
    for (int j = 0; j < segments.cols(); j++) {
      result.add(fromColumn(segments, j));
    }
    return result.build();
  }

  public double getStartYear() {
    return values[START_YEAR];
  }

  public double getEndYear() {
    return values[END_YEAR];
  }

  public double getStartValue() {
    return values[START_VALUE];
  }

  public double getEndValue() {
    return values[END_VALUE];
  }

  public double getMagnitude() {
    return values[MAGNITUDE];
  }

  public double getDuration() {
    return values[DURATION];
  }

  public double getRate() {
    return values[RATE];
  }

  public double getDsnr() {
    return values[DSNR];
  }

  public double[] toArray() {
    return values.clone();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Segment{");
    for (int i = 0; i < FIELDS.size(); i++) {
      sb.append(i == 0 ? "" : ", ").append(FIELDS.get(i)).append('=').append(values[i]);
    }
    return sb.append('}').toString();
  }
}
