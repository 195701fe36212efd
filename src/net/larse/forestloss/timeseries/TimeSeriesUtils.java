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

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.time.LocalDate;
import java.time.MonthDay;

/** Calendar helpers shared by the compositing stages. */
public class TimeSeriesUtils {
  private TimeSeriesUtils() {}

  /** The distinct acquisition years of a series, ascending. */
  public static int[] distinctYears(TimeSeries series) {
    IntSortedSet years = new IntRBTreeSet();
    for (Image image : series) {
      years.add(image.getYear());
    }
    return years.toIntArray();
  }

  /**
   * Windows are month-day ranges inside one calendar year; a start after the end would wrap into
   * the next year, which is not supported.
   */
  public static void checkWindow(MonthDay startDay, MonthDay endDay) {
    Preconditions.checkNotNull(startDay, "startDay");
    Preconditions.checkNotNull(endDay, "endDay");
    Preconditions.checkArgument(!startDay.isAfter(endDay),
        "window %s..%s wraps the year end", startDay, endDay);
  }

  /** First day of the window in a year (inclusive). */
  public static LocalDate windowStart(int year, MonthDay startDay) {
    return startDay.atYear(year);
  }

  /** The day after the last day of the window in a year, so that the end day is included. */
  public static LocalDate windowEnd(int year, MonthDay endDay) {
    return endDay.atYear(year).plusDays(1);
  }
}
