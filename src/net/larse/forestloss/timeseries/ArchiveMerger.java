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

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Concatenates independently harmonized per-sensor series into one series ordered by date. No
 * overlap resolution is done: two sensors observing the same day both stay in the result.
 */
public class ArchiveMerger {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveMerger.class);

  private ArchiveMerger() {}

  public static TimeSeries merge(List<TimeSeries> series) {
    ImmutableList.Builder<Image> images = ImmutableList.builder();
    for (TimeSeries s : series) {
      images.addAll(s.getImages());
    }
    TimeSeries merged = TimeSeries.of(images.build());
    logger.debug("Merged {} series into {} images", series.size(), merged.size());
    return merged;
  }

  public static TimeSeries merge(TimeSeries... series) {
    return merge(Arrays.asList(series));
  }
}
