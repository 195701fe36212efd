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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import net.larse.forestloss.helper.GridGeometry;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * An immutable sequence of images ordered by acquisition date. Images sharing a date keep the
 * order in which they were supplied; nothing is deduplicated.
 */
public final class TimeSeries implements Iterable<Image> {
  private static final Ordering<Image> BY_DATE =
      Ordering.<LocalDate>natural().onResultOf(Image::getDate);

  private static final TimeSeries EMPTY = new TimeSeries(ImmutableList.of());

  private final ImmutableList<Image> images;

  private TimeSeries(ImmutableList<Image> images) {
    this.images = images;
  }

  /**
   * Order images by date. The sort is stable.
   *
   * @throws IllegalArgumentException if the images are not all on the same grid.
   */
  public static TimeSeries of(List<Image> images) {
    if (images.isEmpty()) {
      return EMPTY;
    }
    GridGeometry geometry = images.get(0).getGeometry();
    for (Image image : images) {
      Preconditions.checkArgument(image.getGeometry().equals(geometry),
          "image %s on %s is not on the grid %s", image, image.getGeometry(), geometry);
    }
    return new TimeSeries(BY_DATE.immutableSortedCopy(images));
  }

  public static TimeSeries empty() {
    return EMPTY;
  }

  public int size() {
    return images.size();
  }

  public boolean isEmpty() {
    return images.isEmpty();
  }

  public Image get(int index) {
    return images.get(index);
  }

  public ImmutableList<Image> getImages() {
    return images;
  }

  /** The common grid of the images, null for an empty series. */
  public GridGeometry getGeometry() {
    return images.isEmpty() ? null : images.get(0).getGeometry();
  }

  /** Images acquired on or after start and strictly before end. */
  public TimeSeries filterDate(LocalDate start, LocalDate end) {
    ImmutableList.Builder<Image> selected = ImmutableList.builder();
    for (Image image : images) {
      if (!image.getDate().isBefore(start) && image.getDate().isBefore(end)) {
        selected.add(image);
      }
    }
    return new TimeSeries(selected.build());
  }

  /** Apply a per-image transformation; the results are re-ordered by date. */
  public TimeSeries map(Function<Image, Image> f) {
    ImmutableList.Builder<Image> mapped = ImmutableList.builder();
    for (Image image : images) {
      mapped.add(f.apply(image));
    }
    return of(mapped.build());
  }

  @Override
  public Iterator<Image> iterator() {
    return images.iterator();
  }

  @Override
  public String toString() {
    return "TimeSeries" + images;
  }
}
