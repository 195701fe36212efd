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

import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.DataException;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.TimeSeries;

import java.util.List;

/** Yearly composites in year order, plus the data problems reported while building them. */
public final class CompositeCollection {
  private final TimeSeries composites;
  private final ImmutableList<DataException> problems;

  public CompositeCollection(List<Image> composites, List<DataException> problems) {
    this.composites = TimeSeries.of(composites);
    this.problems = ImmutableList.copyOf(problems);
  }

  public TimeSeries getComposites() {
    return composites;
  }

  /** The composite of a year, or null when the year was not part of the input. */
  public Image getComposite(int year) {
    for (Image image : composites) {
      if (image.getYear() == year) {
        return image;
      }
    }
    return null;
  }

  public ImmutableList<DataException> getProblems() {
    return problems;
  }

  public boolean hasProblems() {
    return !problems.isEmpty();
  }
}
