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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** Which raw band of a sensor family feeds each canonical band. */
public final class BandMapping {
  public static final BandMapping TM = new BandMapping(ImmutableMap.<CanonicalBand, String>builder()
      .put(CanonicalBand.B1, "B1")
      .put(CanonicalBand.B2, "B2")
      .put(CanonicalBand.B3, "B3")
      .put(CanonicalBand.B4, "B4")
      .put(CanonicalBand.B5, "B5")
      .put(CanonicalBand.B7, "B7")
      .build());

  public static final BandMapping OLI = new BandMapping(ImmutableMap.<CanonicalBand, String>builder()
      .put(CanonicalBand.B1, "B2")
      .put(CanonicalBand.B2, "B3")
      .put(CanonicalBand.B3, "B4")
      .put(CanonicalBand.B4, "B5")
      .put(CanonicalBand.B5, "B6")
      .put(CanonicalBand.B7, "B7")
      .build());

  private final ImmutableMap<CanonicalBand, String> sources;

  public BandMapping(Map<CanonicalBand, String> sources) {
    Preconditions.checkArgument(sources.size() == CanonicalBand.COUNT,
        "a mapping needs a source for each of the %s canonical bands", CanonicalBand.COUNT);
    ImmutableMap.Builder<CanonicalBand, String> ordered = ImmutableMap.builder();
    for (CanonicalBand band : CanonicalBand.values()) {
      ordered.put(band, Preconditions.checkNotNull(sources.get(band), "no source for %s", band));
    }
    this.sources = ordered.build();
  }

  public String sourceOf(CanonicalBand band) {
    return sources.get(band);
  }

  /** Raw band names, in canonical order. */
  public ImmutableList<String> inputBands() {
    return sources.values().asList();
  }

  @Override
  public String toString() {
    return "BandMapping" + sources;
  }
}
