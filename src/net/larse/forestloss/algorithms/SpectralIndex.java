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

import net.larse.forestloss.landsat.CanonicalBand;

/**
 * Standard spectral indices. Implemented indices are normalized differences of two canonical
 * bands, together with the sign that makes vegetation loss an increase of the index band.
 */
public enum SpectralIndex {
  NDVI(CanonicalBand.B4, CanonicalBand.B3, -1),
  NBR(CanonicalBand.B4, CanonicalBand.B7, -1),
  NDSI,
  NDMI,
  TCB,
  TCG,
  TCW,
  TCA,
  NBR2;

  private final CanonicalBand first;
  private final CanonicalBand second;
  private final int disturbanceDirection;

  SpectralIndex() {
    this(null, null, 0);
  }

  SpectralIndex(CanonicalBand first, CanonicalBand second, int disturbanceDirection) {
    this.first = first;
    this.second = second;
    this.disturbanceDirection = disturbanceDirection;
  }

  /**
   * Look up an implemented index by name.
   *
   * @throws UnrecognizedIndexException if the name is not a standard index.
   * @throws UnimplementedIndexException if the index is known but cannot be computed.
   */
  public static SpectralIndex forName(String name) {
    SpectralIndex index;
    try {
      index = valueOf(name);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new UnrecognizedIndexException(name);
    }
    return index.checkImplemented();
  }

  public static ImmutableList<SpectralIndex> implemented() {
    ImmutableList.Builder<SpectralIndex> indices = ImmutableList.builder();
    for (SpectralIndex index : values()) {
      if (index.isImplemented()) {
        indices.add(index);
      }
    }
    return indices.build();
  }

  public boolean isImplemented() {
    return first != null;
  }

  /** @throws UnimplementedIndexException if the index cannot be computed. */
  public SpectralIndex checkImplemented() {
    if (!isImplemented()) {
      throw new UnimplementedIndexException(this);
    }
    return this;
  }

  public CanonicalBand getFirst() {
    return checkImplemented().first;
  }

  public CanonicalBand getSecond() {
    return checkImplemented().second;
  }

  /** -1 when disturbance lowers the raw index, +1 when it raises it. */
  public int getDisturbanceDirection() {
    return checkImplemented().disturbanceDirection;
  }
}
