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

import net.larse.forestloss.helper.GridGeometry;

import java.time.LocalDate;
import java.util.Objects;

/** One sensor's images over an area of interest, acquired in [start, end). */
public final class ArchiveRequest {
  private final Sensor sensor;
  private final GridGeometry aoi;
  private final LocalDate start;
  private final LocalDate end;

  public ArchiveRequest(Sensor sensor, GridGeometry aoi, LocalDate start, LocalDate end) {
    this.sensor = Preconditions.checkNotNull(sensor, "sensor");
    this.aoi = Preconditions.checkNotNull(aoi, "aoi");
    this.start = Preconditions.checkNotNull(start, "start");
    this.end = Preconditions.checkNotNull(end, "end");
    Preconditions.checkArgument(start.isBefore(end), "empty date range %s..%s", start, end);
  }

  public Sensor getSensor() {
    return sensor;
  }

  public GridGeometry getAoi() {
    return aoi;
  }

  public LocalDate getStart() {
    return start;
  }

  /** Exclusive. */
  public LocalDate getEnd() {
    return end;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ArchiveRequest)) {
      return false;
    }
    ArchiveRequest r = (ArchiveRequest) o;
    return sensor == r.sensor && aoi.equals(r.aoi) && start.equals(r.start) && end.equals(r.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sensor, aoi, start, end);
  }

  @Override
  public String toString() {
    return String.format("%s %s..%s over %s", sensor.getCollectionId(), start, end, aoi);
  }
}
