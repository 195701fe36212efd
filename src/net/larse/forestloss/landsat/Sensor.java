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

/** The Landsat surface reflectance archives combined into one series. */
public enum Sensor {
  LT05(SensorFamily.TM, "LANDSAT/LT05/C01/T1_SR"),
  LE07(SensorFamily.TM, "LANDSAT/LE07/C01/T1_SR"),
  LC08(SensorFamily.OLI, "LANDSAT/LC08/C01/T1_SR");

  private final SensorFamily family;
  private final String collectionId;

  Sensor(SensorFamily family, String collectionId) {
    this.family = family;
    this.collectionId = collectionId;
  }

  public SensorFamily getFamily() {
    return family;
  }

  /** Identifier of the sensor's surface reflectance collection in the image archive. */
  public String getCollectionId() {
    return collectionId;
  }
}
