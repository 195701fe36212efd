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

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * A per-pixel 2-D array of doubles, modelled on the array-valued pixels of Earth Engine. Axis 0
 * indexes rows (the per-vertex or per-segment attributes), axis 1 indexes columns (the vertices or
 * segments). All operations return new arrays.
 *
 * <p>No-data is carried as NaN; arithmetic propagates it, divisions by zero produce it.
 */
public class EEArray {
  private final double[] array;
  private final int rows;
  private final int cols;

  public EEArray(double[] array, int rows, int cols) {
    Preconditions.checkArgument(array.length == rows * cols,
        "array of length %s does not hold %s x %s values", array.length, rows, cols);
    this.array = array;
    this.rows = rows;
    this.cols = cols;
  }

  public static class Builder {
    private final PixelType type;
    private final double[] array;
    private final int rows;
    private final int cols;

    public Builder(PixelType type, int[] lengths) {
      Preconditions.checkArgument(lengths.length == 1 || lengths.length == 2,
          "only 1-D and 2-D arrays are supported");
      this.type = type;
      this.rows = lengths.length == 1 ? 1 : lengths[0];
      this.cols = lengths.length == 1 ? lengths[0] : lengths[1];
      this.array = new double[rows * cols];
    }

    public EEArray build() {
      return new EEArray(array, rows, cols);
    }

    public void setDouble(double value, int offset) {
      array[offset] = type.cast(value);
    }

    public void setDouble(double value, int row, int col) {
      setDouble(value, row * cols + col);
    }
  }

  public static EEArray.Builder builder(PixelType type, int... lengths) {
    return new Builder(type, lengths);
  }

  /** Build a 2-D array from its rows. All rows must have the same length. */
  public static EEArray ofRows(double[]... rowValues) {
    int nCols = rowValues.length == 0 ? 0 : rowValues[0].length;
    double[] values = new double[rowValues.length * nCols];
    for (int i = 0; i < rowValues.length; i++) {
      Preconditions.checkArgument(rowValues[i].length == nCols, "ragged rows");
      System.arraycopy(rowValues[i], 0, values, i * nCols, nCols);
    }
    return new EEArray(values, rowValues.length, nCols);
  }

  /** Concatenate arrays of equal column count along axis 0. */
  public static EEArray cat(List<EEArray> parts) {
    Preconditions.checkArgument(!parts.isEmpty(), "nothing to concatenate");
    int nCols = parts.get(0).cols;
    int nRows = 0;
    for (EEArray part : parts) {
      Preconditions.checkArgument(part.cols == nCols, "column counts differ");
      nRows += part.rows;
    }
    double[] values = new double[nRows * nCols];
    int offset = 0;
    for (EEArray part : parts) {
      System.arraycopy(part.array, 0, values, offset, part.array.length);
      offset += part.array.length;
    }
    return new EEArray(values, nRows, nCols);
  }

  public int rows() {
    return rows;
  }

  public int cols() {
    return cols;
  }

  public double get(int row, int col) {
    return array[row * cols + col];
  }

  /** Copy of one row. */
  public double[] row(int row) {
    return Arrays.copyOfRange(array, row * cols, (row + 1) * cols);
  }

  /** Copy of one column, i.e. the array projected onto axis 0. */
  public double[] column(int col) {
    double[] values = new double[rows];
    for (int i = 0; i < rows; i++) {
      values[i] = get(i, col);
    }
    return values;
  }

  /**
   * Slice along an axis between start (incl) and end (excl). A negative end is taken as the number
   * of entries from the end (ie: -1 = len-1).
   */
  public EEArray slice(int axis, int start, int end) {
    Preconditions.checkArgument(axis == 0 || axis == 1, "axis must be 0 or 1, got %s", axis);
    int length = axis == 0 ? rows : cols;
    if (end < 0) {
      end = length + end;
    }
    end = Math.max(0, Math.min(end, length));
    start = Math.min(Math.max(start, 0), end);

    if (axis == 0) {
      return new EEArray(Arrays.copyOfRange(array, start * cols, end * cols), end - start, cols);
    }
    int width = Math.max(0, end - start);
    double[] values = new double[rows * width];
    for (int i = 0; i < rows; i++) {
      System.arraycopy(array, i * cols + start, values, i * width, width);
    }
    return new EEArray(values, rows, width);
  }

  /** Slice along an axis from start to the end of that axis. */
  public EEArray slice(int axis, int start) {
    return slice(axis, start, axis == 0 ? rows : cols);
  }

  /**
   * Keep the columns whose entry in the single-row mask is non-zero. NaN in the mask counts as
   * masked out.
   */
  public EEArray mask(EEArray mask) {
    Preconditions.checkArgument(mask.rows == 1 && mask.cols == cols,
        "mask must be 1 x %s, got %s x %s", cols, mask.rows, mask.cols);
    IntArrayList keep = new IntArrayList();
    for (int j = 0; j < cols; j++) {
      double m = mask.array[j];
      if (!Double.isNaN(m) && m != 0.0) {
        keep.add(j);
      }
    }
    return selectColumns(keep.toIntArray());
  }

  /**
   * Sort the columns by ascending key. The sort is stable, columns with equal keys keep their
   * original order.
   */
  public EEArray sort(double[] keys) {
    Preconditions.checkArgument(keys.length == cols, "need one key per column");
    Integer[] order = new Integer[cols];
    for (int j = 0; j < cols; j++) {
      order[j] = j;
    }
    // Arrays.sort on objects is a stable merge sort.
    Arrays.sort(order, Comparator.comparingDouble(j -> keys[j]));
    int[] columns = new int[cols];
    for (int j = 0; j < cols; j++) {
      columns[j] = order[j];
    }
    return selectColumns(columns);
  }

  private EEArray selectColumns(int[] columns) {
    double[] values = new double[rows * columns.length];
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < columns.length; j++) {
        values[i * columns.length + j] = array[i * cols + columns[j]];
      }
    }
    return new EEArray(values, rows, columns.length);
  }

  public EEArray add(double value) {
    double[] values = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      values[i] = array[i] + value;
    }
    return new EEArray(values, rows, cols);
  }

  public EEArray multiply(double value) {
    double[] values = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      values[i] = array[i] * value;
    }
    return new EEArray(values, rows, cols);
  }

  /** Element-wise maximum with a scalar; no-data stays no-data. */
  public EEArray max(double value) {
    double[] values = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      values[i] = Math.max(array[i], value);
    }
    return new EEArray(values, rows, cols);
  }

  public EEArray subtract(EEArray other) {
    checkSameShape(other);
    double[] values = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      values[i] = array[i] - other.array[i];
    }
    return new EEArray(values, rows, cols);
  }

  /** Element-wise division; a zero divisor yields no-data instead of an infinity. */
  public EEArray divide(EEArray other) {
    checkSameShape(other);
    double[] values = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      values[i] = other.array[i] == 0.0 ? Double.NaN : array[i] / other.array[i];
    }
    return new EEArray(values, rows, cols);
  }

  /** Division by a scalar; a zero divisor yields no-data for every element. */
  public EEArray divide(double value) {
    double[] values = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      values[i] = value == 0.0 ? Double.NaN : array[i] / value;
    }
    return new EEArray(values, rows, cols);
  }

  private void checkSameShape(EEArray other) {
    Preconditions.checkArgument(rows == other.rows && cols == other.cols,
        "shape mismatch: %s x %s vs %s x %s", rows, cols, other.rows, other.cols);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof EEArray)) {
      return false;
    }
    EEArray other = (EEArray) o;
    return rows == other.rows && cols == other.cols && Arrays.equals(array, other.array);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * rows + cols) + Arrays.hashCode(array);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < rows; i++) {
      sb.append(i == 0 ? "" : ", ").append(Arrays.toString(row(i)));
    }
    return sb.append(']').toString();
  }
}
