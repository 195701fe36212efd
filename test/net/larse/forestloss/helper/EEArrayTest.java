package net.larse.forestloss.helper;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class EEArrayTest {
  EEArray array;

  @Before
  public void setUp() throws Exception {
    array = EEArray.ofRows(
        new double[] {1, 2, 3, 4},
        new double[] {10, 20, 30, 40});
  }

  @Test
  public void testSliceNegativeEnd() throws Exception {
    EEArray left = array.slice(1, 0, -1);
    assertEquals(2, left.rows());
    assertEquals(3, left.cols());
    assertArrayEquals(new double[] {10, 20, 30}, left.row(1), 0);

    EEArray right = array.slice(1, 1);
    assertArrayEquals(new double[] {2, 3, 4}, right.row(0), 0);
  }

  @Test
  public void testSliceRows() throws Exception {
    EEArray second = array.slice(0, 1, 2);
    assertEquals(1, second.rows());
    assertArrayEquals(new double[] {10, 20, 30, 40}, second.row(0), 0);
  }

  @Test
  public void testSliceOfEmptyArray() throws Exception {
    EEArray empty = new EEArray(new double[0], 2, 0);
    assertEquals(0, empty.slice(1, 0, -1).cols());
    assertEquals(0, empty.slice(1, 0, 1).cols());
  }

  @Test
  public void testMaskDropsZeroAndNaN() throws Exception {
    EEArray mask = new EEArray(new double[] {1, 0, Double.NaN, 5}, 1, 4);
    EEArray masked = array.mask(mask);
    assertEquals(2, masked.cols());
    assertArrayEquals(new double[] {1, 4}, masked.row(0), 0);
    assertArrayEquals(new double[] {10, 40}, masked.row(1), 0);
  }

  @Test
  public void testSortIsStable() throws Exception {
    EEArray sorted = array.sort(new double[] {2, 1, 2, 1});
    assertArrayEquals(new double[] {2, 4, 1, 3}, sorted.row(0), 0);
  }

  @Test
  public void testDivideByZeroIsNoData() throws Exception {
    EEArray divisor = EEArray.ofRows(new double[] {1, 0, 2, 4}, new double[] {0, 5, 3, 8});
    EEArray quotient = array.divide(divisor);
    assertEquals(1.0, quotient.get(0, 0), 0);
    assertTrue(Double.isNaN(quotient.get(0, 1)));
    assertTrue(Double.isNaN(quotient.get(1, 0)));
    assertEquals(4.0, quotient.get(1, 1), 0);

    assertTrue(Double.isNaN(array.divide(0).get(1, 3)));
    assertTrue(Double.isNaN(array.divide(Double.NaN).get(0, 0)));
  }

  @Test
  public void testCatAndColumn() throws Exception {
    EEArray stacked = EEArray.cat(Arrays.asList(array.slice(0, 1, 2), array.slice(0, 0, 1)));
    assertArrayEquals(new double[] {30, 3}, stacked.column(2), 0);
  }

  @Test
  public void testMaxKeepsNoData() throws Exception {
    EEArray values = new EEArray(new double[] {-1, 2, Double.NaN}, 1, 3);
    EEArray clamped = values.max(0);
    assertEquals(0.0, clamped.get(0, 0), 0);
    assertEquals(2.0, clamped.get(0, 1), 0);
    assertTrue(Double.isNaN(clamped.get(0, 2)));
  }

  @Test
  public void testBuilderCastsValues() throws Exception {
    EEArray.Builder builder = EEArray.builder(PixelType.INT16, 2, 2);
    builder.setDouble(5206.95, 0, 0);
    builder.setDouble(-3.7, 1);
    builder.setDouble(1e6, 1, 0);
    builder.setDouble(Double.NaN, 1, 1);
    EEArray built = builder.build();
    assertEquals(5206.0, built.get(0, 0), 0);
    assertEquals(-3.0, built.get(0, 1), 0);
    assertEquals(Short.MAX_VALUE, built.get(1, 0), 0);
    assertTrue(Double.isNaN(built.get(1, 1)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testShapeMismatch() throws Exception {
    array.subtract(array.slice(1, 0, 2));
  }
}
