package net.larse.forestloss.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class ArrayHelperTest {
  static final double NAN = Double.NaN;

  @Test
  public void testMedianIgnoresNoData() throws Exception {
    assertEquals(3.0, ArrayHelper.median(new double[] {5, NAN, 1, 3}), 0);
  }

  @Test
  public void testMedianEvenCount() throws Exception {
    assertEquals(2.5, ArrayHelper.median(new double[] {4, 1, 2, 3}), 1e-12);
  }

  @Test
  public void testMedianAllNoData() throws Exception {
    assertTrue(Double.isNaN(ArrayHelper.median(new double[] {NAN, NAN})));
    assertTrue(Double.isNaN(ArrayHelper.median(new double[0])));
  }

  @Test
  public void testValid() throws Exception {
    assertArrayEquals(new double[] {1, 2}, ArrayHelper.valid(new double[] {NAN, 1, NAN, 2}), 0);
    assertTrue(ArrayHelper.anyNoData(new double[] {1, NAN}));
    assertFalse(ArrayHelper.anyNoData(new double[] {1, 2}));
  }

  @Test
  public void testSquaredDistance() throws Exception {
    assertEquals(25.0, ArrayHelper.squaredDistance(new double[] {0, 0}, new double[] {3, 4}), 0);
  }
}
