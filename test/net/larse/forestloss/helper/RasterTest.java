package net.larse.forestloss.helper;

import com.google.common.collect.ImmutableList;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class RasterTest {
  GridGeometry geometry;
  Raster raster;

  @Before
  public void setUp() throws Exception {
    // 3 x 2 pixels of 30 m, upper left at (1000, 2000)
    geometry = new GridGeometry(1000, 2000, 30, -30, 3, 2);
    raster = new Raster(geometry, ImmutableList.of("a", "b"), new double[][] {
        {1, 2, 3, 4, 5, 6},
        {10, 20, 30, 40, 50, 60}});
  }

  @Test
  public void testNewRasterIsNoData() throws Exception {
    Raster empty = new Raster(geometry, ImmutableList.of("x"));
    for (double value : empty.getBand("x")) {
      assertTrue(Raster.isNoData(value));
    }
  }

  @Test
  public void testAccess() throws Exception {
    assertEquals(6.0, raster.get(0, 2, 1), 0);
    raster.set(1, 0, 1, -1);
    assertEquals(-1.0, raster.getBand("b")[3], 0);
    assertArrayEquals(new double[] {2, 20}, raster.pixel(1), 0);
    assertEquals(-1, raster.bandIndex("c"));
  }

  @Test
  public void testSelectCopies() throws Exception {
    Raster selected = raster.select(ImmutableList.of("b"), ImmutableList.of("B"));
    selected.getBand("B")[0] = 0;
    assertEquals(10.0, raster.getBand("b")[0], 0);
    assertEquals(ImmutableList.of("B"), selected.getBandNames());
  }

  @Test
  public void testCopyIsDeep() throws Exception {
    Raster copy = raster.copy();
    copy.getBand("a")[0] = 0;
    assertEquals(1.0, raster.getBand("a")[0], 0);
    assertEquals(geometry, copy.getGeometry());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateBandNames() throws Exception {
    new Raster(geometry, ImmutableList.of("a", "a"), new double[2][6]);
  }
}
