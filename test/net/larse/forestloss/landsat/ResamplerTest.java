package net.larse.forestloss.landsat;

import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class ResamplerTest {
  Raster source;

  @Before
  public void setUp() throws Exception {
    // 2 x 2 pixels of 10 map units
    source = new Raster(new GridGeometry(0, 0, 10, -10, 2, 2), ImmutableList.of("v"),
        new double[][] {{0, 10, 20, 30}});
  }

  @Test
  public void testSameGridCopies() throws Exception {
    double[] result = Resampler.resample(source, 0, source.getGeometry(),
        Resampler.Interpolation.BILINEAR);
    assertArrayEquals(source.getBand(0), result, 0);
    assertNotSame(source.getBand(0), result);
  }

  @Test
  public void testNearestUpsampling() throws Exception {
    GridGeometry fine = new GridGeometry(0, 0, 5, -5, 4, 4);
    double[] result = Resampler.resample(source, 0, fine, Resampler.Interpolation.NEAREST);
    assertArrayEquals(new double[] {0, 0, 10, 10}, Arrays.copyOfRange(result, 0, 4), 0);
    assertArrayEquals(new double[] {20, 20, 30, 30},
        Arrays.copyOfRange(result, 12, 16), 0);
  }

  @Test
  public void testBilinearBetweenCentres() throws Exception {
    GridGeometry shifted = new GridGeometry(5, -5, 10, -10, 1, 1);
    double[] result = Resampler.resample(source, 0, shifted, Resampler.Interpolation.BILINEAR);
    assertEquals(15.0, result[0], 1e-9);
  }

  @Test
  public void testBilinearNoDataNeighbour() throws Exception {
    source.getBand(0)[3] = Raster.NO_DATA;
    GridGeometry shifted = new GridGeometry(5, -5, 10, -10, 1, 1);
    double[] result = Resampler.resample(source, 0, shifted, Resampler.Interpolation.BILINEAR);
    assertTrue(Raster.isNoData(result[0]));
  }

  @Test
  public void testResampleAllBands() throws Exception {
    GridGeometry coarse = new GridGeometry(0, 0, 20, -20, 1, 1);
    Raster result = Resampler.resample(source, coarse, Resampler.Interpolation.BILINEAR);
    assertEquals(source.getBandNames(), result.getBandNames());
    assertEquals(15.0, result.getBand("v")[0], 1e-9);
  }
}
