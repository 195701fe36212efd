package net.larse.forestloss.algorithms;

import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.ConfigException;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.landsat.CanonicalBand;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.TimeSeries;

import org.junit.Before;
import org.junit.Test;

import java.time.LocalDate;

import static org.junit.Assert.*;

public class IndexBandBuilderTest {
  Image composite;

  @Before
  public void setUp() throws Exception {
    // pixel 0 vegetated, pixel 1 bare, pixel 2 masked, pixel 3 zero reflectance
    double[][] data = {
        {100, 100, Double.NaN, 0},   // B1
        {200, 200, Double.NaN, 0},   // B2
        {1000, 2000, Double.NaN, 0}, // B3
        {3000, 2000, Double.NaN, 0}, // B4
        {1500, 2500, Double.NaN, 0}, // B5
        {1000, 3000, Double.NaN, 0}  // B7
    };
    composite = new Image(new Raster(GridGeometry.ofSize(4, 1), CanonicalBand.names(), data),
        LocalDate.of(2000, 1, 1), null);
  }

  static IndexBandBuilder builder(String index, String... ftv) {
    IndexBandBuilder.Args args = new IndexBandBuilder.Args();
    args.index = index;
    args.ftvBands = ImmutableList.copyOf(ftv);
    return new IndexBandBuilder(args);
  }

  @Test
  public void testNbrOrientedAndScaled() throws Exception {
    Raster result = builder("NBR").build(composite).getRaster();
    assertEquals(ImmutableList.of("NBR"), result.getBandNames());
    // (3000 - 1000) / 4000 = 0.5, flipped and scaled
    assertEquals(-500.0, result.getBand("NBR")[0], 1e-9);
    assertEquals(200.0, result.getBand("NBR")[1], 1e-9);
    assertTrue(Raster.isNoData(result.getBand("NBR")[2]));
    assertTrue(Raster.isNoData(result.getBand("NBR")[3]));
  }

  @Test
  public void testNdvi() throws Exception {
    Raster result = builder("NDVI").build(composite).getRaster();
    assertEquals(-500.0, result.getBand("NDVI")[0], 1e-9);
    assertEquals(0.0, result.getBand("NDVI")[1], 1e-9);
  }

  @Test
  public void testNegativeReflectanceIsNoData() throws Exception {
    // recalibrated OLI B7 of a dark pixel: (0 - 29) / 0.9949
    double[][] data = new double[CanonicalBand.COUNT][];
    for (int b = 0; b < data.length; b++) {
      data[b] = new double[] {500, 500};
    }
    data[CanonicalBand.B7.ordinal()] = new double[] {-29, 0};
    Image dark = new Image(new Raster(GridGeometry.ofSize(2, 1), CanonicalBand.names(), data),
        LocalDate.of(2015, 1, 1), null);

    double[] nbr = builder("NBR").build(dark).getRaster().getBand("NBR");
    assertTrue(Raster.isNoData(nbr[0]));
    assertEquals(-1000.0, nbr[1], 1e-9);
    assertTrue(Raster.isNoData(IndexBandBuilder.normalizedDifference(-1, 5)));
    assertEquals(0.5, IndexBandBuilder.normalizedDifference(3, 1), 0);
  }

  @Test
  public void testFittingBands() throws Exception {
    IndexBandBuilder builder = builder("NBR", "B4", "B5");
    assertEquals(ImmutableList.of("NBR", "ftv_B4", "ftv_B5"), builder.outputBands());

    Image image = builder.build(composite);
    assertEquals(composite.getDate(), image.getDate());
    assertArrayEquals(composite.getRaster().getBand("B5"),
        image.getRaster().getBand("ftv_B5"), 0);
    assertNotSame(composite.getRaster().getBand("B5"), image.getRaster().getBand("ftv_B5"));
  }

  @Test
  public void testBuildSeries() throws Exception {
    Image later = composite.withRaster(composite.getRaster().copy());
    TimeSeries series = TimeSeries.of(ImmutableList.of(composite,
        new Image(later.getRaster(), LocalDate.of(2001, 1, 1), null)));
    TimeSeries result = builder("NBR", "B7").build(series);
    assertEquals(2, result.size());
    assertEquals(2001, result.get(1).getYear());
    assertEquals(ImmutableList.of("NBR", "ftv_B7"), result.get(1).getRaster().getBandNames());
  }

  @Test
  public void testUnimplementedIndex() throws Exception {
    try {
      builder("TCW");
      fail("expected UnimplementedIndexException");
    } catch (UnimplementedIndexException e) {
      assertEquals(SpectralIndex.TCW, e.getIndex());
      assertEquals("The index 'TCW' is not currently supported. Supported indices are: NDVI, NBR",
          e.getMessage());
    }
  }

  @Test
  public void testUnrecognizedIndex() throws Exception {
    try {
      builder("EVI");
      fail("expected UnrecognizedIndexException");
    } catch (UnrecognizedIndexException e) {
      assertEquals("EVI", e.getName());
      assertEquals("The value 'EVI' was not recognized as a standard spectral index.",
          e.getMessage());
    }
  }

  @Test
  public void testIndexErrorsAreConfigErrors() throws Exception {
    for (String name : new String[] {"NDSI", "NDMI", "TCB", "TCG", "TCA", "NBR2", "nbr", ""}) {
      try {
        builder(name);
        fail("expected ConfigException for " + name);
      } catch (ConfigException e) {
        assertTrue(e instanceof UnimplementedIndexException
            || e instanceof UnrecognizedIndexException);
      }
    }
  }

  @Test(expected = ConfigException.class)
  public void testMissingFittingBand() throws Exception {
    builder("NBR", "B6").build(composite);
  }
}
