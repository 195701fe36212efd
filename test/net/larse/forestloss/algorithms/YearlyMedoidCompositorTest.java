package net.larse.forestloss.algorithms;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.landsat.CanonicalBand;
import net.larse.forestloss.landsat.Sensor;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.Observation;
import net.larse.forestloss.timeseries.TimeSeries;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.Assert.*;

public class YearlyMedoidCompositorTest {
  static final double NAN = Double.NaN;

  GridGeometry geometry;
  YearlyMedoidCompositor compositor;

  @Before
  public void setUp() throws Exception {
    geometry = GridGeometry.ofSize(2, 1);
    compositor = new YearlyMedoidCompositor();
  }

  @After
  public void tearDown() throws Exception {
    // clear a leftover interrupt
    Thread.interrupted();
  }

  /** A harmonized image whose pixels hold the given value in every canonical band. */
  static Image canonical(GridGeometry geometry, String date, Sensor sensor, double... pixels) {
    double[][] data = new double[CanonicalBand.COUNT][];
    for (int b = 0; b < data.length; b++) {
      data[b] = pixels.clone();
    }
    return new Image(new Raster(geometry, CanonicalBand.names(), data), LocalDate.parse(date),
        sensor);
  }

  static double[] vector(double value) {
    double[] v = new double[CanonicalBand.COUNT];
    Arrays.fill(v, value);
    return v;
  }

  /** Observations of one pixel, one day apart. */
  static List<Observation> observations(double[]... vectors) {
    List<Observation> observations = Lists.newArrayList();
    for (int o = 0; o < vectors.length; o++) {
      observations.add(new Observation(vectors[o], LocalDate.of(2000, 7, 1).plusDays(o),
          Sensor.LT05));
    }
    return observations;
  }

  @Test
  public void testMedoidExample() throws Exception {
    List<Observation> values = observations(vector(1), vector(2), vector(10));
    assertEquals(1, YearlyMedoidCompositor.MedoidSolver.getResult(values));
    assertArrayEquals(vector(2), YearlyMedoidCompositor.MedoidSolver.median(values), 0);
  }

  @Test
  public void testMedianSkipsNoData() throws Exception {
    List<Observation> values = observations(
        new double[] {1, 5},
        new double[] {NAN, 7},
        new double[] {3, 9});
    assertArrayEquals(new double[] {2, 7}, YearlyMedoidCompositor.MedoidSolver.median(values), 0);
    // the observation with a no-data band is never the medoid
    assertEquals(0, YearlyMedoidCompositor.MedoidSolver.getResult(values));
  }

  @Test
  public void testTieGoesToEarliest() throws Exception {
    List<Observation> values = observations(new double[] {1}, new double[] {3});
    assertEquals(0, YearlyMedoidCompositor.MedoidSolver.getResult(values));
  }

  @Test
  public void testNoValidObservation() throws Exception {
    List<Observation> values = observations(new double[] {NAN, 1}, new double[] {2, NAN});
    assertEquals(-1, YearlyMedoidCompositor.MedoidSolver.getResult(values));
  }

  @Test
  public void testCompositeYear() throws Exception {
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        canonical(geometry, "2000-07-01", Sensor.LT05, 1, NAN),
        canonical(geometry, "2000-07-17", Sensor.LE07, 2, NAN),
        canonical(geometry, "2000-08-02", Sensor.LT05, 10, NAN)));

    CompositeCollection result = compositor.composite(series);
    assertFalse(result.hasProblems());
    assertEquals(1, result.getComposites().size());

    Image composite = result.getComposite(2000);
    assertEquals(LocalDate.of(2000, 1, 1), composite.getDate());
    assertNull(composite.getSensor());
    assertArrayEquals(vector(2), composite.getRaster().pixel(0), 0);
    // a pixel masked in every observation stays no-data
    assertArrayEquals(vector(NAN), composite.getRaster().pixel(1), 0);
  }

  @Test
  public void testObservationsOutsideWindowIgnored() throws Exception {
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        canonical(geometry, "2000-06-19", Sensor.LT05, 100, 100),
        canonical(geometry, "2000-06-20", Sensor.LT05, 1, 1),
        canonical(geometry, "2000-09-10", Sensor.LT05, 3, 3),
        canonical(geometry, "2000-09-11", Sensor.LT05, 100, 100)));

    Image composite = compositor.composite(series).getComposite(2000);
    // median 2 of {1, 3}; tie goes to the earlier acquisition
    assertArrayEquals(vector(1), composite.getRaster().pixel(0), 0);
  }

  @Test
  public void testEmptyYearReported() throws Exception {
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        canonical(geometry, "2000-07-01", Sensor.LT05, 1, 1),
        canonical(geometry, "2001-01-15", Sensor.LE07, 5, 5),
        canonical(geometry, "2002-07-01", Sensor.LE07, 3, 3)));

    CompositeCollection result = compositor.composite(series);
    assertEquals(3, result.getComposites().size());
    assertEquals(1, result.getProblems().size());
    assertEquals(2001, ((EmptyYearException) result.getProblems().get(0)).getYear());

    Image empty = result.getComposite(2001);
    assertEquals(LocalDate.of(2001, 1, 1), empty.getDate());
    assertEquals(geometry, empty.getGeometry());
    assertArrayEquals(vector(NAN), empty.getRaster().pixel(0), 0);
    assertArrayEquals(vector(3), result.getComposite(2002).getRaster().pixel(1), 0);
  }

  @Test
  public void testSequentialMatchesParallel() throws Exception {
    YearlyMedoidCompositor.Args args = new YearlyMedoidCompositor.Args();
    args.parallel = false;
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        canonical(geometry, "2000-07-01", Sensor.LT05, 1, 7),
        canonical(geometry, "2000-07-17", Sensor.LE07, 2, 8),
        canonical(geometry, "2000-08-02", Sensor.LT05, 10, 9)));

    Raster sequential = new YearlyMedoidCompositor(args).composite(series)
        .getComposite(2000).getRaster();
    Raster parallel = compositor.composite(series).getComposite(2000).getRaster();
    assertArrayEquals(parallel.getBand(0), sequential.getBand(0), 0);
    assertArrayEquals(new double[] {2, 8}, sequential.getBand("B4"), 0);
  }

  @Test
  public void testEmptySeries() throws Exception {
    CompositeCollection result = compositor.composite(TimeSeries.empty());
    assertTrue(result.getComposites().isEmpty());
    assertFalse(result.hasProblems());
  }

  @Test(expected = CancellationException.class)
  public void testCancelled() throws Exception {
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        canonical(geometry, "2000-07-01", Sensor.LT05, 1, 1)));
    Thread.currentThread().interrupt();
    compositor.composite(series);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrappingWindow() throws Exception {
    YearlyMedoidCompositor.Args args = new YearlyMedoidCompositor.Args();
    args.startDay = MonthDay.of(11, 1);
    args.endDay = MonthDay.of(3, 1);
    new YearlyMedoidCompositor(args);
  }
}
