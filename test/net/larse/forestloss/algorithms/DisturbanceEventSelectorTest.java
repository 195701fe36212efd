package net.larse.forestloss.algorithms;

import net.larse.forestloss.helper.EEArray;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class DisturbanceEventSelectorTest {
  static final double NAN = Double.NaN;

  EEArray segments;

  @Before
  public void setUp() throws Exception {
    // four segments as columns: yod, endYr, startVal, endVal, mag, dur, rate, dsnr
    segments = EEArray.ofRows(
        new double[] {1986, 1995, 2003, 2011},
        new double[] {1994, 2002, 2010, 2018},
        new double[] {700, 650, 200, 600},
        new double[] {650, 200, 600, 550},
        new double[] {50, 450, -400, 50},
        new double[] {8, 7, 7, 7},
        new double[] {6.25, 64.3, -57.1, 7.1},
        new double[] {1, 9, -8, 1});
  }

  @Test
  public void testMostRecentQualifying() throws Exception {
    EEArray event = DisturbanceEventSelector.getResult(segments, 1985, 2020, 0.5);
    assertEquals(1, event.cols());
    assertEquals(2011, event.get(Segment.START_YEAR, 0), 0);
  }

  @Test
  public void testThreshold() throws Exception {
    EEArray event = DisturbanceEventSelector.getResult(segments, 1985, 2020, 5);
    assertEquals(1995, event.get(Segment.START_YEAR, 0), 0);
    assertEquals(450, event.get(Segment.MAGNITUDE, 0), 0);
  }

  @Test
  public void testYearBoundsInclusive() throws Exception {
    EEArray event = DisturbanceEventSelector.getResult(segments, 1986, 2010, 0.5);
    // 2011-2018 ends after hi; 2003-2010 fails the threshold
    assertEquals(1995, event.get(Segment.START_YEAR, 0), 0);

    event = DisturbanceEventSelector.getResult(segments, 1987, 2001, 0.5);
    assertEquals(0, event.cols());
  }

  @Test
  public void testNoDataDsnrNeverQualifies() throws Exception {
    EEArray noRmse = EEArray.ofRows(
        new double[] {2001}, new double[] {2005}, new double[] {-700}, new double[] {-200},
        new double[] {500}, new double[] {4}, new double[] {125}, new double[] {NAN});
    assertEquals(0, DisturbanceEventSelector.getResult(noRmse, 1985, 2020,
        Double.NEGATIVE_INFINITY).cols());
  }

  @Test
  public void testEqualStartYearsKeepOrder() throws Exception {
    EEArray tied = EEArray.ofRows(
        new double[] {2001, 2001}, new double[] {2001, 2005}, new double[] {0, 0},
        new double[] {0, 0}, new double[] {300, 400}, new double[] {0, 4},
        new double[] {NAN, 100}, new double[] {3, 4});
    EEArray event = DisturbanceEventSelector.getResult(tied, 1985, 2020, 1);
    assertEquals(2001, event.get(Segment.END_YEAR, 0), 0);
  }

  @Test
  public void testSelectRaster() throws Exception {
    DisturbanceEventSelector.Args args = new DisturbanceEventSelector.Args();
    args.startYear = 1985;
    args.endYear = 2020;
    args.dsnrThreshold = 5;
    EEArray none = new EEArray(new double[0], 8, 0);
    Raster result = new DisturbanceEventSelector(args).select(
        new EEArray[] {segments, none, null}, GridGeometry.ofSize(3, 1));

    assertEquals(Segment.FIELDS, result.getBandNames());
    assertArrayEquals(new double[] {1995, 2002, 650, 200, 450, 7, 64.3, 9},
        result.pixel(0), 0);
    for (int b = 0; b < result.getBandCount(); b++) {
      assertTrue(Raster.isNoData(result.get(b, 1, 0)));
      assertTrue(Raster.isNoData(result.get(b, 2, 0)));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvertedBounds() throws Exception {
    DisturbanceEventSelector.Args args = new DisturbanceEventSelector.Args();
    args.startYear = 2010;
    args.endYear = 2000;
    new DisturbanceEventSelector(args);
  }
}
