package net.larse.forestloss.algorithms;

import com.google.common.collect.ImmutableList;

import net.larse.forestloss.helper.EEArray;
import net.larse.forestloss.helper.GridGeometry;
import net.larse.forestloss.helper.Raster;
import net.larse.forestloss.landsat.ArchiveProvider;
import net.larse.forestloss.landsat.QaMask;
import net.larse.forestloss.landsat.Sensor;
import net.larse.forestloss.timeseries.Image;
import net.larse.forestloss.timeseries.TimeSeries;

import org.junit.Before;
import org.junit.Test;

import java.time.LocalDate;
import java.util.Arrays;

import static org.junit.Assert.*;

public class DisturbanceMappingTest {
  GridGeometry aoi;
  ArchiveProvider provider;
  DisturbanceMapping mapping;

  @Before
  public void setUp() throws Exception {
    aoi = GridGeometry.ofSize(2, 1);
    // TM in 2000, OLI in 2014, nothing from ETM+
    provider = request -> {
      switch (request.getSensor()) {
        case LT05:
          return ImmutableList.of(raw(request.getSensor(), "2000-07-01"));
        case LC08:
          return ImmutableList.of(raw(request.getSensor(), "2014-07-01"));
        default:
          return ImmutableList.of();
      }
    };

    DisturbanceMapping.Args args = new DisturbanceMapping.Args();
    args.ftvBands = ImmutableList.of("B5");
    args.dsnrThreshold = 1;
    mapping = new DisturbanceMapping(args);
  }

  /** Bands B1..B7 holding 1000 * band number; the second pixel is cloudy. */
  Image raw(Sensor sensor, String date) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    double[][] data = new double[8][];
    for (int b = 1; b <= 7; b++) {
      names.add("B" + b);
      data[b - 1] = new double[aoi.size()];
      Arrays.fill(data[b - 1], 1000 * b);
    }
    names.add(QaMask.QA_BAND);
    data[7] = new double[] {66, QaMask.CLOUD_BIT};
    return new Image(new Raster(aoi, names.build(), data), LocalDate.parse(date), sensor);
  }

  @Test
  public void testSurfaceReflectanceCollection() throws Exception {
    CompositeCollection composites = mapping.buildSurfaceReflectanceCollection(provider, aoi);
    assertFalse(composites.hasProblems());
    assertEquals(2, composites.getComposites().size());

    Raster tm = composites.getComposite(2000).getRaster();
    assertEquals(4000.0, tm.getBand("B4")[0], 0);
    assertTrue(Raster.isNoData(tm.getBand("B4")[1]));

    // OLI B5 (5000) feeds canonical B4: (5000 + 21) / 1.0073 = 4984.6
    Raster oli = composites.getComposite(2014).getRaster();
    assertEquals(4984.0, oli.getBand("B4")[0], 0);
  }

  @Test
  public void testTrendInput() throws Exception {
    CompositeCollection composites = mapping.buildSurfaceReflectanceCollection(provider, aoi);
    TimeSeries input = mapping.buildTrendInput(composites.getComposites());

    assertEquals(2, input.size());
    Raster first = input.get(0).getRaster();
    assertEquals(ImmutableList.of("NBR", "ftv_B5"), first.getBandNames());
    // (4000 - 7000) / 11000, flipped and scaled
    assertEquals(3000.0 / 11, first.getBand("NBR")[0], 1e-9);
    assertEquals(5000.0, first.getBand("ftv_B5")[0], 0);
    assertTrue(Raster.isNoData(first.getBand("NBR")[1]));
    assertEquals(LocalDate.of(2014, 1, 1), input.get(1).getDate());
  }

  @Test
  public void testExtractDisturbances() throws Exception {
    EEArray fit = LandTrendrResult.toArray(
        new double[] {2000, 2005, 2010},
        new double[] {-690, -210, -590},
        new double[] {-700, -200, -600},
        ImmutableList.of(0, 1, 2));
    LandTrendrResult result = new LandTrendrResult(aoi, new EEArray[] {fit, null},
        new double[] {50, Double.NaN});

    Raster events = mapping.extractDisturbances(result);
    assertEquals(Segment.FIELDS, events.getBandNames());
    assertArrayEquals(new double[] {2001, 2005, 700, 200, 500, 4, 125, 10},
        events.pixel(0), 1e-9);
    for (double value : events.pixel(1)) {
      assertTrue(Raster.isNoData(value));
    }
  }

  @Test
  public void testEventYearsNarrowSelection() throws Exception {
    EEArray fit = LandTrendrResult.toArray(
        new double[] {2000, 2005, 2010},
        new double[] {-690, -210, -590},
        new double[] {-700, -200, -600},
        ImmutableList.of(0, 1, 2));
    LandTrendrResult result = new LandTrendrResult(GridGeometry.ofSize(1, 1),
        new EEArray[] {fit}, new double[] {50});

    DisturbanceMapping.Args args = new DisturbanceMapping.Args();
    args.dsnrThreshold = 1;
    args.eventStartYear = 2003;
    // the 2001-2005 loss starts before the event range, although the archive range covers it
    assertTrue(Raster.isNoData(new DisturbanceMapping(args).extractDisturbances(result)
        .getBand("yod")[0]));

    args.eventStartYear = 2001;
    args.eventEndYear = 2004;
    assertTrue(Raster.isNoData(new DisturbanceMapping(args).extractDisturbances(result)
        .getBand("yod")[0]));

    args.eventEndYear = 2005;
    assertEquals(2001.0, new DisturbanceMapping(args).extractDisturbances(result)
        .getBand("yod")[0], 0);
  }
}
