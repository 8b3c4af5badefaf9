package net.larse.stl.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class StlParamsTest {
  private static final double DELTA = 0.001;

  double[] series;

  @Before
  public void setUp() throws Exception {
    series = new double[] {
        5.0, 9.0, 2.0, 9.0, 0.0, 6.0, 3.0, 8.0, 5.0, 8.0,
        7.0, 8.0, 8.0, 0.0, 2.0, 5.0, 0.0, 5.0, 6.0, 7.0,
        3.0, 6.0, 1.0, 4.0, 4.0, 4.0, 3.0, 7.0, 5.0, 8.0};
  }

  @After
  public void tearDown() throws Exception {
    series = null;
  }

  @Test
  public void testFit() {
    StlResult result = StlParams.params().fit(series, 7);

    assertArrayEquals(new double[] {0.36926576, 0.75655484, -1.3324139, 1.9553658, -0.6044802},
        first(result.getSeasonal(), 5), DELTA);
    assertArrayEquals(new double[] {4.804099, 4.9097075, 5.015316, 5.16045, 5.305584},
        first(result.getTrend(), 5), DELTA);
    assertArrayEquals(new double[] {-0.17336464, 3.3337379, -1.6829021, 1.8841844, -4.7011037},
        first(result.getRemainder(), 5), DELTA);
    assertArrayEquals(new double[] {1.0, 1.0, 1.0, 1.0, 1.0}, first(result.getWeights(), 5), DELTA);
  }

  @Test
  public void testFitRobust() {
    StlResult result = StlParams.params().robust(true).fit(series, 7);

    assertArrayEquals(new double[] {0.14922355, 0.47939026, -1.833231, 1.7411387, 0.8200711},
        first(result.getSeasonal(), 5), DELTA);
    assertArrayEquals(new double[] {5.397365, 5.4745436, 5.5517216, 5.6499176, 5.748114},
        first(result.getTrend(), 5), DELTA);
    assertArrayEquals(new double[] {-0.5465884, 3.0460663, -1.7184906, 1.6089439, -6.5681853},
        first(result.getRemainder(), 5), DELTA);
    assertArrayEquals(new double[] {0.99374926, 0.8129377, 0.9385952, 0.9458036, 0.29742217},
        first(result.getWeights(), 5), DELTA);
  }

  @Test
  public void testWeightsAreOneWithoutOuterLoops() {
    StlResult result = StlParams.params().robust(true).outerLoops(0).fit(series, 7);
    for (double w : result.getWeights()) {
      assertEquals(1.0, w, 0.0);
    }
  }

  @Test
  public void testRobustWeightsInUnitInterval() {
    StlResult result = StlParams.params().robust(true).fit(series, 7);
    for (double w : result.getWeights()) {
      assertTrue(w >= 0.0 && w <= 1.0);
    }
  }

  @Test
  public void testReconstruction() {
    StlParams[] configs = {
        StlParams.params(),
        StlParams.params().robust(true),
        StlParams.params().seasonalLength(11).seasonalDegree(1),
        StlParams.params().seasonalJump(3).trendJump(4).lowPassJump(2),
        StlParams.params().innerLoops(3).outerLoops(2),
    };
    for (StlParams params : configs) {
      for (int period : new int[] {2, 3, 7, 12, 15}) {
        StlResult result = params.fit(series, period);
        double[] seasonal = result.getSeasonal();
        double[] trend = result.getTrend();
        double[] remainder = result.getRemainder();
        assertEquals(series.length, seasonal.length);
        assertEquals(series.length, trend.length);
        assertEquals(series.length, remainder.length);
        assertEquals(series.length, result.getWeights().length);
        for (int i = 0; i < series.length; i++) {
          assertEquals(series[i], seasonal[i] + trend[i] + remainder[i], 1e-4);
        }
      }
    }
  }

  @Test
  public void testSeasonalStrength() {
    StlResult result = StlParams.params().fit(series, 7);
    assertEquals(0.284111676315015, result.seasonalStrength(), DELTA);
  }

  @Test
  public void testSeasonalStrengthMax() {
    double[] cycle = new double[30];
    for (int i = 0; i < cycle.length; i++) {
      cycle[i] = i % 7;
    }
    StlResult result = StlParams.params().fit(cycle, 7);
    assertEquals(1.0, result.seasonalStrength(), DELTA);
  }

  @Test
  public void testTrendStrength() {
    StlResult result = StlParams.params().fit(series, 7);
    assertEquals(0.16384245231864702, result.trendStrength(), DELTA);
  }

  @Test
  public void testTrendStrengthMax() {
    double[] ramp = new double[30];
    for (int i = 0; i < ramp.length; i++) {
      ramp[i] = i;
    }
    StlResult result = StlParams.params().fit(ramp, 7);
    assertEquals(1.0, result.trendStrength(), DELTA);
  }

  @Test
  public void testDeterministic() {
    StlParams params = StlParams.params().robust(true);
    StlResult a = params.fit(series, 7);
    StlResult b = params.fit(series, 7);
    assertArrayEquals(a.getSeasonal(), b.getSeasonal(), 0.0);
    assertArrayEquals(a.getTrend(), b.getTrend(), 0.0);
    assertArrayEquals(a.getWeights(), b.getWeights(), 0.0);
  }

  @Test
  public void testSeriesIsNotModified() {
    double[] copy = series.clone();
    StlParams.params().robust(true).fit(series, 7);
    assertArrayEquals(copy, series, 0.0);
  }

  @Test
  public void testResultArraysAreCopies() {
    StlResult result = StlParams.params().fit(series, 7);
    double[] trend = result.getTrend();
    trend[0] = 1000.0;
    assertEquals(4.804099, result.getTrend()[0], DELTA);
  }

  @Test
  public void testParamsAreImmutable() {
    StlParams base = StlParams.params();
    StlParams robust = base.robust(true);

    assertArrayEquals(new double[] {1.0, 1.0, 1.0, 1.0, 1.0},
        first(base.fit(series, 7).getWeights(), 5), 0.0);
    assertEquals(0.29742217, robust.fit(series, 7).getWeights()[4], DELTA);
  }

  @Test
  public void testExplicitDefaultsMatchDerived() {
    // period 7: ns = 7, nt = 15, nl = 7, jumps 1, 2, 1, two inner loops
    StlParams explicit = StlParams.params()
        .seasonalLength(7).trendLength(15).lowPassLength(7)
        .seasonalDegree(0).trendDegree(1).lowPassDegree(1)
        .seasonalJump(1).trendJump(2).lowPassJump(1)
        .innerLoops(2).outerLoops(0);
    StlResult a = explicit.fit(series, 7);
    StlResult b = StlParams.params().fit(series, 7);
    assertArrayEquals(b.getSeasonal(), a.getSeasonal(), 1e-12);
    assertArrayEquals(b.getTrend(), a.getTrend(), 1e-12);
  }

  @Test
  public void testFloatAndListInputs() {
    float[] floats = new float[series.length];
    for (int i = 0; i < series.length; i++) {
      floats[i] = (float) series[i];
    }
    StlResult expected = StlParams.params().fit(series, 7);
    StlResult fromFloats = StlParams.params().fit(floats, 7);
    StlResult fromList = StlParams.params().fit(new DoubleArrayList(series), 7);

    assertArrayEquals(expected.getTrend(), fromFloats.getTrend(), 1e-12);
    assertArrayEquals(expected.getSeasonal(), fromList.getSeasonal(), 1e-12);
  }

  @Test
  public void testConcurrentFits() throws Exception {
    final StlParams params = StlParams.params().robust(true);
    final StlResult expected = params.fit(series, 7);

    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<StlResult>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        futures.add(executor.submit(() -> params.fit(series, 7)));
      }
      for (Future<StlResult> future : futures) {
        StlResult result = future.get();
        assertArrayEquals(expected.getTrend(), result.getTrend(), 0.0);
        assertArrayEquals(expected.getWeights(), result.getWeights(), 0.0);
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testTooFewPeriods() {
    assertInvalid(StlParams.params(), 16, "series has less than two periods");
  }

  @Test
  public void testHugePeriodIsTooLong() {
    assertInvalid(StlParams.params(), Integer.MAX_VALUE / 2 + 2, "series has less than two periods");
  }

  @Test
  public void testPeriodOne() {
    assertInvalid(StlParams.params(), 1, "period must be at least 2");
  }

  @Test
  public void testBadDegrees() {
    assertInvalid(StlParams.params().seasonalDegree(2), 7, "seasonal_degree must be 0 or 1");
    assertInvalid(StlParams.params().trendDegree(2), 7, "trend_degree must be 0 or 1");
    assertInvalid(StlParams.params().lowPassDegree(-1), 7, "low_pass_degree must be 0 or 1");
  }

  @Test
  public void testEvenWindows() {
    assertInvalid(StlParams.params().seasonalLength(8), 7, "seasonal_length must be odd");
    assertInvalid(StlParams.params().trendLength(14), 7, "trend_length must be odd");
    assertInvalid(StlParams.params().lowPassLength(6), 7, "low_pass_length must be odd");
  }

  @Test
  public void testShortWindows() {
    assertInvalid(StlParams.params().seasonalLength(1), 7, "seasonal_length must be at least 3");
    assertInvalid(StlParams.params().trendLength(2), 7, "trend_length must be at least 3");
    assertInvalid(StlParams.params().lowPassLength(2), 7, "low_pass_length must be at least 3");
  }

  @Test
  public void testBadStridesAndLoops() {
    assertInvalid(StlParams.params().seasonalJump(0), 7, "seasonal_jump must be at least 1");
    assertInvalid(StlParams.params().trendJump(0), 7, "trend_jump must be at least 1");
    assertInvalid(StlParams.params().lowPassJump(0), 7, "low_pass_jump must be at least 1");
    assertInvalid(StlParams.params().innerLoops(0), 7, "inner_loops must be at least 1");
    assertInvalid(StlParams.params().outerLoops(-1), 7, "outer_loops must not be negative");
  }

  private void assertInvalid(StlParams params, int period, String message) {
    try {
      params.fit(series, period);
      fail("expected failure: " + message);
    } catch (IllegalArgumentException e) {
      assertEquals(message, e.getMessage());
    }
  }

  private static double[] first(double[] values, int n) {
    return Arrays.copyOf(values, Math.min(n, values.length));
  }
}
