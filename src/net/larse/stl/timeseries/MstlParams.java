/*
 * Copyright (c) 2015 Zhiqiang Yang.
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

package net.larse.stl.timeseries;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.larse.stl.helper.ArrayHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parameters of a multiple seasonal decomposition (MSTL). Instances are immutable;
 * each setter returns a new instance.
 *
 * <p>MSTL runs STL once per period, from the shortest period to the longest,
 * removing each seasonal component from a running deseasonalized series. The whole
 * pass is repeated {@link #iterations} times, adding a period's previous seasonal
 * component back before it is re-estimated.
 *
 * Bandara, K., Hyndman, R. J., & Bergmeir, C. (2021). MSTL: A Seasonal-Trend
 * Decomposition Algorithm for Time Series with Multiple Seasonal Patterns.
 */
public class MstlParams {
  private static final Logger logger = LoggerFactory.getLogger(MstlParams.class);

  private int iterations = 2;
  private Double lambda;
  private IntArrayList seasonalLengths;
  private StlParams stlParams = new StlParams();

  public MstlParams() {}

  private MstlParams(MstlParams other) {
    this.iterations = other.iterations;
    this.lambda = other.lambda;
    this.seasonalLengths = other.seasonalLengths;
    this.stlParams = other.stlParams;
  }

  public static MstlParams params() {
    return new MstlParams();
  }

  /** Number of passes over all periods, ignored when only one period is given. */
  public MstlParams iterations(int iterations) {
    MstlParams p = new MstlParams(this);
    p.iterations = iterations;
    return p;
  }

  /** Box-Cox lambda in [0, 1] applied to the series before decomposition. */
  public MstlParams lambda(double lambda) {
    MstlParams p = new MstlParams(this);
    p.lambda = lambda;
    return p;
  }

  /** Seasonal window for each period, in the same order as the periods. */
  public MstlParams seasonalLengths(int... lengths) {
    Preconditions.checkNotNull(lengths, "lengths");
    MstlParams p = new MstlParams(this);
    p.seasonalLengths = new IntArrayList(lengths);
    return p;
  }

  public MstlParams stlParams(StlParams stlParams) {
    Preconditions.checkNotNull(stlParams, "stlParams");
    MstlParams p = new MstlParams(this);
    p.stlParams = stlParams;
    return p;
  }

  public MstlResult fit(float[] series, int... periods) {
    Preconditions.checkNotNull(series, "series");
    return fit(ArrayHelper.toDoubles(series), periods);
  }

  public MstlResult fit(DoubleArrayList series, IntArrayList periods) {
    Preconditions.checkNotNull(series, "series");
    Preconditions.checkNotNull(periods, "periods");
    return fit(series.toDoubleArray(), periods.toIntArray());
  }

  /**
   * Decomposes series into one seasonal component per period plus trend and
   * remainder.
   *
   * @param series the series, not modified
   * @param periods the seasonal periods, duplicates allowed
   * @throws IllegalArgumentException if a parameter is invalid
   */
  public MstlResult fit(double[] series, int... periods) {
    Preconditions.checkNotNull(series, "series");
    Preconditions.checkNotNull(periods, "periods");

    for (int period : periods) {
      Preconditions.checkArgument(period >= 2, "periods must be at least 2");
      Preconditions.checkArgument(period <= series.length / 2, "series has less than two periods");
    }

    if (lambda != null) {
      Preconditions.checkArgument(lambda >= 0.0 && lambda <= 1.0, "lambda must be between 0 and 1");
    }

    if (seasonalLengths != null) {
      Preconditions.checkArgument(seasonalLengths.size() == periods.length,
          "seasonal_lengths must have the same length as periods");
    }

    Preconditions.checkArgument(periods.length > 0, "periods must not be empty");
    if (periods.length > 1) {
      Preconditions.checkArgument(iterations >= 1, "iterations must be at least 1");
    }

    stlParams.validate();
    if (seasonalLengths != null) {
      for (int i = 0; i < seasonalLengths.size(); i++) {
        stlParams.seasonalLength(seasonalLengths.getInt(i)).validate();
      }
    }

    return mstl(series, periods);
  }

  private MstlResult mstl(double[] x, int[] periods) {
    int[] order = ArrayHelper.ascendingOrder(periods);
    int iter = periods.length == 1 ? 1 : iterations;

    double[] deseas = lambda != null ? BoxCox.transform(x, lambda) : x.clone();

    double[][] seasonality = new double[periods.length][];
    double[] trend = null;

    for (int j = 0; j < iter; j++) {
      for (int rank = 0; rank < order.length; rank++) {
        int idx = order[rank];
        if (j > 0) {
          ArrayHelper.addInPlace(deseas, seasonality[idx]);
        }

        logger.debug("MSTL round {}: fitting period {} (rank {})", j + 1, periods[idx], rank);
        StlResult fit = paramsFor(idx, rank).fit(deseas, periods[idx]);

        seasonality[idx] = fit.seasonal();
        trend = fit.trend();

        ArrayHelper.subtractInPlace(deseas, seasonality[idx]);
      }
    }

    double[] remainder = ArrayHelper.subtract(deseas, trend);
    List<double[]> seasonal = new ArrayList<>(Arrays.asList(seasonality));
    return new MstlResult(seasonal, trend, remainder);
  }

  /**
   * Seasonal window for a period: the per-period override, else an explicit
   * window of the STL parameters, else 7 + 4 * (rank + 1).
   */
  private StlParams paramsFor(int idx, int rank) {
    if (seasonalLengths != null) {
      return stlParams.seasonalLength(seasonalLengths.getInt(idx));
    }
    if (stlParams.hasSeasonalLength()) {
      return stlParams;
    }
    return stlParams.seasonalLength(7 + 4 * (rank + 1));
  }
}
