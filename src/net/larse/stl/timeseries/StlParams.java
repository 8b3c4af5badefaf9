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
import net.larse.stl.helper.ArrayHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parameters of a seasonal decomposition by loess. Instances are immutable; each
 * setter returns a new instance.
 *
 * <p>Unset windows, strides and loop counts are derived from the period when
 * {@link #fit} is called:
 * <ul>
 *   <li>seasonal window: the period, at least 3 and odd
 *   <li>trend window: ceil(1.5 * np / (1 - 1.5 / ns)), at least 3 and odd
 *   <li>low-pass window: the period, made odd
 *   <li>strides: ceil(window / 10)
 *   <li>inner loops: 1 if robust, else 2; outer loops: 15 if robust, else 0
 * </ul>
 * Explicit windows are validated instead, an even or too small window fails.
 */
public class StlParams {
  private static final Logger logger = LoggerFactory.getLogger(StlParams.class);

  private Integer seasonalLength;
  private Integer trendLength;
  private Integer lowPassLength;
  private int seasonalDegree = 0;
  private int trendDegree = 1;
  private Integer lowPassDegree;
  private Integer seasonalJump;
  private Integer trendJump;
  private Integer lowPassJump;
  private Integer innerLoops;
  private Integer outerLoops;
  private boolean robust = false;

  public StlParams() {}

  private StlParams(StlParams other) {
    this.seasonalLength = other.seasonalLength;
    this.trendLength = other.trendLength;
    this.lowPassLength = other.lowPassLength;
    this.seasonalDegree = other.seasonalDegree;
    this.trendDegree = other.trendDegree;
    this.lowPassDegree = other.lowPassDegree;
    this.seasonalJump = other.seasonalJump;
    this.trendJump = other.trendJump;
    this.lowPassJump = other.lowPassJump;
    this.innerLoops = other.innerLoops;
    this.outerLoops = other.outerLoops;
    this.robust = other.robust;
  }

  public static StlParams params() {
    return new StlParams();
  }

  public StlParams seasonalLength(int ns) {
    StlParams p = new StlParams(this);
    p.seasonalLength = ns;
    return p;
  }

  public StlParams trendLength(int nt) {
    StlParams p = new StlParams(this);
    p.trendLength = nt;
    return p;
  }

  public StlParams lowPassLength(int nl) {
    StlParams p = new StlParams(this);
    p.lowPassLength = nl;
    return p;
  }

  public StlParams seasonalDegree(int isdeg) {
    StlParams p = new StlParams(this);
    p.seasonalDegree = isdeg;
    return p;
  }

  public StlParams trendDegree(int itdeg) {
    StlParams p = new StlParams(this);
    p.trendDegree = itdeg;
    return p;
  }

  public StlParams lowPassDegree(int ildeg) {
    StlParams p = new StlParams(this);
    p.lowPassDegree = ildeg;
    return p;
  }

  public StlParams seasonalJump(int nsjump) {
    StlParams p = new StlParams(this);
    p.seasonalJump = nsjump;
    return p;
  }

  public StlParams trendJump(int ntjump) {
    StlParams p = new StlParams(this);
    p.trendJump = ntjump;
    return p;
  }

  public StlParams lowPassJump(int nljump) {
    StlParams p = new StlParams(this);
    p.lowPassJump = nljump;
    return p;
  }

  public StlParams innerLoops(int ni) {
    StlParams p = new StlParams(this);
    p.innerLoops = ni;
    return p;
  }

  public StlParams outerLoops(int no) {
    StlParams p = new StlParams(this);
    p.outerLoops = no;
    return p;
  }

  public StlParams robust(boolean robust) {
    StlParams p = new StlParams(this);
    p.robust = robust;
    return p;
  }

  boolean hasSeasonalLength() {
    return seasonalLength != null;
  }

  public StlResult fit(float[] y, int period) {
    Preconditions.checkNotNull(y, "series");
    return fit(ArrayHelper.toDoubles(y), period);
  }

  public StlResult fit(DoubleArrayList y, int period) {
    Preconditions.checkNotNull(y, "series");
    return fit(y.toDoubleArray(), period);
  }

  /**
   * Decomposes y into seasonal, trend and remainder for the given period.
   *
   * @param y the series, not modified
   * @param period number of observations per cycle
   * @throws IllegalArgumentException if a parameter is invalid
   */
  public StlResult fit(double[] y, int period) {
    Preconditions.checkNotNull(y, "series");
    int n = y.length;

    Preconditions.checkArgument(period >= 2, "period must be at least 2");
    Preconditions.checkArgument(period <= n / 2, "series has less than two periods");
    validate();

    int ns = seasonalLength != null ? seasonalLength : nextOdd(Math.max(period, 3));

    int nt;
    if (trendLength != null) {
      nt = trendLength;
    } else {
      nt = (int) Math.ceil((1.5 * period) / (1.0 - 1.5 / ns));
      nt = nextOdd(Math.max(nt, 3));
    }

    int nl = lowPassLength != null ? lowPassLength : nextOdd(period);

    int isdeg = seasonalDegree;
    int itdeg = trendDegree;
    int ildeg = lowPassDegree != null ? lowPassDegree : itdeg;

    int ni = innerLoops != null ? innerLoops : (robust ? 1 : 2);
    int no = outerLoops != null ? outerLoops : (robust ? 15 : 0);

    int nsjump = seasonalJump != null ? seasonalJump : (int) Math.ceil(ns / 10.0);
    int ntjump = trendJump != null ? trendJump : (int) Math.ceil(nt / 10.0);
    int nljump = lowPassJump != null ? lowPassJump : (int) Math.ceil(nl / 10.0);

    logger.debug("STL fit: n={} np={} ns={} nt={} nl={} degrees=({},{},{}) "
            + "jumps=({},{},{}) ni={} no={}",
        n, period, ns, nt, nl, isdeg, itdeg, ildeg, nsjump, ntjump, nljump, ni, no);

    double[] seasonal = new double[n];
    double[] trend = new double[n];
    double[] weights = new double[n];

    TimeSeriesUtils.stl(y, period, ns, nt, nl, isdeg, itdeg, ildeg,
        nsjump, ntjump, nljump, ni, no, weights, seasonal, trend);

    double[] remainder = new double[n];
    for (int i = 0; i < n; i++) {
      remainder[i] = y[i] - seasonal[i] - trend[i];
    }

    return new StlResult(seasonal, trend, remainder, weights);
  }

  void validate() {
    if (seasonalLength != null) {
      Preconditions.checkArgument(seasonalLength >= 3, "seasonal_length must be at least 3");
    }
    if (trendLength != null) {
      Preconditions.checkArgument(trendLength >= 3, "trend_length must be at least 3");
    }
    if (lowPassLength != null) {
      Preconditions.checkArgument(lowPassLength >= 3, "low_pass_length must be at least 3");
    }

    Preconditions.checkArgument(isDegree(seasonalDegree), "seasonal_degree must be 0 or 1");
    Preconditions.checkArgument(isDegree(trendDegree), "trend_degree must be 0 or 1");
    if (lowPassDegree != null) {
      Preconditions.checkArgument(isDegree(lowPassDegree), "low_pass_degree must be 0 or 1");
    }

    if (seasonalLength != null) {
      Preconditions.checkArgument(seasonalLength % 2 == 1, "seasonal_length must be odd");
    }
    if (trendLength != null) {
      Preconditions.checkArgument(trendLength % 2 == 1, "trend_length must be odd");
    }
    if (lowPassLength != null) {
      Preconditions.checkArgument(lowPassLength % 2 == 1, "low_pass_length must be odd");
    }

    if (seasonalJump != null) {
      Preconditions.checkArgument(seasonalJump >= 1, "seasonal_jump must be at least 1");
    }
    if (trendJump != null) {
      Preconditions.checkArgument(trendJump >= 1, "trend_jump must be at least 1");
    }
    if (lowPassJump != null) {
      Preconditions.checkArgument(lowPassJump >= 1, "low_pass_jump must be at least 1");
    }
    if (innerLoops != null) {
      Preconditions.checkArgument(innerLoops >= 1, "inner_loops must be at least 1");
    }
    if (outerLoops != null) {
      Preconditions.checkArgument(outerLoops >= 0, "outer_loops must not be negative");
    }
  }

  private static boolean isDegree(int degree) {
    return degree == 0 || degree == 1;
  }

  private static int nextOdd(int value) {
    return value % 2 == 0 ? value + 1 : value;
  }
}
