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

import java.util.Arrays;
import org.apache.commons.math.stat.descriptive.rank.Median;

/**
 * Implements the STL procedure in the paper:
 * R.B. Cleveland, W.S.Cleveland, J.E. McRae, and I. Terpenning,
 * STL: A Seasonal-Trend Decomposition Procedure Based on Loess,
 * Journal of Official Statistics, 6(1), 3-33.
 *
 * Based on the netlib stl implementation. Routine names follow the original
 * source (stl, onestp, ss, fts, ma, rwts) to keep cross checking easy.
 *
 * @author Zhiqiang Yang, 3/11/2015
 */
public class TimeSeriesUtils {

  /**
   * Runs the inner and outer loops of STL. Parameters are expected to be validated
   * already, see {@link StlParams}.
   *
   * @param y the series
   * @param np period
   * @param ns spans for s smoother
   * @param nt spans for t smoother
   * @param nl spans for l smoother
   * @param isdeg local degree for s smoother
   * @param itdeg local degree for t smoother
   * @param ildeg local degree for l smoother
   * @param nsjump stride of the s smoother
   * @param ntjump stride of the t smoother
   * @param nljump stride of the l smoother
   * @param ni number of inner iterations
   * @param no number of outer (robust) iterations
   * @param rw receives the robustness weights
   * @param season receives the seasonal component
   * @param trend receives the trend component
   */
  public static void stl(double[] y, int np,
                         int ns, int nt, int nl,
                         int isdeg, int itdeg, int ildeg,
                         int nsjump, int ntjump, int nljump,
                         int ni, int no,
                         double[] rw, double[] season, double[] trend) {
    int n = y.length;
    Workspace work = new Workspace(n, np);

    Arrays.fill(trend, 0.0);
    boolean userw = false;
    int k = 0;

    // outer loop -- robustness iterations
    while (true) {
      onestp(y, np, ns, nt, nl, isdeg, itdeg, ildeg, nsjump, ntjump, nljump, ni,
          userw, rw, season, trend, work);
      k++;
      if (k > no) {
        break;
      }
      for (int i = 0; i < n; i++) {
        work.work1[i] = trend[i] + season[i];
      }
      rwts(y, n, work.work1, rw);
      userw = true;
    }

    // robustness weights when there were no robustness iterations
    if (no <= 0) {
      Arrays.fill(rw, 0, n, 1.0);
    }
  }

  /** One outer pass: ni inner iterations with the current weights. */
  static void onestp(double[] y, int np, int ns, int nt, int nl,
                     int isdeg, int itdeg, int ildeg,
                     int nsjump, int ntjump, int nljump,
                     int ni, boolean userw, double[] rw,
                     double[] season, double[] trend, Workspace work) {
    int n = y.length;

    for (int j = 0; j < ni; j++) {
      for (int i = 0; i < n; i++) {
        work.work1[i] = y[i] - trend[i];
      }

      ss(work.work1, n, np, ns, isdeg, nsjump, userw, rw, work.work2,
          work.work3, work.work4, work.work5, work.work6);
      fts(work.work2, n + 2 * np, np, work.work3, work.work1);
      Loess.ess(work.work3, n, nl, ildeg, nljump, false, work.work4, work.work1, 0, work.work5);

      for (int i = 0; i < n; i++) {
        season[i] = work.work2[np + i] - work.work1[i];
      }
      for (int i = 0; i < n; i++) {
        work.work1[i] = y[i] - season[i];
      }

      Loess.ess(work.work1, n, nt, itdeg, ntjump, userw, rw, trend, 0, work.work3);
    }
  }

  /**
   * Seasonal smoothing of the cycle-subseries.
   *
   * @param y detrended series
   * @param n length of y
   * @param np period
   * @param ns window of the s smoother
   * @param isdeg degree of the s smoother
   * @param nsjump stride of the s smoother
   * @param userw whether rw should be applied
   * @param rw robustness weights
   * @param season receives n + 2 * np values, one extra cycle on each end
   * @param work1 holds a cycle-subseries
   * @param work2 holds the smoothed cycle-subseries plus the two end points
   * @param work3 holds the weights of a cycle-subseries
   * @param work4 scratch for the estimator
   */
  static void ss(double[] y, int n, int np, int ns, int isdeg, int nsjump,
                 boolean userw, double[] rw, double[] season,
                 double[] work1, double[] work2, double[] work3, double[] work4) {
    for (int j = 1; j <= np; j++) {
      int k = (n - j) / np + 1;

      for (int i = 1; i <= k; i++) {
        work1[i - 1] = y[(i - 1) * np + j - 1];
      }
      if (userw) {
        for (int i = 1; i <= k; i++) {
          work3[i - 1] = rw[(i - 1) * np + j - 1];
        }
      }

      Loess.ess(work1, k, ns, isdeg, nsjump, userw, work3, work2, 1, work4);

      int nright = Math.min(ns, k);
      boolean ok = Loess.est(work1, k, ns, isdeg, 0.0, work2, 0, 1, nright, work4, userw, work3);
      if (!ok) {
        work2[0] = work2[1];
      }

      int nleft = Math.max(1, k - ns + 1);
      ok = Loess.est(work1, k, ns, isdeg, k + 1, work2, k + 1, nleft, k, work4, userw, work3);
      if (!ok) {
        work2[k + 1] = work2[k];
      }

      for (int m = 1; m <= k + 2; m++) {
        season[(m - 1) * np + j - 1] = work2[m - 1];
      }
    }
  }

  /**
   * Low-pass filter: moving averages of length np, np and 3.
   *
   * @param x input of length n
   * @param n length of x
   * @param np period
   * @param trend receives n - 2 * np values
   * @param work scratch, at least n - np + 1 long
   */
  static void fts(double[] x, int n, int np, double[] trend, double[] work) {
    ma(x, n, np, trend);
    ma(trend, n - np + 1, np, work);
    ma(work, n - 2 * np + 2, 3, trend);
  }

  /**
   * Simple moving average of length len over x[0..n-1], written to
   * ave[0..n-len].
   */
  static void ma(double[] x, int n, int len, double[] ave) {
    int newn = n - len + 1;
    double flen = len;

    double v = 0.0;
    for (int i = 0; i < len; i++) {
      v += x[i];
    }
    ave[0] = v / flen;

    // window down the array
    int k = len;
    int m = 0;
    for (int j = 1; j < newn; j++) {
      v = v - x[m] + x[k];
      ave[j] = v / flen;
      k++;
      m++;
    }
  }

  /**
   * Bisquare robustness weights from the residuals of fit, scaled by six times
   * the median absolute residual.
   *
   * @param y the series
   * @param n length of y
   * @param fit current trend + season
   * @param rw receives the weights
   */
  static void rwts(double[] y, int n, double[] fit, double[] rw) {
    double[] absResiduals = new double[n];
    for (int i = 0; i < n; i++) {
      absResiduals[i] = Math.abs(y[i] - fit[i]);
    }

    // Median sorts its own copy
    double cmad = 6.0 * new Median().evaluate(absResiduals);
    double c9 = 0.999 * cmad;
    double c1 = 0.001 * cmad;

    for (int i = 0; i < n; i++) {
      double r = absResiduals[i];
      if (r <= c1) {
        rw[i] = 1.0;
      } else if (r <= c9) {
        double u = r / cmad;
        rw[i] = (1.0 - u * u) * (1.0 - u * u);
      } else {
        rw[i] = 0.0;
      }
    }
  }

  /** Scratch buffers of length n + 2 * np, local to a single fit. */
  static final class Workspace {
    final double[] work1;
    final double[] work2;
    final double[] work3;
    final double[] work4;
    final double[] work5;
    final double[] work6;

    Workspace(int n, int np) {
      int size = n + 2 * np;
      work1 = new double[size];
      work2 = new double[size];
      work3 = new double[size];
      work4 = new double[size];
      work5 = new double[size];
      work6 = new double[size];
    }
  }
}
