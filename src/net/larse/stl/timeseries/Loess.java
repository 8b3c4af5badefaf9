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

/**
 * Locally weighted regression used by every smoothing pass of STL.
 *
 * <p>Positions handed to {@link #est} are 1-based, as in the netlib stl source by
 * Cleveland et al., so that the neighbor range [nleft, nright] and the bandwidth
 * arithmetic read the same as the published algorithm. Arrays are indexed with
 * {@code j - 1}.
 *
 * @author Zhiqiang Yang, 3/11/2015
 */
public final class Loess {
  private Loess() {}

  /**
   * Computes a single fitted value at position xs using a tri-cube kernel over the
   * neighbors nleft..nright (1-based, inclusive).
   *
   * @param y the values to be smoothed, y[0] is position 1
   * @param n number of values in y to consider
   * @param len the smoothing window length
   * @param ideg local degree, 0 (constant) or 1 (linear)
   * @param xs the target position
   * @param ys receives the fitted value at ys[ysIndex]
   * @param ysIndex where to store the fitted value
   * @param nleft first neighbor position
   * @param nright last neighbor position
   * @param w scratch for the neighbor weights, at least nright long
   * @param userw whether rw should be applied
   * @param rw robustness weights, same indexing as y
   * @return false if all neighbors have zero weight and nothing was written
   */
  public static boolean est(double[] y, int n, int len, int ideg, double xs,
                            double[] ys, int ysIndex, int nleft, int nright,
                            double[] w, boolean userw, double[] rw) {
    double range = n - 1.0;
    double h = Math.max(xs - nleft, nright - xs);

    // extrapolating beyond the data: widen by half of the missing window
    if (len > n) {
      h += (len - n) / 2;
    }

    double h9 = 0.999 * h;
    double h1 = 0.001 * h;

    double a = 0.0;
    for (int j = nleft; j <= nright; j++) {
      w[j - 1] = 0.0;
      double r = Math.abs(j - xs);
      if (r <= h9) {
        if (r <= h1) {
          w[j - 1] = 1.0;
        } else {
          w[j - 1] = Math.pow(1.0 - Math.pow(r / h, 3), 3);
        }
        if (userw) {
          w[j - 1] *= rw[j - 1];
        }
        a += w[j - 1];
      }
    }

    if (a <= 0.0) {
      return false;
    }

    for (int j = nleft; j <= nright; j++) {
      w[j - 1] /= a;
    }

    if (h > 0.0 && ideg > 0) {
      // weighted center of the positions
      double center = 0.0;
      for (int j = nleft; j <= nright; j++) {
        center += w[j - 1] * j;
      }
      double b = xs - center;
      double c = 0.0;
      for (int j = nleft; j <= nright; j++) {
        c += w[j - 1] * (j - center) * (j - center);
      }
      // only fit a slope when the points are spread out enough
      if (Math.sqrt(c) > 0.001 * range) {
        b /= c;
        for (int j = nleft; j <= nright; j++) {
          w[j - 1] *= b * (j - center) + 1.0;
        }
      }
    }

    double fitted = 0.0;
    for (int j = nleft; j <= nright; j++) {
      fitted += w[j - 1] * y[j - 1];
    }
    ys[ysIndex] = fitted;
    return true;
  }

  /**
   * Loess-smooths y[0..n-1] into ys[offset..offset+n-1].
   *
   * <p>Exact fits are computed every njump positions and the positions in
   * between are linearly interpolated. A failed fit falls back to the raw value.
   *
   * @param y values to smooth
   * @param n number of values
   * @param len window length
   * @param ideg local degree
   * @param njump stride between exact fits, clamped to n - 1
   * @param userw whether rw should be applied
   * @param rw robustness weights
   * @param ys output array
   * @param offset index in ys that receives the first smoothed value
   * @param res scratch, at least n long
   */
  public static void ess(double[] y, int n, int len, int ideg, int njump,
                         boolean userw, double[] rw, double[] ys, int offset, double[] res) {
    if (n < 2) {
      ys[offset] = y[0];
      return;
    }

    int nleft = 0;
    int nright = 0;

    int newnj = Math.min(njump, n - 1);
    if (len >= n) {
      nleft = 1;
      nright = n;
      for (int i = 1; i <= n; i += newnj) {
        fitOrFallback(y, n, len, ideg, i, ys, offset, nleft, nright, res, userw, rw);
      }
    } else if (newnj == 1) {
      int nsh = (len + 1) / 2;
      nleft = 1;
      nright = len;
      for (int i = 1; i <= n; i++) {
        if (i > nsh && nright != n) {
          nleft++;
          nright++;
        }
        fitOrFallback(y, n, len, ideg, i, ys, offset, nleft, nright, res, userw, rw);
      }
    } else {
      int nsh = (len + 1) / 2;
      for (int i = 1; i <= n; i += newnj) {
        if (i < nsh) {
          nleft = 1;
          nright = len;
        } else if (i >= n - nsh + 1) {
          nleft = n - len + 1;
          nright = n;
        } else {
          nleft = i - nsh + 1;
          nright = len + i - nsh;
        }
        fitOrFallback(y, n, len, ideg, i, ys, offset, nleft, nright, res, userw, rw);
      }
    }

    if (newnj == 1) {
      return;
    }

    for (int i = 1; i <= n - newnj; i += newnj) {
      double delta = (ys[offset + i + newnj - 1] - ys[offset + i - 1]) / newnj;
      for (int j = i + 1; j <= i + newnj - 1; j++) {
        ys[offset + j - 1] = ys[offset + i - 1] + delta * (j - i);
      }
    }

    // the stride may not land on the last position; fit it and fill the tail
    int k = ((n - 1) / newnj) * newnj + 1;
    if (k != n) {
      fitOrFallback(y, n, len, ideg, n, ys, offset, nleft, nright, res, userw, rw);
      if (k != n - 1) {
        double delta = (ys[offset + n - 1] - ys[offset + k - 1]) / (n - k);
        for (int j = k + 1; j <= n - 1; j++) {
          ys[offset + j - 1] = ys[offset + k - 1] + delta * (j - k);
        }
      }
    }
  }

  private static void fitOrFallback(double[] y, int n, int len, int ideg, int i,
                                    double[] ys, int offset, int nleft, int nright,
                                    double[] res, boolean userw, double[] rw) {
    if (!est(y, n, len, ideg, i, ys, offset + i - 1, nleft, nright, res, userw, rw)) {
      ys[offset + i - 1] = y[i - 1];
    }
  }
}
