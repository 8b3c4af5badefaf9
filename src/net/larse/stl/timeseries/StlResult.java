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
 * The result of a seasonal decomposition by loess of a single period.
 *
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6, 3–73.
 */
public class StlResult {
  private final double[] seasonal;
  private final double[] trend;
  private final double[] remainder;
  private final double[] weights;

  StlResult(double[] seasonal, double[] trend, double[] remainder, double[] weights) {
    this.seasonal = seasonal;
    this.trend = trend;
    this.remainder = remainder;
    this.weights = weights;
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getRemainder() {
    return remainder.clone();
  }

  /** Robustness weights, all 1.0 unless outer loops were run. */
  public double[] getWeights() {
    return weights.clone();
  }

  public double seasonalStrength() {
    return Strength.of(seasonal, remainder);
  }

  public double trendStrength() {
    return Strength.of(trend, remainder);
  }

  // uncopied views for MSTL
  double[] seasonal() {
    return seasonal;
  }

  double[] trend() {
    return trend;
  }
}
