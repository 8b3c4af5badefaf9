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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The result of a multiple seasonal decomposition: one seasonal component per
 * requested period, in request order, and a shared trend and remainder.
 *
 * <p>When a Box-Cox transform was requested, all components are in transformed
 * units.
 */
public class MstlResult {
  private final List<double[]> seasonal;
  private final double[] trend;
  private final double[] remainder;

  MstlResult(List<double[]> seasonal, double[] trend, double[] remainder) {
    this.seasonal = seasonal;
    this.trend = trend;
    this.remainder = remainder;
  }

  /** Number of seasonal components, same as the number of requested periods. */
  public int size() {
    return seasonal.size();
  }

  public double[] getSeasonal(int index) {
    return seasonal.get(index).clone();
  }

  public List<double[]> getSeasonal() {
    List<double[]> copy = new ArrayList<>(seasonal.size());
    for (double[] s : seasonal) {
      copy.add(s.clone());
    }
    return Collections.unmodifiableList(copy);
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getRemainder() {
    return remainder.clone();
  }

  /** Strength of each seasonal component, in request order. */
  public double[] seasonalStrength() {
    double[] strengths = new double[seasonal.size()];
    for (int i = 0; i < strengths.length; i++) {
      strengths[i] = Strength.of(seasonal.get(i), remainder);
    }
    return strengths;
  }

  public double trendStrength() {
    return Strength.of(trend, remainder);
  }
}
