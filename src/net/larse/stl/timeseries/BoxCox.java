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
import com.google.common.primitives.Doubles;

/** Box-Cox power transform used to stabilize variance before MSTL. */
public final class BoxCox {
  // lambda below this is treated as 0, the log transform
  static final double LAMBDA_EPSILON = 0.0001;

  private BoxCox() {}

  /**
   * Returns log(y) if lambda is (near) 0, else (y^lambda - 1) / lambda.
   *
   * @throws IllegalArgumentException if a value has no finite transform
   */
  public static double[] transform(double[] y, double lambda) {
    double[] out = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      double value = lambda < LAMBDA_EPSILON
          ? Math.log(y[i])
          : (Math.pow(y[i], lambda) - 1.0) / lambda;
      Preconditions.checkArgument(Doubles.isFinite(value),
          "box-cox transform is undefined for value %s with lambda %s", y[i], lambda);
      out[i] = value;
    }
    return out;
  }
}
