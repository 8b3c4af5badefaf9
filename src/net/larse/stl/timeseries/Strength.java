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
import org.apache.commons.math.stat.descriptive.moment.Variance;

/**
 * Strength of a decomposed component relative to the remainder:
 * {@code max(0, 1 - Var(remainder) / Var(component + remainder))}.
 */
public final class Strength {
  private Strength() {}

  public static double of(double[] component, double[] remainder) {
    Preconditions.checkArgument(component.length == remainder.length,
        "component and remainder must have the same length");

    double[] combined = new double[remainder.length];
    for (int i = 0; i < remainder.length; i++) {
      combined[i] = component[i] + remainder[i];
    }

    Variance variance = new Variance();
    double remainderVariance = variance.evaluate(remainder);
    if (remainderVariance == 0.0) {
      return 1.0;
    }
    return Math.max(0.0, 1.0 - remainderVariance / variance.evaluate(combined));
  }
}
