package net.larse.stl.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StrengthTest {
  private static final double DELTA = 1e-12;

  @Test
  public void testStrength() {
    double[] component = {1, -1, 1, -1};
    double[] remainder = {0.5, 0.5, -0.5, -0.5};

    // Var(remainder) = 1/3, Var(component + remainder) = 5/3
    assertEquals(1.0 - (1.0 / 3.0) / (5.0 / 3.0), Strength.of(component, remainder), DELTA);
  }

  @Test
  public void testZeroRemainderVariance() {
    double[] component = {1, 2, 3, 4};
    double[] remainder = {0.25, 0.25, 0.25, 0.25};

    assertEquals(1.0, Strength.of(component, remainder), 0.0);
    assertEquals(1.0, Strength.of(new double[4], new double[4]), 0.0);
  }

  @Test
  public void testClampedAtZero() {
    // the component cancels the remainder
    double[] component = {-1, 1, -1, 1};
    double[] remainder = {1, -1, 1, -1.5};

    double strength = Strength.of(component, remainder);
    assertEquals(0.0, strength, 0.0);
  }

  @Test
  public void testBounds() {
    double[] component = {3, -2, 5, 0, 1, -4};
    double[] remainder = {0.1, -0.3, 0.2, 0.4, -0.1, 0.0};
    double strength = Strength.of(component, remainder);
    assertTrue(strength >= 0.0 && strength <= 1.0);
  }
}
