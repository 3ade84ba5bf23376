/*-
 * #%L
 * Genome Damage and Stability Centre SMLM Localisation Plugins
 *
 * Software for single molecule localisation microscopy
 * %%
 * Copyright (C) 2011 - 2022 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.localisation.optim;

import org.apache.commons.math3.analysis.MultivariateFunction;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Minimise a function using the Nelder-Mead downhill simplex method.
 *
 * <p>The dimension is taken from the start point. The simplex has one vertex at the start point
 * and one vertex for each axis offset from the start point by the step for that axis.
 *
 * <p>Convergence requires the range of function values over the simplex to be below the value
 * tolerance and the range of each coordinate over the simplex to be below the position tolerance.
 * If the iteration limit is reached the best vertex is returned and the result is marked as not
 * converged.
 *
 * <p>When the reflected point is better than the worst vertex but not the second-worst, a
 * contraction toward the reflected point is attempted; if it does not improve on the reflected
 * point the reflected point is accepted (no shrink is performed).
 *
 * <p>This class is thread-safe; each minimisation allocates its own simplex.
 */
public class NelderMeadMinimiser {
  /** The default value tolerance. */
  public static final double DEFAULT_VALUE_TOLERANCE = 1e-5;
  /** The default position tolerance. */
  public static final double DEFAULT_POSITION_TOLERANCE = 1e-5;
  /** The default maximum iterations. */
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  private static final double REFLECTION = 1;
  private static final double EXPANSION = 2;
  private static final double CONTRACTION = 0.5;
  private static final double SHRINK = 0.5;

  private final double valueTolerance;
  private final double positionTolerance;
  private final int maxIterations;

  /**
   * Function wrapper that counts evaluations.
   */
  private static class CountingFunction {
    final MultivariateFunction function;
    int evaluations;

    CountingFunction(MultivariateFunction function) {
      this.function = function;
    }

    double value(double[] point) {
      evaluations++;
      return function.value(point);
    }
  }

  /**
   * Create a new instance with the default tolerances and iteration limit.
   */
  public NelderMeadMinimiser() {
    this(DEFAULT_VALUE_TOLERANCE, DEFAULT_POSITION_TOLERANCE, DEFAULT_MAX_ITERATIONS);
  }

  /**
   * Create a new instance.
   *
   * @param valueTolerance the value tolerance
   * @param positionTolerance the position tolerance
   * @param maxIterations the maximum iterations
   * @throws IllegalArgumentException if the tolerances are negative or the iterations are not
   *         strictly positive
   */
  public NelderMeadMinimiser(double valueTolerance, double positionTolerance,
      int maxIterations) {
    ValidationUtils.checkPositive(valueTolerance, "valueTolerance");
    ValidationUtils.checkPositive(positionTolerance, "positionTolerance");
    ValidationUtils.checkStrictlyPositive(maxIterations, "maxIterations");
    this.valueTolerance = valueTolerance;
    this.positionTolerance = positionTolerance;
    this.maxIterations = maxIterations;
  }

  /**
   * Minimise the function.
   *
   * @param function the function
   * @param start the start point
   * @param steps the step for each axis used to construct the initial simplex
   * @return the result
   * @throws IllegalArgumentException if the start point is empty or the steps do not match the
   *         start point
   */
  public SimplexResult minimise(MultivariateFunction function, double[] start, double[] steps) {
    ValidationUtils.checkNotNull(function, "function");
    final int n = start.length;
    ValidationUtils.checkArgument(n != 0, "Empty start point");
    ValidationUtils.checkArgument(steps.length == n, "Steps length mismatch: %d != %d",
        steps.length, n);

    final CountingFunction fn = new CountingFunction(function);

    // Initialise the simplex
    final double[][] s = new double[n + 1][];
    final double[] y = new double[n + 1];
    s[0] = start.clone();
    for (int i = 0; i < n; i++) {
      s[i + 1] = start.clone();
      s[i + 1][i] += steps[i];
    }
    for (int i = 0; i <= n; i++) {
      y[i] = fn.value(s[i]);
    }

    final double[] xc = new double[n];
    final double[] xn = new double[n];
    final double[] x2 = new double[n];

    int iteration = 0;
    boolean converged = false;
    while (iteration < maxIterations) {
      // Find lowest (best), highest (worst) and next-to-highest.
      // Ties resolve to the first vertex encountered.
      int li = 0;
      int ni = 0;
      int hi = 1;
      if (y[1] < y[0]) {
        li = 1;
        ni = 1;
        hi = 0;
      }
      for (int i = 2; i <= n; i++) {
        if (y[i] < y[li]) {
          li = i;
        } else if (y[i] > y[hi]) {
          ni = hi;
          hi = i;
        } else if (y[i] > y[ni]) {
          ni = i;
        }
      }
      if (ni == li && n > 1) {
        ni = 2;
      }

      if (y[hi] - y[li] < valueTolerance && maxRange(s) < positionTolerance) {
        converged = true;
        break;
      }

      // Centroid of all but the worst and the reflection
      final double[] sh = s[hi];
      for (int i = 0; i < n; i++) {
        double sum = 0;
        for (int j = 0; j <= n; j++) {
          sum += s[j][i];
        }
        xc[i] = (sum - sh[i]) / n;
        xn[i] = xc[i] + (xc[i] - sh[i]) * REFLECTION;
      }
      final double yn = fn.value(xn);
      if (yn < y[ni]) {
        if (yn < y[li]) {
          for (int i = 0; i < n; i++) {
            x2[i] = xc[i] + (xc[i] - sh[i]) * EXPANSION;
          }
          final double y2 = fn.value(x2);
          if (y2 < yn) {
            replace(s, y, hi, x2, y2);
          } else {
            replace(s, y, hi, xn, yn);
          }
        } else {
          replace(s, y, hi, xn, yn);
        }
      } else if (yn < y[hi]) {
        // Contract toward the reflection
        for (int i = 0; i < n; i++) {
          x2[i] = xc[i] + (xn[i] - xc[i]) * CONTRACTION;
        }
        final double y2 = fn.value(x2);
        if (y2 < yn) {
          replace(s, y, hi, x2, y2);
        } else {
          replace(s, y, hi, xn, yn);
        }
      } else {
        // Contract the worst toward the centroid
        for (int i = 0; i < n; i++) {
          x2[i] = xc[i] + (sh[i] - xc[i]) * CONTRACTION;
        }
        final double y2 = fn.value(x2);
        if (y2 < y[hi]) {
          replace(s, y, hi, x2, y2);
        } else {
          // Shrink toward the best
          final double[] sl = s[li];
          for (int i = 0; i <= n; i++) {
            if (i == li) {
              continue;
            }
            final double[] d = s[i];
            for (int j = 0; j < n; j++) {
              d[j] = sl[j] + (d[j] - sl[j]) * SHRINK;
            }
            y[i] = fn.value(d);
          }
        }
      }
      iteration++;
    }

    // The simplex may have changed since the last ordering
    int best = 0;
    for (int i = 1; i <= n; i++) {
      if (y[i] < y[best]) {
        best = i;
      }
    }
    return new SimplexResult(s[best], y[best], iteration, fn.evaluations, converged);
  }

  private static void replace(double[][] s, double[] y, int index, double[] x, double value) {
    System.arraycopy(x, 0, s[index], 0, x.length);
    y[index] = value;
  }

  /**
   * Get the maximum range of any coordinate over all the vertices.
   *
   * @param s the simplex
   * @return the maximum range
   */
  private static double maxRange(double[][] s) {
    final int n = s[0].length;
    double max = 0;
    for (int i = 0; i < n; i++) {
      double min = s[0][i];
      double upper = min;
      for (int j = 1; j < s.length; j++) {
        final double x = s[j][i];
        if (x < min) {
          min = x;
        } else if (x > upper) {
          upper = x;
        }
      }
      max = Math.max(max, upper - min);
    }
    return max;
  }

  /**
   * Gets the value tolerance.
   *
   * @return the value tolerance
   */
  public double getValueTolerance() {
    return valueTolerance;
  }

  /**
   * Gets the position tolerance.
   *
   * @return the position tolerance
   */
  public double getPositionTolerance() {
    return positionTolerance;
  }

  /**
   * Gets the maximum iterations.
   *
   * @return the maximum iterations
   */
  public int getMaxIterations() {
    return maxIterations;
  }
}
