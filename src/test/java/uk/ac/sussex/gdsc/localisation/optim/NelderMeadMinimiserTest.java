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
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;

@SuppressWarnings({"javadoc"})
class NelderMeadMinimiserTest {
  /**
   * A convex quadratic with a minimum of 1 at the centre.
   */
  private static MultivariateFunction createQuadratic(double[] centre) {
    return x -> {
      double sum = 1;
      for (int i = 0; i < x.length; i++) {
        final double d = x[i] - centre[i];
        sum += (i + 1) * d * d;
      }
      return sum;
    };
  }

  @SeededTest
  void canMinimiseQuadratic(RandomSeed seed) {
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final double[] centre = {1, -2, 3, 0.5, -0.25};
    final double[] start = new double[centre.length];
    for (int i = 0; i < start.length; i++) {
      start[i] = centre[i] + rng.nextDouble() * 4 - 2;
    }
    final double[] steps = {1, 1, 0.2, 1, 1};
    final SimplexResult result =
        new NelderMeadMinimiser().minimise(createQuadratic(centre), start, steps);
    Assertions.assertTrue(result.isConverged());
    Assertions.assertTrue(result.getIterations() < NelderMeadMinimiser.DEFAULT_MAX_ITERATIONS);
    Assertions.assertTrue(result.getEvaluations() > result.getIterations());
    Assertions.assertEquals(1, result.getValue().doubleValue(), 1e-4);
    final double[] point = result.getPoint();
    for (int i = 0; i < centre.length; i++) {
      Assertions.assertEquals(centre[i], point[i], 1e-2);
    }
  }

  @Test
  void canMinimiseOneDimension() {
    final SimplexResult result = new NelderMeadMinimiser()
        .minimise(x -> (x[0] - 3) * (x[0] - 3), new double[] {0}, new double[] {1});
    Assertions.assertTrue(result.isConverged());
    Assertions.assertEquals(3, result.getPoint()[0], 1e-2);
    Assertions.assertEquals(0, result.getValue().doubleValue(), 1e-5);
  }

  @Test
  void canStopAtMaxIterations() {
    // A constant function will always shrink the simplex:
    // 3 initial evaluations; each iteration evaluates the reflection, the contraction
    // and 2 shrunk vertices.
    final SimplexResult result = new NelderMeadMinimiser(1e-5, 1e-5, 5)
        .minimise(x -> 2, new double[] {0, 0}, new double[] {1, 1});
    Assertions.assertFalse(result.isConverged());
    Assertions.assertEquals(5, result.getIterations());
    Assertions.assertEquals(23, result.getEvaluations());
    Assertions.assertEquals(2.0, result.getValue().doubleValue());
    Assertions.assertArrayEquals(new double[] {0, 0}, result.getPoint());
  }

  @Test
  void canConvergeOnConstantFunctionWithTinySteps() {
    final SimplexResult result = new NelderMeadMinimiser()
        .minimise(x -> 2, new double[] {0, 0, 0}, new double[] {1e-6, 1e-6, 1e-6});
    Assertions.assertTrue(result.isConverged());
    Assertions.assertEquals(0, result.getIterations());
    Assertions.assertEquals(4, result.getEvaluations());
  }

  @Test
  void testBadArguments() {
    final NelderMeadMinimiser minimiser = new NelderMeadMinimiser();
    final MultivariateFunction f = x -> 0;
    Assertions.assertThrows(NullPointerException.class,
        () -> minimiser.minimise(null, new double[1], new double[1]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> minimiser.minimise(f, new double[0], new double[0]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> minimiser.minimise(f, new double[2], new double[1]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new NelderMeadMinimiser(1e-5, 1e-5, 0));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new NelderMeadMinimiser(-1, 1e-5, 10));
  }
}
