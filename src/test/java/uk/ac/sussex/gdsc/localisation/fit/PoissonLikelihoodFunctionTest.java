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

package uk.ac.sussex.gdsc.localisation.fit;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class PoissonLikelihoodFunctionTest {
  @Test
  void testBadArguments() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new PoissonLikelihoodFunction(new double[4], 3));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new PoissonLikelihoodFunction(new double[0], 0));
  }

  @Test
  void canCropWindow() {
    final int width = 6;
    final double[] image = new double[width * 5];
    for (int i = 0; i < image.length; i++) {
      image[i] = i;
    }
    final PoissonLikelihoodFunction f = PoissonLikelihoodFunction.crop(image, width, 2, 1, 3);
    Assertions.assertEquals(3, f.getSize());
    Assertions.assertArrayEquals(new double[] {8, 9, 10, 14, 15, 16, 20, 21, 22}, f.getData());
  }

  @Test
  void canComputeNegativeLogLikelihood() {
    final double[] data = {1, 2, 3, 4, 5, 6, 7, 8, 9};
    final PoissonLikelihoodFunction f = new PoissonLikelihoodFunction(data, 3);
    final double[] p = {1.1, 0.9, 1, 5, 1.5};
    double expected = 0;
    for (int y = 0, i = 0; y < 3; y++) {
      for (int x = 0; x < 3; x++, i++) {
        final double u = IntegratedGaussianPsf.value(x, y, p);
        expected -= data[i] * Math.log(u) - u;
      }
    }
    Assertions.assertEquals(0, f.getEvaluations());
    Assertions.assertEquals(expected, f.value(p), Math.abs(expected) * 1e-12);
    Assertions.assertEquals(1, f.getEvaluations());
    f.value(p);
    Assertions.assertEquals(2, f.getEvaluations());
  }

  @Test
  void testMinimumIsAtExpectedValues() {
    final int size = 9;
    final double[] p = {4.2, 3.9, 1.1, 20, 2};
    final double[] data = new double[size * size];
    for (int y = 0, i = 0; y < size; y++) {
      for (int x = 0; x < size; x++, i++) {
        data[i] = IntegratedGaussianPsf.value(x, y, p);
      }
    }
    final PoissonLikelihoodFunction f = new PoissonLikelihoodFunction(data, size);
    final double best = f.value(p);
    for (int i = 0; i < p.length; i++) {
      for (final double delta : new double[] {-0.01, 0.01}) {
        final double[] p2 = p.clone();
        p2[i] += delta;
        Assertions.assertTrue(f.value(p2) > best);
      }
    }
  }
}
