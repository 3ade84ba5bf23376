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

package uk.ac.sussex.gdsc.localisation;

import uk.ac.sussex.gdsc.localisation.fit.IntegratedGaussianPsf;

/**
 * Create images of emitters.
 */
final class TestImages {
  /** No public construction. */
  private TestImages() {}

  /**
   * Create an image in camera counts of a single emitter. The expected photons are divided by the
   * intensity to photon factor.
   *
   * @param size the image size
   * @param x the x centre
   * @param y the y centre
   * @param width the Gaussian standard deviation
   * @param amplitude the total signal in photons
   * @param background the background in photons
   * @return the image
   */
  static double[] createSpot(int size, double x, double y, double width, double amplitude,
      double background) {
    final double[] p = {x, y, Math.sqrt(width), Math.sqrt(amplitude), Math.sqrt(background)};
    final double[] data = new double[size * size];
    for (int j = 0, i = 0; j < size; j++) {
      for (int k = 0; k < size; k++, i++) {
        data[i] =
            IntegratedGaussianPsf.value(k, j, p) / LocalisationSettings.DEFAULT_INTENSITY_TO_PHOTON;
      }
    }
    return data;
  }
}
