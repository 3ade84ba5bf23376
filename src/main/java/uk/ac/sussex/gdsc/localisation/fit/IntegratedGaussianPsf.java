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

import org.apache.commons.math3.special.Erf;

/**
 * A symmetric 2D Gaussian point spread function integrated over each unit pixel, plus a constant
 * background.
 *
 * <p>The parameters are {@code [x0, y0, w, a, b]} where the Gaussian standard deviation is
 * {@code w^2}, the amplitude (total signal) is {@code a^2} and the background is {@code b^2}. The
 * squares keep the model positive for any parameters.
 */
public final class IntegratedGaussianPsf {
  /** Index of the x position. */
  public static final int X = 0;
  /** Index of the y position. */
  public static final int Y = 1;
  /** Index of the width. */
  public static final int WIDTH = 2;
  /** Index of the amplitude. */
  public static final int AMPLITUDE = 3;
  /** Index of the background. */
  public static final int BACKGROUND = 4;
  /** The number of parameters. */
  public static final int NUMBER_OF_PARAMETERS = 5;

  private static final double ROOT2 = Math.sqrt(2);

  /** No public construction. */
  private IntegratedGaussianPsf() {}

  /**
   * Compute the expected value of the pixel with its centre at (x,y).
   *
   * @param x the x
   * @param y the y
   * @param params the parameters
   * @return the value
   */
  public static double value(double x, double y, double[] params) {
    final double s = ROOT2 * params[WIDTH] * params[WIDTH];
    final double ex = integral(x - params[X], s);
    final double ey = integral(y - params[Y], s);
    return ex * ey * params[AMPLITUDE] * params[AMPLITUDE]
        + params[BACKGROUND] * params[BACKGROUND];
  }

  /**
   * Compute the fraction of a unit Gaussian integrated over the pixel at distance d.
   *
   * @param d the distance from the centre
   * @param s the standard deviation multiplied by sqrt(2)
   * @return the integral
   */
  private static double integral(double d, double s) {
    return 0.5 * (Erf.erf((d + 0.5) / s) - Erf.erf((d - 0.5) / s));
  }
}
