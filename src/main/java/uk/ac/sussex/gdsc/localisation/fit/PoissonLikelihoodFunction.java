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

import org.apache.commons.math3.analysis.MultivariateFunction;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The negative Poisson log-likelihood of a square window of photon counts given the
 * {@link IntegratedGaussianPsf} model.
 *
 * <p>The constant term {@code log(k!)} is omitted. Each instance counts its evaluations and is
 * intended for a single fit.
 */
public class PoissonLikelihoodFunction implements MultivariateFunction {
  private final double[] data;
  private final int size;
  private int evaluations;

  /**
   * Create a new instance.
   *
   * @param data the window data (size x size, row-major)
   * @param size the window size
   * @throws IllegalArgumentException if the data length is not size squared
   */
  public PoissonLikelihoodFunction(double[] data, int size) {
    ValidationUtils.checkStrictlyPositive(size, "size");
    ValidationUtils.checkArgument(data.length == size * size,
        "Data length does not match window size: %d", data.length);
    this.data = data.clone();
    this.size = size;
  }

  /**
   * Create a function from a square window cropped from the image.
   *
   * @param image the image (row-major)
   * @param width the image width
   * @param ox the window origin x
   * @param oy the window origin y
   * @param size the window size
   * @return the function
   */
  public static PoissonLikelihoodFunction crop(double[] image, int width, int ox, int oy,
      int size) {
    final double[] window = new double[size * size];
    for (int y = 0; y < size; y++) {
      System.arraycopy(image, (oy + y) * width + ox, window, y * size, size);
    }
    return new PoissonLikelihoodFunction(window, size);
  }

  @Override
  public double value(double[] point) {
    evaluations++;
    double sum = 0;
    for (int y = 0, i = 0; y < size; y++) {
      for (int x = 0; x < size; x++, i++) {
        final double expected = IntegratedGaussianPsf.value(x, y, point);
        sum += data[i] * Math.log(expected) - expected;
      }
    }
    return -sum;
  }

  /**
   * Gets the window size.
   *
   * @return the size
   */
  public int getSize() {
    return size;
  }

  /**
   * Gets a copy of the window data.
   *
   * @return the data
   */
  public double[] getData() {
    return data.clone();
  }

  /**
   * Gets the number of evaluations.
   *
   * @return the evaluations
   */
  public int getEvaluations() {
    return evaluations;
  }
}
