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

package uk.ac.sussex.gdsc.localisation.filter;

import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Filter an image to enhance spots of the expected size.
 *
 * <p>The image is smoothed with a 5-tap binomial kernel applied separably. The noise level is the
 * standard deviation of the residual (image minus smoothed image). The smoothed image is then
 * filtered with a 9-tap kernel (the 5-tap kernel with holes) and subtracted from the smoothed
 * image to create a band-pass image.
 *
 * <p>At the image border the kernel taps that fall outside the image are omitted and the kernel is
 * not renormalised. This biases the border values towards zero.
 */
public class FramePreprocessor {
  private static final Logger logger = Logger.getLogger(FramePreprocessor.class.getName());

  /** The default threshold factor. */
  public static final double DEFAULT_THRESHOLD_FACTOR = 1.5;

  /** The 5-tap kernel [1,4,6,4,1]/16. */
  private static final double[] KERNEL1 = {1.0 / 16, 1.0 / 4, 3.0 / 8, 1.0 / 4, 1.0 / 16};
  /** The 9-tap kernel [1,0,4,0,6,0,4,0,1]/16. */
  private static final double[] KERNEL2 =
      {1.0 / 16, 0, 1.0 / 4, 0, 3.0 / 8, 0, 1.0 / 4, 0, 1.0 / 16};

  private final double thresholdFactor;

  /**
   * Create a new instance with the default threshold factor.
   */
  public FramePreprocessor() {
    this(DEFAULT_THRESHOLD_FACTOR);
  }

  /**
   * Create a new instance.
   *
   * @param thresholdFactor the factor applied to the noise standard deviation to create the
   *        threshold
   * @throws IllegalArgumentException if the factor is negative
   */
  public FramePreprocessor(double thresholdFactor) {
    ValidationUtils.checkPositive(thresholdFactor, "thresholdFactor");
    this.thresholdFactor = thresholdFactor;
  }

  /**
   * Gets the threshold factor.
   *
   * @return the threshold factor
   */
  public double getThresholdFactor() {
    return thresholdFactor;
  }

  /**
   * Process the image.
   *
   * @param data the image data (row-major)
   * @param width the width
   * @param height the height
   * @return the preprocessed frame
   * @throws IllegalArgumentException if the data length does not match the dimensions
   */
  public PreprocessedFrame process(double[] data, int width, int height) {
    ValidationUtils.checkStrictlyPositive(width, "width");
    ValidationUtils.checkStrictlyPositive(height, "height");
    final int size = width * height;
    ValidationUtils.checkArgument(data.length == size,
        "Data length does not match dimensions: %d", data.length);

    final double[] buffer = new double[size];
    final double[] v1 = new double[size];

    filterX(data, buffer, width, height, KERNEL1);
    filterY(buffer, v1, width, height, KERNEL1);

    // Noise from the residual
    double sum = 0;
    double sumSq = 0;
    for (int i = 0; i < size; i++) {
      final double residual = data[i] - v1[i];
      sum += residual;
      sumSq += residual * residual;
    }
    final double mean = sum / size;
    final double meanSq = sumSq / size;
    // Rounding may create a small negative variance
    final double threshold = thresholdFactor * Math.sqrt(Math.max(0, meanSq - mean * mean));
    logger.fine(() -> "threshold = " + threshold);

    final double[] f2 = new double[size];
    filterX(v1, buffer, width, height, KERNEL2);
    filterY(buffer, f2, width, height, KERNEL2);
    for (int i = 0; i < size; i++) {
      f2[i] = v1[i] - f2[i];
    }

    return new PreprocessedFrame(width, height, v1, f2, threshold);
  }

  /**
   * Apply the kernel in the X direction. Taps outside the image are omitted.
   *
   * @param in the input
   * @param out the output
   * @param width the width
   * @param height the height
   * @param kernel the kernel (odd length)
   */
  private static void filterX(double[] in, double[] out, int width, int height,
      double[] kernel) {
    final int half = kernel.length / 2;
    for (int y = 0, i = 0; y < height; y++) {
      for (int x = 0; x < width; x++, i++) {
        final int start = x < half ? half - x : 0;
        final int end = x + half < width ? kernel.length : width + half - x;
        double sum = 0;
        for (int j = start; j < end; j++) {
          sum += in[i + j - half] * kernel[j];
        }
        out[i] = sum;
      }
    }
  }

  /**
   * Apply the kernel in the Y direction. Taps outside the image are omitted.
   *
   * @param in the input
   * @param out the output
   * @param width the width
   * @param height the height
   * @param kernel the kernel (odd length)
   */
  private static void filterY(double[] in, double[] out, int width, int height,
      double[] kernel) {
    final int half = kernel.length / 2;
    for (int y = 0, i = 0; y < height; y++) {
      final int start = y < half ? half - y : 0;
      final int end = y + half < height ? kernel.length : height + half - y;
      for (int x = 0; x < width; x++, i++) {
        double sum = 0;
        for (int j = start; j < end; j++) {
          sum += in[i + (j - half) * width] * kernel[j];
        }
        out[i] = sum;
      }
    }
  }
}
