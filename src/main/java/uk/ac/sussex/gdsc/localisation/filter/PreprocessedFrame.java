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

/**
 * The output of the {@link FramePreprocessor}.
 */
public class PreprocessedFrame {
  private final int width;
  private final int height;
  private final double[] smoothed;
  private final double[] bandPass;
  private final double threshold;

  /**
   * Create a new instance. The arrays are not copied.
   *
   * @param width the width
   * @param height the height
   * @param smoothed the smoothed image
   * @param bandPass the band-pass image
   * @param threshold the noise threshold
   */
  PreprocessedFrame(int width, int height, double[] smoothed, double[] bandPass,
      double threshold) {
    this.width = width;
    this.height = height;
    this.smoothed = smoothed;
    this.bandPass = bandPass;
    this.threshold = threshold;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets a reference to the image smoothed with the 5-tap kernel.
   *
   * @return the smoothed image
   */
  public double[] getSmoothed() {
    return smoothed;
  }

  /**
   * Gets a reference to the band-pass image. This is the smoothed image minus the smoothed image
   * filtered with the 9-tap kernel.
   *
   * @return the band-pass image
   */
  public double[] getBandPass() {
    return bandPass;
  }

  /**
   * Gets the noise threshold. Candidates must have a band-pass value above this level.
   *
   * @return the threshold
   */
  public double getThreshold() {
    return threshold;
  }
}
