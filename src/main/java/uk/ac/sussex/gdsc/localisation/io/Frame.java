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

package uk.ac.sussex.gdsc.localisation.io;

import ij.process.ShortProcessor;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * A single decoded image frame of unsigned 16-bit samples stored in row-major order.
 */
public class Frame {
  /** The frame index within the container (zero-based). */
  private final int index;
  private final int width;
  private final int height;
  /** The samples. These are unsigned and must be read using a mask of 0xffff. */
  private final short[] pixels;

  /**
   * Create a new instance. The pixels are not copied.
   *
   * @param index the frame index
   * @param width the width
   * @param height the height
   * @param pixels the pixels
   * @throws IllegalArgumentException if the pixel length does not match the dimensions
   */
  public Frame(int index, int width, int height, short[] pixels) {
    ValidationUtils.checkArgument(pixels.length == width * height,
        "Pixel length does not match dimensions: %d", pixels.length);
    this.index = index;
    this.width = width;
    this.height = height;
    this.pixels = pixels;
  }

  /**
   * Gets the frame index.
   *
   * @return the index
   */
  public int getIndex() {
    return index;
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
   * Gets a reference to the pixels. The samples are unsigned.
   *
   * @return the pixels
   */
  public short[] getPixels() {
    return pixels;
  }

  /**
   * Gets the unsigned value at the given position.
   *
   * @param x the x
   * @param y the y
   * @return the value
   */
  public int getValue(int x, int y) {
    return pixels[y * width + x] & 0xffff;
  }

  /**
   * Convert the unsigned samples to double values.
   *
   * @return the data
   */
  public double[] toDouble() {
    final double[] data = new double[pixels.length];
    for (int i = 0; i < data.length; i++) {
      data[i] = pixels[i] & 0xffff;
    }
    return data;
  }

  /**
   * Wrap the pixels as an ImageJ processor. The pixels are not copied.
   *
   * @return the processor
   */
  public ShortProcessor toProcessor() {
    return new ShortProcessor(width, height, pixels, null);
  }
}
