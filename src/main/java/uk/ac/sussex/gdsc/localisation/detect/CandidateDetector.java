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

package uk.ac.sussex.gdsc.localisation.detect;

import java.util.List;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Find 8-connected local maxima using a single pass of forward elimination.
 *
 * <p>Pixels are visited in row-major order excluding the last row and the last column. Each pixel
 * is compared to its four forward neighbours (right, down-right, down and down-left). The
 * neighbour is eliminated if the pixel is higher, otherwise the pixel is eliminated. Ties
 * eliminate the current pixel so a plateau resolves to a later pixel in scan order. Eliminated
 * pixels are never restored.
 *
 * <p>A pixel is a candidate if it survives its own comparisons, is above the threshold and is at
 * least the fit radius from each image edge.
 */
public class CandidateDetector {
  private final int border;

  /**
   * Create a new instance.
   *
   * @param fitRadius the fit radius (border excluded from detection)
   * @throws IllegalArgumentException if the radius is negative
   */
  public CandidateDetector(int fitRadius) {
    ValidationUtils.checkPositive(fitRadius, "fitRadius");
    this.border = fitRadius;
  }

  /**
   * Gets the fit radius.
   *
   * @return the fit radius
   */
  public int getFitRadius() {
    return border;
  }

  /**
   * Detect the candidates.
   *
   * @param data the band-pass image (row-major)
   * @param width the width
   * @param height the height
   * @param threshold the threshold
   * @return the candidates in scan order
   * @throws IllegalArgumentException if the data length does not match the dimensions
   */
  public List<Candidate> detect(double[] data, int width, int height, double threshold) {
    ValidationUtils.checkArgument(data.length == width * height,
        "Data length does not match dimensions: %d", data.length);
    final LocalList<Candidate> list = new LocalList<>();
    final boolean[] eliminated = new boolean[data.length];
    final int maxx = width - border;
    final int maxy = height - border;
    for (int y = 0; y < height - 1; y++) {
      for (int x = 0, i = y * width; x < width - 1; x++, i++) {
        final double v = data[i];
        compare(data, eliminated, i, i + 1, v);
        compare(data, eliminated, i, i + width + 1, v);
        compare(data, eliminated, i, i + width, v);
        if (x != 0) {
          compare(data, eliminated, i, i + width - 1, v);
        }
        if (!eliminated[i] && v > threshold && x >= border && x < maxx && y >= border
            && y < maxy) {
          list.add(new Candidate(x, y, v));
        }
      }
    }
    return list;
  }

  private static void compare(double[] data, boolean[] eliminated, int index, int neighbour,
      double value) {
    if (value > data[neighbour]) {
      eliminated[neighbour] = true;
    } else {
      eliminated[index] = true;
    }
  }
}
