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

/**
 * A local maximum in the band-pass image.
 */
public class Candidate {
  private final int x;
  private final int y;
  private final double value;

  /**
   * Create a new instance.
   *
   * @param x the x
   * @param y the y
   * @param value the band-pass value
   */
  public Candidate(int x, int y, double value) {
    this.x = x;
    this.y = y;
    this.value = value;
  }

  /**
   * Gets the x coordinate.
   *
   * @return the x
   */
  public int getX() {
    return x;
  }

  /**
   * Gets the y coordinate.
   *
   * @return the y
   */
  public int getY() {
    return y;
  }

  /**
   * Gets the band-pass value.
   *
   * @return the value
   */
  public double getValue() {
    return value;
  }

  @Override
  public String toString() {
    return String.format("(%d,%d)=%s", x, y, value);
  }
}
