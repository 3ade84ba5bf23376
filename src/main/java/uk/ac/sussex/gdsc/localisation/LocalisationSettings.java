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

import uk.ac.sussex.gdsc.localisation.filter.FramePreprocessor;
import uk.ac.sussex.gdsc.localisation.optim.NelderMeadMinimiser;

/**
 * Provides the options for the {@link FrameLocaliser}.
 */
public class LocalisationSettings {
  /** The default fit radius. */
  public static final int DEFAULT_FIT_RADIUS = 4;
  /** The default conversion from camera counts to photons. */
  public static final double DEFAULT_INTENSITY_TO_PHOTON = 3.6;
  /** The default pixel size in nm. */
  public static final double DEFAULT_PIXEL_SIZE = 80;
  /** The default initial width parameter. The width is the square of this value. */
  public static final double DEFAULT_INITIAL_WIDTH = Math.sqrt(1.6);
  /** The default maximum amplitude parameter. The amplitude is the square of this value. */
  public static final double DEFAULT_MAX_AMPLITUDE = 1000;
  /** The default minimum width parameter. */
  public static final double DEFAULT_MIN_WIDTH = 0.5;

  private int fitRadius;
  private double intensityToPhoton;
  private double pixelSize;
  private double thresholdFactor;
  private double initialWidth;
  private double valueTolerance;
  private double positionTolerance;
  private int maxIterations;
  private double maxAmplitude;
  private double minWidth;

  /**
   * Default constructor.
   */
  public LocalisationSettings() {
    fitRadius = DEFAULT_FIT_RADIUS;
    intensityToPhoton = DEFAULT_INTENSITY_TO_PHOTON;
    pixelSize = DEFAULT_PIXEL_SIZE;
    thresholdFactor = FramePreprocessor.DEFAULT_THRESHOLD_FACTOR;
    initialWidth = DEFAULT_INITIAL_WIDTH;
    valueTolerance = NelderMeadMinimiser.DEFAULT_VALUE_TOLERANCE;
    positionTolerance = NelderMeadMinimiser.DEFAULT_POSITION_TOLERANCE;
    maxIterations = NelderMeadMinimiser.DEFAULT_MAX_ITERATIONS;
    maxAmplitude = DEFAULT_MAX_AMPLITUDE;
    minWidth = DEFAULT_MIN_WIDTH;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  public LocalisationSettings(LocalisationSettings source) {
    fitRadius = source.fitRadius;
    intensityToPhoton = source.intensityToPhoton;
    pixelSize = source.pixelSize;
    thresholdFactor = source.thresholdFactor;
    initialWidth = source.initialWidth;
    valueTolerance = source.valueTolerance;
    positionTolerance = source.positionTolerance;
    maxIterations = source.maxIterations;
    maxAmplitude = source.maxAmplitude;
    minWidth = source.minWidth;
  }

  /**
   * Create a copy.
   *
   * @return A copy
   */
  public LocalisationSettings copy() {
    return new LocalisationSettings(this);
  }

  /**
   * Gets the fit radius. The fit window has a side of {@code 2 * radius + 1}.
   *
   * @return the fit radius
   */
  public int getFitRadius() {
    return fitRadius;
  }

  /**
   * Sets the fit radius.
   *
   * @param fitRadius the new fit radius
   */
  public void setFitRadius(int fitRadius) {
    this.fitRadius = fitRadius;
  }

  /**
   * Gets the fit window size.
   *
   * @return the fit window size
   */
  public int getFitWindowSize() {
    return 2 * fitRadius + 1;
  }

  /**
   * Gets the conversion from camera counts to photons.
   *
   * @return the intensity to photon factor
   */
  public double getIntensityToPhoton() {
    return intensityToPhoton;
  }

  /**
   * Sets the conversion from camera counts to photons.
   *
   * @param intensityToPhoton the new intensity to photon factor
   */
  public void setIntensityToPhoton(double intensityToPhoton) {
    this.intensityToPhoton = intensityToPhoton;
  }

  /**
   * Gets the pixel size in nm.
   *
   * @return the pixel size
   */
  public double getPixelSize() {
    return pixelSize;
  }

  /**
   * Sets the pixel size in nm.
   *
   * @param pixelSize the new pixel size
   */
  public void setPixelSize(double pixelSize) {
    this.pixelSize = pixelSize;
  }

  /**
   * Gets the threshold factor applied to the noise.
   *
   * @return the threshold factor
   */
  public double getThresholdFactor() {
    return thresholdFactor;
  }

  /**
   * Sets the threshold factor applied to the noise.
   *
   * @param thresholdFactor the new threshold factor
   */
  public void setThresholdFactor(double thresholdFactor) {
    this.thresholdFactor = thresholdFactor;
  }

  /**
   * Gets the initial width parameter. The Gaussian standard deviation is the square of this value.
   *
   * @return the initial width
   */
  public double getInitialWidth() {
    return initialWidth;
  }

  /**
   * Sets the initial width parameter.
   *
   * @param initialWidth the new initial width
   */
  public void setInitialWidth(double initialWidth) {
    this.initialWidth = initialWidth;
  }

  /**
   * Gets the value tolerance for the minimiser.
   *
   * @return the value tolerance
   */
  public double getValueTolerance() {
    return valueTolerance;
  }

  /**
   * Sets the value tolerance for the minimiser.
   *
   * @param valueTolerance the new value tolerance
   */
  public void setValueTolerance(double valueTolerance) {
    this.valueTolerance = valueTolerance;
  }

  /**
   * Gets the position tolerance for the minimiser.
   *
   * @return the position tolerance
   */
  public double getPositionTolerance() {
    return positionTolerance;
  }

  /**
   * Sets the position tolerance for the minimiser.
   *
   * @param positionTolerance the new position tolerance
   */
  public void setPositionTolerance(double positionTolerance) {
    this.positionTolerance = positionTolerance;
  }

  /**
   * Gets the max iterations for the minimiser.
   *
   * @return the max iterations
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  /**
   * Sets the max iterations for the minimiser.
   *
   * @param maxIterations the new max iterations
   */
  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  /**
   * Gets the maximum absolute amplitude parameter of an accepted fit.
   *
   * @return the max amplitude
   */
  public double getMaxAmplitude() {
    return maxAmplitude;
  }

  /**
   * Sets the maximum absolute amplitude parameter of an accepted fit.
   *
   * @param maxAmplitude the new max amplitude
   */
  public void setMaxAmplitude(double maxAmplitude) {
    this.maxAmplitude = maxAmplitude;
  }

  /**
   * Gets the minimum width parameter of an accepted fit. The maximum is half the fit radius.
   *
   * @return the min width
   */
  public double getMinWidth() {
    return minWidth;
  }

  /**
   * Sets the minimum width parameter of an accepted fit.
   *
   * @param minWidth the new min width
   */
  public void setMinWidth(double minWidth) {
    this.minWidth = minWidth;
  }
}
