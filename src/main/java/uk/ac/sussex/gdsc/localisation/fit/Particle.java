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

/**
 * A fitted emitter.
 *
 * <p>The fitted position parameters are relative to the origin of the fit window, which is the
 * detection position minus the fit radius.
 */
public class Particle {
  private final int frame;
  private final int x;
  private final int y;
  private final int fitRadius;
  private final double[] params;
  private final double value;
  private final int iterations;
  private final int evaluations;

  /**
   * Create a new instance.
   *
   * @param frame the frame index (zero-based)
   * @param x the detection x
   * @param y the detection y
   * @param fitRadius the fit radius
   * @param params the fitted parameters (copied)
   * @param value the negative log-likelihood at the fitted parameters
   * @param iterations the minimiser iterations
   * @param evaluations the function evaluations
   */
  public Particle(int frame, int x, int y, int fitRadius, double[] params, double value,
      int iterations, int evaluations) {
    this.frame = frame;
    this.x = x;
    this.y = y;
    this.fitRadius = fitRadius;
    this.params = params.clone();
    this.value = value;
    this.iterations = iterations;
    this.evaluations = evaluations;
  }

  /**
   * Gets the frame index (zero-based).
   *
   * @return the frame
   */
  public int getFrame() {
    return frame;
  }

  /**
   * Gets the detection x.
   *
   * @return the x
   */
  public int getX() {
    return x;
  }

  /**
   * Gets the detection y.
   *
   * @return the y
   */
  public int getY() {
    return y;
  }

  /**
   * Gets the fit radius.
   *
   * @return the fit radius
   */
  public int getFitRadius() {
    return fitRadius;
  }

  /**
   * Gets a copy of the fitted parameters.
   *
   * @return the parameters
   * @see IntegratedGaussianPsf
   */
  public double[] getParameters() {
    return params.clone();
  }

  /**
   * Gets the parameter.
   *
   * @param index the index
   * @return the parameter
   */
  public double getParameter(int index) {
    return params[index];
  }

  /**
   * Gets the negative log-likelihood at the fitted parameters.
   *
   * @return the value
   */
  public double getValue() {
    return value;
  }

  /**
   * Gets the minimiser iterations.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * Gets the function evaluations.
   *
   * @return the evaluations
   */
  public int getEvaluations() {
    return evaluations;
  }

  /**
   * Gets the fitted x position in image pixels.
   *
   * @return the x position
   */
  public double getPositionX() {
    return x - fitRadius + params[IntegratedGaussianPsf.X];
  }

  /**
   * Gets the fitted y position in image pixels.
   *
   * @return the y position
   */
  public double getPositionY() {
    return y - fitRadius + params[IntegratedGaussianPsf.Y];
  }

  /**
   * Gets the Gaussian standard deviation in pixels.
   *
   * @return the width
   */
  public double getWidth() {
    final double w = params[IntegratedGaussianPsf.WIDTH];
    return w * w;
  }

  /**
   * Gets the total signal in photons.
   *
   * @return the amplitude
   */
  public double getAmplitude() {
    final double a = params[IntegratedGaussianPsf.AMPLITUDE];
    return a * a;
  }

  /**
   * Gets the background in photons per pixel.
   *
   * @return the background
   */
  public double getBackground() {
    final double b = params[IntegratedGaussianPsf.BACKGROUND];
    return b * b;
  }

  @Override
  public String toString() {
    return String.format("frame=%d (%d,%d) x=%s y=%s w=%s a=%s b=%s", frame, x, y,
        getPositionX(), getPositionY(), getWidth(), getAmplitude(), getBackground());
  }
}
