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

package uk.ac.sussex.gdsc.localisation.optim;

import org.apache.commons.math3.optim.PointValuePair;

/**
 * The result of a simplex minimisation.
 */
public class SimplexResult extends PointValuePair {
  private static final long serialVersionUID = 20221014L;

  private final int iterations;
  private final int evaluations;
  private final boolean converged;

  /**
   * Create a new instance.
   *
   * @param point the point (copied)
   * @param value the value
   * @param iterations the iterations
   * @param evaluations the evaluations
   * @param converged true if converged
   */
  public SimplexResult(double[] point, double value, int iterations, int evaluations,
      boolean converged) {
    super(point, value, true);
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.converged = converged;
  }

  /**
   * Gets the number of completed iterations.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * Gets the number of function evaluations.
   *
   * @return the evaluations
   */
  public int getEvaluations() {
    return evaluations;
  }

  /**
   * Checks if the minimisation converged within the iteration limit.
   *
   * @return true if converged
   */
  public boolean isConverged() {
    return converged;
  }
}
