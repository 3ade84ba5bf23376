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

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.localisation.LocalisationSettings;
import uk.ac.sussex.gdsc.localisation.detect.Candidate;
import uk.ac.sussex.gdsc.localisation.optim.NelderMeadMinimiser;
import uk.ac.sussex.gdsc.localisation.optim.SimplexResult;

/**
 * Fit an {@link IntegratedGaussianPsf} to a square window around each candidate using maximum
 * likelihood estimation with a Poisson noise model.
 *
 * <p>Fits are filtered using a plausibility test on the parameters: the centre must be within
 * half the fit radius of the window centre; the width parameter must be within the minimum width
 * and half the fit radius; and the absolute amplitude parameter must be below the maximum
 * amplitude. Half the fit radius uses integer division.
 */
public class ParticleFitter {
  private static final Logger logger = Logger.getLogger(ParticleFitter.class.getName());

  /** The simplex steps for each parameter. */
  private static final double[] STEPS = {1, 1, 0.2, 1, 1};

  private final int fitRadius;
  private final int size;
  private final int halfRadius;
  private final double initialWidth;
  private final double minWidth;
  private final double maxAmplitude;
  private final NelderMeadMinimiser minimiser;

  /**
   * Create a new instance.
   *
   * @param settings the settings
   * @throws IllegalArgumentException if the fit radius is not strictly positive
   */
  public ParticleFitter(LocalisationSettings settings) {
    fitRadius = ValidationUtils.checkNotNull(settings, "settings").getFitRadius();
    ValidationUtils.checkStrictlyPositive(fitRadius, "fitRadius");
    size = 2 * fitRadius + 1;
    halfRadius = fitRadius / 2;
    initialWidth = settings.getInitialWidth();
    minWidth = settings.getMinWidth();
    maxAmplitude = settings.getMaxAmplitude();
    minimiser = new NelderMeadMinimiser(settings.getValueTolerance(),
        settings.getPositionTolerance(), settings.getMaxIterations());
  }

  /**
   * Fit each candidate and return the plausible particles.
   *
   * @param frame the frame index
   * @param photons the image in photons (row-major)
   * @param width the image width
   * @param height the image height
   * @param candidates the candidates
   * @return the particles in candidate order
   */
  public List<Particle> fit(int frame, double[] photons, int width, int height,
      List<Candidate> candidates) {
    final LocalList<Particle> list = new LocalList<>(candidates.size());
    for (final Candidate candidate : candidates) {
      final Particle particle = fit(frame, photons, width, height, candidate);
      if (isPlausible(particle.getParameters())) {
        list.add(particle);
      } else if (logger.isLoggable(Level.FINEST)) {
        logger.finest("Rejected " + particle);
      }
    }
    return list;
  }

  /**
   * Fit the candidate. No plausibility test is performed.
   *
   * @param frame the frame index
   * @param photons the image in photons (row-major)
   * @param width the image width
   * @param height the image height
   * @param candidate the candidate
   * @return the particle
   * @throws IllegalArgumentException if the fit window is outside the image
   */
  public Particle fit(int frame, double[] photons, int width, int height, Candidate candidate) {
    final int ox = candidate.getX() - fitRadius;
    final int oy = candidate.getY() - fitRadius;
    ValidationUtils.checkArgument(
        ox >= 0 && oy >= 0 && ox + size <= width && oy + size <= height
            && photons.length == width * height,
        "Fit window outside the image: %s", candidate);
    final PoissonLikelihoodFunction function =
        PoissonLikelihoodFunction.crop(photons, width, ox, oy, size);

    final double[] data = function.getData();
    double max = data[0];
    double min = data[0];
    for (final double v : data) {
      if (v > max) {
        max = v;
      } else if (v < min) {
        min = v;
      }
    }
    final double[] start = {fitRadius, fitRadius, initialWidth, Math.sqrt(max - min),
        Math.sqrt(min)};

    final SimplexResult result = minimiser.minimise(function, start, STEPS);
    return new Particle(frame, candidate.getX(), candidate.getY(), fitRadius, result.getPoint(),
        result.getValue(), result.getIterations(), function.getEvaluations());
  }

  /**
   * Checks if the fitted parameters are plausible.
   *
   * @param params the parameters
   * @return true if plausible
   */
  public boolean isPlausible(double[] params) {
    return Math.abs(params[IntegratedGaussianPsf.X] - fitRadius) <= halfRadius
        && Math.abs(params[IntegratedGaussianPsf.Y] - fitRadius) <= halfRadius
        && params[IntegratedGaussianPsf.WIDTH] >= minWidth
        && params[IntegratedGaussianPsf.WIDTH] <= halfRadius
        && Math.abs(params[IntegratedGaussianPsf.AMPLITUDE]) <= maxAmplitude;
  }

  /**
   * Gets the fit radius.
   *
   * @return the fit radius
   */
  public int getFitRadius() {
    return fitRadius;
  }
}
