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

import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.localisation.detect.Candidate;
import uk.ac.sussex.gdsc.localisation.detect.CandidateDetector;
import uk.ac.sussex.gdsc.localisation.filter.FramePreprocessor;
import uk.ac.sussex.gdsc.localisation.filter.PreprocessedFrame;
import uk.ac.sussex.gdsc.localisation.fit.Particle;
import uk.ac.sussex.gdsc.localisation.fit.ParticleFitter;
import uk.ac.sussex.gdsc.localisation.io.Frame;

/**
 * Localise emitters in a single frame.
 *
 * <p>Candidates are detected as local maxima of a band-pass filtered image above a noise threshold.
 * Each candidate is fitted in the image converted to photons and implausible fits are discarded.
 */
public class FrameLocaliser {
  private static final Logger logger = Logger.getLogger(FrameLocaliser.class.getName());

  private final double intensityToPhoton;
  private final FramePreprocessor preprocessor;
  private final CandidateDetector detector;
  private final ParticleFitter fitter;

  /**
   * Create a new instance.
   *
   * @param settings the settings
   */
  public FrameLocaliser(LocalisationSettings settings) {
    intensityToPhoton = settings.getIntensityToPhoton();
    preprocessor = new FramePreprocessor(settings.getThresholdFactor());
    detector = new CandidateDetector(settings.getFitRadius());
    fitter = new ParticleFitter(settings);
  }

  /**
   * Localise emitters in the frame.
   *
   * @param frame the frame
   * @return the particles
   */
  public List<Particle> localise(Frame frame) {
    return localise(frame.getIndex(), frame.toDouble(), frame.getWidth(), frame.getHeight());
  }

  /**
   * Localise emitters in the image.
   *
   * @param frame the frame index
   * @param data the image data in camera counts (row-major)
   * @param width the width
   * @param height the height
   * @return the particles
   */
  public List<Particle> localise(int frame, double[] data, int width, int height) {
    final PreprocessedFrame filtered = preprocessor.process(data, width, height);
    final List<Candidate> candidates =
        detector.detect(filtered.getBandPass(), width, height, filtered.getThreshold());

    final double[] photons = new double[data.length];
    for (int i = 0; i < photons.length; i++) {
      photons[i] = data[i] * intensityToPhoton;
    }
    final List<Particle> particles = fitter.fit(frame, photons, width, height, candidates);
    logger.fine(() -> String.format("Frame %d: %s, %s", frame,
        TextUtils.pleural(candidates.size(), "candidate"),
        TextUtils.pleural(particles.size(), "particle")));
    return particles;
  }
}
