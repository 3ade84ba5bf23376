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
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.localisation.fit.Particle;
import uk.ac.sussex.gdsc.localisation.io.Frame;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;

@SuppressWarnings({"javadoc"})
class FrameLocaliserTest {
  private static final int SIZE = 64;

  @Test
  void canLocaliseSingleEmitter() {
    final double[] data = TestImages.createSpot(SIZE, 31.3, 28.7, 1.3, 500, 5);
    final List<Particle> particles =
        new FrameLocaliser(new LocalisationSettings()).localise(2, data, SIZE, SIZE);
    Assertions.assertEquals(1, particles.size());
    final Particle p = particles.get(0);
    Assertions.assertEquals(2, p.getFrame());
    Assertions.assertEquals(31, p.getX());
    Assertions.assertEquals(29, p.getY());
    Assertions.assertEquals(31.3, p.getPositionX(), 0.05);
    Assertions.assertEquals(28.7, p.getPositionY(), 0.05);
    Assertions.assertEquals(1.3, p.getWidth(), 1.3 * 0.05);
    Assertions.assertEquals(500, p.getAmplitude(), 500 * 0.05);
    Assertions.assertEquals(5, p.getBackground(), 5 * 0.2);
  }

  @Test
  void testBrightEmitterIsRejected() {
    // Amplitude parameter of 2000 is above the plausible limit
    final double[] data = TestImages.createSpot(SIZE, 31.3, 28.7, 1.3, 2000.0 * 2000, 5);
    final List<Particle> particles =
        new FrameLocaliser(new LocalisationSettings()).localise(0, data, SIZE, SIZE);
    Assertions.assertTrue(particles.isEmpty());
  }

  @Test
  void testEmptyImageHasNoParticles() {
    final FrameLocaliser localiser = new FrameLocaliser(new LocalisationSettings());
    Assertions.assertTrue(localiser.localise(0, new double[SIZE * SIZE], SIZE, SIZE).isEmpty());
    Assertions.assertTrue(localiser.localise(new Frame(0, SIZE, SIZE, new short[SIZE * SIZE]))
        .isEmpty());
  }

  @Test
  void canLocaliseFrame() {
    final double[] data = TestImages.createSpot(SIZE, 20.6, 40.2, 1.1, 3000, 20);
    final short[] pixels = new short[data.length];
    for (int i = 0; i < data.length; i++) {
      pixels[i] = (short) Math.round(data[i]);
    }
    final List<Particle> particles = new FrameLocaliser(new LocalisationSettings())
        .localise(new Frame(4, SIZE, SIZE, pixels));
    Assertions.assertEquals(1, particles.size());
    final Particle p = particles.get(0);
    Assertions.assertEquals(4, p.getFrame());
    Assertions.assertEquals(20.6, p.getPositionX(), 0.1);
    Assertions.assertEquals(40.2, p.getPositionY(), 0.1);
  }

  @SeededTest
  void canLocaliseEmitterWithPoissonNoise(RandomSeed seed) {
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final double[] data = TestImages.createSpot(SIZE, 31.3, 28.7, 1.3, 2000, 10);
    for (int i = 0; i < data.length; i++) {
      final double photons = data[i] * LocalisationSettings.DEFAULT_INTENSITY_TO_PHOTON;
      data[i] = PoissonSampler.of(rng, photons).sample()
          / LocalisationSettings.DEFAULT_INTENSITY_TO_PHOTON;
    }
    final List<Particle> particles =
        new FrameLocaliser(new LocalisationSettings()).localise(0, data, SIZE, SIZE);
    Assertions.assertTrue(particles.stream().anyMatch(p -> Math.abs(p.getPositionX() - 31.3) < 1
        && Math.abs(p.getPositionY() - 28.7) < 1), () -> particles.toString());
  }
}
