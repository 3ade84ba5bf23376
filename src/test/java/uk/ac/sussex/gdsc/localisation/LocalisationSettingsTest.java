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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.localisation.filter.FramePreprocessor;
import uk.ac.sussex.gdsc.localisation.optim.NelderMeadMinimiser;

@SuppressWarnings({"javadoc"})
class LocalisationSettingsTest {
  @Test
  void testDefaults() {
    final LocalisationSettings settings = new LocalisationSettings();
    Assertions.assertEquals(4, settings.getFitRadius());
    Assertions.assertEquals(9, settings.getFitWindowSize());
    Assertions.assertEquals(3.6, settings.getIntensityToPhoton());
    Assertions.assertEquals(80, settings.getPixelSize());
    Assertions.assertEquals(FramePreprocessor.DEFAULT_THRESHOLD_FACTOR,
        settings.getThresholdFactor());
    Assertions.assertEquals(Math.sqrt(1.6), settings.getInitialWidth());
    Assertions.assertEquals(NelderMeadMinimiser.DEFAULT_VALUE_TOLERANCE,
        settings.getValueTolerance());
    Assertions.assertEquals(NelderMeadMinimiser.DEFAULT_POSITION_TOLERANCE,
        settings.getPositionTolerance());
    Assertions.assertEquals(1000, settings.getMaxIterations());
    Assertions.assertEquals(1000, settings.getMaxAmplitude());
    Assertions.assertEquals(0.5, settings.getMinWidth());
  }

  @Test
  void canCopy() {
    final LocalisationSettings settings = new LocalisationSettings();
    settings.setFitRadius(3);
    settings.setIntensityToPhoton(2);
    settings.setPixelSize(100);
    settings.setThresholdFactor(2.5);
    settings.setInitialWidth(1.5);
    settings.setValueTolerance(1e-3);
    settings.setPositionTolerance(1e-4);
    settings.setMaxIterations(50);
    settings.setMaxAmplitude(30);
    settings.setMinWidth(0.75);
    final LocalisationSettings copy = settings.copy();
    Assertions.assertNotSame(settings, copy);
    Assertions.assertEquals(3, copy.getFitRadius());
    Assertions.assertEquals(7, copy.getFitWindowSize());
    Assertions.assertEquals(2, copy.getIntensityToPhoton());
    Assertions.assertEquals(100, copy.getPixelSize());
    Assertions.assertEquals(2.5, copy.getThresholdFactor());
    Assertions.assertEquals(1.5, copy.getInitialWidth());
    Assertions.assertEquals(1e-3, copy.getValueTolerance());
    Assertions.assertEquals(1e-4, copy.getPositionTolerance());
    Assertions.assertEquals(50, copy.getMaxIterations());
    Assertions.assertEquals(30, copy.getMaxAmplitude());
    Assertions.assertEquals(0.75, copy.getMinWidth());

    copy.setFitRadius(5);
    Assertions.assertEquals(3, settings.getFitRadius());
  }
}
