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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import uk.ac.sussex.gdsc.core.utils.FileUtils;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.localisation.fit.Particle;

/**
 * Write particles to a delimited text file.
 *
 * <p>Each line has the frame (starting at 1), the position and width in nm, the amplitude and the
 * background in photons.
 */
public class ParticleResultsWriter implements Closeable {
  /** The column headings. */
  public static final String[] HEADINGS =
      {"Frame", "X (nm)", "Y (nm)", "Width (nm)", "Amplitude", "Background"};

  private final BufferedWriter out;
  private final double pixelSize;
  private final StringBuilder sb = new StringBuilder();

  /**
   * Create a new instance and write the header line. The parent directory is created if
   * required.
   *
   * @param path the path
   * @param pixelSize the pixel size in nm
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public ParticleResultsWriter(Path path, double pixelSize) throws IOException {
    FileUtils.createParent(path);
    this.pixelSize = pixelSize;
    out = Files.newBufferedWriter(path);
    out.write(String.join(",", HEADINGS));
    out.newLine();
  }

  /**
   * Write the particles.
   *
   * @param particles the particles
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public void write(List<Particle> particles) throws IOException {
    for (final Particle particle : particles) {
      write(particle);
    }
  }

  /**
   * Write the particle.
   *
   * @param particle the particle
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public void write(Particle particle) throws IOException {
    sb.setLength(0);
    sb.append(particle.getFrame() + 1).append(',');
    sb.append(pixelSize * particle.getPositionX()).append(',');
    sb.append(pixelSize * particle.getPositionY()).append(',');
    sb.append(pixelSize * particle.getWidth()).append(',');
    sb.append(particle.getAmplitude()).append(',');
    sb.append(particle.getBackground());
    out.write(sb.toString());
    out.newLine();
  }

  @Override
  public void close() throws IOException {
    out.close();
  }

  /**
   * Create a tab-delimited row for the particle with rounded values.
   *
   * @param particle the particle
   * @param pixelSize the pixel size in nm
   * @return the row
   */
  public static String toRow(Particle particle, double pixelSize) {
    return new StringBuilder().append(particle.getFrame() + 1).append('\t')
        .append(MathUtils.rounded(pixelSize * particle.getPositionX())).append('\t')
        .append(MathUtils.rounded(pixelSize * particle.getPositionY())).append('\t')
        .append(MathUtils.rounded(pixelSize * particle.getWidth())).append('\t')
        .append(MathUtils.rounded(particle.getAmplitude())).append('\t')
        .append(MathUtils.rounded(particle.getBackground())).toString();
  }
}
