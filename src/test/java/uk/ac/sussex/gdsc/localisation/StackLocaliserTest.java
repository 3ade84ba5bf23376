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

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.sussex.gdsc.localisation.fit.Particle;
import uk.ac.sussex.gdsc.localisation.io.ImageFormatException;
import uk.ac.sussex.gdsc.localisation.io.ImageFormatException.Kind;
import uk.ac.sussex.gdsc.localisation.io.TiffBuilder;

@SuppressWarnings({"javadoc"})
class StackLocaliserTest {
  private static final int SIZE = 32;

  @TempDir
  Path tempDir;

  private Path write(TiffBuilder builder) throws IOException {
    final Path path = tempDir.resolve("stack.tif");
    Files.write(path, builder.build());
    return path;
  }

  private static double[] createFlat() {
    final double[] data = new double[SIZE * SIZE];
    Arrays.fill(data, 14);
    return data;
  }

  @Test
  void canLocaliseStack() throws IOException {
    final Path path = write(new TiffBuilder(ByteOrder.LITTLE_ENDIAN, SIZE, SIZE)
        .addImage(createFlat()).addImage(TestImages.createSpot(SIZE, 15.4, 16.2, 1.3, 5000, 50)));
    final List<Integer> frames = new ArrayList<>();
    final List<Particle> particles = new ArrayList<>();
    final int count =
        new StackLocaliser(new LocalisationSettings()).run(path, (frame, list) -> {
          frames.add(frame.getIndex());
          particles.addAll(list);
        });
    Assertions.assertEquals(2, count);
    Assertions.assertEquals(Arrays.asList(0, 1), frames);
    Assertions.assertEquals(1, particles.size());
    final Particle p = particles.get(0);
    Assertions.assertEquals(1, p.getFrame());
    Assertions.assertEquals(15.4, p.getPositionX(), 0.1);
    Assertions.assertEquals(16.2, p.getPositionY(), 0.1);
  }

  @Test
  void canLocaliseBigEndianStack() throws IOException {
    final Path path = write(new TiffBuilder(ByteOrder.BIG_ENDIAN, SIZE, SIZE).setRowsPerStrip(5)
        .addImage(TestImages.createSpot(SIZE, 15.4, 16.2, 1.3, 5000, 50)));
    final List<Particle> particles = new ArrayList<>();
    final int count = new StackLocaliser(new LocalisationSettings()).run(path,
        (frame, list) -> particles.addAll(list));
    Assertions.assertEquals(1, count);
    Assertions.assertEquals(1, particles.size());
    Assertions.assertEquals(15.4, particles.get(0).getPositionX(), 0.1);
  }

  @Test
  void testInvalidStripCountStopsProcessing() throws IOException {
    final Path path = write(new TiffBuilder(ByteOrder.LITTLE_ENDIAN, SIZE, SIZE)
        .setDeclaredRowsPerStrip(2).addImage(createFlat()));
    final List<Integer> frames = new ArrayList<>();
    final StackLocaliser localiser = new StackLocaliser(new LocalisationSettings());
    final ImageFormatException ex = Assertions.assertThrows(ImageFormatException.class,
        () -> localiser.run(path, (frame, list) -> frames.add(frame.getIndex())));
    Assertions.assertEquals(Kind.SIZE_MISMATCH, ex.getKind());
    Assertions.assertTrue(frames.isEmpty());
  }

  @Test
  void testInvalidMarkerThrows() throws IOException {
    final Path path = write(new TiffBuilder(ByteOrder.LITTLE_ENDIAN, SIZE, SIZE).setMarker("XX")
        .addImage(createFlat()));
    final StackLocaliser localiser = new StackLocaliser(new LocalisationSettings());
    final ImageFormatException ex = Assertions.assertThrows(ImageFormatException.class,
        () -> localiser.run(path, (frame, list) -> Assertions.fail("No frames expected")));
    Assertions.assertEquals(Kind.FORMAT, ex.getKind());
  }
}
