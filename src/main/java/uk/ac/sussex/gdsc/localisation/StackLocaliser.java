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
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.localisation.fit.Particle;
import uk.ac.sussex.gdsc.localisation.io.Frame;
import uk.ac.sussex.gdsc.localisation.io.ImageFormatException;
import uk.ac.sussex.gdsc.localisation.io.ImageFormatException.Kind;
import uk.ac.sussex.gdsc.localisation.io.TiffDecoder;

/**
 * Localise emitters in every frame of a TIFF image stack.
 *
 * <p>Frames are decoded and processed in directory order. Any decoding error aborts processing;
 * the listener has received the results of all frames before the failing frame.
 */
public class StackLocaliser {
  private static final Logger logger = Logger.getLogger(StackLocaliser.class.getName());

  private final FrameLocaliser localiser;

  /**
   * Receive the results of each frame.
   */
  @FunctionalInterface
  public interface FrameListener {
    /**
     * Called when the frame has been localised.
     *
     * @param frame the frame
     * @param particles the particles
     */
    void frameLocalised(Frame frame, List<Particle> particles);
  }

  /**
   * Create a new instance.
   *
   * @param settings the settings
   */
  public StackLocaliser(LocalisationSettings settings) {
    localiser = new FrameLocaliser(settings);
  }

  /**
   * Localise all frames in the file.
   *
   * @param path the path
   * @param listener the listener
   * @return the number of frames
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public int run(Path path, FrameListener listener) throws IOException {
    try (SeekableByteChannel channel = Files.newByteChannel(path)) {
      return run(channel, listener);
    }
  }

  /**
   * Localise all frames in the channel. The channel is not closed.
   *
   * @param channel the channel
   * @param listener the listener
   * @return the number of frames
   * @throws ImageFormatException if the image data is invalid or a directory is visited twice
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public int run(SeekableByteChannel channel, FrameListener listener) throws IOException {
    final TiffDecoder decoder = new TiffDecoder(channel);
    decoder.start();
    final Set<Long> visited = new HashSet<>();
    long offset = decoder.getFirstDirectoryOffset();
    int count = 0;
    while (offset != 0) {
      if (!visited.add(offset)) {
        throw new ImageFormatException(Kind.FORMAT, "Directory loop at offset " + offset);
      }
      offset = decoder.parseDirectory(offset);
      final Frame frame = decoder.readFrame(count);
      listener.frameLocalised(frame, localiser.localise(frame));
      count++;
    }
    if (count == 0) {
      logger.warning("No image directories");
    }
    return count;
  }
}
