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

package uk.ac.sussex.gdsc.localisation.ij;

import ij.IJ;
import ij.io.OpenDialog;
import ij.plugin.PlugIn;
import ij.text.TextWindow;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.ij.BufferedTextWindow;
import uk.ac.sussex.gdsc.core.ij.ImageJPluginLoggerHelper;
import uk.ac.sussex.gdsc.core.ij.ImageJUtils;
import uk.ac.sussex.gdsc.core.ij.gui.ExtendedGenericDialog;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.localisation.LocalisationSettings;
import uk.ac.sussex.gdsc.localisation.ParticleResultsWriter;
import uk.ac.sussex.gdsc.localisation.StackLocaliser;
import uk.ac.sussex.gdsc.localisation.fit.Particle;
import uk.ac.sussex.gdsc.localisation.io.Frame;

/**
 * Localise single emitters in each frame of a 16-bit TIFF image stack and show the results in a
 * table.
 *
 * <p>The image is read directly from the file one frame at a time so the stack does not have to
 * fit in memory.
 */
public class SmlmLocalisation_PlugIn implements PlugIn {
  private static final String TITLE = "SMLM Localisation";
  private static final AtomicReference<TextWindow> RESULTS_TABLE = new AtomicReference<>();

  /** The plugin settings. */
  private Settings settings;

  /**
   * Contains the settings that are the re-usable state of the plugin.
   */
  private static class Settings {
    /** The last settings used by the plugin. This should be updated after plugin execution. */
    private static final AtomicReference<Settings> lastSettings =
        new AtomicReference<>(new Settings());

    String inputFile;
    LocalisationSettings localisationSettings;
    boolean saveResults;
    String resultsFile;

    Settings() {
      inputFile = "";
      localisationSettings = new LocalisationSettings();
      resultsFile = "";
    }

    Settings(Settings source) {
      inputFile = source.inputFile;
      localisationSettings = source.localisationSettings.copy();
      saveResults = source.saveResults;
      resultsFile = source.resultsFile;
    }

    Settings copy() {
      return new Settings(this);
    }

    /**
     * Load a copy of the settings.
     *
     * @return the settings
     */
    static Settings load() {
      return lastSettings.get().copy();
    }

    /**
     * Save the settings.
     */
    void save() {
      lastSettings.set(this);
    }
  }

  @Override
  public void run(String arg) {
    settings = Settings.load();
    if (!selectInput() || !showDialog()) {
      return;
    }
    settings.save();

    // Route the processing log messages to the ImageJ log window
    final Logger logger =
        ImageJPluginLoggerHelper.getLogger(StackLocaliser.class.getPackage().getName());

    final LocalisationSettings localisationSettings = settings.localisationSettings;
    final double pixelSize = localisationSettings.getPixelSize();
    final int[] count = new int[1];
    final long start = System.nanoTime();

    try (BufferedTextWindow table = new BufferedTextWindow(createResultsTable());
        ParticleResultsWriter writer = createWriter(pixelSize)) {
      final StackLocaliser localiser = new StackLocaliser(localisationSettings);
      final int frames = localiser.run(Paths.get(settings.inputFile), (frame, particles) -> {
        IJ.showStatus(String.format("Frame %d: %s", frame.getIndex() + 1,
            TextUtils.pleural(particles.size(), "particle")));
        for (final Particle particle : particles) {
          table.append(ParticleResultsWriter.toRow(particle, pixelSize));
        }
        count[0] += particles.size();
        write(writer, frame, particles);
      });
      final long time = System.nanoTime() - start;
      ImageJUtils.log("%s : %s : %s, %s in %s", TITLE, settings.inputFile,
          TextUtils.pleural(frames, "frame"), TextUtils.pleural(count[0], "particle"),
          TextUtils.nanosToString(time));
    } catch (final IOException | UncheckedIOException ex) {
      logger.log(Level.FINE, "Localisation failed", ex);
      IJ.error(TITLE, "Failed to localise " + settings.inputFile + ":\n" + ex.getMessage());
    }
    IJ.showStatus("");
  }

  private boolean selectInput() {
    final String[] path = ImageJUtils.decodePath(settings.inputFile);
    final OpenDialog chooser = new OpenDialog("TIFF_stack", path[0], path[1]);
    if (chooser.getFileName() == null) {
      return false;
    }
    settings.inputFile = chooser.getDirectory() + chooser.getFileName();
    return true;
  }

  private boolean showDialog() {
    final LocalisationSettings s = settings.localisationSettings;
    final ExtendedGenericDialog gd = new ExtendedGenericDialog(TITLE);
    gd.addMessage("Localise emitters in each frame of:\n" + settings.inputFile);
    gd.addNumericField("Fit_radius", s.getFitRadius(), 0);
    gd.addNumericField("Intensity_to_photon", s.getIntensityToPhoton(), 3);
    gd.addNumericField("Pixel_size", s.getPixelSize(), 2, 6, "nm");
    gd.addNumericField("Threshold_factor", s.getThresholdFactor(), 2);
    gd.addNumericField("Max_iterations", s.getMaxIterations(), 0);
    gd.addNumericField("Max_amplitude", s.getMaxAmplitude(), 0);
    gd.addNumericField("Min_width", s.getMinWidth(), 2);
    gd.addCheckbox("Save_results", settings.saveResults);
    gd.addStringField("Results_file", settings.resultsFile, 30);
    gd.showDialog();

    if (gd.wasCanceled()) {
      return false;
    }

    s.setFitRadius((int) Math.abs(gd.getNextNumber()));
    s.setIntensityToPhoton(Math.abs(gd.getNextNumber()));
    s.setPixelSize(Math.abs(gd.getNextNumber()));
    s.setThresholdFactor(Math.abs(gd.getNextNumber()));
    s.setMaxIterations((int) Math.abs(gd.getNextNumber()));
    s.setMaxAmplitude(Math.abs(gd.getNextNumber()));
    s.setMinWidth(Math.abs(gd.getNextNumber()));
    settings.saveResults = gd.getNextBoolean();
    settings.resultsFile = gd.getNextString();

    if (s.getFitRadius() < 1 || s.getMaxIterations() < 1) {
      IJ.error(TITLE, "Fit radius and max iterations must be strictly positive");
      return false;
    }
    if (settings.saveResults && TextUtils.isNullOrEmpty(settings.resultsFile)) {
      IJ.error(TITLE, "No results file");
      return false;
    }
    return true;
  }

  private static TextWindow createResultsTable() {
    return ImageJUtils.refresh(RESULTS_TABLE, () -> new TextWindow(TITLE + " Results",
        String.join("\t", ParticleResultsWriter.HEADINGS), "", 800, 400));
  }

  private ParticleResultsWriter createWriter(double pixelSize) throws IOException {
    if (settings.saveResults) {
      return new ParticleResultsWriter(Paths.get(settings.resultsFile), pixelSize);
    }
    return null;
  }

  private static void write(ParticleResultsWriter writer, Frame frame, List<Particle> particles) {
    if (writer == null) {
      return;
    }
    try {
      writer.write(particles);
    } catch (final IOException ex) {
      throw new UncheckedIOException("Failed to write frame " + (frame.getIndex() + 1), ex);
    }
  }
}
