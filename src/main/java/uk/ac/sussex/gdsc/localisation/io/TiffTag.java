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

package uk.ac.sussex.gdsc.localisation.io;

/**
 * The directory entry tags recognised by the {@link TiffDecoder}.
 *
 * <p>Any other tag code maps to {@link #UNRECOGNISED}.
 */
public enum TiffTag {
  /** The image width. */
  IMAGE_WIDTH(0x100, "ImageWidth"),
  /** The image length (height). */
  IMAGE_LENGTH(0x101, "ImageLength"),
  /** The bits per sample. */
  BITS_PER_SAMPLE(0x102, "BitsPerSample"),
  /** The compression. */
  COMPRESSION(0x103, "Compression"),
  /** The photometric interpretation. */
  PHOTOMETRIC_INTERPRETATION(0x106, "PhotometricInterpretation"),
  /** The fill order. */
  FILL_ORDER(0x10a, "FillOrder"),
  /** The image description. */
  IMAGE_DESCRIPTION(0x10e, "ImageDescription"),
  /** The strip offsets. */
  STRIP_OFFSETS(0x111, "StripOffsets"),
  /** The orientation. */
  ORIENTATION(0x112, "Orientation"),
  /** The samples per pixel. */
  SAMPLES_PER_PIXEL(0x115, "SamplesPerPixel"),
  /** The rows per strip. */
  ROWS_PER_STRIP(0x116, "RowsPerStrip"),
  /** The strip byte counts. */
  STRIP_BYTE_COUNTS(0x117, "StripByteCounts"),
  /** The x resolution. */
  X_RESOLUTION(0x11a, "XResolution"),
  /** The y resolution. */
  Y_RESOLUTION(0x11b, "YResolution"),
  /** The planar configuration. */
  PLANAR_CONFIGURATION(0x11c, "PlanarConfiguration"),
  /** The resolution unit. */
  RESOLUTION_UNIT(0x128, "ResolutionUnit"),
  /** The software. */
  SOFTWARE(0x131, "Software"),
  /** The sample format. */
  SAMPLE_FORMAT(0x153, "SampleFormat"),
  /** The image ID. */
  IMAGE_ID(0x800d, "ImageID"),
  /** Any tag not in this enumeration. */
  UNRECOGNISED(-1, "Unrecognised");

  /** The values that map to a tag code. */
  private static final TiffTag[] values;

  static {
    final TiffTag[] all = values();
    values = new TiffTag[all.length - 1];
    System.arraycopy(all, 0, values, 0, values.length);
  }

  /** The tag code. */
  private final int code;

  /** The name used in the file format documentation. */
  private final String description;

  TiffTag(int code, String description) {
    this.code = code;
    this.description = description;
  }

  /**
   * Gets the tag code.
   *
   * @return the code
   */
  public int getCode() {
    return code;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Get the tag for the code.
   *
   * @param code the code
   * @return the tag (or {@link #UNRECOGNISED})
   */
  public static TiffTag forCode(int code) {
    for (final TiffTag value : values) {
      if (value.code == code) {
        return value;
      }
    }
    return UNRECOGNISED;
  }
}
