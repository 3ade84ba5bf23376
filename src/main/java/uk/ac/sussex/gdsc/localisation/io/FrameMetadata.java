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

import java.util.Arrays;

/**
 * Contains the metadata decoded from a single image file directory.
 *
 * <p>Fields not present in the directory keep their default value: zero, an empty array or an
 * empty string.
 */
public class FrameMetadata {
  private static final long[] EMPTY_LONGS = new long[0];
  private static final int[] EMPTY_INTS = new int[0];

  private long imageWidth;
  private long imageLength;
  private int[] bitsPerSample = EMPTY_INTS;
  private int compression;
  private int photometric;
  private int fillOrder;
  private String imageDescription = "";
  private long[] stripOffsets = EMPTY_LONGS;
  private int orientation;
  private long samplesPerPixel;
  private long rowsPerStrip;
  private long[] stripByteCounts = EMPTY_LONGS;
  private long[] xresolution = EMPTY_LONGS;
  private long[] yresolution = EMPTY_LONGS;
  private int planarConfiguration;
  private int resolutionUnit;
  private String software = "";
  private int[] sampleFormats = EMPTY_INTS;
  private String imageId = "";

  /**
   * The compression methods.
   */
  public enum Compression {
    /** No compression. */
    NONE(1, "None"),
    /** CCITT modified Huffman RLE. */
    CCITT(2, "CCITT"),
    /** PackBits compression. */
    PACK_BITS(32773, "PackBits");

    private final int code;
    private final String description;

    Compression(int code, String description) {
      this.code = code;
      this.description = description;
    }

    /**
     * Gets the code.
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
     * Get the value for the code.
     *
     * @param code the code
     * @return the value (or null)
     */
    public static Compression forCode(int code) {
      for (final Compression value : values()) {
        if (value.code == code) {
          return value;
        }
      }
      return null;
    }
  }

  /**
   * The photometric interpretation.
   */
  public enum Photometric {
    /** White is zero. */
    WHITE_IS_ZERO(0, "WhiteIsZero"),
    /** Black is zero. */
    BLACK_IS_ZERO(1, "BlackIsZero"),
    /** RGB. */
    RGB(2, "RGB"),
    /** Palette colour. */
    PALETTE(3, "Palette"),
    /** Transparency mask. */
    TRANSPARENCY_MASK(4, "TransparencyMask");

    private final int code;
    private final String description;

    Photometric(int code, String description) {
      this.code = code;
      this.description = description;
    }

    /**
     * Gets the code.
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
     * Get the value for the code.
     *
     * @param code the code
     * @return the value (or null)
     */
    public static Photometric forCode(int code) {
      for (final Photometric value : values()) {
        if (value.code == code) {
          return value;
        }
      }
      return null;
    }
  }

  /**
   * The resolution unit.
   */
  public enum ResolutionUnit {
    /** No absolute unit. */
    NONE(1, "None"),
    /** Inch. */
    INCH(2, "Inch"),
    /** Centimeter. */
    CENTIMETER(3, "Centimeter");

    private final int code;
    private final String description;

    ResolutionUnit(int code, String description) {
      this.code = code;
      this.description = description;
    }

    /**
     * Gets the code.
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
     * Get the value for the code.
     *
     * @param code the code
     * @return the value (or null)
     */
    public static ResolutionUnit forCode(int code) {
      for (final ResolutionUnit value : values()) {
        if (value.code == code) {
          return value;
        }
      }
      return null;
    }
  }

  /**
   * The sample format.
   */
  public enum SampleFormat {
    /** Unsigned integer data. */
    UNSIGNED(1, "Unsigned"),
    /** Two's complement signed integer data. */
    TWO_COMPLEMENT(2, "TwoComplement"),
    /** IEEE floating point data. */
    IEEE_FLOAT(3, "IEEEFloat"),
    /** Undefined data format. */
    UNDEFINED(4, "Undefined");

    private final int code;
    private final String description;

    SampleFormat(int code, String description) {
      this.code = code;
      this.description = description;
    }

    /**
     * Gets the code.
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
     * Get the value for the code.
     *
     * @param code the code
     * @return the value (or null)
     */
    public static SampleFormat forCode(int code) {
      for (final SampleFormat value : values()) {
        if (value.code == code) {
          return value;
        }
      }
      return null;
    }
  }

  /**
   * Gets the image width.
   *
   * @return the image width
   */
  public long getImageWidth() {
    return imageWidth;
  }

  void setImageWidth(long imageWidth) {
    this.imageWidth = imageWidth;
  }

  /**
   * Gets the image length (height).
   *
   * @return the image length
   */
  public long getImageLength() {
    return imageLength;
  }

  void setImageLength(long imageLength) {
    this.imageLength = imageLength;
  }

  /**
   * Gets the bits per sample for each sample of a pixel.
   *
   * @return the bits per sample
   */
  public int[] getBitsPerSample() {
    return bitsPerSample.clone();
  }

  void setBitsPerSample(int[] bitsPerSample) {
    this.bitsPerSample = bitsPerSample;
  }

  /**
   * Gets the compression code.
   *
   * @return the compression code
   */
  public int getCompressionCode() {
    return compression;
  }

  /**
   * Gets the compression.
   *
   * @return the compression (null if not recognised)
   */
  public Compression getCompression() {
    return Compression.forCode(compression);
  }

  void setCompression(int compression) {
    this.compression = compression;
  }

  /**
   * Gets the photometric interpretation code.
   *
   * @return the photometric code
   */
  public int getPhotometricCode() {
    return photometric;
  }

  /**
   * Gets the photometric interpretation.
   *
   * @return the photometric interpretation (null if not recognised)
   */
  public Photometric getPhotometric() {
    return Photometric.forCode(photometric);
  }

  void setPhotometric(int photometric) {
    this.photometric = photometric;
  }

  /**
   * Gets the fill order.
   *
   * @return the fill order
   */
  public int getFillOrder() {
    return fillOrder;
  }

  void setFillOrder(int fillOrder) {
    this.fillOrder = fillOrder;
  }

  /**
   * Gets the image description.
   *
   * @return the image description
   */
  public String getImageDescription() {
    return imageDescription;
  }

  void setImageDescription(String imageDescription) {
    this.imageDescription = imageDescription;
  }

  /**
   * Gets the strip offsets.
   *
   * @return the strip offsets
   */
  public long[] getStripOffsets() {
    return stripOffsets.clone();
  }

  void setStripOffsets(long[] stripOffsets) {
    this.stripOffsets = stripOffsets;
  }

  /**
   * Gets the orientation.
   *
   * @return the orientation
   */
  public int getOrientation() {
    return orientation;
  }

  void setOrientation(int orientation) {
    this.orientation = orientation;
  }

  /**
   * Gets the samples per pixel.
   *
   * @return the samples per pixel
   */
  public long getSamplesPerPixel() {
    return samplesPerPixel;
  }

  void setSamplesPerPixel(long samplesPerPixel) {
    this.samplesPerPixel = samplesPerPixel;
  }

  /**
   * Gets the rows per strip.
   *
   * @return the rows per strip
   */
  public long getRowsPerStrip() {
    return rowsPerStrip;
  }

  void setRowsPerStrip(long rowsPerStrip) {
    this.rowsPerStrip = rowsPerStrip;
  }

  /**
   * Gets the strip byte counts.
   *
   * @return the strip byte counts
   */
  public long[] getStripByteCounts() {
    return stripByteCounts.clone();
  }

  void setStripByteCounts(long[] stripByteCounts) {
    this.stripByteCounts = stripByteCounts;
  }

  /**
   * Gets the x resolution as a {numerator, denominator} pair.
   *
   * @return the x resolution (empty if not present)
   */
  public long[] getXResolution() {
    return xresolution.clone();
  }

  void setXResolution(long[] xresolution) {
    this.xresolution = xresolution;
  }

  /**
   * Gets the y resolution as a {numerator, denominator} pair.
   *
   * @return the y resolution (empty if not present)
   */
  public long[] getYResolution() {
    return yresolution.clone();
  }

  void setYResolution(long[] yresolution) {
    this.yresolution = yresolution;
  }

  /**
   * Gets the planar configuration.
   *
   * @return the planar configuration
   */
  public int getPlanarConfiguration() {
    return planarConfiguration;
  }

  void setPlanarConfiguration(int planarConfiguration) {
    this.planarConfiguration = planarConfiguration;
  }

  /**
   * Gets the resolution unit code.
   *
   * @return the resolution unit code
   */
  public int getResolutionUnitCode() {
    return resolutionUnit;
  }

  /**
   * Gets the resolution unit.
   *
   * @return the resolution unit (null if not recognised)
   */
  public ResolutionUnit getResolutionUnit() {
    return ResolutionUnit.forCode(resolutionUnit);
  }

  void setResolutionUnit(int resolutionUnit) {
    this.resolutionUnit = resolutionUnit;
  }

  /**
   * Gets the software.
   *
   * @return the software
   */
  public String getSoftware() {
    return software;
  }

  void setSoftware(String software) {
    this.software = software;
  }

  /**
   * Gets the sample format codes for each sample of a pixel.
   *
   * @return the sample format codes
   */
  public int[] getSampleFormatCodes() {
    return sampleFormats.clone();
  }

  /**
   * Gets the sample formats for each sample of a pixel. Unrecognised codes are null.
   *
   * @return the sample formats
   */
  public SampleFormat[] getSampleFormats() {
    return Arrays.stream(sampleFormats).mapToObj(SampleFormat::forCode)
        .toArray(SampleFormat[]::new);
  }

  void setSampleFormats(int[] sampleFormats) {
    this.sampleFormats = sampleFormats;
  }

  /**
   * Gets the image ID.
   *
   * @return the image ID
   */
  public String getImageId() {
    return imageId;
  }

  void setImageId(String imageId) {
    this.imageId = imageId;
  }

  /**
   * Gets the number of bytes used to store the image pixels. Assumes one sample per pixel using
   * the first bits per sample value.
   *
   * @return the image byte size
   */
  public long getImageByteSize() {
    final int bits = bitsPerSample.length == 0 ? 0 : bitsPerSample[0];
    return imageWidth * imageLength * (bits / 8);
  }

  /**
   * Gets the number of strips required by the image length and rows per strip.
   *
   * @return the strip count (or -1 if the rows per strip is zero)
   */
  public long getExpectedStripCount() {
    if (rowsPerStrip == 0) {
      return -1;
    }
    return (imageLength + rowsPerStrip - 1) / rowsPerStrip;
  }

  @Override
  public String toString() {
    return String.format("%dx%d, bits=%s, samples=%d, compression=%d, strips=%d, rows/strip=%d",
        imageWidth, imageLength, Arrays.toString(bitsPerSample), samplesPerPixel, compression,
        stripOffsets.length, rowsPerStrip);
  }
}
