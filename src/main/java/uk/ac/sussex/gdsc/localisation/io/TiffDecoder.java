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

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.localisation.io.ImageFormatException.Kind;

/**
 * Decodes frames from a multi-image TIFF container.
 *
 * <p>Only uncompressed images with a single 16-bit sample per pixel stored in strips are
 * supported. The decoder reads the header using {@link #start()}, then each image file directory
 * (IFD) using {@link #parseDirectory(long)} followed by the pixels using {@link #readPixels()}.
 *
 * <p>All reads are positioned reads on the channel. This class is not thread-safe.
 */
public class TiffDecoder {
  private static final Logger logger = Logger.getLogger(TiffDecoder.class.getName());

  /** The value that follows the byte order marker in the header. */
  public static final int MAGIC_NUMBER = 42;
  /** The size of the header in bytes. */
  public static final int HEADER_SIZE = 8;

  private static final byte LITTLE_ENDIAN_MARKER = 'I';
  private static final byte BIG_ENDIAN_MARKER = 'M';
  private static final int BITS_PER_SAMPLE = 16;
  private static final int BYTES_PER_SAMPLE = 2;
  /** The largest array that will be allocated. */
  private static final long MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

  /** The channel. */
  private final SeekableByteChannel channel;
  /** Buffer for reading primitives in the native byte order. */
  private final ByteBuffer scratch = ByteBuffer.allocate(4).order(ByteOrder.nativeOrder());

  /** The byte order of the file. Set in {@link #start()}. */
  private ByteOrder byteOrder;
  /** Set to true if the byte order of the file is not the native byte order. */
  private boolean swapBytes;
  /** The offset of the first image file directory. */
  private long firstDirectoryOffset;
  /** The metadata from the last parsed directory. */
  private FrameMetadata metadata;

  /**
   * Create a new instance.
   *
   * @param channel the channel (owned by the caller)
   */
  public TiffDecoder(SeekableByteChannel channel) {
    this.channel = ValidationUtils.checkNotNull(channel, "channel");
  }

  /**
   * Read the header. This identifies the byte order of the file and the offset of the first image
   * file directory.
   *
   * @throws ImageFormatException if the byte order marker or check constant are not recognised
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public void start() throws IOException {
    seek(0);
    scratch.clear();
    scratch.limit(2);
    readFully(scratch);
    final byte b0 = scratch.get(0);
    final byte b1 = scratch.get(1);
    if (b0 == LITTLE_ENDIAN_MARKER && b1 == LITTLE_ENDIAN_MARKER) {
      byteOrder = ByteOrder.LITTLE_ENDIAN;
    } else if (b0 == BIG_ENDIAN_MARKER && b1 == BIG_ENDIAN_MARKER) {
      byteOrder = ByteOrder.BIG_ENDIAN;
    } else {
      throw new ImageFormatException(Kind.FORMAT,
          String.format("Unrecognised byte order marker: 0x%02x%02x", b0, b1));
    }
    swapBytes = byteOrder != ByteOrder.nativeOrder();

    final int check = read16();
    if (check != MAGIC_NUMBER) {
      throw new ImageFormatException(Kind.FORMAT, "Bad check constant: " + check);
    }
    firstDirectoryOffset = read32();
    logger.fine(() -> String.format("[%s]:%d, IFD at %d", byteOrder, check, firstDirectoryOffset));
  }

  /**
   * Parse the image file directory at the given offset. The metadata is available using
   * {@link #getMetadata()}.
   *
   * <p>Unrecognised tags are logged and ignored.
   *
   * @param offset the offset of the directory (use zero for the first directory)
   * @return the offset of the next directory (zero if there are no more)
   * @throws ImageFormatException if an entry has the wrong type for its tag
   * @throws IOException Signals that an I/O exception has occurred.
   * @throws IllegalStateException if the header has not been read
   */
  public long parseDirectory(long offset) throws IOException {
    checkStarted();
    seek(offset == 0 ? firstDirectoryOffset : offset);
    final int count = read16();
    logger.fine(() -> "# directory entries = " + count);
    final DirectoryEntry[] entries = new DirectoryEntry[count];
    for (int i = 0; i < count; i++) {
      entries[i] = readEntry();
    }
    final long next = read32();

    final FrameMetadata frameMetadata = new FrameMetadata();
    for (final DirectoryEntry entry : entries) {
      process(entry, frameMetadata);
    }
    metadata = frameMetadata;
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("%s, next IFD: %d", frameMetadata, next));
    }
    return next;
  }

  /**
   * Process the entry and store the value in the metadata.
   *
   * @param entry the entry
   * @param frameMetadata the frame metadata
   * @throws IOException Signals that an I/O exception has occurred.
   */
  private void process(DirectoryEntry entry, FrameMetadata frameMetadata) throws IOException {
    final TiffTag tag = TiffTag.forCode(entry.getTag());
    switch (tag) {
      case IMAGE_WIDTH:
        frameMetadata.setImageWidth(getScalar(entry));
        break;
      case IMAGE_LENGTH:
        frameMetadata.setImageLength(getScalar(entry));
        break;
      case BITS_PER_SAMPLE:
        frameMetadata.setBitsPerSample(getShorts(entry));
        break;
      case COMPRESSION:
        frameMetadata.setCompression((int) getScalar(entry));
        break;
      case PHOTOMETRIC_INTERPRETATION:
        frameMetadata.setPhotometric((int) getScalar(entry));
        break;
      case FILL_ORDER:
        frameMetadata.setFillOrder((int) getScalar(entry));
        break;
      case IMAGE_DESCRIPTION:
        frameMetadata.setImageDescription(getString(entry));
        break;
      case STRIP_OFFSETS:
        frameMetadata.setStripOffsets(getUnsignedIntegers(entry));
        break;
      case ORIENTATION:
        frameMetadata.setOrientation((int) getScalar(entry));
        break;
      case SAMPLES_PER_PIXEL:
        frameMetadata.setSamplesPerPixel(getScalar(entry));
        break;
      case ROWS_PER_STRIP:
        frameMetadata.setRowsPerStrip(getScalar(entry));
        break;
      case STRIP_BYTE_COUNTS:
        frameMetadata.setStripByteCounts(getUnsignedIntegers(entry));
        break;
      case X_RESOLUTION:
        frameMetadata.setXResolution(getRational(entry));
        break;
      case Y_RESOLUTION:
        frameMetadata.setYResolution(getRational(entry));
        break;
      case PLANAR_CONFIGURATION:
        frameMetadata.setPlanarConfiguration((int) getScalar(entry));
        break;
      case RESOLUTION_UNIT:
        frameMetadata.setResolutionUnit((int) getScalar(entry));
        break;
      case SOFTWARE:
        frameMetadata.setSoftware(getString(entry));
        break;
      case SAMPLE_FORMAT:
        frameMetadata.setSampleFormats(getShorts(entry));
        break;
      case IMAGE_ID:
        frameMetadata.setImageId(getString(entry));
        break;
      case UNRECOGNISED:
        logger.info(() -> "Unprocessed tag: " + entry.getTag());
        break;
    }
  }

  /**
   * Read the pixels of the image described by the last parsed directory.
   *
   * @return the pixels (unsigned 16-bit samples)
   * @throws ImageFormatException if the sample layout is not supported or the strips do not match
   *         the image size
   * @throws IOException Signals that an I/O exception has occurred.
   * @throws IllegalStateException if no directory has been parsed
   */
  public short[] readPixels() throws IOException {
    final FrameMetadata frameMetadata = checkMetadata();
    final int[] bits = frameMetadata.getBitsPerSample();
    if (frameMetadata.getSamplesPerPixel() != 1 || bits.length == 0
        || bits[0] != BITS_PER_SAMPLE) {
      throw new ImageFormatException(Kind.UNSUPPORTED_FORMAT,
          String.format("Unprocessed samples per pixel (%d) or bits per sample %s",
              frameMetadata.getSamplesPerPixel(), Arrays.toString(bits)));
    }
    final int compression = frameMetadata.getCompressionCode();
    if (compression != 0 && compression != FrameMetadata.Compression.NONE.getCode()) {
      throw new ImageFormatException(Kind.UNSUPPORTED_FORMAT,
          "Unprocessed compression: " + compression);
    }
    if (frameMetadata.getImageWidth() == 0 || frameMetadata.getImageLength() == 0) {
      throw new ImageFormatException(Kind.FORMAT, "Missing image dimensions");
    }
    final long size = frameMetadata.getImageWidth() * frameMetadata.getImageLength()
        * BYTES_PER_SAMPLE;
    if (size > MAX_ARRAY_SIZE) {
      throw new ImageFormatException(Kind.UNSUPPORTED_FORMAT, "Image too large: " + size);
    }

    final long[] offsets = frameMetadata.getStripOffsets();
    final long[] counts = frameMetadata.getStripByteCounts();
    final long strips = frameMetadata.getExpectedStripCount();
    if (strips != offsets.length) {
      throw new ImageFormatException(Kind.SIZE_MISMATCH,
          String.format("Mismatch number of strip offsets: %d != %d", offsets.length, strips));
    }
    if (counts.length != offsets.length) {
      throw new ImageFormatException(Kind.SIZE_MISMATCH, String
          .format("Mismatch number of strip byte counts: %d != %d", counts.length, strips));
    }

    final byte[] bytes = new byte[(int) size];
    final ByteBuffer buffer = ByteBuffer.wrap(bytes);
    long total = 0;
    for (int i = 0; i < offsets.length; i++) {
      final long end = total + counts[i];
      if (end > size) {
        throw new ImageFormatException(Kind.SIZE_MISMATCH,
            String.format("Image byte size mismatch: strip %d ends at %d > %d", i, end, size));
      }
      buffer.limit((int) end);
      buffer.position((int) total);
      seek(offsets[i]);
      try {
        readFully(buffer);
      } catch (final EOFException ex) {
        throw new ImageFormatException(Kind.SIZE_MISMATCH, "Truncated strip " + i, ex);
      }
      total = end;
    }
    if (total != size) {
      throw new ImageFormatException(Kind.SIZE_MISMATCH,
          String.format("Image byte size mismatch: %d != %d", total, size));
    }

    final short[] pixels = new short[bytes.length / BYTES_PER_SAMPLE];
    ByteBuffer.wrap(bytes).order(ByteOrder.nativeOrder()).asShortBuffer().get(pixels);
    if (swapBytes) {
      for (int i = 0; i < pixels.length; i++) {
        pixels[i] = Short.reverseBytes(pixels[i]);
      }
    }
    return pixels;
  }

  /**
   * Read the frame described by the last parsed directory.
   *
   * @param index the frame index
   * @return the frame
   * @throws IOException Signals that an I/O exception has occurred.
   * @see #readPixels()
   */
  public Frame readFrame(int index) throws IOException {
    final short[] pixels = readPixels();
    return new Frame(index, (int) metadata.getImageWidth(), (int) metadata.getImageLength(),
        pixels);
  }

  /**
   * Gets the byte order of the file.
   *
   * @return the byte order (null before {@link #start()})
   */
  public ByteOrder getByteOrder() {
    return byteOrder;
  }

  /**
   * Checks if bytes must be swapped to convert the file byte order to the native byte order.
   *
   * @return true if swapping bytes
   */
  public boolean isSwapBytes() {
    return swapBytes;
  }

  /**
   * Gets the offset of the first image file directory.
   *
   * @return the first directory offset
   */
  public long getFirstDirectoryOffset() {
    return firstDirectoryOffset;
  }

  /**
   * Gets the metadata from the last parsed directory.
   *
   * @return the metadata (null before {@link #parseDirectory(long)})
   */
  public FrameMetadata getMetadata() {
    return metadata;
  }

  private void checkStarted() {
    if (byteOrder == null) {
      throw new IllegalStateException("Header has not been read");
    }
  }

  private FrameMetadata checkMetadata() {
    if (metadata == null) {
      throw new IllegalStateException("No directory has been parsed");
    }
    return metadata;
  }

  // Primitive readers. These convert from the file byte order.

  private void seek(long position) throws IOException {
    channel.position(position);
  }

  private void readFully(ByteBuffer buffer) throws IOException {
    while (buffer.hasRemaining()) {
      if (channel.read(buffer) < 0) {
        throw new EOFException("Unexpected end of stream at position " + channel.position());
      }
    }
  }

  private int read16() throws IOException {
    scratch.clear();
    scratch.limit(2);
    readFully(scratch);
    short value = scratch.getShort(0);
    if (swapBytes) {
      value = Short.reverseBytes(value);
    }
    return value & 0xffff;
  }

  private int readRaw32() throws IOException {
    scratch.clear();
    readFully(scratch);
    int value = scratch.getInt(0);
    if (swapBytes) {
      value = Integer.reverseBytes(value);
    }
    return value;
  }

  private long read32() throws IOException {
    return Integer.toUnsignedLong(readRaw32());
  }

  private DirectoryEntry readEntry() throws IOException {
    final int tag = read16();
    final int type = read16();
    final long count = read32();
    final int value = readRaw32();
    return new DirectoryEntry(tag, type, count, value);
  }

  // Entry value conversions

  /**
   * Get the first 16-bit value stored inline in the entry value field.
   *
   * @param entry the entry
   * @return the value
   */
  private int first16(DirectoryEntry entry) {
    final int value = entry.getValue();
    return byteOrder == ByteOrder.LITTLE_ENDIAN ? value & 0xffff : value >>> 16;
  }

  /**
   * Get the second 16-bit value stored inline in the entry value field.
   *
   * @param entry the entry
   * @return the value
   */
  private int second16(DirectoryEntry entry) {
    final int value = entry.getValue();
    return byteOrder == ByteOrder.LITTLE_ENDIAN ? value >>> 16 : value & 0xffff;
  }

  private static void checkType(DirectoryEntry entry, int type) throws ImageFormatException {
    if (entry.getType() != type) {
      throw new ImageFormatException(Kind.FORMAT, String.format(
          "Entry type error: tag %d has type %d (expected %d)", entry.getTag(), entry.getType(),
          type));
    }
  }

  private static int checkCount(DirectoryEntry entry) throws ImageFormatException {
    if (entry.getCount() > MAX_ARRAY_SIZE) {
      throw new ImageFormatException(Kind.FORMAT,
          String.format("Entry count too large: tag %d count %d", entry.getTag(),
              entry.getCount()));
    }
    return (int) entry.getCount();
  }

  /**
   * Gets a single unsigned integer from an entry with a 32-bit or 16-bit type.
   *
   * @param entry the entry
   * @return the value
   * @throws ImageFormatException if the type is not 32-bit or 16-bit
   */
  private long getScalar(DirectoryEntry entry) throws ImageFormatException {
    if (entry.getType() == DirectoryEntry.TYPE_LONG) {
      return entry.getOffset();
    }
    checkType(entry, DirectoryEntry.TYPE_SHORT);
    return first16(entry);
  }

  private int[] getShorts(DirectoryEntry entry) throws IOException {
    checkType(entry, DirectoryEntry.TYPE_SHORT);
    final int count = checkCount(entry);
    final int[] values = new int[count];
    if (count <= 2) {
      if (count != 0) {
        values[0] = first16(entry);
      }
      if (count == 2) {
        values[1] = second16(entry);
      }
    } else {
      seek(entry.getOffset());
      for (int i = 0; i < count; i++) {
        values[i] = read16();
      }
    }
    return values;
  }

  /**
   * Gets the unsigned integers from an entry with a 32-bit or 16-bit type.
   *
   * @param entry the entry
   * @return the values
   * @throws IOException Signals that an I/O exception has occurred.
   */
  private long[] getUnsignedIntegers(DirectoryEntry entry) throws IOException {
    if (entry.getType() == DirectoryEntry.TYPE_SHORT) {
      return Arrays.stream(getShorts(entry)).asLongStream().toArray();
    }
    checkType(entry, DirectoryEntry.TYPE_LONG);
    final int count = checkCount(entry);
    final long[] values = new long[count];
    if (count == 1) {
      values[0] = entry.getOffset();
    } else if (count > 1) {
      seek(entry.getOffset());
      for (int i = 0; i < count; i++) {
        values[i] = read32();
      }
    }
    return values;
  }

  private long[] getRational(DirectoryEntry entry) throws IOException {
    checkType(entry, DirectoryEntry.TYPE_RATIONAL);
    seek(entry.getOffset());
    final long numerator = read32();
    final long denominator = read32();
    return new long[] {numerator, denominator};
  }

  private String getString(DirectoryEntry entry) throws IOException {
    checkType(entry, DirectoryEntry.TYPE_ASCII);
    final int count = checkCount(entry);
    if (count == 0) {
      return "";
    }
    final byte[] bytes;
    if (count <= 4) {
      // Stored inline in the file byte order
      bytes = Arrays.copyOf(
          ByteBuffer.allocate(4).order(byteOrder).putInt(entry.getValue()).array(), count);
    } else {
      bytes = new byte[count];
      seek(entry.getOffset());
      readFully(ByteBuffer.wrap(bytes));
    }
    int length = count;
    if (bytes[length - 1] != 0) {
      logger.warning(() -> "String does not end with '\\0': tag " + entry.getTag());
    } else {
      while (length > 0 && bytes[length - 1] == 0) {
        length--;
      }
    }
    return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
  }
}
