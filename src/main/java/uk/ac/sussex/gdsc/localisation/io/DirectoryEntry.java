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
 * A single 12-byte record of an image file directory.
 *
 * <p>The {@link #getType() type} determines how the {@link #getValue() value} is interpreted:
 * either inline data or an offset to the data.
 */
public final class DirectoryEntry {
  /** The size of an entry in bytes. */
  public static final int SIZE = 12;

  /** Type code for 8-bit bytes containing 7-bit ASCII codes terminated by NUL. */
  public static final int TYPE_ASCII = 2;
  /** Type code for a 16-bit unsigned integer. */
  public static final int TYPE_SHORT = 3;
  /** Type code for a 32-bit unsigned integer. */
  public static final int TYPE_LONG = 4;
  /** Type code for two 32-bit unsigned integers: the numerator and denominator of a fraction. */
  public static final int TYPE_RATIONAL = 5;

  private final int tag;
  private final int type;
  private final long count;
  private final int value;

  /**
   * Create a new instance.
   *
   * @param tag the tag code
   * @param type the type code
   * @param count the count (unsigned)
   * @param value the value or offset (raw 32-bit field in file byte order)
   */
  public DirectoryEntry(int tag, int type, long count, int value) {
    this.tag = tag;
    this.type = type;
    this.count = count;
    this.value = value;
  }

  /**
   * Gets the tag code.
   *
   * @return the tag
   */
  public int getTag() {
    return tag;
  }

  /**
   * Gets the type code.
   *
   * @return the type
   */
  public int getType() {
    return type;
  }

  /**
   * Gets the number of values.
   *
   * @return the count
   */
  public long getCount() {
    return count;
  }

  /**
   * Gets the raw value field.
   *
   * @return the value
   */
  public int getValue() {
    return value;
  }

  /**
   * Gets the value field as an unsigned offset.
   *
   * @return the offset
   */
  public long getOffset() {
    return Integer.toUnsignedLong(value);
  }

  @Override
  public String toString() {
    return String.format("tag=%d (0x%x), type=%d, count=%d, value=%d", tag, tag, type, count,
        getOffset());
  }
}
