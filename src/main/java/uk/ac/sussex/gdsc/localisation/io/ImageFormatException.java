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

import java.io.IOException;

/**
 * Signals that an image container could not be decoded.
 *
 * <p>The type of failure is identified by the {@link Kind}. The message is auxiliary detail.
 */
public class ImageFormatException extends IOException {
  private static final long serialVersionUID = 20221014L;

  /**
   * The kind of format failure.
   */
  public enum Kind {
    /** The container is not a recognised format (byte-order marker, check constant, entry type). */
    FORMAT("Format error"),
    /** The image sample layout is not supported. */
    UNSUPPORTED_FORMAT("Unsupported format"),
    /** The strip layout does not match the declared image geometry. */
    SIZE_MISMATCH("Size mismatch");

    private final String description;

    Kind(String description) {
      this.description = description;
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
  }

  /** The kind of failure. */
  private final Kind kind;

  /**
   * Create a new instance.
   *
   * @param kind the kind of failure
   * @param message the message
   */
  public ImageFormatException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Create a new instance.
   *
   * @param kind the kind of failure
   * @param message the message
   * @param cause the cause
   */
  public ImageFormatException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Gets the kind of failure.
   *
   * @return the kind
   */
  public Kind getKind() {
    return kind;
  }

  @Override
  public String getMessage() {
    return kind.getDescription() + ": " + super.getMessage();
  }
}
