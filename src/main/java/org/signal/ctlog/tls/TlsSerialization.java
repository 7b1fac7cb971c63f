/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.tls;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import org.signal.ctlog.EncodingException;

/**
 * Reads and writes the big-endian, length-prefixed primitives of the TLS presentation language (RFC 5246 section 4)
 * used by Certificate Transparency structures.
 */
public class TlsSerialization {

  private TlsSerialization() {
  }

  /**
   * Writes {@code value} as an unsigned big-endian number of {@code width} bytes.
   *
   * @throws EncodingException if {@code value} does not fit in {@code width} bytes
   */
  public static void writeNumber(final OutputStream output, final long value, final int width)
      throws EncodingException {
    if (width < 1 || width > 8) {
      throw new IllegalArgumentException("Invalid width: " + width);
    }
    if (width < 8 && (value < 0 || value >= (1L << (width * 8)))) {
      throw new EncodingException("Value " + value + " does not fit in " + width + " bytes");
    }

    try {
      for (int shift = (width - 1) * 8; shift >= 0; shift -= 8) {
        output.write((int) (value >>> shift) & 0xff);
      }
    } catch (final IOException e) {
      throw new EncodingException("Failed to write number", e);
    }
  }

  /**
   * Writes an opaque vector prefixed with its length, the length itself taking {@code lengthWidth} bytes.
   *
   * @throws EncodingException if {@code data} is longer than a {@code lengthWidth}-byte prefix can describe
   */
  public static void writeVariableBytes(final OutputStream output, final byte[] data, final int lengthWidth)
      throws EncodingException {
    writeNumber(output, data.length, lengthWidth);
    writeFixedBytes(output, data);
  }

  public static void writeFixedBytes(final OutputStream output, final byte[] data) throws EncodingException {
    try {
      output.write(data);
    } catch (final IOException e) {
      throw new EncodingException("Failed to write " + data.length + " bytes", e);
    }
  }

  /**
   * Reads an unsigned big-endian number of up to 8 bytes. Numbers of 8 bytes with the top bit set are rejected since
   * they cannot be represented as a non-negative {@code long}.
   */
  public static long readNumber(final InputStream input, final int width) throws EncodingException {
    if (width < 1 || width > 8) {
      throw new IllegalArgumentException("Invalid width: " + width);
    }

    long result = 0;
    for (int i = 0; i < width; i++) {
      result = (result << 8) | readByte(input);
    }
    if (result < 0) {
      throw new EncodingException("Number does not fit in a signed 64-bit value");
    }
    return result;
  }

  public static byte[] readFixedBytes(final InputStream input, final int length) throws EncodingException {
    if (length < 0) {
      throw new EncodingException("Negative length: " + length);
    }
    try {
      final byte[] data = input.readNBytes(length);
      if (data.length < length) {
        throw new EncodingException(
            "Premature end of input, expected " + length + " bytes, only read " + data.length);
      }
      return data;
    } catch (final IOException e) {
      throw new EncodingException("Failed to read " + length + " bytes", e);
    }
  }

  public static byte[] readVariableBytes(final InputStream input, final int lengthWidth) throws EncodingException {
    return readFixedBytes(input, (int) readNumber(input, lengthWidth));
  }

  /**
   * @throws EncodingException if {@code input} has bytes left over after a structure was fully decoded
   */
  public static void requireFullyConsumed(final ByteArrayInputStream input) throws EncodingException {
    if (input.available() > 0) {
      throw new EncodingException(input.available() + " trailing bytes after structure");
    }
  }

  private static int readByte(final InputStream input) throws EncodingException {
    try {
      final int b = input.read();
      if (b == -1) {
        throw new EncodingException("Premature end of input");
      }
      return b;
    } catch (final IOException e) {
      throw new EncodingException("Failed to read from input", e);
    }
  }
}
