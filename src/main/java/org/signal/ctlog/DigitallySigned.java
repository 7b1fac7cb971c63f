/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.HexFormat;
import org.signal.ctlog.tls.CtConstants;
import org.signal.ctlog.tls.TlsSerialization;

/**
 * A signature together with the algorithms used to produce it, as defined by RFC 5246 section 4.7.
 *
 * @param hashAlgorithm      the hash algorithm applied to the signed data
 * @param signatureAlgorithm the signature algorithm; must match the type of the log's key
 * @param signature          the raw signature bytes (DER-encoded for ECDSA)
 */
public record DigitallySigned(HashAlgorithm hashAlgorithm,
                              SignatureAlgorithm signatureAlgorithm,
                              byte[] signature) {

  public enum HashAlgorithm {
    NONE(0),
    MD5(1),
    SHA1(2),
    SHA224(3),
    SHA256(4),
    SHA384(5),
    SHA512(6);

    private final int value;

    HashAlgorithm(final int value) {
      this.value = value;
    }

    public int value() {
      return value;
    }

    static HashAlgorithm fromValue(final int value) throws EncodingException {
      for (final HashAlgorithm algorithm : values()) {
        if (algorithm.value == value) {
          return algorithm;
        }
      }
      throw new EncodingException("Unknown hash algorithm " + value);
    }
  }

  public enum SignatureAlgorithm {
    ANONYMOUS(0),
    RSA(1),
    DSA(2),
    ECDSA(3);

    private final int value;

    SignatureAlgorithm(final int value) {
      this.value = value;
    }

    public int value() {
      return value;
    }

    static SignatureAlgorithm fromValue(final int value) throws EncodingException {
      for (final SignatureAlgorithm algorithm : values()) {
        if (algorithm.value == value) {
          return algorithm;
        }
      }
      throw new EncodingException("Unknown signature algorithm " + value);
    }
  }

  /**
   * Decodes the TLS encoding of a {@code DigitallySigned} structure, requiring that no bytes follow it.
   */
  public static DigitallySigned decode(final byte[] encoded) throws EncodingException {
    final ByteArrayInputStream input = new ByteArrayInputStream(encoded);
    final DigitallySigned digitallySigned = new DigitallySigned(
        HashAlgorithm.fromValue((int) TlsSerialization.readNumber(input, CtConstants.HASH_ALGORITHM_LENGTH)),
        SignatureAlgorithm.fromValue(
            (int) TlsSerialization.readNumber(input, CtConstants.SIGNATURE_ALGORITHM_LENGTH)),
        TlsSerialization.readVariableBytes(input, CtConstants.SIGNATURE_LENGTH_BYTES));
    TlsSerialization.requireFullyConsumed(input);
    return digitallySigned;
  }

  public byte[] encode() throws EncodingException {
    final ByteArrayOutputStream output = new ByteArrayOutputStream();
    TlsSerialization.writeNumber(output, hashAlgorithm.value(), CtConstants.HASH_ALGORITHM_LENGTH);
    TlsSerialization.writeNumber(output, signatureAlgorithm.value(), CtConstants.SIGNATURE_ALGORITHM_LENGTH);
    TlsSerialization.writeVariableBytes(output, signature, CtConstants.SIGNATURE_LENGTH_BYTES);
    return output.toByteArray();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DigitallySigned that)) {
      return false;
    }
    return hashAlgorithm == that.hashAlgorithm
        && signatureAlgorithm == that.signatureAlgorithm
        && Arrays.equals(signature, that.signature);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * hashAlgorithm.hashCode() + signatureAlgorithm.hashCode()) + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "DigitallySigned{" +
        "hashAlgorithm=" + hashAlgorithm +
        ", signatureAlgorithm=" + signatureAlgorithm +
        ", signature=" + HexFormat.of().formatHex(signature) +
        "}";
  }
}
