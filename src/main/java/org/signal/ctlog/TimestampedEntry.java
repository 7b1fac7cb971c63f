/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.io.OutputStream;
import java.util.HexFormat;
import java.util.Objects;
import javax.annotation.Nullable;
import org.signal.ctlog.tls.CtConstants;
import org.signal.ctlog.tls.TlsSerialization;

/**
 * The body of a Merkle tree leaf: a certificate (or pre-certificate) entry as timestamped by the log.
 *
 * @param timestamp     milliseconds since the Unix epoch at which the log accepted the entry
 * @param entryType     whether {@code signedEntry} is a certificate or a pre-certificate's TBSCertificate
 * @param signedEntry   the DER-encoded certificate for {@link LogEntryType#X509_ENTRY}, or the DER-encoded
 *                      TBSCertificate for {@link LogEntryType#PRECERT_ENTRY}
 * @param issuerKeyHash the SHA-256 hash of the issuer's public key; present only for pre-certificates
 * @param extensions    CT extensions of the entry, usually empty
 */
public record TimestampedEntry(long timestamp,
                               LogEntryType entryType,
                               byte[] signedEntry,
                               @Nullable byte[] issuerKeyHash,
                               byte[] extensions) {

  public TimestampedEntry {
    Objects.requireNonNull(entryType, "entryType");
    Objects.requireNonNull(signedEntry, "signedEntry");
    Objects.requireNonNull(extensions, "extensions");
  }

  /**
   * @return a copy of this entry that carries the given timestamp
   */
  public TimestampedEntry withTimestamp(final long newTimestamp) {
    return new TimestampedEntry(newTimestamp, entryType, signedEntry, issuerKeyHash, extensions);
  }

  /**
   * Writes the {@code entry_type} and {@code signed_entry} fields shared by the Merkle tree leaf and the input to an
   * SCT signature.
   */
  void encodeSignedEntry(final OutputStream output) throws EncodingException {
    TlsSerialization.writeNumber(output, entryType.value(), CtConstants.ENTRY_TYPE_LENGTH);
    switch (entryType) {
      case X509_ENTRY -> TlsSerialization.writeVariableBytes(output, signedEntry,
          CtConstants.CERTIFICATE_LENGTH_BYTES);
      case PRECERT_ENTRY -> {
        if (issuerKeyHash == null || issuerKeyHash.length != CtConstants.ISSUER_KEY_HASH_LENGTH) {
          throw new EncodingException("Pre-certificate entries require a "
              + CtConstants.ISSUER_KEY_HASH_LENGTH + "-byte issuer key hash");
        }
        TlsSerialization.writeFixedBytes(output, issuerKeyHash);
        TlsSerialization.writeVariableBytes(output, signedEntry, CtConstants.CERTIFICATE_LENGTH_BYTES);
      }
    }
  }

  void encode(final OutputStream output) throws EncodingException {
    TlsSerialization.writeNumber(output, timestamp, CtConstants.TIMESTAMP_LENGTH);
    encodeSignedEntry(output);
    TlsSerialization.writeVariableBytes(output, extensions, CtConstants.EXTENSIONS_LENGTH_BYTES);
  }

  @Override
  public String toString() {
    return "TimestampedEntry{" +
        "timestamp=" + timestamp +
        ", entryType=" + entryType +
        ", signedEntry=" + signedEntry.length + " bytes" +
        ", issuerKeyHash=" + (issuerKeyHash == null ? "null" : HexFormat.of().formatHex(issuerKeyHash)) +
        ", extensions=" + HexFormat.of().formatHex(extensions) +
        "}";
  }
}
