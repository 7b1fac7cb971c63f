/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import org.signal.ctlog.tls.CtConstants;
import org.signal.ctlog.tls.TlsSerialization;

/**
 * A leaf of a log's Merkle tree (RFC 6962 section 3.4). The hash of a leaf, and the signature in an SCT, are defined
 * over the entry as timestamped by the log, so callers normally build a leaf from a certificate and let
 * {@link LogInfo} substitute the timestamp of the SCT before hashing or verifying.
 *
 * @param version          the leaf version; only {@link CtConstants#VERSION_V1} is defined
 * @param timestampedEntry the entry this leaf commits to
 */
public record MerkleTreeLeaf(int version, TimestampedEntry timestampedEntry) {

  public MerkleTreeLeaf {
    Objects.requireNonNull(timestampedEntry, "timestampedEntry");
  }

  /**
   * Creates a leaf for a final certificate. The timestamp is left at zero.
   *
   * @param certificate the DER encoding of the certificate
   */
  public static MerkleTreeLeaf forCertificate(final byte[] certificate) {
    return new MerkleTreeLeaf(CtConstants.VERSION_V1,
        new TimestampedEntry(0, LogEntryType.X509_ENTRY, certificate, null, new byte[0]));
  }

  /**
   * Creates a leaf for a pre-certificate. The timestamp is left at zero.
   *
   * @param tbsCertificate the DER encoding of the pre-certificate's TBSCertificate, with the poison extension removed
   * @param issuerKeyHash  the SHA-256 hash of the issuing CA's DER-encoded public key
   */
  public static MerkleTreeLeaf forPrecertificate(final byte[] tbsCertificate, final byte[] issuerKeyHash) {
    return new MerkleTreeLeaf(CtConstants.VERSION_V1,
        new TimestampedEntry(0, LogEntryType.PRECERT_ENTRY, tbsCertificate, issuerKeyHash, new byte[0]));
  }

  /**
   * @return a copy of this leaf whose entry carries the given timestamp; this leaf is not modified
   */
  public MerkleTreeLeaf withTimestamp(final long timestamp) {
    return new MerkleTreeLeaf(version, timestampedEntry.withTimestamp(timestamp));
  }

  public byte[] encode() throws EncodingException {
    final ByteArrayOutputStream output = new ByteArrayOutputStream();
    TlsSerialization.writeNumber(output, version, CtConstants.VERSION_LENGTH);
    TlsSerialization.writeNumber(output, CtConstants.LEAF_TYPE_TIMESTAMPED_ENTRY, CtConstants.LEAF_TYPE_LENGTH);
    timestampedEntry.encode(output);
    return output.toByteArray();
  }
}
