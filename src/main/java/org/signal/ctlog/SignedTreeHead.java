/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import org.signal.ctlog.tls.CtConstants;
import org.signal.ctlog.tls.TlsSerialization;

/**
 * A log's signed snapshot of its Merkle tree (RFC 6962 section 3.5).
 *
 * @param version           the tree head version; only {@link CtConstants#VERSION_V1} is defined
 * @param treeSize          the number of leaves in the tree
 * @param timestamp         milliseconds since the Unix epoch at which the tree head was produced
 * @param sha256RootHash    the root hash of the tree
 * @param treeHeadSignature the log's signature over the other fields
 */
public record SignedTreeHead(int version,
                             long treeSize,
                             long timestamp,
                             byte[] sha256RootHash,
                             DigitallySigned treeHeadSignature) {

  public SignedTreeHead {
    if (treeSize < 0) {
      throw new IllegalArgumentException("Tree size must be non-negative");
    }
    Objects.requireNonNull(sha256RootHash, "sha256RootHash");
    Objects.requireNonNull(treeHeadSignature, "treeHeadSignature");
  }

  /**
   * Encodes the data covered by {@link #treeHeadSignature()}.
   */
  public byte[] encodeSignatureInput() throws EncodingException {
    if (sha256RootHash.length != CtConstants.SHA256_HASH_LENGTH) {
      throw new EncodingException("Root hash must be " + CtConstants.SHA256_HASH_LENGTH + " bytes");
    }
    final ByteArrayOutputStream output = new ByteArrayOutputStream();
    TlsSerialization.writeNumber(output, version, CtConstants.VERSION_LENGTH);
    TlsSerialization.writeNumber(output, CtConstants.SIGNATURE_TYPE_TREE_HASH, CtConstants.SIGNATURE_TYPE_LENGTH);
    TlsSerialization.writeNumber(output, timestamp, CtConstants.TIMESTAMP_LENGTH);
    TlsSerialization.writeNumber(output, treeSize, CtConstants.TREE_SIZE_LENGTH);
    TlsSerialization.writeFixedBytes(output, sha256RootHash);
    return output.toByteArray();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SignedTreeHead that)) {
      return false;
    }
    return version == that.version
        && treeSize == that.treeSize
        && timestamp == that.timestamp
        && Arrays.equals(sha256RootHash, that.sha256RootHash)
        && treeHeadSignature.equals(that.treeHeadSignature);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(version, treeSize, timestamp, treeHeadSignature);
    result = 31 * result + Arrays.hashCode(sha256RootHash);
    return result;
  }

  @Override
  public String toString() {
    return "SignedTreeHead{" +
        "version=" + version +
        ", treeSize=" + treeSize +
        ", timestamp=" + timestamp +
        ", sha256RootHash=" + HexFormat.of().formatHex(sha256RootHash) +
        "}";
  }
}
