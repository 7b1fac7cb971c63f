/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.io.ByteArrayOutputStream;
import java.util.HexFormat;
import java.util.Objects;
import org.signal.ctlog.tls.CtConstants;
import org.signal.ctlog.tls.TlsSerialization;

/**
 * A log's signed promise to incorporate an entry into its tree within the maximum merge delay (RFC 6962 section 3.2).
 *
 * @param version    the SCT version; only {@link CtConstants#VERSION_V1} is defined
 * @param logId      the SHA-256 hash of the issuing log's DER-encoded public key
 * @param timestamp  milliseconds since the Unix epoch at which the log issued the SCT
 * @param extensions SCT extensions, usually empty
 * @param signature  the log's signature over the SCT and the entry it covers
 */
public record SignedCertificateTimestamp(int version,
                                         byte[] logId,
                                         long timestamp,
                                         byte[] extensions,
                                         DigitallySigned signature) {

  public SignedCertificateTimestamp {
    Objects.requireNonNull(logId, "logId");
    Objects.requireNonNull(extensions, "extensions");
    Objects.requireNonNull(signature, "signature");
  }

  /**
   * Encodes the data covered by this SCT's signature for the given leaf. The leaf's own timestamp is ignored in favor
   * of this SCT's timestamp.
   */
  public byte[] encodeSignatureInput(final MerkleTreeLeaf leaf) throws EncodingException {
    final ByteArrayOutputStream output = new ByteArrayOutputStream();
    TlsSerialization.writeNumber(output, version, CtConstants.VERSION_LENGTH);
    TlsSerialization.writeNumber(output, CtConstants.SIGNATURE_TYPE_CERTIFICATE_TIMESTAMP,
        CtConstants.SIGNATURE_TYPE_LENGTH);
    TlsSerialization.writeNumber(output, timestamp, CtConstants.TIMESTAMP_LENGTH);
    leaf.timestampedEntry().encodeSignedEntry(output);
    TlsSerialization.writeVariableBytes(output, extensions, CtConstants.EXTENSIONS_LENGTH_BYTES);
    return output.toByteArray();
  }

  @Override
  public String toString() {
    return "SignedCertificateTimestamp{" +
        "version=" + version +
        ", logId=" + HexFormat.of().formatHex(logId) +
        ", timestamp=" + timestamp +
        ", extensions=" + HexFormat.of().formatHex(extensions) +
        ", signature=" + signature +
        "}";
  }
}
