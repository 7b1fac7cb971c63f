/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.util;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import org.signal.ctlog.DigitallySigned;
import org.signal.ctlog.EncodingException;
import org.signal.ctlog.MerkleTreeLeaf;
import org.signal.ctlog.SignedCertificateTimestamp;
import org.signal.ctlog.SignedTreeHead;
import org.signal.ctlog.tls.CtConstants;

/**
 * Generates log keys and produces SCTs and tree heads signed by them.
 */
public class TestLogKeys {

  /**
   * P-256 public keys, base64-encoded DER SubjectPublicKeyInfo, with no use outside of tests.
   */
  public static final String BASE_64_EC_PUBLIC_KEY =
      "MFkwEwYHKoZIzj0CAQYIKoZIzj0DAQcDQgAEkDsiOTmzkyum41tV0FAItHhj+CsbG6Nh5KZF2YPPwaohpsn6sp9aRKclj+7GtaoLX6iWFLwz6berOQ2IymoEDw==";

  public static final String BASE_64_SECOND_EC_PUBLIC_KEY =
      "MFkwEwYHKoZIzj0CAQYIKoZIzj0DAQcDQgAEmW4sk1699PglDr9BC061phrD3lgRnz+/17/m4j3eKUP7JMucaeuTh6UeHqdkhQijpxLD2rXMy7+gAljTPyth1w==";

  public static KeyPair generateEcKeyPair() {
    try {
      final KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance("EC");
      keyPairGenerator.initialize(new ECGenParameterSpec("secp256r1"));
      return keyPairGenerator.generateKeyPair();
    } catch (final GeneralSecurityException e) {
      throw new AssertionError(e);
    }
  }

  public static KeyPair generateRsaKeyPair(final int bits) {
    try {
      final KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance("RSA");
      keyPairGenerator.initialize(bits);
      return keyPairGenerator.generateKeyPair();
    } catch (final GeneralSecurityException e) {
      throw new AssertionError(e);
    }
  }

  public static DigitallySigned sign(final KeyPair keyPair, final byte[] data) {
    final boolean ec = "EC".equals(keyPair.getPrivate().getAlgorithm());
    try {
      final Signature signature = Signature.getInstance(ec ? "SHA256withECDSA" : "SHA256withRSA");
      signature.initSign(keyPair.getPrivate());
      signature.update(data);
      return new DigitallySigned(DigitallySigned.HashAlgorithm.SHA256,
          ec ? DigitallySigned.SignatureAlgorithm.ECDSA : DigitallySigned.SignatureAlgorithm.RSA,
          signature.sign());
    } catch (final GeneralSecurityException e) {
      throw new AssertionError(e);
    }
  }

  public static SignedCertificateTimestamp signSct(final KeyPair keyPair, final MerkleTreeLeaf leaf,
      final long timestamp) throws EncodingException {

    final byte[] logId = Sha256.hash(keyPair.getPublic().getEncoded());
    final SignedCertificateTimestamp unsigned = new SignedCertificateTimestamp(CtConstants.VERSION_V1, logId,
        timestamp, new byte[0], new DigitallySigned(DigitallySigned.HashAlgorithm.SHA256,
        DigitallySigned.SignatureAlgorithm.ECDSA, new byte[0]));

    return new SignedCertificateTimestamp(CtConstants.VERSION_V1, logId, timestamp, new byte[0],
        sign(keyPair, unsigned.encodeSignatureInput(leaf)));
  }

  public static SignedTreeHead signSth(final KeyPair keyPair, final long treeSize, final long timestamp,
      final byte[] rootHash) throws EncodingException {

    final SignedTreeHead unsigned = new SignedTreeHead(CtConstants.VERSION_V1, treeSize, timestamp, rootHash,
        new DigitallySigned(DigitallySigned.HashAlgorithm.SHA256, DigitallySigned.SignatureAlgorithm.ECDSA,
            new byte[0]));

    return new SignedTreeHead(CtConstants.VERSION_V1, treeSize, timestamp, rootHash,
        sign(keyPair, unsigned.encodeSignatureInput()));
  }
}
