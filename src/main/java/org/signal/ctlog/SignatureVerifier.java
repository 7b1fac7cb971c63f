/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.List;

/**
 * Verifies signatures made by a single log over SCTs and tree heads. Logs sign with either ECDSA or RSA, always over a
 * SHA-256 digest.
 */
public class SignatureVerifier {

  private static final int MINIMUM_RSA_KEY_BITS = 2048;
  private static final List<String> SUPPORTED_KEY_ALGORITHMS = List.of("EC", "RSA");

  private final PublicKey publicKey;
  private final DigitallySigned.SignatureAlgorithm signatureAlgorithm;
  private final String jcaSignatureAlgorithm;

  private SignatureVerifier(final PublicKey publicKey, final DigitallySigned.SignatureAlgorithm signatureAlgorithm,
      final String jcaSignatureAlgorithm) throws LogConfigException {
    this.publicKey = publicKey;
    this.signatureAlgorithm = signatureAlgorithm;
    this.jcaSignatureAlgorithm = jcaSignatureAlgorithm;

    // Check that the algorithm is supported and that the key is usable with it
    try {
      Signature.getInstance(jcaSignatureAlgorithm).initVerify(publicKey);
    } catch (final NoSuchAlgorithmException | InvalidKeyException e) {
      throw new LogConfigException("Public key cannot be used with " + jcaSignatureAlgorithm, e);
    }
  }

  /**
   * Builds a verifier for the given log key.
   *
   * @throws LogConfigException if the key is neither an EC key nor an RSA key of at least 2048 bits
   */
  public static SignatureVerifier forPublicKey(final PublicKey publicKey) throws LogConfigException {
    if (publicKey instanceof ECPublicKey) {
      return new SignatureVerifier(publicKey, DigitallySigned.SignatureAlgorithm.ECDSA, "SHA256withECDSA");
    } else if (publicKey instanceof RSAPublicKey rsaPublicKey) {
      if (rsaPublicKey.getModulus().bitLength() < MINIMUM_RSA_KEY_BITS) {
        throw new LogConfigException(String.format("RSA key of %d bits is smaller than the required %d bits",
            rsaPublicKey.getModulus().bitLength(), MINIMUM_RSA_KEY_BITS));
      }
      return new SignatureVerifier(publicKey, DigitallySigned.SignatureAlgorithm.RSA, "SHA256withRSA");
    }

    throw new LogConfigException("Unsupported public key type " + publicKey.getAlgorithm());
  }

  /**
   * Parses a DER-encoded SubjectPublicKeyInfo holding an EC or RSA key.
   *
   * @throws LogConfigException if the bytes are not a supported public key
   */
  public static PublicKey parsePublicKey(final byte[] derPublicKey) throws LogConfigException {
    final X509EncodedKeySpec keySpec = new X509EncodedKeySpec(derPublicKey);
    InvalidKeySpecException lastException = null;

    for (final String keyAlgorithm : SUPPORTED_KEY_ALGORITHMS) {
      try {
        return KeyFactory.getInstance(keyAlgorithm).generatePublic(keySpec);
      } catch (final InvalidKeySpecException e) {
        lastException = e;
      } catch (final NoSuchAlgorithmException e) {
        throw new AssertionError("Every implementation of the Java platform is required to support " + keyAlgorithm,
            e);
      }
    }

    throw new LogConfigException("Failed to parse public key", lastException);
  }

  public PublicKey getPublicKey() {
    return publicKey;
  }

  /**
   * Verifies the log's signature in {@code sct} over the given leaf. The leaf's timestamp is not consulted; the SCT's
   * own timestamp is part of the signed data.
   *
   * @throws InvalidSignatureException if the signature does not verify
   * @throws EncodingException         if the leaf cannot be encoded
   */
  public void verifySctSignature(final SignedCertificateTimestamp sct, final MerkleTreeLeaf leaf)
      throws InvalidSignatureException, EncodingException {
    verifySignature(sct.encodeSignatureInput(leaf), sct.signature());
  }

  /**
   * Verifies the log's signature over a tree head.
   *
   * @throws InvalidSignatureException if the signature does not verify
   * @throws EncodingException         if the tree head cannot be encoded
   */
  public void verifySthSignature(final SignedTreeHead sth) throws InvalidSignatureException, EncodingException {
    verifySignature(sth.encodeSignatureInput(), sth.treeHeadSignature());
  }

  /**
   * Verifies a signature made by this log's key over arbitrary data.
   *
   * @throws InvalidSignatureException if the algorithms do not match this log's key, the signature is malformed, or
   *                                   the signature does not verify
   */
  public void verifySignature(final byte[] data, final DigitallySigned digitallySigned)
      throws InvalidSignatureException {
    if (digitallySigned.hashAlgorithm() != DigitallySigned.HashAlgorithm.SHA256) {
      throw new InvalidSignatureException("Unsupported hash algorithm " + digitallySigned.hashAlgorithm());
    }
    if (digitallySigned.signatureAlgorithm() != signatureAlgorithm) {
      throw new InvalidSignatureException(String.format("Signature algorithm %s does not match %s key",
          digitallySigned.signatureAlgorithm(), signatureAlgorithm));
    }

    final boolean verified;
    try {
      final Signature signature = Signature.getInstance(jcaSignatureAlgorithm);
      signature.initVerify(publicKey);
      signature.update(data);
      verified = signature.verify(digitallySigned.signature());
    } catch (final SignatureException e) {
      throw new InvalidSignatureException("Malformed signature", e);
    } catch (final NoSuchAlgorithmException | InvalidKeyException e) {
      // We checked for algorithm support and key validity at construction time
      throw new AssertionError(e);
    }

    if (!verified) {
      throw new InvalidSignatureException("Signature did not match");
    }
  }
}
