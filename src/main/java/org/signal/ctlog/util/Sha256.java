/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.util;

import com.google.common.hash.HashCode;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class Sha256 {

  private Sha256() {
  }

  /**
   * Infallibly returns a new {@code MessageDigest} instance that uses the SHA-256 algorithm. Every implementation of
   * the Java platform is required to support SHA-256.
   */
  public static MessageDigest newMessageDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support SHA-256", e);
    }
  }

  public static byte[] hash(final byte[] data) {
    return newMessageDigest().digest(data);
  }

  /**
   * Computes the identifier of a log, which is the SHA-256 hash of its DER-encoded public key.
   */
  public static HashCode keyHash(final byte[] derPublicKey) {
    return HashCode.fromBytes(hash(derPublicKey));
  }
}
