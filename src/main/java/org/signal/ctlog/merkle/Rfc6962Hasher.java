/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.merkle;

import java.security.MessageDigest;
import org.signal.ctlog.util.Sha256;

/**
 * The SHA-256 based Merkle tree hashing scheme of RFC 6962 section 2.1. Leaf and interior node hashes are domain
 * separated by a one-byte prefix so that a leaf can never be confused with an interior node.
 */
public class Rfc6962Hasher {

  static final byte LEAF_HASH_PREFIX = 0x00;
  static final byte NODE_HASH_PREFIX = 0x01;

  public static final int HASH_SIZE = 32;

  private Rfc6962Hasher() {
  }

  /**
   * @return the root hash of a tree with no leaves
   */
  public static byte[] emptyRoot() {
    return Sha256.newMessageDigest().digest();
  }

  public static byte[] hashLeaf(final byte[] leaf) {
    final MessageDigest messageDigest = Sha256.newMessageDigest();
    messageDigest.update(LEAF_HASH_PREFIX);
    messageDigest.update(leaf);
    return messageDigest.digest();
  }

  public static byte[] hashChildren(final byte[] left, final byte[] right) {
    final MessageDigest messageDigest = Sha256.newMessageDigest();
    messageDigest.update(NODE_HASH_PREFIX);
    messageDigest.update(left);
    messageDigest.update(right);
    return messageDigest.digest();
  }
}
