/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.merkle;

import java.security.MessageDigest;
import java.util.List;
import org.signal.ctlog.InvalidProofException;

/**
 * Verifies Merkle inclusion proofs for append-only logs that use {@link Rfc6962Hasher}.
 */
public class MerkleLogVerifier {

  private MerkleLogVerifier() {
  }

  /**
   * Verifies that {@code leafHash} is the leaf at {@code leafIndex} of the tree of size {@code treeSize} whose root
   * is {@code rootHash}.
   *
   * @param leafIndex the 0-based index of the leaf
   * @param treeSize  the number of leaves in the tree
   * @param auditPath the sibling hashes from the leaf up to the root
   * @param rootHash  the expected root hash
   * @param leafHash  the leaf hash, i.e. the output of {@link Rfc6962Hasher#hashLeaf(byte[])}
   * @throws InvalidProofException if the proof does not recompute to {@code rootHash}
   */
  public static void verifyInclusionProof(final long leafIndex, final long treeSize, final List<byte[]> auditPath,
      final byte[] rootHash, final byte[] leafHash) throws InvalidProofException {

    if (rootHash.length != Rfc6962Hasher.HASH_SIZE) {
      throw new InvalidProofException("Root hash has unexpected length " + rootHash.length);
    }

    final byte[] calculatedRoot = rootFromInclusionProof(leafIndex, treeSize, auditPath, leafHash);
    if (!MessageDigest.isEqual(calculatedRoot, rootHash)) {
      throw new InvalidProofException(String.format(
          "Calculated root hash does not match expected root hash for leaf %d at tree size %d", leafIndex,
          treeSize));
    }
  }

  /**
   * Calculates the root hash implied by an inclusion proof, following the algorithm of RFC 9162 section 2.1.3.2.
   *
   * @throws InvalidProofException if the index is outside the tree, or the audit path has the wrong length for the
   *                               given position and tree size
   */
  public static byte[] rootFromInclusionProof(final long leafIndex, final long treeSize,
      final List<byte[]> auditPath, final byte[] leafHash) throws InvalidProofException {

    if (treeSize <= 0) {
      throw new InvalidProofException("Tree size must be positive, was " + treeSize);
    }
    if (leafIndex < 0 || leafIndex >= treeSize) {
      throw new InvalidProofException(
          String.format("Leaf index %d is outside a tree of size %d", leafIndex, treeSize));
    }
    if (leafHash.length != Rfc6962Hasher.HASH_SIZE) {
      throw new InvalidProofException("Leaf hash has unexpected length " + leafHash.length);
    }

    final int expectedPathLength = auditPathLength(leafIndex, treeSize);
    if (auditPath.size() != expectedPathLength) {
      throw new InvalidProofException(String.format(
          "Audit path for leaf %d at tree size %d must have %d entries, had %d", leafIndex, treeSize,
          expectedPathLength, auditPath.size()));
    }

    long fn = leafIndex;
    long sn = treeSize - 1;
    byte[] hash = leafHash;

    for (final byte[] sibling : auditPath) {
      if (sibling.length != Rfc6962Hasher.HASH_SIZE) {
        throw new InvalidProofException("Audit path entry has unexpected length " + sibling.length);
      }
      if (sn == 0) {
        throw new InvalidProofException("Audit path is longer than the tree is deep");
      }

      if ((fn & 1) == 1 || fn == sn) {
        hash = Rfc6962Hasher.hashChildren(sibling, hash);
        // climb past levels where this node is a left child with no right sibling
        while ((fn & 1) == 0 && fn != 0) {
          fn >>= 1;
          sn >>= 1;
        }
      } else {
        hash = Rfc6962Hasher.hashChildren(hash, sibling);
      }
      fn >>= 1;
      sn >>= 1;
    }

    if (sn != 0) {
      throw new InvalidProofException("Audit path is shorter than the tree is deep");
    }

    return hash;
  }

  /**
   * Returns the number of hashes in the audit path of the given leaf: one for every level below the point where the
   * path to the leaf diverges from the path to the last leaf, plus one for every left sibling above it.
   */
  public static int auditPathLength(final long leafIndex, final long treeSize) {
    final int inner = 64 - Long.numberOfLeadingZeros(leafIndex ^ (treeSize - 1));
    final int border = Long.bitCount(leafIndex >>> inner);
    return inner + border;
  }
}
