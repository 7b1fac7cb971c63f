/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.util;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A straightforward recursive implementation of the RFC 6962 section 2.1 tree hash and audit path definitions, used
 * to check the iterative verifier against.
 */
public class TestMerkleTree {

  private final List<byte[]> leafHashes = new ArrayList<>();

  public void addLeaf(final byte[] leafData) {
    leafHashes.add(leafHash(leafData));
  }

  public void addLeafHash(final byte[] leafHash) {
    leafHashes.add(leafHash);
  }

  public int size() {
    return leafHashes.size();
  }

  public byte[] leafHash(final int index) {
    return leafHashes.get(index);
  }

  public byte[] rootHash(final int treeSize) {
    return subtreeHash(0, treeSize);
  }

  public List<byte[]> auditPath(final int leafIndex, final int treeSize) {
    final List<byte[]> path = new ArrayList<>();
    auditPath(leafIndex, 0, treeSize, path);
    return path;
  }

  public static byte[] leafHash(final byte[] leafData) {
    final ByteArrayOutputStream input = new ByteArrayOutputStream();
    input.write(0x00);
    input.writeBytes(leafData);
    return Sha256.hash(input.toByteArray());
  }

  private static byte[] nodeHash(final byte[] left, final byte[] right) {
    final ByteArrayOutputStream input = new ByteArrayOutputStream();
    input.write(0x01);
    input.writeBytes(left);
    input.writeBytes(right);
    return Sha256.hash(input.toByteArray());
  }

  // Hash of leaves [start, end)
  private byte[] subtreeHash(final int start, final int end) {
    final int n = end - start;
    if (n == 0) {
      return Sha256.hash(new byte[0]);
    }
    if (n == 1) {
      return leafHashes.get(start);
    }
    final int k = largestPowerOfTwoLessThan(n);
    return nodeHash(subtreeHash(start, start + k), subtreeHash(start + k, end));
  }

  // Appends PATH(m, D[start:end]) from the leaf upwards
  private void auditPath(final int m, final int start, final int end, final List<byte[]> path) {
    final int n = end - start;
    if (n <= 1) {
      return;
    }
    final int k = largestPowerOfTwoLessThan(n);
    if (m < k) {
      auditPath(m, start, start + k, path);
      path.add(subtreeHash(start + k, end));
    } else {
      auditPath(m - k, start + k, end, path);
      path.add(subtreeHash(start, start + k));
    }
  }

  private static int largestPowerOfTwoLessThan(final int n) {
    int k = 1;
    while (k << 1 < n) {
      k <<= 1;
    }
    return k;
  }
}
