/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class MerkleTreeLeafTest {

  @Test
  void encodeCertificateLeaf() throws EncodingException {
    final MerkleTreeLeaf leaf = MerkleTreeLeaf.forCertificate(HexFormat.of().parseHex("3082"))
        .withTimestamp(0x0102030405060708L);

    assertEquals("00" + "00" + "0102030405060708" + "0000" + "000002" + "3082" + "0000",
        HexFormat.of().formatHex(leaf.encode()));
  }

  @Test
  void encodePrecertificateLeaf() throws EncodingException {
    final byte[] issuerKeyHash = new byte[32];
    issuerKeyHash[31] = 0x7f;

    final MerkleTreeLeaf leaf = MerkleTreeLeaf.forPrecertificate(HexFormat.of().parseHex("aa"), issuerKeyHash)
        .withTimestamp(1);

    assertEquals("00" + "00" + "0000000000000001" + "0001" + HexFormat.of().formatHex(issuerKeyHash)
            + "000001" + "aa" + "0000",
        HexFormat.of().formatHex(leaf.encode()));
  }

  @Test
  void precertificateRequiresIssuerKeyHash() {
    final MerkleTreeLeaf leaf = MerkleTreeLeaf.forPrecertificate(new byte[]{1}, new byte[20]);

    assertThrows(EncodingException.class, leaf::encode);
  }

  @Test
  void withTimestampDoesNotModifyOriginal() {
    final MerkleTreeLeaf leaf = MerkleTreeLeaf.forCertificate(new byte[]{1, 2, 3});
    final MerkleTreeLeaf timestamped = leaf.withTimestamp(12345);

    assertEquals(0, leaf.timestampedEntry().timestamp());
    assertEquals(12345, timestamped.timestampedEntry().timestamp());
  }
}
