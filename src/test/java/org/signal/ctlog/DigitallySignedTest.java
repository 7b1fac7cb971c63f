/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HexFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DigitallySignedTest {

  @Test
  void decode() throws EncodingException {
    final DigitallySigned digitallySigned = DigitallySigned.decode(HexFormat.of().parseHex("04030003aabbcc"));

    assertEquals(DigitallySigned.HashAlgorithm.SHA256, digitallySigned.hashAlgorithm());
    assertEquals(DigitallySigned.SignatureAlgorithm.ECDSA, digitallySigned.signatureAlgorithm());
    assertArrayEquals(HexFormat.of().parseHex("aabbcc"), digitallySigned.signature());
    assertEquals("04030003aabbcc", HexFormat.of().formatHex(digitallySigned.encode()));
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      // unknown hash algorithm
      "09030000",
      // unknown signature algorithm
      "04070000",
      // truncated signature
      "04030004aabbcc",
      // trailing byte
      "04030001aabb"
  })
  void decodeInvalid(final String hex) {
    final EncodingException exception =
        assertThrows(EncodingException.class, () -> DigitallySigned.decode(HexFormat.of().parseHex(hex)));
    assertEquals(LogVerificationException.Kind.ENCODING, exception.getKind());
  }
}
