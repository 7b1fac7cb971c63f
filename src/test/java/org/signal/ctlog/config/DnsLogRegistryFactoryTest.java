/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import io.micronaut.context.annotation.Property;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import java.util.Base64;
import org.junit.jupiter.api.Test;
import org.signal.ctlog.LogInfo;
import org.signal.ctlog.LogInfoByHash;
import org.signal.ctlog.client.DnsLogClient;
import org.signal.ctlog.util.Sha256;
import org.signal.ctlog.util.TestLogKeys;

@Property(name = "verifier.transport", value = "DNS")
@Property(name = "verifier.logs.gamma.description", value = "Gamma Log")
@Property(name = "verifier.logs.gamma.url", value = "ct.example.com/gamma")
@Property(name = "verifier.logs.gamma.key", value = TestLogKeys.BASE_64_EC_PUBLIC_KEY)
@Property(name = "verifier.logs.gamma.maximum-merge-delay", value = "86400")
@Property(name = "verifier.logs.gamma.dns-api-endpoint", value = "gamma.dns.ct.example.com")
@MicronautTest
class DnsLogRegistryFactoryTest {

  @Inject
  LogInfoByHash logInfoByHash;

  @Test
  void logInfoByHash() {
    assertEquals(1, logInfoByHash.size());

    final LogInfo gamma = logInfoByHash.get(
        Sha256.keyHash(Base64.getDecoder().decode(TestLogKeys.BASE_64_EC_PUBLIC_KEY))).orElseThrow();
    assertEquals("gamma.dns.ct.example.com",
        assertInstanceOf(DnsLogClient.class, gamma.getClient()).getDomain());
  }
}
