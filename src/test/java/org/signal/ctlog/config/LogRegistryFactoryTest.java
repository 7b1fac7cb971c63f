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
import java.net.URI;
import java.time.Duration;
import java.util.Base64;
import org.junit.jupiter.api.Test;
import org.signal.ctlog.LogInfo;
import org.signal.ctlog.LogInfoByHash;
import org.signal.ctlog.client.HttpLogClient;
import org.signal.ctlog.util.Sha256;
import org.signal.ctlog.util.TestLogKeys;

@Property(name = "verifier.request-timeout", value = "3s")
@Property(name = "verifier.logs.alpha.description", value = "Alpha Log")
@Property(name = "verifier.logs.alpha.url", value = "ct.example.com/alpha")
@Property(name = "verifier.logs.alpha.key", value = TestLogKeys.BASE_64_EC_PUBLIC_KEY)
@Property(name = "verifier.logs.alpha.maximum-merge-delay", value = "86400")
@Property(name = "verifier.logs.beta.description", value = "Beta Log")
@Property(name = "verifier.logs.beta.url", value = "https://ct.example.com/beta/")
@Property(name = "verifier.logs.beta.key", value = TestLogKeys.BASE_64_SECOND_EC_PUBLIC_KEY)
@Property(name = "verifier.logs.beta.maximum-merge-delay", value = "3600")
@Property(name = "verifier.logs.beta.dns-api-endpoint", value = "beta.dns.ct.example.com")
@MicronautTest
class LogRegistryFactoryTest {

  @Inject
  VerifierConfiguration verifierConfiguration;

  @Inject
  LogInfoByHash logInfoByHash;

  @Test
  void verifierConfiguration() {
    assertEquals(VerifierConfiguration.Transport.HTTP, verifierConfiguration.transport());
    assertEquals(Duration.ofSeconds(3), verifierConfiguration.requestTimeout());
    assertEquals("ct-log-verifier", verifierConfiguration.userAgent());
  }

  @Test
  void logInfoByHash() {
    assertEquals(2, logInfoByHash.size());

    final LogInfo alpha = logInfoByHash.get(
        Sha256.keyHash(Base64.getDecoder().decode(TestLogKeys.BASE_64_EC_PUBLIC_KEY))).orElseThrow();
    assertEquals("Alpha Log", alpha.getDescription());
    assertEquals(Duration.ofDays(1), alpha.getMaximumMergeDelay());
    assertEquals(URI.create("https://ct.example.com/alpha/"),
        assertInstanceOf(HttpLogClient.class, alpha.getClient()).getBaseUri());

    final LogInfo beta = logInfoByHash.get(
        Sha256.keyHash(Base64.getDecoder().decode(TestLogKeys.BASE_64_SECOND_EC_PUBLIC_KEY))).orElseThrow();
    assertEquals("Beta Log", beta.getDescription());
    assertEquals(Duration.ofHours(1), beta.getMaximumMergeDelay());
    assertEquals(URI.create("https://ct.example.com/beta/"),
        assertInstanceOf(HttpLogClient.class, beta.getClient()).getBaseUri());
  }
}
