/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.exceptions.ConfigurationException;
import jakarta.inject.Singleton;
import java.net.http.HttpClient;
import java.util.Comparator;
import java.util.List;
import org.signal.ctlog.LogConfigException;
import org.signal.ctlog.LogInfoByHash;
import org.signal.ctlog.LogListEntry;
import org.signal.ctlog.client.DnsJavaTxtResolver;
import org.signal.ctlog.client.TxtResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Factory
class LogRegistryFactory {

  private static final Logger logger = LoggerFactory.getLogger(LogRegistryFactory.class);

  @Singleton
  HttpClient httpClient(final VerifierConfiguration configuration) {
    return HttpClient.newBuilder()
        .connectTimeout(configuration.requestTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Singleton
  TxtResolver txtResolver() {
    return DnsJavaTxtResolver.systemDefault();
  }

  @Singleton
  LogInfoByHash logInfoByHash(final VerifierConfiguration configuration,
      final List<LogConfiguration> logConfigurations,
      final HttpClient httpClient,
      final TxtResolver txtResolver,
      final MeterRegistry meterRegistry) {

    try {
      final List<LogListEntry> entries = toLogListEntries(logConfigurations);

      logger.info("Building registry of {} configured logs over {}", entries.size(), configuration.transport());

      return switch (configuration.transport()) {
        case HTTP -> LogInfoByHash.overHttp(entries, httpClient, configuration.requestTimeout(),
            configuration.userAgent(), meterRegistry);
        case DNS -> LogInfoByHash.overDns(entries, txtResolver, meterRegistry);
      };
    } catch (final LogConfigException e) {
      throw new ConfigurationException("Invalid log configuration: " + e.getMessage(), e);
    }
  }

  // Bean injection order is unspecified, so entries are ordered by configured name
  static List<LogListEntry> toLogListEntries(final List<LogConfiguration> logConfigurations) {
    return logConfigurations.stream()
        .sorted(Comparator.comparing(LogConfiguration::getName))
        .map(LogConfiguration::toLogListEntry)
        .toList();
  }
}
