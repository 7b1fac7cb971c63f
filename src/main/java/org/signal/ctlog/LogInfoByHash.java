/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashCode;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.signal.ctlog.client.DnsLogClient;
import org.signal.ctlog.client.HttpLogClient;
import org.signal.ctlog.client.TxtResolver;
import org.signal.ctlog.util.Sha256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable registry of {@link LogInfo} instances indexed by the SHA-256 hash of each log's DER-encoded public
 * key, which is the log ID carried in SCTs.
 */
public class LogInfoByHash {

  private static final Logger logger = LoggerFactory.getLogger(LogInfoByHash.class);

  private static final String HTTPS_PREFIX = "https://";

  private final ImmutableMap<HashCode, LogInfo> logInfoByKeyHash;

  private LogInfoByHash(final ImmutableMap<HashCode, LogInfo> logInfoByKeyHash) {
    this.logInfoByKeyHash = logInfoByKeyHash;
  }

  /**
   * Builds a registry from the given entries. If any entry fails to build, no registry is returned.
   * <p>
   * If two entries share a public key, the later entry replaces the earlier one.
   *
   * @throws LogConfigException if the factory rejects any entry
   */
  public static LogInfoByHash build(final Collection<LogListEntry> entries, final LogInfoFactory factory)
      throws LogConfigException {

    final ImmutableMap.Builder<HashCode, LogInfo> builder = ImmutableMap.builder();
    final Set<HashCode> seenKeyHashes = new HashSet<>();

    for (final LogListEntry entry : entries) {
      final LogInfo logInfo = factory.create(entry);
      final HashCode keyHash = Sha256.keyHash(logInfo.getIdentity().publicKey());

      if (!seenKeyHashes.add(keyHash)) {
        logger.warn("Log \"{}\" shares key hash {} with an earlier entry and replaces it",
            entry.description(), keyHash);
      }

      builder.put(keyHash, logInfo);
    }

    final LogInfoByHash logInfoByHash = new LogInfoByHash(builder.buildKeepingLast());
    logger.info("Built registry of {} logs", logInfoByHash.size());

    return logInfoByHash;
  }

  /**
   * Builds a registry whose logs are reached over the RFC 6962 HTTP API.
   */
  public static LogInfoByHash overHttp(final Collection<LogListEntry> entries,
      final HttpClient httpClient,
      final Duration requestTimeout,
      final String userAgent,
      final MeterRegistry meterRegistry) throws LogConfigException {

    return build(entries, entry -> newHttpLogInfo(entry, httpClient, requestTimeout, userAgent, meterRegistry));
  }

  /**
   * Builds a registry whose logs are reached over the DNS TXT API. Every entry must name a DNS endpoint.
   */
  public static LogInfoByHash overDns(final Collection<LogListEntry> entries,
      final TxtResolver resolver,
      final MeterRegistry meterRegistry) throws LogConfigException {

    return build(entries, entry -> newDnsLogInfo(entry, resolver, meterRegistry));
  }

  static LogInfo newHttpLogInfo(final LogListEntry entry,
      final HttpClient httpClient,
      final Duration requestTimeout,
      final String userAgent,
      final MeterRegistry meterRegistry) throws LogConfigException {

    if (entry.url() == null || entry.url().isBlank()) {
      throw new LogConfigException(entry.description(), "no URL", null);
    }

    final String url = entry.url().startsWith(HTTPS_PREFIX) ? entry.url() : HTTPS_PREFIX + entry.url();

    final URI baseUri;
    try {
      baseUri = URI.create(url);
    } catch (final IllegalArgumentException e) {
      throw new LogConfigException(entry.description(), "failed to create client for URL " + url, e);
    }

    // URI accepts some authorities, such as host names containing '_', without parsing a host from them
    if (baseUri.getHost() == null) {
      throw new LogConfigException(entry.description(), "URL " + url + " has no valid host", null);
    }

    return LogInfo.fromLogListEntry(entry, new HttpLogClient(baseUri, httpClient, requestTimeout, userAgent),
        meterRegistry);
  }

  static LogInfo newDnsLogInfo(final LogListEntry entry,
      final TxtResolver resolver,
      final MeterRegistry meterRegistry) throws LogConfigException {

    if (entry.dnsApiEndpoint() == null || entry.dnsApiEndpoint().isBlank()) {
      throw new LogConfigException(entry.description(), "no available DNS endpoint", null);
    }

    return LogInfo.fromLogListEntry(entry, new DnsLogClient(entry.dnsApiEndpoint(), resolver), meterRegistry);
  }

  public Optional<LogInfo> get(final byte[] keyHash) {
    return get(HashCode.fromBytes(keyHash));
  }

  public Optional<LogInfo> get(final HashCode keyHash) {
    return Optional.ofNullable(logInfoByKeyHash.get(keyHash));
  }

  public Collection<LogInfo> values() {
    return logInfoByKeyHash.values();
  }

  public ImmutableMap<HashCode, LogInfo> asMap() {
    return logInfoByKeyHash;
  }

  public int size() {
    return logInfoByKeyHash.size();
  }
}
