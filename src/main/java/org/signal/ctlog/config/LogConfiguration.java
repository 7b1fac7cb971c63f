/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.config;

import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.security.PublicKey;
import javax.annotation.Nullable;
import org.signal.ctlog.LogListEntry;

/**
 * Configuration for a single log, bound from {@code verifier.logs.<name>}.
 */
@EachProperty("verifier.logs")
public class LogConfiguration {

  private final String name;

  @NotBlank
  private String description;

  @NotBlank
  private String url;

  /**
   * The log's public key, configured as a base64-encoded DER SubjectPublicKeyInfo
   */
  @NotNull
  private PublicKey key;

  /**
   * The log's maximum merge delay, in seconds
   */
  @Positive
  private long maximumMergeDelay;

  @Nullable
  private String dnsApiEndpoint;

  public LogConfiguration(@Parameter final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(final String description) {
    this.description = description;
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(final String url) {
    this.url = url;
  }

  public PublicKey getKey() {
    return key;
  }

  public void setKey(final PublicKey key) {
    this.key = key;
  }

  public long getMaximumMergeDelay() {
    return maximumMergeDelay;
  }

  public void setMaximumMergeDelay(final long maximumMergeDelay) {
    this.maximumMergeDelay = maximumMergeDelay;
  }

  @Nullable
  public String getDnsApiEndpoint() {
    return dnsApiEndpoint;
  }

  public void setDnsApiEndpoint(@Nullable final String dnsApiEndpoint) {
    this.dnsApiEndpoint = dnsApiEndpoint;
  }

  /**
   * Converts this configuration to a log-list entry. The entry's key is the re-encoded DER form of the configured key,
   * which matches the configured bytes for named-curve EC and RSA keys.
   */
  public LogListEntry toLogListEntry() {
    return new LogListEntry(description, url, key.getEncoded(), maximumMergeDelay, dnsApiEndpoint);
  }
}
