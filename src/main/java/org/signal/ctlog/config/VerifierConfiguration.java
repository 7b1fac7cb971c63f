/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.bind.annotation.Bindable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Configuration parameters shared by every configured log.
 *
 * @param transport      how logs are reached; logs configured for {@link Transport#DNS} must each name a DNS endpoint
 * @param requestTimeout the maximum time to wait for a single HTTP request to a log
 * @param userAgent      the {@code User-Agent} header sent with HTTP requests
 */
@ConfigurationProperties("verifier")
public record VerifierConfiguration(
    @NotNull
    @Bindable(defaultValue = "HTTP")
    Transport transport,
    @NotNull
    @Bindable(defaultValue = "10s")
    Duration requestTimeout,
    @NotBlank
    @Bindable(defaultValue = "ct-log-verifier")
    String userAgent) {

  public enum Transport {
    HTTP,
    DNS
  }
}
