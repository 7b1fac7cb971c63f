/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.time.Duration;
import javax.annotation.Nullable;

/**
 * A single log as described by a log list.
 *
 * @param description              human-readable name of the log
 * @param url                      the log's base URL; the {@code https://} scheme may be omitted
 * @param key                      the DER-encoded SubjectPublicKeyInfo of the log's signing key
 * @param maximumMergeDelaySeconds the log's maximum merge delay in seconds
 * @param dnsApiEndpoint           the domain serving the log's CT-over-DNS API, if it has one
 */
public record LogListEntry(String description,
                           String url,
                           byte[] key,
                           long maximumMergeDelaySeconds,
                           @Nullable String dnsApiEndpoint) {

  LogIdentity toLogIdentity() {
    return new LogIdentity(description, key, Duration.ofSeconds(maximumMergeDelaySeconds));
  }

  @Override
  public String toString() {
    return "LogListEntry{" +
        "description='" + description + '\'' +
        ", url='" + url + '\'' +
        ", maximumMergeDelaySeconds=" + maximumMergeDelaySeconds +
        ", dnsApiEndpoint='" + dnsApiEndpoint + '\'' +
        "}";
  }
}
