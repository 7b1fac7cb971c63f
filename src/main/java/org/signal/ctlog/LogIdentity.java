/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.time.Duration;
import java.util.Objects;

/**
 * The immutable identity of a trusted log.
 *
 * @param description        human-readable name of the log
 * @param publicKey          the DER-encoded SubjectPublicKeyInfo of the log's signing key
 * @param maximumMergeDelay  how long the log may take to incorporate an entry after issuing an SCT for it
 */
public record LogIdentity(String description, byte[] publicKey, Duration maximumMergeDelay) {

  public LogIdentity {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(maximumMergeDelay, "maximumMergeDelay");
    publicKey = publicKey.clone();
  }

  @Override
  public byte[] publicKey() {
    return publicKey.clone();
  }

  @Override
  public String toString() {
    return "LogIdentity{" +
        "description='" + description + '\'' +
        ", maximumMergeDelay=" + maximumMergeDelay +
        "}";
  }
}
