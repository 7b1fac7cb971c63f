/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import javax.annotation.Nullable;

/**
 * Indicates that a log-list entry or its public key cannot be used to build a {@link LogInfo}.
 */
public class LogConfigException extends LogVerificationException {

  public LogConfigException(final String message) {
    this(null, message, null);
  }

  public LogConfigException(final String message, @Nullable final Throwable cause) {
    this(null, message, cause);
  }

  public LogConfigException(@Nullable final String logDescription, final String message, @Nullable final Throwable cause) {
    super(Kind.LOG_CONFIG, logDescription, message, cause);
  }
}
