/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import javax.annotation.Nullable;

/**
 * Indicates that communication with a log failed, including timeouts, cancellation, and the log reporting that a leaf is absent at the requested tree size.
 */
public class LogTransportException extends LogVerificationException {

  public LogTransportException(final String message) {
    this(null, message, null);
  }

  public LogTransportException(final String message, @Nullable final Throwable cause) {
    this(null, message, cause);
  }

  public LogTransportException(@Nullable final String logDescription, final String message, @Nullable final Throwable cause) {
    super(Kind.TRANSPORT, logDescription, message, cause);
  }
}
