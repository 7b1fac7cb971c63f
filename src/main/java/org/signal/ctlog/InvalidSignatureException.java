/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import javax.annotation.Nullable;

/**
 * Indicates that a log signature over an SCT or a tree head did not verify.
 */
public class InvalidSignatureException extends LogVerificationException {

  public InvalidSignatureException(final String message) {
    this(null, message, null);
  }

  public InvalidSignatureException(final String message, @Nullable final Throwable cause) {
    this(null, message, cause);
  }

  public InvalidSignatureException(@Nullable final String logDescription, final String message, @Nullable final Throwable cause) {
    super(Kind.SIGNATURE_INVALID, logDescription, message, cause);
  }
}
