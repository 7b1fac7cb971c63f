/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import javax.annotation.Nullable;

/**
 * Indicates that a structure could not be canonically encoded or decoded in its TLS presentation form.
 */
public class EncodingException extends LogVerificationException {

  public EncodingException(final String message) {
    this(null, message, null);
  }

  public EncodingException(final String message, @Nullable final Throwable cause) {
    this(null, message, cause);
  }

  public EncodingException(@Nullable final String logDescription, final String message, @Nullable final Throwable cause) {
    super(Kind.ENCODING, logDescription, message, cause);
  }
}
