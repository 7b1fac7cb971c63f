/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import javax.annotation.Nullable;

/**
 * Indicates that a Merkle inclusion proof provided by a log does not recompute to the expected root hash.
 */
public class InvalidProofException extends LogVerificationException {

  public InvalidProofException(final String message) {
    this(null, message, null);
  }

  public InvalidProofException(final String message, @Nullable final Throwable cause) {
    this(null, message, cause);
  }

  public InvalidProofException(@Nullable final String logDescription, final String message, @Nullable final Throwable cause) {
    super(Kind.PROOF_INVALID, logDescription, message, cause);
  }
}
