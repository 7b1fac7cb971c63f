/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Base class for every failure reported while building or using a {@link LogInfo}. Each failure carries a
 * {@link Kind} so that callers making trust decisions can tell log misbehavior apart from operational problems
 * without parsing messages.
 */
public abstract class LogVerificationException extends Exception {

  /**
   * The category of a verification failure.
   */
  public enum Kind {
    /** A log-list entry or public key could not be turned into a usable log. */
    LOG_CONFIG,
    /** The log could not be reached, timed out, was cancelled, or answered with an error. */
    TRANSPORT,
    /** A leaf or structure could not be canonically encoded. */
    ENCODING,
    /** A log signature over an SCT or tree head did not verify. */
    SIGNATURE_INVALID,
    /** An inclusion proof did not recompute to the expected root hash. */
    PROOF_INVALID;

    /**
     * @return {@code true} if a failure of this kind means the log presented cryptographically inconsistent data,
     * rather than being unreachable or misconfigured
     */
    public boolean indicatesLogMisbehavior() {
      return this == SIGNATURE_INVALID || this == PROOF_INVALID;
    }
  }

  private final Kind kind;
  @Nullable
  private final String logDescription;

  protected LogVerificationException(final Kind kind, @Nullable final String logDescription, final String message,
      @Nullable final Throwable cause) {
    super(logDescription == null ? message : String.format("log \"%s\": %s", logDescription, message), cause);
    this.kind = kind;
    this.logDescription = logDescription;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @return the description of the log the failure relates to, if known at the point the failure was raised
   */
  public Optional<String> getLogDescription() {
    return Optional.ofNullable(logDescription);
  }
}
