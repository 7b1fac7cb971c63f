/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

/**
 * The kind of certificate a log entry was created for.
 */
public enum LogEntryType {
  X509_ENTRY(0),
  PRECERT_ENTRY(1);

  private final int value;

  LogEntryType(final int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }
}
