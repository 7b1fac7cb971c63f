/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

/**
 * Builds the verification state for a single log-list entry.
 */
@FunctionalInterface
public interface LogInfoFactory {

  LogInfo create(LogListEntry entry) throws LogConfigException;
}
