/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.client;

import java.io.IOException;
import java.util.List;

/**
 * Looks up DNS TXT records.
 */
@FunctionalInterface
public interface TxtResolver {

  /**
   * @param name the fully-qualified name to query
   * @return the raw character-strings of every TXT record found at {@code name}, in answer order
   * @throws IOException if the name is malformed, the query fails, or no TXT record exists at {@code name}
   */
  List<byte[]> lookupTxt(String name) throws IOException;
}
