/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import java.util.HexFormat;
import java.util.List;

/**
 * A log's answer to a request for the inclusion proof of a leaf hash at a given tree size.
 *
 * @param leafIndex the 0-based position of the leaf in the log
 * @param auditPath the sibling hashes from the leaf up to the root, lowest level first
 */
public record InclusionProof(long leafIndex, List<byte[]> auditPath) {

  public InclusionProof {
    auditPath = List.copyOf(auditPath);
  }

  @Override
  public String toString() {
    return "InclusionProof{" +
        "leafIndex=" + leafIndex +
        ", auditPath=" + auditPath.stream().map(bytes -> HexFormat.of().formatHex(bytes)).toList() +
        "}";
  }
}
