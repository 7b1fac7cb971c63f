/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.client;

import org.signal.ctlog.InclusionProof;
import org.signal.ctlog.LogTransportException;
import org.signal.ctlog.SignedTreeHead;

/**
 * The read operations of a Certificate Transparency log needed to check inclusion, independent of how the log is
 * reached.
 * <p>
 * Calls block the calling thread. Implementations bound each call with their own request timeout, and abandon an
 * in-flight call when the calling thread is interrupted; both surface as a {@link LogTransportException}. No retries
 * are attempted.
 */
public interface LogClient {

  /**
   * Fetches the log's current signed tree head. The signature is not checked by the client.
   *
   * @return the log's current tree head
   * @throws LogTransportException if the log cannot be reached or returns a malformed or error response
   */
  SignedTreeHead getSignedTreeHead() throws LogTransportException;

  /**
   * Fetches the inclusion proof for the leaf with the given hash in the tree of the given size.
   *
   * @param leafHash the Merkle leaf hash of the entry
   * @param treeSize the size of the tree the proof should be relative to
   * @return the leaf's index and audit path as reported by the log
   * @throws LogTransportException if the log cannot be reached, returns a malformed response, or does not know the
   *                               leaf at the given tree size
   */
  InclusionProof getProofByHash(byte[] leafHash, long treeSize) throws LogTransportException;
}
