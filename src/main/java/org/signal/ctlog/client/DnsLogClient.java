/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.client;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.BaseEncoding;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import org.signal.ctlog.DigitallySigned;
import org.signal.ctlog.EncodingException;
import org.signal.ctlog.InclusionProof;
import org.signal.ctlog.LogTransportException;
import org.signal.ctlog.SignedTreeHead;
import org.signal.ctlog.merkle.MerkleLogVerifier;
import org.signal.ctlog.merkle.Rfc6962Hasher;
import org.signal.ctlog.tls.CtConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client for logs that publish their tree heads and inclusion proofs as DNS TXT records.
 * <p>
 * The log's domain answers three kinds of query:
 * <ul>
 *   <li>{@code sth.<domain>} with {@code <tree size>.<timestamp>.<base64 root hash>.<base64 signature>}</li>
 *   <li>{@code <base32 leaf hash>.hash.<domain>} with the decimal index of the leaf</li>
 *   <li>{@code <start>.<leaf index>.<tree size>.tree.<domain>} with a run of raw 32-byte audit path hashes beginning
 *   at position {@code start} of the path</li>
 * </ul>
 */
public class DnsLogClient implements LogClient {

  private static final Logger logger = LoggerFactory.getLogger(DnsLogClient.class);
  private static final BaseEncoding BASE32 = BaseEncoding.base32().omitPadding();

  private final String domain;
  private final TxtResolver resolver;

  /**
   * @param domain   the domain serving the log's DNS API, e.g. {@code example.ct.example.com}
   * @param resolver the resolver used to issue TXT queries
   */
  public DnsLogClient(final String domain, final TxtResolver resolver) {
    this.domain = domain.endsWith(".") ? domain.substring(0, domain.length() - 1) : domain;
    this.resolver = resolver;
  }

  public String getDomain() {
    return domain;
  }

  @Override
  public SignedTreeHead getSignedTreeHead() throws LogTransportException {
    final String name = "sth." + domain;
    final String answer = new String(lookup(name), StandardCharsets.US_ASCII);
    final String[] parts = answer.split("\\.", -1);

    if (parts.length != 4) {
      throw new LogTransportException(
          String.format("Malformed tree head at %s: expected 4 fields, got %d", name, parts.length));
    }

    try {
      final byte[] rootHash = Base64.getDecoder().decode(parts[2]);
      if (rootHash.length != Rfc6962Hasher.HASH_SIZE) {
        throw new EncodingException("Root hash has unexpected length " + rootHash.length);
      }

      return new SignedTreeHead(CtConstants.VERSION_V1,
          Long.parseLong(parts[0]),
          Long.parseLong(parts[1]),
          rootHash,
          DigitallySigned.decode(Base64.getDecoder().decode(parts[3])));
    } catch (final EncodingException | IllegalArgumentException e) {
      throw new LogTransportException("Malformed tree head at " + name, e);
    }
  }

  @Override
  public InclusionProof getProofByHash(final byte[] leafHash, final long treeSize) throws LogTransportException {
    final long leafIndex = getLeafIndex(leafHash);

    if (leafIndex >= treeSize) {
      throw new LogTransportException(
          String.format("Leaf %d is not included in a tree of size %d", leafIndex, treeSize));
    }

    final int expectedPathLength = MerkleLogVerifier.auditPathLength(leafIndex, treeSize);
    final List<byte[]> auditPath = new ArrayList<>(expectedPathLength);

    while (auditPath.size() < expectedPathLength) {
      final String name = String.format("%d.%d.%d.tree.%s", auditPath.size(), leafIndex, treeSize, domain);
      final byte[] nodes = lookup(name);

      if (nodes.length == 0 || nodes.length % Rfc6962Hasher.HASH_SIZE != 0) {
        throw new LogTransportException(
            String.format("Malformed audit path at %s: %d bytes is not a positive multiple of %d", name,
                nodes.length, Rfc6962Hasher.HASH_SIZE));
      }

      for (int start = 0; start < nodes.length; start += Rfc6962Hasher.HASH_SIZE) {
        auditPath.add(Arrays.copyOfRange(nodes, start, start + Rfc6962Hasher.HASH_SIZE));
      }
    }

    if (auditPath.size() != expectedPathLength) {
      throw new LogTransportException(String.format("Log returned %d audit path nodes for leaf %d at size %d, "
          + "expected %d", auditPath.size(), leafIndex, treeSize, expectedPathLength));
    }

    return new InclusionProof(leafIndex, auditPath);
  }

  @VisibleForTesting
  long getLeafIndex(final byte[] leafHash) throws LogTransportException {
    final String name = BASE32.encode(leafHash) + ".hash." + domain;
    final String answer = new String(lookup(name), StandardCharsets.US_ASCII);

    try {
      final long leafIndex = Long.parseLong(answer);
      if (leafIndex < 0) {
        throw new NumberFormatException("Negative leaf index " + leafIndex);
      }
      return leafIndex;
    } catch (final NumberFormatException e) {
      throw new LogTransportException("Malformed leaf index at " + name, e);
    }
  }

  /**
   * Queries the TXT records at {@code name} and concatenates their character-strings.
   */
  private byte[] lookup(final String name) throws LogTransportException {
    if (Thread.currentThread().isInterrupted()) {
      throw new LogTransportException("TXT lookup for " + name + " was cancelled");
    }

    final List<byte[]> strings;
    try {
      strings = resolver.lookupTxt(name);
    } catch (final IOException e) {
      throw new LogTransportException("TXT lookup for " + name + " failed", e);
    }

    logger.debug("Resolved {} to {} character-strings", name, strings.size());

    final ByteArrayOutputStream joined = new ByteArrayOutputStream();
    strings.forEach(joined::writeBytes);
    return joined.toByteArray();
  }
}
