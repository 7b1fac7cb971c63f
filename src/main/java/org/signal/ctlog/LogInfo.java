/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.security.PublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;
import org.signal.ctlog.client.LogClient;
import org.signal.ctlog.merkle.MerkleLogVerifier;
import org.signal.ctlog.merkle.Rfc6962Hasher;
import org.signal.ctlog.metrics.MetricsUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-log verification state: the log's identity, a client for reaching it, a verifier for its signatures, and the
 * most recent signed tree head observed from it.
 * <p>
 * All verification methods may be called concurrently from multiple threads. The cached tree head is the only
 * mutable state and is guarded by a read/write lock owned by this instance. Calls block on network I/O performed by
 * the {@link LogClient}; interrupting the calling thread abandons the call without touching the cache.
 */
public class LogInfo {

  private static final Logger logger = LoggerFactory.getLogger(LogInfo.class);

  private final LogIdentity identity;
  private final LogClient client;
  private final SignatureVerifier verifier;

  private final ReadWriteLock lastSignedTreeHeadLock = new ReentrantReadWriteLock();
  @Nullable
  private SignedTreeHead lastSignedTreeHead;

  private final Counter treeHeadFetchCounter;
  private final Counter misbehaviorCounter;
  private final Timer inclusionTimer;

  public LogInfo(final LogIdentity identity, final LogClient client, final SignatureVerifier verifier,
      final MeterRegistry meterRegistry) {
    this.identity = identity;
    this.client = client;
    this.verifier = verifier;

    this.treeHeadFetchCounter = meterRegistry.counter(MetricsUtil.name(LogInfo.class, "treeHeadFetches"),
        "log", identity.description());
    this.misbehaviorCounter = meterRegistry.counter(MetricsUtil.name(LogInfo.class, "misbehavior"),
        "log", identity.description());
    this.inclusionTimer = meterRegistry.timer(MetricsUtil.name(LogInfo.class, "verifyInclusion"),
        "log", identity.description());
  }

  /**
   * Builds the state for a single log-list entry, parsing its public key and pinning it for signature checks.
   *
   * @param entry         the log-list entry
   * @param client        a client already bound to the log's endpoint
   * @param meterRegistry the registry to record per-log metrics in
   * @throws LogConfigException if the entry has no public key, or its key cannot be parsed or used for verification
   */
  public static LogInfo fromLogListEntry(final LogListEntry entry, final LogClient client,
      final MeterRegistry meterRegistry) throws LogConfigException {

    if (entry.key() == null) {
      throw new LogConfigException(entry.description(), "no public key", null);
    }

    final PublicKey publicKey;
    try {
      publicKey = SignatureVerifier.parsePublicKey(entry.key());
    } catch (final LogConfigException e) {
      throw new LogConfigException(entry.description(), "failed to parse public key data", e);
    }

    final SignatureVerifier verifier;
    try {
      verifier = SignatureVerifier.forPublicKey(publicKey);
    } catch (final LogConfigException e) {
      throw new LogConfigException(entry.description(), "failed to build verifier", e);
    }

    return new LogInfo(entry.toLogIdentity(), client, verifier, meterRegistry);
  }

  public LogIdentity getIdentity() {
    return identity;
  }

  public String getDescription() {
    return identity.description();
  }

  public Duration getMaximumMergeDelay() {
    return identity.maximumMergeDelay();
  }

  public LogClient getClient() {
    return client;
  }

  public SignatureVerifier getVerifier() {
    return verifier;
  }

  /**
   * @return the most recent tree head recorded for this log, or empty if none has been fetched yet
   */
  public Optional<SignedTreeHead> getLastSignedTreeHead() {
    lastSignedTreeHeadLock.readLock().lock();
    try {
      return Optional.ofNullable(lastSignedTreeHead);
    } finally {
      lastSignedTreeHeadLock.readLock().unlock();
    }
  }

  /**
   * Replaces the recorded tree head unconditionally, even with one for a smaller tree.
   */
  public void setSignedTreeHead(final SignedTreeHead signedTreeHead) {
    lastSignedTreeHeadLock.writeLock().lock();
    try {
      lastSignedTreeHead = signedTreeHead;
    } finally {
      lastSignedTreeHeadLock.writeLock().unlock();
    }
  }

  /**
   * Returns the instant by which an entry covered by an SCT with the given timestamp must be included in a published
   * tree head.
   *
   * @param sctTimestamp the SCT timestamp in milliseconds since the Unix epoch
   */
  public Instant mergeDeadline(final long sctTimestamp) {
    return Instant.ofEpochMilli(sctTimestamp).plus(identity.maximumMergeDelay());
  }

  /**
   * Checks that the signature in {@code sct} matches the given leaf, adjusted for the SCT's timestamp, and this log.
   *
   * @throws InvalidSignatureException if the signature does not verify
   * @throws EncodingException         if the leaf cannot be encoded
   */
  public void verifySctSignature(final SignedCertificateTimestamp sct, final MerkleTreeLeaf leaf)
      throws InvalidSignatureException, EncodingException {
    final MerkleTreeLeaf timestampedLeaf = leaf.withTimestamp(sct.timestamp());
    try {
      verifier.verifySctSignature(sct, timestampedLeaf);
    } catch (final InvalidSignatureException e) {
      misbehaviorCounter.increment();
      logger.warn("Invalid SCT signature from log \"{}\"", identity.description());
      throw new InvalidSignatureException(identity.description(), "failed to verify SCT signature", e);
    } catch (final EncodingException e) {
      throw new EncodingException(identity.description(), "failed to encode SCT signature input", e);
    }
  }

  /**
   * Checks that the given leaf, adjusted for the given timestamp, is included in the most recent tree head known for
   * this log. If no tree head is known yet, one is fetched and recorded first.
   *
   * @return the index of the leaf in the log
   */
  public long verifyInclusionLatest(final MerkleTreeLeaf leaf, final long timestamp)
      throws LogTransportException, InvalidSignatureException, EncodingException, InvalidProofException {

    final Optional<SignedTreeHead> maybeSignedTreeHead = getLastSignedTreeHead();
    final SignedTreeHead signedTreeHead = maybeSignedTreeHead.isPresent()
        ? maybeSignedTreeHead.get()
        : fetchSignedTreeHead();

    return verifyInclusionAt(leaf, timestamp, signedTreeHead.treeSize(), signedTreeHead.sha256RootHash());
  }

  /**
   * Checks that the given leaf, adjusted for the given timestamp, is included in the log's current tree. The current
   * tree head is always fetched and recorded, replacing whatever was recorded before.
   *
   * @return the index of the leaf in the log
   */
  public long verifyInclusion(final MerkleTreeLeaf leaf, final long timestamp)
      throws LogTransportException, InvalidSignatureException, EncodingException, InvalidProofException {

    final SignedTreeHead signedTreeHead = fetchSignedTreeHead();
    return verifyInclusionAt(leaf, timestamp, signedTreeHead.treeSize(), signedTreeHead.sha256RootHash());
  }

  /**
   * Checks that the given leaf, adjusted for the given timestamp, is included in the tree with the given size and
   * root hash. The recorded tree head is neither consulted nor changed.
   *
   * @param leaf      the leaf to look for; not modified
   * @param timestamp the timestamp the log assigned to the entry, normally the SCT timestamp
   * @param treeSize  the size of the tree to check against
   * @param rootHash  the root hash of the tree to check against
   * @return the index of the leaf in the log
   * @throws EncodingException     if the leaf cannot be encoded for hashing
   * @throws LogTransportException if the proof cannot be fetched, including when the log does not know the leaf at
   *                               the given size
   * @throws InvalidProofException if the fetched proof does not lead to {@code rootHash}
   */
  public long verifyInclusionAt(final MerkleTreeLeaf leaf, final long timestamp, final long treeSize,
      final byte[] rootHash) throws EncodingException, LogTransportException, InvalidProofException {

    final Timer.Sample sample = Timer.start();
    try {
      final byte[] leafHash = calculateLeafHash(leaf.withTimestamp(timestamp));

      final InclusionProof proof;
      try {
        proof = client.getProofByHash(leafHash, treeSize);
      } catch (final LogTransportException e) {
        throw new LogTransportException(identity.description(),
            String.format("failed to get proof by hash at size %d", treeSize), e);
      }

      try {
        MerkleLogVerifier.verifyInclusionProof(proof.leafIndex(), treeSize, proof.auditPath(), rootHash, leafHash);
      } catch (final InvalidProofException e) {
        misbehaviorCounter.increment();
        logger.warn("Invalid inclusion proof from log \"{}\" for leaf {} at size {}", identity.description(),
            proof.leafIndex(), treeSize);
        throw new InvalidProofException(identity.description(),
            String.format("failed to verify inclusion proof at size %d", treeSize), e);
      }

      return proof.leafIndex();
    } finally {
      sample.stop(inclusionTimer);
    }
  }

  /**
   * Fetches the log's current tree head, checks its signature against the pinned key, and records it. A tree head
   * that cannot be fetched or fails its signature check is not recorded.
   */
  private SignedTreeHead fetchSignedTreeHead() throws LogTransportException, InvalidSignatureException, EncodingException {
    final SignedTreeHead signedTreeHead;
    try {
      signedTreeHead = client.getSignedTreeHead();
    } catch (final LogTransportException e) {
      throw new LogTransportException(identity.description(), "failed to get current STH", e);
    } finally {
      treeHeadFetchCounter.increment();
    }

    try {
      verifier.verifySthSignature(signedTreeHead);
    } catch (final InvalidSignatureException e) {
      misbehaviorCounter.increment();
      logger.warn("Invalid tree head signature from log \"{}\" at size {}", identity.description(),
          signedTreeHead.treeSize());
      throw new InvalidSignatureException(identity.description(), "failed to verify STH signature", e);
    } catch (final EncodingException e) {
      throw new EncodingException(identity.description(), "failed to encode STH signature input", e);
    }

    setSignedTreeHead(signedTreeHead);
    logger.debug("Recorded tree head of size {} for log \"{}\"", signedTreeHead.treeSize(), identity.description());

    return signedTreeHead;
  }

  private byte[] calculateLeafHash(final MerkleTreeLeaf leaf) throws EncodingException {
    try {
      return Rfc6962Hasher.hashLeaf(leaf.encode());
    } catch (final EncodingException e) {
      throw new EncodingException(identity.description(), "failed to create leaf hash", e);
    }
  }

  @Override
  public String toString() {
    return "LogInfo{" +
        "description='" + identity.description() + '\'' +
        ", lastSignedTreeHead=" + getLastSignedTreeHead().orElse(null) +
        "}";
  }
}
