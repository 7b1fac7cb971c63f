/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.client;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import javax.annotation.Nullable;
import org.signal.ctlog.DigitallySigned;
import org.signal.ctlog.EncodingException;
import org.signal.ctlog.InclusionProof;
import org.signal.ctlog.LogTransportException;
import org.signal.ctlog.SignedTreeHead;
import org.signal.ctlog.merkle.Rfc6962Hasher;
import org.signal.ctlog.tls.CtConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client for the JSON-over-HTTPS API of RFC 6962 section 4.
 */
public class HttpLogClient implements LogClient {

  private static final Logger logger = LoggerFactory.getLogger(HttpLogClient.class);
  private static final Gson GSON = new Gson();

  @VisibleForTesting
  static final String GET_STH_PATH = "ct/v1/get-sth";
  @VisibleForTesting
  static final String GET_PROOF_BY_HASH_PATH = "ct/v1/get-proof-by-hash";

  private final URI baseUri;
  private final HttpClient httpClient;
  private final Duration requestTimeout;
  private final String userAgent;

  // JSON bodies of the RFC 6962 responses, populated by Gson

  static class GetSthResponse {
    @SerializedName("tree_size")
    Long treeSize;

    Long timestamp;

    @SerializedName("sha256_root_hash")
    String sha256RootHash;

    @SerializedName("tree_head_signature")
    String treeHeadSignature;
  }

  static class GetProofByHashResponse {
    @SerializedName("leaf_index")
    Long leafIndex;

    @SerializedName("audit_path")
    List<String> auditPath;
  }

  /**
   * @param baseUri        the log's base URL, e.g. {@code https://ct.example.com/2026/}
   * @param httpClient     the HTTP client to send requests with
   * @param requestTimeout the maximum time to wait for each response
   * @param userAgent      the value of the {@code User-Agent} header sent with each request
   */
  public HttpLogClient(final URI baseUri, final HttpClient httpClient, final Duration requestTimeout,
      final String userAgent) {
    this.baseUri = baseUri.getPath() != null && baseUri.getPath().endsWith("/")
        ? baseUri
        : URI.create(baseUri + "/");
    this.httpClient = httpClient;
    this.requestTimeout = requestTimeout;
    this.userAgent = userAgent;
  }

  public URI getBaseUri() {
    return baseUri;
  }

  @Override
  public SignedTreeHead getSignedTreeHead() throws LogTransportException {
    final GetSthResponse response = get(baseUri.resolve(GET_STH_PATH), GetSthResponse.class);

    try {
      return new SignedTreeHead(CtConstants.VERSION_V1,
          requireField(response.treeSize, "tree_size"),
          requireField(response.timestamp, "timestamp"),
          decodeHash(requireField(response.sha256RootHash, "sha256_root_hash")),
          DigitallySigned.decode(decodeBase64(requireField(response.treeHeadSignature, "tree_head_signature"))));
    } catch (final EncodingException | IllegalArgumentException e) {
      throw new LogTransportException("Malformed get-sth response from " + baseUri, e);
    }
  }

  @Override
  public InclusionProof getProofByHash(final byte[] leafHash, final long treeSize) throws LogTransportException {
    final URI uri = baseUri.resolve(GET_PROOF_BY_HASH_PATH
        + "?hash=" + URLEncoder.encode(Base64.getEncoder().encodeToString(leafHash), StandardCharsets.UTF_8)
        + "&tree_size=" + treeSize);
    final GetProofByHashResponse response = get(uri, GetProofByHashResponse.class);

    try {
      final long leafIndex = requireField(response.leafIndex, "leaf_index");
      if (leafIndex < 0) {
        throw new IllegalArgumentException("Negative leaf index " + leafIndex);
      }

      final List<byte[]> auditPath = new ArrayList<>();
      for (final String node : requireField(response.auditPath, "audit_path")) {
        auditPath.add(decodeHash(node));
      }
      return new InclusionProof(leafIndex, auditPath);
    } catch (final EncodingException | IllegalArgumentException e) {
      throw new LogTransportException("Malformed get-proof-by-hash response from " + baseUri, e);
    }
  }

  private <T> T get(final URI uri, final Class<T> responseClass) throws LogTransportException {
    final HttpResponse<String> response;
    try {
      final HttpRequest request = HttpRequest.newBuilder(uri)
          .GET()
          .timeout(requestTimeout)
          .header("User-Agent", userAgent)
          .header("Accept", "application/json")
          .build();

      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IllegalArgumentException e) {
      throw new LogTransportException("Cannot send request to " + uri, e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LogTransportException("Request to " + uri + " was cancelled", e);
    } catch (final IOException e) {
      throw new LogTransportException("Request to " + uri + " failed", e);
    }

    if (response.statusCode() != 200) {
      logger.debug("Log at {} responded with HTTP {}: {}", uri, response.statusCode(), response.body());
      throw new LogTransportException(
          String.format("Request to %s failed with HTTP status %d", uri, response.statusCode()));
    }

    try {
      final T parsed = GSON.fromJson(response.body(), responseClass);
      if (parsed == null) {
        throw new LogTransportException("Empty response body from " + uri);
      }
      return parsed;
    } catch (final JsonParseException e) {
      throw new LogTransportException("Malformed JSON response from " + uri, e);
    }
  }

  private static <T> T requireField(@Nullable final T value, final String name) throws EncodingException {
    if (value == null) {
      throw new EncodingException("Missing field " + name);
    }
    return value;
  }

  private static byte[] decodeBase64(final String base64) {
    return Base64.getDecoder().decode(base64);
  }

  private static byte[] decodeHash(final String base64) throws EncodingException {
    final byte[] hash = decodeBase64(base64);
    if (hash.length != Rfc6962Hasher.HASH_SIZE) {
      throw new EncodingException("Expected a " + Rfc6962Hasher.HASH_SIZE + "-byte hash, got " + hash.length);
    }
    return hash;
  }
}
