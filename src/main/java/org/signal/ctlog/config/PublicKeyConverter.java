/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.config;

import io.micronaut.context.annotation.Prototype;
import io.micronaut.core.convert.ConversionContext;
import io.micronaut.core.convert.TypeConverter;
import java.security.PublicKey;
import java.util.Base64;
import java.util.Optional;
import org.signal.ctlog.LogConfigException;
import org.signal.ctlog.SignatureVerifier;

/**
 * Converts a base64-encoded DER SubjectPublicKeyInfo from configuration into an EC or RSA public key.
 */
@Prototype
class PublicKeyConverter implements TypeConverter<String, PublicKey> {

  @Override
  public Optional<PublicKey> convert(final String base64, final Class<PublicKey> targetType,
      final ConversionContext context) {
    try {
      return Optional.of(SignatureVerifier.parsePublicKey(Base64.getDecoder().decode(base64)));
    } catch (final LogConfigException | IllegalArgumentException e) {
      context.reject(base64, e);
      return Optional.empty();
    }
  }
}
