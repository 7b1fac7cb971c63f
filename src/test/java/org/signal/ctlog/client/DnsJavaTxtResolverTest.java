/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.client;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.Resolver;

class DnsJavaTxtResolverTest {

  @Test
  void invalidName() {
    final Resolver resolver = mock(Resolver.class);
    final DnsJavaTxtResolver txtResolver = new DnsJavaTxtResolver(resolver);

    assertThrows(IOException.class, () -> txtResolver.lookupTxt("sth..example.com"));
    verifyNoInteractions(resolver);
  }
}
