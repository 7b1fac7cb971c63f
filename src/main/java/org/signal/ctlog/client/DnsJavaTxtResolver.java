/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.client;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.Type;

/**
 * A {@link TxtResolver} backed by dnsjava.
 */
public class DnsJavaTxtResolver implements TxtResolver {

  private final Resolver resolver;

  public DnsJavaTxtResolver(final Resolver resolver) {
    this.resolver = resolver;
  }

  /**
   * @return a resolver that queries the name servers configured for this host
   */
  public static DnsJavaTxtResolver systemDefault() {
    return new DnsJavaTxtResolver(Lookup.getDefaultResolver());
  }

  @Override
  public List<byte[]> lookupTxt(final String name) throws IOException {
    final Lookup lookup = new Lookup(Name.fromString(name, Name.root), Type.TXT);
    lookup.setResolver(resolver);
    // Tree heads change over time, so answers are never served from dnsjava's shared cache
    lookup.setCache(null);

    final org.xbill.DNS.Record[] records = lookup.run();
    if (lookup.getResult() != Lookup.SUCCESSFUL || records == null) {
      throw new IOException(String.format("TXT lookup for %s failed: %s", name, lookup.getErrorString()));
    }

    final List<byte[]> strings = new ArrayList<>();
    for (final org.xbill.DNS.Record record : records) {
      if (record instanceof TXTRecord txtRecord) {
        strings.addAll(txtRecord.getStringsAsByteArrays());
      }
    }
    return strings;
  }
}
