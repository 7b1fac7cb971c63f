/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.metrics;

public class MetricsUtil {

  private static final String PREFIX = "ctlog";

  private MetricsUtil() {
  }

  /**
   * Returns a dot-separated metric name of the form {@code ctlog.<simple class name>.<metric name>}.
   */
  public static String name(final Class<?> clazz, final String metricName) {
    return String.join(".", PREFIX, clazz.getSimpleName(), metricName);
  }
}
