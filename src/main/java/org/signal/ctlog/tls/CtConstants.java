/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ctlog.tls;

/**
 * Field widths and enumerated values of the RFC 6962 structures. All widths are in bytes.
 */
public class CtConstants {

  public static final int VERSION_V1 = 0;

  public static final int VERSION_LENGTH = 1;
  public static final int SIGNATURE_TYPE_LENGTH = 1;
  public static final int LEAF_TYPE_LENGTH = 1;
  public static final int ENTRY_TYPE_LENGTH = 2;
  public static final int TIMESTAMP_LENGTH = 8;
  public static final int TREE_SIZE_LENGTH = 8;
  public static final int HASH_ALGORITHM_LENGTH = 1;
  public static final int SIGNATURE_ALGORITHM_LENGTH = 1;
  public static final int SIGNATURE_LENGTH_BYTES = 2;
  public static final int CERTIFICATE_LENGTH_BYTES = 3;
  public static final int EXTENSIONS_LENGTH_BYTES = 2;

  public static final int LOG_ID_LENGTH = 32;
  public static final int ISSUER_KEY_HASH_LENGTH = 32;
  public static final int SHA256_HASH_LENGTH = 32;

  public static final int SIGNATURE_TYPE_CERTIFICATE_TIMESTAMP = 0;
  public static final int SIGNATURE_TYPE_TREE_HASH = 1;

  public static final int LEAF_TYPE_TIMESTAMPED_ENTRY = 0;

  private CtConstants() {
  }
}
