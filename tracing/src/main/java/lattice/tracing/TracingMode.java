/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.Locale;

/**
 * Informs the creation of no-op spans.
 *
 * <p>In {@link #BACKGROUND} mode, real spans are created for all operations. They record sparse
 * structured information unless an operation explicitly asks for verbose recording.
 *
 * <p>In {@link #LEGACY} mode, real spans are only created when a caller asks for one, when
 * recording is requested, or when a shadow tracer or the debug sink is configured.
 */
public enum TracingMode {
  LEGACY,
  BACKGROUND;

  /** Parses the setting value {@code legacy} or {@code background}, ignoring case. */
  public static TracingMode parse(String value) {
    if (value == null) throw new NullPointerException("value == null");
    String lowerCase = value.trim().toLowerCase(Locale.ROOT);
    for (TracingMode mode : values()) {
      if (mode.settingValue().equals(lowerCase)) return mode;
    }
    throw new IllegalArgumentException(
      "unknown trace.mode '" + value + "', expected 'legacy' or 'background'");
  }

  /** The value used in {@code trace.mode} */
  public String settingValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
