/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.debug;

/**
 * Receives a lightweight trace per real span while debugging is enabled with the
 * {@code trace.debug.enable} setting.
 */
public interface DebugSink {
  /**
   * @param family groups traces, for example "tracing"
   * @param title usually the operation name
   */
  DebugTrace newTrace(String family, String title);
}
