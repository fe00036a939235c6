/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.debug;

/** Events of one span as shown by the debug sink. */
public interface DebugTrace {
  /** Older events are discarded past this count. */
  void setMaxEvents(int maxEvents);

  void printf(String format, Object... args);

  void finish();
}
