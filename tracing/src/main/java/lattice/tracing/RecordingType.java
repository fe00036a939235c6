/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

/** Whether a span keeps free-form log messages in addition to tags and structured entries. */
public enum RecordingType {
  /** Only tags, baggage and structured entries are kept. */
  OFF,
  /**
   * Everything is kept, including messages passed to {@link Span#record(String)}. Verbosity is
   * inherited by local children and carried to remote children as baggage.
   */
  VERBOSE
}
