/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow;

import java.util.Map;

/** The backend counterpart of a real span, created by {@link ShadowTracer#startSpan}. */
public interface ShadowSpan {
  Object context();

  void tag(String key, String value);

  void baggageItem(String key, String value);

  void log(long timestamp, Map<String, String> fields);

  /** @param finishTimestamp epoch microseconds */
  void finish(long finishTimestamp);
}
