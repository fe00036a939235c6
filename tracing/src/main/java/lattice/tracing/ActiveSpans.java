/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/** Registry of local root spans that have not yet finished. Used for introspection only. */
final class ActiveSpans {
  final Map<Span, Boolean> spans = new IdentityHashMap<>();

  synchronized void add(Span span) {
    spans.put(span, Boolean.TRUE);
  }

  synchronized void remove(Span span) {
    spans.remove(span);
  }

  /** Returns a copy, so that callers can iterate without holding the lock. */
  synchronized List<Span> snapshot() {
    return new ArrayList<>(spans.keySet());
  }

  synchronized int size() {
    return spans.size();
  }
}
