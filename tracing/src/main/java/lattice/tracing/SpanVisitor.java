/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

/** Used with {@link Tracer#visitSpans(SpanVisitor)}. */
public interface SpanVisitor {
  /** Returns false to stop visiting further spans. */
  boolean visit(Span span);
}
