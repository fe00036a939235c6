/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.io.Closeable;

/** Returned by {@link ContextSpans#contextWithRecordingSpan}. */
public final class RecordingSpanScope implements Closeable {
  final Tracer tracer;
  final PropagationContext context;
  final Span span;

  RecordingSpanScope(Tracer tracer, PropagationContext context, Span span) {
    this.tracer = tracer;
    this.context = context;
    this.span = span;
  }

  public PropagationContext context() {
    return context;
  }

  public Span span() {
    return span;
  }

  public Recording recording() {
    return span.recording();
  }

  /** Stops verbose recording, finishes the span and closes the private tracer. */
  @Override public void close() {
    span.setVerbose(false);
    span.finish();
    tracer.close();
  }

  @Override public String toString() {
    return "RecordingSpanScope{span=" + span + "}";
  }
}
