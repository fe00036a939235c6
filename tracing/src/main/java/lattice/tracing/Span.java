/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.List;
import java.util.Map;
import lattice.tracing.internal.Nullable;

/**
 * Models one logical operation. Spans are started with {@link Tracer#startSpan} and must be
 * {@linkplain #finish() finished} by the caller.
 *
 * <p>Here's a typical example of tracing an operation in the scope of a parent:
 * <pre>{@code
 * StartedSpan child = ContextSpans.childSpan(ctx, "resolve intents");
 * try {
 *   child.span().tag("range", rangeId);
 *   return resolve(child.context());
 * } finally {
 *   child.span().finish();
 * }
 * }</pre>
 *
 * <p>When tracing is not required, the tracer returns a shared no-op span whose mutation methods
 * do nothing. Check {@link #isNoop()} before doing expensive work only needed for tracing.
 *
 * <p>All mutation methods return this span for chaining.
 */
public abstract class Span {
  /**
   * When true, nothing is recorded and {@link #meta()} is {@link SpanMeta#EMPTY}. Both ids are
   * zero.
   */
  public abstract boolean isNoop();

  /** The tracer that started this span. */
  public abstract Tracer tracer();

  /** Nonzero unless this is a no-op span. */
  public abstract long traceId();

  /** Nonzero unless this is a no-op span. */
  public abstract long spanId();

  /** Empty for a no-op span. */
  public abstract String operationName();

  public abstract Span tag(String key, String value);

  /**
   * Sets a baggage item. Baggage is copied into children started after this call and written on
   * the wire by {@link Tracer#injectMetaInto}.
   */
  public abstract Span baggageItem(String key, String value);

  @Nullable public abstract String baggageItem(String key);

  /**
   * Toggles verbose recording. While verbose, {@link #record(String)} messages are kept and
   * children start out verbose as well.
   */
  public abstract Span setVerbose(boolean verbose);

  public abstract boolean isVerbose();

  /** Logs a message, which is kept in the recording only while {@linkplain #isVerbose() verbose}. */
  public abstract Span record(String message);

  /** Like {@link #record(String)}, formatting with {@link String#format(String, Object...)}. */
  public abstract Span recordf(String format, Object... args);

  /** Logs a structured entry. Kept in the recording regardless of verbosity. */
  public abstract Span logStructured(Map<String, String> fields);

  /**
   * Adds spans recorded elsewhere, typically returned by a remote node for a child that was
   * started with {@link SpanOption#withParentAndManualCollection(SpanMeta)}. They appear in
   * {@link #recording()} after this span's own children.
   */
  public abstract Span importRemoteSpans(List<RecordedSpan> spans);

  /**
   * Ends the span. Only the first call has an effect. A span started with {@link
   * SpanOption#withParentAndAutoCollection(Span)} is added to its parent's recording here.
   */
  public abstract void finish();

  /** The identity of this span, for propagation. Valid before and after {@link #finish()}. */
  public abstract SpanMeta meta();

  /** A snapshot of this span and the spans collected into it. Valid at any time. */
  public abstract Recording recording();

  Span() {
  }
}
