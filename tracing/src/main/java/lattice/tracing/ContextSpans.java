/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

/**
 * Helpers that derive spans from the span held by a {@link PropagationContext}.
 *
 * <p>{@link #forkSpan}, {@link #childSpan} and {@link #childSpanRemote} do nothing when the
 * context holds no span: they return the input context and a null span. When a span is returned,
 * the caller must finish it.
 */
public final class ContextSpans {

  /**
   * Starts a span that "follows from" the context's span, for work that may outlive it such as an
   * async task. Its recording is collected into the context's span.
   */
  public static StartedSpan forkSpan(PropagationContext context, String operation) {
    Span span = context.span();
    if (span == null) return new StartedSpan(context, null);
    return span.tracer().startSpanCtx(context, operation,
      SpanOption.withParentAndAutoCollection(span), SpanOption.withFollowsFrom());
  }

  /** Starts a child of the context's span. Its recording is collected into the parent. */
  public static StartedSpan childSpan(PropagationContext context, String operation) {
    Span span = context.span();
    if (span == null) return new StartedSpan(context, null);
    return span.tracer().startSpanCtx(context, operation,
      SpanOption.withParentAndAutoCollection(span));
  }

  /**
   * Like {@link #childSpan}, except the recording is not collected into the parent. The caller
   * returns it explicitly, for example in an RPC response, and the receiver merges it with {@link
   * Span#importRemoteSpans(java.util.List)}.
   */
  public static StartedSpan childSpanRemote(PropagationContext context, String operation) {
    Span span = context.span();
    if (span == null) return new StartedSpan(context, null);
    return span.tracer().startSpanCtx(context, operation,
      SpanOption.withParentAndManualCollection(span.meta()));
  }

  /**
   * Starts a child of the context's span if there is one, otherwise a new root span. Never returns
   * a null span.
   */
  public static StartedSpan ensureChildSpan(PropagationContext context, Tracer tracer,
    String operation, SpanOption... options) {
    if (tracer == null) throw new NullPointerException("tracer == null");
    SpanOption[] allOptions = new SpanOption[options.length + 1];
    allOptions[0] = SpanOption.withParentAndAutoCollection(context.span());
    System.arraycopy(options, 0, allOptions, 1, options.length);
    return tracer.startSpanCtx(context, operation, allOptions);
  }

  /** Like {@link #ensureChildSpan}, forcing a real span that records verbosely. */
  public static StartedSpan startVerboseTrace(PropagationContext context, Tracer tracer,
    String operation) {
    StartedSpan result =
      ensureChildSpan(context, tracer, operation, SpanOption.withForceRealSpan());
    result.span().setVerbose(true);
    return result;
  }

  /**
   * Starts a verbose root span on a private tracer. Read its {@link RecordingSpanScope#recording()
   * recording} before {@linkplain RecordingSpanScope#close() closing} the scope.
   *
   * <pre>{@code
   * try (RecordingSpanScope scope = ContextSpans.contextWithRecordingSpan(ctx, "test")) {
   *   runQuery(scope.context());
   *   assertThat(scope.recording().findLogMessage("scan")).isNotNull();
   * }
   * }</pre>
   */
  public static RecordingSpanScope contextWithRecordingSpan(PropagationContext context,
    String operation) {
    Tracer tracer = Tracer.create();
    StartedSpan started =
      tracer.startSpanCtx(context, operation, SpanOption.withForceRealSpan());
    started.span().setVerbose(true);
    return new RecordingSpanScope(tracer, started.context(), started.span());
  }

  ContextSpans() {
  }
}
