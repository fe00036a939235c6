/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow.zipkin;

import java.io.Closeable;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import lattice.tracing.ReferenceType;
import lattice.tracing.internal.HexCodec;
import lattice.tracing.internal.Nullable;
import lattice.tracing.internal.Platform;
import lattice.tracing.propagation.CarrierFormat;
import lattice.tracing.propagation.PropagationException;
import lattice.tracing.shadow.ShadowSpan;
import lattice.tracing.shadow.ShadowTracer;
import zipkin2.Endpoint;
import zipkin2.Span;
import zipkin2.reporter.Reporter;

/**
 * Mirrors spans to Zipkin. Shadow fields are written as B3 headers, so that the wire format is
 * understood by other Zipkin-instrumented services.
 *
 * <p>Zipkin has no notion of baggage, so baggage items are not mirrored.
 */
public final class ZipkinShadowTracer implements ShadowTracer {
  public static final String TYPE = "zipkin";

  static final String TRACE_ID = "X-B3-TraceId";
  static final String SPAN_ID = "X-B3-SpanId";
  static final String PARENT_SPAN_ID = "X-B3-ParentSpanId";
  static final String SAMPLED = "X-B3-Sampled";

  final Reporter<Span> reporter;
  final Endpoint localEndpoint;
  final Closeable[] resources;

  /** Reports finished spans to the given reporter, which the caller is responsible for closing. */
  public ZipkinShadowTracer(Reporter<Span> reporter, Endpoint localEndpoint) {
    this(reporter, localEndpoint, new Closeable[0]);
  }

  ZipkinShadowTracer(Reporter<Span> reporter, Endpoint localEndpoint, Closeable... resources) {
    if (reporter == null) throw new NullPointerException("reporter == null");
    if (localEndpoint == null) throw new NullPointerException("localEndpoint == null");
    this.reporter = reporter;
    this.localEndpoint = localEndpoint;
    this.resources = resources;
  }

  @Override public String type() {
    return TYPE;
  }

  @Override public ShadowSpan startSpan(@Nullable Object parentContext,
    ReferenceType referenceType, String operation, long startTimestamp) {
    Platform platform = Platform.get();
    ZipkinContext context;
    if (parentContext instanceof ZipkinContext) {
      ZipkinContext parent = (ZipkinContext) parentContext;
      context = new ZipkinContext(parent.traceId, parent.spanId, platform.nextId());
    } else {
      long id = platform.nextId();
      context = new ZipkinContext(id, 0L, id);
    }
    return new ZipkinShadowSpan(this, context, operation, startTimestamp);
  }

  /** Writes B3 headers. Both carrier formats use the same encoding. */
  @Override public void inject(Object context, CarrierFormat format,
    BiConsumer<String, String> writer) throws PropagationException {
    if (!(context instanceof ZipkinContext)) {
      throw new PropagationException("not a zipkin context: " + context);
    }
    ZipkinContext zipkinContext = (ZipkinContext) context;
    writer.accept(TRACE_ID, HexCodec.toLowerHex(zipkinContext.traceId));
    writer.accept(SPAN_ID, HexCodec.toLowerHex(zipkinContext.spanId));
    if (zipkinContext.parentId != 0L) {
      writer.accept(PARENT_SPAN_ID, HexCodec.toLowerHex(zipkinContext.parentId));
    }
    writer.accept(SAMPLED, "1");
  }

  @Override @Nullable public Object extract(CarrierFormat format, Map<String, String> fields)
    throws PropagationException {
    String traceId = null, spanId = null, parentId = null;
    for (Map.Entry<String, String> field : fields.entrySet()) {
      String key = field.getKey().toLowerCase(Locale.ROOT);
      if (key.equals("x-b3-traceid")) {
        traceId = field.getValue();
      } else if (key.equals("x-b3-spanid")) {
        spanId = field.getValue();
      } else if (key.equals("x-b3-parentspanid")) {
        parentId = field.getValue();
      }
    }
    if (traceId == null || spanId == null) return null;
    // 128-bit trace IDs are truncated to their lower 64 bits
    if (traceId.length() == 32) traceId = traceId.substring(16);
    return new ZipkinContext(parseId(TRACE_ID, traceId),
      parentId != null ? parseId(PARENT_SPAN_ID, parentId) : 0L,
      parseId(SPAN_ID, spanId));
  }

  static long parseId(String key, String value) throws PropagationException {
    try {
      return HexCodec.hexToUnsignedLong(value);
    } catch (NumberFormatException e) {
      throw new PropagationException("malformed " + key + ": " + value, e);
    }
  }

  void report(Span span) {
    reporter.report(span);
  }

  @Override public void close() {
    for (Closeable resource : resources) {
      try {
        resource.close();
      } catch (IOException | RuntimeException e) {
        Platform.get().log("error closing {0}", resource, e);
      }
    }
  }

  @Override public String toString() {
    return "ZipkinShadowTracer{" + reporter + "}";
  }
}
