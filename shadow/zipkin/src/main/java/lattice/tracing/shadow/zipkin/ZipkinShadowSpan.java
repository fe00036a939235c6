/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow.zipkin;

import java.util.Map;
import lattice.tracing.LogEntry;
import lattice.tracing.internal.HexCodec;
import lattice.tracing.shadow.ShadowSpan;
import zipkin2.Span;

/** Accumulates a Zipkin span until it is finished, then reports it. */
final class ZipkinShadowSpan implements ShadowSpan {
  final ZipkinShadowTracer tracer;
  final ZipkinContext context;
  final long startTimestamp;
  final Span.Builder builder; // guarded by this
  boolean finished; // guarded by this

  ZipkinShadowSpan(ZipkinShadowTracer tracer, ZipkinContext context, String operation,
    long startTimestamp) {
    this.tracer = tracer;
    this.context = context;
    this.startTimestamp = startTimestamp;
    builder = Span.newBuilder()
      .traceId(HexCodec.toLowerHex(context.traceId))
      .id(context.spanId)
      .name(operation)
      .timestamp(startTimestamp)
      .localEndpoint(tracer.localEndpoint);
    if (context.parentId != 0L) builder.parentId(context.parentId);
  }

  @Override public Object context() {
    return context;
  }

  @Override public synchronized void tag(String key, String value) {
    builder.putTag(key, value);
  }

  @Override public void baggageItem(String key, String value) {
    // B3 has no baggage
  }

  @Override public synchronized void log(long timestamp, Map<String, String> fields) {
    String event = fields.get(LogEntry.EVENT_FIELD);
    if (fields.size() == 1 && event != null) {
      builder.addAnnotation(timestamp, event);
      return;
    }
    StringBuilder value = new StringBuilder();
    for (Map.Entry<String, String> field : fields.entrySet()) {
      if (value.length() > 0) value.append(' ');
      value.append(field.getKey()).append('=').append(field.getValue());
    }
    builder.addAnnotation(timestamp, value.toString());
  }

  @Override public void finish(long finishTimestamp) {
    Span span;
    synchronized (this) {
      if (finished) return;
      finished = true;
      span = builder.duration(Math.max(finishTimestamp - startTimestamp, 1L)).build();
    }
    tracer.report(span);
  }

  @Override public String toString() {
    return "ZipkinShadowSpan{" + context + "}";
  }
}
