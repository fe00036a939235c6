/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow.opentracing;

import io.opentracing.References;
import io.opentracing.SpanContext;
import io.opentracing.Tracer.SpanBuilder;
import io.opentracing.propagation.Format;
import io.opentracing.propagation.TextMap;
import io.opentracing.propagation.TextMapAdapter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import lattice.tracing.ReferenceType;
import lattice.tracing.internal.Nullable;
import lattice.tracing.propagation.CarrierFormat;
import lattice.tracing.propagation.PropagationException;
import lattice.tracing.shadow.ShadowSpan;
import lattice.tracing.shadow.ShadowTracer;
import lattice.tracing.shadow.ShadowTracerFactory;

/**
 * Mirrors spans into any OpenTracing tracer, such as a LightStep tracer. Shadow contexts are the
 * OpenTracing tracer's {@link SpanContext}s.
 *
 * <p>Spans are started with {@link SpanBuilder#ignoreActiveSpan()}: parentage only follows the
 * tracer's own spans, never the OpenTracing scope manager.
 */
public final class OpenTracingShadowTracer implements ShadowTracer {

  /**
   * Returns a factory that builds the OpenTracing tracer from the configuration string, such as
   * an access token.
   */
  public static ShadowTracerFactory newFactory(final String type,
    final Function<String, io.opentracing.Tracer> tracerFunction) {
    if (type == null) throw new NullPointerException("type == null");
    if (tracerFunction == null) throw new NullPointerException("tracerFunction == null");
    return new ShadowTracerFactory() {
      @Override public ShadowTracer create(String config) {
        return new OpenTracingShadowTracer(type, tracerFunction.apply(config));
      }

      @Override public String toString() {
        return "OpenTracingShadowTracerFactory{" + type + "}";
      }
    };
  }

  final String type;
  final io.opentracing.Tracer delegate;

  public OpenTracingShadowTracer(String type, io.opentracing.Tracer delegate) {
    if (type == null || type.isEmpty()) throw new IllegalArgumentException("type is empty");
    if (delegate == null) throw new NullPointerException("delegate == null");
    this.type = type;
    this.delegate = delegate;
  }

  @Override public String type() {
    return type;
  }

  @Override public ShadowSpan startSpan(@Nullable Object parentContext,
    ReferenceType referenceType, String operation, long startTimestamp) {
    SpanBuilder builder = delegate.buildSpan(operation)
      .withStartTimestamp(startTimestamp)
      .ignoreActiveSpan();
    if (parentContext instanceof SpanContext) {
      builder.addReference(referenceType == ReferenceType.FOLLOWS_FROM
        ? References.FOLLOWS_FROM
        : References.CHILD_OF, (SpanContext) parentContext);
    }
    return new OpenTracingShadowSpan(builder.start());
  }

  @Override public void inject(Object context, CarrierFormat format,
    BiConsumer<String, String> writer) throws PropagationException {
    if (!(context instanceof SpanContext)) {
      throw new PropagationException("not an OpenTracing context: " + context);
    }
    Map<String, String> fields = new LinkedHashMap<>();
    try {
      delegate.inject((SpanContext) context, formatOf(format), new TextMapAdapter(fields));
    } catch (RuntimeException e) {
      throw new PropagationException(type + " failed to inject", e);
    }
    for (Map.Entry<String, String> field : fields.entrySet()) {
      writer.accept(field.getKey(), field.getValue());
    }
  }

  @Override @Nullable public Object extract(CarrierFormat format, Map<String, String> fields)
    throws PropagationException {
    try {
      return delegate.extract(formatOf(format), new TextMapAdapter(fields));
    } catch (RuntimeException e) {
      throw new PropagationException(type + " failed to extract", e);
    }
  }

  static Format<TextMap> formatOf(CarrierFormat format) {
    return format == CarrierFormat.HTTP_HEADERS
      ? Format.Builtin.HTTP_HEADERS
      : Format.Builtin.TEXT_MAP;
  }

  @Override public void close() {
    delegate.close();
  }

  @Override public String toString() {
    return "OpenTracingShadowTracer{type=" + type + ", delegate=" + delegate + "}";
  }
}
