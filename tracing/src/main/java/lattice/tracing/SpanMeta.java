/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lattice.tracing.internal.HexCodec;
import lattice.tracing.internal.Nullable;

/**
 * The serializable identity of a span: what crosses a process boundary. Produced either from a
 * live span via {@link Span#meta()}, or decoded from a carrier via {@link
 * Tracer#extractMetaFrom(lattice.tracing.propagation.Carrier)}.
 *
 * <p>A meta with both ids zero, such as {@link #EMPTY}, means no tracing is in effect.
 */
public final class SpanMeta {
  public static final SpanMeta EMPTY = new Builder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  final long traceId, spanId;
  final Map<String, String> baggage;
  final RecordingType recordingType;
  @Nullable final String shadowTracerType;
  @Nullable final Object shadowContext;

  SpanMeta(Builder builder) {
    traceId = builder.traceId;
    spanId = builder.spanId;
    baggage = builder.baggage.isEmpty()
      ? Collections.<String, String>emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(builder.baggage));
    recordingType = builder.recordingType;
    shadowTracerType = builder.shadowTracerType;
    shadowContext = builder.shadowContext;
  }

  public long traceId() {
    return traceId;
  }

  public long spanId() {
    return spanId;
  }

  /** Unmodifiable copy of the baggage at the time this meta was created. */
  public Map<String, String> baggage() {
    return baggage;
  }

  public RecordingType recordingType() {
    return recordingType;
  }

  /** The type of shadow tracer that produced {@link #shadowContext()}, or null. */
  @Nullable public String shadowTracerType() {
    return shadowTracerType;
  }

  /** Opaque to this library. Only the shadow tracer of {@link #shadowTracerType()} reads it. */
  @Nullable public Object shadowContext() {
    return shadowContext;
  }

  /** True when this meta carries no trace. */
  public boolean isNoop() {
    return traceId == 0L && spanId == 0L;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanMeta)) return false;
    SpanMeta that = (SpanMeta) o;
    return traceId == that.traceId
      && spanId == that.spanId
      && baggage.equals(that.baggage)
      && recordingType == that.recordingType
      && equal(shadowTracerType, that.shadowTracerType)
      && equal(shadowContext, that.shadowContext);
  }

  static boolean equal(@Nullable Object a, @Nullable Object b) {
    return a == null ? b == null : a.equals(b);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= (int) ((spanId >>> 32) ^ spanId);
    h *= 1000003;
    h ^= baggage.hashCode();
    h *= 1000003;
    h ^= recordingType.hashCode();
    return h;
  }

  @Override public String toString() {
    if (isNoop()) return "SpanMeta{noop}";
    return "SpanMeta{"
      + "traceId=" + HexCodec.toLowerHex(traceId)
      + ", spanId=" + HexCodec.toLowerHex(spanId)
      + (baggage.isEmpty() ? "" : ", baggage=" + baggage)
      + (recordingType == RecordingType.OFF ? "" : ", recordingType=" + recordingType)
      + (shadowTracerType == null ? "" : ", shadowTracerType=" + shadowTracerType)
      + "}";
  }

  public static final class Builder {
    long traceId, spanId;
    final Map<String, String> baggage = new LinkedHashMap<>();
    RecordingType recordingType = RecordingType.OFF;
    String shadowTracerType;
    Object shadowContext;

    Builder() {
    }

    Builder(SpanMeta source) {
      traceId = source.traceId;
      spanId = source.spanId;
      baggage.putAll(source.baggage);
      recordingType = source.recordingType;
      shadowTracerType = source.shadowTracerType;
      shadowContext = source.shadowContext;
    }

    public Builder traceId(long traceId) {
      this.traceId = traceId;
      return this;
    }

    public Builder spanId(long spanId) {
      this.spanId = spanId;
      return this;
    }

    public Builder putBaggage(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      baggage.put(key, value);
      return this;
    }

    public Builder recordingType(RecordingType recordingType) {
      if (recordingType == null) throw new NullPointerException("recordingType == null");
      this.recordingType = recordingType;
      return this;
    }

    /** Sets both shadow fields. Pass null for both to clear them. */
    public Builder shadow(@Nullable String shadowTracerType, @Nullable Object shadowContext) {
      if ((shadowTracerType == null) != (shadowContext == null)) {
        throw new IllegalArgumentException("shadowTracerType and shadowContext must both be set");
      }
      this.shadowTracerType = shadowTracerType;
      this.shadowContext = shadowContext;
      return this;
    }

    public SpanMeta build() {
      return new SpanMeta(this);
    }
  }
}
