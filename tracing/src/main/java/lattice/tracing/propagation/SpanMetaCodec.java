/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lattice.tracing.RecordingType;
import lattice.tracing.SpanMeta;
import lattice.tracing.internal.HexCodec;
import lattice.tracing.internal.Nullable;
import lattice.tracing.internal.Platform;
import lattice.tracing.internal.recorder.SpanRecord;
import lattice.tracing.shadow.ShadowTracer;

/**
 * Writes and reads {@link SpanMeta} as carrier entries. All keys are lower case:
 *
 * <ul>
 *   <li>{@value #FIELD_TRACE_ID} and {@value #FIELD_SPAN_ID}: ids as 16 lower-hex digits</li>
 *   <li>{@value #FIELD_SHADOW_TYPE}: the shadow tracer type, when shadow fields follow</li>
 *   <li>{@value #PREFIX_BAGGAGE} + key: one entry per baggage item</li>
 *   <li>{@value #PREFIX_SHADOW} + key: fields written by the shadow tracer</li>
 * </ul>
 *
 * <p>Shadow fields are only written and read when the attached shadow tracer has the same type as
 * the one recorded on the other side. Otherwise they are dropped, while ids and baggage are kept.
 */
public final class SpanMetaCodec {
  public static final String FIELD_TRACE_ID = "lattice-tracer-traceid";
  public static final String FIELD_SPAN_ID = "lattice-tracer-spanid";
  public static final String FIELD_SHADOW_TYPE = "lattice-tracer-shadowtype";
  public static final String PREFIX_BAGGAGE = "lattice-baggage-";
  public static final String PREFIX_SHADOW = "lattice-shadow-";

  /**
   * @param shadowTracer the currently attached shadow tracer, or null
   * @throws PropagationException if the carrier format is unsupported or the shadow tracer fails
   */
  public static void inject(SpanMeta meta, final Carrier carrier,
    @Nullable ShadowTracer shadowTracer) throws PropagationException {
    if (meta == null) throw new NullPointerException("meta == null");
    if (carrier == null) throw new NullPointerException("carrier == null");
    if (meta.isNoop()) return; // extract reads an empty carrier as no tracing

    CarrierFormat format = formatOf(carrier);
    carrier.set(FIELD_TRACE_ID, HexCodec.toLowerHex(meta.traceId()));
    carrier.set(FIELD_SPAN_ID, HexCodec.toLowerHex(meta.spanId()));
    for (Map.Entry<String, String> item : meta.baggage().entrySet()) {
      carrier.set(PREFIX_BAGGAGE + item.getKey(), item.getValue());
    }

    String shadowType = meta.shadowTracerType();
    if (shadowTracer == null || shadowType == null) return;
    if (!shadowType.equals(shadowTracer.type())) {
      Platform.get().log("Not injecting context of shadow tracer {0}", shadowType, null);
      return;
    }
    carrier.set(FIELD_SHADOW_TYPE, shadowType);
    try {
      shadowTracer.inject(meta.shadowContext(), format,
        (key, value) -> carrier.set(PREFIX_SHADOW + key, value));
    } catch (RuntimeException e) {
      throw new PropagationException("shadow tracer " + shadowType + " failed to inject", e);
    }
  }

  /**
   * Returns {@link SpanMeta#EMPTY} when the carrier holds neither id.
   *
   * @param shadowTracer the currently attached shadow tracer, or null
   * @throws PropagationException if the carrier format is unsupported, an id is malformed or the
   * shadow tracer fails
   */
  public static SpanMeta extract(Carrier carrier, @Nullable ShadowTracer shadowTracer)
    throws PropagationException {
    if (carrier == null) throw new NullPointerException("carrier == null");
    CarrierFormat format = formatOf(carrier);

    final SpanMeta.Builder builder = SpanMeta.newBuilder();
    final Map<String, String> shadowFields = new LinkedHashMap<>();
    final String[] shadowType = {null};
    carrier.forEach((key, value) -> {
      String lowerKey = key.toLowerCase(Locale.ROOT);
      if (lowerKey.equals(FIELD_TRACE_ID)) {
        builder.traceId(parseId(lowerKey, value));
      } else if (lowerKey.equals(FIELD_SPAN_ID)) {
        builder.spanId(parseId(lowerKey, value));
      } else if (lowerKey.equals(FIELD_SHADOW_TYPE)) {
        shadowType[0] = value;
      } else if (lowerKey.startsWith(PREFIX_BAGGAGE)) {
        builder.putBaggage(lowerKey.substring(PREFIX_BAGGAGE.length()), value);
      } else if (lowerKey.startsWith(PREFIX_SHADOW)) {
        shadowFields.put(lowerKey.substring(PREFIX_SHADOW.length()), value);
      }
    });

    SpanMeta ids = builder.build();
    if (ids.isNoop()) return SpanMeta.EMPTY;

    String verbose = ids.baggage().get(SpanRecord.VERBOSE_BAGGAGE_KEY);
    if (verbose != null && !verbose.isEmpty()) builder.recordingType(RecordingType.VERBOSE);

    if (shadowType[0] != null && !shadowType[0].isEmpty()) {
      if (shadowTracer == null || !shadowType[0].equals(shadowTracer.type())) {
        Platform.get().log("Dropping context of shadow tracer {0}", shadowType[0], null);
      } else {
        Object shadowContext;
        try {
          shadowContext = shadowTracer.extract(format, shadowFields);
        } catch (RuntimeException e) {
          throw new PropagationException(
            "shadow tracer " + shadowType[0] + " failed to extract", e);
        }
        if (shadowContext != null) builder.shadow(shadowType[0], shadowContext);
      }
    }
    return builder.build();
  }

  static CarrierFormat formatOf(Carrier carrier) throws PropagationException {
    CarrierFormat format = carrier.format();
    if (format == null) {
      throw new PropagationException("unsupported carrier: " + carrier.getClass().getName());
    }
    return format;
  }

  static long parseId(String key, String value) throws PropagationException {
    try {
      return HexCodec.hexToUnsignedLong(value);
    } catch (NumberFormatException e) {
      throw new PropagationException("malformed " + key + ": " + value, e);
    }
  }

  SpanMetaCodec() {
  }
}
