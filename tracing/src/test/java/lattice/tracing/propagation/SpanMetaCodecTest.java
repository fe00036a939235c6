/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import lattice.tracing.RecordingType;
import lattice.tracing.SpanMeta;
import lattice.tracing.shadow.FakeShadowTracer;
import lattice.tracing.shadow.FakeShadowTracer.FakeContext;
import lattice.tracing.shadow.ShadowTracer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpanMetaCodecTest {
  FakeShadowTracer shadow = new FakeShadowTracer("fake");
  SpanMeta meta = SpanMeta.newBuilder()
    .traceId(0x463ac35c9f6413adL)
    .spanId(0xa2fb4a1d1a96d312L)
    .putBaggage("user", "alice")
    .build();
  Map<String, String> map = new LinkedHashMap<>();
  MapCarrier mapCarrier = new MapCarrier(map);

  @Test void inject_mapCarrier() throws PropagationException {
    SpanMetaCodec.inject(meta, mapCarrier, null);

    assertThat(map).containsExactly(
      entry("lattice-tracer-traceid", "463ac35c9f6413ad"),
      entry("lattice-tracer-spanid", "a2fb4a1d1a96d312"),
      entry("lattice-baggage-user", "alice")
    );
  }

  @Test void inject_idsArePadded() throws PropagationException {
    SpanMetaCodec.inject(SpanMeta.newBuilder().traceId(1L).spanId(2L).build(), mapCarrier, null);

    assertThat(map).containsEntry("lattice-tracer-traceid", "0000000000000001");
  }

  @Test void inject_noopWritesNothing() throws PropagationException {
    SpanMetaCodec.inject(SpanMeta.EMPTY, mapCarrier, shadow);

    assertThat(map).isEmpty();
  }

  @Test void inject_unsupportedCarrier() {
    assertThatThrownBy(() -> SpanMetaCodec.inject(meta, new UnknownCarrier(), null))
      .isInstanceOf(PropagationException.class)
      .hasMessageStartingWith("unsupported carrier");
  }

  @Test void roundTrip_mapCarrier() throws PropagationException {
    SpanMetaCodec.inject(meta, mapCarrier, null);

    assertThat(SpanMetaCodec.extract(mapCarrier, null)).isEqualTo(meta);
  }

  @Test void roundTrip_metadataCarrier() throws PropagationException {
    MetadataCarrier carrier = new MetadataCarrier(new LinkedHashMap<>());
    SpanMetaCodec.inject(meta, carrier, null);

    assertThat(SpanMetaCodec.extract(carrier, null)).isEqualTo(meta);
  }

  @Test void roundTrip_verboseMarker() throws PropagationException {
    SpanMeta verbose = meta.toBuilder()
      .putBaggage("sb", "1")
      .recordingType(RecordingType.VERBOSE)
      .build();
    SpanMetaCodec.inject(verbose, mapCarrier, null);

    SpanMeta extracted = SpanMetaCodec.extract(mapCarrier, null);

    assertThat(extracted.recordingType()).isEqualTo(RecordingType.VERBOSE);
    assertThat(extracted).isEqualTo(verbose);
  }

  @Test void roundTrip_shadowOfSameType() throws PropagationException {
    SpanMeta withShadow = meta.toBuilder().shadow("fake", new FakeContext(7L, 8L)).build();
    SpanMetaCodec.inject(withShadow, mapCarrier, shadow);

    assertThat(map)
      .containsEntry("lattice-tracer-shadowtype", "fake")
      .containsEntry("lattice-shadow-trace", "7")
      .containsEntry("lattice-shadow-span", "8");
    assertThat(SpanMetaCodec.extract(mapCarrier, shadow)).isEqualTo(withShadow);
  }

  @Test void inject_dropsShadowOfOtherType() throws PropagationException {
    SpanMeta withShadow = meta.toBuilder().shadow("other", new FakeContext(7L, 8L)).build();
    SpanMetaCodec.inject(withShadow, mapCarrier, shadow);

    assertThat(map.keySet()).noneMatch(key -> key.contains("shadow"));
  }

  @Test void extract_dropsShadowOfOtherType() throws PropagationException {
    map.put("lattice-tracer-traceid", "1");
    map.put("lattice-tracer-spanid", "2");
    map.put("lattice-tracer-shadowtype", "other");
    map.put("lattice-shadow-trace", "7");
    map.put("lattice-shadow-span", "8");

    SpanMeta extracted = SpanMetaCodec.extract(mapCarrier, shadow);

    assertThat(extracted.traceId()).isEqualTo(1L);
    assertThat(extracted.spanId()).isEqualTo(2L);
    assertThat(extracted.shadowTracerType()).isNull();
    assertThat(extracted.shadowContext()).isNull();
  }

  @Test void extract_dropsShadowWithoutShadowTracer() throws PropagationException {
    map.put("lattice-tracer-traceid", "1");
    map.put("lattice-tracer-spanid", "2");
    map.put("lattice-tracer-shadowtype", "fake");

    assertThat(SpanMetaCodec.extract(mapCarrier, null).shadowTracerType()).isNull();
  }

  @Test void extract_caseInsensitiveKeys() throws PropagationException {
    map.put("Lattice-Tracer-TraceId", "463AC35C9F6413AD");
    map.put("LATTICE-TRACER-SPANID", "a2fb4a1d1a96d312");
    map.put("Lattice-Baggage-User", "alice");

    assertThat(SpanMetaCodec.extract(mapCarrier, null)).isEqualTo(meta);
  }

  @Test void extract_lowerCasesBaggageKeys() throws PropagationException {
    SpanMeta mixedCase = SpanMeta.newBuilder().traceId(1L).spanId(2L)
      .putBaggage("UserID", "Alice")
      .build();
    SpanMetaCodec.inject(mixedCase, mapCarrier, null);

    SpanMeta extracted = SpanMetaCodec.extract(mapCarrier, null);

    assertThat(extracted.baggage()).containsExactly(entry("userid", "Alice"));
  }

  @Test void extract_noIdsIsNoop() throws PropagationException {
    map.put("lattice-baggage-user", "alice");
    map.put("content-type", "application/grpc");

    assertThat(SpanMetaCodec.extract(mapCarrier, null)).isSameAs(SpanMeta.EMPTY);
  }

  @Test void extract_malformedId() {
    map.put("lattice-tracer-traceid", "not-hex");
    map.put("lattice-tracer-spanid", "2");

    assertThatThrownBy(() -> SpanMetaCodec.extract(mapCarrier, null))
      .isInstanceOf(PropagationException.class)
      .hasMessage("malformed lattice-tracer-traceid: not-hex")
      .hasCauseInstanceOf(NumberFormatException.class);
  }

  @Test void extract_idTooLong() {
    map.put("lattice-tracer-traceid", "463ac35c9f6413ad463ac35c9f6413ad");
    map.put("lattice-tracer-spanid", "2");

    assertThatThrownBy(() -> SpanMetaCodec.extract(mapCarrier, null))
      .isInstanceOf(PropagationException.class);
  }

  @Test void extract_unsupportedCarrier() {
    assertThatThrownBy(() -> SpanMetaCodec.extract(new UnknownCarrier(), null))
      .isInstanceOf(PropagationException.class);
  }

  @Test void extract_shadowFailureIsPropagated() throws PropagationException {
    ShadowTracer broken = mock(ShadowTracer.class);
    when(broken.type()).thenReturn("fake");
    when(broken.extract(any(), any())).thenThrow(new IllegalStateException("corrupt"));
    map.put("lattice-tracer-traceid", "1");
    map.put("lattice-tracer-spanid", "2");
    map.put("lattice-tracer-shadowtype", "fake");

    assertThatThrownBy(() -> SpanMetaCodec.extract(mapCarrier, broken))
      .isInstanceOf(PropagationException.class)
      .hasRootCauseMessage("corrupt");
  }

  @Test @SuppressWarnings("unchecked")
  void inject_shadowFailureIsPropagated() throws PropagationException {
    ShadowTracer broken = mock(ShadowTracer.class);
    when(broken.type()).thenReturn("fake");
    doThrow(new PropagationException("unsupported format"))
      .when(broken).inject(any(), any(), any(BiConsumer.class));
    SpanMeta withShadow = meta.toBuilder().shadow("fake", new FakeContext(7L, 8L)).build();

    assertThatThrownBy(() -> SpanMetaCodec.inject(withShadow, mapCarrier, broken))
      .isInstanceOf(PropagationException.class)
      .hasMessage("unsupported format");
  }

  @Test void metadataCarrier_lowerCasesAndAppends() throws PropagationException {
    MetadataCarrier carrier = new MetadataCarrier(new LinkedHashMap<>());
    carrier.set("X-Foo", "1");
    carrier.set("x-foo", "2");

    List<String> values = new ArrayList<>();
    carrier.forEach((key, value) -> values.add(key + "=" + value));

    assertThat(values).containsExactly("x-foo=1", "x-foo=2");
  }

  static final class UnknownCarrier implements Carrier {
    @Override public CarrierFormat format() {
      return null;
    }

    @Override public void set(String key, String value) {
      throw new AssertionError();
    }

    @Override public void forEach(EntryVisitor visitor) {
      throw new AssertionError();
    }
  }
}
