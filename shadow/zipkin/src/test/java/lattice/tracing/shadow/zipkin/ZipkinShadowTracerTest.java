/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow.zipkin;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lattice.tracing.Span;
import lattice.tracing.SpanMeta;
import lattice.tracing.SpanOption;
import lattice.tracing.Tracer;
import lattice.tracing.propagation.MapCarrier;
import lattice.tracing.propagation.PropagationException;
import lattice.tracing.settings.MutableSetting;
import lattice.tracing.settings.TracingSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import zipkin2.Annotation;
import zipkin2.Endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ZipkinShadowTracerTest {
  List<zipkin2.Span> spans = new ArrayList<>();
  Endpoint localEndpoint = Endpoint.newBuilder().serviceName("node1").build();
  ZipkinShadowTracer zipkin = new ZipkinShadowTracer(spans::add, localEndpoint);
  MutableSetting<String> collector = MutableSetting.create("localhost:9411");
  Tracer tracer = Tracer.newBuilder()
    .shadowTracerFactory(ZipkinShadowTracer.TYPE, config -> zipkin)
    .build();

  @BeforeEach void configure() {
    tracer.configure(TracingSettings.newBuilder()
      .shadowTracer(ZipkinShadowTracer.TYPE, collector)
      .build());
  }

  @AfterEach void close() {
    tracer.close();
  }

  @Test void attachedShadowTracerForcesRealSpans() {
    assertThat(tracer.alwaysTrace()).isTrue();
    assertThat(tracer.startSpan("get").isNoop()).isFalse();
  }

  @Test void reportsFinishedSpans() {
    Span span = tracer.startSpan("get", SpanOption.withTags(singletonMap("range", "r12")));
    span.record("evaluated");
    span.finish();

    assertThat(spans).hasSize(1);
    zipkin2.Span reported = spans.get(0);
    assertThat(reported.name()).isEqualTo("get");
    assertThat(reported.localEndpoint()).isEqualTo(localEndpoint);
    assertThat(reported.tags()).containsEntry("range", "r12");
    assertThat(reported.annotations()).extracting(Annotation::value).containsExactly("evaluated");
    assertThat(reported.durationAsLong()).isPositive();
    assertThat(reported.parentId()).isNull();
  }

  @Test void childSharesZipkinTrace() {
    Span parent = tracer.startSpan("parent");
    Span child = tracer.startSpan("child", SpanOption.withParentAndAutoCollection(parent));
    child.finish();
    parent.finish();

    assertThat(spans).hasSize(2);
    zipkin2.Span reportedChild = spans.get(0), reportedParent = spans.get(1);
    assertThat(reportedChild.traceId()).isEqualTo(reportedParent.traceId());
    assertThat(reportedChild.parentId()).isEqualTo(reportedParent.id());
  }

  @Test void structuredLogsBecomeAnnotations() {
    Span span = tracer.startSpan("get");
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("key", "a");
    fields.put("txn", "t1");
    span.logStructured(fields);
    span.finish();

    assertThat(spans.get(0).annotations()).extracting(Annotation::value)
      .containsExactly("key=a txn=t1");
  }

  @Test void propagatesB3FieldsAcrossProcesses() throws PropagationException {
    Span client = tracer.startSpan("client");
    MapCarrier carrier = new MapCarrier(new LinkedHashMap<>());
    tracer.injectMetaInto(client.meta(), carrier);

    assertThat(carrier.map())
      .containsEntry("lattice-tracer-shadowtype", "zipkin")
      .containsKeys("lattice-shadow-X-B3-TraceId", "lattice-shadow-X-B3-SpanId")
      .containsEntry("lattice-shadow-X-B3-Sampled", "1");

    SpanMeta remote = tracer.extractMetaFrom(carrier);
    Span server = tracer.startSpan("server", SpanOption.withParentAndManualCollection(remote));
    server.finish();
    client.finish();

    zipkin2.Span reportedServer = spans.get(0), reportedClient = spans.get(1);
    assertThat(reportedServer.traceId()).isEqualTo(reportedClient.traceId());
    assertThat(reportedServer.parentId()).isEqualTo(reportedClient.id());
  }

  @Test void extract_caseInsensitive() throws PropagationException {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("x-b3-traceid", "463ac35c9f6413ad");
    fields.put("x-b3-spanid", "a2fb4a1d1a96d312");
    fields.put("x-b3-parentspanid", "0020000000000001");

    ZipkinContext context = (ZipkinContext) zipkin.extract(null, fields);
    assertThat(context.traceId()).isEqualTo(0x463ac35c9f6413adL);
    assertThat(context.spanId()).isEqualTo(0xa2fb4a1d1a96d312L);
    assertThat(context.parentId()).isEqualTo(0x20000000000001L);
  }

  @Test void extract_truncates128BitTraceId() throws PropagationException {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("X-B3-TraceId", "463ac35c9f6413ad48485a3953bb6124");
    fields.put("X-B3-SpanId", "a2fb4a1d1a96d312");

    ZipkinContext context = (ZipkinContext) zipkin.extract(null, fields);
    assertThat(context.traceId()).isEqualTo(0x48485a3953bb6124L);
  }

  @Test void extract_missingIds() throws PropagationException {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("X-B3-Sampled", "1");

    assertThat(zipkin.extract(null, fields)).isNull();
  }

  @Test void extract_malformed() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("X-B3-TraceId", "cafebabe-not-hex");
    fields.put("X-B3-SpanId", "a2fb4a1d1a96d312");

    assertThatThrownBy(() -> zipkin.extract(null, fields))
      .isInstanceOf(PropagationException.class)
      .hasMessageContaining("X-B3-TraceId");
  }

  @Test void inject_rejectsForeignContext() {
    assertThatThrownBy(() -> zipkin.inject("foo", null, (k, v) -> {
    })).isInstanceOf(PropagationException.class);
  }

  @Test void clearingCollectorDetachesAndCloses() throws IOException {
    Closeable sender = mock(Closeable.class);
    ZipkinShadowTracer closeable = new ZipkinShadowTracer(spans::add, localEndpoint, sender);
    Tracer tracer = Tracer.newBuilder()
      .shadowTracerFactory(ZipkinShadowTracer.TYPE, config -> closeable)
      .build();
    MutableSetting<String> collector = MutableSetting.create("localhost:9411");
    tracer.configure(TracingSettings.newBuilder()
      .shadowTracer(ZipkinShadowTracer.TYPE, collector)
      .build());
    assertThat(tracer.shadowTracer()).isSameAs(closeable);

    collector.set("");

    assertThat(tracer.shadowTracer()).isNull();
    verify(sender).close();
  }

  static Map<String, String> singletonMap(String key, String value) {
    Map<String, String> result = new LinkedHashMap<>();
    result.put(key, value);
    return result;
  }
}
