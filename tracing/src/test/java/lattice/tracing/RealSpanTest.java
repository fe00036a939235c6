/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lattice.tracing.shadow.FakeShadowTracer;
import lattice.tracing.shadow.ShadowSpan;
import lattice.tracing.shadow.ShadowTracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static lattice.tracing.SpanOption.withForceRealSpan;
import static lattice.tracing.SpanOption.withParentAndAutoCollection;
import static lattice.tracing.SpanOption.withParentAndManualCollection;
import static lattice.tracing.SpanOption.withRecording;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RealSpanTest {
  Tracer tracer = Tracer.newBuilder().maxLogsPerSpan(3).maxChildrenPerSpan(2).build();
  Span span = tracer.startSpan("get", withRecording(RecordingType.VERBOSE));

  @AfterEach void close() {
    tracer.close();
  }

  @Test void finish_idempotent() {
    ShadowTracer shadow = mock(ShadowTracer.class);
    ShadowSpan shadowSpan = mock(ShadowSpan.class);
    when(shadow.type()).thenReturn("mock");
    when(shadow.startSpan(any(), any(), anyString(), anyLong())).thenReturn(shadowSpan);
    tracer.setShadowTracer(shadow);
    Span span = tracer.startSpan("get");

    span.finish();
    RecordedSpan first = span.recording().spans().get(0);
    span.finish();
    RecordedSpan second = span.recording().spans().get(0);

    assertThat(first.finished()).isTrue();
    assertThat(second.duration()).isEqualTo(first.duration());
    verify(shadowSpan, times(1)).finish(anyLong());
  }

  @Test void finish_removesFromRegistry() {
    assertThat(tracer.activeSpans.snapshot()).containsExactly(span);

    span.finish();

    assertThat(tracer.activeSpans.size()).isZero();
  }

  @Test void recording_beforeFinish() {
    RecordedSpan recorded = span.recording().spans().get(0);

    assertThat(recorded.finished()).isFalse();
    assertThat(recorded.duration()).isNotNegative();
    assertThat(recorded.tags())
      .containsEntry(RecordedSpan.TAG_UNFINISHED, "1")
      .containsEntry(RecordedSpan.TAG_VERBOSE, "1");
  }

  @Test void recording_afterFinish() {
    span.setVerbose(false);
    span.finish();
    RecordedSpan recorded = span.recording().spans().get(0);

    assertThat(recorded.finished()).isTrue();
    assertThat(recorded.tags())
      .doesNotContainKey(RecordedSpan.TAG_UNFINISHED)
      .doesNotContainKey(RecordedSpan.TAG_VERBOSE);
  }

  @Test void recording_isASnapshot() {
    Recording recording = span.recording();
    span.tag("late", "1");

    assertThat(recording.spans().get(0).tags()).doesNotContainKey("late");
  }

  @Test void record_onlyKeptWhileVerbose() {
    span.record("kept");
    span.setVerbose(false);
    span.record("dropped");
    span.recordf("dropped %s", "too");

    assertThat(span.recording().spans().get(0).logs())
      .extracting(LogEntry::message)
      .containsExactly("kept");
  }

  @Test void recordf_formats() {
    span.recordf("%d intents in %s", 3, "r1");

    assertThat(span.recording().findLogMessage("3 intents in r1")).isNotNull();
  }

  @Test void logStructured_keptRegardlessOfVerbosity() {
    Span span = tracer.startSpan("get", withForceRealSpan());
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("key", "a");
    span.logStructured(fields);

    assertThat(span.recording().spans().get(0).logs())
      .extracting(LogEntry::fields)
      .containsExactly(fields);
  }

  @Test void logs_dropOldestPastMaximum() {
    for (int i = 0; i < 5; i++) span.record("message " + i);

    assertThat(span.recording().spans().get(0).logs())
      .extracting(LogEntry::message)
      .containsExactly("message 2", "message 3", "message 4");
  }

  @Test void setVerbose_togglesBaggageMarker() {
    assertThat(span.baggageItem("sb")).isEqualTo("1");
    assertThat(span.meta().recordingType()).isEqualTo(RecordingType.VERBOSE);

    span.setVerbose(false);

    assertThat(span.isVerbose()).isFalse();
    assertThat(span.baggageItem("sb")).isNull();
    assertThat(span.meta().recordingType()).isEqualTo(RecordingType.OFF);
  }

  @Test void autoCollectedChild_inParentRecordingAfterFinish() {
    Span child = tracer.startSpan("child", withParentAndAutoCollection(span));

    assertThat(span.recording().findSpan("child")).isNull();

    child.finish();
    span.finish();

    assertThat(span.recording().spans())
      .extracting(RecordedSpan::operation)
      .containsExactly("get", "child");
  }

  @Test void manuallyCollectedChild_notInParentRecordingUntilImported() {
    Span child = tracer.startSpan("remote child", withParentAndManualCollection(span.meta()));
    child.record("on the other node");
    child.finish();
    span.finish();

    assertThat(span.recording().findSpan("remote child")).isNull();

    span.importRemoteSpans(child.recording().spans());

    assertThat(span.recording().findSpan("remote child").parentSpanId())
      .isEqualTo(span.spanId());
    assertThat(span.recording().findLogMessage("other node")).isNotNull();
  }

  @Test void recording_depthFirstOrder() {
    Span child1 = tracer.startSpan("child1", withParentAndAutoCollection(span));
    Span grandchild = tracer.startSpan("grandchild", withParentAndAutoCollection(child1));
    Span child2 = tracer.startSpan("child2", withParentAndAutoCollection(span));
    grandchild.finish();
    child1.finish();
    child2.finish();
    span.importRemoteSpans(Arrays.asList(RecordedSpan.newBuilder()
      .traceId(span.traceId()).spanId(99L).parentSpanId(span.spanId())
      .operation("remote").build()));

    List<RecordedSpan> spans = span.recording().spans();

    assertThat(spans).extracting(RecordedSpan::operation)
      .containsExactly("get", "child1", "grandchild", "child2", "remote");
  }

  @Test void children_pastMaximumAreNotCollected() {
    for (int i = 0; i < 3; i++) {
      tracer.startSpan("child" + i, withParentAndAutoCollection(span)).finish();
    }

    assertThat(span.recording().spans()).extracting(RecordedSpan::operation)
      .containsExactly("get", "child0", "child1");
  }

  @Test void meta_exportsIdentity() {
    span.baggageItem("user", "alice");

    SpanMeta meta = span.meta();

    assertThat(meta.traceId()).isEqualTo(span.traceId());
    assertThat(meta.spanId()).isEqualTo(span.spanId());
    assertThat(meta.baggage()).containsEntry("user", "alice");
    assertThat(meta.shadowTracerType()).isNull();
    assertThat(meta.isNoop()).isFalse();
  }

  @Test void meta_includesShadowContext() {
    tracer.setShadowTracer(new FakeShadowTracer("fake"));
    Span span = tracer.startSpan("get");

    SpanMeta meta = span.meta();

    assertThat(meta.shadowTracerType()).isEqualTo("fake");
    assertThat(meta.shadowContext()).isInstanceOf(FakeShadowTracer.FakeContext.class);
  }

  @Test void mutations_mirroredToShadowSpan() {
    FakeShadowTracer shadow = new FakeShadowTracer("fake");
    tracer.setShadowTracer(shadow);
    Span span = tracer.startSpan("get");

    span.tag("key", "a");
    span.baggageItem("user", "alice");
    span.record("not verbose, but mirrored");
    span.finish();

    FakeShadowTracer.FakeShadowSpan shadowSpan = shadow.finishedSpans().get(0);
    assertThat(shadowSpan.tags).containsEntry("key", "a");
    assertThat(shadowSpan.baggage).containsEntry("user", "alice");
    assertThat(shadowSpan.logs).hasSize(1);
    assertThat(shadowSpan.finishTimestamp).isGreaterThanOrEqualTo(shadowSpan.startTimestamp);
  }

  @Test void timestamps_childrenUseParentClock() {
    Span child = tracer.startSpan("child", withParentAndAutoCollection(span));
    child.finish();
    span.finish();

    List<RecordedSpan> spans = span.recording().spans();
    RecordedSpan parent = spans.get(0), recordedChild = spans.get(1);
    assertThat(recordedChild.startTimestamp()).isGreaterThanOrEqualTo(parent.startTimestamp());
  }

  @Test void concurrentMutation_keepsCaps() throws Exception {
    int threads = 8, iterations = 200;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        String key = "thread" + i;
        futures.add(executor.submit(() -> {
          start.await();
          for (int j = 0; j < iterations; j++) {
            span.tag(key, Integer.toString(j));
            span.record(key + " iteration " + j);
            tracer.startSpan("child", withParentAndAutoCollection(span)).finish();
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) future.get(30, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    RealSpan real = (RealSpan) span;
    assertThat(real.record.logCount()).isEqualTo(3);
    assertThat(real.record.childCount()).isEqualTo(2);

    List<RecordedSpan> spans = span.recording().spans();
    assertThat(spans).hasSize(3);
    for (int i = 0; i < threads; i++) {
      assertThat(spans.get(0).tags())
        .containsEntry("thread" + i, Integer.toString(iterations - 1));
    }
    assertThat(spans.get(0).logs()).hasSize(3);
  }
}
