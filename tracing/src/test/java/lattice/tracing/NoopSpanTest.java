/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.Collections;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NoopSpanTest {
  Tracer tracer = Tracer.create();
  Span span = tracer.startSpan("get");

  @Test void isNoop() {
    assertThat(span).isInstanceOf(NoopSpan.class);
    assertThat(span.isNoop()).isTrue();
    assertThat(span.operationName()).isEmpty();
  }

  @Test void mutationsReturnSameInstance() {
    assertThat(span.tag("key", "a")).isSameAs(span);
    assertThat(span.baggageItem("user", "alice")).isSameAs(span);
    assertThat(span.setVerbose(true)).isSameAs(span);
    assertThat(span.record("message")).isSameAs(span);
    assertThat(span.recordf("%s", "message")).isSameAs(span);
    assertThat(span.logStructured(Collections.singletonMap("key", "a"))).isSameAs(span);
    assertThat(span.importRemoteSpans(Collections.<RecordedSpan>emptyList())).isSameAs(span);
  }

  @Test void mutationsHaveNoEffect() {
    span.baggageItem("user", "alice");
    span.setVerbose(true);
    span.finish();

    assertThat(span.baggageItem("user")).isNull();
    assertThat(span.isVerbose()).isFalse();
    assertThat(span.meta()).isSameAs(SpanMeta.EMPTY);
    assertThat(span.recording()).isSameAs(Recording.EMPTY);
  }

  @Test void tracer() {
    assertThat(span.tracer()).isSameAs(tracer);
  }
}
