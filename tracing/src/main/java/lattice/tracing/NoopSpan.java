/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.List;
import java.util.Map;

final class NoopSpan extends Span {
  final Tracer tracer;

  NoopSpan(Tracer tracer) {
    this.tracer = tracer;
  }

  @Override public boolean isNoop() {
    return true;
  }

  @Override public Tracer tracer() {
    return tracer;
  }

  @Override public long traceId() {
    return 0L;
  }

  @Override public long spanId() {
    return 0L;
  }

  @Override public String operationName() {
    return "";
  }

  @Override public Span tag(String key, String value) {
    return this;
  }

  @Override public Span baggageItem(String key, String value) {
    return this;
  }

  @Override public String baggageItem(String key) {
    return null;
  }

  @Override public Span setVerbose(boolean verbose) {
    return this;
  }

  @Override public boolean isVerbose() {
    return false;
  }

  @Override public Span record(String message) {
    return this;
  }

  @Override public Span recordf(String format, Object... args) {
    return this;
  }

  @Override public Span logStructured(Map<String, String> fields) {
    return this;
  }

  @Override public Span importRemoteSpans(List<RecordedSpan> spans) {
    return this;
  }

  @Override public void finish() {
  }

  @Override public SpanMeta meta() {
    return SpanMeta.EMPTY;
  }

  @Override public Recording recording() {
    return Recording.EMPTY;
  }

  @Override public String toString() {
    return "NoopSpan";
  }
}
