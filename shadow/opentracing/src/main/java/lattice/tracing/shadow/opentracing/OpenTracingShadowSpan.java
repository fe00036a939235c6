/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow.opentracing;

import io.opentracing.Span;
import java.util.Map;
import lattice.tracing.shadow.ShadowSpan;

final class OpenTracingShadowSpan implements ShadowSpan {
  final Span delegate;

  OpenTracingShadowSpan(Span delegate) {
    this.delegate = delegate;
  }

  @Override public Object context() {
    return delegate.context();
  }

  @Override public void tag(String key, String value) {
    delegate.setTag(key, value);
  }

  @Override public void baggageItem(String key, String value) {
    delegate.setBaggageItem(key, value);
  }

  @Override public void log(long timestamp, Map<String, String> fields) {
    delegate.log(timestamp, fields);
  }

  @Override public void finish(long finishTimestamp) {
    delegate.finish(finishTimestamp);
  }

  @Override public String toString() {
    return "OpenTracingShadowSpan{" + delegate + "}";
  }
}
