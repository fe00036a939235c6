/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.LinkedHashMap;
import java.util.Map;
import lattice.tracing.internal.Nullable;

/** Accumulates {@link SpanOption}s for one call to start a span. Not thread-safe. */
final class SpanOptions {
  static SpanOptions of(SpanOption... options) {
    SpanOptions result = new SpanOptions();
    for (SpanOption option : options) {
      if (option == null) throw new NullPointerException("option == null");
      option.apply(result);
    }
    if (result.localParentOption && result.parent != null
      && result.remoteParentOption && result.remoteParent != null) {
      throw new IllegalArgumentException("can't specify both parent and remote parent");
    }
    return result;
  }

  boolean localParentOption, remoteParentOption;
  @Nullable Span parent;
  @Nullable SpanMeta remoteParent;
  boolean forceRealSpan, bypassRegistry;
  @Nullable RecordingType recordingType;
  final Map<String, String> tags = new LinkedHashMap<>();
  @Nullable LogTags logTags;
  ReferenceType referenceType = ReferenceType.CHILD_OF;

  /** The local parent if it is real, else null. */
  @Nullable RealSpan localParent() {
    return parent instanceof RealSpan ? (RealSpan) parent : null;
  }

  /** The remote parent unless absent or no-op. */
  @Nullable SpanMeta remoteParent() {
    return remoteParent != null && !remoteParent.isNoop() ? remoteParent : null;
  }

  /**
   * An explicit recording type wins. Otherwise a local parent's type is inherited over a remote
   * parent's.
   */
  RecordingType recordingType() {
    if (recordingType != null) return recordingType;
    RealSpan localParent = localParent();
    if (localParent != null) return localParent.record.recordingType();
    SpanMeta remoteParent = remoteParent();
    if (remoteParent != null) return remoteParent.recordingType();
    return RecordingType.OFF;
  }

  long parentTraceId() {
    RealSpan localParent = localParent();
    if (localParent != null) return localParent.traceId();
    SpanMeta remoteParent = remoteParent();
    return remoteParent != null ? remoteParent.traceId() : 0L;
  }

  long parentSpanId() {
    RealSpan localParent = localParent();
    if (localParent != null) return localParent.spanId();
    SpanMeta remoteParent = remoteParent();
    return remoteParent != null ? remoteParent.spanId() : 0L;
  }

  /** The shadow tracer type the parent was created with, or null. */
  @Nullable String parentShadowTracerType() {
    RealSpan localParent = localParent();
    if (localParent != null) {
      return localParent.shadowTracer != null ? localParent.shadowTracer.type() : null;
    }
    SpanMeta remoteParent = remoteParent();
    return remoteParent != null ? remoteParent.shadowTracerType() : null;
  }

  /** The context of the parent's shadow span, or null. */
  @Nullable Object parentShadowContext() {
    RealSpan localParent = localParent();
    if (localParent != null) {
      return localParent.shadowSpan != null ? localParent.shadowSpan.context() : null;
    }
    SpanMeta remoteParent = remoteParent();
    return remoteParent != null ? remoteParent.shadowContext() : null;
  }

  @Override public String toString() {
    return "SpanOptions{parent=" + parent + ", remoteParent=" + remoteParent
      + ", recordingType=" + recordingType + ", forceRealSpan=" + forceRealSpan
      + ", referenceType=" + referenceType + "}";
  }
}
