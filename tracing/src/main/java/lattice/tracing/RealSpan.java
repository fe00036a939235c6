/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lattice.tracing.debug.DebugTrace;
import lattice.tracing.internal.HexCodec;
import lattice.tracing.internal.Nullable;
import lattice.tracing.internal.Platform;
import lattice.tracing.internal.recorder.SpanRecord;
import lattice.tracing.shadow.ShadowSpan;
import lattice.tracing.shadow.ShadowTracer;

/**
 * This wraps the public api and guards access to a span record. Changes are mirrored into the
 * shadow span and debug trace, if any, outside the record's lock. Backend failures are logged and
 * otherwise ignored.
 */
final class RealSpan extends Span {
  final Tracer tracer;
  final SpanRecord record;
  @Nullable final RealSpan parent; // only set when this span's recording is collected into it
  @Nullable final ShadowTracer shadowTracer;
  @Nullable final ShadowSpan shadowSpan;
  @Nullable final DebugTrace debugTrace;
  final boolean registered;

  RealSpan(Tracer tracer, SpanRecord record, @Nullable RealSpan parent,
    @Nullable ShadowTracer shadowTracer, @Nullable ShadowSpan shadowSpan,
    @Nullable DebugTrace debugTrace, boolean registered) {
    this.tracer = tracer;
    this.record = record;
    this.parent = parent;
    this.shadowTracer = shadowTracer;
    this.shadowSpan = shadowSpan;
    this.debugTrace = debugTrace;
    this.registered = registered;
  }

  @Override public boolean isNoop() {
    return false;
  }

  @Override public Tracer tracer() {
    return tracer;
  }

  @Override public long traceId() {
    return record.traceId();
  }

  @Override public long spanId() {
    return record.spanId();
  }

  @Override public String operationName() {
    return record.operation();
  }

  @Override public Span tag(String key, String value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) throw new NullPointerException("value of " + key + " == null");
    record.tag(key, value);
    if (shadowSpan != null) {
      try {
        shadowSpan.tag(key, value);
      } catch (RuntimeException e) {
        Platform.get().log("error tagging shadow span {0}", this, e);
      }
    }
    if (debugTrace != null) debugPrintf("%s:%s", key, value);
    return this;
  }

  @Override public Span baggageItem(String key, String value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) throw new NullPointerException("value of " + key + " == null");
    record.baggageItem(key, value);
    if (shadowSpan != null) {
      try {
        shadowSpan.baggageItem(key, value);
      } catch (RuntimeException e) {
        Platform.get().log("error setting baggage on shadow span {0}", this, e);
      }
    }
    return this;
  }

  @Override public String baggageItem(String key) {
    return record.baggageItem(key);
  }

  @Override public Span setVerbose(boolean verbose) {
    record.setVerbose(verbose);
    return this;
  }

  @Override public boolean isVerbose() {
    return record.isVerbose();
  }

  @Override public Span record(String message) {
    if (message == null) throw new NullPointerException("message == null");
    long timestamp = record.clock().currentTimeMicroseconds();
    if (record.isVerbose()) record.log(LogEntry.message(timestamp, message));
    mirrorLog(timestamp, Collections.singletonMap(LogEntry.EVENT_FIELD, message));
    return this;
  }

  @Override public Span recordf(String format, Object... args) {
    if (format == null) throw new NullPointerException("format == null");
    if (!record.isVerbose() && shadowSpan == null && debugTrace == null) return this;
    return record(String.format(format, args));
  }

  @Override public Span logStructured(Map<String, String> fields) {
    if (fields == null) throw new NullPointerException("fields == null");
    long timestamp = record.clock().currentTimeMicroseconds();
    LogEntry entry = LogEntry.structured(timestamp, fields);
    record.log(entry);
    mirrorLog(timestamp, entry.fields());
    return this;
  }

  void mirrorLog(long timestamp, Map<String, String> fields) {
    if (shadowSpan != null) {
      try {
        shadowSpan.log(timestamp, fields);
      } catch (RuntimeException e) {
        Platform.get().log("error logging to shadow span {0}", this, e);
      }
    }
    if (debugTrace != null) {
      StringBuilder message = new StringBuilder();
      for (Map.Entry<String, String> field : fields.entrySet()) {
        if (message.length() > 0) message.append(' ');
        message.append(field.getKey()).append(':').append(field.getValue());
      }
      debugPrintf("%s", message);
    }
  }

  void debugPrintf(String format, Object... args) {
    try {
      debugTrace.printf(format, args);
    } catch (RuntimeException e) {
      Platform.get().log("error writing debug trace of {0}", this, e);
    }
  }

  @Override public Span importRemoteSpans(List<RecordedSpan> spans) {
    if (spans == null) throw new NullPointerException("spans == null");
    record.importRemoteSpans(spans);
    return this;
  }

  @Override public void finish() {
    if (!record.finish()) return;
    if (registered) tracer.activeSpans.remove(this);
    if (parent != null) parent.record.addChild(record); // false when the child cap is reached
    if (shadowSpan != null) {
      try {
        shadowSpan.finish(record.finishTimestamp());
      } catch (RuntimeException e) {
        Platform.get().log("error finishing shadow span {0}", this, e);
      }
    }
    if (debugTrace != null) {
      try {
        debugTrace.finish();
      } catch (RuntimeException e) {
        Platform.get().log("error finishing debug trace of {0}", this, e);
      }
    }
  }

  @Override public SpanMeta meta() {
    SpanMeta.Builder builder = SpanMeta.newBuilder()
      .traceId(record.traceId())
      .spanId(record.spanId())
      .recordingType(record.recordingType());
    for (Map.Entry<String, String> item : record.baggage().entrySet()) {
      builder.putBaggage(item.getKey(), item.getValue());
    }
    if (shadowSpan != null) {
      try {
        Object shadowContext = shadowSpan.context();
        if (shadowContext != null) builder.shadow(shadowTracer.type(), shadowContext);
      } catch (RuntimeException e) {
        Platform.get().log("error reading context of shadow span {0}", this, e);
      }
    }
    return builder.build();
  }

  @Override public Recording recording() {
    List<RecordedSpan> result = new ArrayList<>();
    record.collect(result);
    return Recording.create(result);
  }

  /** Returns a copy of the baggage, for children to start with. */
  Map<String, String> baggageSnapshot() {
    return record.baggage();
  }

  @Override public String toString() {
    return "RealSpan{"
      + "traceId=" + HexCodec.toLowerHex(record.traceId())
      + ", spanId=" + HexCodec.toLowerHex(record.spanId())
      + ", operation=" + record.operation()
      + "}";
  }
}
