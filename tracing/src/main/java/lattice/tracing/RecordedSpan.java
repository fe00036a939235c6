/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lattice.tracing.internal.HexCodec;

/**
 * An immutable copy of one span's state, taken when a {@link Recording} was requested. Recorded
 * spans are also how manually collected recordings travel back to the caller of a remote
 * operation, see {@link Span#importRemoteSpans(List)}.
 */
public final class RecordedSpan {
  /** Tag added to spans that were not yet finished when the recording was taken. */
  public static final String TAG_UNFINISHED = "_unfinished";
  /** Tag added to spans that were recording verbosely when the recording was taken. */
  public static final String TAG_VERBOSE = "_verbose";

  public static Builder newBuilder() {
    return new Builder();
  }

  final long traceId, spanId, parentSpanId, threadId, startTimestamp, duration;
  final String operation;
  final boolean finished;
  final Map<String, String> tags, baggage;
  final List<LogEntry> logs;

  RecordedSpan(Builder builder) {
    traceId = builder.traceId;
    spanId = builder.spanId;
    parentSpanId = builder.parentSpanId;
    threadId = builder.threadId;
    startTimestamp = builder.startTimestamp;
    duration = builder.duration;
    operation = builder.operation;
    finished = builder.finished;
    tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    baggage = Collections.unmodifiableMap(new LinkedHashMap<>(builder.baggage));
    logs = Collections.unmodifiableList(new ArrayList<>(builder.logs));
  }

  public long traceId() {
    return traceId;
  }

  public long spanId() {
    return spanId;
  }

  /** Zero when this span was a root. */
  public long parentSpanId() {
    return parentSpanId;
  }

  public String operation() {
    return operation;
  }

  /** The thread that started the span. Diagnostic only. */
  public long threadId() {
    return threadId;
  }

  /** Epoch microseconds when the span started. */
  public long startTimestamp() {
    return startTimestamp;
  }

  /**
   * Duration in microseconds. When {@link #finished()} is false, this is the time elapsed until
   * the recording was taken.
   */
  public long duration() {
    return duration;
  }

  public boolean finished() {
    return finished;
  }

  public Map<String, String> tags() {
    return tags;
  }

  public Map<String, String> baggage() {
    return baggage;
  }

  public List<LogEntry> logs() {
    return logs;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RecordedSpan)) return false;
    RecordedSpan that = (RecordedSpan) o;
    return traceId == that.traceId
      && spanId == that.spanId
      && parentSpanId == that.parentSpanId
      && threadId == that.threadId
      && startTimestamp == that.startTimestamp
      && duration == that.duration
      && finished == that.finished
      && operation.equals(that.operation)
      && tags.equals(that.tags)
      && baggage.equals(that.baggage)
      && logs.equals(that.logs);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= (int) ((spanId >>> 32) ^ spanId);
    h *= 1000003;
    h ^= operation.hashCode();
    return h;
  }

  @Override public String toString() {
    return "RecordedSpan{"
      + "traceId=" + HexCodec.toLowerHex(traceId)
      + ", spanId=" + HexCodec.toLowerHex(spanId)
      + (parentSpanId != 0L ? ", parentSpanId=" + HexCodec.toLowerHex(parentSpanId) : "")
      + ", operation=" + operation
      + ", duration=" + duration
      + (tags.isEmpty() ? "" : ", tags=" + tags)
      + (baggage.isEmpty() ? "" : ", baggage=" + baggage)
      + (logs.isEmpty() ? "" : ", logs=" + logs.size())
      + "}";
  }

  public static final class Builder {
    long traceId, spanId, parentSpanId, threadId, startTimestamp, duration;
    String operation = "";
    boolean finished;
    final Map<String, String> tags = new LinkedHashMap<>(), baggage = new LinkedHashMap<>();
    final List<LogEntry> logs = new ArrayList<>();

    public Builder traceId(long traceId) {
      this.traceId = traceId;
      return this;
    }

    public Builder spanId(long spanId) {
      this.spanId = spanId;
      return this;
    }

    public Builder parentSpanId(long parentSpanId) {
      this.parentSpanId = parentSpanId;
      return this;
    }

    public Builder operation(String operation) {
      if (operation == null) throw new NullPointerException("operation == null");
      this.operation = operation;
      return this;
    }

    public Builder threadId(long threadId) {
      this.threadId = threadId;
      return this;
    }

    public Builder startTimestamp(long startTimestamp) {
      this.startTimestamp = startTimestamp;
      return this;
    }

    public Builder duration(long duration) {
      this.duration = duration;
      return this;
    }

    public Builder finished(boolean finished) {
      this.finished = finished;
      return this;
    }

    public Builder putTag(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      tags.put(key, value);
      return this;
    }

    public Builder putBaggage(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      baggage.put(key, value);
      return this;
    }

    public Builder addLog(LogEntry log) {
      if (log == null) throw new NullPointerException("log == null");
      logs.add(log);
      return this;
    }

    public RecordedSpan build() {
      if (traceId == 0L) throw new IllegalStateException("traceId == 0");
      if (spanId == 0L) throw new IllegalStateException("spanId == 0");
      return new RecordedSpan(this);
    }

    Builder() {
    }
  }
}
