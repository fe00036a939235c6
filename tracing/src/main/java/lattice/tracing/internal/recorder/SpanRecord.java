/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.internal.recorder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lattice.tracing.LogEntry;
import lattice.tracing.LogTags;
import lattice.tracing.RecordedSpan;
import lattice.tracing.RecordingType;
import lattice.tracing.internal.Nullable;

/**
 * The mutable state of one real span, independent of any backend. Identity and timing basis are
 * fixed at construction; everything else is guarded by this object's monitor.
 *
 * <p>Critical sections are constant time, except {@link #collect(List)} which copies the state of
 * this record only, releasing the lock before descending into children.
 */
public final class SpanRecord {
  /** Baggage key present while a span records verbosely. Crosses process boundaries. */
  public static final String VERBOSE_BAGGAGE_KEY = "sb";

  final long traceId, spanId, parentSpanId, threadId, startTimestamp;
  final String operation;
  final TickClock clock;
  final LogTags logTags;
  final int maxLogs, maxChildren;

  // guarded by this
  long duration = -1L;
  RecordingType recordingType = RecordingType.OFF;
  final Map<String, String> tags = new LinkedHashMap<>();
  final Map<String, String> baggage = new LinkedHashMap<>();
  final Deque<LogEntry> logs = new ArrayDeque<>();
  final List<SpanRecord> children = new ArrayList<>();
  final List<RecordedSpan> remoteSpans = new ArrayList<>();

  public SpanRecord(long traceId, long spanId, long parentSpanId, String operation, long threadId,
    TickClock clock, LogTags logTags, int maxLogs, int maxChildren) {
    if (traceId == 0L) throw new IllegalArgumentException("traceId == 0");
    if (spanId == 0L) throw new IllegalArgumentException("spanId == 0");
    if (operation == null) throw new NullPointerException("operation == null");
    if (clock == null) throw new NullPointerException("clock == null");
    if (logTags == null) throw new NullPointerException("logTags == null");
    this.traceId = traceId;
    this.spanId = spanId;
    this.parentSpanId = parentSpanId;
    this.operation = operation;
    this.threadId = threadId;
    this.clock = clock;
    this.logTags = logTags;
    this.maxLogs = maxLogs;
    this.maxChildren = maxChildren;
    this.startTimestamp = clock.currentTimeMicroseconds();
  }

  public long traceId() {
    return traceId;
  }

  public long spanId() {
    return spanId;
  }

  public long parentSpanId() {
    return parentSpanId;
  }

  public String operation() {
    return operation;
  }

  /** Children use this clock so that their timestamps are consistent with this span's. */
  public TickClock clock() {
    return clock;
  }

  public LogTags logTags() {
    return logTags;
  }

  public long startTimestamp() {
    return startTimestamp;
  }

  /**
   * Records the duration. Returns false if the span was already finished, in which case nothing
   * changes.
   */
  public boolean finish() {
    long now = clock.currentTimeMicroseconds();
    synchronized (this) {
      if (duration >= 0L) return false;
      duration = Math.max(0L, now - startTimestamp);
      return true;
    }
  }

  /** Returns the finish timestamp in epoch microseconds, or -1 if unfinished. */
  public synchronized long finishTimestamp() {
    return duration < 0L ? -1L : startTimestamp + duration;
  }

  public synchronized boolean isFinished() {
    return duration >= 0L;
  }

  public synchronized RecordingType recordingType() {
    return recordingType;
  }

  /** Starts recording. {@link RecordingType#VERBOSE} also sets the verbose baggage item. */
  public synchronized void enableRecording(RecordingType recordingType) {
    if (recordingType == null) throw new NullPointerException("recordingType == null");
    if (recordingType == RecordingType.OFF) return;
    this.recordingType = recordingType;
    if (recordingType == RecordingType.VERBOSE) baggage.put(VERBOSE_BAGGAGE_KEY, "1");
  }

  public synchronized void setVerbose(boolean verbose) {
    if (verbose) {
      recordingType = RecordingType.VERBOSE;
      baggage.put(VERBOSE_BAGGAGE_KEY, "1");
    } else {
      recordingType = RecordingType.OFF;
      baggage.remove(VERBOSE_BAGGAGE_KEY);
    }
  }

  public synchronized boolean isVerbose() {
    return recordingType == RecordingType.VERBOSE;
  }

  public synchronized void tag(String key, String value) {
    tags.put(key, value);
  }

  public synchronized void baggageItem(String key, String value) {
    baggage.put(key, value);
  }

  @Nullable public synchronized String baggageItem(String key) {
    return baggage.get(key);
  }

  /** Returns a copy that is not affected by later changes to this span. */
  public synchronized Map<String, String> baggage() {
    return new LinkedHashMap<>(baggage);
  }

  /** Appends the entry, dropping the oldest one when the log is full. */
  public synchronized void log(LogEntry entry) {
    if (maxLogs <= 0) return;
    if (logs.size() >= maxLogs) logs.removeFirst();
    logs.addLast(entry);
  }

  public synchronized int logCount() {
    return logs.size();
  }

  /**
   * Folds a finished child into this span's recording. Returns false once the child cap is
   * reached; the child is then not recorded here.
   */
  public boolean addChild(SpanRecord child) {
    if (child == this) throw new IllegalArgumentException("child == this");
    synchronized (this) {
      if (children.size() >= maxChildren) return false;
      children.add(child);
      return true;
    }
  }

  public synchronized int childCount() {
    return children.size();
  }

  public synchronized void importRemoteSpans(List<RecordedSpan> spans) {
    remoteSpans.addAll(spans);
  }

  /** Adds a snapshot of this record, then of each folded child recursively, then remote spans. */
  public void collect(List<RecordedSpan> result) {
    List<SpanRecord> childrenSnapshot;
    List<RecordedSpan> remoteSnapshot;
    long now = clock.currentTimeMicroseconds();
    synchronized (this) {
      result.add(snapshot(now));
      childrenSnapshot = children.isEmpty()
        ? Collections.<SpanRecord>emptyList()
        : new ArrayList<>(children);
      remoteSnapshot = remoteSpans.isEmpty()
        ? Collections.<RecordedSpan>emptyList()
        : new ArrayList<>(remoteSpans);
    }
    for (SpanRecord child : childrenSnapshot) child.collect(result);
    result.addAll(remoteSnapshot);
  }

  // guarded by this
  RecordedSpan snapshot(long now) {
    RecordedSpan.Builder builder = RecordedSpan.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .parentSpanId(parentSpanId)
      .operation(operation)
      .threadId(threadId)
      .startTimestamp(startTimestamp);
    if (duration >= 0L) {
      builder.finished(true).duration(duration);
    } else {
      builder.finished(false).duration(Math.max(0L, now - startTimestamp));
    }
    for (LogTags.Tag tag : logTags.currentTags()) builder.putTag(tag.key(), tag.value());
    for (Map.Entry<String, String> tag : tags.entrySet()) {
      builder.putTag(tag.getKey(), tag.getValue());
    }
    if (duration < 0L) builder.putTag(RecordedSpan.TAG_UNFINISHED, "1");
    if (recordingType == RecordingType.VERBOSE) builder.putTag(RecordedSpan.TAG_VERBOSE, "1");
    for (Map.Entry<String, String> item : baggage.entrySet()) {
      builder.putBaggage(item.getKey(), item.getValue());
    }
    for (LogEntry log : logs) builder.addLog(log);
    return builder.build();
  }

  @Override public String toString() {
    return "SpanRecord{operation=" + operation + "}";
  }
}
