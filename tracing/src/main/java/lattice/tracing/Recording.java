/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lattice.tracing.internal.Nullable;

/**
 * A read-only snapshot of a span and the spans collected into it. The first element is the span
 * the recording was requested from. The remaining elements are in depth-first order: each
 * collected child, in the order it finished, is followed by its own descendants. Spans imported
 * with {@link Span#importRemoteSpans(List)} follow the span they were imported into.
 */
public final class Recording {
  public static final Recording EMPTY = new Recording(Collections.<RecordedSpan>emptyList());

  public static Recording create(List<RecordedSpan> spans) {
    if (spans == null) throw new NullPointerException("spans == null");
    if (spans.isEmpty()) return EMPTY;
    return new Recording(Collections.unmodifiableList(new ArrayList<>(spans)));
  }

  final List<RecordedSpan> spans;

  Recording(List<RecordedSpan> spans) {
    this.spans = spans;
  }

  public List<RecordedSpan> spans() {
    return spans;
  }

  public boolean isEmpty() {
    return spans.isEmpty();
  }

  public int size() {
    return spans.size();
  }

  /** Returns the first span with the given operation name, or null if there is none. */
  @Nullable public RecordedSpan findSpan(String operation) {
    for (RecordedSpan span : spans) {
      if (span.operation().equals(operation)) return span;
    }
    return null;
  }

  /**
   * Returns the first log entry whose {@linkplain LogEntry#message() message} matches the regular
   * expression, or null if there is none.
   */
  @Nullable public LogEntry findLogMessage(String regex) {
    Pattern pattern = Pattern.compile(regex);
    for (RecordedSpan span : spans) {
      for (LogEntry log : span.logs()) {
        if (pattern.matcher(log.message()).find()) return log;
      }
    }
    return null;
  }

  /**
   * Renders the recording as indented text, one block per span. Log entries are prefixed with
   * their offset from the start of the first span.
   */
  @Override public String toString() {
    if (spans.isEmpty()) return "<empty recording>";
    long start = spans.get(0).startTimestamp();
    Map<Long, Integer> depths = new HashMap<>();
    StringBuilder result = new StringBuilder();
    for (RecordedSpan span : spans) {
      Integer parentDepth = depths.get(span.parentSpanId());
      int depth = parentDepth != null ? parentDepth + 1 : 0;
      depths.put(span.spanId(), depth);

      indent(result, depth).append("=== operation:").append(span.operation());
      for (Map.Entry<String, String> tag : span.tags().entrySet()) {
        result.append(' ').append(tag.getKey());
        if (!tag.getValue().isEmpty()) result.append(':').append(tag.getValue());
      }
      result.append('\n');
      for (LogEntry log : span.logs()) {
        indent(result, depth)
          .append(String.format(Locale.ROOT, "%10.3fms ", (log.timestamp() - start) / 1000.0))
          .append(log.message())
          .append('\n');
      }
    }
    return result.toString();
  }

  static StringBuilder indent(StringBuilder result, int depth) {
    for (int i = 0; i < depth; i++) result.append("    ");
    return result;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Recording)) return false;
    return spans.equals(((Recording) o).spans);
  }

  @Override public int hashCode() {
    return spans.hashCode();
  }
}
