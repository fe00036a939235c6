/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One timestamped entry recorded into a span. Fields keep their insertion order. */
public final class LogEntry {
  /** The field name used for free-form messages passed to {@link Span#record(String)} */
  public static final String EVENT_FIELD = "event";

  public static LogEntry message(long timestamp, String message) {
    if (message == null) throw new NullPointerException("message == null");
    return new LogEntry(timestamp, Collections.singletonMap(EVENT_FIELD, message));
  }

  public static LogEntry structured(long timestamp, Map<String, String> fields) {
    if (fields == null) throw new NullPointerException("fields == null");
    return new LogEntry(timestamp,
      Collections.unmodifiableMap(new LinkedHashMap<String, String>(fields)));
  }

  final long timestamp;
  final Map<String, String> fields;

  LogEntry(long timestamp, Map<String, String> fields) {
    this.timestamp = timestamp;
    this.fields = fields;
  }

  /** Epoch microseconds when this entry was recorded. */
  public long timestamp() {
    return timestamp;
  }

  public Map<String, String> fields() {
    return fields;
  }

  /**
   * Returns the message for entries made by {@link Span#record(String)}, otherwise the fields
   * rendered as {@code key:value} pairs.
   */
  public String message() {
    if (fields.size() == 1 && fields.containsKey(EVENT_FIELD)) return fields.get(EVENT_FIELD);
    StringBuilder result = new StringBuilder();
    for (Map.Entry<String, String> field : fields.entrySet()) {
      if (result.length() > 0) result.append(' ');
      result.append(field.getKey()).append(':').append(field.getValue());
    }
    return result.toString();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof LogEntry)) return false;
    LogEntry that = (LogEntry) o;
    return timestamp == that.timestamp && fields.equals(that.fields);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) ((timestamp >>> 32) ^ timestamp);
    h *= 1000003;
    h ^= fields.hashCode();
    return h;
  }

  @Override public String toString() {
    return "LogEntry{timestamp=" + timestamp + ", fields=" + fields + "}";
  }
}
