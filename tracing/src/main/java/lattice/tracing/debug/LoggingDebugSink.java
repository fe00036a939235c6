/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.debug;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default debug sink. Buffers a bounded number of events per trace and writes them to a {@link
 * Logger} at {@link Level#FINE} when the trace finishes.
 */
public final class LoggingDebugSink implements DebugSink {
  static final int DEFAULT_MAX_EVENTS = 1000;

  final Logger logger;

  public LoggingDebugSink() {
    this(Logger.getLogger(LoggingDebugSink.class.getName()));
  }

  public LoggingDebugSink(Logger logger) {
    if (logger == null) throw new NullPointerException("logger == null");
    this.logger = logger;
  }

  @Override public DebugTrace newTrace(String family, String title) {
    return new LoggingDebugTrace(logger, family, title);
  }

  @Override public String toString() {
    return "LoggingDebugSink{name=" + logger.getName() + "}";
  }

  static final class LoggingDebugTrace implements DebugTrace {
    final Logger logger;
    final String family, title;
    final Deque<String> events = new ArrayDeque<>();
    int maxEvents = DEFAULT_MAX_EVENTS;
    boolean finished;

    LoggingDebugTrace(Logger logger, String family, String title) {
      this.logger = logger;
      this.family = family;
      this.title = title;
    }

    @Override public synchronized void setMaxEvents(int maxEvents) {
      if (maxEvents < 1) throw new IllegalArgumentException("maxEvents < 1");
      this.maxEvents = maxEvents;
      while (events.size() > maxEvents) events.removeFirst();
    }

    @Override public synchronized void printf(String format, Object... args) {
      if (finished) return;
      if (events.size() == maxEvents) events.removeFirst();
      events.addLast(String.format(format, args));
    }

    @Override public void finish() {
      String message;
      synchronized (this) {
        if (finished) return;
        finished = true;
        if (!logger.isLoggable(Level.FINE)) return;
        StringBuilder result = new StringBuilder();
        result.append(family).append(' ').append(title);
        for (String event : events) result.append("\n  ").append(event);
        message = result.toString();
      }
      logger.fine(message);
    }

    synchronized int eventCount() {
      return events.size();
    }
  }
}
