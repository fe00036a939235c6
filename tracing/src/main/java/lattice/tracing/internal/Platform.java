/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.internal;

import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import lattice.tracing.Clock;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems.
 */
public abstract class Platform {
  private static final Platform PLATFORM = new Jre9();
  private static final Logger LOG = Logger.getLogger(lattice.tracing.Tracer.class.getName());

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String)}, except with a throwable arg */
  public void log(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    Object[] params = {param1};
    lr.setParameters(params);
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  /**
   * Returns a pseudo-random, non-negative 63-bit value. This optimizes speed over full coverage,
   * which is why it doesn't share a {@link java.security.SecureRandom}.
   *
   * <p>Zero is possible: callers that need an identifier use {@link #nextId()}.
   */
  public abstract long randomLong();

  /** Generates a new 63-bit ID, taking care to dodge zero which can be confused with absent */
  public long nextId() {
    long nextId = randomLong();
    while (nextId == 0L) {
      nextId = randomLong();
    }
    return nextId;
  }

  /** Identifies the thread creating a span. Diagnostic only. */
  @SuppressWarnings("deprecation") // Thread.threadId() is not available until JRE 19
  public long currentThreadId() {
    return Thread.currentThread().getId();
  }

  /** Monotonic time source used to keep durations coherent within a trace. */
  public long nanoTime() {
    return System.nanoTime();
  }

  public abstract Clock clock();

  static final class Jre9 extends Platform {
    @Override public long randomLong() {
      return ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE;
    }

    @Override public Clock clock() {
      return new Clock() {
        @Override public long currentTimeMicroseconds() {
          java.time.Instant instant = java.time.Clock.systemUTC().instant();
          return (instant.getEpochSecond() * 1000000) + (instant.getNano() / 1000);
        }

        @Override public String toString() {
          return "Clock.systemUTC().instant()";
        }
      };
    }

    @Override public String toString() {
      return "Jre9{}";
    }
  }
}
