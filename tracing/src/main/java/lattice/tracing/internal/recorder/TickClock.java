/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.internal.recorder;

import lattice.tracing.Clock;
import lattice.tracing.internal.Platform;

/**
 * Anchors a wall-clock reading to the monotonic tick of the local root span. Children share their
 * parent's clock, so NTP or system clock changes mid-trace never produce negative durations.
 */
public final class TickClock implements Clock {
  final Platform platform;
  final long baseEpochMicros;
  final long baseTickNanos;

  public static TickClock create(Platform platform, Clock clock) {
    return new TickClock(platform, clock.currentTimeMicroseconds(), platform.nanoTime());
  }

  TickClock(Platform platform, long baseEpochMicros, long baseTickNanos) {
    this.platform = platform;
    this.baseEpochMicros = baseEpochMicros;
    this.baseTickNanos = baseTickNanos;
  }

  @Override public long currentTimeMicroseconds() {
    return ((platform.nanoTime() - baseTickNanos) / 1000) + baseEpochMicros;
  }

  @Override public String toString() {
    return "TickClock{"
      + "baseEpochMicros=" + baseEpochMicros + ", "
      + "baseTickNanos=" + baseTickNanos
      + "}";
  }
}
