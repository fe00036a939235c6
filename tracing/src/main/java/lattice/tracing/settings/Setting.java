/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.settings;

/**
 * A configuration value that may change while the process runs. The tracer reads {@link
 * #currentValue()} when reconfiguring and registers with {@link #onChange(Runnable)} to be told
 * when to do so.
 */
public interface Setting<V> {
  V currentValue();

  /** Listeners may be invoked on any thread, possibly concurrently with each other. */
  void onChange(Runnable listener);
}
