/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

/**
 * Epoch microseconds used to timestamp span starts and log entries.
 *
 * <p>This should use the most precise value possible. For example, {@code gettimeofday} or
 * multiplying {@link System#currentTimeMillis} by 1000.
 *
 * <p><em>Note</em>: This type is safe to implement as a lambda, or use as a method reference.
 */
public interface Clock {

  long currentTimeMicroseconds();
}
