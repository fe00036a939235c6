/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation;

import lattice.tracing.internal.Nullable;

/**
 * A key/value view over the transport that moves span metadata across a boundary.
 *
 * <p>Implementations report a {@link #format()} so that the codec can reject carriers it does not
 * understand before touching them.
 */
public interface Carrier {
  /** Returns null if this carrier's format is unknown to the codec. */
  @Nullable CarrierFormat format();

  void set(String key, String value);

  /**
   * Invokes the visitor for each entry. Stops at the first exception thrown by the visitor and
   * rethrows it.
   */
  void forEach(EntryVisitor visitor) throws PropagationException;

  interface EntryVisitor {
    void visit(String key, String value) throws PropagationException;
  }
}
