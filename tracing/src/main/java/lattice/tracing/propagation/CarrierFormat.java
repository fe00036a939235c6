/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation;

/** Discriminates how a {@link Carrier} stores its entries. */
public enum CarrierFormat {
  /** A plain string map, such as an in-process task descriptor. */
  TEXT_MAP,
  /** Request headers or RPC metadata, where keys are case-insensitive. */
  HTTP_HEADERS
}
