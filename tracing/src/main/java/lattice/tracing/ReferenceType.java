/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

/** How a new span relates to its parent. Shadow tracers receive this verbatim. */
public enum ReferenceType {
  /** The parent depends on the result of the child. This is the default. */
  CHILD_OF,
  /** The parent does not wait for the child, for example an async task that may outlive it. */
  FOLLOWS_FROM
}
