/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import lattice.tracing.internal.Nullable;

/** A span paired with the propagation context to pass to work done under it. */
public final class StartedSpan {
  final PropagationContext context;
  @Nullable final Span span;

  StartedSpan(PropagationContext context, @Nullable Span span) {
    this.context = context;
    this.span = span;
  }

  public PropagationContext context() {
    return context;
  }

  /**
   * The started span, which the caller must finish. Null only when a helper in {@link
   * ContextSpans} found no span to derive from; the context is then the input context.
   */
  @Nullable public Span span() {
    return span;
  }

  @Override public String toString() {
    return "StartedSpan{span=" + span + "}";
  }
}
