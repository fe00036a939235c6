/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import lattice.tracing.internal.Nullable;

/**
 * An immutable, request-scoped value carrying the current span and log tags down a call chain.
 * Derive new contexts with the {@code with} methods; the receiver is never modified.
 */
public final class PropagationContext {
  public static final PropagationContext EMPTY = new PropagationContext(null, LogTags.EMPTY);

  @Nullable final Span span;
  final LogTags logTags;

  PropagationContext(@Nullable Span span, LogTags logTags) {
    this.span = span;
    this.logTags = logTags;
  }

  /** The current span, or null if none was started in this scope. */
  @Nullable public Span span() {
    return span;
  }

  public LogTags logTags() {
    return logTags;
  }

  public PropagationContext withSpan(@Nullable Span span) {
    if (span == this.span) return this;
    return new PropagationContext(span, logTags);
  }

  public PropagationContext withLogTags(LogTags logTags) {
    if (logTags == null) throw new NullPointerException("logTags == null");
    if (logTags.equals(this.logTags)) return this;
    return new PropagationContext(span, logTags);
  }

  @Override public String toString() {
    return "PropagationContext{span=" + span + ", logTags=" + logTags + "}";
  }
}
