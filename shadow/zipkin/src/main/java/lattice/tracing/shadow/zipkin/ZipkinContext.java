/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow.zipkin;

import lattice.tracing.internal.HexCodec;

/** Identifies a span in Zipkin. The shadow context of spans mirrored by {@link ZipkinShadowTracer}. */
public final class ZipkinContext {
  final long traceId, parentId, spanId;

  ZipkinContext(long traceId, long parentId, long spanId) {
    this.traceId = traceId;
    this.parentId = parentId;
    this.spanId = spanId;
  }

  public long traceId() {
    return traceId;
  }

  /** Zero when this is a root span. */
  public long parentId() {
    return parentId;
  }

  public long spanId() {
    return spanId;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof ZipkinContext)) return false;
    ZipkinContext that = (ZipkinContext) o;
    return traceId == that.traceId && parentId == that.parentId && spanId == that.spanId;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= (int) ((parentId >>> 32) ^ parentId);
    h *= 1000003;
    h ^= (int) ((spanId >>> 32) ^ spanId);
    return h;
  }

  @Override public String toString() {
    return HexCodec.toLowerHex(traceId) + "/" + HexCodec.toLowerHex(spanId);
  }
}
