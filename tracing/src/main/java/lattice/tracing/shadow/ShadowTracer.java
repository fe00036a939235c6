/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow;

import java.io.Closeable;
import java.util.Map;
import java.util.function.BiConsumer;
import lattice.tracing.ReferenceType;
import lattice.tracing.internal.Nullable;
import lattice.tracing.propagation.CarrierFormat;
import lattice.tracing.propagation.PropagationException;

/**
 * An external trace backend that receives a copy of every real span. At most one shadow tracer is
 * attached to a {@link lattice.tracing.Tracer} at a time; it is swapped on reconfiguration and
 * {@linkplain #close() closed} after it is no longer attached.
 *
 * <p>Contexts returned by {@link ShadowSpan#context()} and {@link #extract} are opaque to the
 * tracer. They are only ever passed back to the shadow tracer whose {@link #type()} produced them.
 */
public interface ShadowTracer extends Closeable {
  /** A short name such as "zipkin" or "lightstep", written on the wire next to shadow fields. */
  String type();

  /**
   * Starts a backend span.
   *
   * @param parentContext context of the parent's shadow span, or null for a root
   * @param startTimestamp epoch microseconds
   */
  ShadowSpan startSpan(@Nullable Object parentContext, ReferenceType referenceType,
    String operation, long startTimestamp);

  /** Writes the backend's own fields for the context. Keys are not namespaced by the caller. */
  void inject(Object context, CarrierFormat format, BiConsumer<String, String> writer)
    throws PropagationException;

  /**
   * Reads back the fields written by {@link #inject}. Returns null if the fields do not hold a
   * context.
   */
  @Nullable Object extract(CarrierFormat format, Map<String, String> fields)
    throws PropagationException;

  /** Releases backend resources. Does not throw. */
  @Override void close();
}
