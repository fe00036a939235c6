/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow;

/**
 * Creates a shadow tracer from its configuration string, such as an access token or collector
 * address. Registered per type with {@link lattice.tracing.Tracer.Builder#shadowTracerFactory}.
 */
public interface ShadowTracerFactory {
  ShadowTracer create(String config);
}
