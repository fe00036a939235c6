/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.shadow.zipkin;

import lattice.tracing.shadow.ShadowTracer;
import lattice.tracing.shadow.ShadowTracerFactory;
import zipkin2.Endpoint;
import zipkin2.reporter.AsyncReporter;
import zipkin2.reporter.urlconnection.URLConnectionSender;

/**
 * Creates a {@link ZipkinShadowTracer} from a collector address, such as "localhost:9411". Spans
 * are reported asynchronously over HTTP in JSON v2 format.
 *
 * <p>Register under {@link ZipkinShadowTracer#TYPE} with {@link
 * lattice.tracing.Tracer.Builder#shadowTracerFactory}.
 */
public final class ZipkinShadowTracerFactory implements ShadowTracerFactory {
  public static ZipkinShadowTracerFactory create(String localServiceName) {
    if (localServiceName == null || localServiceName.isEmpty()) {
      throw new IllegalArgumentException(localServiceName + " is not a valid serviceName");
    }
    return new ZipkinShadowTracerFactory(localServiceName);
  }

  final Endpoint localEndpoint;

  ZipkinShadowTracerFactory(String localServiceName) {
    localEndpoint = Endpoint.newBuilder().serviceName(localServiceName).build();
  }

  @Override public ShadowTracer create(String collectorAddress) {
    URLConnectionSender sender = URLConnectionSender.create(collectorUrl(collectorAddress));
    AsyncReporter<zipkin2.Span> reporter = AsyncReporter.create(sender);
    return new ZipkinShadowTracer(reporter, localEndpoint, reporter, sender);
  }

  /** Accepts "host:port" or a complete URL. */
  static String collectorUrl(String collectorAddress) {
    if (collectorAddress == null) throw new NullPointerException("collectorAddress == null");
    if (collectorAddress.contains("://")) return collectorAddress;
    return "http://" + collectorAddress + "/api/v2/spans";
  }

  @Override public String toString() {
    return "ZipkinShadowTracerFactory{" + localEndpoint.serviceName() + "}";
  }
}
