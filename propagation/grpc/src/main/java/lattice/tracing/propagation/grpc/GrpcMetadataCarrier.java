/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation.grpc;

import io.grpc.Metadata;
import io.grpc.Metadata.Key;
import java.util.ArrayList;
import java.util.List;
import lattice.tracing.internal.Platform;
import lattice.tracing.propagation.Carrier;
import lattice.tracing.propagation.CarrierFormat;
import lattice.tracing.propagation.PropagationException;

/**
 * Carries span metadata in gRPC request headers. Use with {@link
 * lattice.tracing.Tracer#injectMetaInto} in a client interceptor, and {@link
 * lattice.tracing.Tracer#extractMetaFrom} in a server interceptor.
 *
 * <p>Binary headers, suffixed with {@value Metadata#BINARY_HEADER_SUFFIX}, are skipped.
 *
 * <p>Entries gRPC cannot send as ASCII headers are dropped when set, and logged at FINE. These are
 * keys with characters outside {@code [0-9a-z_.-]} or with a binary suffix, and values that are not
 * printable ASCII. The trace and span ids are always valid.
 */
public final class GrpcMetadataCarrier implements Carrier {
  final Metadata metadata;

  public GrpcMetadataCarrier(Metadata metadata) {
    if (metadata == null) throw new NullPointerException("metadata == null");
    this.metadata = metadata;
  }

  @Override public CarrierFormat format() {
    return CarrierFormat.HTTP_HEADERS;
  }

  /** gRPC lower-cases the key. An existing key gets an additional value. */
  @Override public void set(String key, String value) {
    if (!isPrintableAscii(value)) {
      Platform.get().log("Dropping header {0}: value is not printable ASCII", key, null);
      return;
    }
    Key<String> metadataKey;
    try {
      metadataKey = Key.of(key, Metadata.ASCII_STRING_MARSHALLER);
    } catch (IllegalArgumentException e) {
      Platform.get().log("Dropping header {0}: invalid ASCII header name", key, e);
      return;
    }
    metadata.put(metadataKey, value);
  }

  static boolean isPrintableAscii(String value) {
    for (int i = 0, length = value.length(); i < length; i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7e) return false;
    }
    return true;
  }

  @Override public void forEach(EntryVisitor visitor) throws PropagationException {
    // copy the keys, as the visitor could write to the same metadata
    List<String> keys = new ArrayList<>(metadata.keys());
    for (String name : keys) {
      if (name.endsWith(Metadata.BINARY_HEADER_SUFFIX)) continue;
      Iterable<String> values = metadata.getAll(Key.of(name, Metadata.ASCII_STRING_MARSHALLER));
      if (values == null) continue;
      for (String value : values) visitor.visit(name, value);
    }
  }

  @Override public String toString() {
    return "GrpcMetadataCarrier{" + metadata + "}";
  }
}
