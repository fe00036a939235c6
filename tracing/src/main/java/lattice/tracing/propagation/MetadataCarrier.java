/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A {@link CarrierFormat#HTTP_HEADERS} carrier over multi-valued RPC metadata. Keys are stored in
 * lower case; setting an existing key appends a value.
 */
public final class MetadataCarrier implements Carrier {
  final Map<String, List<String>> metadata;

  public MetadataCarrier(Map<String, List<String>> metadata) {
    if (metadata == null) throw new NullPointerException("metadata == null");
    this.metadata = metadata;
  }

  public Map<String, List<String>> metadata() {
    return metadata;
  }

  @Override public CarrierFormat format() {
    return CarrierFormat.HTTP_HEADERS;
  }

  @Override public void set(String key, String value) {
    String lowerKey = key.toLowerCase(Locale.ROOT);
    List<String> values = metadata.get(lowerKey);
    if (values == null) {
      values = new ArrayList<>(1);
      metadata.put(lowerKey, values);
    }
    values.add(value);
  }

  @Override public void forEach(EntryVisitor visitor) throws PropagationException {
    for (Map.Entry<String, List<String>> entry : metadata.entrySet()) {
      for (String value : entry.getValue()) {
        visitor.visit(entry.getKey(), value);
      }
    }
  }

  @Override public String toString() {
    return "MetadataCarrier" + metadata;
  }
}
