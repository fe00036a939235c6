/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation;

import java.util.Map;

/** A {@link CarrierFormat#TEXT_MAP} carrier backed by a string map. */
public final class MapCarrier implements Carrier {
  final Map<String, String> map;

  public MapCarrier(Map<String, String> map) {
    if (map == null) throw new NullPointerException("map == null");
    this.map = map;
  }

  public Map<String, String> map() {
    return map;
  }

  @Override public CarrierFormat format() {
    return CarrierFormat.TEXT_MAP;
  }

  @Override public void set(String key, String value) {
    map.put(key, value);
  }

  @Override public void forEach(EntryVisitor visitor) throws PropagationException {
    for (Map.Entry<String, String> entry : map.entrySet()) {
      visitor.visit(entry.getKey(), entry.getValue());
    }
  }

  @Override public String toString() {
    return "MapCarrier" + map;
  }
}
