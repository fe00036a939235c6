/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.settings;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/** An in-memory setting whose listeners run on the thread calling {@link #set(Object)}. */
public final class MutableSetting<V> implements Setting<V> {
  public static <V> MutableSetting<V> create(V initialValue) {
    if (initialValue == null) throw new NullPointerException("initialValue == null");
    return new MutableSetting<>(initialValue);
  }

  final AtomicReference<V> value;
  final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  MutableSetting(V initialValue) {
    this.value = new AtomicReference<>(initialValue);
  }

  @Override public V currentValue() {
    return value.get();
  }

  /** Updates the value, notifying listeners only if it changed. */
  public void set(V newValue) {
    if (newValue == null) throw new NullPointerException("newValue == null");
    V oldValue = value.getAndSet(newValue);
    if (oldValue.equals(newValue)) return;
    for (Runnable listener : listeners) listener.run();
  }

  @Override public void onChange(Runnable listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    listeners.add(listener);
  }

  @Override public String toString() {
    return "MutableSetting{" + value.get() + "}";
  }
}
