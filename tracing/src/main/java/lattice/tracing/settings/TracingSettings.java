/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import lattice.tracing.TracingMode;

/**
 * The dynamic settings a {@link lattice.tracing.Tracer} is {@linkplain
 * lattice.tracing.Tracer#configure(TracingSettings) configured} from.
 *
 * <p>Shadow tracer selections are ordered. The first one whose value is non-empty, and whose type
 * has a factory registered with the tracer, is attached.
 */
public final class TracingSettings {
  public static final String MODE = "trace.mode";
  public static final String DEBUG_ENABLE = "trace.debug.enable";
  public static final String LIGHTSTEP_TOKEN = "trace.lightstep.token";
  public static final String ZIPKIN_COLLECTOR = "trace.zipkin.collector";

  static final String LIGHTSTEP_TOKEN_ENV = "LATTICE_TEST_LIGHTSTEP_TOKEN";
  static final String ZIPKIN_COLLECTOR_ENV = "LATTICE_TEST_ZIPKIN_COLLECTOR";

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Reads {@link #MODE}, {@link #DEBUG_ENABLE}, {@link #LIGHTSTEP_TOKEN} and {@link #ZIPKIN_COLLECTOR}. */
  public static TracingSettings fromProperties(Properties properties) {
    return fromProperties(properties, System.getenv());
  }

  static TracingSettings fromProperties(Properties properties, Map<String, String> env) {
    if (properties == null) throw new NullPointerException("properties == null");
    String mode = properties.getProperty(MODE, TracingMode.LEGACY.settingValue());
    String debug = properties.getProperty(DEBUG_ENABLE, "false");
    return newBuilder()
      .mode(MutableSetting.create(TracingMode.parse(mode.trim())))
      .debugEnabled(MutableSetting.create(Boolean.parseBoolean(debug.trim())))
      .shadowTracer("lightstep", MutableSetting.create(
        properties.getProperty(LIGHTSTEP_TOKEN, orEmpty(env.get(LIGHTSTEP_TOKEN_ENV)))))
      .shadowTracer("zipkin", MutableSetting.create(
        properties.getProperty(ZIPKIN_COLLECTOR, orEmpty(env.get(ZIPKIN_COLLECTOR_ENV)))))
      .build();
  }

  static String orEmpty(String value) {
    return value != null ? value : "";
  }

  final Setting<TracingMode> mode;
  final Setting<Boolean> debugEnabled;
  final List<ShadowSelection> shadowTracers;

  TracingSettings(Builder builder) {
    mode = builder.mode;
    debugEnabled = builder.debugEnabled;
    shadowTracers = Collections.unmodifiableList(new ArrayList<>(builder.shadowTracers));
  }

  public Setting<TracingMode> mode() {
    return mode;
  }

  public Setting<Boolean> debugEnabled() {
    return debugEnabled;
  }

  /** In priority order. */
  public List<ShadowSelection> shadowTracers() {
    return shadowTracers;
  }

  /** Registers the listener with every setting. */
  public void onChange(Runnable listener) {
    mode.onChange(listener);
    debugEnabled.onChange(listener);
    for (ShadowSelection selection : shadowTracers) selection.config.onChange(listener);
  }

  @Override public String toString() {
    return "TracingSettings{mode=" + mode.currentValue()
      + ", debugEnabled=" + debugEnabled.currentValue()
      + ", shadowTracers=" + shadowTracers + "}";
  }

  /** Associates a shadow tracer type with the setting holding its configuration string. */
  public static final class ShadowSelection {
    final String type;
    final Setting<String> config;

    ShadowSelection(String type, Setting<String> config) {
      this.type = type;
      this.config = config;
    }

    public String type() {
      return type;
    }

    /** An empty value means this shadow tracer is not selected. */
    public Setting<String> config() {
      return config;
    }

    @Override public String toString() {
      return type + (config.currentValue().isEmpty() ? "(unset)" : "(set)");
    }
  }

  public static final class Builder {
    Setting<TracingMode> mode = MutableSetting.create(TracingMode.LEGACY);
    Setting<Boolean> debugEnabled = MutableSetting.create(false);
    final List<ShadowSelection> shadowTracers = new ArrayList<>();

    public Builder mode(Setting<TracingMode> mode) {
      if (mode == null) throw new NullPointerException("mode == null");
      this.mode = mode;
      return this;
    }

    public Builder debugEnabled(Setting<Boolean> debugEnabled) {
      if (debugEnabled == null) throw new NullPointerException("debugEnabled == null");
      this.debugEnabled = debugEnabled;
      return this;
    }

    /** Appends a selection. Earlier selections take priority. */
    public Builder shadowTracer(String type, Setting<String> config) {
      if (type == null) throw new NullPointerException("type == null");
      if (config == null) throw new NullPointerException("config == null");
      shadowTracers.add(new ShadowSelection(type, config));
      return this;
    }

    public TracingSettings build() {
      return new TracingSettings(this);
    }

    Builder() {
    }
  }
}
