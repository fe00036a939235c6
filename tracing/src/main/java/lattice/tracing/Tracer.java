/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.io.Closeable;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lattice.tracing.debug.DebugSink;
import lattice.tracing.debug.DebugTrace;
import lattice.tracing.debug.LoggingDebugSink;
import lattice.tracing.internal.Nullable;
import lattice.tracing.internal.Platform;
import lattice.tracing.internal.recorder.SpanRecord;
import lattice.tracing.internal.recorder.TickClock;
import lattice.tracing.propagation.Carrier;
import lattice.tracing.propagation.PropagationException;
import lattice.tracing.propagation.SpanMetaCodec;
import lattice.tracing.settings.TracingSettings;
import lattice.tracing.shadow.ShadowSpan;
import lattice.tracing.shadow.ShadowTracer;
import lattice.tracing.shadow.ShadowTracerFactory;

/**
 * Creates spans, and decides for each whether it is real or the shared no-op span.
 *
 * <p>A real span is created when any of these hold:
 * <ul>
 *   <li>the mode is {@link TracingMode#BACKGROUND}</li>
 *   <li>a shadow tracer is attached, or the debug sink is enabled</li>
 *   <li>the caller passed {@link SpanOption#withForceRealSpan()}</li>
 *   <li>recording was requested, explicitly or by inheriting from a recording parent</li>
 * </ul>
 *
 * <p>Mode, debug flag and shadow tracer are each held in their own atomic cell and updated by
 * {@link #configure(TracingSettings)}. A reader may observe a mix of old and new values while a
 * reconfiguration is in progress.
 *
 * <p>Local root spans are kept in a registry until finished, see {@link #visitSpans(SpanVisitor)}.
 */
public final class Tracer implements Closeable {
  public static final int DEFAULT_MAX_LOGS_PER_SPAN = 1000;
  public static final int DEFAULT_MAX_CHILDREN_PER_SPAN = 1000;

  /** Returns a tracer in legacy mode, without debug sink or shadow tracer. */
  public static Tracer create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    Clock clock;
    DebugSink debugSink;
    final Map<String, ShadowTracerFactory> shadowTracerFactories = new LinkedHashMap<>();
    int maxLogsPerSpan = DEFAULT_MAX_LOGS_PER_SPAN;
    int maxChildrenPerSpan = DEFAULT_MAX_CHILDREN_PER_SPAN;

    /**
     * Assigns the epoch clock used for the start of root spans. Children derive timestamps from
     * their root using a monotonic tick, so that durations are never negative. Defaults to the
     * system clock.
     */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /** Receives traces while debugging is enabled. Defaults to {@link LoggingDebugSink}. */
    public Builder debugSink(DebugSink debugSink) {
      if (debugSink == null) throw new NullPointerException("debugSink == null");
      this.debugSink = debugSink;
      return this;
    }

    /**
     * Registers how to create the shadow tracer of the given type, when a {@linkplain
     * TracingSettings#shadowTracers() shadow selection} of that type is set.
     */
    public Builder shadowTracerFactory(String type, ShadowTracerFactory factory) {
      if (type == null) throw new NullPointerException("type == null");
      if (factory == null) throw new NullPointerException("factory == null");
      shadowTracerFactories.put(type, factory);
      return this;
    }

    /** When a span has this many log entries, the oldest is dropped for each new one. */
    public Builder maxLogsPerSpan(int maxLogsPerSpan) {
      if (maxLogsPerSpan < 1) throw new IllegalArgumentException("maxLogsPerSpan < 1");
      this.maxLogsPerSpan = maxLogsPerSpan;
      return this;
    }

    /** Children finishing after a span has collected this many are left out of its recording. */
    public Builder maxChildrenPerSpan(int maxChildrenPerSpan) {
      if (maxChildrenPerSpan < 0) throw new IllegalArgumentException("maxChildrenPerSpan < 0");
      this.maxChildrenPerSpan = maxChildrenPerSpan;
      return this;
    }

    public Tracer build() {
      return new Tracer(this);
    }

    Builder() {
    }
  }

  final Platform platform = Platform.get();
  final Clock clock;
  final DebugSink debugSink;
  final Map<String, ShadowTracerFactory> shadowTracerFactories;
  final int maxLogsPerSpan, maxChildrenPerSpan;

  final AtomicReference<TracingMode> mode = new AtomicReference<>(TracingMode.LEGACY);
  final AtomicBoolean debugEnabled = new AtomicBoolean();
  final AtomicReference<ShadowHandle> shadow = new AtomicReference<>();

  final Set<TracingSettings> configuredSettings = Collections.synchronizedSet(
    Collections.newSetFromMap(new IdentityHashMap<TracingSettings, Boolean>()));
  final ActiveSpans activeSpans = new ActiveSpans();
  final NoopSpan noopSpan = new NoopSpan(this);

  Tracer(Builder builder) {
    clock = builder.clock != null ? builder.clock : platform.clock();
    debugSink = builder.debugSink != null ? builder.debugSink : new LoggingDebugSink();
    shadowTracerFactories =
      Collections.unmodifiableMap(new LinkedHashMap<>(builder.shadowTracerFactories));
    maxLogsPerSpan = builder.maxLogsPerSpan;
    maxChildrenPerSpan = builder.maxChildrenPerSpan;
  }

  /**
   * Applies the current settings, then re-applies them whenever any of them changes. Safe to call
   * more than once: a listener is registered only on the first call with a given settings object.
   */
  public void configure(final TracingSettings settings) {
    if (settings == null) throw new NullPointerException("settings == null");
    reconfigure(settings);
    if (!configuredSettings.add(settings)) return;
    settings.onChange(new Runnable() {
      @Override public void run() {
        reconfigure(settings);
      }

      @Override public String toString() {
        return "Reconfigure(" + Tracer.this + ")";
      }
    });
  }

  /** A replaced shadow tracer is closed after the lock is released, as closing may flush. */
  void reconfigure(TracingSettings settings) {
    ShadowHandle replaced;
    synchronized (this) {
      replaced = applySettings(settings);
    }
    closeShadow(replaced);
  }

  /** Called with this tracer's lock held. Returns the shadow handle that was replaced, or null. */
  @Nullable ShadowHandle applySettings(TracingSettings settings) {
    mode.set(settings.mode().currentValue());

    String type = null, config = null;
    for (TracingSettings.ShadowSelection selection : settings.shadowTracers()) {
      String value = selection.config().currentValue();
      if (value == null || value.isEmpty()) continue;
      if (!shadowTracerFactories.containsKey(selection.type())) {
        platform.log("No factory registered for shadow tracer {0}", selection.type(), null);
        continue;
      }
      type = selection.type();
      config = value;
      break;
    }

    ShadowHandle replaced = null;
    if (type == null) {
      replaced = swapShadow(null);
    } else {
      ShadowHandle current = shadow.get();
      if (current == null || !current.isSelection(type, config)) {
        ShadowTracer created = null;
        try {
          created = shadowTracerFactories.get(type).create(config);
        } catch (RuntimeException e) {
          platform.log("error creating shadow tracer {0}", type, e);
        }
        replaced = swapShadow(created != null ? new ShadowHandle(type, config, created) : null);
      }
    }

    debugEnabled.set(settings.debugEnabled().currentValue());
    return replaced;
  }

  /** Visible for testing. Attaches the shadow tracer regardless of settings. */
  void setShadowTracer(@Nullable ShadowTracer shadowTracer) {
    closeShadow(swapShadow(shadowTracer != null
      ? new ShadowHandle(shadowTracer.type(), null, shadowTracer)
      : null));
  }

  /**
   * Returns the previous handle, to be closed by the caller once the swap is visible. Spans
   * started with the old shadow tracer keep their shadow spans.
   */
  @Nullable ShadowHandle swapShadow(@Nullable ShadowHandle replacement) {
    ShadowHandle old = shadow.getAndSet(replacement);
    return old == replacement ? null : old;
  }

  void closeShadow(@Nullable ShadowHandle old) {
    if (old == null) return;
    try {
      old.tracer.close();
    } catch (RuntimeException e) {
      platform.log("error closing shadow tracer {0}", old.type, e);
    }
  }

  public TracingMode mode() {
    return mode.get();
  }

  public boolean isDebugEnabled() {
    return debugEnabled.get();
  }

  /** The currently attached shadow tracer, or null. */
  @Nullable public ShadowTracer shadowTracer() {
    ShadowHandle handle = shadow.get();
    return handle != null ? handle.tracer : null;
  }

  /** True if operations should be traced regardless of whether a caller asked for it. */
  public boolean alwaysTrace() {
    return debugEnabled.get() || shadow.get() != null;
  }

  /** Like {@link #startSpanCtx}, except no propagation context is involved. */
  public Span startSpan(String operation, SpanOption... options) {
    return startSpan(PropagationContext.EMPTY, operation, SpanOptions.of(options));
  }

  /**
   * Starts a span and returns it with a context holding it. Log tags of the input context are
   * applied to the span unless {@link SpanOption#withLogTags(LogTags)} is passed.
   *
   * <p>When the result is the no-op span, the returned context is the input one, unless the input
   * holds a real span. In that case the context is rewrapped with the no-op span, so that work
   * under it is not attributed to the outer span.
   *
   * @throws IllegalArgumentException if both a local and a remote parent were passed
   */
  public StartedSpan startSpanCtx(PropagationContext context, String operation,
    SpanOption... options) {
    if (context == null) throw new NullPointerException("context == null");
    Span span = startSpan(context, operation, SpanOptions.of(options));
    Span current = context.span();
    if (span.isNoop() && (current == null || current.isNoop())) {
      return new StartedSpan(context, span);
    }
    return new StartedSpan(context.withSpan(span), span);
  }

  Span startSpan(PropagationContext context, String operation, SpanOptions options) {
    if (operation == null) throw new NullPointerException("operation == null");
    ShadowHandle shadowHandle = shadow.get();
    RecordingType recordingType = options.recordingType();
    boolean real = options.forceRealSpan
      || mode.get() == TracingMode.BACKGROUND
      || shadowHandle != null
      || debugEnabled.get()
      || recordingType != RecordingType.OFF;
    if (!real) return noopSpan;
    return newRealSpan(context, operation, options, recordingType, shadowHandle);
  }

  RealSpan newRealSpan(PropagationContext context, String operation, SpanOptions options,
    RecordingType recordingType, @Nullable ShadowHandle shadowHandle) {
    RealSpan localParent = options.localParent();
    SpanMeta remoteParent = options.remoteParent();

    LogTags logTags = options.logTags;
    if (logTags == null) {
      logTags = context.logTags();
      if (logTags.isEmpty() && localParent != null) logTags = localParent.record.logTags();
    }

    long traceId = options.parentTraceId();
    if (traceId == 0L) traceId = platform.nextId();
    TickClock tickClock = localParent != null
      ? localParent.record.clock()
      : TickClock.create(platform, clock);
    SpanRecord record = new SpanRecord(traceId, platform.nextId(), options.parentSpanId(),
      operation, platform.currentThreadId(), tickClock, logTags, maxLogsPerSpan,
      maxChildrenPerSpan);

    ShadowTracer shadowTracer = null;
    ShadowSpan shadowSpan = null;
    if (shadowHandle != null) {
      String parentType = options.parentShadowTracerType();
      // don't derive a span from a context created by a different type of shadow tracer
      if (parentType == null || parentType.equals(shadowHandle.tracer.type())) {
        try {
          shadowSpan = shadowHandle.tracer.startSpan(options.parentShadowContext(),
            options.referenceType, operation, record.startTimestamp());
          shadowTracer = shadowHandle.tracer;
          for (LogTags.Tag tag : logTags.currentTags()) shadowSpan.tag(tag.key(), tag.value());
        } catch (RuntimeException e) {
          platform.log("error starting shadow span {0}", operation, e);
        }
      }
    }

    DebugTrace debugTrace = null;
    if (debugEnabled.get()) {
      try {
        debugTrace = debugSink.newTrace("tracing", operation);
        debugTrace.setMaxEvents(maxLogsPerSpan);
        for (LogTags.Tag tag : logTags.currentTags()) {
          debugTrace.printf("%s:%s", tag.key(), tag.value());
        }
      } catch (RuntimeException e) {
        platform.log("error starting debug trace {0}", operation, e);
      }
    }

    boolean registered = localParent == null && !options.bypassRegistry;
    RealSpan span = new RealSpan(this, record, localParent, shadowTracer, shadowSpan, debugTrace,
      registered);

    record.enableRecording(recordingType);
    for (Map.Entry<String, String> tag : options.tags.entrySet()) {
      span.tag(tag.getKey(), tag.getValue());
    }

    Map<String, String> baggage = localParent != null
      ? localParent.baggageSnapshot()
      : remoteParent != null ? remoteParent.baggage() : Collections.<String, String>emptyMap();
    for (Map.Entry<String, String> item : baggage.entrySet()) {
      // the verbose marker follows the recording type resolved above
      if (item.getKey().equals(SpanRecord.VERBOSE_BAGGAGE_KEY)) continue;
      span.baggageItem(item.getKey(), item.getValue());
    }

    if (registered) activeSpans.add(span);
    return span;
  }

  /**
   * Writes the metadata to the carrier. Does nothing if the metadata {@linkplain SpanMeta#isNoop()
   * is no-op}.
   *
   * @throws PropagationException if the carrier format is unsupported or the shadow tracer fails
   */
  public void injectMetaInto(SpanMeta meta, Carrier carrier) throws PropagationException {
    SpanMetaCodec.inject(meta, carrier, shadowTracer());
  }

  /**
   * Reads metadata written by {@link #injectMetaInto}, returning {@link SpanMeta#EMPTY} if there
   * is none. Shadow fields are dropped unless the attached shadow tracer is of the same type.
   *
   * @throws PropagationException if the carrier format is unsupported, an id is malformed or the
   * shadow tracer fails
   */
  public SpanMeta extractMetaFrom(Carrier carrier) throws PropagationException {
    return SpanMetaCodec.extract(carrier, shadowTracer());
  }

  /**
   * Invokes the visitor with each unfinished local root span, until it returns false. The visitor
   * runs without holding the registry lock, so it can start and finish spans.
   */
  public void visitSpans(SpanVisitor visitor) {
    if (visitor == null) throw new NullPointerException("visitor == null");
    for (Span span : activeSpans.snapshot()) {
      if (!visitor.visit(span)) return;
    }
  }

  /** Detaches and closes the shadow tracer, if any. The tracer can still create spans. */
  @Override public void close() {
    closeShadow(swapShadow(null));
  }

  @Override public String toString() {
    ShadowHandle handle = shadow.get();
    return "Tracer{mode=" + mode.get()
      + ", debugEnabled=" + debugEnabled.get()
      + (handle != null ? ", shadowTracer=" + handle.type : "")
      + "}";
  }

  static final class ShadowHandle {
    final String type;
    @Nullable final String config; // null when attached directly
    final ShadowTracer tracer;

    ShadowHandle(String type, @Nullable String config, ShadowTracer tracer) {
      this.type = type;
      this.config = config;
      this.tracer = tracer;
    }

    boolean isSelection(String type, String config) {
      return this.type.equals(type) && config.equals(this.config);
    }
  }
}
