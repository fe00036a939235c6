/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.Map;
import lattice.tracing.internal.Nullable;

/**
 * Customizes how {@link Tracer#startSpan(String, SpanOption...)} creates a span. Options are
 * applied in order; a later option of the same kind replaces an earlier one, except {@link
 * #withTags(Map)} which accumulates.
 */
public abstract class SpanOption {

  /**
   * Makes the new span a child of the given local span. The child's recording is added to the
   * parent's when the child finishes. A null or no-op parent is ignored.
   *
   * <p>Cannot be combined with {@link #withParentAndManualCollection(SpanMeta)}.
   */
  public static SpanOption withParentAndAutoCollection(@Nullable final Span parent) {
    return new SpanOption() {
      @Override void apply(SpanOptions options) {
        options.localParentOption = true;
        options.parent = parent;
      }

      @Override public String toString() {
        return "WithParentAndAutoCollection(" + parent + ")";
      }
    };
  }

  /**
   * Makes the new span a child of the span identified by the metadata, typically extracted from
   * an incoming request. The child's recording is not added to any parent; the caller is
   * responsible for returning it, see {@link Span#importRemoteSpans(java.util.List)}. A null or
   * {@linkplain SpanMeta#isNoop() no-op} meta is ignored.
   */
  public static SpanOption withParentAndManualCollection(@Nullable final SpanMeta remoteParent) {
    return new SpanOption() {
      @Override void apply(SpanOptions options) {
        options.remoteParentOption = true;
        options.remoteParent = remoteParent;
      }

      @Override public String toString() {
        return "WithParentAndManualCollection(" + remoteParent + ")";
      }
    };
  }

  /** Relates the new span to its parent as "follows from" instead of "child of". */
  public static SpanOption withFollowsFrom() {
    return FOLLOWS_FROM;
  }

  /** Creates a real span even when tracing would otherwise use the no-op span. */
  public static SpanOption withForceRealSpan() {
    return FORCE_REAL_SPAN;
  }

  /**
   * Starts the span recording. Takes precedence over the recording type inherited from a parent.
   */
  public static SpanOption withRecording(final RecordingType recordingType) {
    if (recordingType == null) throw new NullPointerException("recordingType == null");
    return new SpanOption() {
      @Override void apply(SpanOptions options) {
        options.recordingType = recordingType;
      }

      @Override public String toString() {
        return "WithRecording(" + recordingType + ")";
      }
    };
  }

  /** Tags to set on the new span. They do not propagate to children. */
  public static SpanOption withTags(final Map<String, String> tags) {
    if (tags == null) throw new NullPointerException("tags == null");
    return new SpanOption() {
      @Override void apply(SpanOptions options) {
        options.tags.putAll(tags);
      }

      @Override public String toString() {
        return "WithTags(" + tags + ")";
      }
    };
  }

  /**
   * Log tags to use instead of those of the propagation context. Unlike tags, log tags are
   * inherited by children.
   */
  public static SpanOption withLogTags(final LogTags logTags) {
    if (logTags == null) throw new NullPointerException("logTags == null");
    return new SpanOption() {
      @Override void apply(SpanOptions options) {
        options.logTags = logTags;
      }

      @Override public String toString() {
        return "WithLogTags(" + logTags + ")";
      }
    };
  }

  /**
   * Keeps a root span out of the registry enumerated by {@link Tracer#visitSpans(SpanVisitor)}.
   * Use for spans that are short-lived or internal.
   */
  public static SpanOption withBypassRegistry() {
    return BYPASS_REGISTRY;
  }

  static final SpanOption FOLLOWS_FROM = new SpanOption() {
    @Override void apply(SpanOptions options) {
      options.referenceType = ReferenceType.FOLLOWS_FROM;
    }

    @Override public String toString() {
      return "WithFollowsFrom()";
    }
  };

  static final SpanOption FORCE_REAL_SPAN = new SpanOption() {
    @Override void apply(SpanOptions options) {
      options.forceRealSpan = true;
    }

    @Override public String toString() {
      return "WithForceRealSpan()";
    }
  };

  static final SpanOption BYPASS_REGISTRY = new SpanOption() {
    @Override void apply(SpanOptions options) {
      options.bypassRegistry = true;
    }

    @Override public String toString() {
      return "WithBypassRegistry()";
    }
  };

  abstract void apply(SpanOptions options);

  SpanOption() {
  }
}
