/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable key/value pairs describing the request a span belongs to, such as a node or
 * range identifier. Unlike {@link Span#tag(String, String) tags}, log tags are inherited from the
 * {@link PropagationContext} and from a local parent when none are supplied.
 */
public final class LogTags {
  public static final LogTags EMPTY = new LogTags(Collections.<Tag>emptyList());

  public static LogTags of(String key, String value) {
    return EMPTY.with(key, value);
  }

  final List<Tag> tags;

  LogTags(List<Tag> tags) {
    this.tags = tags;
  }

  /**
   * Returns a copy with the given tag appended. If the key is already present, its value is
   * replaced in place, so the original order is kept.
   */
  public LogTags with(String key, String value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) throw new NullPointerException("value == null");
    List<Tag> result = new ArrayList<>(tags.size() + 1);
    boolean replaced = false;
    for (Tag tag : tags) {
      if (tag.key.equals(key)) {
        result.add(new Tag(key, value));
        replaced = true;
      } else {
        result.add(tag);
      }
    }
    if (!replaced) result.add(new Tag(key, value));
    return new LogTags(Collections.unmodifiableList(result));
  }

  /** The tags in insertion order. */
  public List<Tag> currentTags() {
    return tags;
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof LogTags)) return false;
    return tags.equals(((LogTags) o).tags);
  }

  @Override public int hashCode() {
    return tags.hashCode();
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder("[");
    for (int i = 0; i < tags.size(); i++) {
      if (i > 0) result.append(',');
      result.append(tags.get(i));
    }
    return result.append(']').toString();
  }

  public static final class Tag {
    final String key, value;

    Tag(String key, String value) {
      this.key = key;
      this.value = value;
    }

    public String key() {
      return key;
    }

    public String value() {
      return value;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Tag)) return false;
      Tag that = (Tag) o;
      return key.equals(that.key) && value.equals(that.value);
    }

    @Override public int hashCode() {
      return key.hashCode() * 1000003 ^ value.hashCode();
    }

    @Override public String toString() {
      return value.isEmpty() ? key : key + "=" + value;
    }
  }
}
