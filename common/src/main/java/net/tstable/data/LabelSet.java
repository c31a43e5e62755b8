// This file is part of TSTable.
// Copyright (C) 2026 The TSTable Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tstable.data;

import java.util.Map;
import java.util.Map.Entry;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedMap;

import net.tstable.common.Const;

/**
 * An immutable, sorted set of label name to value pairs attached to a
 * physical series. A full label set carries the table, both classifiers, the
 * line and the timeframe plus any extra labels. With the line removed it
 * describes an identity, i.e. one logical row stream.
 * <p>
 * Label sets sort by their canonical string so that identities can be ordered
 * deterministically when rows of several identities share a timestamp.
 *
 * @since 1.0
 */
public final class LabelSet implements Comparable<LabelSet> {

  /** The sorted labels. */
  private final ImmutableSortedMap<String, String> labels;

  /** Cached canonical form. */
  private final String canonical;

  private LabelSet(final Map<String, String> labels) {
    this.labels = ImmutableSortedMap.copyOf(labels);
    final StringBuilder buf = new StringBuilder("{");
    boolean first = true;
    for (final Entry<String, String> entry : this.labels.entrySet()) {
      if (!first) {
        buf.append(", ");
      }
      buf.append(entry.getKey())
         .append("=")
         .append(entry.getValue());
      first = false;
    }
    canonical = buf.append("}").toString();
  }

  /**
   * Wraps a copy of the given map.
   * @param labels A non-null map without null or empty keys or values.
   * @return The label set.
   * @throws IllegalArgumentException if a key or value was null or empty.
   */
  public static LabelSet of(final Map<String, String> labels) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    for (final Entry<String, String> entry : labels.entrySet()) {
      if (Strings.isNullOrEmpty(entry.getKey())) {
        throw new IllegalArgumentException("Label names cannot be null or empty.");
      }
      if (Strings.isNullOrEmpty(entry.getValue())) {
        throw new IllegalArgumentException("Value of label '" + entry.getKey()
            + "' cannot be null or empty.");
      }
    }
    return new LabelSet(labels);
  }

  /** @return The unmodifiable sorted label map. */
  public Map<String, String> asMap() {
    return labels;
  }

  /**
   * @param name A label name.
   * @return The value of the label or null if not present.
   */
  public String get(final String name) {
    return labels.get(name);
  }

  /** @return The table label or null. */
  public String table() {
    return labels.get(Const.TABLE_LABEL);
  }

  /** @return The first classifier or null. */
  public String c1() {
    return labels.get(Const.C1_LABEL);
  }

  /** @return The second classifier or null. */
  public String c2() {
    return labels.get(Const.C2_LABEL);
  }

  /** @return The line name or null for an identity. */
  public String line() {
    return labels.get(Const.LINE_LABEL);
  }

  /** @return The timeframe name or null. */
  public String timeframe() {
    return labels.get(Const.TIMEFRAME_LABEL);
  }

  /** @return The labels without the line, i.e. the identity of the stream. */
  public LabelSet withoutLine() {
    if (!labels.containsKey(Const.LINE_LABEL)) {
      return this;
    }
    final ImmutableSortedMap.Builder<String, String> builder =
        ImmutableSortedMap.naturalOrder();
    for (final Entry<String, String> entry : labels.entrySet()) {
      if (!entry.getKey().equals(Const.LINE_LABEL)) {
        builder.put(entry);
      }
    }
    return new LabelSet(builder.build());
  }

  /**
   * Whether or not every pair of the predicate is present in this set.
   * @param predicate A non-null map of label names to required values.
   * @return True if all labels match.
   */
  public boolean matches(final Map<String, String> predicate) {
    for (final Entry<String, String> entry : predicate.entrySet()) {
      if (!entry.getValue().equals(labels.get(entry.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int compareTo(final LabelSet other) {
    return canonical.compareTo(other.canonical);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Objects.equal(labels, ((LabelSet) o).labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return canonical;
  }
}
