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
package net.tstable.query;

import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.tstable.common.Const;
import net.tstable.naming.KeyNamingScheme;
import net.tstable.table.TableDefinition;

/**
 * Selects the series a read covers. An exact classifier pair without label
 * predicates is resolved by deriving the keys; anything else goes through
 * the store's label index.
 *
 * @since 1.0
 */
public class SeriesFilter {

  private final String c1;
  private final String c2;
  private final Map<String, String> c2_labels;
  private final Map<String, String> extra_labels;
  private final String timeframe;

  protected SeriesFilter(final Builder builder) {
    c1 = builder.c1 == null ? null : KeyNamingScheme.normalize("c1", builder.c1);
    c2 = builder.c2 == null ? null : KeyNamingScheme.normalize("c2", builder.c2);
    c2_labels = checkLabels(builder.c2_labels);
    extra_labels = checkLabels(builder.extra_labels);
    timeframe = Strings.isNullOrEmpty(builder.timeframe) ? null :
      builder.timeframe.toLowerCase();
  }

  /** @return The first classifier or null to match any. */
  public String getC1() {
    return c1;
  }

  /** @return The second classifier or null to match any. */
  public String getC2() {
    return c2;
  }

  /** @return Label values the second classifier's series must carry. */
  public Map<String, String> getC2Labels() {
    return c2_labels;
  }

  /** @return Additional label values the series must carry. */
  public Map<String, String> getExtraLabels() {
    return extra_labels;
  }

  /** @return The timeframe or null for the table's default. */
  public String getTimeframe() {
    return timeframe;
  }

  /** @return True if both classifiers are given and no label predicate. */
  public boolean isExactPair() {
    return c1 != null && c2 != null && c2_labels.isEmpty()
        && extra_labels.isEmpty();
  }

  /**
   * @param table The table.
   * @return The timeframe to read, validated against the table.
   */
  public String resolveTimeframe(final TableDefinition table) {
    final String tf = timeframe == null ? table.getDefaultWriteTimeframe() :
      timeframe;
    table.getTimeframe(tf);
    return tf;
  }

  /**
   * Builds the label predicate matching the filtered series of every line.
   * @param table The table.
   * @return The predicate.
   */
  public Map<String, String> toPredicate(final TableDefinition table) {
    final Map<String, String> predicate = Maps.newHashMap();
    predicate.putAll(c2_labels);
    predicate.putAll(extra_labels);
    predicate.put(Const.TABLE_LABEL, table.getName());
    predicate.put(Const.TIMEFRAME_LABEL, resolveTimeframe(table));
    if (c1 != null) {
      predicate.put(Const.C1_LABEL, c1);
    }
    if (c2 != null) {
      predicate.put(Const.C2_LABEL, c2);
    }
    return predicate;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{c1=")
        .append(c1)
        .append(", c2=")
        .append(c2)
        .append(", c2Labels=")
        .append(c2_labels)
        .append(", extraLabels=")
        .append(extra_labels)
        .append(", timeframe=")
        .append(timeframe)
        .append("}")
        .toString();
  }

  /**
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @return A filter for one pair in the default timeframe.
   */
  public static SeriesFilter of(final String c1, final String c2) {
    return newBuilder().setC1(c1).setC2(c2).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private static Map<String, String> checkLabels(final Map<String, String> labels) {
    if (labels == null || labels.isEmpty()) {
      return Collections.emptyMap();
    }
    for (final Entry<String, String> entry : labels.entrySet()) {
      if (Strings.isNullOrEmpty(entry.getKey())
          || Strings.isNullOrEmpty(entry.getValue())) {
        throw new IllegalArgumentException("Label predicate names and values "
            + "cannot be null or empty: " + labels);
      }
      if (Const.RESERVED_LABELS.contains(entry.getKey())) {
        throw new IllegalArgumentException("Label predicate '" + entry.getKey()
            + "' is reserved, use the filter fields instead.");
      }
    }
    return ImmutableMap.copyOf(labels);
  }

  public static class Builder {
    private String c1;
    private String c2;
    private Map<String, String> c2_labels;
    private Map<String, String> extra_labels;
    private String timeframe;

    public Builder setC1(final String c1) {
      this.c1 = c1;
      return this;
    }

    public Builder setC2(final String c2) {
      this.c2 = c2;
      return this;
    }

    /**
     * @param c2_labels Labels selecting the second classifier's series
     * instead of an exact value.
     * @return The builder.
     */
    public Builder setC2Labels(final Map<String, String> c2_labels) {
      this.c2_labels = c2_labels;
      return this;
    }

    public Builder setExtraLabels(final Map<String, String> extra_labels) {
      this.extra_labels = extra_labels;
      return this;
    }

    public Builder setTimeframe(final String timeframe) {
      this.timeframe = timeframe;
      return this;
    }

    public SeriesFilter build() {
      return new SeriesFilter(this);
    }
  }
}
