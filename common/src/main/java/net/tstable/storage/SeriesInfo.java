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
package net.tstable.storage;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Metadata the store keeps about one series. The raw properties carry
 * whatever the store reported so introspection calls can surface it
 * unmodified.
 *
 * @since 1.0
 */
public class SeriesInfo {

  /** The key. */
  private final String key;

  /** Retention in milliseconds, 0 for forever. */
  private final long retention;

  /** The labels of the series. */
  private final Map<String, String> labels;

  /** Rules reading from this series. */
  private final List<RuleInfo> rules;

  /** The key of the series feeding this one, null if none. */
  private final String source_key;

  /** Number of samples held. */
  private final long total_samples;

  /** Oldest timestamp in milliseconds. */
  private final long first_timestamp;

  /** Newest timestamp in milliseconds. */
  private final long last_timestamp;

  /** The duplicate policy or null if the store didn't report one. */
  private final DuplicatePolicy duplicate_policy;

  /** Everything the store reported. */
  private final Map<String, Object> properties;

  /**
   * Protected builder ctor.
   * @param builder The non-null builder.
   */
  protected SeriesInfo(final Builder builder) {
    if (builder.key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    key = builder.key;
    retention = builder.retention;
    labels = builder.labels == null ? Collections.<String, String>emptyMap() :
      ImmutableMap.copyOf(builder.labels);
    rules = builder.rules == null ? Collections.<RuleInfo>emptyList() :
      ImmutableList.copyOf(builder.rules);
    source_key = builder.source_key;
    total_samples = builder.total_samples;
    first_timestamp = builder.first_timestamp;
    last_timestamp = builder.last_timestamp;
    duplicate_policy = builder.duplicate_policy;
    properties = builder.properties == null ?
      Collections.<String, Object>emptyMap() :
      Collections.unmodifiableMap(Maps.newLinkedHashMap(builder.properties));
  }

  /** @return The key. */
  public String getKey() {
    return key;
  }

  /** @return Retention in milliseconds, 0 for forever. */
  public long getRetention() {
    return retention;
  }

  /** @return The labels of the series. */
  public Map<String, String> getLabels() {
    return labels;
  }

  /** @return Rules reading from this series. */
  public List<RuleInfo> getRules() {
    return rules;
  }

  /** @return The key of the series feeding this one, null if none. */
  public String getSourceKey() {
    return source_key;
  }

  /** @return Number of samples held. */
  public long getTotalSamples() {
    return total_samples;
  }

  /** @return Oldest timestamp in milliseconds. */
  public long getFirstTimestamp() {
    return first_timestamp;
  }

  /** @return Newest timestamp in milliseconds. */
  public long getLastTimestamp() {
    return last_timestamp;
  }

  /** @return The duplicate policy or null if unknown. */
  public DuplicatePolicy getDuplicatePolicy() {
    return duplicate_policy;
  }

  /** @return Everything the store reported. */
  public Map<String, Object> getProperties() {
    return properties;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("key=")
        .append(key)
        .append(", retention=")
        .append(retention)
        .append(", labels=")
        .append(labels)
        .append(", rules=")
        .append(rules)
        .append(", sourceKey=")
        .append(source_key)
        .append(", totalSamples=")
        .append(total_samples)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String key;
    private long retention;
    private Map<String, String> labels;
    private List<RuleInfo> rules;
    private String source_key;
    private long total_samples;
    private long first_timestamp;
    private long last_timestamp;
    private DuplicatePolicy duplicate_policy;
    private Map<String, Object> properties;

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder setRetention(final long retention) {
      this.retention = retention;
      return this;
    }

    public Builder setLabels(final Map<String, String> labels) {
      this.labels = labels;
      return this;
    }

    public Builder setRules(final List<RuleInfo> rules) {
      this.rules = rules;
      return this;
    }

    public Builder addRule(final RuleInfo rule) {
      if (rules == null) {
        rules = Lists.newArrayList();
      }
      rules.add(rule);
      return this;
    }

    public Builder setSourceKey(final String source_key) {
      this.source_key = source_key;
      return this;
    }

    public Builder setTotalSamples(final long total_samples) {
      this.total_samples = total_samples;
      return this;
    }

    public Builder setFirstTimestamp(final long first_timestamp) {
      this.first_timestamp = first_timestamp;
      return this;
    }

    public Builder setLastTimestamp(final long last_timestamp) {
      this.last_timestamp = last_timestamp;
      return this;
    }

    public Builder setDuplicatePolicy(final DuplicatePolicy duplicate_policy) {
      this.duplicate_policy = duplicate_policy;
      return this;
    }

    public Builder setProperties(final Map<String, Object> properties) {
      this.properties = properties;
      return this;
    }

    public SeriesInfo build() {
      return new SeriesInfo(this);
    }
  }
}
