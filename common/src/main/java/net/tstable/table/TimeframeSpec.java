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
package net.tstable.table;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;

import net.tstable.common.Const;
import net.tstable.exceptions.TableDefinitionException;

/**
 * The retention and resolution of one timeframe of a table.
 * <p>
 * A timeframe with a bucket is a compaction target fed by a downsampling rule
 * and never written directly. A timeframe without a bucket is written by the
 * ingest path. The {@code noRules} flag marks a tier that is written directly
 * and never wired into the rule graph.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = TimeframeSpec.Builder.class)
public class TimeframeSpec {

  /** Retention in seconds, 0 means forever. */
  private final long retention;

  /** Bucket width in seconds, null for written timeframes. */
  private final Long bucket;

  /** Whether or not the timeframe is kept out of the rule graph. */
  private final boolean no_rules;

  /**
   * Protected builder ctor.
   * @param builder The non-null builder.
   * @throws TableDefinitionException if the values were out of range.
   */
  protected TimeframeSpec(final Builder builder) {
    if (builder.retention < 0) {
      throw new TableDefinitionException("Retention cannot be negative: "
          + builder.retention);
    }
    if (builder.bucket != null && builder.bucket <= 0) {
      throw new TableDefinitionException("Bucket must be greater than zero: "
          + builder.bucket);
    }
    if (builder.bucket != null && builder.noRules) {
      throw new TableDefinitionException("A timeframe without rules is "
          + "written directly and cannot declare a bucket.");
    }
    retention = builder.retention;
    bucket = builder.bucket;
    no_rules = builder.noRules;
  }

  /** @return The retention in seconds, 0 for forever. */
  @JsonProperty("retention")
  public long getRetention() {
    return retention;
  }

  /** @return The retention in milliseconds as the store expects it. */
  @JsonIgnore
  public long getRetentionMillis() {
    return retention * Const.MILLIS_PER_SECOND;
  }

  /** @return The bucket width in seconds or null if this isn't a compaction
   * target. */
  @JsonProperty("bucket")
  public Long getBucket() {
    return bucket;
  }

  /** @return The bucket width in milliseconds or 0 if not a compaction target. */
  @JsonIgnore
  public long getBucketMillis() {
    return bucket == null ? 0 : bucket * Const.MILLIS_PER_SECOND;
  }

  /** @return Whether or not this timeframe stays out of the rule graph. */
  @JsonProperty("noRules")
  public boolean isNoRules() {
    return no_rules;
  }

  /** @return True if points may be written to this timeframe directly. */
  @JsonIgnore
  public boolean isWritable() {
    return bucket == null;
  }

  /** @return True if this timeframe is fed by a downsampling rule. */
  @JsonIgnore
  public boolean isRuled() {
    return bucket != null;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeframeSpec other = (TimeframeSpec) o;
    return retention == other.retention
        && no_rules == other.no_rules
        && Objects.equal(bucket, other.bucket);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(retention, bucket, no_rules);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("retention=")
        .append(retention)
        .append(", bucket=")
        .append(bucket)
        .append(", noRules=")
        .append(no_rules)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder {
    @JsonProperty
    private long retention;
    @JsonProperty
    private Long bucket;
    @JsonProperty
    private boolean noRules;

    /**
     * @param retention Retention in seconds, 0 for forever.
     * @return The builder.
     */
    public Builder setRetention(final long retention) {
      this.retention = retention;
      return this;
    }

    /**
     * @param bucket Bucket width in seconds for compaction targets.
     * @return The builder.
     */
    public Builder setBucket(final Long bucket) {
      this.bucket = bucket;
      return this;
    }

    /**
     * @param no_rules Whether or not the timeframe is kept out of the rules.
     * @return The builder.
     */
    public Builder setNoRules(final boolean no_rules) {
      this.noRules = no_rules;
      return this;
    }

    public TimeframeSpec build() {
      return new TimeframeSpec(this);
    }
  }
}
