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

import com.google.common.base.Objects;

import net.tstable.table.AggregatorKind;

/**
 * A downsampling rule as reported by the store for its source series.
 *
 * @since 1.0
 */
public final class RuleInfo {

  /** The destination key. */
  private final String dest_key;

  /** The bucket width in milliseconds. */
  private final long bucket;

  /** The aggregation or null if the store reported one we don't know. */
  private final AggregatorKind aggregator;

  /**
   * Default ctor.
   * @param dest_key The non-null destination key.
   * @param bucket The bucket width in milliseconds.
   * @param aggregator The aggregation, may be null.
   */
  public RuleInfo(final String dest_key,
                  final long bucket,
                  final AggregatorKind aggregator) {
    this.dest_key = dest_key;
    this.bucket = bucket;
    this.aggregator = aggregator;
  }

  /** @return The destination key. */
  public String destKey() {
    return dest_key;
  }

  /** @return The bucket width in milliseconds. */
  public long bucket() {
    return bucket;
  }

  /** @return The aggregation, may be null. */
  public AggregatorKind aggregator() {
    return aggregator;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RuleInfo other = (RuleInfo) o;
    return bucket == other.bucket
        && Objects.equal(dest_key, other.dest_key)
        && aggregator == other.aggregator;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(dest_key, bucket, aggregator);
  }

  @Override
  public String toString() {
    return dest_key + "(" + aggregator + ", " + bucket + "ms)";
  }
}
