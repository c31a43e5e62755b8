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

/**
 * A single (timestamp, value) sample of one physical series as the store
 * returns it. Timestamps are in milliseconds.
 *
 * @since 1.0
 */
public final class DataPoint {

  /** Epoch timestamp in milliseconds. */
  private final long timestamp;

  /** The value. */
  private final double value;

  /**
   * Default ctor.
   * @param timestamp Epoch timestamp in milliseconds.
   * @param value The value.
   */
  public DataPoint(final long timestamp, final double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  /** @return Epoch timestamp in milliseconds. */
  public long timestamp() {
    return timestamp;
  }

  /** @return The value. */
  public double value() {
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final DataPoint other = (DataPoint) o;
    return timestamp == other.timestamp
        && Double.compare(value, other.value) == 0;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(timestamp) * 31 + Double.hashCode(value);
  }

  @Override
  public String toString() {
    return "(" + timestamp + ", " + value + ")";
  }
}
