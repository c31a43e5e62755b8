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
 * The physical identifier of one series, {@code table:c1:c2:timeframe:line},
 * always paired with its label set.
 *
 * @since 1.0
 */
public final class SeriesKey {

  /** The store key. */
  private final String key;

  /** The labels attached to the series. */
  private final LabelSet labels;

  /**
   * Default ctor.
   * @param key The non-null store key.
   * @param labels The non-null labels.
   */
  public SeriesKey(final String key, final LabelSet labels) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    this.key = key;
    this.labels = labels;
  }

  /** @return The store key. */
  public String key() {
    return key;
  }

  /** @return The labels attached to the series. */
  public LabelSet labels() {
    return labels;
  }

  /** @return The line label. */
  public String line() {
    return labels.line();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final SeriesKey other = (SeriesKey) o;
    return key.equals(other.key) && labels.equals(other.labels);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + labels;
  }
}
