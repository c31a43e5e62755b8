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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

/**
 * One logical row: a timestamp in seconds and one value per line of the
 * table, in line order. A value is null when the line has no point at the
 * timestamp. The identity names the stream the row was read from.
 *
 * @since 1.0
 */
public final class Row {

  /** Identities in natural order, rows without one first. */
  private static final Ordering<LabelSet> IDENTITY_ORDER =
      Ordering.<LabelSet>natural().nullsFirst();

  /** Orders rows by timestamp, then identity, then values. Absent values
   * sort first. */
  public static final Comparator<Row> ORDER = new Comparator<Row>() {
    @Override
    public int compare(final Row a, final Row b) {
      int cmp = ComparisonChain.start()
          .compare(a.timestamp, b.timestamp)
          .compare(a.identity, b.identity, IDENTITY_ORDER)
          .result();
      if (cmp != 0) {
        return cmp;
      }
      final int len = Math.min(a.values.length, b.values.length);
      for (int i = 0; i < len; i++) {
        cmp = compareValues(a.values[i], b.values[i]);
        if (cmp != 0) {
          return cmp;
        }
      }
      return Integer.compare(a.values.length, b.values.length);
    }
  };

  /** Epoch timestamp in seconds. */
  private final long timestamp;

  /** The stream the row belongs to, labels without the line. */
  private final LabelSet identity;

  /** The line names, shared by every row of a result. */
  private final List<String> lines;

  /** One value per line, null when absent. */
  private final Double[] values;

  /**
   * Default ctor.
   * @param timestamp Epoch timestamp in seconds.
   * @param identity The identity of the stream, may be null for rows built
   * by callers.
   * @param lines The non-null line names.
   * @param values The values, one per line. The array is not copied.
   * @throws IllegalArgumentException if the value count doesn't match the
   * line count.
   */
  public Row(final long timestamp,
             final LabelSet identity,
             final List<String> lines,
             final Double[] values) {
    if (lines == null || values == null) {
      throw new IllegalArgumentException("Lines and values cannot be null.");
    }
    if (lines.size() != values.length) {
      throw new IllegalArgumentException("Row has " + values.length
          + " values for " + lines.size() + " lines.");
    }
    this.timestamp = timestamp;
    this.identity = identity;
    this.lines = lines;
    this.values = values;
  }

  /** @return Epoch timestamp in seconds. */
  public long timestamp() {
    return timestamp;
  }

  /** @return The identity, may be null. */
  public LabelSet identity() {
    return identity;
  }

  /** @return The line names. */
  public List<String> lines() {
    return lines;
  }

  /** @return The number of values. */
  public int size() {
    return values.length;
  }

  /**
   * @param index A zero based line index.
   * @return The value or null if absent.
   */
  public Double value(final int index) {
    return values[index];
  }

  /**
   * @param line A line name.
   * @return The value or null if absent.
   * @throws IllegalArgumentException if the line is not part of the row.
   */
  public Double value(final String line) {
    final int idx = lines.indexOf(line);
    if (idx < 0) {
      throw new IllegalArgumentException("No such line '" + line
          + "' in " + lines);
    }
    return values[idx];
  }

  /**
   * @param index A zero based line index.
   * @return True if the line has a value in this row.
   */
  public boolean has(final int index) {
    return values[index] != null;
  }

  /** @return A copy of the values. */
  public Double[] values() {
    return Arrays.copyOf(values, values.length);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Row other = (Row) o;
    return timestamp == other.timestamp
        && Objects.equal(identity, other.identity)
        && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(timestamp, identity) * 31 + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("(")
        .append(timestamp)
        .append(", ")
        .append(Arrays.toString(values))
        .append(identity == null ? "" : ", " + identity)
        .append(")")
        .toString();
  }

  private static int compareValues(final Double a, final Double b) {
    if (a == null) {
      return b == null ? 0 : -1;
    }
    if (b == null) {
      return 1;
    }
    return Double.compare(a, b);
  }
}
