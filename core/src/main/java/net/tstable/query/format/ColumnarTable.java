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
package net.tstable.query.format;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tstable.data.LabelSet;
import net.tstable.data.Row;
import net.tstable.query.ReturnAs;

/**
 * A table with a {@code timestamp} column followed by one column per line.
 * Absent values are null cells.
 *
 * @since 1.0
 */
public class ColumnarTable implements FormattedResult {

  /** Name of the first column. */
  public static final String TIMESTAMP_COLUMN = "timestamp";

  private final List<String> lines;
  private final List<String> column_names;
  private final List<Long> timestamps;
  private final List<List<Double>> columns;
  private final List<LabelSet> identities;

  /**
   * Default ctor.
   * @param lines The line names.
   * @param rows The rows to lay out.
   */
  public ColumnarTable(final List<String> lines, final List<Row> rows) {
    this.lines = ImmutableList.copyOf(lines);
    column_names = ImmutableList.<String>builder()
        .add(TIMESTAMP_COLUMN)
        .addAll(lines)
        .build();
    final List<Long> ts = Lists.newArrayListWithCapacity(rows.size());
    final List<LabelSet> ids = Lists.newArrayListWithCapacity(rows.size());
    final List<List<Double>> cols = Lists.newArrayListWithCapacity(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      cols.add(Lists.<Double>newArrayListWithCapacity(rows.size()));
    }
    for (final Row row : rows) {
      ts.add(row.timestamp());
      ids.add(row.identity());
      for (int i = 0; i < lines.size(); i++) {
        cols.get(i).add(row.value(i));
      }
    }
    timestamps = Collections.unmodifiableList(ts);
    identities = Collections.unmodifiableList(ids);
    final List<List<Double>> frozen = Lists.newArrayListWithCapacity(cols.size());
    for (final List<Double> col : cols) {
      frozen.add(Collections.unmodifiableList(col));
    }
    columns = Collections.unmodifiableList(frozen);
  }

  /** @return The column names, timestamp first. */
  public List<String> getColumnNames() {
    return column_names;
  }

  /** @return The timestamp column in seconds. */
  public List<Long> getTimestamps() {
    return timestamps;
  }

  /**
   * @param name A column name.
   * @return The column, timestamps as longs and values as nullable doubles.
   * @throws IllegalArgumentException if there is no such column.
   */
  public List<?> getColumn(final String name) {
    if (TIMESTAMP_COLUMN.equals(name)) {
      return timestamps;
    }
    final int idx = lines.indexOf(name);
    if (idx < 0) {
      throw new IllegalArgumentException("No such column: " + name);
    }
    return columns.get(idx);
  }

  /**
   * @param row A row index.
   * @param column A column index, 0 being the timestamp.
   * @return The cell, may be null.
   */
  public Object getValue(final int row, final int column) {
    return column == 0 ? timestamps.get(row) : columns.get(column - 1).get(row);
  }

  /** @return The identity of each row. */
  public List<LabelSet> getIdentities() {
    return identities;
  }

  @Override
  public ReturnAs shape() {
    return ReturnAs.COLUMNS;
  }

  @Override
  public int size() {
    return timestamps.size();
  }

  @Override
  public List<Row> toRows() {
    final List<Row> rows = Lists.newArrayListWithCapacity(timestamps.size());
    for (int r = 0; r < timestamps.size(); r++) {
      final Double[] values = new Double[lines.size()];
      for (int i = 0; i < lines.size(); i++) {
        values[i] = columns.get(i).get(r);
      }
      rows.add(new Row(timestamps.get(r), identities.get(r), lines, values));
    }
    return rows;
  }

  @Override
  public String toString() {
    return column_names + " x " + timestamps.size();
  }
}
