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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tstable.data.LabelSet;
import net.tstable.data.Row;
import net.tstable.query.ReturnAs;

/**
 * Line name to values, each list aligned to the shared timestamp sequence.
 *
 * @since 1.0
 */
public class LineMap implements FormattedResult {

  private final List<String> lines;
  private final List<Long> timestamps;
  private final List<LabelSet> identities;
  private final Map<String, List<Double>> values;

  public LineMap(final List<String> lines, final List<Row> rows) {
    this.lines = ImmutableList.copyOf(lines);
    final List<Long> ts = Lists.newArrayListWithCapacity(rows.size());
    final List<LabelSet> ids = Lists.newArrayListWithCapacity(rows.size());
    final Map<String, List<Double>> map = new LinkedHashMap<String, List<Double>>();
    for (final String line : lines) {
      map.put(line, Lists.<Double>newArrayListWithCapacity(rows.size()));
    }
    for (final Row row : rows) {
      ts.add(row.timestamp());
      ids.add(row.identity());
      for (int i = 0; i < lines.size(); i++) {
        map.get(lines.get(i)).add(row.value(i));
      }
    }
    for (final String line : lines) {
      map.put(line, Collections.unmodifiableList(map.get(line)));
    }
    timestamps = Collections.unmodifiableList(ts);
    identities = Collections.unmodifiableList(ids);
    values = Collections.unmodifiableMap(map);
  }

  /** @return The shared timestamps in seconds. */
  public List<Long> getTimestamps() {
    return timestamps;
  }

  /**
   * @param line A line name.
   * @return The values aligned to the timestamps, null where absent, or null
   * if the line is unknown.
   */
  public List<Double> getLine(final String line) {
    return values.get(line);
  }

  /** @return The line to values map in line order. */
  public Map<String, List<Double>> asMap() {
    return values;
  }

  /** @return The identity of each timestamp. */
  public List<LabelSet> getIdentities() {
    return identities;
  }

  @Override
  public ReturnAs shape() {
    return ReturnAs.LINES;
  }

  @Override
  public int size() {
    return timestamps.size();
  }

  @Override
  public List<Row> toRows() {
    final List<Row> rows = Lists.newArrayListWithCapacity(timestamps.size());
    for (int r = 0; r < timestamps.size(); r++) {
      final Double[] row = new Double[lines.size()];
      for (int i = 0; i < lines.size(); i++) {
        row[i] = values.get(lines.get(i)).get(r);
      }
      rows.add(new Row(timestamps.get(r), identities.get(r), lines, row));
    }
    return rows;
  }

  @Override
  public String toString() {
    return "timestamps=" + timestamps + ", " + values;
  }
}
