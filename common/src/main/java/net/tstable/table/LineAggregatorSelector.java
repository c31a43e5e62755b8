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

import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableMap;

/**
 * Selects the same aggregator for a line in every compacted timeframe, e.g.
 * {@code open -> first, high -> max, low -> min, close -> last,
 * volume -> sum} for candles. Lines without a mapping get no rule.
 *
 * @since 1.0
 */
public class LineAggregatorSelector implements AggregatorSelector {

  /** Line name to aggregator name. */
  private final Map<String, String> aggregators;

  /**
   * Default ctor.
   * @param aggregators A non-null map of line names to aggregator names.
   */
  public LineAggregatorSelector(final Map<String, String> aggregators) {
    if (aggregators == null) {
      throw new IllegalArgumentException("Aggregator map cannot be null.");
    }
    final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (final Entry<String, String> entry : aggregators.entrySet()) {
      builder.put(entry.getKey().toLowerCase(), entry.getValue());
    }
    this.aggregators = builder.build();
  }

  @Override
  public String select(final String c1,
                       final String c2,
                       final String line,
                       final String timeframe_name,
                       final TimeframeSpec timeframe_spec,
                       final String source_key,
                       final String dest_key) {
    return aggregators.get(line);
  }

  /** @return The line to aggregator mapping. */
  public Map<String, String> getAggregators() {
    return aggregators;
  }

  @Override
  public String toString() {
    return "lines" + aggregators;
  }
}
