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

/**
 * Picks the aggregator of the downsampling rule feeding one line of one
 * compacted timeframe. Called once per (line, timeframe) when the series of
 * a classifier pair are created.
 *
 * @since 1.0
 */
public interface AggregatorSelector {

  /**
   * Picks the aggregator for a rule.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param line The line name.
   * @param timeframe_name The name of the destination timeframe.
   * @param timeframe_spec The settings of the destination timeframe.
   * @param source_key The key of the source series.
   * @param dest_key The key of the destination series.
   * @return An aggregator name as understood by
   * {@link AggregatorKind#fromString(String)} or null to skip the rule.
   */
  public String select(final String c1,
                       final String c2,
                       final String line,
                       final String timeframe_name,
                       final TimeframeSpec timeframe_spec,
                       final String source_key,
                       final String dest_key);

  /** A selector that never creates rules. */
  public static final AggregatorSelector NONE = new AggregatorSelector() {
    @Override
    public String select(final String c1,
                         final String c2,
                         final String line,
                         final String timeframe_name,
                         final TimeframeSpec timeframe_spec,
                         final String source_key,
                         final String dest_key) {
      return null;
    }

    @Override
    public String toString() {
      return "none";
    }
  };
}
