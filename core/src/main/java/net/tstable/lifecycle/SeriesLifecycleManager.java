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
package net.tstable.lifecycle;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tstable.core.OperationResult;
import net.tstable.data.SeriesKey;
import net.tstable.exceptions.StoreException;
import net.tstable.exceptions.TableDefinitionException;
import net.tstable.naming.KeyNamingScheme;
import net.tstable.storage.CreateStatus;
import net.tstable.storage.DuplicatePolicy;
import net.tstable.storage.SeriesInfo;
import net.tstable.storage.TimeSeriesStore;
import net.tstable.table.AggregatorKind;
import net.tstable.table.TableDefinition;
import net.tstable.table.TimeframeSpec;

/**
 * Creates the physical series of a classifier pair, one per timeframe and
 * line, and wires the downsampling rules feeding the compacted timeframes.
 * <p>
 * Creation is idempotent: series that exist with the expected retention are
 * left alone and rules already feeding a destination from the expected
 * source are not created twice. A series that exists with a different
 * retention, or a destination fed from another source, fails the call.
 * <p>
 * Series are created with the {@link DuplicatePolicy#LAST} policy so a
 * second write at a timestamp replaces the first.
 *
 * @since 1.0
 */
public class SeriesLifecycleManager {
  private static final Logger LOG = LoggerFactory.getLogger(SeriesLifecycleManager.class);

  /** The store to create series in. */
  private final TimeSeriesStore store;

  /**
   * Default ctor.
   * @param store The non-null store.
   */
  public SeriesLifecycleManager(final TimeSeriesStore store) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.store = store;
  }

  /**
   * Creates every series and rule of a classifier pair.
   * @param table The non-null table definition.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param extra_labels Optional labels added to every series, may be null.
   * @return A result whose count is the number of series created by this
   * call. Failures carry the cause.
   */
  public OperationResult create(final TableDefinition table,
                                final String c1,
                                final String c2,
                                final Map<String, String> extra_labels) {
    int created = 0;
    try {
      for (final String line : table.getLines()) {
        created += createLineSeries(table, c1, c2, line, extra_labels);
      }
      int rules = 0;
      for (final String line : table.getLines()) {
        rules += wireRules(table, c1, c2, line);
      }
      final String msg = "Created " + created + " series and " + rules
          + " rules for " + table.getName() + ":" + c1 + ":" + c2;
      if (LOG.isDebugEnabled()) {
        LOG.debug(msg);
      }
      return OperationResult.ok(msg, created);
    } catch (IllegalArgumentException | IllegalStateException e) {
      LOG.warn("Failed to create series for " + table.getName() + ":" + c1
          + ":" + c2 + ": " + e.getMessage());
      return OperationResult.failed(e.getMessage(), created, e);
    } catch (StoreException e) {
      LOG.error("Store failure creating series for " + table.getName() + ":"
          + c1 + ":" + c2, e);
      return OperationResult.failed(e.getMessage(), created, e);
    }
  }

  /**
   * Creates the series of one line in every timeframe, without rules.
   * @param table The non-null table definition.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param line A declared line.
   * @param extra_labels Optional extra labels, may be null.
   * @return The number of series created, not counting existing ones.
   * @throws StoreException if the store failed or a series exists with a
   * different retention.
   * @throws IllegalArgumentException if a name or label was invalid.
   */
  public int createLineSeries(final TableDefinition table,
                              final String c1,
                              final String c2,
                              final String line,
                              final Map<String, String> extra_labels) {
    int created = 0;
    for (final String timeframe : table.getTimeframeNames()) {
      final TimeframeSpec spec = table.getTimeframe(timeframe);
      final SeriesKey key = KeyNamingScheme.derive(table, c1, c2, timeframe,
          line, extra_labels);
      final CreateStatus status = store.createSeries(key.key(),
          spec.getRetentionMillis(), key.labels(), DuplicatePolicy.LAST);
      if (status == CreateStatus.CREATED) {
        created++;
        continue;
      }
      final SeriesInfo info = store.getInfo(key.key());
      if (info != null && info.getRetention() != spec.getRetentionMillis()) {
        throw new StoreException("create", key.key(), "series exists with a "
            + "retention of " + info.getRetention() + "ms instead of "
            + spec.getRetentionMillis() + "ms.");
      }
    }
    return created;
  }

  /**
   * Wires the rules of one line into every compacted timeframe. Rules whose
   * destination is already fed by the expected source are skipped.
   * @param table The non-null table definition.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param line A declared line.
   * @return The number of rules created.
   * @throws TableDefinitionException if the selected aggregator is unknown.
   * @throws StoreException if the store failed or a destination is fed from
   * another source.
   */
  public int wireRules(final TableDefinition table,
                       final String c1,
                       final String c2,
                       final String line) {
    final String c1_name = KeyNamingScheme.normalize("c1", c1);
    final String c2_name = KeyNamingScheme.normalize("c2", c2);
    int wired = 0;
    for (final String timeframe : table.getRuledTimeframes()) {
      final TimeframeSpec spec = table.getTimeframe(timeframe);
      final String source_key = KeyNamingScheme.keyName(table, c1, c2,
          table.getRuleSourceTimeframe(timeframe), line);
      final String dest_key = KeyNamingScheme.keyName(table, c1, c2,
          timeframe, line);
      final String selected = table.getAggregatorSelector().select(c1_name,
          c2_name, line.toLowerCase(), timeframe, spec, source_key, dest_key);
      if (selected == null) {
        continue;
      }
      final AggregatorKind aggregator;
      try {
        aggregator = AggregatorKind.fromString(selected);
      } catch (IllegalArgumentException e) {
        throw new TableDefinitionException("Unrecognized aggregator '"
            + selected + "' selected for line '" + line + "' in timeframe '"
            + timeframe + "'.", e);
      }

      final SeriesInfo dest = store.getInfo(dest_key);
      if (dest != null && dest.getSourceKey() != null) {
        if (dest.getSourceKey().equals(source_key)) {
          continue;
        }
        throw new StoreException("createrule", dest_key, "destination is "
            + "already fed from '" + dest.getSourceKey() + "' instead of '"
            + source_key + "'.");
      }
      store.createRule(source_key, dest_key, aggregator, spec.getBucketMillis());
      wired++;
      if (LOG.isDebugEnabled()) {
        LOG.debug("Wired rule " + source_key + " -> " + dest_key + " ("
            + aggregator + ", " + spec.getBucketMillis() + "ms)");
      }
    }
    return wired;
  }
}
