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
package net.tstable.ingest;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tstable.common.Const;
import net.tstable.exceptions.StoreException;
import net.tstable.naming.KeyNamingScheme;
import net.tstable.storage.Direction;
import net.tstable.storage.TimeSeriesStore;
import net.tstable.table.TableDefinition;

/**
 * Overwrites the values of some lines at a timestamp that already holds a
 * point. Lines not named keep their values. Rules recompute the buckets of
 * the compacted timeframes from the corrected points.
 *
 * @since 1.0
 */
public class UpdateCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(UpdateCoordinator.class);

  private final TimeSeriesStore store;
  private final long write_timeout;

  /**
   * Default ctor.
   * @param store The non-null store.
   * @param write_timeout How long to wait on the writes in milliseconds.
   */
  public UpdateCoordinator(final TimeSeriesStore store,
                           final long write_timeout) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (write_timeout < 1) {
      throw new IllegalArgumentException("Write timeout must be positive.");
    }
    this.store = store;
    this.write_timeout = write_timeout;
  }

  /**
   * Updates lines in the table's default timeframe.
   * @see #update(TableDefinition, Map, String, String, long, String)
   */
  public IngestResult update(final TableDefinition table,
                             final Map<String, ? extends Number> values,
                             final String c1,
                             final String c2,
                             final long timestamp) {
    return update(table, values, c1, c2, timestamp, null);
  }

  /**
   * Updates lines at a timestamp. Every named line must already hold a
   * point at the timestamp, otherwise nothing is written.
   * @param table The non-null table definition.
   * @param values A non-empty map of line names to new values.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param timestamp Timestamp in seconds.
   * @param timeframe A writable timeframe or null for the default.
   * @return The result with the count of lines updated.
   */
  public IngestResult update(final TableDefinition table,
                             final Map<String, ? extends Number> values,
                             final String c1,
                             final String c2,
                             final long timestamp,
                             final String timeframe) {
    final long ms = timestamp * Const.MILLIS_PER_SECOND;
    final Map<String, String> keys = Maps.newLinkedHashMap();
    try {
      if (values == null || values.isEmpty()) {
        throw new IllegalArgumentException("No line values to update.");
      }
      final String target = IngestCoordinator.checkTarget(table, timeframe);
      for (final Entry<String, ? extends Number> entry : values.entrySet()) {
        if (entry.getValue() == null) {
          throw new IllegalArgumentException("Value for line '"
              + entry.getKey() + "' cannot be null.");
        }
        final String line = table.getLines().get(table.lineIndex(entry.getKey()));
        final String key = KeyNamingScheme.keyName(table, c1, c2, target, line);
        if (store.range(key, ms, ms, 1, Direction.FORWARD).isEmpty()) {
          throw new IllegalStateException("No point at " + timestamp
              + " for line '" + line + "' of " + c1 + ":" + c2
              + ", nothing updated.");
        }
        keys.put(entry.getKey(), key);
      }
    } catch (IllegalArgumentException | IllegalStateException | StoreException e) {
      LOG.warn("Rejected update for " + table.getName() + ":" + c1 + ":" + c2
          + "@" + timestamp + ": " + e.getMessage());
      return IngestResult.rejected(e.getMessage(), e);
    }

    final PendingWrites pending = new PendingWrites();
    for (final Entry<String, String> entry : keys.entrySet()) {
      pending.add(store.append(entry.getValue(), ms,
          values.get(entry.getKey()).doubleValue()), 0, entry.getValue(),
          entry.getKey().toLowerCase(), timestamp);
    }
    final List<PointFailure> failures = Lists.newArrayList();
    final long written = pending.join(write_timeout, failures);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Updated " + written + " lines of " + table.getName() + ":"
          + c1 + ":" + c2 + "@" + timestamp);
    }
    return IngestResult.of(written, failures);
  }
}
