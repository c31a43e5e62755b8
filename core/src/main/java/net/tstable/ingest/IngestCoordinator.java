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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.tstable.common.Const;
import net.tstable.core.OperationResult;
import net.tstable.data.C2Source;
import net.tstable.exceptions.IllegalDataException;
import net.tstable.exceptions.StoreException;
import net.tstable.lifecycle.SeriesLifecycleManager;
import net.tstable.naming.KeyNamingScheme;
import net.tstable.storage.TimeSeriesStore;
import net.tstable.storage.WriteStatus;
import net.tstable.table.TableDefinition;
import net.tstable.table.TimeframeSpec;

/**
 * Writes batches of rows into the series of a table. Each row is
 * {@code [timestamp, v1, ..., vN]} with one value per line in line order, or
 * carries the second classifier at a fixed offset when the batch spans
 * several identities. A null value skips that line for the row.
 * <p>
 * The whole batch is validated before anything is written. After that every
 * point is appended independently and the result lists the points that
 * failed; nothing is rolled back. Compacted timeframes are only written by
 * their rules, so naming one as the target rejects the call.
 *
 * @since 1.0
 */
public class IngestCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(IngestCoordinator.class);

  /** The store to write to. */
  private final TimeSeriesStore store;

  /** Used to create identities in place. */
  private final SeriesLifecycleManager lifecycle;

  /** How long to wait on the appends of one call, in milliseconds. */
  private final long write_timeout;

  /**
   * Default ctor.
   * @param store The non-null store.
   * @param lifecycle The non-null lifecycle manager.
   * @param write_timeout How long to wait on the appends of one call in
   * milliseconds.
   */
  public IngestCoordinator(final TimeSeriesStore store,
                           final SeriesLifecycleManager lifecycle,
                           final long write_timeout) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (lifecycle == null) {
      throw new IllegalArgumentException("Lifecycle manager cannot be null.");
    }
    if (write_timeout < 1) {
      throw new IllegalArgumentException("Write timeout must be positive.");
    }
    this.store = store;
    this.lifecycle = lifecycle;
    this.write_timeout = write_timeout;
  }

  /**
   * Writes a batch.
   * @param table The non-null table definition.
   * @param rows The rows to write.
   * @param c1 The first classifier.
   * @param c2 Where the second classifier comes from.
   * @param create_inplace Whether to create each identity's series before
   * writing to it.
   * @param extra_labels Extra labels used when creating in place, may be
   * null.
   * @param timeframe The target timeframe or null for the table's default.
   * @return The result with the count of points written and any failures.
   */
  public IngestResult insert(final TableDefinition table,
                             final List<? extends List<?>> rows,
                             final String c1,
                             final C2Source c2,
                             final boolean create_inplace,
                             final Map<String, String> extra_labels,
                             final String timeframe) {
    final String target;
    final Map<String, List<ParsedRow>> by_identity;
    try {
      target = checkTarget(table, timeframe);
      KeyNamingScheme.normalize("c1", c1);
      if (c2 == null) {
        throw new IllegalArgumentException("C2 source cannot be null.");
      }
      by_identity = parse(table, rows, c2);
    } catch (IllegalArgumentException | IllegalStateException e) {
      LOG.warn("Rejected batch for table " + table.getName() + ": "
          + e.getMessage());
      return IngestResult.rejected(e.getMessage(), e);
    }
    if (by_identity.isEmpty()) {
      return IngestResult.of(0, null);
    }

    final List<PointFailure> failures = Lists.newArrayList();
    final PendingWrites pending = new PendingWrites();
    for (final Map.Entry<String, List<ParsedRow>> entry : by_identity.entrySet()) {
      final String identity = entry.getKey();
      final WriteStatus ready = prepare(table, c1, identity, target,
          create_inplace, extra_labels);
      for (final ParsedRow row : entry.getValue()) {
        for (int i = 0; i < table.getLines().size(); i++) {
          final Double value = row.values[i];
          if (value == null) {
            continue;
          }
          final String line = table.getLines().get(i);
          final String key = KeyNamingScheme.keyName(table, c1, identity,
              target, line);
          if (ready != WriteStatus.OK) {
            failures.add(new PointFailure(row.index, key, line, row.timestamp,
                ready));
            continue;
          }
          pending.add(store.append(key, row.timestamp * Const.MILLIS_PER_SECOND,
              value), row.index, key, line, row.timestamp);
        }
      }
    }

    final long written = pending.join(write_timeout, failures);
    if (!failures.isEmpty()) {
      LOG.warn("Batch for table " + table.getName() + ":" + c1 + " wrote "
          + written + " points, " + failures.size() + " failed. First: "
          + failures.get(0));
    } else if (LOG.isDebugEnabled()) {
      LOG.debug("Wrote " + written + " points to " + table.getName() + ":"
          + c1 + " in " + target);
    }
    return IngestResult.of(written, failures);
  }

  /**
   * Resolves the target timeframe, rejecting compaction targets.
   * @param table The table.
   * @param timeframe The requested timeframe, may be null.
   * @return The writable timeframe.
   * @throws IllegalArgumentException if the timeframe is unknown or fed by a
   * rule.
   */
  static String checkTarget(final TableDefinition table,
                            final String timeframe) {
    final String target = timeframe == null ?
        table.getDefaultWriteTimeframe() : timeframe.toLowerCase();
    final TimeframeSpec spec = table.getTimeframe(target);
    if (!spec.isWritable()) {
      throw new IllegalArgumentException("Timeframe '" + target
          + "' is a compaction target fed by rules and cannot be written.");
    }
    return target;
  }

  /**
   * Makes sure the identity's series exist.
   * @return {@link WriteStatus#OK} or the status to report for every point
   * of the identity.
   */
  private WriteStatus prepare(final TableDefinition table,
                              final String c1,
                              final String c2,
                              final String target,
                              final boolean create_inplace,
                              final Map<String, String> extra_labels) {
    if (create_inplace) {
      final OperationResult created = lifecycle.create(table, c1, c2,
          extra_labels);
      return created.isSuccess() ? WriteStatus.OK :
        WriteStatus.error("Failed to create series for " + c1 + ":" + c2
            + ": " + created.getMessage(), created.getException());
    }
    final String probe = KeyNamingScheme.keyName(table, c1, c2, target,
        table.getLines().get(0));
    try {
      if (!store.exists(probe)) {
        return WriteStatus.rejected("Series for " + c1 + ":" + c2
            + " do not exist. Create them first or write in place.");
      }
    } catch (StoreException e) {
      return WriteStatus.error(e.getMessage(), e);
    }
    return WriteStatus.OK;
  }

  /**
   * Validates the batch and groups the rows by identity, in order of first
   * appearance.
   * @throws IllegalDataException if a row is malformed.
   */
  private Map<String, List<ParsedRow>> parse(final TableDefinition table,
                                             final List<? extends List<?>> rows,
                                             final C2Source c2) {
    final Map<String, List<ParsedRow>> by_identity =
        new LinkedHashMap<String, List<ParsedRow>>();
    if (rows == null) {
      return by_identity;
    }
    final int lines = table.getLines().size();
    final int expected = 1 + lines + c2.extraCells();
    for (int i = 0; i < rows.size(); i++) {
      final List<?> row = rows.get(i);
      if (row == null || row.size() != expected) {
        throw new IllegalDataException("Row " + i + " has "
            + (row == null ? 0 : row.size()) + " cells, expected " + expected
            + " (timestamp" + (c2.extraCells() > 0 ? ", c2" : "") + " and "
            + lines + " values).");
      }
      final List<Object> cells = Lists.<Object>newArrayList(row);
      final String identity;
      if (c2.kind() == C2Source.Kind.POSITIONAL) {
        if (c2.position() >= cells.size()) {
          throw new IllegalDataException("C2 position " + c2.position()
              + " is outside row " + i + ".");
        }
        final Object cell = cells.remove(c2.position());
        if (cell == null) {
          throw new IllegalDataException("Row " + i + " has no c2 at offset "
              + c2.position() + ".");
        }
        identity = KeyNamingScheme.normalize("c2", cell.toString());
      } else {
        identity = KeyNamingScheme.normalize("c2", c2.identity());
      }

      final long timestamp = toTimestamp(i, cells.get(0));
      final Double[] values = new Double[lines];
      for (int v = 0; v < lines; v++) {
        values[v] = toValue(i, table.getLines().get(v), cells.get(v + 1));
      }
      List<ParsedRow> group = by_identity.get(identity);
      if (group == null) {
        group = Lists.newArrayList();
        by_identity.put(identity, group);
      }
      group.add(new ParsedRow(i, timestamp, values));
    }
    return by_identity;
  }

  private static long toTimestamp(final int row, final Object cell) {
    if (cell instanceof Number) {
      final Number number = (Number) cell;
      if (number.doubleValue() != Math.floor(number.doubleValue())) {
        throw new IllegalDataException("Row " + row + " has a fractional "
            + "timestamp, expected whole seconds: " + cell);
      }
      return number.longValue();
    }
    if (cell instanceof String) {
      try {
        return Long.parseLong(((String) cell).trim());
      } catch (NumberFormatException e) {
        throw new IllegalDataException("Row " + row + " has an invalid "
            + "timestamp: " + cell, e);
      }
    }
    throw new IllegalDataException("Row " + row + " has no timestamp: " + cell);
  }

  private static Double toValue(final int row,
                                final String line,
                                final Object cell) {
    if (cell == null) {
      return null;
    }
    if (cell instanceof Number) {
      return ((Number) cell).doubleValue();
    }
    if (cell instanceof String) {
      try {
        return Double.parseDouble(((String) cell).trim());
      } catch (NumberFormatException e) {
        throw new IllegalDataException("Row " + row + " has an invalid value "
            + "for line '" + line + "': " + cell, e);
      }
    }
    throw new IllegalDataException("Row " + row + " has an invalid value for "
        + "line '" + line + "': " + cell);
  }

  /** A validated row. */
  private static class ParsedRow {
    private final int index;
    private final long timestamp;
    private final Double[] values;

    ParsedRow(final int index, final long timestamp, final Double[] values) {
      this.index = index;
      this.timestamp = timestamp;
      this.values = values;
    }
  }
}
