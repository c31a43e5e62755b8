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
package net.tstable.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tstable.common.Const;
import net.tstable.configuration.StoreConfig;
import net.tstable.data.C2Source;
import net.tstable.data.DataPoint;
import net.tstable.data.LabelSet;
import net.tstable.data.Row;
import net.tstable.exceptions.QueryExecutionException;
import net.tstable.exceptions.StoreException;
import net.tstable.ingest.IngestCoordinator;
import net.tstable.ingest.IngestResult;
import net.tstable.ingest.PendingWrites;
import net.tstable.ingest.PointFailure;
import net.tstable.ingest.UpdateCoordinator;
import net.tstable.lifecycle.SeriesLifecycleManager;
import net.tstable.naming.KeyNamingScheme;
import net.tstable.query.QueryEngine;
import net.tstable.query.ReadResult;
import net.tstable.query.ReturnAs;
import net.tstable.query.SeriesFilter;
import net.tstable.storage.Direction;
import net.tstable.storage.SeriesInfo;
import net.tstable.storage.TimeSeriesStore;
import net.tstable.table.TableDefinition;

/**
 * The entry point for working with one logical table on top of a time
 * series store. Each classifier pair of the table owns one series per line
 * and timeframe; this class creates them, writes and updates rows, reads
 * them back in the requested shape and maintains the table's lines.
 * <p>
 * Mutations return an {@link OperationResult} and reads a
 * {@link ReadResult}; ambiguous filters, store errors and partial writes
 * are reported there instead of thrown.
 * <p>
 * Adding and deleting lines replaces the definition; both are serialized
 * on the manager. Closing the manager closes the store.
 *
 * @since 1.0
 */
public class TableManager implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(TableManager.class);

  private final TimeSeriesStore store;
  private final StoreConfig config;
  private final SeriesLifecycleManager lifecycle;
  private final IngestCoordinator ingest;
  private final UpdateCoordinator updater;
  private final QueryEngine query;

  /** The current definition, replaced when lines change. */
  private volatile TableDefinition definition;

  /**
   * Ctor with the default config.
   * @param definition The non-null table definition.
   * @param store The non-null store.
   */
  public TableManager(final TableDefinition definition,
                      final TimeSeriesStore store) {
    this(definition, store, StoreConfig.newBuilder().build());
  }

  /**
   * Default ctor.
   * @param definition The non-null table definition.
   * @param store The non-null store.
   * @param config The non-null config for write timeouts and probing.
   */
  public TableManager(final TableDefinition definition,
                      final TimeSeriesStore store,
                      final StoreConfig config) {
    if (definition == null) {
      throw new IllegalArgumentException("Table definition cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.definition = definition;
    this.store = store;
    this.config = config;
    lifecycle = new SeriesLifecycleManager(store);
    ingest = new IngestCoordinator(store, lifecycle, config.getWriteTimeout());
    updater = new UpdateCoordinator(store, config.getWriteTimeout());
    query = new QueryEngine(store, config.getProbeWindow());
    LOG.info("Opened table '" + definition.getName() + "' with lines "
        + definition.getLines() + " and timeframes "
        + definition.getTimeframeNames());
  }

  /** @return The current table definition. */
  public TableDefinition getDefinition() {
    return definition;
  }

  /** @return The line names in order. */
  public List<String> getLines() {
    return definition.getLines();
  }

  /** @return The timeframe names in declaration order. */
  public List<String> getTimeframes() {
    return definition.getTimeframeNames();
  }

  /** @return The underlying store. */
  public TimeSeriesStore getStore() {
    return store;
  }

  /** @return The config. */
  public StoreConfig getConfig() {
    return config;
  }

  // ------------------------------------------------------------- mutations

  /**
   * Creates the series and rules of a classifier pair.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @return The result.
   */
  public OperationResult create(final String c1, final String c2) {
    return create(c1, c2, null);
  }

  /**
   * Creates the series and rules of a classifier pair with extra labels.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param extra_labels Labels added to every series, may be null.
   * @return The result.
   */
  public OperationResult create(final String c1,
                                final String c2,
                                final Map<String, String> extra_labels) {
    return lifecycle.create(definition, c1, c2, extra_labels);
  }

  /**
   * Writes rows of one existing pair to the default timeframe.
   * @param rows Rows of {@code [timestamp, v1, ..., vN]}.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @return The result.
   */
  public IngestResult insert(final List<? extends List<?>> rows,
                             final String c1,
                             final String c2) {
    try {
      return insert(rows, c1, C2Source.fixed(c2), false, null, null);
    } catch (IllegalArgumentException e) {
      return IngestResult.rejected(e.getMessage(), e);
    }
  }

  /**
   * Writes rows.
   * @param rows The rows.
   * @param c1 The first classifier.
   * @param c2 Where the second classifier comes from.
   * @param create_inplace Whether to create missing series first.
   * @param extra_labels Labels for series created in place, may be null.
   * @param timeframe A writable timeframe or null for the default.
   * @return The result.
   */
  public IngestResult insert(final List<? extends List<?>> rows,
                             final String c1,
                             final C2Source c2,
                             final boolean create_inplace,
                             final Map<String, String> extra_labels,
                             final String timeframe) {
    return ingest.insert(definition, rows, c1, c2, create_inplace,
        extra_labels, timeframe);
  }

  /**
   * Overwrites some lines at an existing timestamp.
   * @param values Line names to new values.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param timestamp Timestamp in seconds.
   * @return The result.
   */
  public IngestResult update(final Map<String, ? extends Number> values,
                             final String c1,
                             final String c2,
                             final long timestamp) {
    return updater.update(definition, values, c1, c2, timestamp);
  }

  /**
   * Deletes the points of a pair between two timestamps in every timeframe
   * and line.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param from Start in seconds, null for the beginning.
   * @param to End in seconds, null for now.
   * @return The result with the number of points deleted.
   */
  public OperationResult clearData(final String c1,
                                   final String c2,
                                   final Long from,
                                   final Long to) {
    final TableDefinition table = definition;
    final long from_ms = from == null ? 0 : from * Const.MILLIS_PER_SECOND;
    final long to_ms = to == null ? System.currentTimeMillis() :
      to * Const.MILLIS_PER_SECOND;
    long deleted = 0;
    try {
      for (final String timeframe : table.getTimeframeNames()) {
        for (final String line : table.getLines()) {
          deleted += store.deleteRange(
              KeyNamingScheme.keyName(table, c1, c2, timeframe, line),
              from_ms, to_ms);
        }
      }
    } catch (IllegalArgumentException | StoreException e) {
      LOG.warn("Failed to clear data of " + c1 + ":" + c2 + ": "
          + e.getMessage());
      return OperationResult.failed(e.getMessage(), deleted, e);
    }
    return OperationResult.ok("Deleted " + deleted + " points of " + c1 + ":"
        + c2, deleted);
  }

  /**
   * Deletes every series of a pair.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @return The result with the number of series deleted.
   */
  public OperationResult deleteClassifierKeys(final String c1,
                                              final String c2) {
    final TableDefinition table = definition;
    long deleted = 0;
    try {
      final Map<String, String> predicate = Maps.newHashMap();
      predicate.put(Const.TABLE_LABEL, table.getName());
      predicate.put(Const.C1_LABEL, KeyNamingScheme.normalize("c1", c1));
      predicate.put(Const.C2_LABEL, KeyNamingScheme.normalize("c2", c2));
      for (final String key : store.listKeys(predicate)) {
        if (store.deleteKey(key)) {
          deleted++;
        }
      }
    } catch (IllegalArgumentException | StoreException e) {
      LOG.warn("Failed to delete series of " + c1 + ":" + c2 + ": "
          + e.getMessage());
      return OperationResult.failed(e.getMessage(), deleted, e);
    }
    LOG.info("Deleted " + deleted + " series of " + table.getName() + ":"
        + c1 + ":" + c2);
    return OperationResult.ok("Deleted " + deleted + " series", deleted);
  }

  /**
   * Adds a line to the table. Every existing pair gets the line's series in
   * every timeframe, the new line is filled with a default value at every
   * timestamp the first line holds in the writable timeframes, then its
   * rules are wired.
   * @param line The new line name.
   * @param default_value The value to backfill.
   * @return The result with the number of series created.
   */
  public synchronized OperationResult addLine(final String line,
                                              final double default_value) {
    final TableDefinition current = definition;
    final TableDefinition widened;
    try {
      widened = current.withLine(line);
    } catch (IllegalArgumentException e) {
      return OperationResult.failed(e.getMessage(), e);
    }
    final String new_line = widened.getLines().get(widened.getLines().size() - 1);
    final String ref_line = current.getLines().get(0);
    long created = 0;
    final List<PointFailure> failures = Lists.newArrayList();
    try {
      for (final Map.Entry<LabelSet, Map<String, String>> pair :
          pairs(current, ref_line).entrySet()) {
        final String c1 = pair.getKey().c1();
        final String c2 = pair.getKey().c2();
        created += lifecycle.createLineSeries(widened, c1, c2, new_line,
            pair.getValue());

        final PendingWrites pending = new PendingWrites();
        for (final String timeframe : widened.getTimeframeNames()) {
          if (!widened.getTimeframe(timeframe).isWritable()) {
            continue;
          }
          final String ref_key = KeyNamingScheme.keyName(widened, c1, c2,
              timeframe, ref_line);
          final String new_key = KeyNamingScheme.keyName(widened, c1, c2,
              timeframe, new_line);
          for (final DataPoint point : store.range(ref_key, 0, Long.MAX_VALUE,
              0, Direction.FORWARD)) {
            pending.add(store.append(new_key, point.timestamp(), default_value),
                0, new_key, new_line,
                point.timestamp() / Const.MILLIS_PER_SECOND);
          }
        }
        pending.join(config.getWriteTimeout(), failures);
        lifecycle.wireRules(widened, c1, c2, new_line);
      }
    } catch (IllegalArgumentException | IllegalStateException | StoreException e) {
      LOG.error("Failed to add line '" + line + "' to table '"
          + current.getName() + "'", e);
      return OperationResult.failed(e.getMessage(), created, e);
    }
    if (!failures.isEmpty()) {
      LOG.warn("Failed to backfill " + failures.size() + " points of line '"
          + new_line + "'. First: " + failures.get(0));
      return OperationResult.failed("Created " + created + " series but "
          + failures.size() + " backfill points failed.", created,
          failures.get(0).status().exception());
    }
    definition = widened;
    LOG.info("Added line '" + new_line + "' to table '" + current.getName()
        + "', created " + created + " series");
    return OperationResult.ok("Added line '" + new_line + "'", created);
  }

  /**
   * Deletes a line and every series of it.
   * @param line The line name.
   * @return The result with the number of series deleted.
   */
  public synchronized OperationResult deleteLine(final String line) {
    final TableDefinition current = definition;
    final TableDefinition narrowed;
    try {
      narrowed = current.withoutLine(line);
    } catch (IllegalArgumentException e) {
      return OperationResult.failed(e.getMessage(), e);
    }
    long deleted = 0;
    try {
      final Map<String, String> predicate = Maps.newHashMap();
      predicate.put(Const.TABLE_LABEL, current.getName());
      predicate.put(Const.LINE_LABEL, line.toLowerCase());
      for (final String key : store.listKeys(predicate)) {
        if (store.deleteKey(key)) {
          deleted++;
        }
      }
    } catch (StoreException e) {
      LOG.error("Failed to delete line '" + line + "'", e);
      return OperationResult.failed(e.getMessage(), deleted, e);
    }
    definition = narrowed;
    LOG.info("Deleted line '" + line + "' of table '" + current.getName()
        + "' and " + deleted + " series");
    return OperationResult.ok("Deleted line '" + line + "'", deleted);
  }

  // ------------------------------------------------------------- reads

  /**
   * Reads the rows of one pair.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param from Start in seconds, null for the beginning.
   * @param to End in seconds, null for now.
   * @return The rows.
   */
  public ReadResult read(final String c1,
                         final String c2,
                         final Long from,
                         final Long to) {
    try {
      return read(SeriesFilter.of(c1, c2), from, to, 0, false, ReturnAs.ROWS);
    } catch (IllegalArgumentException e) {
      return ReadResult.failed(e.getMessage(), e);
    }
  }

  /**
   * Reads rows between two timestamps.
   * @see QueryEngine#read
   */
  public ReadResult read(final SeriesFilter filter,
                         final Long from,
                         final Long to,
                         final int extra_records,
                         final boolean allow_multiple,
                         final ReturnAs return_as) {
    try {
      return query.read(definition, filter, from, to, extra_records,
          allow_multiple, return_as);
    } catch (IllegalArgumentException | IllegalStateException
        | QueryExecutionException | StoreException e) {
      return readFailed("read", filter, e);
    }
  }

  /** @see QueryEngine#readLastNRecords */
  public ReadResult readLastNRecords(final SeriesFilter filter,
                                     final int n,
                                     final Long minimum_timestamp,
                                     final boolean allow_multiple,
                                     final ReturnAs return_as) {
    try {
      return query.readLastNRecords(definition, filter, n, minimum_timestamp,
          allow_multiple, return_as);
    } catch (IllegalArgumentException | IllegalStateException
        | QueryExecutionException | StoreException e) {
      return readFailed("read_last_n_records", filter, e);
    }
  }

  /** @see QueryEngine#readLastNthRecord */
  public ReadResult readLastNthRecord(final SeriesFilter filter,
                                      final int n,
                                      final Long minimum_timestamp,
                                      final boolean allow_multiple,
                                      final ReturnAs return_as) {
    try {
      return query.readLastNthRecord(definition, filter, n, minimum_timestamp,
          allow_multiple, return_as);
    } catch (IllegalArgumentException | IllegalStateException
        | QueryExecutionException | StoreException e) {
      return readFailed("read_last_nth_record", filter, e);
    }
  }

  /** @see QueryEngine#readLast */
  public ReadResult readLast(final SeriesFilter filter,
                             final boolean allow_multiple,
                             final ReturnAs return_as) {
    try {
      return query.readLast(definition, filter, allow_multiple, return_as);
    } catch (IllegalArgumentException | IllegalStateException
        | QueryExecutionException | StoreException e) {
      return readFailed("read_last", filter, e);
    }
  }

  /** @see QueryEngine#findLast */
  public ReadResult findLast(final SeriesFilter filter,
                             final Predicate<Row> predicate,
                             final boolean allow_multiple,
                             final ReturnAs return_as) {
    try {
      return query.findLast(definition, filter, predicate, allow_multiple,
          return_as);
    } catch (IllegalArgumentException | IllegalStateException
        | QueryExecutionException | StoreException e) {
      return readFailed("find_last", filter, e);
    }
  }

  /**
   * Finds the newest point across the series matching optional classifiers
   * and timeframe.
   * @param c1 The first classifier or null for any.
   * @param c2 The second classifier or null for any.
   * @param timeframe The timeframe or null for any.
   * @return The newest point, a not found record or a failed one.
   */
  public LastRecord lastRecord(final String c1,
                               final String c2,
                               final String timeframe) {
    try {
      String newest_key = null;
      DataPoint newest = null;
      for (final String key : store.listKeys(indexPredicate(c1, c2, null,
          timeframe))) {
        final DataPoint last = store.getLast(key);
        if (last != null && (newest == null
            || last.timestamp() > newest.timestamp())) {
          newest = last;
          newest_key = key;
        }
      }
      if (newest == null) {
        return LastRecord.notFound();
      }
      final SeriesInfo info = store.getInfo(newest_key);
      return LastRecord.of(newest_key,
          info == null ? null : LabelSet.of(info.getLabels()),
          newest.timestamp() / Const.MILLIS_PER_SECOND, newest.value());
    } catch (IllegalArgumentException | StoreException e) {
      logFailure("last_record", e);
      return LastRecord.failed(e.getMessage(), e);
    }
  }

  /**
   * Lists the series of the table matching optional components.
   * @param c1 The first classifier or null for any.
   * @param c2 The second classifier or null for any.
   * @param line The line or null for any.
   * @param timeframe The timeframe or null for any.
   * @return The keys and their distinct component values, or the error.
   */
  public IndexResult queryIndex(final String c1,
                                final String c2,
                                final String line,
                                final String timeframe) {
    try {
      return new IndexResult(store.listKeys(indexPredicate(c1, c2, line,
          timeframe)));
    } catch (IllegalArgumentException | StoreException e) {
      logFailure("query_index", e);
      return IndexResult.failed(e.getMessage(), e);
    }
  }

  /**
   * Whether a pair's series exist, probed on the first line of the default
   * timeframe.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @return A successful result with a count of 1 if the pair exists and
   * 0 if not, or a failed result.
   */
  public OperationResult mapExists(final String c1, final String c2) {
    final TableDefinition table = definition;
    try {
      final String key = KeyNamingScheme.keyName(table, c1, c2,
          table.getDefaultWriteTimeframe(), table.getLines().get(0));
      return store.exists(key) ?
          OperationResult.ok("Series " + key + " exists", 1) :
          OperationResult.ok("Series " + key + " does not exist", 0);
    } catch (IllegalArgumentException | StoreException e) {
      logFailure("map_exists", e);
      return OperationResult.failed(e.getMessage(), e);
    }
  }

  /**
   * Returns the store's metadata of one series.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param timeframe The timeframe.
   * @param line The line or null for the first one.
   * @return The metadata.
   * @throws StoreException if the series doesn't exist or the store failed.
   */
  public SeriesInfo stats(final String c1,
                          final String c2,
                          final String timeframe,
                          final String line) {
    final TableDefinition table = definition;
    final String key = KeyNamingScheme.keyName(table, c1, c2, timeframe,
        line == null ? table.getLines().get(0) : line);
    final SeriesInfo info = store.getInfo(key);
    if (info == null) {
      throw new StoreException("info", key, "the key does not exist.");
    }
    return info;
  }

  @Override
  public void close() throws IOException {
    LOG.info("Closing table '" + definition.getName() + "'");
    store.close();
  }

  /**
   * Collects the pairs holding a reference line, with their extra labels.
   */
  private Map<LabelSet, Map<String, String>> pairs(final TableDefinition table,
                                                   final String ref_line) {
    final Map<String, String> predicate = Maps.newHashMap();
    predicate.put(Const.TABLE_LABEL, table.getName());
    predicate.put(Const.LINE_LABEL, ref_line);
    final Map<LabelSet, Map<String, String>> pairs = Maps.newTreeMap();
    final Set<String> seen = Sets.newHashSet();
    for (final String key : store.listKeys(predicate)) {
      final Map<String, String> components = KeyNamingScheme.parse(key);
      if (components == null || !seen.add(components.get(Const.C1_LABEL)
          + Const.KEY_SEPARATOR + components.get(Const.C2_LABEL))) {
        continue;
      }
      final SeriesInfo info = store.getInfo(key);
      final Map<String, String> extra = Maps.newHashMap();
      if (info != null) {
        for (final Map.Entry<String, String> label : info.getLabels().entrySet()) {
          if (!Const.RESERVED_LABELS.contains(label.getKey())) {
            extra.put(label.getKey(), label.getValue());
          }
        }
      }
      final Map<String, String> pair = Maps.newHashMap();
      pair.put(Const.C1_LABEL, components.get(Const.C1_LABEL));
      pair.put(Const.C2_LABEL, components.get(Const.C2_LABEL));
      pairs.put(LabelSet.of(pair), extra);
    }
    return pairs;
  }

  private Map<String, String> indexPredicate(final String c1,
                                             final String c2,
                                             final String line,
                                             final String timeframe) {
    final Map<String, String> predicate = Maps.newHashMap();
    predicate.put(Const.TABLE_LABEL, definition.getName());
    if (c1 != null) {
      predicate.put(Const.C1_LABEL, KeyNamingScheme.normalize("c1", c1));
    }
    if (c2 != null) {
      predicate.put(Const.C2_LABEL, KeyNamingScheme.normalize("c2", c2));
    }
    if (line != null) {
      predicate.put(Const.LINE_LABEL, line.toLowerCase());
    }
    if (timeframe != null) {
      predicate.put(Const.TIMEFRAME_LABEL, timeframe.toLowerCase());
    }
    return predicate;
  }

  private ReadResult readFailed(final String operation,
                                final SeriesFilter filter,
                                final RuntimeException e) {
    if (e instanceof StoreException) {
      LOG.error("Store failure in " + operation + " for " + filter, e);
    } else {
      LOG.warn("Failed " + operation + " for " + filter + ": "
          + e.getMessage());
    }
    return ReadResult.failed(e.getMessage(), e);
  }

  private void logFailure(final String operation, final RuntimeException e) {
    if (e instanceof StoreException) {
      LOG.error("Store failure in " + operation, e);
    } else {
      LOG.warn("Failed " + operation + ": " + e.getMessage());
    }
  }
}
