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
package net.tstable.query;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tstable.common.Const;
import net.tstable.data.DataPoint;
import net.tstable.data.LabelSet;
import net.tstable.data.Row;
import net.tstable.exceptions.AmbiguousIdentityException;
import net.tstable.naming.KeyNamingScheme;
import net.tstable.query.format.FormattedResult;
import net.tstable.query.format.OutputFormatter;
import net.tstable.storage.Direction;
import net.tstable.storage.SeriesInfo;
import net.tstable.storage.TimeSeriesStore;
import net.tstable.table.TableDefinition;

/**
 * Reads logical rows out of the per line series of a table.
 * <p>
 * A filter resolves to one or more identities, each being the labels its
 * series share once the line label is dropped. Unless the caller allows
 * several identities, a filter matching more than one fails with an
 * {@link AmbiguousIdentityException}. Within an identity the lines are
 * merged on timestamp; a line without a point at a timestamp leaves an
 * absent value in the row.
 * <p>
 * Timestamps are in seconds. Reads without an upper bound stop at the
 * current time.
 *
 * @since 1.0
 */
public class QueryEngine {
  private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

  /** The store to read from. */
  private final TimeSeriesStore store;

  /** Points fetched per line in each backward probe. */
  private final int probe_window;

  /**
   * Default ctor.
   * @param store The non-null store.
   * @param probe_window Points fetched per line in each backward probe of
   * {@link #findLast}.
   */
  public QueryEngine(final TimeSeriesStore store, final int probe_window) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (probe_window < 1) {
      throw new IllegalArgumentException("Probe window must be at least 1.");
    }
    this.store = store;
    this.probe_window = probe_window;
  }

  /**
   * Reads the rows between two timestamps, inclusive.
   * @param table The non-null table definition.
   * @param filter The non-null filter.
   * @param from Start in seconds, null for the beginning.
   * @param to End in seconds, null for now.
   * @param extra_records When positive, the start is moved back to include
   * that many points of the first line before it.
   * @param allow_multiple Whether several identities may match.
   * @param return_as The shape of the result.
   * @return The result.
   * @throws AmbiguousIdentityException if several identities matched and
   * that wasn't allowed.
   * @throws net.tstable.exceptions.StoreException if the store failed.
   */
  public ReadResult read(final TableDefinition table,
                         final SeriesFilter filter,
                         final Long from,
                         final Long to,
                         final int extra_records,
                         final boolean allow_multiple,
                         final ReturnAs return_as) {
    final long from_ms = from == null ? 0 : from * Const.MILLIS_PER_SECOND;
    final long to_ms = to == null ? now() : to * Const.MILLIS_PER_SECOND;
    if (from_ms > to_ms) {
      throw new IllegalArgumentException("Start " + from
          + " is after the end " + to + ".");
    }
    final List<IdentityRows> results = Lists.newArrayList();
    for (final IdentityGroup group : resolve(table, filter, allow_multiple)) {
      final long start = extra_records > 0 ?
          widen(table, group, from_ms, extra_records) : from_ms;
      final Map<String, List<DataPoint>> points = Maps.newHashMap();
      for (final String line : table.getLines()) {
        final String key = group.keys.get(line);
        if (key != null) {
          points.put(line, store.range(key, start, to_ms, 0, Direction.FORWARD));
        }
      }
      results.add(new IdentityRows(group.identity,
          merge(table.getLines(), group.identity, points)));
    }
    return ReadResult.ok(OutputFormatter.format(table.getLines(), results,
        return_as));
  }

  /**
   * Reads the newest n rows of each identity no older than a minimum. The
   * timestamp of the n-th newest row is taken from the newest n points of
   * every line, then every line is read from there so the rows hold each
   * line's point wherever one exists.
   * @param table The non-null table definition.
   * @param filter The non-null filter.
   * @param n How many rows per identity, at least 1.
   * @param minimum_timestamp The oldest timestamp in seconds, null for 0.
   * @param allow_multiple Whether several identities may match.
   * @param return_as The shape of the result.
   * @return The result, complete if every identity yielded n rows.
   */
  public ReadResult readLastNRecords(final TableDefinition table,
                                     final SeriesFilter filter,
                                     final int n,
                                     final Long minimum_timestamp,
                                     final boolean allow_multiple,
                                     final ReturnAs return_as) {
    checkCount(n);
    final long min_ms = minimum_timestamp == null ? 0 :
      minimum_timestamp * Const.MILLIS_PER_SECOND;
    final long now = now();
    boolean complete = true;
    final List<IdentityRows> results = Lists.newArrayList();
    for (final IdentityGroup group : resolve(table, filter, allow_multiple)) {
      final TreeSet<Long> timestamps = new TreeSet<Long>();
      for (final String line : table.getLines()) {
        final String key = group.keys.get(line);
        if (key == null) {
          continue;
        }
        for (final DataPoint point : store.range(key, min_ms, now, n,
            Direction.REVERSE)) {
          timestamps.add(point.timestamp());
        }
      }
      if (timestamps.size() < n) {
        complete = false;
      }
      if (timestamps.isEmpty()) {
        results.add(new IdentityRows(group.identity,
            Collections.<Row>emptyList()));
        continue;
      }
      final long cutoff = timestamps.size() > n ?
          Lists.newArrayList(timestamps.descendingSet()).get(n - 1) :
          timestamps.first();
      final Map<String, List<DataPoint>> points = Maps.newHashMap();
      for (final String line : table.getLines()) {
        final String key = group.keys.get(line);
        if (key != null) {
          points.put(line, store.range(key, cutoff, now, 0, Direction.FORWARD));
        }
      }
      results.add(new IdentityRows(group.identity,
          merge(table.getLines(), group.identity, points)));
    }
    return ReadResult.ok(OutputFormatter.format(table.getLines(), results,
        return_as), complete);
  }

  /**
   * Reads the n-th newest row of each identity.
   * @param table The non-null table definition.
   * @param filter The non-null filter.
   * @param n 1 for the newest row, at least 1.
   * @param minimum_timestamp The oldest timestamp in seconds, null for 0.
   * @param allow_multiple Whether several identities may match.
   * @param return_as The shape of the result.
   * @return The result, not found if no identity has n rows.
   */
  public ReadResult readLastNthRecord(final TableDefinition table,
                                      final SeriesFilter filter,
                                      final int n,
                                      final Long minimum_timestamp,
                                      final boolean allow_multiple,
                                      final ReturnAs return_as) {
    checkCount(n);
    final long min_ms = minimum_timestamp == null ? 0 :
      minimum_timestamp * Const.MILLIS_PER_SECOND;
    final long now = now();
    final List<IdentityRows> results = Lists.newArrayList();
    for (final IdentityGroup group : resolve(table, filter, allow_multiple)) {
      // the n newest points of each line cover the n newest merged rows.
      final Map<String, List<DataPoint>> points = Maps.newHashMap();
      for (final String line : table.getLines()) {
        final String key = group.keys.get(line);
        if (key != null) {
          points.put(line, store.range(key, min_ms, now, n, Direction.REVERSE));
        }
      }
      final List<Row> rows = merge(table.getLines(), group.identity, points);
      if (rows.size() >= n) {
        results.add(new IdentityRows(group.identity,
            Collections.singletonList(rows.get(rows.size() - n))));
      }
    }
    final FormattedResult data = OutputFormatter.format(table.getLines(),
        results, return_as);
    return results.isEmpty() ? ReadResult.notFound(data) : ReadResult.ok(data);
  }

  /**
   * Reads the newest row of each identity.
   * @see #readLastNthRecord
   */
  public ReadResult readLast(final TableDefinition table,
                             final SeriesFilter filter,
                             final boolean allow_multiple,
                             final ReturnAs return_as) {
    return readLastNthRecord(table, filter, 1, null, allow_multiple, return_as);
  }

  /**
   * Walks each identity's rows backwards, a window of points per line at a
   * time, until a row satisfies the predicate or the series are exhausted.
   * @param table The non-null table definition.
   * @param filter The non-null filter.
   * @param predicate The non-null row predicate.
   * @param allow_multiple Whether several identities may match.
   * @param return_as The shape of the result.
   * @return The newest matching row of each identity, not found if no
   * identity has one.
   */
  public ReadResult findLast(final TableDefinition table,
                             final SeriesFilter filter,
                             final Predicate<Row> predicate,
                             final boolean allow_multiple,
                             final ReturnAs return_as) {
    if (predicate == null) {
      throw new IllegalArgumentException("Predicate cannot be null.");
    }
    final List<IdentityRows> results = Lists.newArrayList();
    for (final IdentityGroup group : resolve(table, filter, allow_multiple)) {
      final Row row = probe(table, group, predicate);
      if (row != null) {
        results.add(new IdentityRows(group.identity,
            Collections.singletonList(row)));
      }
    }
    final FormattedResult data = OutputFormatter.format(table.getLines(),
        results, return_as);
    return results.isEmpty() ? ReadResult.notFound(data) : ReadResult.ok(data);
  }

  /**
   * Resolves a filter to its identities, sorted.
   * @param table The table.
   * @param filter The filter.
   * @param allow_multiple Whether several identities may match.
   * @return The identities with their series per line, possibly empty.
   * @throws AmbiguousIdentityException if several identities matched and
   * that wasn't allowed.
   */
  List<IdentityGroup> resolve(final TableDefinition table,
                              final SeriesFilter filter,
                              final boolean allow_multiple) {
    if (filter == null) {
      throw new IllegalArgumentException("Filter cannot be null.");
    }
    final String timeframe = filter.resolveTimeframe(table);
    if (filter.isExactPair()) {
      // same identity as a label lookup, extra labels included
      final String first_key = KeyNamingScheme.keyName(table, filter.getC1(),
          filter.getC2(), timeframe, table.getLines().get(0));
      final SeriesInfo info = store.getInfo(first_key);
      final LabelSet labels = info != null ? LabelSet.of(info.getLabels()) :
          KeyNamingScheme.derive(table, filter.getC1(), filter.getC2(),
              timeframe, table.getLines().get(0), null).labels();
      final IdentityGroup group = new IdentityGroup(labels.withoutLine());
      for (final String line : table.getLines()) {
        group.keys.put(line, KeyNamingScheme.keyName(table, filter.getC1(),
            filter.getC2(), timeframe, line));
      }
      return Collections.singletonList(group);
    }

    final TreeMap<LabelSet, IdentityGroup> groups =
        new TreeMap<LabelSet, IdentityGroup>();
    for (final String key : store.listKeys(filter.toPredicate(table))) {
      final SeriesInfo info = store.getInfo(key);
      if (info == null) {
        // deleted since the index was queried
        continue;
      }
      final LabelSet labels = LabelSet.of(info.getLabels());
      final String line = labels.line();
      if (line == null || !table.hasLine(line)) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Skipping series " + key + " of an undeclared line.");
        }
        continue;
      }
      final LabelSet identity = labels.withoutLine();
      IdentityGroup group = groups.get(identity);
      if (group == null) {
        group = new IdentityGroup(identity);
        groups.put(identity, group);
      }
      group.keys.put(line, key);
    }
    if (groups.size() > 1 && !allow_multiple) {
      throw new AmbiguousIdentityException(filter.toString(),
          Lists.newArrayList(groups.keySet()));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resolved filter " + filter + " to " + groups.size()
          + " identities");
    }
    return Lists.newArrayList(groups.values());
  }

  /**
   * Merges the points of each line into rows, ascending.
   * @param lines The line names.
   * @param identity The identity of the rows.
   * @param points Points per line in ascending order, missing lines allowed.
   * @return The rows.
   */
  static List<Row> merge(final List<String> lines,
                         final LabelSet identity,
                         final Map<String, List<DataPoint>> points) {
    final TreeMap<Long, Double[]> merged = new TreeMap<Long, Double[]>();
    for (int i = 0; i < lines.size(); i++) {
      final List<DataPoint> line_points = points.get(lines.get(i));
      if (line_points == null) {
        continue;
      }
      for (final DataPoint point : line_points) {
        Double[] values = merged.get(point.timestamp());
        if (values == null) {
          values = new Double[lines.size()];
          merged.put(point.timestamp(), values);
        }
        values[i] = point.value();
      }
    }
    final List<Row> rows = Lists.newArrayListWithCapacity(merged.size());
    for (final Entry<Long, Double[]> entry : merged.entrySet()) {
      rows.add(new Row(entry.getKey() / Const.MILLIS_PER_SECOND, identity,
          lines, entry.getValue()));
    }
    return rows;
  }

  /** @return The current time in milliseconds. */
  protected long now() {
    return System.currentTimeMillis();
  }

  /**
   * Moves a start back so the first line's points before it are included.
   */
  private long widen(final TableDefinition table,
                     final IdentityGroup group,
                     final long from,
                     final int extra_records) {
    if (from <= 0) {
      return from;
    }
    final String key = group.keys.get(table.getLines().get(0));
    if (key == null) {
      return from;
    }
    final List<DataPoint> before = store.range(key, 0, from - 1, extra_records,
        Direction.REVERSE);
    return before.isEmpty() ? from : before.get(before.size() - 1).timestamp();
  }

  /**
   * Probes one identity backwards for a matching row.
   * @return The newest matching row or null.
   */
  private Row probe(final TableDefinition table,
                    final IdentityGroup group,
                    final Predicate<Row> predicate) {
    long cursor = now();
    int windows = 0;
    while (cursor >= 0) {
      windows++;
      final Map<String, List<DataPoint>> points = Maps.newHashMap();
      // rows at or after the floor are complete in this window.
      long floor = Long.MIN_VALUE;
      boolean any = false;
      for (final String line : table.getLines()) {
        final String key = group.keys.get(line);
        if (key == null) {
          continue;
        }
        final List<DataPoint> window = Lists.newArrayList(
            store.range(key, 0, cursor, probe_window, Direction.REVERSE));
        if (window.isEmpty()) {
          continue;
        }
        any = true;
        if (window.size() >= probe_window) {
          floor = Math.max(floor, window.get(window.size() - 1).timestamp());
        }
        Collections.reverse(window);
        points.put(line, window);
      }
      if (!any) {
        break;
      }
      final List<Row> rows = merge(table.getLines(), group.identity, points);
      for (int i = rows.size() - 1; i >= 0; i--) {
        final Row row = rows.get(i);
        if (row.timestamp() * Const.MILLIS_PER_SECOND < floor) {
          break;
        }
        if (predicate.test(row)) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Found row for " + group.identity + " after " + windows
                + " windows");
          }
          return row;
        }
      }
      if (floor == Long.MIN_VALUE) {
        break;
      }
      cursor = floor - 1;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("No matching row for " + group.identity + " in " + windows
          + " windows");
    }
    return null;
  }

  private static void checkCount(final int n) {
    if (n < 1) {
      throw new IllegalArgumentException("Record count must be at least 1: "
          + n);
    }
  }

  /** An identity and its series per line. */
  static class IdentityGroup {
    final LabelSet identity;
    final Map<String, String> keys = Maps.newLinkedHashMap();

    IdentityGroup(final LabelSet identity) {
      this.identity = identity;
    }
  }
}
