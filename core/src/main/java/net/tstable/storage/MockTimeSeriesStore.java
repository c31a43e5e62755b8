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
package net.tstable.storage;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.tstable.data.DataPoint;
import net.tstable.data.LabelSet;
import net.tstable.exceptions.StoreException;
import net.tstable.table.AggregatorKind;

/**
 * A simple store that keeps every series in memory. It applies retention,
 * duplicate policies and downsampling rules the way a time series store
 * does, except that the bucket holding the newest sample is aggregated
 * eagerly instead of when the next bucket opens. It's meant for testing and
 * for running tables without a server.
 * <p>
 * All methods are synchronized on the store.
 *
 * @since 1.0
 */
public class MockTimeSeriesStore implements TimeSeriesStore {
  private static final Logger LOG = LoggerFactory.getLogger(MockTimeSeriesStore.class);

  /** The super inefficient in-memory db, keyed on series key. */
  private final Map<String, MockSeries> database;

  /** Whether or not the store was closed. */
  private boolean closed;

  public MockTimeSeriesStore() {
    database = Maps.newHashMap();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Instantiating mock time series store @"
          + System.identityHashCode(this));
    }
  }

  @Override
  public synchronized CreateStatus createSeries(final String key,
                                                final long retention,
                                                final LabelSet labels,
                                                final DuplicatePolicy policy) {
    checkOpen("create", key);
    if (database.containsKey(key)) {
      return CreateStatus.ALREADY_EXISTS;
    }
    database.put(key, new MockSeries(key, retention, labels,
        policy == null ? DuplicatePolicy.BLOCK : policy));
    return CreateStatus.CREATED;
  }

  @Override
  public synchronized Deferred<WriteStatus> append(final String key,
                                                   final long timestamp,
                                                   final double value) {
    if (closed) {
      return Deferred.fromResult(WriteStatus.error("Store is closed.", null));
    }
    final MockSeries series = database.get(key);
    if (series == null) {
      return Deferred.fromResult(WriteStatus.error(
          "The key does not exist: " + key, null));
    }
    if (series.retention > 0 && !series.samples.isEmpty()
        && timestamp < series.samples.lastKey() - series.retention) {
      return Deferred.fromResult(WriteStatus.rejected(
          "Timestamp " + timestamp + " is older than the retention of " + key));
    }
    final Double existing = series.samples.get(timestamp);
    final double stored;
    if (existing == null) {
      stored = value;
    } else {
      switch (series.policy) {
      case BLOCK:
        return Deferred.fromResult(WriteStatus.rejected(
            "Duplicate sample at " + timestamp + " blocked for " + key));
      case FIRST:
        stored = existing;
        break;
      case MIN:
        stored = Math.min(existing, value);
        break;
      case MAX:
        stored = Math.max(existing, value);
        break;
      case SUM:
        stored = existing + value;
        break;
      default:
        stored = value;
      }
    }
    put(series, timestamp, stored);
    return Deferred.fromResult(WriteStatus.OK);
  }

  @Override
  public synchronized List<DataPoint> range(final String key,
                                            final long from,
                                            final long to,
                                            final int count,
                                            final Direction direction) {
    final MockSeries series = getSeries("range", key);
    if (from > to) {
      return Collections.emptyList();
    }
    NavigableMap<Long, Double> slice = series.samples.subMap(from, true, to, true);
    if (direction == Direction.REVERSE) {
      slice = slice.descendingMap();
    }
    final List<DataPoint> points = Lists.newArrayList();
    for (final Entry<Long, Double> entry : slice.entrySet()) {
      if (count > 0 && points.size() >= count) {
        break;
      }
      points.add(new DataPoint(entry.getKey(), entry.getValue()));
    }
    return points;
  }

  @Override
  public synchronized void createRule(final String source_key,
                                      final String dest_key,
                                      final AggregatorKind aggregator,
                                      final long bucket) {
    if (source_key.equals(dest_key)) {
      throw new StoreException("createrule", source_key,
          "source and destination keys must differ.");
    }
    final MockSeries source = getSeries("createrule", source_key);
    final MockSeries dest = getSeries("createrule", dest_key);
    if (dest.source_key != null) {
      throw new StoreException("createrule", dest_key,
          "the destination key already has a source rule.");
    }
    if (bucket <= 0) {
      throw new StoreException("createrule", dest_key,
          "bucket duration must be positive: " + bucket);
    }
    source.rules.add(new RuleInfo(dest_key, bucket, aggregator));
    dest.source_key = source_key;
  }

  @Override
  public synchronized boolean deleteKey(final String key) {
    checkOpen("del", key);
    final MockSeries series = database.remove(key);
    if (series == null) {
      return false;
    }
    if (series.source_key != null) {
      final MockSeries source = database.get(series.source_key);
      if (source != null) {
        final List<RuleInfo> remaining = Lists.newArrayList();
        for (final RuleInfo rule : source.rules) {
          if (!rule.destKey().equals(key)) {
            remaining.add(rule);
          }
        }
        source.rules.clear();
        source.rules.addAll(remaining);
      }
    }
    for (final RuleInfo rule : series.rules) {
      final MockSeries dest = database.get(rule.destKey());
      if (dest != null) {
        dest.source_key = null;
      }
    }
    return true;
  }

  @Override
  public synchronized long deleteRange(final String key,
                                       final long from,
                                       final long to) {
    final MockSeries series = getSeries("del", key);
    if (from > to) {
      return 0;
    }
    final NavigableMap<Long, Double> slice = series.samples.subMap(from, true, to, true);
    final long deleted = slice.size();
    slice.clear();
    return deleted;
  }

  @Override
  public synchronized List<String> listKeys(final Map<String, String> label_predicate) {
    checkOpen("queryindex", null);
    if (label_predicate == null || label_predicate.isEmpty()) {
      throw new StoreException("queryindex", null,
          "at least one label filter is required.");
    }
    final List<String> keys = Lists.newArrayList();
    for (final MockSeries series : database.values()) {
      if (series.labels.matches(label_predicate)) {
        keys.add(series.key);
      }
    }
    Collections.sort(keys);
    return keys;
  }

  @Override
  public synchronized SeriesInfo getInfo(final String key) {
    checkOpen("info", key);
    final MockSeries series = database.get(key);
    if (series == null) {
      return null;
    }
    final SeriesInfo.Builder builder = SeriesInfo.newBuilder()
        .setKey(key)
        .setRetention(series.retention)
        .setLabels(series.labels.asMap())
        .setRules(series.rules)
        .setSourceKey(series.source_key)
        .setTotalSamples(series.samples.size())
        .setDuplicatePolicy(series.policy);
    if (!series.samples.isEmpty()) {
      builder.setFirstTimestamp(series.samples.firstKey())
             .setLastTimestamp(series.samples.lastKey());
    }
    return builder.build();
  }

  @Override
  public synchronized boolean exists(final String key) {
    checkOpen("exists", key);
    return database.containsKey(key);
  }

  @Override
  public synchronized DataPoint getLast(final String key) {
    final MockSeries series = getSeries("get", key);
    if (series.samples.isEmpty()) {
      return null;
    }
    final Entry<Long, Double> last = series.samples.lastEntry();
    return new DataPoint(last.getKey(), last.getValue());
  }

  @Override
  public synchronized void close() {
    closed = true;
    database.clear();
  }

  /** @return The number of series held, for tests. */
  public synchronized int size() {
    return database.size();
  }

  /**
   * Stores a sample, trims expired samples and recomputes the buckets of
   * every rule fed by the series.
   */
  private void put(final MockSeries series,
                   final long timestamp,
                   final double value) {
    series.samples.put(timestamp, value);
    if (series.retention > 0) {
      series.samples.headMap(series.samples.lastKey() - series.retention)
          .clear();
    }
    for (final RuleInfo rule : series.rules) {
      final MockSeries dest = database.get(rule.destKey());
      if (dest == null) {
        continue;
      }
      final long start = timestamp - Math.floorMod(timestamp, rule.bucket());
      final NavigableMap<Long, Double> bucket =
          series.samples.subMap(start, true, start + rule.bucket(), false);
      if (bucket.isEmpty()) {
        continue;
      }
      put(dest, start, aggregate(rule.aggregator(), bucket.values()));
    }
  }

  /**
   * Computes an aggregation over the values of one bucket.
   * @param aggregator The aggregation.
   * @param values The non-empty values in time order.
   * @return The aggregated value.
   */
  static double aggregate(final AggregatorKind aggregator,
                          final Collection<Double> values) {
    double sum = 0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double first = Double.NaN;
    double last = Double.NaN;
    int count = 0;
    for (final Double value : values) {
      if (count == 0) {
        first = value;
      }
      last = value;
      sum += value;
      min = Math.min(min, value);
      max = Math.max(max, value);
      count++;
    }
    switch (aggregator) {
    case AVG:
      return sum / count;
    case SUM:
      return sum;
    case MIN:
      return min;
    case MAX:
      return max;
    case RANGE:
      return max - min;
    case COUNT:
      return count;
    case FIRST:
      return first;
    case LAST:
      return last;
    default:
      break;
    }
    final double mean = sum / count;
    double squares = 0;
    for (final Double value : values) {
      squares += (value - mean) * (value - mean);
    }
    switch (aggregator) {
    case VAR_P:
      return squares / count;
    case VAR_S:
      return count > 1 ? squares / (count - 1) : 0;
    case STD_P:
      return Math.sqrt(squares / count);
    case STD_S:
      return count > 1 ? Math.sqrt(squares / (count - 1)) : 0;
    default:
      throw new IllegalArgumentException("Unhandled aggregator: " + aggregator);
    }
  }

  private MockSeries getSeries(final String operation, final String key) {
    checkOpen(operation, key);
    final MockSeries series = database.get(key);
    if (series == null) {
      throw new StoreException(operation, key, "the key does not exist.");
    }
    return series;
  }

  private void checkOpen(final String operation, final String key) {
    if (closed) {
      throw new StoreException(operation, key, "the store is closed.");
    }
  }

  /** One series and its rules. */
  private static class MockSeries {
    private final String key;
    private final long retention;
    private final LabelSet labels;
    private final DuplicatePolicy policy;
    private final TreeMap<Long, Double> samples;
    private final List<RuleInfo> rules;
    private String source_key;

    MockSeries(final String key,
               final long retention,
               final LabelSet labels,
               final DuplicatePolicy policy) {
      this.key = key;
      this.retention = retention;
      this.labels = labels;
      this.policy = policy;
      samples = new TreeMap<Long, Double>();
      rules = Lists.newArrayList();
    }
  }
}
