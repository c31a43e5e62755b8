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
package net.tstable.storage.redis;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Deferred;

import net.tstable.common.Const;
import net.tstable.configuration.StoreConfig;
import net.tstable.data.DataPoint;
import net.tstable.data.LabelSet;
import net.tstable.exceptions.StoreException;
import net.tstable.storage.CreateStatus;
import net.tstable.storage.Direction;
import net.tstable.storage.DuplicatePolicy;
import net.tstable.storage.RuleInfo;
import net.tstable.storage.SeriesInfo;
import net.tstable.storage.TimeSeriesStore;
import net.tstable.storage.WriteStatus;
import net.tstable.table.AggregatorKind;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.timeseries.AggregationType;
import redis.clients.jedis.timeseries.TSCreateParams;
import redis.clients.jedis.timeseries.TSElement;
import redis.clients.jedis.timeseries.TSInfo;
import redis.clients.jedis.timeseries.TSRangeParams;

/**
 * A {@link TimeSeriesStore} on a Redis server with the RedisTimeSeries
 * module, through a pooled Jedis client.
 * <p>
 * Appends run on a fixed pool of writer threads and resolve their deferred
 * with the outcome: a command the server refused is
 * {@link WriteStatus.WriteState#REJECTED}, a connection or protocol failure
 * is {@link WriteStatus.WriteState#ERROR}. Every other call is synchronous
 * and wraps Jedis exceptions in a {@link StoreException}.
 *
 * @since 1.0
 */
public class RedisTimeSeriesStore implements TimeSeriesStore {
  private static final Logger LOG = LoggerFactory.getLogger(RedisTimeSeriesStore.class);

  /** Fragment of the server's reply for a missing key. */
  static final String MISSING_KEY = "does not exist";

  /** Fragment of the server's reply for an existing key. */
  static final String EXISTING_KEY = "already exists";

  /** The client. */
  private final UnifiedJedis jedis;

  /** Runs the appends. */
  private final ExecutorService writers;

  /**
   * Connects to the server named in the config.
   * @param config The non-null config.
   */
  public RedisTimeSeriesStore(final StoreConfig config) {
    this(new JedisPooled(new HostAndPort(config.getHost(), config.getPort()),
        DefaultJedisClientConfig.builder()
          .database(config.getDatabase())
          .password(config.password())
          .timeoutMillis(config.getTimeout())
          .build()), config.getWriteThreads());
    LOG.info("Connected Redis time series store to " + config.getHost() + ":"
        + config.getPort() + "/" + config.getDatabase());
  }

  /**
   * Ctor with a client, e.g. a cluster client or a mock.
   * @param jedis The non-null client.
   * @param write_threads The number of writer threads.
   */
  public RedisTimeSeriesStore(final UnifiedJedis jedis,
                              final int write_threads) {
    if (jedis == null) {
      throw new IllegalArgumentException("Jedis client cannot be null.");
    }
    if (write_threads < 1) {
      throw new IllegalArgumentException("Write threads must be at least 1.");
    }
    this.jedis = jedis;
    writers = Executors.newFixedThreadPool(write_threads,
        new ThreadFactoryBuilder()
          .setNameFormat("tstable-redis-writer-%d")
          .setDaemon(true)
          .build());
  }

  @Override
  public CreateStatus createSeries(final String key,
                                   final long retention,
                                   final LabelSet labels,
                                   final DuplicatePolicy policy) {
    final TSCreateParams params = TSCreateParams.createParams()
        .retention(retention)
        .labels(labels.asMap());
    if (policy != null) {
      params.duplicatePolicy(
          redis.clients.jedis.timeseries.DuplicatePolicy.valueOf(policy.name()));
    }
    try {
      jedis.tsCreate(key, params);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Created series " + key + " with labels " + labels);
      }
      return CreateStatus.CREATED;
    } catch (JedisDataException e) {
      if (e.getMessage() != null && e.getMessage().contains(EXISTING_KEY)) {
        return CreateStatus.ALREADY_EXISTS;
      }
      throw new StoreException("TS.CREATE", key, e);
    } catch (JedisException e) {
      throw new StoreException("TS.CREATE", key, e);
    }
  }

  @Override
  public Deferred<WriteStatus> append(final String key,
                                      final long timestamp,
                                      final double value) {
    final Deferred<WriteStatus> deferred = new Deferred<WriteStatus>();
    try {
      writers.execute(new Runnable() {
        @Override
        public void run() {
          WriteStatus status;
          try {
            jedis.tsAdd(key, timestamp, value);
            status = WriteStatus.OK;
          } catch (JedisDataException e) {
            status = WriteStatus.rejected(e.getMessage());
          } catch (JedisException e) {
            status = WriteStatus.error(e.getMessage(), e);
          } catch (RuntimeException e) {
            LOG.error("Unexpected failure appending to " + key, e);
            status = WriteStatus.error(e.getMessage(), e);
          }
          deferred.callback(status);
        }
      });
    } catch (RejectedExecutionException e) {
      return Deferred.fromResult(WriteStatus.error("Store is closed.", e));
    }
    return deferred;
  }

  @Override
  public List<DataPoint> range(final String key,
                               final long from,
                               final long to,
                               final int count,
                               final Direction direction) {
    if (from > to) {
      return Collections.emptyList();
    }
    final TSRangeParams params = TSRangeParams.rangeParams(from, to);
    if (count > 0) {
      params.count(count);
    }
    try {
      final List<TSElement> elements = direction == Direction.REVERSE ?
          jedis.tsRevRange(key, params) : jedis.tsRange(key, params);
      final List<DataPoint> points = Lists.newArrayListWithCapacity(
          elements == null ? 0 : elements.size());
      if (elements != null) {
        for (final TSElement element : elements) {
          points.add(new DataPoint(element.getTimestamp(), element.getValue()));
        }
      }
      return points;
    } catch (JedisException e) {
      throw new StoreException(direction == Direction.REVERSE ?
          "TS.REVRANGE" : "TS.RANGE", key, e);
    }
  }

  @Override
  public void createRule(final String source_key,
                         final String dest_key,
                         final AggregatorKind aggregator,
                         final long bucket) {
    try {
      jedis.tsCreateRule(source_key, dest_key, toAggregationType(aggregator),
          bucket);
    } catch (JedisException e) {
      throw new StoreException("TS.CREATERULE", source_key + " -> " + dest_key,
          e);
    }
  }

  @Override
  public boolean deleteKey(final String key) {
    try {
      return jedis.del(key) > 0;
    } catch (JedisException e) {
      throw new StoreException("DEL", key, e);
    }
  }

  @Override
  public long deleteRange(final String key, final long from, final long to) {
    try {
      return jedis.tsDel(key, from, to);
    } catch (JedisException e) {
      throw new StoreException("TS.DEL", key, e);
    }
  }

  @Override
  public List<String> listKeys(final Map<String, String> label_predicate) {
    if (label_predicate == null || label_predicate.isEmpty()) {
      throw new IllegalArgumentException("At least one label filter is required.");
    }
    final String[] filters = new String[label_predicate.size()];
    int i = 0;
    for (final Entry<String, String> entry : label_predicate.entrySet()) {
      filters[i++] = entry.getKey() + "=" + entry.getValue();
    }
    try {
      final List<String> keys = Lists.newArrayList(jedis.tsQueryIndex(filters));
      Collections.sort(keys);
      return keys;
    } catch (JedisException e) {
      throw new StoreException("TS.QUERYINDEX", String.join(" ", filters), e);
    }
  }

  @Override
  public SeriesInfo getInfo(final String key) {
    final TSInfo info;
    try {
      info = jedis.tsInfo(key);
    } catch (JedisDataException e) {
      if (e.getMessage() != null && e.getMessage().contains(MISSING_KEY)) {
        return null;
      }
      throw new StoreException("TS.INFO", key, e);
    } catch (JedisException e) {
      throw new StoreException("TS.INFO", key, e);
    }
    if (info == null) {
      return null;
    }
    final Map<String, Object> properties = info.getProperties();
    final SeriesInfo.Builder builder = SeriesInfo.newBuilder()
        .setKey(key)
        .setRetention(toLong(properties.get("retentionTime")))
        .setLabels(info.getLabels())
        .setTotalSamples(toLong(properties.get("totalSamples")))
        .setFirstTimestamp(toLong(properties.get("firstTimestamp")))
        .setLastTimestamp(toLong(properties.get("lastTimestamp")))
        .setProperties(properties);
    final Object source = properties.get("sourceKey");
    if (source != null) {
      builder.setSourceKey(source.toString());
    }
    final Object policy = properties.get("duplicatePolicy");
    if (policy != null) {
      try {
        builder.setDuplicatePolicy(
            DuplicatePolicy.valueOf(policy.toString().toUpperCase()));
      } catch (IllegalArgumentException e) {
        LOG.warn("Unknown duplicate policy '" + policy + "' for " + key);
      }
    }
    parseRules(key, properties.get("rules"), builder);
    return builder.build();
  }

  @Override
  public boolean exists(final String key) {
    try {
      return jedis.exists(key);
    } catch (JedisException e) {
      throw new StoreException("EXISTS", key, e);
    }
  }

  @Override
  public DataPoint getLast(final String key) {
    try {
      final TSElement element = jedis.tsGet(key);
      return element == null ? null :
        new DataPoint(element.getTimestamp(), element.getValue());
    } catch (JedisException e) {
      throw new StoreException("TS.GET", key, e);
    }
  }

  @Override
  public void close() {
    writers.shutdown();
    try {
      if (!writers.awaitTermination(5, TimeUnit.SECONDS)) {
        LOG.warn("Writer threads did not finish in time, abandoning them.");
        writers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      writers.shutdownNow();
    }
    jedis.close();
    LOG.info("Closed Redis time series store");
  }

  /**
   * @param aggregator The aggregator.
   * @return The Jedis aggregation of the same name.
   */
  static AggregationType toAggregationType(final AggregatorKind aggregator) {
    return AggregationType.valueOf(aggregator.name());
  }

  /**
   * Reads the rules out of the info reply. Depending on the protocol they
   * come as a map of destination to details or a list of
   * {@code [dest, bucket, aggregator, ...]} entries.
   */
  @SuppressWarnings("unchecked")
  static void parseRules(final String key,
                         final Object rules,
                         final SeriesInfo.Builder builder) {
    if (rules instanceof Map) {
      for (final Entry<Object, Object> entry :
          ((Map<Object, Object>) rules).entrySet()) {
        if (entry.getValue() instanceof List) {
          final List<Object> details = Lists.newArrayList();
          details.add(entry.getKey());
          details.addAll((List<Object>) entry.getValue());
          addRule(key, details, builder);
        }
      }
    } else if (rules instanceof List) {
      for (final Object rule : (List<Object>) rules) {
        if (rule instanceof List) {
          addRule(key, (List<Object>) rule, builder);
        }
      }
    }
  }

  private static void addRule(final String key,
                              final List<Object> details,
                              final SeriesInfo.Builder builder) {
    if (details.size() < 3) {
      return;
    }
    try {
      builder.addRule(new RuleInfo(toString(details.get(0)),
          toLong(details.get(1)),
          AggregatorKind.fromString(toString(details.get(2)))));
    } catch (IllegalArgumentException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Skipping unparsable rule " + details + " of " + key);
      }
    }
  }

  private static String toString(final Object value) {
    if (value instanceof byte[]) {
      return new String((byte[]) value, Const.UTF8_CHARSET);
    }
    return String.valueOf(value);
  }

  private static long toLong(final Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value == null) {
      return 0;
    }
    try {
      return Long.parseLong(toString(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: " + value, e);
    }
  }
}
