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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tstable.common.Const;
import net.tstable.core.TableManager;
import net.tstable.data.DataPoint;
import net.tstable.data.LabelSet;
import net.tstable.exceptions.StoreException;
import net.tstable.storage.CreateStatus;
import net.tstable.storage.Direction;
import net.tstable.storage.DuplicatePolicy;
import net.tstable.storage.RuleInfo;
import net.tstable.storage.SeriesInfo;
import net.tstable.storage.WriteStatus;
import net.tstable.storage.WriteStatus.WriteState;
import net.tstable.table.AggregatorKind;
import net.tstable.table.TableDefinition;
import net.tstable.table.TimeframeSpec;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.timeseries.AggregationType;
import redis.clients.jedis.timeseries.TSCreateParams;
import redis.clients.jedis.timeseries.TSElement;
import redis.clients.jedis.timeseries.TSInfo;
import redis.clients.jedis.timeseries.TSRangeParams;

public class TestRedisTimeSeriesStore {
  private static final LabelSet LABELS = LabelSet.of(ImmutableMap.of(
      "table", "quotes", "c1", "nyse", "c2", "ibm", "timeframe", "raw",
      "line", "open"));
  private static final String KEY = "quotes:nyse:ibm:raw:open";

  private UnifiedJedis jedis;
  private RedisTimeSeriesStore store;

  @Before
  public void before() throws Exception {
    jedis = mock(UnifiedJedis.class);
    store = new RedisTimeSeriesStore(jedis, 2);
  }

  @After
  public void after() throws Exception {
    store.close();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new RedisTimeSeriesStore(null, 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new RedisTimeSeriesStore(jedis, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void createSeries() throws Exception {
    when(jedis.tsCreate(eq(KEY), any(TSCreateParams.class))).thenReturn("OK");
    assertSame(CreateStatus.CREATED, store.createSeries(KEY, 86400000,
        LABELS, DuplicatePolicy.LAST));
    verify(jedis).tsCreate(eq(KEY), any(TSCreateParams.class));
  }

  @Test
  public void createSeriesExists() throws Exception {
    when(jedis.tsCreate(eq(KEY), any(TSCreateParams.class))).thenThrow(
        new JedisDataException("ERR TSDB: key already exists"));
    assertSame(CreateStatus.ALREADY_EXISTS, store.createSeries(KEY, 0, LABELS,
        DuplicatePolicy.LAST));
  }

  @Test
  public void createSeriesFailures() throws Exception {
    when(jedis.tsCreate(eq(KEY), any(TSCreateParams.class)))
        .thenThrow(new JedisDataException("ERR TSDB: invalid retention"))
        .thenThrow(new JedisConnectionException("Connection refused"));
    try {
      store.createSeries(KEY, -1, LABELS, DuplicatePolicy.LAST);
      fail("Expected StoreException");
    } catch (StoreException e) {
      assertEquals("TS.CREATE", e.getOperation());
      assertEquals(KEY, e.getKey());
    }
    try {
      store.createSeries(KEY, 0, LABELS, null);
      fail("Expected StoreException");
    } catch (StoreException e) {
      assertTrue(e.getCause() instanceof JedisConnectionException);
    }
  }

  @Test
  public void append() throws Exception {
    when(jedis.tsAdd(KEY, 1000L, 1.5)).thenReturn(1000L);
    when(jedis.tsAdd(KEY, 2000L, 2.5)).thenThrow(new JedisDataException(
        "ERR TSDB: Error at upsert, update is not supported when "
        + "DUPLICATE_POLICY is set to BLOCK mode"));
    when(jedis.tsAdd(KEY, 3000L, 3.5)).thenThrow(
        new JedisConnectionException("Connection reset"));

    assertSame(WriteStatus.OK, store.append(KEY, 1000, 1.5).join(5000));
    WriteStatus status = store.append(KEY, 2000, 2.5).join(5000);
    assertSame(WriteState.REJECTED, status.state());
    assertTrue(status.message().contains("BLOCK"));
    status = store.append(KEY, 3000, 3.5).join(5000);
    assertSame(WriteState.ERROR, status.state());
    assertTrue(status.exception() instanceof JedisConnectionException);
  }

  @Test
  public void appendAfterClose() throws Exception {
    store.close();
    final WriteStatus status = store.append(KEY, 1000, 1).join(5000);
    assertSame(WriteState.ERROR, status.state());
    verify(jedis, never()).tsAdd(anyString(), anyLong(), anyDouble());
    verify(jedis).close();
  }

  @Test
  public void range() throws Exception {
    when(jedis.tsRange(eq(KEY), any(TSRangeParams.class))).thenReturn(
        Lists.newArrayList(new TSElement(1000, 1), new TSElement(2000, 2)));
    when(jedis.tsRevRange(eq(KEY), any(TSRangeParams.class))).thenReturn(
        Lists.newArrayList(new TSElement(2000, 2)));

    assertEquals(Lists.newArrayList(new DataPoint(1000, 1),
        new DataPoint(2000, 2)), store.range(KEY, 0, 5000, 0,
            Direction.FORWARD));
    assertEquals(Lists.newArrayList(new DataPoint(2000, 2)),
        store.range(KEY, 0, 5000, 1, Direction.REVERSE));
    assertTrue(store.range(KEY, 10, 5, 0, Direction.FORWARD).isEmpty());
  }

  @Test
  public void rangeFailure() throws Exception {
    when(jedis.tsRevRange(eq(KEY), any(TSRangeParams.class))).thenThrow(
        new JedisDataException("ERR TSDB: the key does not exist"));
    try {
      store.range(KEY, 0, 5000, 1, Direction.REVERSE);
      fail("Expected StoreException");
    } catch (StoreException e) {
      assertEquals("TS.REVRANGE", e.getOperation());
    }
  }

  @Test
  public void createRule() throws Exception {
    store.createRule("src", "dest", AggregatorKind.STD_P, 60000);
    verify(jedis).tsCreateRule("src", "dest", AggregationType.STD_P, 60000L);

    when(jedis.tsCreateRule("src", "dest", AggregationType.SUM, 60000L))
        .thenThrow(new JedisDataException("ERR TSDB: the destination key "
            + "already has a src rule"));
    try {
      store.createRule("src", "dest", AggregatorKind.SUM, 60000);
      fail("Expected StoreException");
    } catch (StoreException e) {
      assertEquals("TS.CREATERULE", e.getOperation());
    }
  }

  @Test
  public void deletes() throws Exception {
    when(jedis.del(KEY)).thenReturn(1L);
    when(jedis.tsDel(KEY, 0L, 5000L)).thenReturn(3L);
    assertTrue(store.deleteKey(KEY));
    assertFalse(store.deleteKey("nope"));
    assertEquals(3, store.deleteRange(KEY, 0, 5000));
  }

  @Test
  public void listKeys() throws Exception {
    when(jedis.tsQueryIndex("table=quotes", "c1=nyse")).thenReturn(
        Lists.newArrayList("quotes:nyse:ibm:raw:open",
            "quotes:nyse:aapl:raw:open"));
    assertEquals(Lists.newArrayList("quotes:nyse:aapl:raw:open",
        "quotes:nyse:ibm:raw:open"),
        store.listKeys(ImmutableMap.of("table", "quotes", "c1", "nyse")));
    try {
      store.listKeys(ImmutableMap.<String, String>of());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void getInfo() throws Exception {
    final Map<String, Object> properties = Maps.newHashMap();
    properties.put("retentionTime", 86400000L);
    properties.put("totalSamples", 3L);
    properties.put("firstTimestamp", 1000L);
    properties.put("lastTimestamp", 3000L);
    properties.put("sourceKey", "quotes:nyse:ibm:tick:open");
    properties.put("duplicatePolicy", "last");
    properties.put("rules", ImmutableMap.of("quotes:nyse:ibm:1m:open",
        Lists.<Object>newArrayList(60000L, "FIRST")));
    final TSInfo info = mock(TSInfo.class);
    when(info.getProperties()).thenReturn(properties);
    when(info.getLabels()).thenReturn(LABELS.asMap());
    when(jedis.tsInfo(KEY)).thenReturn(info);

    final SeriesInfo series = store.getInfo(KEY);
    assertEquals(KEY, series.getKey());
    assertEquals(86400000L, series.getRetention());
    assertEquals(3, series.getTotalSamples());
    assertEquals(1000, series.getFirstTimestamp());
    assertEquals(3000, series.getLastTimestamp());
    assertEquals("quotes:nyse:ibm:tick:open", series.getSourceKey());
    assertSame(DuplicatePolicy.LAST, series.getDuplicatePolicy());
    assertEquals(LABELS.asMap(), series.getLabels());
    assertEquals(Lists.newArrayList(new RuleInfo("quotes:nyse:ibm:1m:open",
        60000, AggregatorKind.FIRST)), series.getRules());
  }

  @Test
  public void getInfoMissing() throws Exception {
    when(jedis.tsInfo(KEY)).thenThrow(new JedisDataException(
        "ERR TSDB: the key does not exist"));
    assertNull(store.getInfo(KEY));

    when(jedis.tsInfo("other")).thenThrow(new JedisConnectionException(
        "Connection refused"));
    try {
      store.getInfo("other");
      fail("Expected StoreException");
    } catch (StoreException e) { }
  }

  @Test
  public void parseRulesListForm() throws Exception {
    final SeriesInfo.Builder builder = SeriesInfo.newBuilder().setKey(KEY);
    final List<Object> rules = Lists.newArrayList();
    rules.add(Lists.<Object>newArrayList("dest".getBytes(Const.UTF8_CHARSET),
        "3600000".getBytes(Const.UTF8_CHARSET), "var.s"));
    rules.add(Lists.<Object>newArrayList("bogus", 1L, "median"));
    rules.add(Lists.<Object>newArrayList("short"));
    RedisTimeSeriesStore.parseRules(KEY, rules, builder);
    assertEquals(Lists.newArrayList(new RuleInfo("dest", 3600000,
        AggregatorKind.VAR_S)), builder.build().getRules());

    final SeriesInfo.Builder empty = SeriesInfo.newBuilder().setKey(KEY);
    RedisTimeSeriesStore.parseRules(KEY, null, empty);
    assertTrue(empty.build().getRules().isEmpty());
  }

  @Test
  public void existsAndGetLast() throws Exception {
    when(jedis.exists(KEY)).thenReturn(true);
    when(jedis.tsGet(KEY)).thenReturn(new TSElement(3000, 4.5));
    assertTrue(store.exists(KEY));
    assertFalse(store.exists("nope"));
    assertEquals(new DataPoint(3000, 4.5), store.getLast(KEY));
    assertNull(store.getLast("nope"));
  }

  @Test
  public void toAggregationType() throws Exception {
    for (final AggregatorKind kind : AggregatorKind.values()) {
      assertEquals(kind.name(),
          RedisTimeSeriesStore.toAggregationType(kind).name());
    }
  }

  @Test
  public void tableManager() throws Exception {
    final TableDefinition table = TableDefinition.newBuilder()
        .setName("quotes")
        .addLine("open")
        .addTimeframe("raw", TimeframeSpec.newBuilder())
        .build();
    when(jedis.exists(KEY)).thenReturn(true);
    final TableManager manager = new TableManager(table, store);
    assertEquals(1, manager.mapExists("NYSE", "IBM").getCount());
    assertEquals(0, manager.mapExists("nyse", "aapl").getCount());
    verify(jedis).exists("quotes:nyse:aapl:raw:open");
  }

  @Test
  public void close() throws Exception {
    store.close();
    verify(jedis).close();
  }
}
