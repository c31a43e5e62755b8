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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.tstable.data.DataPoint;
import net.tstable.data.LabelSet;
import net.tstable.exceptions.StoreException;
import net.tstable.storage.WriteStatus.WriteState;
import net.tstable.table.AggregatorKind;

public class TestMockTimeSeriesStore {
  private static final LabelSet RAW = LabelSet.of(ImmutableMap.of(
      "table", "t", "line", "v", "timeframe", "raw"));
  private static final LabelSet MIN = LabelSet.of(ImmutableMap.of(
      "table", "t", "line", "v", "timeframe", "1m"));
  private static final LabelSet HOUR = LabelSet.of(ImmutableMap.of(
      "table", "t", "line", "v", "timeframe", "1h"));

  private MockTimeSeriesStore store;

  @Before
  public void before() throws Exception {
    store = new MockTimeSeriesStore();
  }

  @Test
  public void createSeries() throws Exception {
    assertSame(CreateStatus.CREATED,
        store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST));
    assertSame(CreateStatus.ALREADY_EXISTS,
        store.createSeries("raw", 1000, RAW, DuplicatePolicy.LAST));
    assertTrue(store.exists("raw"));
    assertFalse(store.exists("nope"));
    assertEquals(1, store.size());

    final SeriesInfo info = store.getInfo("raw");
    assertEquals("raw", info.getKey());
    assertEquals(0, info.getRetention());
    assertEquals(RAW.asMap(), info.getLabels());
    assertSame(DuplicatePolicy.LAST, info.getDuplicatePolicy());
    assertNull(store.getInfo("nope"));
  }

  @Test
  public void appendAndRange() throws Exception {
    store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST);
    for (long ts = 5000; ts >= 1000; ts -= 1000) {
      assertSame(WriteStatus.OK, store.append("raw", ts, ts / 1000).join());
    }
    List<DataPoint> points = store.range("raw", 0, 10000, 0, Direction.FORWARD);
    assertEquals(5, points.size());
    assertEquals(new DataPoint(1000, 1), points.get(0));
    assertEquals(new DataPoint(5000, 5), points.get(4));

    points = store.range("raw", 2000, 4000, 0, Direction.FORWARD);
    assertEquals(3, points.size());

    points = store.range("raw", 0, 10000, 2, Direction.REVERSE);
    assertEquals(Lists.newArrayList(new DataPoint(5000, 5),
        new DataPoint(4000, 4)), points);

    points = store.range("raw", 0, 10000, 2, Direction.FORWARD);
    assertEquals(Lists.newArrayList(new DataPoint(1000, 1),
        new DataPoint(2000, 2)), points);

    assertTrue(store.range("raw", 10, 5, 0, Direction.FORWARD).isEmpty());
    assertEquals(new DataPoint(5000, 5), store.getLast("raw"));

    final SeriesInfo info = store.getInfo("raw");
    assertEquals(5, info.getTotalSamples());
    assertEquals(1000, info.getFirstTimestamp());
    assertEquals(5000, info.getLastTimestamp());
  }

  @Test
  public void duplicatePolicies() throws Exception {
    store.createSeries("last", 0, RAW, DuplicatePolicy.LAST);
    store.createSeries("block", 0, RAW, DuplicatePolicy.BLOCK);
    store.createSeries("sum", 0, RAW, DuplicatePolicy.SUM);
    store.createSeries("first", 0, RAW, DuplicatePolicy.FIRST);

    for (final String key : ImmutableList.of("last", "block", "sum", "first")) {
      store.append(key, 1000, 1).join();
    }
    assertSame(WriteState.OK, store.append("last", 1000, 3).join().state());
    assertSame(WriteState.REJECTED, store.append("block", 1000, 3).join().state());
    assertSame(WriteState.OK, store.append("sum", 1000, 3).join().state());
    assertSame(WriteState.OK, store.append("first", 1000, 3).join().state());

    assertEquals(3, store.getLast("last").value(), 0.0001);
    assertEquals(1, store.getLast("block").value(), 0.0001);
    assertEquals(4, store.getLast("sum").value(), 0.0001);
    assertEquals(1, store.getLast("first").value(), 0.0001);
  }

  @Test
  public void missingKey() throws Exception {
    assertSame(WriteState.ERROR, store.append("nope", 1000, 1).join().state());
    try {
      store.range("nope", 0, 1, 0, Direction.FORWARD);
      fail("Expected StoreException");
    } catch (StoreException e) {
      assertEquals("range", e.getOperation());
      assertEquals("nope", e.getKey());
    }
    try {
      store.getLast("nope");
      fail("Expected StoreException");
    } catch (StoreException e) { }
    assertFalse(store.deleteKey("nope"));
  }

  @Test
  public void retention() throws Exception {
    store.createSeries("raw", 10000, RAW, DuplicatePolicy.LAST);
    store.append("raw", 1000, 1).join();
    store.append("raw", 20000, 2).join();
    // expired by the second append
    assertEquals(1, store.range("raw", 0, 30000, 0, Direction.FORWARD).size());
    assertSame(WriteState.REJECTED, store.append("raw", 2000, 3).join().state());
  }

  @Test
  public void chainedRules() throws Exception {
    store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST);
    store.createSeries("1m", 0, MIN, DuplicatePolicy.LAST);
    store.createSeries("1h", 0, HOUR, DuplicatePolicy.LAST);
    store.createRule("raw", "1m", AggregatorKind.SUM, 60000);
    store.createRule("1m", "1h", AggregatorKind.MAX, 3600000);

    // three minutes of 10 second samples
    for (long ts = 0; ts < 180000; ts += 10000) {
      store.append("raw", ts, 1).join();
    }
    final List<DataPoint> minutes = store.range("1m", 0, Long.MAX_VALUE, 0,
        Direction.FORWARD);
    assertEquals(Lists.newArrayList(new DataPoint(0, 6),
        new DataPoint(60000, 6), new DataPoint(120000, 6)), minutes);
    assertEquals(Lists.newArrayList(new DataPoint(0, 6)),
        store.range("1h", 0, Long.MAX_VALUE, 0, Direction.FORWARD));

    // overwriting a raw point recomputes its buckets
    store.append("raw", 70000, 5).join();
    assertEquals(10, store.range("1m", 60000, 60000, 0, Direction.FORWARD)
        .get(0).value(), 0.0001);
    assertEquals(10, store.getLast("1h").value(), 0.0001);

    final SeriesInfo raw = store.getInfo("raw");
    assertEquals(1, raw.getRules().size());
    assertEquals(new RuleInfo("1m", 60000, AggregatorKind.SUM),
        raw.getRules().get(0));
    assertEquals("raw", store.getInfo("1m").getSourceKey());
    assertEquals("1m", store.getInfo("1h").getSourceKey());
  }

  @Test
  public void createRuleErrors() throws Exception {
    store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST);
    store.createSeries("raw2", 0, RAW, DuplicatePolicy.LAST);
    store.createSeries("1m", 0, MIN, DuplicatePolicy.LAST);
    store.createRule("raw", "1m", AggregatorKind.AVG, 60000);
    try {
      store.createRule("raw2", "1m", AggregatorKind.AVG, 60000);
      fail("Expected StoreException");
    } catch (StoreException e) { }
    try {
      store.createRule("raw", "raw", AggregatorKind.AVG, 60000);
      fail("Expected StoreException");
    } catch (StoreException e) { }
    try {
      store.createRule("raw", "nope", AggregatorKind.AVG, 60000);
      fail("Expected StoreException");
    } catch (StoreException e) { }
  }

  @Test
  public void deleteKeyDropsRules() throws Exception {
    store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST);
    store.createSeries("1m", 0, MIN, DuplicatePolicy.LAST);
    store.createRule("raw", "1m", AggregatorKind.AVG, 60000);
    assertTrue(store.deleteKey("1m"));
    assertTrue(store.getInfo("raw").getRules().isEmpty());
    assertSame(WriteState.OK, store.append("raw", 1000, 1).join().state());
  }

  @Test
  public void deleteRange() throws Exception {
    store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST);
    for (long ts = 1000; ts <= 5000; ts += 1000) {
      store.append("raw", ts, 1).join();
    }
    assertEquals(3, store.deleteRange("raw", 2000, 4000));
    assertEquals(2, store.range("raw", 0, 10000, 0, Direction.FORWARD).size());
  }

  @Test
  public void listKeys() throws Exception {
    store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST);
    store.createSeries("1m", 0, MIN, DuplicatePolicy.LAST);
    store.createSeries("1h", 0, HOUR, DuplicatePolicy.LAST);
    assertEquals(Lists.newArrayList("1h", "1m", "raw"),
        store.listKeys(ImmutableMap.of("table", "t")));
    assertEquals(Lists.newArrayList("1m"),
        store.listKeys(ImmutableMap.of("table", "t", "timeframe", "1m")));
    assertTrue(store.listKeys(ImmutableMap.of("table", "x")).isEmpty());
    try {
      store.listKeys(ImmutableMap.<String, String>of());
      fail("Expected StoreException");
    } catch (StoreException e) { }
  }

  @Test
  public void aggregate() throws Exception {
    final List<Double> values = Lists.newArrayList(2.0, 4.0, 4.0, 4.0, 5.0,
        5.0, 7.0, 9.0);
    assertEquals(5, MockTimeSeriesStore.aggregate(AggregatorKind.AVG, values), 0.0001);
    assertEquals(40, MockTimeSeriesStore.aggregate(AggregatorKind.SUM, values), 0.0001);
    assertEquals(2, MockTimeSeriesStore.aggregate(AggregatorKind.MIN, values), 0.0001);
    assertEquals(9, MockTimeSeriesStore.aggregate(AggregatorKind.MAX, values), 0.0001);
    assertEquals(7, MockTimeSeriesStore.aggregate(AggregatorKind.RANGE, values), 0.0001);
    assertEquals(8, MockTimeSeriesStore.aggregate(AggregatorKind.COUNT, values), 0.0001);
    assertEquals(2, MockTimeSeriesStore.aggregate(AggregatorKind.FIRST, values), 0.0001);
    assertEquals(9, MockTimeSeriesStore.aggregate(AggregatorKind.LAST, values), 0.0001);
    assertEquals(4, MockTimeSeriesStore.aggregate(AggregatorKind.VAR_P, values), 0.0001);
    assertEquals(2, MockTimeSeriesStore.aggregate(AggregatorKind.STD_P, values), 0.0001);
    assertEquals(32.0 / 7, MockTimeSeriesStore.aggregate(AggregatorKind.VAR_S, values), 0.0001);
    assertEquals(Math.sqrt(32.0 / 7),
        MockTimeSeriesStore.aggregate(AggregatorKind.STD_S, values), 0.0001);
  }

  @Test
  public void close() throws Exception {
    store.createSeries("raw", 0, RAW, DuplicatePolicy.LAST);
    store.close();
    assertSame(WriteState.ERROR, store.append("raw", 1000, 1).join().state());
    try {
      store.exists("raw");
      fail("Expected StoreException");
    } catch (StoreException e) { }
  }
}
