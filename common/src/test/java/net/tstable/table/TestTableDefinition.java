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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.tstable.exceptions.TableDefinitionException;
import net.tstable.utils.JSON;

public class TestTableDefinition {

  private TableDefinition.Builder builder;

  @Before
  public void before() throws Exception {
    builder = TableDefinition.newBuilder()
        .setName("Quotes")
        .setLines(Lists.newArrayList("Open", "high", "low", "close"))
        .addTimeframe("raw", TimeframeSpec.newBuilder().setRetention(86400))
        .addTimeframe("1h", TimeframeSpec.newBuilder()
            .setRetention(2592000)
            .setBucket(3600L))
        .addTimeframe("1m", TimeframeSpec.newBuilder()
            .setRetention(604800)
            .setBucket(60L));
  }

  @Test
  public void build() throws Exception {
    final TableDefinition table = builder.build();
    assertEquals("quotes", table.getName());
    assertEquals(Lists.newArrayList("open", "high", "low", "close"),
        table.getLines());
    assertEquals(Lists.newArrayList("raw", "1h", "1m"),
        table.getTimeframeNames());
    assertEquals("raw", table.getBaseTimeframe());
    assertEquals("raw", table.getDefaultWriteTimeframe());
    assertEquals(Lists.newArrayList("1m", "1h"), table.getRuledTimeframes());
    assertSame(RuleSource.CHAIN, table.getRuleSource());
    assertSame(AggregatorSelector.NONE, table.getAggregatorSelector());
    assertNull(table.getAggregators());
    assertEquals(0, table.lineIndex("OPEN"));
    assertEquals(3, table.lineIndex("close"));
    assertTrue(table.hasLine("High"));
    assertFalse(table.hasLine("volume"));
    assertFalse(table.hasLine(null));
    assertEquals(3600L, (long) table.getTimeframe("1H").getBucket());
  }

  @Test
  public void ruleSource() throws Exception {
    TableDefinition table = builder.build();
    assertEquals("raw", table.getRuleSourceTimeframe("1m"));
    assertEquals("1m", table.getRuleSourceTimeframe("1h"));

    table = builder.setRuleSource(RuleSource.BASE).build();
    assertEquals("raw", table.getRuleSourceTimeframe("1m"));
    assertEquals("raw", table.getRuleSourceTimeframe("1h"));

    try {
      table.getRuleSourceTimeframe("raw");
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
  }

  @Test
  public void noRulesTiers() throws Exception {
    final TableDefinition table = TableDefinition.newBuilder()
        .setName("daily")
        .addLine("close")
        .addTimeframe("d1", TimeframeSpec.newBuilder().setNoRules(true))
        .addTimeframe("w1", TimeframeSpec.newBuilder().setNoRules(true))
        .build();
    assertNull(table.getBaseTimeframe());
    assertEquals("d1", table.getDefaultWriteTimeframe());
    assertTrue(table.getRuledTimeframes().isEmpty());

    // a base alongside no-rules tiers stays the default target
    final TableDefinition mixed = TableDefinition.newBuilder()
        .setName("mixed")
        .addLine("close")
        .addTimeframe("d1", TimeframeSpec.newBuilder().setNoRules(true))
        .addTimeframe("raw", TimeframeSpec.newBuilder())
        .build();
    assertEquals("raw", mixed.getBaseTimeframe());
    assertEquals("raw", mixed.getDefaultWriteTimeframe());
  }

  @Test
  public void invalid() throws Exception {
    try {
      builder.setName(null).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    try {
      builder.setName("quo:tes").build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
    builder.setName("quotes");

    try {
      builder.setLines(Lists.<String>newArrayList()).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    try {
      builder.setLines(Lists.newArrayList("open", "OPEN")).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    try {
      builder.setLines(Lists.newArrayList("open", "")).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
    builder.setLines(Lists.newArrayList("open", "close"));

    // two bases
    try {
      builder.addTimeframe("raw2", TimeframeSpec.newBuilder()).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    // shared bucket
    try {
      before();
      builder.addTimeframe("60s", TimeframeSpec.newBuilder().setBucket(60L))
          .build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    // compacted without a base
    try {
      TableDefinition.newBuilder()
          .setName("t")
          .addLine("a")
          .addTimeframe("1m", TimeframeSpec.newBuilder().setBucket(60L))
          .build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    // no timeframes
    try {
      TableDefinition.newBuilder()
          .setName("t")
          .addLine("a")
          .build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    // aggregator for an unknown line
    try {
      before();
      builder.setAggregators(ImmutableMap.of("volume", "sum")).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
  }

  @Test
  public void unknownNames() throws Exception {
    final TableDefinition table = builder.build();
    try {
      table.lineIndex("volume");
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
    try {
      table.getTimeframe("1d");
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
    try {
      table.getTimeframe(null);
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
  }

  @Test
  public void withAndWithoutLine() throws Exception {
    final TableDefinition table = builder.build();
    final TableDefinition widened = table.withLine("Volume");
    assertEquals(Lists.newArrayList("open", "high", "low", "close", "volume"),
        widened.getLines());
    assertEquals(4, table.getLines().size());
    assertEquals(table.getTimeframes(), widened.getTimeframes());

    final TableDefinition narrowed = widened.withoutLine("high");
    assertEquals(Lists.newArrayList("open", "low", "close", "volume"),
        narrowed.getLines());

    try {
      table.withLine("open");
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
    try {
      table.withoutLine("volume");
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
  }

  @Test
  public void aggregators() throws Exception {
    final TableDefinition table = builder
        .setAggregators(ImmutableMap.of("Open", "first", "close", "last"))
        .build();
    final AggregatorSelector selector = table.getAggregatorSelector();
    assertEquals("first", selector.select("nasdaq", "aapl", "open", "1m",
        table.getTimeframe("1m"), "src", "dst"));
    assertNull(selector.select("nasdaq", "aapl", "high", "1m",
        table.getTimeframe("1m"), "src", "dst"));
    assertEquals(ImmutableMap.of("open", "first", "close", "last"),
        table.getAggregators());

    // a custom selector wins over the map
    final AggregatorSelector custom = new AggregatorSelector() {
      @Override
      public String select(final String c1, final String c2, final String line,
          final String timeframe_name, final TimeframeSpec timeframe_spec,
          final String source_key, final String dest_key) {
        return "sum";
      }
    };
    assertSame(custom, builder.setAggregatorSelector(custom).build()
        .getAggregatorSelector());
  }

  @Test
  public void json() throws Exception {
    final String json = "{\"name\":\"Quotes\",\"lines\":[\"open\",\"close\"],"
        + "\"timeframes\":{\"raw\":{\"retention\":86400},"
        + "\"1m\":{\"retention\":604800,\"bucket\":60},"
        + "\"d1\":{\"retention\":0,\"noRules\":true}},"
        + "\"aggregators\":{\"open\":\"first\",\"close\":\"last\"},"
        + "\"ruleSource\":\"BASE\",\"unknown\":42}";
    final TableDefinition table = JSON.parseToObject(json, TableDefinition.class);
    assertEquals("quotes", table.getName());
    assertEquals(Lists.newArrayList("raw", "1m", "d1"),
        table.getTimeframeNames());
    assertTrue(table.getTimeframe("d1").isNoRules());
    assertSame(RuleSource.BASE, table.getRuleSource());
    assertEquals("last", table.getAggregators().get("close"));

    final TableDefinition copy = JSON.parseToObject(table.toString(),
        TableDefinition.class);
    assertEquals(table.getLines(), copy.getLines());
    assertEquals(table.getTimeframes(), copy.getTimeframes());
    assertEquals(table.getAggregators(), copy.getAggregators());
    assertSame(table.getRuleSource(), copy.getRuleSource());

    try {
      JSON.parseToObject("{\"name\":\"t\",\"lines\":[\"a\"],\"timeframes\":"
          + "{\"raw\":{},\"raw2\":{}}}", TableDefinition.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void loadYaml() throws Exception {
    final Path path = Paths.get(getClass().getResource("/quotes.yaml").toURI());
    final TableDefinition table = TableDefinition.load(path);
    assertEquals("quotes", table.getName());
    assertEquals(Lists.newArrayList("open", "high", "low", "close"),
        table.getLines());
    assertEquals(Lists.newArrayList("1m", "1h"), table.getRuledTimeframes());
    assertEquals(60000, table.getTimeframe("1m").getBucketMillis());
    assertEquals("max", table.getAggregatorSelector().select("a", "b", "high",
        "1h", table.getTimeframe("1h"), "s", "d"));

    try {
      TableDefinition.load(Paths.get("no/such/table.yaml"));
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
  }
}
