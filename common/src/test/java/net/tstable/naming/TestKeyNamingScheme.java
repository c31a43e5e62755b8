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
package net.tstable.naming;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.tstable.data.SeriesKey;
import net.tstable.exceptions.TableDefinitionException;
import net.tstable.table.TableDefinition;
import net.tstable.table.TimeframeSpec;

public class TestKeyNamingScheme {

  private TableDefinition table;

  @Before
  public void before() throws Exception {
    table = TableDefinition.newBuilder()
        .setName("quotes")
        .addLine("open")
        .addLine("close")
        .addTimeframe("raw", TimeframeSpec.newBuilder().setRetention(86400))
        .addTimeframe("1m", TimeframeSpec.newBuilder().setBucket(60L))
        .build();
  }

  @Test
  public void derive() throws Exception {
    final SeriesKey key = KeyNamingScheme.derive(table, "NASDAQ", " AAPL ",
        "1M", "Close", ImmutableMap.of("sector", "tech"));
    assertEquals("quotes:nasdaq:aapl:1m:close", key.key());
    assertEquals("close", key.line());
    assertEquals(ImmutableMap.builder()
        .put("table", "quotes")
        .put("c1", "nasdaq")
        .put("c2", "aapl")
        .put("timeframe", "1m")
        .put("line", "close")
        .put("sector", "tech")
        .build(), key.labels().asMap());

    assertEquals("quotes:nasdaq:aapl:raw:open",
        KeyNamingScheme.derive(table, "nasdaq", "aapl", "raw", "open", null)
          .key());
  }

  @Test
  public void injective() throws Exception {
    assertNotEquals(
        KeyNamingScheme.keyName(table, "a", "bc", "raw", "open"),
        KeyNamingScheme.keyName(table, "ab", "c", "raw", "open"));
    assertNotEquals(
        KeyNamingScheme.keyName(table, "a", "b", "raw", "open"),
        KeyNamingScheme.keyName(table, "b", "a", "raw", "open"));
  }

  @Test
  public void invalid() throws Exception {
    try {
      KeyNamingScheme.keyName(table, "a:b", "c", "raw", "open");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      KeyNamingScheme.keyName(table, "a", " ", "raw", "open");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      KeyNamingScheme.keyName(table, "a", "b", "raw", "volume");
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    try {
      KeyNamingScheme.keyName(table, "a", "b", "1d", "open");
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    try {
      KeyNamingScheme.derive(table, "a", "b", "raw", "open",
          ImmutableMap.of("line", "high"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      KeyNamingScheme.derive(table, "a", "b", "raw", "open",
          ImmutableMap.of("sector", ""));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parse() throws Exception {
    final Map<String, String> parsed =
        KeyNamingScheme.parse("quotes:nasdaq:aapl:1m:close");
    assertEquals("quotes", parsed.get("table"));
    assertEquals("nasdaq", parsed.get("c1"));
    assertEquals("aapl", parsed.get("c2"));
    assertEquals("1m", parsed.get("timeframe"));
    assertEquals("close", parsed.get("line"));

    assertNull(KeyNamingScheme.parse(null));
    assertNull(KeyNamingScheme.parse("quotes:nasdaq:aapl:1m"));
    assertNull(KeyNamingScheme.parse("quotes:nasdaq::1m:close"));
    assertNull(KeyNamingScheme.parse("quotes:nasdaq:aapl:1m:close:x"));
  }
}
