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
package net.tstable.data;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

public class TestRow {
  private static final List<String> LINES = ImmutableList.of("open", "close");
  private static final LabelSet AAPL = LabelSet.of(ImmutableMap.of("c2", "aapl"));
  private static final LabelSet MSFT = LabelSet.of(ImmutableMap.of("c2", "msft"));

  @Test
  public void ctor() throws Exception {
    final Row row = new Row(100, AAPL, LINES, new Double[] { 1.5, null });
    assertEquals(100, row.timestamp());
    assertEquals(2, row.size());
    assertEquals(1.5, row.value(0), 0.0001);
    assertEquals(1.5, row.value("open"), 0.0001);
    assertNull(row.value("close"));
    assertTrue(row.has(0));
    assertFalse(row.has(1));
    assertArrayEquals(new Double[] { 1.5, null }, row.values());

    try {
      row.value("volume");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new Row(100, AAPL, LINES, new Double[] { 1.5 });
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void order() throws Exception {
    final Row msft_100 = new Row(100, MSFT, LINES, new Double[] { 1.0, 1.0 });
    final Row aapl_100 = new Row(100, AAPL, LINES, new Double[] { 9.0, 9.0 });
    final Row aapl_50 = new Row(50, AAPL, LINES, new Double[] { 5.0, 5.0 });
    final Row absent = new Row(50, AAPL, LINES, new Double[] { null, 5.0 });
    final Row anonymous = new Row(50, null, LINES, new Double[] { 7.0, 7.0 });

    final List<Row> rows = Lists.newArrayList(msft_100, aapl_100, aapl_50,
        absent, anonymous);
    Collections.sort(rows, Row.ORDER);
    assertEquals(Lists.newArrayList(anonymous, absent, aapl_50, aapl_100,
        msft_100), rows);
  }

  @Test
  public void equality() throws Exception {
    final Row a = new Row(100, AAPL, LINES, new Double[] { 1.0, null });
    final Row b = new Row(100, AAPL, Lists.newArrayList("open", "close"),
        new Double[] { 1.0, null });
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertFalse(a.equals(new Row(100, MSFT, LINES, new Double[] { 1.0, null })));
  }
}
