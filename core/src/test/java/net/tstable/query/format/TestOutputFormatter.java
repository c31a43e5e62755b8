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
package net.tstable.query.format;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.tstable.data.LabelSet;
import net.tstable.data.Row;
import net.tstable.query.IdentityRows;
import net.tstable.query.ReturnAs;

public class TestOutputFormatter {
  private static final List<String> LINES = Lists.newArrayList("open", "close");
  private static final LabelSet ID_A = LabelSet.of(ImmutableMap.of(
      "table", "quotes", "c1", "nyse", "c2", "aapl", "timeframe", "raw"));
  private static final LabelSet ID_B = LabelSet.of(ImmutableMap.of(
      "table", "quotes", "c1", "nyse", "c2", "ibm", "timeframe", "raw"));

  private List<IdentityRows> groups;

  @Before
  public void before() throws Exception {
    groups = Lists.newArrayList(
        new IdentityRows(ID_A, Lists.newArrayList(
            row(100, ID_A, 1.0, 2.0),
            row(101, ID_A, 3.0, null))),
        new IdentityRows(ID_B, Lists.newArrayList(
            row(100, ID_B, 5.0, 6.0),
            row(102, ID_B, null, 8.0),
            row(103, ID_B, 9.0, 10.0))));
  }

  @Test
  public void rows() throws Exception {
    final FormattedResult result = OutputFormatter.format(LINES, groups, null);
    assertSame(ReturnAs.ROWS, result.shape());
    assertEquals(5, result.size());
    final List<Row> rows = ((RowSequence) result).getRows();
    assertEquals(ID_A, rows.get(0).identity());
    assertEquals(ID_B, rows.get(1).identity());
    assertEquals(101, rows.get(2).timestamp());
    assertEquals(103, rows.get(4).timestamp());
  }

  @Test
  public void columns() throws Exception {
    final ColumnarTable table = (ColumnarTable) OutputFormatter.format(LINES,
        groups, ReturnAs.COLUMNS);
    assertSame(ReturnAs.COLUMNS, table.shape());
    assertEquals(5, table.size());
    assertEquals(Lists.newArrayList(ColumnarTable.TIMESTAMP_COLUMN, "open",
        "close"), table.getColumnNames());
    assertEquals(Lists.newArrayList(100L, 100L, 101L, 102L, 103L),
        table.getTimestamps());
    assertEquals(Lists.newArrayList(1.0, 5.0, 3.0, null, 9.0),
        table.getColumn("open"));
    assertEquals(101L, table.getValue(2, 0));
    assertNull(table.getValue(2, 2));
    assertEquals(ID_B, table.getIdentities().get(1));
    try {
      table.getColumn("volume");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void lines() throws Exception {
    final LineMap map = (LineMap) OutputFormatter.format(LINES, groups,
        ReturnAs.LINES);
    assertSame(ReturnAs.LINES, map.shape());
    assertEquals(5, map.size());
    assertEquals(Lists.newArrayList("open", "close"),
        Lists.newArrayList(map.asMap().keySet()));
    assertEquals(Lists.newArrayList(2.0, 6.0, null, 8.0, 10.0),
        map.getLine("close"));
    assertNull(map.getLine("volume"));
  }

  @Test
  public void shapesHoldTheSameRows() throws Exception {
    final List<Row> expected = OutputFormatter.format(LINES, groups,
        ReturnAs.ROWS).toRows();
    assertEquals(expected, OutputFormatter.format(LINES, groups,
        ReturnAs.COLUMNS).toRows());
    assertEquals(expected, OutputFormatter.format(LINES, groups,
        ReturnAs.LINES).toRows());
  }

  @Test
  public void grouped() throws Exception {
    for (final ReturnAs shape : new ReturnAs[] { ReturnAs.GROUPED_ROWS,
        ReturnAs.GROUPED_COLUMNS, ReturnAs.GROUPED_LINES }) {
      final FormattedResult result = OutputFormatter.format(LINES, groups,
          shape);
      assertSame(shape, result.shape());
      assertTrue(shape.isGrouped());
      // the size of the first identity
      assertEquals(2, result.size());
      assertEquals(5, result.toRows().size());
      final GroupedResult<?> grouped = (GroupedResult<?>) result;
      assertEquals(2, grouped.getGroups().size());
      assertEquals(ID_A, grouped.getGroups().get(0).identity());
      assertEquals(3, grouped.get(ID_B).size());
      assertNull(grouped.get(LabelSet.of(ImmutableMap.of("c2", "msft"))));
    }
    final GroupedResult<?> columns = (GroupedResult<?>) OutputFormatter.format(
        LINES, groups, ReturnAs.GROUPED_COLUMNS);
    assertEquals(Lists.newArrayList(100L, 102L, 103L),
        ((ColumnarTable) columns.get(ID_B)).getTimestamps());
  }

  @Test
  public void raw() throws Exception {
    final RawResult result = (RawResult) OutputFormatter.format(LINES, groups,
        ReturnAs.RAW);
    assertSame(ReturnAs.RAW, result.shape());
    assertEquals(2, result.size());
    assertEquals(groups, result.getGroups());
    assertEquals(5, result.toRows().size());
  }

  @Test
  public void empty() throws Exception {
    final List<IdentityRows> none = Collections.emptyList();
    for (final ReturnAs shape : ReturnAs.values()) {
      final FormattedResult result = OutputFormatter.format(LINES, none, shape);
      assertEquals(0, result.size());
      assertTrue(result.toRows().isEmpty());
    }
  }

  @Test
  public void singleIdentityKeepsOrder() throws Exception {
    final List<Row> rows = OutputFormatter.merge(groups.subList(1, 2));
    assertEquals(3, rows.size());
    assertEquals(100, rows.get(0).timestamp());
  }

  private static Row row(final long timestamp,
                         final LabelSet identity,
                         final Double open,
                         final Double close) {
    return new Row(timestamp, identity, LINES, new Double[] { open, close });
  }
}
