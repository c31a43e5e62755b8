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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import net.tstable.data.Row;
import net.tstable.query.IdentityRows;
import net.tstable.query.ReturnAs;

/**
 * Shapes the per identity rows of a read into the requested
 * {@link ReturnAs}. Ungrouped shapes merge the rows of every identity with
 * {@link Row#ORDER}.
 *
 * @since 1.0
 */
public final class OutputFormatter {

  private OutputFormatter() {
  }

  /**
   * @param lines The table's line names.
   * @param groups The rows per identity, in identity order.
   * @param return_as The shape, null for {@link ReturnAs#ROWS}.
   * @return The formatted result.
   */
  public static FormattedResult format(final List<String> lines,
                                       final List<IdentityRows> groups,
                                       final ReturnAs return_as) {
    final ReturnAs shape = return_as == null ? ReturnAs.ROWS : return_as;
    switch (shape) {
    case ROWS:
      return new RowSequence(merge(groups));
    case COLUMNS:
      return new ColumnarTable(lines, merge(groups));
    case LINES:
      return new LineMap(lines, merge(groups));
    case GROUPED_ROWS:
      final List<GroupedResult.Group<RowSequence>> row_groups = Lists.newArrayList();
      for (final IdentityRows group : groups) {
        row_groups.add(new GroupedResult.Group<RowSequence>(group.identity(),
            new RowSequence(group.rows())));
      }
      return new GroupedResult<RowSequence>(shape, row_groups);
    case GROUPED_COLUMNS:
      final List<GroupedResult.Group<ColumnarTable>> column_groups = Lists.newArrayList();
      for (final IdentityRows group : groups) {
        column_groups.add(new GroupedResult.Group<ColumnarTable>(
            group.identity(), new ColumnarTable(lines, group.rows())));
      }
      return new GroupedResult<ColumnarTable>(shape, column_groups);
    case GROUPED_LINES:
      final List<GroupedResult.Group<LineMap>> line_groups = Lists.newArrayList();
      for (final IdentityRows group : groups) {
        line_groups.add(new GroupedResult.Group<LineMap>(group.identity(),
            new LineMap(lines, group.rows())));
      }
      return new GroupedResult<LineMap>(shape, line_groups);
    case RAW:
      return new RawResult(groups);
    default:
      throw new IllegalArgumentException("Unhandled shape: " + shape);
    }
  }

  /**
   * @param groups Rows per identity.
   * @return Every row in {@link Row#ORDER}.
   */
  public static List<Row> merge(final List<IdentityRows> groups) {
    if (groups.size() == 1) {
      return groups.get(0).rows();
    }
    final List<Row> rows = Lists.newArrayList();
    for (final IdentityRows group : groups) {
      rows.addAll(group.rows());
    }
    Collections.sort(rows, Row.ORDER);
    return rows;
  }
}
