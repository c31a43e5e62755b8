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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tstable.data.Row;
import net.tstable.query.ReturnAs;

/**
 * Rows in timestamp order.
 *
 * @since 1.0
 */
public class RowSequence implements FormattedResult {

  private final List<Row> rows;

  public RowSequence(final List<Row> rows) {
    this.rows = ImmutableList.copyOf(rows);
  }

  /** @return The rows. */
  public List<Row> getRows() {
    return rows;
  }

  @Override
  public ReturnAs shape() {
    return ReturnAs.ROWS;
  }

  @Override
  public int size() {
    return rows.size();
  }

  @Override
  public List<Row> toRows() {
    return rows;
  }

  @Override
  public String toString() {
    return rows.toString();
  }
}
