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
package net.tstable.query;

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tstable.data.LabelSet;
import net.tstable.data.Row;

/**
 * The rows read for one identity, ascending by timestamp.
 *
 * @since 1.0
 */
public final class IdentityRows {

  private final LabelSet identity;
  private final List<Row> rows;

  /**
   * Default ctor.
   * @param identity The identity labels, without the line.
   * @param rows The rows in ascending order.
   */
  public IdentityRows(final LabelSet identity, final List<Row> rows) {
    this.identity = identity;
    this.rows = ImmutableList.copyOf(rows);
  }

  /** @return The identity labels. */
  public LabelSet identity() {
    return identity;
  }

  /** @return The rows in ascending order. */
  public List<Row> rows() {
    return rows;
  }

  @Override
  public String toString() {
    return identity + "=" + rows;
  }
}
