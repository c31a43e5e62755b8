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
import com.google.common.collect.Lists;

import net.tstable.data.Row;
import net.tstable.query.IdentityRows;
import net.tstable.query.ReturnAs;

/**
 * The per identity rows as the query engine produced them.
 *
 * @since 1.0
 */
public class RawResult implements FormattedResult {

  private final List<IdentityRows> groups;

  public RawResult(final List<IdentityRows> groups) {
    this.groups = ImmutableList.copyOf(groups);
  }

  /** @return The groups in identity order. */
  public List<IdentityRows> getGroups() {
    return groups;
  }

  @Override
  public ReturnAs shape() {
    return ReturnAs.RAW;
  }

  @Override
  public int size() {
    return groups.isEmpty() ? 0 : groups.get(0).rows().size();
  }

  @Override
  public List<Row> toRows() {
    final List<Row> rows = Lists.newArrayList();
    for (final IdentityRows group : groups) {
      rows.addAll(group.rows());
    }
    return rows;
  }

  @Override
  public String toString() {
    return groups.toString();
  }
}
