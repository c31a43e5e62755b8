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

import net.tstable.data.LabelSet;
import net.tstable.data.Row;
import net.tstable.query.ReturnAs;

/**
 * One result per identity, in identity order.
 *
 * @param <T> The shape of each group.
 * @since 1.0
 */
public class GroupedResult<T extends FormattedResult> implements FormattedResult {

  /** One identity and its result. */
  public static final class Group<T> {
    private final LabelSet identity;
    private final T result;

    public Group(final LabelSet identity, final T result) {
      this.identity = identity;
      this.result = result;
    }

    /** @return The identity labels. */
    public LabelSet identity() {
      return identity;
    }

    /** @return The identity's result. */
    public T result() {
      return result;
    }
  }

  private final ReturnAs shape;
  private final List<Group<T>> groups;

  public GroupedResult(final ReturnAs shape, final List<Group<T>> groups) {
    this.shape = shape;
    this.groups = ImmutableList.copyOf(groups);
  }

  /** @return The groups in identity order. */
  public List<Group<T>> getGroups() {
    return groups;
  }

  /**
   * @param identity An identity.
   * @return The identity's result or null if it isn't part of the result.
   */
  public T get(final LabelSet identity) {
    for (final Group<T> group : groups) {
      if (group.identity().equals(identity)) {
        return group.result();
      }
    }
    return null;
  }

  @Override
  public ReturnAs shape() {
    return shape;
  }

  @Override
  public int size() {
    return groups.isEmpty() ? 0 : groups.get(0).result().size();
  }

  @Override
  public List<Row> toRows() {
    final List<Row> rows = Lists.newArrayList();
    for (final Group<T> group : groups) {
      rows.addAll(group.result().toRows());
    }
    return rows;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    for (final Group<T> group : groups) {
      if (buf.length() > 1) {
        buf.append(", ");
      }
      buf.append(group.identity())
         .append("=")
         .append(group.result());
    }
    return buf.append("]").toString();
  }
}
