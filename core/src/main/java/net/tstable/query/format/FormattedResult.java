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

import net.tstable.data.Row;
import net.tstable.query.ReturnAs;

/**
 * Read results in one of the {@link ReturnAs} shapes.
 *
 * @since 1.0
 */
public interface FormattedResult {

  /** @return The shape. */
  public ReturnAs shape();

  /** @return The number of rows. Grouped shapes report the first group. */
  public int size();

  /** @return The rows in the shape's order, groups one after another. */
  public List<Row> toRows();

}
