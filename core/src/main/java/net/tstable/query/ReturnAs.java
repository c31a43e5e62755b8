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

/**
 * The shapes a read can be returned in.
 *
 * @since 1.0
 */
public enum ReturnAs {
  /** Rows of every identity merged in timestamp order. */
  ROWS,

  /** A table with a timestamp column and one column per line. */
  COLUMNS,

  /** Line name to values, aligned to a shared timestamp sequence. */
  LINES,

  /** {@link #ROWS} per identity. */
  GROUPED_ROWS,

  /** {@link #COLUMNS} per identity. */
  GROUPED_COLUMNS,

  /** {@link #LINES} per identity. */
  GROUPED_LINES,

  /** The per identity rows as the engine built them. */
  RAW;

  /** @return Whether the shape keeps identities apart. */
  public boolean isGrouped() {
    return this == GROUPED_ROWS || this == GROUPED_COLUMNS
        || this == GROUPED_LINES || this == RAW;
  }
}
