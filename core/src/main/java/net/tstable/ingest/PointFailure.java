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
package net.tstable.ingest;

import net.tstable.storage.WriteStatus;

/**
 * A point that was not stored, with the series it was meant for and the
 * status the store returned.
 *
 * @since 1.0
 */
public final class PointFailure {

  /** The row index in the written batch. */
  private final int row;

  /** The series key. */
  private final String key;

  /** The line, may be null when a whole row failed. */
  private final String line;

  /** Timestamp in seconds. */
  private final long timestamp;

  /** The status. */
  private final WriteStatus status;

  public PointFailure(final int row,
                      final String key,
                      final String line,
                      final long timestamp,
                      final WriteStatus status) {
    this.row = row;
    this.key = key;
    this.line = line;
    this.timestamp = timestamp;
    this.status = status;
  }

  /** @return The row index in the written batch. */
  public int row() {
    return row;
  }

  /** @return The series key. */
  public String key() {
    return key;
  }

  /** @return The line name. */
  public String line() {
    return line;
  }

  /** @return Timestamp in seconds. */
  public long timestamp() {
    return timestamp;
  }

  /** @return The status the store returned. */
  public WriteStatus status() {
    return status;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("row=")
        .append(row)
        .append(", key=")
        .append(key)
        .append(", timestamp=")
        .append(timestamp)
        .append(", status=")
        .append(status)
        .toString();
  }
}
