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
package net.tstable.core;

import net.tstable.data.LabelSet;

/**
 * The newest point across a set of series, with the series it came from.
 * A failed lookup carries the error instead.
 *
 * @since 1.0
 */
public final class LastRecord {

  private static final LastRecord NOT_FOUND =
      new LastRecord(true, false, null, null, 0, Double.NaN, null, null);

  private final boolean success;
  private final boolean found;
  private final String key;
  private final LabelSet labels;
  private final long timestamp;
  private final double value;
  private final String error;
  private final Throwable exception;

  private LastRecord(final boolean success,
                     final boolean found,
                     final String key,
                     final LabelSet labels,
                     final long timestamp,
                     final double value,
                     final String error,
                     final Throwable exception) {
    this.success = success;
    this.found = found;
    this.key = key;
    this.labels = labels;
    this.timestamp = timestamp;
    this.value = value;
    this.error = error;
    this.exception = exception;
  }

  /**
   * @param key The series key.
   * @param labels The series labels.
   * @param timestamp Timestamp in seconds.
   * @param value The value.
   * @return A found record.
   */
  public static LastRecord of(final String key,
                              final LabelSet labels,
                              final long timestamp,
                              final double value) {
    return new LastRecord(true, true, key, labels, timestamp, value, null,
        null);
  }

  /** @return The record for series without points. */
  public static LastRecord notFound() {
    return NOT_FOUND;
  }

  /**
   * @param error The error message.
   * @param exception The cause, may be null.
   * @return A failed lookup.
   */
  public static LastRecord failed(final String error,
                                  final Throwable exception) {
    return new LastRecord(false, false, null, null, 0, Double.NaN, error,
        exception);
  }

  /** @return Whether the lookup succeeded. */
  public boolean isSuccess() {
    return success;
  }

  public boolean isFound() {
    return found;
  }

  public String getKey() {
    return key;
  }

  public LabelSet getLabels() {
    return labels;
  }

  /** @return Timestamp in seconds. */
  public long getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  /** @return The error message, null on success. */
  public String getError() {
    return error;
  }

  public Throwable getException() {
    return exception;
  }

  @Override
  public String toString() {
    if (!success) {
      return "error=" + error;
    }
    return found ? key + "@" + timestamp + "=" + value : "not found";
  }
}
