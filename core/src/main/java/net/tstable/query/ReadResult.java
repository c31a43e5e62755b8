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

import java.util.Collections;
import java.util.List;

import net.tstable.data.Row;
import net.tstable.query.format.FormattedResult;

/**
 * The result of a read: the formatted data on success or the error on
 * failure. Reads that look for a specific row also report whether it was
 * found, and last-n reads whether every identity had enough rows.
 *
 * @since 1.0
 */
public class ReadResult {

  private final boolean success;
  private final FormattedResult data;
  private final boolean found;
  private final boolean complete;
  private final String error;
  private final Throwable exception;

  protected ReadResult(final boolean success,
                       final FormattedResult data,
                       final boolean found,
                       final boolean complete,
                       final String error,
                       final Throwable exception) {
    this.success = success;
    this.data = data;
    this.found = found;
    this.complete = complete;
    this.error = error;
    this.exception = exception;
  }

  /**
   * @param data The data.
   * @return A successful result.
   */
  public static ReadResult ok(final FormattedResult data) {
    return new ReadResult(true, data, !data.toRows().isEmpty(), true, null,
        null);
  }

  /**
   * @param data The data.
   * @param complete Whether every identity yielded the requested rows.
   * @return A successful result.
   */
  public static ReadResult ok(final FormattedResult data,
                              final boolean complete) {
    return new ReadResult(true, data, !data.toRows().isEmpty(), complete,
        null, null);
  }

  /**
   * @param data The possibly empty data.
   * @return A successful result for a row that doesn't exist.
   */
  public static ReadResult notFound(final FormattedResult data) {
    return new ReadResult(true, data, false, false, null, null);
  }

  /**
   * @param error The error message.
   * @param exception The cause, may be null.
   * @return A failed result.
   */
  public static ReadResult failed(final String error,
                                  final Throwable exception) {
    return new ReadResult(false, null, false, false, error, exception);
  }

  /** @return Whether the read succeeded. */
  public boolean isSuccess() {
    return success;
  }

  /** @return The formatted data, null on failure. */
  public FormattedResult getData() {
    return data;
  }

  /** @return Whether any identity had rows. */
  public boolean isFound() {
    return found;
  }

  /** @return For last-n reads, whether every identity yielded n rows. */
  public boolean isComplete() {
    return complete;
  }

  /** @return The error message, null on success. */
  public String getError() {
    return error;
  }

  /** @return The cause of a failure, may be null. */
  public Throwable getException() {
    return exception;
  }

  /** @return The rows of the data, empty on failure. */
  public List<Row> rows() {
    return data == null ? Collections.<Row>emptyList() : data.toRows();
  }

  @Override
  public String toString() {
    return success ? "found=" + found + ", data=" + data : "error=" + error;
  }
}
