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

/**
 * The outcome of a call that returns no data: a success flag, a message
 * for the caller and a count whose meaning depends on the call, e.g. series
 * created or points written. Failures carry the exception that caused them.
 *
 * @since 1.0
 */
public class OperationResult {

  /** Whether or not the call succeeded. */
  private final boolean success;

  /** A message for the caller. */
  private final String message;

  /** The count of things done. */
  private final long count;

  /** The cause of a failure, may be null. */
  private final Throwable exception;

  /**
   * Protected ctor, use the static helpers.
   * @param success Whether or not the call succeeded.
   * @param message A message for the caller.
   * @param count The count of things done.
   * @param exception The cause of a failure, may be null.
   */
  protected OperationResult(final boolean success,
                            final String message,
                            final long count,
                            final Throwable exception) {
    this.success = success;
    this.message = message;
    this.count = count;
    this.exception = exception;
  }

  /**
   * @param message A message for the caller.
   * @param count The count of things done.
   * @return A successful result.
   */
  public static OperationResult ok(final String message, final long count) {
    return new OperationResult(true, message, count, null);
  }

  /**
   * @param message A description of the failure.
   * @param count The count of things done before the failure.
   * @param exception The cause, may be null.
   * @return A failed result.
   */
  public static OperationResult failed(final String message,
                                       final long count,
                                       final Throwable exception) {
    return new OperationResult(false, message, count, exception);
  }

  /**
   * @param message A description of the failure.
   * @param exception The cause, may be null.
   * @return A failed result with a zero count.
   */
  public static OperationResult failed(final String message,
                                       final Throwable exception) {
    return failed(message, 0, exception);
  }

  /** @return Whether or not the call succeeded. */
  public boolean isSuccess() {
    return success;
  }

  /** @return A message for the caller. */
  public String getMessage() {
    return message;
  }

  /** @return The count of things done. */
  public long getCount() {
    return count;
  }

  /** @return The cause of a failure, may be null. */
  public Throwable getException() {
    return exception;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("success=")
        .append(success)
        .append(", count=")
        .append(count)
        .append(", message=")
        .append(message)
        .toString();
  }
}
