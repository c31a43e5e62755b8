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
package net.tstable.exceptions;

/**
 * An error reported by the backing time series store. The original exception
 * is kept as the cause, untouched, and the operation and key are attached for
 * context. These are never retried by the table layer.
 *
 * @since 1.0
 */
public class StoreException extends RuntimeException {
  private static final long serialVersionUID = -4420954127312618412L;

  /** The store operation that failed, e.g. "create_series". */
  private final String operation;

  /** The key the operation was applied to. May be null for index calls. */
  private final String key;

  /**
   * Ctor for errors detected by the store implementation itself.
   * @param operation The non-null operation name.
   * @param key The key, may be null.
   * @param msg A descriptive message.
   */
  public StoreException(final String operation,
                        final String key,
                        final String msg) {
    super(format(operation, key, msg));
    this.operation = operation;
    this.key = key;
  }

  /**
   * Ctor wrapping an exception thrown by the store client.
   * @param operation The non-null operation name.
   * @param key The key, may be null.
   * @param cause The store's exception.
   */
  public StoreException(final String operation,
                        final String key,
                        final Throwable cause) {
    super(format(operation, key, cause.getMessage()), cause);
    this.operation = operation;
    this.key = key;
  }

  /** @return The store operation that failed. */
  public String getOperation() {
    return operation;
  }

  /** @return The key the operation was applied to, may be null. */
  public String getKey() {
    return key;
  }

  private static String format(final String operation,
                               final String key,
                               final String msg) {
    return "Store operation '" + operation + "' failed"
        + (key == null ? "" : " for key '" + key + "'")
        + ": " + msg;
  }
}
