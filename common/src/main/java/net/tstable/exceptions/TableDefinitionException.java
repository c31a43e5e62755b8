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
 * A malformed table definition or a reference to a line or timeframe that
 * the definition does not declare. Raised before the store is touched.
 *
 * @since 1.0
 */
public class TableDefinitionException extends IllegalArgumentException {
  private static final long serialVersionUID = 2219170838735190211L;

  /**
   * Ctor setting the message.
   * @param msg A non-null and non-empty message.
   */
  public TableDefinitionException(final String msg) {
    super(msg);
  }

  /**
   * Ctor setting the message and cause.
   * @param msg A non-null and non-empty message.
   * @param cause A non-null cause.
   */
  public TableDefinitionException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
