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
package net.tstable.storage;

/**
 * How a series resolves a second sample at an existing timestamp.
 *
 * @since 1.0
 */
public enum DuplicatePolicy {
  /** Reject the second sample. */
  BLOCK,

  /** Keep the first sample. */
  FIRST,

  /** Keep the newest sample. The table layer creates every series with this
   * policy so updates overwrite in place. */
  LAST,

  /** Keep the smaller value. */
  MIN,

  /** Keep the larger value. */
  MAX,

  /** Add the values. */
  SUM
}
