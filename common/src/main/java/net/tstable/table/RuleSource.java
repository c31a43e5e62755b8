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
package net.tstable.table;

/**
 * Where the rule feeding a compacted timeframe reads from.
 *
 * @since 1.0
 */
public enum RuleSource {
  /** From the compacted timeframe with the next smaller bucket, or the base
   * timeframe for the smallest bucket. */
  CHAIN,

  /** Always from the base timeframe. RedisTimeSeries refuses to compact a
   * series that is itself a compaction, so tables on that backend use this. */
  BASE
}
